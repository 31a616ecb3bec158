package com.questrail.logic.protocol.rpc.model;

/**
 * Per-request failure classes. All of them are reported to the caller as a
 * failed {@link CallResponse}. None of them closes the connection.
 */
public enum RpcErrorKind
{
    /** No module registered under the requested id. */
    UNKNOWN_MODULE,

    /** The module exists but has no such method. */
    UNKNOWN_METHOD,

    /** The envelope or its params did not fit the expected shape. */
    VALIDATION_ERROR,

    /** The handler threw or its stage failed. */
    HANDLER_ERROR,

    /** The handler returned something its response schema does not describe. */
    TYPE_MISMATCH
}
