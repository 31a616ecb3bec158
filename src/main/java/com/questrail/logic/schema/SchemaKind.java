package com.questrail.logic.schema;

/**
 * Root kind of a {@link Schema}.
 *
 * <p>Handler parameter types must be {@link #PARAMETERS} schemas and handler
 * results {@link #RESPONSE} schemas. {@link #OBJECT} describes records nested
 * inside either.</p>
 */
public enum SchemaKind
{
    PARAMETERS,
    RESPONSE,
    OBJECT
}
