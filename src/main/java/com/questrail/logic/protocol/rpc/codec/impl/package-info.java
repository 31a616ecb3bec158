/**
 * MessagePack implementation of the envelope codec.
 *
 * <p>Built on msgpack-core's packer and value API. Nothing outside this package
 * sees msgpack types.</p>
 */
package com.questrail.logic.protocol.rpc.codec.impl;
