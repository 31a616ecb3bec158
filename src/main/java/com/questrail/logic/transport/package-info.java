/**
 * Transport Ports
 * =============================================================================
 *
 * These interfaces define the framework-agnostic boundary between a concrete
 * socket implementation (Netty epoll, a test double) and the RPC runtime.
 *
 * <h2>What crosses the boundary</h2>
 * Everything above the transport sees only:
 * <ul>
 *   <li>complete frames as {@code byte[]}</li>
 *   <li>a {@link com.questrail.logic.transport.FrameChannel} for writing responses</li>
 *   <li>connection and listener close notifications</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>perform I/O and length delimiting only</li>
 *   <li>not decode envelopes or dispatch calls</li>
 *   <li>not retry binds or writes</li>
 * </ul>
 */
package com.questrail.logic.transport;
