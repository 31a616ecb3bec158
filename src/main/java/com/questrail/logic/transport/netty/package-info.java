/**
 * Netty epoll adapter for the transport ports.
 *
 * <p>Only {@link com.questrail.logic.transport.netty.NettyUnixServerEndpoint}
 * is public; the decoder, channel and handler stay package-private so no
 * Netty type reaches the runtime.</p>
 */
package com.questrail.logic.transport.netty;
