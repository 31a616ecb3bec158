package com.questrail.logic.api;

import com.questrail.logic.schema.RpcParameters;
import com.questrail.logic.schema.RpcResponse;

/**
 * Blocking API handler.
 *
 * <p>Invocations are moved onto the server's worker pool, so an implementation
 * may block freely. Handlers are invoked concurrently and must guard their own
 * shared state.</p>
 *
 * @param <P> parameter record
 * @param <R> response record
 */
@FunctionalInterface
public interface ApiHandler<P extends RpcParameters, R extends RpcResponse>
{
    R handle(P params) throws Exception;
}
