package com.questrail.logic.api;

import com.questrail.logic.schema.RpcParameters;
import com.questrail.logic.schema.RpcResponse;

import java.util.concurrent.CompletionStage;

/**
 * Non-blocking API handler.
 *
 * <p>Invoked directly on the I/O thread that read the request. The method
 * must return promptly; long work belongs in the returned stage.</p>
 *
 * @param <P> parameter record
 * @param <R> response record
 */
@FunctionalInterface
public interface AsyncApiHandler<P extends RpcParameters, R extends RpcResponse>
{
    CompletionStage<R> handle(P params);
}
