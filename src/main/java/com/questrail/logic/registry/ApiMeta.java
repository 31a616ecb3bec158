package com.questrail.logic.registry;

import com.questrail.logic.api.ApiHandler;
import com.questrail.logic.api.AsyncApiHandler;
import com.questrail.logic.schema.RpcParameters;
import com.questrail.logic.schema.RpcResponse;
import com.questrail.logic.schema.Schema;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Metadata bound to one API handler.
 *
 * <p>Both schemas are built when the metadata is created, so an unsupported
 * parameter or response type fails at registration rather than on the first
 * call. Exactly one of the blocking or async handlers is present, selected by
 * the factory used.</p>
 *
 * @param <P> parameter record
 * @param <R> response record
 */
public final class ApiMeta<P extends RpcParameters, R extends RpcResponse>
{
    private final String methodName;
    private final Schema<P> parameterSchema;
    private final Schema<R> responseSchema;
    private final ApiHandler<P, R> blockingHandler;
    private final AsyncApiHandler<P, R> asyncHandler;

    private ApiMeta(String methodName,
                    Class<P> parameterType,
                    Class<R> responseType,
                    ApiHandler<P, R> blockingHandler,
                    AsyncApiHandler<P, R> asyncHandler)
    {
        Objects.requireNonNull(methodName, "methodName");
        if (methodName.isBlank()) {
            throw new IllegalArgumentException("methodName must not be blank");
        }
        this.methodName = methodName;
        this.parameterSchema = Schema.forParameters(Objects.requireNonNull(parameterType, "parameterType"));
        this.responseSchema = Schema.forResponse(Objects.requireNonNull(responseType, "responseType"));
        this.blockingHandler = blockingHandler;
        this.asyncHandler = asyncHandler;
    }

    public static <P extends RpcParameters, R extends RpcResponse> ApiMeta<P, R> blocking(String methodName,
                                                                                          Class<P> parameterType,
                                                                                          Class<R> responseType,
                                                                                          ApiHandler<P, R> handler)
    {
        Objects.requireNonNull(handler, "handler");
        return new ApiMeta<>(methodName, parameterType, responseType, handler, null);
    }

    public static <P extends RpcParameters, R extends RpcResponse> ApiMeta<P, R> async(String methodName,
                                                                                       Class<P> parameterType,
                                                                                       Class<R> responseType,
                                                                                       AsyncApiHandler<P, R> handler)
    {
        Objects.requireNonNull(handler, "handler");
        return new ApiMeta<>(methodName, parameterType, responseType, null, handler);
    }

    public String methodName()
    {
        return methodName;
    }

    public Schema<P> parameterSchema()
    {
        return parameterSchema;
    }

    public Schema<R> responseSchema()
    {
        return responseSchema;
    }

    public boolean isAsync()
    {
        return asyncHandler != null;
    }

    /**
     * Call the blocking handler on the current thread.
     *
     * @throws IllegalStateException if this API was registered as async
     */
    public R invokeBlocking(P params) throws Exception
    {
        if (blockingHandler == null) {
            throw new IllegalStateException(methodName + " is async");
        }
        return blockingHandler.handle(params);
    }

    /**
     * Call the async handler on the current thread and return its stage.
     *
     * @throws IllegalStateException if this API was registered as blocking
     */
    public CompletionStage<R> invokeAsync(P params)
    {
        if (asyncHandler == null) {
            throw new IllegalStateException(methodName + " is blocking");
        }
        return asyncHandler.handle(params);
    }

    MethodDescriptor describe()
    {
        return new MethodDescriptor(
                methodName,
                isAsync(),
                parameterSchema.type().getSimpleName(),
                parameterSchema.fields(),
                responseSchema.type().getSimpleName(),
                responseSchema.fields());
    }

    @Override
    public String toString()
    {
        return "ApiMeta[" + methodName + ", " + parameterSchema.type().getSimpleName()
                + " -> " + responseSchema.type().getSimpleName() + (isAsync() ? ", async" : "") + "]";
    }
}
