package com.questrail.logic.protocol.rpc.internal.dispatch;

import com.questrail.logic.observability.CallCompletedEvent;
import com.questrail.logic.observability.RpcObservabilitySink;
import com.questrail.logic.protocol.rpc.model.CallRequest;
import com.questrail.logic.protocol.rpc.model.CallResponse;
import com.questrail.logic.protocol.rpc.model.RpcErrorKind;
import com.questrail.logic.registry.ApiMeta;
import com.questrail.logic.registry.ModuleRegistry;
import com.questrail.logic.registry.Resolution;
import com.questrail.logic.schema.RpcParameters;
import com.questrail.logic.schema.RpcResponse;
import com.questrail.logic.schema.SchemaValidationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Dispatcher
 * =============================================================================
 * Turns a decoded {@link CallRequest} into a {@link CallResponse}.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>resolve {@code (module_id, method)} in the {@link ModuleRegistry}</li>
 *   <li>decode {@code params} against the method's parameter schema</li>
 *   <li>invoke the handler: async handlers on the calling thread, blocking
 *       handlers on the worker executor</li>
 *   <li>check the result against the response schema and encode it</li>
 * </ol>
 *
 * <h2>Failure containment</h2>
 * Every failure along the pipeline becomes a failed {@link CallResponse}
 * tagged with an {@link RpcErrorKind}. {@link #dispatch(CallRequest)} never
 * throws and its future never completes exceptionally; one bad request cannot
 * tear down its connection or the server.
 *
 * <h2>Threading</h2>
 * The dispatcher holds no mutable state of its own and may be called from any
 * number of threads. It provides no per-method exclusion: handlers invoked
 * concurrently must guard their own shared state.
 */
public final class Dispatcher
{
    private final ModuleRegistry registry;
    private final Executor blockingExecutor;
    private final RpcObservabilitySink sink;
    private final InFlightTracker inFlight = new InFlightTracker();

    public Dispatcher(ModuleRegistry registry, Executor blockingExecutor, RpcObservabilitySink sink)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.blockingExecutor = Objects.requireNonNull(blockingExecutor, "blockingExecutor");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Outstanding-call counter shared with the connection handlers.
     */
    public InFlightTracker inFlight()
    {
        return inFlight;
    }

    /**
     * Dispatch one call.
     *
     * @return a future that always completes normally with the response
     */
    public CompletableFuture<CallResponse> dispatch(CallRequest request)
    {
        Objects.requireNonNull(request, "request");
        final long startNanos = System.nanoTime();

        CompletableFuture<Outcome> outcome;
        try {
            outcome = route(request);
        } catch (RuntimeException e) {
            outcome = CompletableFuture.completedFuture(handlerError(request, e));
        }

        return outcome.handle((o, error) -> {
            Outcome done = error != null ? handlerError(request, unwrap(error)) : o;
            report(request.moduleId(), request.method(), done, startNanos);
            return done.response();
        });
    }

    /**
     * Build a failure response for an envelope that never reached resolution.
     */
    public CallResponse reject(String unifiedMsgOrigin, RpcErrorKind kind, String message)
    {
        String umo = unifiedMsgOrigin == null ? "" : unifiedMsgOrigin;
        Outcome outcome = new Outcome(CallResponse.failure(umo, message), kind, null);
        report("?", "?", outcome, System.nanoTime());
        return outcome.response();
    }

    // -------------------------------------------------------------------------
    // Pipeline
    // -------------------------------------------------------------------------

    private CompletableFuture<Outcome> route(CallRequest request)
    {
        Resolution resolution = registry.resolve(request.moduleId(), request.method());

        if (resolution instanceof Resolution.ModuleNotFound) {
            return CompletableFuture.completedFuture(failure(request, RpcErrorKind.UNKNOWN_MODULE,
                    "Unknown module: " + request.moduleId()));
        }
        if (resolution instanceof Resolution.MethodNotFound) {
            return CompletableFuture.completedFuture(failure(request, RpcErrorKind.UNKNOWN_METHOD,
                    "Unknown method: " + qualified(request)));
        }

        Resolution.Found found = (Resolution.Found) resolution;
        return invoke(found.meta(), request);
    }

    private <P extends RpcParameters, R extends RpcResponse> CompletableFuture<Outcome> invoke(ApiMeta<P, R> meta,
                                                                                               CallRequest request)
    {
        final P params;
        try {
            params = meta.parameterSchema().decode(request.params());
        } catch (SchemaValidationException e) {
            return CompletableFuture.completedFuture(failure(request, RpcErrorKind.VALIDATION_ERROR,
                    "Invalid parameters for " + qualified(request) + ": " + e.getMessage()));
        }

        CompletableFuture<R> call = meta.isAsync() ? callAsync(meta, params) : callBlocking(meta, params);

        return call.handle((result, error) -> error != null
                ? handlerError(request, unwrap(error))
                : complete(meta, request, result));
    }

    private static <P extends RpcParameters, R extends RpcResponse> CompletableFuture<R> callAsync(ApiMeta<P, R> meta,
                                                                                                   P params)
    {
        try {
            CompletionStage<R> stage = meta.invokeAsync(params);
            if (stage == null) {
                return CompletableFuture.failedFuture(
                        new NullPointerException(meta.methodName() + " returned no completion stage"));
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <P extends RpcParameters, R extends RpcResponse> CompletableFuture<R> callBlocking(ApiMeta<P, R> meta,
                                                                                               P params)
    {
        CompletableFuture<R> future = new CompletableFuture<>();
        try {
            blockingExecutor.execute(() -> {
                try {
                    future.complete(meta.invokeBlocking(params));
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private static <R extends RpcResponse> Outcome complete(ApiMeta<?, R> meta, CallRequest request, R result)
    {
        String expected = meta.responseSchema().type().getSimpleName();

        if (result == null) {
            return failure(request, RpcErrorKind.TYPE_MISMATCH, "Return type mismatch for " + qualified(request)
                    + ": expected " + expected + " but handler returned null");
        }
        if (!meta.responseSchema().accepts(result)) {
            return failure(request, RpcErrorKind.TYPE_MISMATCH, "Return type mismatch for " + qualified(request)
                    + ": expected " + expected + " but got " + result.getClass().getSimpleName());
        }

        final Map<String, Object> data;
        try {
            data = meta.responseSchema().encode(result);
        } catch (SchemaValidationException e) {
            return failure(request, RpcErrorKind.TYPE_MISMATCH, "Return type mismatch for " + qualified(request)
                    + ": " + e.getMessage());
        }
        return new Outcome(CallResponse.success(request.unifiedMsgOrigin(), data), null, null);
    }

    // -------------------------------------------------------------------------
    // Outcomes
    // -------------------------------------------------------------------------

    private static Outcome failure(CallRequest request, RpcErrorKind kind, String message)
    {
        return new Outcome(CallResponse.failure(request.unifiedMsgOrigin(), message), kind, null);
    }

    private static Outcome handlerError(CallRequest request, Throwable error)
    {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new Outcome(CallResponse.failure(request.unifiedMsgOrigin(), message), RpcErrorKind.HANDLER_ERROR, error);
    }

    private void report(String moduleId, String method, Outcome outcome, long startNanos)
    {
        CallResponse response = outcome.response();
        sink.onCallCompleted(new CallCompletedEvent(
                Instant.now(),
                moduleId,
                method,
                response.unifiedMsgOrigin(),
                response.ok(),
                outcome.kind(),
                response.errorMessage(),
                Duration.ofNanos(System.nanoTime() - startNanos),
                outcome.failure()));
    }

    private static Throwable unwrap(Throwable t)
    {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String qualified(CallRequest request)
    {
        return request.moduleId() + "." + request.method();
    }

    private record Outcome(CallResponse response, RpcErrorKind kind, Throwable failure) {}
}
