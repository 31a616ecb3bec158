package com.questrail.logic.protocol.rpc.internal.dispatch;

import com.questrail.logic.api.RpcModule;
import com.questrail.logic.observability.CallCompletedEvent;
import com.questrail.logic.observability.RecordingObservabilitySink;
import com.questrail.logic.protocol.rpc.model.CallRequest;
import com.questrail.logic.protocol.rpc.model.CallResponse;
import com.questrail.logic.protocol.rpc.model.RpcErrorKind;
import com.questrail.logic.registry.ApiMeta;
import com.questrail.logic.registry.ModuleRegistry;
import com.questrail.logic.schema.RpcResponse;
import com.questrail.logic.testmodule.TestModuleProvider;
import com.questrail.logic.testmodule.TestParameters;
import com.questrail.logic.testmodule.TestResponse;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class DispatcherTest
{
    record OtherResponse(String text) implements RpcResponse {}

    private ExecutorService workers;
    private RecordingObservabilitySink sink;
    private ModuleRegistry registry;
    private Dispatcher dispatcher;

    @BeforeEach
    void setUp()
    {
        workers = Executors.newFixedThreadPool(4);
        sink = new RecordingObservabilitySink();
        registry = new ModuleRegistry();
        registry.registerModule(new TestModuleProvider().create());
        dispatcher = new Dispatcher(registry, workers, sink);
    }

    @AfterEach
    void tearDown()
    {
        workers.shutdownNow();
    }

    private static CallRequest call(String module, String method, Map<String, Object> params)
    {
        return new CallRequest(module, method, "origin", params);
    }

    // ---------------------------------------------------------------------
    // Success
    // ---------------------------------------------------------------------

    @Test
    void asyncHandlerResultIsEncoded()
    {
        CallResponse response = dispatcher.dispatch(call("test_module", "test_function", Map.of("value", 5L))).join();

        assertTrue(response.ok());
        assertEquals("origin", response.unifiedMsgOrigin());
        assertEquals(Map.of("result", 10L), response.data());
        assertEquals("", response.errorMessage());

        CallCompletedEvent event = sink.eventsOfType(CallCompletedEvent.class).get(0);
        assertTrue(event.ok());
        assertNull(event.errorKind());
        assertEquals("test_module", event.moduleId());
        assertEquals("test_function", event.method());
    }

    @Test
    void blockingHandlerRunsOnWorkerExecutor()
    {
        String[] threadName = new String[1];
        RpcModule module = new RpcModule("blocking").api("who", TestParameters.class, TestResponse.class, p -> {
            threadName[0] = Thread.currentThread().getName();
            return new TestResponse(p.value());
        });
        registry.registerModule(module);

        CallResponse response = dispatcher.dispatch(call("blocking", "who", Map.of("value", 1L))).join();

        assertTrue(response.ok());
        assertNotEquals(Thread.currentThread().getName(), threadName[0]);
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    @Test
    void unknownModule()
    {
        CallResponse response = dispatcher.dispatch(call("missing", "test_function", Map.of())).join();

        assertFalse(response.ok());
        assertNull(response.data());
        assertEquals("Unknown module: missing", response.errorMessage());
        assertEquals(RpcErrorKind.UNKNOWN_MODULE, sink.eventsOfType(CallCompletedEvent.class).get(0).errorKind());
    }

    @Test
    void unknownMethod()
    {
        CallResponse response = dispatcher.dispatch(call("test_module", "nope", Map.of())).join();

        assertFalse(response.ok());
        assertEquals("Unknown method: test_module.nope", response.errorMessage());
        assertEquals(RpcErrorKind.UNKNOWN_METHOD, sink.eventsOfType(CallCompletedEvent.class).get(0).errorKind());
    }

    @Test
    void invalidParameters()
    {
        CallResponse response = dispatcher.dispatch(
                call("test_module", "test_function", Map.of("value", "not a number"))).join();

        assertFalse(response.ok());
        assertTrue(response.errorMessage().startsWith("Invalid parameters for test_module.test_function: "),
                response.errorMessage());
        assertTrue(response.errorMessage().contains("value"));
        assertEquals(RpcErrorKind.VALIDATION_ERROR, sink.eventsOfType(CallCompletedEvent.class).get(0).errorKind());
    }

    @Test
    void handlerExceptionMessageIsReturned()
    {
        CallResponse response = dispatcher.dispatch(call("test_module", "test_function2", Map.of("value", 1L))).join();

        assertFalse(response.ok());
        assertEquals(TestModuleProvider.TEST_ERROR, response.errorMessage());

        CallCompletedEvent event = sink.eventsOfType(CallCompletedEvent.class).get(0);
        assertEquals(RpcErrorKind.HANDLER_ERROR, event.errorKind());
        assertInstanceOf(IllegalArgumentException.class, event.failure());
    }

    @Test
    void handlerExceptionWithoutMessageFallsBackToClassName()
    {
        registry.registerModule(new RpcModule("npe").api("f", TestParameters.class, TestResponse.class, p -> {
            throw new NullPointerException();
        }));

        CallResponse response = dispatcher.dispatch(call("npe", "f", Map.of("value", 1L))).join();

        assertEquals("NullPointerException", response.errorMessage());
    }

    @Test
    void asyncFailureIsUnwrapped()
    {
        registry.registerModule(new RpcModule("async").asyncApi("f", TestParameters.class, TestResponse.class,
                p -> CompletableFuture.<TestResponse>supplyAsync(() -> {
                    throw new IllegalStateException("async boom");
                })));

        CallResponse response = dispatcher.dispatch(call("async", "f", Map.of("value", 1L))).join();

        assertEquals("async boom", response.errorMessage());
        assertEquals(RpcErrorKind.HANDLER_ERROR, sink.eventsOfType(CallCompletedEvent.class).get(0).errorKind());
    }

    @Test
    void asyncHandlerThrowingSynchronouslyIsContained()
    {
        registry.registerModule(new RpcModule("async").asyncApi("f", TestParameters.class, TestResponse.class, p -> {
            throw new IllegalStateException("thrown before returning a stage");
        }));

        CallResponse response = dispatcher.dispatch(call("async", "f", Map.of("value", 1L))).join();

        assertFalse(response.ok());
        assertEquals("thrown before returning a stage", response.errorMessage());
    }

    @Test
    void nullResultIsTypeMismatch()
    {
        registry.registerModule(new RpcModule("null").api("f", TestParameters.class, TestResponse.class, p -> null));

        CallResponse response = dispatcher.dispatch(call("null", "f", Map.of("value", 1L))).join();

        assertFalse(response.ok());
        assertTrue(response.errorMessage().startsWith("Return type mismatch for null.f"), response.errorMessage());
        assertEquals(RpcErrorKind.TYPE_MISMATCH, sink.eventsOfType(CallCompletedEvent.class).get(0).errorKind());
    }

    @Test
    @SuppressWarnings({ "unchecked", "rawtypes" })
    void wrongResultClassIsTypeMismatch()
    {
        ApiMeta meta = ApiMeta.blocking("f", TestParameters.class, TestResponse.class,
                (com.questrail.logic.api.ApiHandler) p -> new OtherResponse("wrong"));
        RpcModule module = new RpcModule("liar");
        module.register(meta);
        registry.registerModule(module);

        CallResponse response = dispatcher.dispatch(call("liar", "f", Map.of("value", 1L))).join();

        assertFalse(response.ok());
        assertEquals("Return type mismatch for liar.f: expected TestResponse but got OtherResponse",
                response.errorMessage());
    }

    @Test
    void rejectedExecutionBecomesHandlerError()
    {
        RpcModule module = new RpcModule("blocking").api("f", TestParameters.class, TestResponse.class,
                p -> new TestResponse(1));
        registry.registerModule(module);
        Dispatcher rejecting = new Dispatcher(registry, r -> {
            throw new RejectedExecutionException("pool is shut down");
        }, sink);

        CallResponse response = rejecting.dispatch(call("blocking", "f", Map.of("value", 1L))).join();

        assertFalse(response.ok());
        assertEquals("pool is shut down", response.errorMessage());
    }

    @Test
    void rejectReportsWithoutResolving()
    {
        CallResponse response = dispatcher.reject(null, RpcErrorKind.VALIDATION_ERROR, "Malformed request: x");

        assertFalse(response.ok());
        assertEquals("", response.unifiedMsgOrigin());
        assertEquals("Malformed request: x", response.errorMessage());
        assertEquals(RpcErrorKind.VALIDATION_ERROR, sink.eventsOfType(CallCompletedEvent.class).get(0).errorKind());
    }

    // ---------------------------------------------------------------------
    // Concurrency
    // ---------------------------------------------------------------------

    @Test
    void slowCallDoesNotHoldBackLaterCalls() throws Exception
    {
        CountDownLatch release = new CountDownLatch(1);
        registry.registerModule(new RpcModule("timing")
                .api("slow", TestParameters.class, TestResponse.class, p -> {
                    if (!release.await(5, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("never released");
                    }
                    return new TestResponse(p.value());
                })
                .api("fast", TestParameters.class, TestResponse.class, p -> new TestResponse(p.value())));

        CompletableFuture<CallResponse> slow = dispatcher.dispatch(call("timing", "slow", Map.of("value", 1L)));
        CompletableFuture<CallResponse> fast = dispatcher.dispatch(call("timing", "fast", Map.of("value", 2L)));

        CallResponse fastResponse = fast.get(2, TimeUnit.SECONDS);
        assertTrue(fastResponse.ok());
        assertFalse(slow.isDone());

        release.countDown();
        assertTrue(slow.get(2, TimeUnit.SECONDS).ok());

        List<CallCompletedEvent> events = sink.eventsOfType(CallCompletedEvent.class);
        assertEquals(List.of("fast", "slow"), events.stream().map(CallCompletedEvent::method).toList());
    }
}
