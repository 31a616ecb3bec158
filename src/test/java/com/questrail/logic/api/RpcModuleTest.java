package com.questrail.logic.api;

import com.questrail.logic.registry.DuplicateMethodException;
import com.questrail.logic.testmodule.TestParameters;
import com.questrail.logic.testmodule.TestResponse;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

public class RpcModuleTest
{
    @Test
    void registersApisInOrder()
    {
        RpcModule module = new RpcModule("m")
                .api("b", TestParameters.class, TestResponse.class, p -> new TestResponse(p.value()))
                .asyncApi("a", TestParameters.class, TestResponse.class,
                        p -> CompletableFuture.completedFuture(new TestResponse(p.value())));

        assertEquals(List.of("b", "a"), new ArrayList<>(module.apis().keySet()));
        assertFalse(module.findApi("b").orElseThrow().isAsync());
        assertTrue(module.findApi("a").orElseThrow().isAsync());
        assertTrue(module.findApi("c").isEmpty());
    }

    @Test
    void duplicateMethodNameIsRejected()
    {
        RpcModule module = new RpcModule("m")
                .api("f", TestParameters.class, TestResponse.class, p -> new TestResponse(1));

        DuplicateMethodException e = assertThrows(DuplicateMethodException.class,
                () -> module.api("f", TestParameters.class, TestResponse.class, p -> new TestResponse(2)));
        assertEquals("m", e.moduleId());
        assertEquals("f", e.methodName());
        assertEquals(1, module.apis().size());
    }

    @Test
    void blankIdIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new RpcModule(" "));
        assertThrows(NullPointerException.class, () -> new RpcModule(null));
    }

    @Test
    void frozenModuleRejectsRegistration()
    {
        RpcModule module = new RpcModule("m");
        module.freeze();

        assertTrue(module.isFrozen());
        assertThrows(IllegalStateException.class,
                () -> module.api("f", TestParameters.class, TestResponse.class, p -> new TestResponse(1)));
        assertThrows(IllegalStateException.class, () -> module.onStart(() -> { }));
        assertThrows(IllegalStateException.class, () -> module.onShutdown(() -> { }));
    }

    @Test
    void contextIsKeyedByType()
    {
        RpcModule module = new RpcModule("m");
        module.setContext(StringBuilder.class, new StringBuilder("state"));

        assertEquals("state", module.getContext(StringBuilder.class).orElseThrow().toString());
        assertTrue(module.getContext(String.class).isEmpty());

        assertTrue(module.removeContext(StringBuilder.class).isPresent());
        assertTrue(module.getContext(StringBuilder.class).isEmpty());
    }

    @Test
    void contextRemainsWritableAfterFreeze()
    {
        RpcModule module = new RpcModule("m");
        module.freeze();

        module.setContext(Integer.class, 5);
        assertEquals(5, module.getContext(Integer.class).orElseThrow());
    }

    @Test
    void asyncHookIsAwaitedAndItsFailureUnwrapped()
    {
        List<String> calls = new ArrayList<>();
        RpcModule module = new RpcModule("m")
                .onStartAsync(() -> CompletableFuture.runAsync(() -> calls.add("started")))
                .onShutdownAsync(() -> CompletableFuture.failedFuture(new IOException("disk gone")));

        assertDoesNotThrow(() -> module.startHooks().get(0).run());
        assertEquals(List.of("started"), calls);

        IOException e = assertThrows(IOException.class, () -> module.shutdownHooks().get(0).run());
        assertEquals("disk gone", e.getMessage());
    }
}
