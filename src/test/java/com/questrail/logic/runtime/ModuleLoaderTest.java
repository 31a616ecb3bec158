package com.questrail.logic.runtime;

import com.questrail.logic.api.RpcModule;
import com.questrail.logic.registry.ModuleRegistry;
import com.questrail.logic.registry.Resolution;
import com.questrail.logic.testmodule.TestModuleProvider;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleLoaderTest
{
    @Test
    void discoversProvidersOnTheClasspath()
    {
        ModuleRegistry registry = new ModuleRegistry();

        List<RpcModule> added = new ModuleLoader(getClass().getClassLoader()).loadInto(registry);

        assertEquals(List.of(TestModuleProvider.MODULE_ID), added.stream().map(RpcModule::id).toList());
        assertInstanceOf(Resolution.Found.class, registry.resolve("test_module", "test_function"));
    }

    @Test
    void alreadyRegisteredIdIsSkipped()
    {
        ModuleRegistry registry = new ModuleRegistry();
        RpcModule existing = new RpcModule(TestModuleProvider.MODULE_ID);
        registry.registerModule(existing);

        List<RpcModule> added = new ModuleLoader().loadInto(registry);

        assertTrue(added.isEmpty());
        assertSame(existing, registry.module(TestModuleProvider.MODULE_ID).orElseThrow());
    }
}
