package com.questrail.logic.registry;

import com.questrail.logic.api.RpcModule;
import com.questrail.logic.schema.FieldKind;
import com.questrail.logic.testmodule.TestModuleProvider;
import com.questrail.logic.testmodule.TestParameters;
import com.questrail.logic.testmodule.TestResponse;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleRegistryTest
{
    @Test
    void resolvesRegisteredMethod()
    {
        ModuleRegistry registry = new ModuleRegistry();
        RpcModule module = new TestModuleProvider().create();
        assertTrue(registry.registerModule(module));

        Resolution r = registry.resolve("test_module", "test_function");

        assertInstanceOf(Resolution.Found.class, r);
        Resolution.Found found = (Resolution.Found) r;
        assertSame(module, found.module());
        assertEquals("test_function", found.meta().methodName());
    }

    @Test
    void distinguishesUnknownModuleFromUnknownMethod()
    {
        ModuleRegistry registry = new ModuleRegistry();
        registry.registerModule(new TestModuleProvider().create());

        assertEquals(new Resolution.ModuleNotFound("nope"), registry.resolve("nope", "test_function"));
        assertEquals(new Resolution.MethodNotFound("test_module", "nope"), registry.resolve("test_module", "nope"));
    }

    @Test
    void duplicateModuleIdKeepsFirstRegistration()
    {
        ModuleRegistry registry = new ModuleRegistry();
        RpcModule first = new RpcModule("m");
        RpcModule second = new RpcModule("m");

        assertTrue(registry.registerModule(first));
        assertFalse(registry.registerModule(second));
        assertSame(first, registry.module("m").orElseThrow());
        assertEquals(1, registry.modules().size());
    }

    @Test
    void registerApiTargetsExistingModule()
    {
        ModuleRegistry registry = new ModuleRegistry();
        registry.registerModule(new RpcModule("m"));

        registry.registerApi("m", ApiMeta.blocking("f", TestParameters.class, TestResponse.class,
                p -> new TestResponse(p.value())));

        assertInstanceOf(Resolution.Found.class, registry.resolve("m", "f"));
        assertThrows(IllegalArgumentException.class, () -> registry.registerApi("other",
                ApiMeta.blocking("f", TestParameters.class, TestResponse.class, p -> new TestResponse(0))));
    }

    @Test
    void sealFreezesModulesAndRejectsFurtherRegistration()
    {
        ModuleRegistry registry = new ModuleRegistry();
        RpcModule module = new RpcModule("m");
        registry.registerModule(module);

        registry.seal();

        assertTrue(registry.isSealed());
        assertTrue(module.isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.registerModule(new RpcModule("n")));
        assertThrows(IllegalStateException.class, () -> registry.addStartHook("m", () -> { }));
    }

    @Test
    void describeListsMethodsWithTheirSchemas()
    {
        ModuleRegistry registry = new ModuleRegistry();
        registry.registerModule(new TestModuleProvider().create());

        List<ModuleDescriptor> described = registry.describe();

        assertEquals(1, described.size());
        ModuleDescriptor module = described.get(0);
        assertEquals("test_module", module.id());
        assertEquals(2, module.methods().size());

        MethodDescriptor fn = module.methods().get(0);
        assertEquals("test_function", fn.methodName());
        assertTrue(fn.async());
        assertEquals("TestParameters", fn.parameterType());
        assertEquals("value", fn.parameterFields().get(0).name());
        assertEquals(FieldKind.INTEGER, fn.parameterFields().get(0).kind());
        assertEquals("TestResponse", fn.responseType());

        assertFalse(module.methods().get(1).async());
    }
}
