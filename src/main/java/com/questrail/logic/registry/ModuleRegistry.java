package com.questrail.logic.registry;

import com.questrail.logic.api.LifecycleHook;
import com.questrail.logic.api.RpcModule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ModuleRegistry
 * =============================================================================
 * Process-wide table of modules, their APIs, and lifecycle hooks.
 *
 * <h2>Threading</h2>
 * All mutation happens during bootstrap, on one thread, before the server
 * starts. {@link #seal()} then freezes the registry and every module in it.
 * After sealing the registry is read-only and lookups need no locking; the
 * server starts its own threads only after sealing, which publishes the final
 * state to them.
 *
 * <h2>Idempotent module registration</h2>
 * A second module registered under an existing id is ignored, leaving the first
 * module's APIs untouched.
 */
public final class ModuleRegistry
{
    private final Map<String, RpcModule> modules = new LinkedHashMap<>();
    private volatile boolean sealed;

    /**
     * Insert {@code module} if its id is not yet registered.
     *
     * @return {@code true} if the module was added, {@code false} if the id was
     *         already present
     * @throws IllegalStateException if the registry is sealed
     */
    public boolean registerModule(RpcModule module)
    {
        Objects.requireNonNull(module, "module");
        requireOpen();

        if (modules.containsKey(module.id())) {
            return false;
        }
        modules.put(module.id(), module);
        return true;
    }

    /**
     * Add an API to a registered module.
     *
     * @throws DuplicateMethodException if the method name is already present
     * @throws IllegalArgumentException if the module is unknown
     * @throws IllegalStateException if the registry is sealed
     */
    public void registerApi(String moduleId, ApiMeta<?, ?> meta)
    {
        requireOpen();
        requireModule(moduleId).register(meta);
    }

    public void addStartHook(String moduleId, LifecycleHook hook)
    {
        requireOpen();
        requireModule(moduleId).addStartHook(hook);
    }

    public void addShutdownHook(String moduleId, LifecycleHook hook)
    {
        requireOpen();
        requireModule(moduleId).addShutdownHook(hook);
    }

    /**
     * Two-level lookup. Never mutates.
     */
    public Resolution resolve(String moduleId, String methodName)
    {
        RpcModule module = moduleId == null ? null : modules.get(moduleId);
        if (module == null) {
            return new Resolution.ModuleNotFound(moduleId);
        }

        return module.findApi(methodName)
                .<Resolution>map(meta -> new Resolution.Found(module, meta))
                .orElseGet(() -> new Resolution.MethodNotFound(moduleId, methodName));
    }

    public Optional<RpcModule> module(String moduleId)
    {
        return Optional.ofNullable(modules.get(moduleId));
    }

    /**
     * @return modules in registration order
     */
    public List<RpcModule> modules()
    {
        return List.copyOf(modules.values());
    }

    /**
     * Read-only traversal for client stub generation.
     */
    public List<ModuleDescriptor> describe()
    {
        List<ModuleDescriptor> out = new ArrayList<>(modules.size());
        for (RpcModule module : modules.values()) {
            List<MethodDescriptor> methods = new ArrayList<>();
            for (ApiMeta<?, ?> meta : module.apis().values()) {
                methods.add(meta.describe());
            }
            out.add(new ModuleDescriptor(module.id(), module.name(), module.description(), methods));
        }
        return out;
    }

    /**
     * Freeze the registry and all registered modules. Idempotent.
     */
    public void seal()
    {
        if (sealed) {
            return;
        }
        modules.values().forEach(RpcModule::freeze);
        sealed = true;
    }

    public boolean isSealed()
    {
        return sealed;
    }

    private RpcModule requireModule(String moduleId)
    {
        RpcModule module = modules.get(moduleId);
        if (module == null) {
            throw new IllegalArgumentException("module '" + moduleId + "' is not registered");
        }
        return module;
    }

    private void requireOpen()
    {
        if (sealed) {
            throw new IllegalStateException("registry is sealed; register modules before the server starts");
        }
    }
}
