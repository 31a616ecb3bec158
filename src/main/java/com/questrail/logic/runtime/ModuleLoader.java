package com.questrail.logic.runtime;

import com.questrail.logic.api.RpcModule;
import com.questrail.logic.api.RpcModuleProvider;
import com.questrail.logic.registry.ModuleRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Discovers {@link RpcModuleProvider}s with {@link ServiceLoader} and
 * registers their modules in discovery order.
 *
 * <p>A provider that fails to load or to build its module stops the load with
 * the provider's exception. Bootstrap errors are not isolated the way hook
 * errors are.</p>
 */
public final class ModuleLoader
{
    private static final Logger log = LoggerFactory.getLogger(ModuleLoader.class);

    private final ClassLoader classLoader;

    public ModuleLoader()
    {
        this(Thread.currentThread().getContextClassLoader());
    }

    public ModuleLoader(ClassLoader classLoader)
    {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    /**
     * @return the modules actually added, excluding ids that were already present
     */
    public List<RpcModule> loadInto(ModuleRegistry registry)
    {
        Objects.requireNonNull(registry, "registry");
        List<RpcModule> added = new ArrayList<>();

        for (RpcModuleProvider provider : ServiceLoader.load(RpcModuleProvider.class, classLoader)) {
            RpcModule module = Objects.requireNonNull(provider.create(),
                    () -> provider.getClass().getName() + " returned no module");

            if (registry.registerModule(module)) {
                added.add(module);
                log.info("Loaded module {} ({} apis) from {}",
                        module.id(), module.apis().size(), provider.getClass().getName());
            }
            else {
                log.warn("Module id {} from {} is already registered; ignoring",
                        module.id(), provider.getClass().getName());
            }
        }
        return added;
    }
}
