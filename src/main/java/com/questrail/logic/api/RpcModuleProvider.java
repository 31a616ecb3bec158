package com.questrail.logic.api;

/**
 * Service-provider entry point for module discovery.
 *
 * <p>Implementations are listed in
 * {@code META-INF/services/com.questrail.logic.api.RpcModuleProvider} and
 * instantiated through {@link java.util.ServiceLoader}. A provider must have a
 * public no-argument constructor.</p>
 */
public interface RpcModuleProvider
{
    /**
     * Build the module this provider contributes.
     *
     * <p>Called once during bootstrap, before the server starts. The returned
     * module should already carry its APIs and hooks.</p>
     */
    RpcModule create();
}
