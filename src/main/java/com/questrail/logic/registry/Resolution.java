package com.questrail.logic.registry;

import com.questrail.logic.api.RpcModule;

import java.util.Objects;

/**
 * Outcome of a two-level {@code (module, method)} lookup.
 */
public sealed interface Resolution
        permits Resolution.Found, Resolution.ModuleNotFound, Resolution.MethodNotFound
{
    record Found(RpcModule module, ApiMeta<?, ?> meta) implements Resolution {
        public Found {
            Objects.requireNonNull(module, "module");
            Objects.requireNonNull(meta, "meta");
        }
    }

    record ModuleNotFound(String moduleId) implements Resolution {}

    record MethodNotFound(String moduleId, String methodName) implements Resolution {}
}
