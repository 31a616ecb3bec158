package com.questrail.logic.registry;

import java.util.List;

/**
 * Read-only view of a registered module, methods in registration order.
 */
public record ModuleDescriptor(
    String id,
    String name,
    String description,
    List<MethodDescriptor> methods
) {
    public ModuleDescriptor {
        methods = List.copyOf(methods);
    }
}
