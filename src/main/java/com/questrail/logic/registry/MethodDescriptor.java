package com.questrail.logic.registry;

import com.questrail.logic.schema.FieldDescriptor;

import java.util.List;

/**
 * Read-only view of one API for client stub generators.
 */
public record MethodDescriptor(
    String methodName,
    boolean async,
    String parameterType,
    List<FieldDescriptor> parameterFields,
    String responseType,
    List<FieldDescriptor> responseFields
) {
    public MethodDescriptor {
        parameterFields = List.copyOf(parameterFields);
        responseFields = List.copyOf(responseFields);
    }
}
