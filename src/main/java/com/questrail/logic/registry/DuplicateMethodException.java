package com.questrail.logic.registry;

/**
 * Raised when a method name is registered twice within one module.
 */
public final class DuplicateMethodException extends RuntimeException
{
    private final String moduleId;
    private final String methodName;

    public DuplicateMethodException(String moduleId, String methodName) {
        super("method '" + methodName + "' is already registered in module '" + moduleId + "'");
        this.moduleId = moduleId;
        this.methodName = methodName;
    }

    public String moduleId() {
        return moduleId;
    }

    public String methodName() {
        return methodName;
    }
}
