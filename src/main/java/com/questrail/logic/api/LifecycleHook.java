package com.questrail.logic.api;

/**
 * Nullary start or shutdown callback registered on a module.
 */
@FunctionalInterface
public interface LifecycleHook
{
    void run() throws Exception;
}
