package com.questrail.logic.api;

import java.util.concurrent.CompletionStage;

/**
 * Lifecycle callback that completes asynchronously.
 *
 * <p>The server waits for the returned stage before moving on to the next
 * hook, so ordering matches {@link LifecycleHook}.</p>
 */
@FunctionalInterface
public interface AsyncLifecycleHook
{
    CompletionStage<?> run();
}
