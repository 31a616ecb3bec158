package com.questrail.logic.runtime;

/**
 * A lifecycle hook that threw.
 *
 * @param index position of the hook within its module's list for that phase
 */
public record HookFailure(
    String moduleId,
    HookPhase phase,
    int index,
    Throwable cause
) {
}
