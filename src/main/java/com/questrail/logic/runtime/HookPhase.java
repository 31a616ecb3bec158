package com.questrail.logic.runtime;

public enum HookPhase
{
    START,
    SHUTDOWN
}
