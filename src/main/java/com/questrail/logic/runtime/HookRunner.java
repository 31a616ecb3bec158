package com.questrail.logic.runtime;

import com.questrail.logic.api.LifecycleHook;
import com.questrail.logic.api.RpcModule;
import com.questrail.logic.observability.RpcObservabilitySink;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs lifecycle hooks with per-hook failure isolation.
 *
 * <p>Hooks run in module registration order, then in hook order within each
 * module. A hook that throws is recorded as a {@link HookFailure}, reported
 * to the sink, and the pass continues with the next hook. An interrupted hook
 * is recorded the same way; the interrupt flag is restored once the pass
 * completes.</p>
 */
public final class HookRunner
{
    private final RpcObservabilitySink sink;

    public HookRunner(RpcObservabilitySink sink)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public List<HookFailure> runStartHooks(List<RpcModule> modules)
    {
        return run(modules, HookPhase.START);
    }

    public List<HookFailure> runShutdownHooks(List<RpcModule> modules)
    {
        return run(modules, HookPhase.SHUTDOWN);
    }

    private List<HookFailure> run(List<RpcModule> modules, HookPhase phase)
    {
        List<HookFailure> failures = new ArrayList<>();
        boolean interrupted = false;

        for (RpcModule module : modules) {
            List<LifecycleHook> hooks = phase == HookPhase.START ? module.startHooks() : module.shutdownHooks();

            for (int i = 0; i < hooks.size(); i++) {
                try {
                    hooks.get(i).run();
                } catch (Exception e) {
                    if (e instanceof InterruptedException) {
                        interrupted = true;
                    }
                    HookFailure failure = new HookFailure(module.id(), phase, i, e);
                    failures.add(failure);
                    sink.onHookFailure(failure);
                }
            }
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return failures;
    }
}
