package com.questrail.logic.schema;

/**
 * Root kind for handler parameter types.
 *
 * <p>Implementations must be records; each component becomes one required
 * field of the request {@code params} map.</p>
 *
 * <pre>{@code
 * record TestParameters(int value) implements RpcParameters {}
 * }</pre>
 */
public interface RpcParameters
{
}
