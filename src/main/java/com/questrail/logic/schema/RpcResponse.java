package com.questrail.logic.schema;

/**
 * Root kind for handler result types.
 *
 * <p>Implementations must be records; each component becomes one field of the
 * response {@code data} map.</p>
 */
public interface RpcResponse
{
}
