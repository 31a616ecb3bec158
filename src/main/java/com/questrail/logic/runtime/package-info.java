/**
 * RPC Runtime
 * =============================================================================
 *
 * <p>Wiring and lifecycle: the server loop ({@link com.questrail.logic.runtime.LogicRpcServer}),
 * per-connection handling ({@link com.questrail.logic.runtime.RpcConnectionHandler}),
 * lifecycle hooks, module discovery, and the process entry point.</p>
 *
 * <h2>Data flow</h2>
 * <pre>
 *   ServerEndpoint (accept)
 *        → RpcConnectionHandler (one per connection)
 *            → Dispatcher (one task per request, not awaited)
 *                → ResponseWriter (per-connection lock)
 * </pre>
 *
 * <p>No wire format or transport detail lives here; those sit behind the codec
 * and transport ports.</p>
 */
package com.questrail.logic.runtime;
