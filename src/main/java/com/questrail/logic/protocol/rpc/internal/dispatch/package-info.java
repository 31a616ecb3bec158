/**
 * Call dispatch.
 *
 * <p>Resolution, parameter decoding, handler invocation and response
 * validation. Everything that can go wrong with a single call is converted to a
 * failed response here and does not propagate further.</p>
 */
package com.questrail.logic.protocol.rpc.internal.dispatch;
