/**
 * In-memory webhook cache with coalesced fetches and an execution helper.
 *
 * <p>{@link com.mimecast.hookcache.HookCache} wires the pieces together for a typical application.
 */
package com.mimecast.hookcache;
