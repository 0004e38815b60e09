/**
 * Platform REST adapter.
 *
 * <p>{@link com.mimecast.hookcache.http.DiscordRestClient} implements the fetch, send and channel capabilities
 * over HTTP with OkHttp and Gson.
 */
package com.mimecast.hookcache.http;
