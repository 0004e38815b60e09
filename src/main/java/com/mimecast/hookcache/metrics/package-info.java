/**
 * Micrometer meters for cache and execution traffic.
 */
package com.mimecast.hookcache.metrics;
