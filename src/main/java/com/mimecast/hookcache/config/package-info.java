/**
 * JSON5 configuration files read into typed accessors.
 */
package com.mimecast.hookcache.config;
