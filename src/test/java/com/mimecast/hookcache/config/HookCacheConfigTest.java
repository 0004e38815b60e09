package com.mimecast.hookcache.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HookCacheConfigTest {

    @Test
    void testDefaults() {
        HookCacheConfig config = new HookCacheConfig();

        assertEquals("https://discord.com/api/v10", config.getApiBaseUrl());
        assertEquals("", config.getBotToken());
        assertEquals("DiscordBot (hookcache, 1.0)", config.getUserAgent());
        assertEquals(30, config.getConnectTimeout());
        assertEquals(30, config.getReadTimeout());
        assertEquals(30, config.getWriteTimeout());
        assertEquals(0L, config.getFetchTimeout());
        assertTrue(config.isMetricsEnabled());
    }

    @Test
    void testLoadFromFile() throws IOException {
        HookCacheConfig config = new HookCacheConfig("src/test/resources/cfg/hookcache.json5");

        assertEquals("http://localhost:8080/api/v10", config.getApiBaseUrl());
        assertEquals("test-bot-token", config.getBotToken());
        assertEquals("DiscordBot (hookcache-test, 1.0)", config.getUserAgent());
        assertEquals(5, config.getConnectTimeout());
        assertEquals(10, config.getReadTimeout());
        assertEquals(15, config.getWriteTimeout());
        assertEquals(3L, config.getFetchTimeout());
        assertFalse(config.isMetricsEnabled());
    }

    @Test
    void testBotTokenFromFile(@TempDir Path dir) throws IOException {
        Path secret = dir.resolve("bot-token");
        Files.writeString(secret, "file-token\n");

        Map<String, Object> map = new HashMap<>();
        map.put("botToken", secret.toString());

        assertEquals("file-token", new HookCacheConfig(map).getBotToken());
    }

    @Test
    void testNumericStrings() {
        Map<String, Object> map = new HashMap<>();
        map.put("fetchTimeout", "12");
        map.put("readTimeout", 7.0);

        HookCacheConfig config = new HookCacheConfig(map);
        assertEquals(12L, config.getFetchTimeout());
        assertEquals(7, config.getReadTimeout());
    }

    @Test
    void testNegativeFetchTimeout() {
        Map<String, Object> map = new HashMap<>();
        map.put("fetchTimeout", -1);

        HookCacheConfig config = new HookCacheConfig(map);
        assertThrows(IllegalArgumentException.class, config::getFetchTimeout);
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> new HookCacheConfig("src/test/resources/cfg/missing.json5"));
    }

    @Test
    void testMalformedFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.json5");
        Files.writeString(file, "{ apiBaseUrl: ");

        assertThrows(IOException.class, () -> new HookCacheConfig(file.toString()));
    }
}
