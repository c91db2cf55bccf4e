package com.chatcast.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration loaded from chatcast.yml (or classpath default).
 * All fields have sensible defaults for localhost development.
 */
public final class ChatConfig {

    private static final Logger log = LoggerFactory.getLogger(ChatConfig.class);

    public static final String CONFIG_PROPERTY = "chatcast.config";
    public static final String DEFAULT_RESOURCE = "/chatcast.yml";

    // Transport
    public int port = 8080;
    public String wsPath = "/";
    public String subprotocol = "chat-protocol";
    public int maxFrameSize = 65536;
    public int ioThreads = 4;

    // Chat
    public int historyLimit = 500;
    public int maxUsernameLength = 63;

    // Store
    public String storePath = "chat_history.sqlite";
    public String storeBackend = "sqlite";   // sqlite | memory
    public int storePoolSize = 4;

    // Metrics
    public int metricsIntervalSecs = 30;

    /** Loads from the file named by {@code -Dchatcast.config}, falling back to the classpath default. */
    public static ChatConfig load() {
        return load(System.getProperty(CONFIG_PROPERTY));
    }

    /** A file that fails to parse or has a badly typed value is ignored as a whole. */
    public static ChatConfig load(String path) {
        try (InputStream is = open(path)) {
            if (is == null) return new ChatConfig();
            Map<String, Object> map = new Yaml().load(is);
            ChatConfig cfg = new ChatConfig();
            if (map != null) applyMap(cfg, map);
            return cfg;
        } catch (Exception e) {
            log.warn("Failed to load config, using defaults: {}", e.getMessage());
            return new ChatConfig();
        }
    }

    private static InputStream open(String path) throws IOException {
        if (path != null) {
            Path p = Paths.get(path);
            if (Files.exists(p)) return Files.newInputStream(p);
            log.warn("Config file {} not found, using classpath default", path);
        }
        return ChatConfig.class.getResourceAsStream(DEFAULT_RESOURCE);
    }

    private static void applyMap(ChatConfig cfg, Map<String, Object> map) {
        if (map.containsKey("port")) cfg.port = (int) map.get("port");
        if (map.containsKey("wsPath")) cfg.wsPath = (String) map.get("wsPath");
        if (map.containsKey("subprotocol")) cfg.subprotocol = (String) map.get("subprotocol");
        if (map.containsKey("maxFrameSize")) cfg.maxFrameSize = (int) map.get("maxFrameSize");
        if (map.containsKey("ioThreads")) cfg.ioThreads = (int) map.get("ioThreads");
        if (map.containsKey("historyLimit")) cfg.historyLimit = (int) map.get("historyLimit");
        if (map.containsKey("maxUsernameLength")) cfg.maxUsernameLength = (int) map.get("maxUsernameLength");
        if (map.containsKey("storePath")) cfg.storePath = (String) map.get("storePath");
        if (map.containsKey("storeBackend")) cfg.storeBackend = (String) map.get("storeBackend");
        if (map.containsKey("storePoolSize")) cfg.storePoolSize = (int) map.get("storePoolSize");
        if (map.containsKey("metricsIntervalSecs")) cfg.metricsIntervalSecs = (int) map.get("metricsIntervalSecs");
    }

    public boolean inMemoryStore() {
        return "memory".equalsIgnoreCase(storeBackend);
    }
}
