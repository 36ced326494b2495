package com.vcc.copilot.service;

import com.vcc.copilot.config.CopilotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool of LLM provider API keys with round-robin selection, loaded from configuration.
 * An empty pool is allowed for keyless local providers; requests then go out unauthenticated.
 */
@Service
public class KeyPool {
    private static final Logger log = LoggerFactory.getLogger(KeyPool.class);

    private final List<String> keys;
    private final AtomicInteger index = new AtomicInteger(0);

    public KeyPool(CopilotProperties properties) {
        List<String> loaded = new ArrayList<>();
        List<String> configured = properties.getUpstream().getApiKeys();
        if (configured != null) {
            for (String key : configured) {
                if (key != null && !key.isBlank() && !loaded.contains(key.trim())) {
                    loaded.add(key.trim());
                }
            }
        }
        this.keys = List.copyOf(loaded);

        if (keys.isEmpty()) {
            log.warn("KeyPool has no upstream API keys; requests will be sent without Authorization");
        }
        for (int i = 0; i < keys.size(); i++) {
            log.info("Loaded upstream key [{}]: {} (length={})", i, maskKey(keys.get(i)), keys.get(i).length());
        }
    }

    /**
     * Mask key for logging (show first 6 chars only).
     */
    static String maskKey(String key) {
        if (key == null || key.length() <= 10) {
            return "***";
        }
        return key.substring(0, 6) + "...";
    }

    /**
     * Next key in round-robin order, or {@code null} when the pool is empty.
     */
    public String nextKey() {
        if (keys.isEmpty()) {
            return null;
        }
        int next = Math.floorMod(index.getAndIncrement(), keys.size());
        return keys.get(next);
    }
}
