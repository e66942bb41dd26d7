package com.agentgate.orchestrator.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session-scoped allow-list backed by a concurrent set.
 */
public class InMemoryAllowListStore implements AllowListStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAllowListStore.class);

    private final Set<String> allowed = ConcurrentHashMap.newKeySet();

    @Override
    public boolean isAllowed(String text) {
        return text != null && allowed.contains(text);
    }

    @Override
    public void allow(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        if (allowed.add(text)) {
            log.info("Added to allow-list: {}", text);
        }
    }

    public int size() {
        return allowed.size();
    }
}
