package com.stackforge.core.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache of provider clients for one plan execution, keyed by region, profile
 * and role. Safe to share between workers.
 */
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final StackProviderFactory factory;
    private final Map<ConnectionKey, StackProvider> clients = new ConcurrentHashMap<>();

    public ConnectionManager(StackProviderFactory factory) {
        this.factory = factory;
    }

    public StackProvider connect(ConnectionKey key) {
        return clients.computeIfAbsent(key, k -> {
            log.debug("Opening provider session for region={} profile={} role={}",
                    k.region(), k.profile(), k.iamRole());
            return factory.connect(k);
        });
    }

    public int size() {
        return clients.size();
    }
}
