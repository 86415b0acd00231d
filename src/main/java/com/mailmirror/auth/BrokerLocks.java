package com.mailmirror.auth;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per MQTT client id.
 * Overlapping sessions under the same client id make the broker drop the older one.
 */
public class BrokerLocks {

    private final Map<String, Lock> locks = new ConcurrentHashMap<>();

    public Lock forClient(String clientId) {
        return locks.computeIfAbsent(clientId, id -> new ReentrantLock(true));
    }
}
