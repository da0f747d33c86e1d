package com.phillippitts.voicebridge.service.events;

import com.phillippitts.voicebridge.service.stream.connection.event.ConnectionLostEvent;
import com.phillippitts.voicebridge.service.stream.connection.event.ConnectionRestoredEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log of connection losses and recoveries. Throttled per provider to avoid log spam
 * from a flapping connection.
 */
@Component
class ConnectionEventsListener {
    private static final Logger LOG = LogManager.getLogger(ConnectionEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Map<String, Instant> lostAt = new ConcurrentHashMap<>();

    @EventListener
    void onConnectionLost(ConnectionLostEvent e) {
        lostAt.putIfAbsent(e.provider(), e.at());
        if (shouldLog("lost-" + e.provider())) {
            LOG.warn("Connection to {} lost at {}. Pending results resume after reconnect.", e.provider(), e.at());
        }
    }

    @EventListener
    void onConnectionRestored(ConnectionRestoredEvent e) {
        Instant since = lostAt.remove(e.provider());
        long downMs = since == null ? -1 : Duration.between(since, e.at()).toMillis();
        if (shouldLog("restored-" + e.provider())) {
            LOG.info("Connection to {} restored after {} attempt(s), down for {}ms", e.provider(), e.attempts(), downMs);
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }

    // Package-private for tests
    boolean isDown(String provider) {
        return lostAt.containsKey(provider);
    }
}
