package com.roomsignal.service;

import com.roomsignal.config.SignalingProperties;
import com.roomsignal.exception.ErrorType;
import com.roomsignal.exception.SignalingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request counters per source address. Over the limit a request is
 * rejected, never queued.
 */
@Service
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public enum Policy {
        API("Too many requests from this IP, please try again later."),
        ROOM_CREATION("Too many rooms created from this IP, please try again later."),
        SIGNALING("Too many events, please slow down.");

        private final String message;

        Policy(String message) {
            this.message = message;
        }

        public String getMessage() { return message; }
    }

    private static final class Window {
        int count;
        final long resetAt;

        Window(long resetAt) {
            this.resetAt = resetAt;
        }
    }

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final SignalingProperties properties;
    private final Clock clock;

    public RateLimiter(SignalingProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Counts one request for {@code key} under {@code policy}.
     *
     * @return false when the window's limit is already used up
     */
    public boolean tryAcquire(Policy policy, String key) {
        SignalingProperties.Policy settings = settingsOf(policy);
        long now = clock.millis();
        boolean[] allowed = new boolean[1];

        windows.compute(policy.name() + ':' + key, (k, window) -> {
            if (window == null || now > window.resetAt) {
                window = new Window(now + settings.getWindow().toMillis());
            }
            if (window.count < settings.getLimit()) {
                window.count++;
                allowed[0] = true;
            }
            return window;
        });

        if (!allowed[0]) {
            log.warn("Rate limit {} exceeded for {}", policy, key);
        }
        return allowed[0];
    }

    /**
     * Same as {@link #tryAcquire} but throws {@link ErrorType#RATE_LIMITED}.
     */
    public void check(Policy policy, String key) {
        if (!tryAcquire(policy, key)) {
            throw new SignalingException(ErrorType.RATE_LIMITED, policy.getMessage());
        }
    }

    /**
     * Drops windows that have already closed.
     *
     * @return number of windows removed
     */
    public int evictExpired() {
        long now = clock.millis();
        int before = windows.size();
        windows.values().removeIf(window -> now > window.resetAt);
        return before - windows.size();
    }

    public int size() {
        return windows.size();
    }

    private SignalingProperties.Policy settingsOf(Policy policy) {
        switch (policy) {
            case API: return properties.getRateLimit().getApi();
            case ROOM_CREATION: return properties.getRateLimit().getRoomCreation();
            default: return properties.getRateLimit().getSignaling();
        }
    }
}
