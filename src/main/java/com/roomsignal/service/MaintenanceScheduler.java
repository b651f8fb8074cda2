package com.roomsignal.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic sweeps over the in-memory stores. A failing sweep is logged and
 * retried on the next tick.
 */
@Component
public class MaintenanceScheduler {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final ConnectionRegistry registry;
    private final PeerConnectionTracker tracker;
    private final RateLimiter rateLimiter;

    public MaintenanceScheduler(ConnectionRegistry registry,
                                PeerConnectionTracker tracker,
                                RateLimiter rateLimiter) {
        this.registry = registry;
        this.tracker = tracker;
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedDelayString = "${signaling.sweep.empty-room-interval-ms:300000}",
            initialDelayString = "${signaling.sweep.empty-room-interval-ms:300000}")
    public void cleanupEmptyRooms() {
        try {
            registry.cleanupEmptyRooms();
        } catch (RuntimeException e) {
            log.error("Empty room cleanup failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${signaling.sweep.offer-interval-ms:60000}",
            initialDelayString = "${signaling.sweep.offer-interval-ms:60000}")
    public void cleanupExpiredOffers() {
        try {
            int removed = tracker.sweepExpiredOffers();
            if (removed > 0) {
                log.info("Removed {} expired offers", removed);
            }
        } catch (RuntimeException e) {
            log.error("Expired offer cleanup failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${signaling.sweep.rate-limit-interval-ms:300000}",
            initialDelayString = "${signaling.sweep.rate-limit-interval-ms:300000}")
    public void evictRateLimitWindows() {
        try {
            int removed = rateLimiter.evictExpired();
            log.debug("Evicted {} closed rate-limit windows", removed);
        } catch (RuntimeException e) {
            log.error("Rate-limit window eviction failed", e);
        }
    }
}
