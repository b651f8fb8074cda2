package com.roomsignal.config;

import com.roomsignal.model.IceServer;
import com.roomsignal.model.Room;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Signaling server settings, bound from the {@code signaling.*} keys of application.yml.
 */
@Component
@ConfigurationProperties(prefix = "signaling")
public class SignalingProperties {

    /**
     * Capacity used when a room is created without {@code maxUsers}.
     */
    private int defaultRoomCapacity = Room.DEFAULT_CAPACITY;

    /**
     * Pending offers older than this are dropped together with their connecting link.
     */
    private Duration offerMaxAge = Duration.ofSeconds(30);

    /**
     * Empty rooms younger than this are left alone by the cleanup sweep.
     */
    private Duration emptyRoomGracePeriod = Duration.ofMinutes(5);

    private List<IceServer> iceServers = new ArrayList<>(List.of(
            new IceServer("stun:stun.l.google.com:19302"),
            new IceServer("stun:stun1.l.google.com:19302"),
            new IceServer("stun:stun2.l.google.com:19302")));

    private final RateLimit rateLimit = new RateLimit();

    public int getDefaultRoomCapacity() {
        return defaultRoomCapacity;
    }

    public void setDefaultRoomCapacity(int defaultRoomCapacity) {
        this.defaultRoomCapacity = defaultRoomCapacity;
    }

    public Duration getOfferMaxAge() {
        return offerMaxAge;
    }

    public void setOfferMaxAge(Duration offerMaxAge) {
        this.offerMaxAge = offerMaxAge;
    }

    public Duration getEmptyRoomGracePeriod() {
        return emptyRoomGracePeriod;
    }

    public void setEmptyRoomGracePeriod(Duration emptyRoomGracePeriod) {
        this.emptyRoomGracePeriod = emptyRoomGracePeriod;
    }

    public List<IceServer> getIceServers() {
        return iceServers;
    }

    public void setIceServers(List<IceServer> iceServers) {
        this.iceServers = iceServers;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public static class RateLimit {

        /**
         * Admin API requests per address.
         */
        private Policy api = new Policy(100, Duration.ofMinutes(15));

        /**
         * Room creations per address.
         */
        private Policy roomCreation = new Policy(10, Duration.ofHours(1));

        /**
         * Signaling events per address and event type.
         */
        private Policy signaling = new Policy(50, Duration.ofSeconds(60));

        public Policy getApi() {
            return api;
        }

        public void setApi(Policy api) {
            this.api = api;
        }

        public Policy getRoomCreation() {
            return roomCreation;
        }

        public void setRoomCreation(Policy roomCreation) {
            this.roomCreation = roomCreation;
        }

        public Policy getSignaling() {
            return signaling;
        }

        public void setSignaling(Policy signaling) {
            this.signaling = signaling;
        }
    }

    public static class Policy {
        private int limit;
        private Duration window;

        public Policy() {}

        public Policy(int limit, Duration window) {
            this.limit = limit;
            this.window = window;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }
}
