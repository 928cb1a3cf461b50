package com.example.engage.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "engage")
public class EngageProperties {

    @NestedConfigurationProperty
    private final Scheduler scheduler = new Scheduler();

    @NestedConfigurationProperty
    private final Delivery delivery = new Delivery();

    @NestedConfigurationProperty
    private final Commitment commitment = new Commitment();

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final SocketIo socketio = new SocketIo();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Commitment getCommitment() {
        return commitment;
    }

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public SocketIo getSocketio() {
        return socketio;
    }

    @Validated
    public static class Scheduler {

        /**
         * Toggle for the background delivery loop. Disabled in tests that drive ticks manually.
         */
        private boolean enabled = true;

        /**
         * Interval between delivery ticks.
         */
        private Duration interval = Duration.ofSeconds(30);

        /**
         * Maximum number of due engagements claimed per tick.
         */
        private int batchSize = 50;

        /**
         * Claims older than this are considered abandoned and released back to pending.
         */
        private Duration claimTimeout = Duration.ofMinutes(5);

        /**
         * Upper bound on waiting for an in-flight tick during shutdown.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getClaimTimeout() {
            return claimTimeout;
        }

        public void setClaimTimeout(Duration claimTimeout) {
            this.claimTimeout = claimTimeout;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    @Validated
    public static class Delivery {

        /**
         * Number of failed sends after which an engagement is marked failed.
         */
        private int maxAttempts = 3;

        /**
         * Upper bound for a single push over a live connection.
         */
        private Duration sendTimeout = Duration.ofSeconds(5);

        /**
         * Pending engagements that have existed and been due for longer than this are expired.
         */
        private Duration maxPendingAge = Duration.ofDays(7);

        /**
         * Wait for a client acknowledgement before counting a push as delivered.
         */
        private boolean requireAck = false;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }

        public Duration getMaxPendingAge() {
            return maxPendingAge;
        }

        public void setMaxPendingAge(Duration maxPendingAge) {
            this.maxPendingAge = maxPendingAge;
        }

        public boolean isRequireAck() {
            return requireAck;
        }

        public void setRequireAck(boolean requireAck) {
            this.requireAck = requireAck;
        }
    }

    @Validated
    public static class Commitment {

        /**
         * How long before the due date a reminder engagement is scheduled.
         */
        private Duration reminderLead = Duration.ofHours(1);

        public Duration getReminderLead() {
            return reminderLead;
        }

        public void setReminderLead(Duration reminderLead) {
            this.reminderLead = reminderLead;
        }
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the engagement module.
         */
        private String keyPrefix = "engage";

        /**
         * Redis key time-to-live for presence entries.
         */
        private Duration presenceTtl = Duration.ofMinutes(5);

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getPresenceTtl() {
            return presenceTtl;
        }

        public void setPresenceTtl(Duration presenceTtl) {
            this.presenceTtl = presenceTtl;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Kafka topic to publish engagement and commitment lifecycle events.
         */
        private String lifecycleTopic = "engage.lifecycle";

        public String getLifecycleTopic() {
            return lifecycleTopic;
        }

        public void setLifecycleTopic(String lifecycleTopic) {
            this.lifecycleTopic = lifecycleTopic;
        }
    }

    @Validated
    public static class SocketIo {

        private boolean enabled = true;

        private String host = "0.0.0.0";

        private int port = 9095;

        /**
         * Allowed origin for the Socket.IO handshake.
         */
        private String origin = "*";

        private Duration pingInterval = Duration.ofSeconds(25);

        /**
         * A connection missing pings for this long is closed and its user unregistered.
         */
        private Duration pingTimeout = Duration.ofSeconds(60);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getOrigin() {
            return origin;
        }

        public void setOrigin(String origin) {
            this.origin = origin;
        }

        public Duration getPingInterval() {
            return pingInterval;
        }

        public void setPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
        }

        public Duration getPingTimeout() {
            return pingTimeout;
        }

        public void setPingTimeout(Duration pingTimeout) {
            this.pingTimeout = pingTimeout;
        }
    }
}
