package com.example.messenger.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "messenger")
public class MessengerProperties {

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Assignment assignment = new Assignment();

    @NestedConfigurationProperty
    private final Routing routing = new Routing();

    @NestedConfigurationProperty
    private final Escalation escalation = new Escalation();

    @NestedConfigurationProperty
    private final Widget widget = new Widget();

    @NestedConfigurationProperty
    private final Retention retention = new Retention();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Socketio socketio = new Socketio();

    public Redis getRedis() {
        return redis;
    }

    public Assignment getAssignment() {
        return assignment;
    }

    public Routing getRouting() {
        return routing;
    }

    public Escalation getEscalation() {
        return escalation;
    }

    public Widget getWidget() {
        return widget;
    }

    public Retention getRetention() {
        return retention;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Socketio getSocketio() {
        return socketio;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the messenger module.
         */
        private String keyPrefix = "messenger";

        /**
         * Time-to-live of cached agent presence entries.
         */
        private Duration presenceTtl = Duration.ofMinutes(5);

        private Duration queueTtl = Duration.ofDays(7);

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

        public Duration getQueueTtl() {
            return queueTtl;
        }

        public void setQueueTtl(Duration queueTtl) {
            this.queueTtl = queueTtl;
        }
    }

    @Validated
    public static class Assignment {

        /**
         * Maximum number of conversations pushed to one agent per rate window.
         */
        private int rateLimit = 10;

        private Duration rateWindow = Duration.ofSeconds(60);

        /**
         * Upper bound of compare-and-set attempts for a single queue mutation.
         */
        private int maxCasAttempts = 8;

        /**
         * Automatically assign unassigned conversations when they are created or receive a visitor message.
         */
        private boolean autoAssignEnabled = true;

        public int getRateLimit() {
            return rateLimit;
        }

        public void setRateLimit(int rateLimit) {
            this.rateLimit = rateLimit;
        }

        public Duration getRateWindow() {
            return rateWindow;
        }

        public void setRateWindow(Duration rateWindow) {
            this.rateWindow = rateWindow;
        }

        public int getMaxCasAttempts() {
            return maxCasAttempts;
        }

        public void setMaxCasAttempts(int maxCasAttempts) {
            this.maxCasAttempts = maxCasAttempts;
        }

        public boolean isAutoAssignEnabled() {
            return autoAssignEnabled;
        }

        public void setAutoAssignEnabled(boolean autoAssignEnabled) {
            this.autoAssignEnabled = autoAssignEnabled;
        }
    }

    @Validated
    public static class Routing {

        /**
         * Branch of conversations in branch-less inboxes when no routing rule applies.
         */
        private Long defaultBranchId;

        public Long getDefaultBranchId() {
            return defaultBranchId;
        }

        public void setDefaultBranchId(Long defaultBranchId) {
            this.defaultBranchId = defaultBranchId;
        }
    }

    @Validated
    public static class Escalation {

        private boolean enabled = true;

        private Duration interval = Duration.ofMinutes(1);

        /**
         * How long an assignee may leave a conversation unopened before it is reassigned.
         */
        private long timeoutSeconds = 240;

        private int batchSize = 500;

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

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    @Validated
    public static class Widget {

        private Duration sessionTtl = Duration.ofHours(24);

        private int initialMessages = 10;

        private int pollLimit = 50;

        @NestedConfigurationProperty
        private final Captcha captcha = new Captcha();

        @NestedConfigurationProperty
        private final Throttle throttle = new Throttle();

        @NestedConfigurationProperty
        private final Stream stream = new Stream();

        public Duration getSessionTtl() {
            return sessionTtl;
        }

        public void setSessionTtl(Duration sessionTtl) {
            this.sessionTtl = sessionTtl;
        }

        public int getInitialMessages() {
            return initialMessages;
        }

        public void setInitialMessages(int initialMessages) {
            this.initialMessages = initialMessages;
        }

        public int getPollLimit() {
            return pollLimit;
        }

        public void setPollLimit(int pollLimit) {
            this.pollLimit = pollLimit;
        }

        public Captcha getCaptcha() {
            return captcha;
        }

        public Throttle getThrottle() {
            return throttle;
        }

        public Stream getStream() {
            return stream;
        }
    }

    @Validated
    public static class Captcha {

        /**
         * Requests from one IP within {@link #ipWindow} after which a challenge is required.
         */
        private int ipThreshold = 60;

        private Duration ipWindow = Duration.ofMinutes(10);

        private Duration challengeTtl = Duration.ofMinutes(10);

        public int getIpThreshold() {
            return ipThreshold;
        }

        public void setIpThreshold(int ipThreshold) {
            this.ipThreshold = ipThreshold;
        }

        public Duration getIpWindow() {
            return ipWindow;
        }

        public void setIpWindow(Duration ipWindow) {
            this.ipWindow = ipWindow;
        }

        public Duration getChallengeTtl() {
            return challengeTtl;
        }

        public void setChallengeTtl(Duration challengeTtl) {
            this.challengeTtl = challengeTtl;
        }
    }

    @Validated
    public static class Throttle {

        private Duration window = Duration.ofSeconds(60);

        private int bootstrapPerIp = 10;

        private int bootstrapPerToken = 20;

        private int sendPerIp = 60;

        private int sendPerSession = 30;

        private int pollPerSession = 20;

        private Duration pollMinInterval = Duration.ofSeconds(2);

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public int getBootstrapPerIp() {
            return bootstrapPerIp;
        }

        public void setBootstrapPerIp(int bootstrapPerIp) {
            this.bootstrapPerIp = bootstrapPerIp;
        }

        public int getBootstrapPerToken() {
            return bootstrapPerToken;
        }

        public void setBootstrapPerToken(int bootstrapPerToken) {
            this.bootstrapPerToken = bootstrapPerToken;
        }

        public int getSendPerIp() {
            return sendPerIp;
        }

        public void setSendPerIp(int sendPerIp) {
            this.sendPerIp = sendPerIp;
        }

        public int getSendPerSession() {
            return sendPerSession;
        }

        public void setSendPerSession(int sendPerSession) {
            this.sendPerSession = sendPerSession;
        }

        public int getPollPerSession() {
            return pollPerSession;
        }

        public void setPollPerSession(int pollPerSession) {
            this.pollPerSession = pollPerSession;
        }

        public Duration getPollMinInterval() {
            return pollMinInterval;
        }

        public void setPollMinInterval(Duration pollMinInterval) {
            this.pollMinInterval = pollMinInterval;
        }
    }

    @Validated
    public static class Stream {

        /**
         * A stream that delivered nothing for this long closes itself.
         */
        private Duration idleTimeout = Duration.ofSeconds(30);

        private Duration maxLifetime = Duration.ofMinutes(5);

        private Duration sweepInterval = Duration.ofSeconds(5);

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        public Duration getMaxLifetime() {
            return maxLifetime;
        }

        public void setMaxLifetime(Duration maxLifetime) {
            this.maxLifetime = maxLifetime;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    @Validated
    public static class Retention {

        private boolean enabled = true;

        /**
         * Age after which resolved conversations are closed.
         */
        private Duration resolvedToClosed = Duration.ofDays(90);

        private int batchSize = 5000;

        private Duration interval = Duration.ofHours(24);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getResolvedToClosed() {
            return resolvedToClosed;
        }

        public void setResolvedToClosed(Duration resolvedToClosed) {
            this.resolvedToClosed = resolvedToClosed;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    @Validated
    public static class Kafka {

        private boolean relayEnabled = true;

        private String eventsTopic = "messenger.events";

        public boolean isRelayEnabled() {
            return relayEnabled;
        }

        public void setRelayEnabled(boolean relayEnabled) {
            this.relayEnabled = relayEnabled;
        }

        public String getEventsTopic() {
            return eventsTopic;
        }

        public void setEventsTopic(String eventsTopic) {
            this.eventsTopic = eventsTopic;
        }
    }

    @Validated
    public static class Socketio {

        private String host = "0.0.0.0";

        private int port = 9094;

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
    }
}
