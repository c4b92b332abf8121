package com.example.realtime.config;

import com.example.realtime.domain.NotificationTemplate;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "realtime")
public class RealtimeProperties {

    @NestedConfigurationProperty
    private final Listener listener = new Listener();

    @NestedConfigurationProperty
    private final SocketIo socketio = new SocketIo();

    @NestedConfigurationProperty
    private final Auth auth = new Auth();

    @NestedConfigurationProperty
    private final Push push = new Push();

    @NestedConfigurationProperty
    private final RateLimit rateLimit = new RateLimit();

    /**
     * Time allowed for the whole shutdown sequence before sockets and the listener link are
     * closed forcefully.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    /**
     * How often the delivery health summary is written to the log.
     */
    private Duration healthLogInterval = Duration.ofMinutes(5);

    public Listener getListener() {
        return listener;
    }

    public SocketIo getSocketio() {
        return socketio;
    }

    public Auth getAuth() {
        return auth;
    }

    public Push getPush() {
        return push;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Duration getHealthLogInterval() {
        return healthLogInterval;
    }

    public void setHealthLogInterval(Duration healthLogInterval) {
        this.healthLogInterval = healthLogInterval;
    }

    @Validated
    public static class Listener {

        /**
         * Start the change listener with the application. Disabled in tests that bring up a context
         * without a database.
         */
        private boolean enabled = true;

        /**
         * JDBC URL of the dedicated subscription link. Falls back to {@code spring.datasource.url}.
         */
        private String url;

        private String username;

        private String password;

        /**
         * Channel carrying inserted notification rows.
         */
        private String notificationChannel = "notification_created";

        /**
         * Channel carrying inserted chat message rows.
         */
        private String messageChannel = "message_created";

        /**
         * How long one poll of the link blocks waiting for notifications.
         */
        private Duration pollTimeout = Duration.ofMillis(500);

        /**
         * Delay before the first reconnect attempt after the link drops.
         */
        private Duration reconnectDelay = Duration.ofSeconds(5);

        /**
         * Growth factor applied to the delay on consecutive failures. 1.0 keeps the delay fixed.
         */
        private double reconnectMultiplier = 1.0;

        /**
         * Upper bound for the reconnect delay.
         */
        private Duration reconnectMaxDelay = Duration.ofSeconds(5);

        /**
         * Random extra delay added on top of each computed backoff, as a fraction of that delay.
         */
        private double reconnectJitter = 0.0;

        /**
         * Ceiling for a graceful close of the link.
         */
        private Duration disconnectTimeout = Duration.ofSeconds(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getNotificationChannel() {
            return notificationChannel;
        }

        public void setNotificationChannel(String notificationChannel) {
            this.notificationChannel = notificationChannel;
        }

        public String getMessageChannel() {
            return messageChannel;
        }

        public void setMessageChannel(String messageChannel) {
            this.messageChannel = messageChannel;
        }

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }

        public Duration getReconnectDelay() {
            return reconnectDelay;
        }

        public void setReconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
        }

        public double getReconnectMultiplier() {
            return reconnectMultiplier;
        }

        public void setReconnectMultiplier(double reconnectMultiplier) {
            this.reconnectMultiplier = reconnectMultiplier;
        }

        public Duration getReconnectMaxDelay() {
            return reconnectMaxDelay;
        }

        public void setReconnectMaxDelay(Duration reconnectMaxDelay) {
            this.reconnectMaxDelay = reconnectMaxDelay;
        }

        public double getReconnectJitter() {
            return reconnectJitter;
        }

        public void setReconnectJitter(double reconnectJitter) {
            this.reconnectJitter = reconnectJitter;
        }

        public Duration getDisconnectTimeout() {
            return disconnectTimeout;
        }

        public void setDisconnectTimeout(Duration disconnectTimeout) {
            this.disconnectTimeout = disconnectTimeout;
        }
    }

    @Validated
    public static class SocketIo {

        private String host = "0.0.0.0";

        private int port = 9094;

        /**
         * Allowed CORS origin for polling transports.
         */
        private String origin = "*";

        private Duration pingInterval = Duration.ofSeconds(25);

        private Duration pingTimeout = Duration.ofSeconds(20);

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

    @Validated
    public static class Auth {

        /**
         * Endpoint that resolves a bearer token to its profile, e.g. {@code https://api.example.com/api/auth/me}.
         */
        private String verifyUrl = "http://localhost:3002/api/auth/me";

        private Duration connectTimeout = Duration.ofSeconds(3);

        private Duration readTimeout = Duration.ofSeconds(5);

        /**
         * Threads verifying handshakes off the socket event loop.
         */
        private int workerThreads = 4;

        public String getVerifyUrl() {
            return verifyUrl;
        }

        public void setVerifyUrl(String verifyUrl) {
            this.verifyUrl = verifyUrl;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    @Validated
    public static class Push {

        private String endpoint = "https://exp.host/--/api/v2/push/send";

        /**
         * Optional Expo access token sent as a bearer credential.
         */
        private String accessToken;

        /**
         * Messages per provider request.
         */
        private int chunkSize = 100;

        private String sound = "default";

        /**
         * Threads sending push batches in the background.
         */
        private int workerThreads = 4;

        /**
         * Per-type overrides merged over the built-in templates.
         */
        private Map<String, NotificationTemplate> templates = new LinkedHashMap<>();

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getAccessToken() {
            return accessToken;
        }

        public void setAccessToken(String accessToken) {
            this.accessToken = accessToken;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public String getSound() {
            return sound;
        }

        public void setSound(String sound) {
            this.sound = sound;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public Map<String, NotificationTemplate> getTemplates() {
            return templates;
        }

        public void setTemplates(Map<String, NotificationTemplate> templates) {
            this.templates = templates;
        }
    }

    @Validated
    public static class RateLimit {

        /**
         * Toggle for the inbound HTTP rate limiter.
         */
        private boolean enabled = true;

        /**
         * Maximum number of requests allowed per refill period.
         */
        private long capacity = 60;

        /**
         * Number of tokens replenished every {@link #refillPeriod}.
         */
        private long refillTokens = 60;

        private Duration refillPeriod = Duration.ofSeconds(60);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public long getRefillTokens() {
            return refillTokens;
        }

        public void setRefillTokens(long refillTokens) {
            this.refillTokens = refillTokens;
        }

        public Duration getRefillPeriod() {
            return refillPeriod;
        }

        public void setRefillPeriod(Duration refillPeriod) {
            this.refillPeriod = refillPeriod;
        }
    }
}
