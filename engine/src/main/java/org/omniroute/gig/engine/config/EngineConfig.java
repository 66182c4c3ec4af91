package org.omniroute.gig.engine.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * Immutable configuration for the allocation engine host.
 * Values come from environment variables, then from a {@code .env} file, then from defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_API_URL = "http://localhost:8081";
    public static final int DEFAULT_CALLBACK_PORT = 8082;
    public static final int DEFAULT_SWEEP_INTERVAL = 15;
    public static final int DEFAULT_HEARTBEAT_TIMEOUT = 300;
    public static final int DEFAULT_BROADCAST_POOL_SIZE = 8;
    public static final int DEFAULT_REALLOCATION_POOL_SIZE = 2;
    public static final String DEFAULT_LOG_FILE = "/app/logs/engine/allocation.log";

    // Collaborator endpoints
    private final String apiBaseUrl;
    private final String routingApiUrl;
    private final String pricingApiUrl;
    private final String notificationApiUrl;

    // Callback server
    private final int callbackPort;

    // Maintenance sweeps
    private final int sweepIntervalSeconds;
    private final int heartbeatTimeoutSeconds;
    private final boolean schedulerEnabled;

    // Worker pools
    private final int broadcastPoolSize;
    private final int reallocationPoolSize;

    // Logging
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private EngineConfig(Builder builder) {
        this.apiBaseUrl = builder.apiBaseUrl;
        this.routingApiUrl = builder.routingApiUrl != null ? builder.routingApiUrl : builder.apiBaseUrl;
        this.pricingApiUrl = builder.pricingApiUrl != null ? builder.pricingApiUrl : builder.apiBaseUrl;
        this.notificationApiUrl = builder.notificationApiUrl != null ? builder.notificationApiUrl : builder.apiBaseUrl;
        this.callbackPort = builder.callbackPort;
        this.sweepIntervalSeconds = builder.sweepIntervalSeconds;
        this.heartbeatTimeoutSeconds = builder.heartbeatTimeoutSeconds;
        this.schedulerEnabled = builder.schedulerEnabled;
        this.broadcastPoolSize = builder.broadcastPoolSize;
        this.reallocationPoolSize = builder.reallocationPoolSize;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from environment variables, falling back to a {@code .env} file
     * in the working directory or its parent.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
        Dotenv parentDotenv = Dotenv.configure().directory("../").ignoreIfMissing().load();
        return fromLookup(key -> {
            String value = System.getenv(key);
            if (isBlank(value)) {
                value = dotenv.get(key);
            }
            if (isBlank(value)) {
                value = parentDotenv.get(key);
            }
            return value;
        });
    }

    /**
     * Creates configuration from an arbitrary variable lookup.
     *
     * @param lookup returns the raw value of a variable, or null when unset
     */
    public static EngineConfig fromLookup(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        String apiBaseUrl = getString(lookup, "API_BASE_URL", DEFAULT_API_URL);
        return new Builder()
                .apiBaseUrl(apiBaseUrl)
                .routingApiUrl(getString(lookup, "ROUTING_API_URL", apiBaseUrl))
                .pricingApiUrl(getString(lookup, "PRICING_API_URL", apiBaseUrl))
                .notificationApiUrl(getString(lookup, "NOTIFICATION_API_URL", apiBaseUrl))
                .callbackPort(getInt(lookup, "ENGINE_CALLBACK_PORT", DEFAULT_CALLBACK_PORT))
                .sweepIntervalSeconds(getInt(lookup, "SWEEP_INTERVAL_SECONDS", DEFAULT_SWEEP_INTERVAL))
                .heartbeatTimeoutSeconds(getInt(lookup, "HEARTBEAT_TIMEOUT_SECONDS", DEFAULT_HEARTBEAT_TIMEOUT))
                .schedulerEnabled(getBoolean(lookup, "SWEEP_SCHEDULER_ENABLED", true))
                .broadcastPoolSize(getInt(lookup, "BROADCAST_POOL_SIZE", DEFAULT_BROADCAST_POOL_SIZE))
                .reallocationPoolSize(getInt(lookup, "REALLOCATION_POOL_SIZE", DEFAULT_REALLOCATION_POOL_SIZE))
                .logFilePath(getString(lookup, "ENGINE_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(lookup, "ENGINE_FILE_LOGGING_ENABLED", true))
                .build();
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public String getRoutingApiUrl() {
        return routingApiUrl;
    }

    public String getPricingApiUrl() {
        return pricingApiUrl;
    }

    public String getNotificationApiUrl() {
        return notificationApiUrl;
    }

    public int getCallbackPort() {
        return callbackPort;
    }

    public int getSweepIntervalSeconds() {
        return sweepIntervalSeconds;
    }

    public int getHeartbeatTimeoutSeconds() {
        return heartbeatTimeoutSeconds;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public int getBroadcastPoolSize() {
        return broadcastPoolSize;
    }

    public int getReallocationPoolSize() {
        return reallocationPoolSize;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    // Variable helpers
    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String getString(Function<String, String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        if (isBlank(value)) {
            LOG.debug("Using default for {}: {}", key, defaultValue);
            return defaultValue;
        }
        return value.trim();
    }

    private static int getInt(Function<String, String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Invalid integer for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static boolean getBoolean(Function<String, String> lookup, String key, boolean defaultValue) {
        String value = lookup.apply(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "apiBaseUrl='" + apiBaseUrl + '\'' +
                ", routingApiUrl='" + routingApiUrl + '\'' +
                ", pricingApiUrl='" + pricingApiUrl + '\'' +
                ", notificationApiUrl='" + notificationApiUrl + '\'' +
                ", callbackPort=" + callbackPort +
                ", sweepIntervalSeconds=" + sweepIntervalSeconds +
                ", heartbeatTimeoutSeconds=" + heartbeatTimeoutSeconds +
                ", schedulerEnabled=" + schedulerEnabled +
                ", broadcastPoolSize=" + broadcastPoolSize +
                ", reallocationPoolSize=" + reallocationPoolSize +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private String apiBaseUrl = DEFAULT_API_URL;
        private String routingApiUrl;
        private String pricingApiUrl;
        private String notificationApiUrl;
        private int callbackPort = DEFAULT_CALLBACK_PORT;
        private int sweepIntervalSeconds = DEFAULT_SWEEP_INTERVAL;
        private int heartbeatTimeoutSeconds = DEFAULT_HEARTBEAT_TIMEOUT;
        private boolean schedulerEnabled = true;
        private int broadcastPoolSize = DEFAULT_BROADCAST_POOL_SIZE;
        private int reallocationPoolSize = DEFAULT_REALLOCATION_POOL_SIZE;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = true;

        public Builder apiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = Objects.requireNonNull(apiBaseUrl, "apiBaseUrl must not be null");
            return this;
        }

        public Builder routingApiUrl(String routingApiUrl) {
            this.routingApiUrl = routingApiUrl;
            return this;
        }

        public Builder pricingApiUrl(String pricingApiUrl) {
            this.pricingApiUrl = pricingApiUrl;
            return this;
        }

        public Builder notificationApiUrl(String notificationApiUrl) {
            this.notificationApiUrl = notificationApiUrl;
            return this;
        }

        public Builder callbackPort(int callbackPort) {
            if (callbackPort < 0 || callbackPort > 65535) {
                throw new IllegalArgumentException("callbackPort must be between 0 and 65535");
            }
            this.callbackPort = callbackPort;
            return this;
        }

        public Builder sweepIntervalSeconds(int sweepIntervalSeconds) {
            if (sweepIntervalSeconds < 1) {
                throw new IllegalArgumentException("sweepIntervalSeconds must be at least 1");
            }
            this.sweepIntervalSeconds = sweepIntervalSeconds;
            return this;
        }

        public Builder heartbeatTimeoutSeconds(int heartbeatTimeoutSeconds) {
            if (heartbeatTimeoutSeconds < 1) {
                throw new IllegalArgumentException("heartbeatTimeoutSeconds must be at least 1");
            }
            this.heartbeatTimeoutSeconds = heartbeatTimeoutSeconds;
            return this;
        }

        public Builder schedulerEnabled(boolean schedulerEnabled) {
            this.schedulerEnabled = schedulerEnabled;
            return this;
        }

        public Builder broadcastPoolSize(int broadcastPoolSize) {
            if (broadcastPoolSize < 1) {
                throw new IllegalArgumentException("broadcastPoolSize must be at least 1");
            }
            this.broadcastPoolSize = broadcastPoolSize;
            return this;
        }

        public Builder reallocationPoolSize(int reallocationPoolSize) {
            if (reallocationPoolSize < 1) {
                throw new IllegalArgumentException("reallocationPoolSize must be at least 1");
            }
            this.reallocationPoolSize = reallocationPoolSize;
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
