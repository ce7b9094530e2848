package io.fullerstack.csms.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the central system.
 * <p>
 * <b>Usage:</b>
 * <pre>{@code
 * // Defaults (heartbeat 300s, cache 60s, command timeout 30s)
 * CentralSystemConfig config = CentralSystemConfig.defaults();
 *
 * // From csms.properties + system properties
 * CentralSystemConfig config = CentralSystemConfig.load();
 * }</pre>
 *
 * @param host                   bind address of the OCPP-J transport
 * @param port                   listen port of the OCPP-J transport
 * @param heartbeatInterval      interval returned to charge points on boot
 * @param missedHeartbeatFactor  a charge point silent for longer than this many intervals goes offline
 * @param livenessCheckInterval  period of the liveness sweep
 * @param authCacheTtl           lifetime of a cached authorization verdict
 * @param commandTimeout         deadline for the reply to a centrally-initiated command
 * @param readRetryBackoff       backoff before the single retry of a failed storage read
 */
public record CentralSystemConfig(
    String host,
    int port,
    Duration heartbeatInterval,
    double missedHeartbeatFactor,
    Duration livenessCheckInterval,
    Duration authCacheTtl,
    Duration commandTimeout,
    Duration readRetryBackoff
) {
    public static final String HOST = "csms.host";
    public static final String PORT = "csms.port";
    public static final String HEARTBEAT_INTERVAL_SECONDS = "csms.heartbeat-interval-seconds";
    public static final String MISSED_HEARTBEAT_FACTOR = "csms.liveness.missed-heartbeat-factor";
    public static final String LIVENESS_CHECK_INTERVAL_SECONDS = "csms.liveness.check-interval-seconds";
    public static final String AUTH_CACHE_TTL_SECONDS = "csms.auth-cache.ttl-seconds";
    public static final String COMMAND_TIMEOUT_SECONDS = "csms.command.timeout-seconds";
    public static final String READ_RETRY_BACKOFF_MS = "csms.storage.read-retry-backoff-ms";

    private static final String DEFAULT_HOST = "0.0.0.0";
    private static final int DEFAULT_PORT = 9000;
    private static final int DEFAULT_HEARTBEAT_SECONDS = 300;
    private static final double DEFAULT_MISSED_HEARTBEAT_FACTOR = 2.5;
    private static final int DEFAULT_AUTH_CACHE_TTL_SECONDS = 60;
    private static final int DEFAULT_COMMAND_TIMEOUT_SECONDS = 30;
    private static final long DEFAULT_READ_RETRY_BACKOFF_MS = 100;

    /**
     * Compact constructor with validation.
     *
     * @throws ConfigurationException if a value is out of range
     */
    public CentralSystemConfig {
        Objects.requireNonNull(host, "host must not be null");
        if (port < 0 || port > 65_535) {
            throw new ConfigurationException("port must be within 0..65535, got: " + port);
        }
        requirePositive("heartbeatInterval", heartbeatInterval);
        if (!(missedHeartbeatFactor > 1.0)) {
            throw new ConfigurationException(
                "missedHeartbeatFactor must be greater than 1, got: " + missedHeartbeatFactor);
        }
        requirePositive("livenessCheckInterval", livenessCheckInterval);
        requirePositive("authCacheTtl", authCacheTtl);
        requirePositive("commandTimeout", commandTimeout);
        Objects.requireNonNull(readRetryBackoff, "readRetryBackoff must not be null");
        if (readRetryBackoff.isNegative()) {
            throw new ConfigurationException("readRetryBackoff must not be negative, got: " + readRetryBackoff);
        }
    }

    public static CentralSystemConfig defaults() {
        Duration heartbeat = Duration.ofSeconds(DEFAULT_HEARTBEAT_SECONDS);
        return new CentralSystemConfig(
            DEFAULT_HOST,
            DEFAULT_PORT,
            heartbeat,
            DEFAULT_MISSED_HEARTBEAT_FACTOR,
            heartbeat.dividedBy(3),
            Duration.ofSeconds(DEFAULT_AUTH_CACHE_TTL_SECONDS),
            Duration.ofSeconds(DEFAULT_COMMAND_TIMEOUT_SECONDS),
            Duration.ofMillis(DEFAULT_READ_RETRY_BACKOFF_MS)
        );
    }

    /**
     * Loads {@code csms.properties} with system property overrides.
     */
    public static CentralSystemConfig load() {
        return from(CsmsProperties.load());
    }

    public static CentralSystemConfig from(CsmsProperties properties) {
        Duration heartbeat = Duration.ofSeconds(
            properties.getLong(HEARTBEAT_INTERVAL_SECONDS, DEFAULT_HEARTBEAT_SECONDS));
        requirePositive("heartbeatInterval", heartbeat);

        // The sweep defaults to a third of whatever heartbeat interval was configured
        Duration check = properties.contains(LIVENESS_CHECK_INTERVAL_SECONDS)
            ? Duration.ofSeconds(properties.getLong(LIVENESS_CHECK_INTERVAL_SECONDS, 0))
            : heartbeat.dividedBy(3);

        return new CentralSystemConfig(
            properties.getString(HOST, DEFAULT_HOST),
            properties.getInt(PORT, DEFAULT_PORT),
            heartbeat,
            properties.getDouble(MISSED_HEARTBEAT_FACTOR, DEFAULT_MISSED_HEARTBEAT_FACTOR),
            check,
            Duration.ofSeconds(properties.getLong(AUTH_CACHE_TTL_SECONDS, DEFAULT_AUTH_CACHE_TTL_SECONDS)),
            Duration.ofSeconds(properties.getLong(COMMAND_TIMEOUT_SECONDS, DEFAULT_COMMAND_TIMEOUT_SECONDS)),
            Duration.ofMillis(properties.getLong(READ_RETRY_BACKOFF_MS, DEFAULT_READ_RETRY_BACKOFF_MS))
        );
    }

    /**
     * Time after the last inbound message at which a charge point is demoted to offline.
     */
    public Duration missedHeartbeatDeadline() {
        return Duration.ofMillis(Math.round(heartbeatInterval.toMillis() * missedHeartbeatFactor));
    }

    public CentralSystemConfig withCommandTimeout(Duration timeout) {
        return new CentralSystemConfig(host, port, heartbeatInterval, missedHeartbeatFactor,
            livenessCheckInterval, authCacheTtl, timeout, readRetryBackoff);
    }

    public CentralSystemConfig withReadRetryBackoff(Duration backoff) {
        return new CentralSystemConfig(host, port, heartbeatInterval, missedHeartbeatFactor,
            livenessCheckInterval, authCacheTtl, commandTimeout, backoff);
    }

    private static void requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isNegative() || value.isZero()) {
            throw new ConfigurationException(name + " must be positive, got: " + value);
        }
    }
}
