package io.dmart.sdk.client;

import io.dmart.sdk.connections.ConfigurableConnectionPool;
import io.dmart.sdk.connections.InvalidConfigException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * Settings of the shared connection pool and its sockets. Values come from {@code dmart-client.properties} on the
 * classpath when present; every key is optional:
 * <pre>
 *     dmart.http.connect-timeout-ms=10000
 *     dmart.http.read-timeout-ms=60000
 *     dmart.pool.max-connections=32
 *     dmart.pool.max-connections-per-endpoint=8
 *     dmart.pool.alive-time-ms=4000
 *     dmart.pool.max-wait-ms=10000
 *     dmart.pool.max-age-ms=7200000
 * </pre>
 * Setters validate their argument and return this, to allow chaining.
 */
public class ClientConfig {
    public static final String PROPERTIES_FILE = "dmart-client.properties";

    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(60);
    private int maxConnections = 32;
    private int maxConnectionsPerEndpoint = 8;
    private Duration aliveTime = Duration.ofSeconds(4);
    private Duration maxWait = Duration.ofSeconds(10);
    private Duration maxAge = Duration.ofHours(2);

    public ClientConfig() {
    }

    /**
     * Reads {@value #PROPERTIES_FILE} from the classpath. Missing file means defaults.
     * @return loaded config
     * @throws InvalidConfigException if a value is malformed or out of range
     */
    public static ClientConfig load() {
        Properties properties = new Properties();
        try(InputStream in = ClientConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if(in != null) properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + PROPERTIES_FILE, e);
        }
        return fromProperties(properties);
    }

    /**
     * @param properties source of the settings; keys which aren't present keep their defaults
     * @return new config
     * @throws InvalidConfigException if a value is malformed or out of range
     */
    public static ClientConfig fromProperties(Properties properties) {
        ClientConfig config = new ClientConfig();
        String value;
        if((value = properties.getProperty("dmart.http.connect-timeout-ms")) != null)
            config.setConnectTimeout(Duration.ofMillis(parse("dmart.http.connect-timeout-ms", value)));
        if((value = properties.getProperty("dmart.http.read-timeout-ms")) != null)
            config.setReadTimeout(Duration.ofMillis(parse("dmart.http.read-timeout-ms", value)));
        if((value = properties.getProperty("dmart.pool.max-connections")) != null)
            config.setMaxConnections(parseInt("dmart.pool.max-connections", value));
        if((value = properties.getProperty("dmart.pool.max-connections-per-endpoint")) != null)
            config.setMaxConnectionsPerEndpoint(parseInt("dmart.pool.max-connections-per-endpoint", value));
        if((value = properties.getProperty("dmart.pool.alive-time-ms")) != null)
            config.setAliveTime(Duration.ofMillis(parse("dmart.pool.alive-time-ms", value)));
        if((value = properties.getProperty("dmart.pool.max-wait-ms")) != null)
            config.setMaxWait(Duration.ofMillis(parse("dmart.pool.max-wait-ms", value)));
        if((value = properties.getProperty("dmart.pool.max-age-ms")) != null)
            config.setMaxAge(Duration.ofMillis(parse("dmart.pool.max-age-ms", value)));
        return config;
    }

    private static long parse(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigException(key + " must be a number, got " + value, e);
        }
    }

    private static int parseInt(String key, String value) {
        long parsed = parse(key, value);
        if(parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE)
            throw new InvalidConfigException(key + " is out of range: " + value);
        return (int) parsed;
    }

    private static Duration timeout(Duration value, String name) {
        if(value == null || value.toMillis() < 1 || value.toMillis() > Integer.MAX_VALUE)
            throw new InvalidConfigException(name + " must be between 1ms and " + Integer.MAX_VALUE + "ms");
        return value;
    }

    private static Duration positive(Duration value, String name) {
        if(value == null || value.isNegative() || value.isZero())
            throw new InvalidConfigException(name + " must be positive!");
        return value;
    }

    public ClientConfig setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = timeout(connectTimeout, "connectTimeout");
        return this;
    }
    public ClientConfig setReadTimeout(Duration readTimeout) {
        this.readTimeout = timeout(readTimeout, "readTimeout");
        return this;
    }
    public ClientConfig setMaxConnections(int maxConnections) {
        if(maxConnections < 1) throw new InvalidConfigException("maxConnections must be positive!");
        this.maxConnections = maxConnections;
        return this;
    }
    public ClientConfig setMaxConnectionsPerEndpoint(int maxConnectionsPerEndpoint) {
        if(maxConnectionsPerEndpoint < 1) throw new InvalidConfigException("maxConnectionsPerEndpoint must be positive!");
        this.maxConnectionsPerEndpoint = maxConnectionsPerEndpoint;
        return this;
    }
    /**
     * Keep this below the backend's keep-alive timeout, so idle sockets are dropped before the server drops them.
     */
    public ClientConfig setAliveTime(Duration aliveTime) {
        this.aliveTime = positive(aliveTime, "aliveTime");
        return this;
    }
    public ClientConfig setMaxWait(Duration maxWait) {
        this.maxWait = positive(maxWait, "maxWait");
        return this;
    }
    public ClientConfig setMaxAge(Duration maxAge) {
        this.maxAge = positive(maxAge, "maxAge");
        return this;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }
    public Duration getReadTimeout() {
        return readTimeout;
    }
    public int getMaxConnections() {
        return maxConnections;
    }
    public int getMaxConnectionsPerEndpoint() {
        return maxConnectionsPerEndpoint;
    }
    public Duration getAliveTime() {
        return aliveTime;
    }
    public Duration getMaxWait() {
        return maxWait;
    }
    public Duration getMaxAge() {
        return maxAge;
    }

    /**
     * @return configuration for a {@link ConfigurableConnectionPool} with these settings
     * @throws InvalidConfigException if per-endpoint limit is larger than the total one
     */
    public ConfigurableConnectionPool.Config toPoolConfig() {
        if(maxConnectionsPerEndpoint > maxConnections)
            throw new InvalidConfigException("maxConnectionsPerEndpoint can't exceed maxConnections");
        return new ConfigurableConnectionPool.Config(maxConnections, maxConnectionsPerEndpoint, aliveTime, maxWait)
                .setMaxAge(maxAge)
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout);
    }
}
