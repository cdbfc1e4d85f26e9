package io.dmart.sdk.connections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeoutException;

/**
 * Connection pool which can be configured using values in {@link Config}. Idle connections are kept alive and
 * reused for the same {@link Endpoint}; the number of open connections is bounded both in total and per endpoint.
 * New sockets are opened outside the pool lock, so a slow TLS handshake doesn't hold up other callers.
 */
public class ConfigurableConnectionPool implements ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(ConfigurableConnectionPool.class);

    /**
     * List of all open connections for each Endpoint
     */
    private final Map<Endpoint, List<HttpSocket>> connections = new HashMap<>();
    /**
     * Connections which are being opened right now, per Endpoint; they count towards the limits
     */
    private final Map<Endpoint, Integer> opening = new HashMap<>();
    private final Object lock = new Object();
    private volatile Config config;

    public ConfigurableConnectionPool(Config config) {
        this.config = config;
    }
    public ConfigurableConnectionPool() {
        this(new Config());
    }
    public ConfigurableConnectionPool(int maxConnections, int maxConnectionsPerEndpoint, Duration aliveTime, Duration maxWait) {
        this(new Config(maxConnections, maxConnectionsPerEndpoint, aliveTime, maxWait));
    }

    /**
     * Returns config for this connection pool. This method can be used to change parameters for this pool. Changes
     * apply to connections obtained afterwards.
     * @return config for this connection pool
     */
    public Config getConfig() {
        return config;
    }

    /**
     * Sets new config by replacing current config object. Changes apply to connections obtained afterwards.
     * @param config new config
     */
    public void setConfig(Config config) {
        if(config == null) throw new InvalidConfigException("config can't be null");
        this.config = config;
    }

    @Override
    public int getPoolSize() {
        synchronized (lock) {
            cleanupConnections();
            return countAll();
        }
    }

    @Override
    public HttpSocket getConnectionBlocking(Endpoint endpoint) throws IOException, TimeoutException {
        Config config = this.config;
        long deadline = System.nanoTime() + config.maxWait.toNanos(); //waiting for a lock counts as waiting
        while(true) {
            synchronized (lock) {
                cleanupConnections();
                HttpSocket idle = acquireIdle(endpoint);
                if(idle != null) return idle;
                if(hasCapacity(endpoint, config)) {
                    opening.merge(endpoint, 1, Integer::sum);
                    break;
                }
            }
            long left = deadline - System.nanoTime();
            if(left <= 0) throw new TimeoutException("Cannot obtain connection to " + endpoint + "; try again later.");
            try {
                Thread.sleep(Math.max(1, Math.min(config.waitTime.toMillis(), left / 1_000_000)));
            } catch (InterruptedException interrupt) {
                Thread.currentThread().interrupt();
                throw new TimeoutException("Interrupted while waiting for connection to " + endpoint);
            }
        }
        return openReserved(endpoint, config);
    }

    private HttpSocket openReserved(Endpoint endpoint, Config config) throws IOException {
        HttpSocket conn = null;
        try {
            conn = openSocket(endpoint, config);
            conn.acquireIfIdle();
            log.debug("Opened connection to {}", endpoint);
            return conn;
        } finally {
            synchronized (lock) {
                opening.merge(endpoint, -1, Integer::sum);
                if(conn != null) connections.computeIfAbsent(endpoint, e -> new ArrayList<>()).add(conn);
            }
        }
    }

    /**
     * Opens a new socket. Override to supply sockets from somewhere else.
     * @param endpoint endpoint to connect to
     * @param config pool config with timeouts
     * @return new, not yet acquired socket
     * @throws IOException if the connection can't be established
     */
    protected HttpSocket openSocket(Endpoint endpoint, Config config) throws IOException {
        return new HttpSocket(endpoint, config.connectTimeout, config.readTimeout);
    }

    private HttpSocket acquireIdle(Endpoint endpoint) {
        List<HttpSocket> pool = connections.get(endpoint);
        if(pool == null) return null;
        for(Iterator<HttpSocket> it = pool.iterator(); it.hasNext(); ) {
            HttpSocket conn = it.next();
            if(!conn.acquireIfIdle()) continue;
            if(conn.isStale()) {
                log.debug("Dropping stale connection to {}", endpoint);
                conn.closeQuietly();
                it.remove();
                continue;
            }
            return conn;
        }
        return null;
    }

    private boolean hasCapacity(Endpoint endpoint, Config config) {
        List<HttpSocket> pool = connections.get(endpoint);
        int forEndpoint = (pool == null ? 0 : pool.size()) + opening.getOrDefault(endpoint, 0);
        return forEndpoint < config.maxConnectionsPerEndpoint && countAll() < config.maxConnections;
    }

    private int countAll() {
        int count = 0;
        for(List<HttpSocket> conns : connections.values()) count += conns.size();
        for(int pending : opening.values()) count += pending;
        return count;
    }

    private void cleanupConnections() {
        Config config = this.config;
        for (Iterator<List<HttpSocket>> lists = connections.values().iterator(); lists.hasNext(); ) {
            List<HttpSocket> conns = lists.next();
            for (Iterator<HttpSocket> it = conns.iterator(); it.hasNext(); ) {
                HttpSocket conn = it.next();
                if (conn.isClosed()) {
                    it.remove();
                } else if ((conn.getIdlingTime().compareTo(config.aliveTime) > 0
                        || conn.getAge().compareTo(config.maxAge) > 0) && conn.acquireIfIdle()) {
                    //connections which are in use won't be closed regardless of age
                    conn.closeQuietly();
                    it.remove();
                }
            }
            if(conns.isEmpty()) lists.remove();
        }
    }


    public static class Config {
        private int maxConnections = 32;
        private int maxConnectionsPerEndpoint = 8;
        private Duration aliveTime = Duration.ofSeconds(30);
        private Duration maxWait = Duration.ofSeconds(10);
        private Duration maxAge = Duration.ofHours(2);
        private Duration waitTime = Duration.ofMillis(50);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);

        public Config() {
        }

        public Config(int maxConnections, int maxConnectionsPerEndpoint, Duration aliveTime, Duration maxWait) {
            setMaxConnections(maxConnections);
            setMaxConnectionsPerEndpoint(maxConnectionsPerEndpoint);
            setAliveTime(aliveTime);
            setMaxWait(maxWait);
        }

        private static Duration positive(Duration value, String name) {
            if(value == null || value.isNegative() || value.isZero())
                throw new InvalidConfigException(name + " must be positive!");
            return value;
        }

        //sockets take timeouts as int milliseconds, where 0 means no timeout at all
        private static Duration timeout(Duration value, String name) {
            if(value == null || value.toMillis() < 1 || value.toMillis() > Integer.MAX_VALUE)
                throw new InvalidConfigException(name + " must be between 1ms and " + Integer.MAX_VALUE + "ms");
            return value;
        }

        /**
         * Set maximum number of connections this pool can contain. If max is reached, client has to wait for one of the
         * connections to be freed so it can take it over.
         * @param maxConnections max number of connections
         * @return this, to allow chaining
         */
        public Config setMaxConnections(int maxConnections) {
            if(maxConnections < 1) throw new InvalidConfigException("maxConnections must be positive!");
            this.maxConnections = maxConnections;
            return this;
        }

        /**
         * Sets maximum number of connections which can be kept open to a single endpoint.
         * @param maxConnectionsPerEndpoint maximum connections per endpoint
         * @return this, to allow chaining
         */
        public Config setMaxConnectionsPerEndpoint(int maxConnectionsPerEndpoint) {
            if(maxConnectionsPerEndpoint < 1) throw new InvalidConfigException("maxConnectionsPerEndpoint must be positive!");
            this.maxConnectionsPerEndpoint = maxConnectionsPerEndpoint;
            return this;
        }

        /**
         * Sets maximum time connection can be alive and idling without being closed. If connection is idling for more
         * than aliveTime, it will be closed on the next occasion and won't be used again. Keep this below the server's
         * keep-alive timeout.
         * @param aliveTime maximum idling time
         * @return this, to allow chaining
         */
        public Config setAliveTime(Duration aliveTime) {
            this.aliveTime = positive(aliveTime, "aliveTime");
            return this;
        }

        /**
         * Sets maximum duration user can wait for connection. If user waits for connection for more than maxWait,
         * TimeoutException is thrown.
         * @param maxWait maximum wait time for connection
         * @return this, to allow chaining
         */
        public Config setMaxWait(Duration maxWait) {
            this.maxWait = positive(maxWait, "maxWait");
            return this;
        }

        /**
         * Sets maximum connection age. Age is calculated as a period between the time socket was opened and now. If
         * connection is older than maxAge, it will be closed on the next occasion and won't be used again. Connections
         * which are in use won't be closed regardless of age.
         * @param maxAge maximum age connection can live for
         * @return this, to allow chaining
         */
        public Config setMaxAge(Duration maxAge) {
            this.maxAge = positive(maxAge, "maxAge");
            return this;
        }

        /**
         * Sets duration which user spends sleeping while waiting for connection. When requesting connection, if none
         * are available, instead of entering a tight loop, user sleeps and periodically checks if any connection has
         * freed up.
         * @param waitTime how long the caller sleeps before checking if connection is available
         * @return this, to allow chaining
         */
        public Config setWaitTime(Duration waitTime) {
            this.waitTime = positive(waitTime, "waitTime");
            return this;
        }

        /**
         * @param connectTimeout how long opening a TCP connection may take
         * @return this, to allow chaining
         */
        public Config setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = timeout(connectTimeout, "connectTimeout");
            return this;
        }

        /**
         * @param readTimeout how long a single read from a connection may block
         * @return this, to allow chaining
         */
        public Config setReadTimeout(Duration readTimeout) {
            this.readTimeout = timeout(readTimeout, "readTimeout");
            return this;
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
        public Duration getWaitTime() {
            return waitTime;
        }
        public Duration getConnectTimeout() {
            return connectTimeout;
        }
        public Duration getReadTimeout() {
            return readTimeout;
        }
    }

}
