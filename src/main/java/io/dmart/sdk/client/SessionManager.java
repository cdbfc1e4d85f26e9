package io.dmart.sdk.client;

import io.dmart.sdk.connections.ConfigurableConnectionPool;
import io.dmart.sdk.connections.ConnectionPool;
import io.dmart.sdk.connections.HttpSocket;
import io.dmart.sdk.connections.HttpTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Owns the {@link ConnectionPool} every request goes through, and opens {@link HttpTransaction}s over it. The
 * pool is created on first use and lives as long as the manager; {@link #shared()} is the one most programs need,
 * so all {@link DmartService}s of a process share their sockets.
 * <br/>
 * Example with default values:
 * <pre>
 *     DmartService dmart = new DmartService("https://api.example.com", "alice", "secret");
 * </pre>
 * More customized example:
 * <pre>
 *     SessionManager session = new SessionManager(new ClientConfig().setMaxConnections(4));
 *     DmartService first = new DmartService(url, "alice", "secret", session);
 *     DmartService second = new DmartService(url, "bob", "secret", session);
 * </pre>
 */
public class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private static final class Holder {
        private static final SessionManager SHARED = new SessionManager(ClientConfig.load());
    }

    private final Supplier<? extends ConnectionPool> poolFactory;
    private ConnectionPool connectionPool; //guarded by this
    private int poolsCreated; //guarded by this

    /**
     * Create a manager whose pool is a {@link ConfigurableConnectionPool} with the given settings.
     * @param config pool and socket settings
     */
    public SessionManager(ClientConfig config) {
        this(() -> new ConfigurableConnectionPool(config.toPoolConfig()));
    }

    /**
     * Create a manager with a custom pool. The factory is called at most once.
     * @param poolFactory creates the pool on first use
     */
    public SessionManager(Supplier<? extends ConnectionPool> poolFactory) {
        if(poolFactory == null) throw new IllegalArgumentException("Pool factory can't be null");
        this.poolFactory = poolFactory;
    }

    /**
     * @return process-wide manager, configured from {@value ClientConfig#PROPERTIES_FILE}
     */
    public static SessionManager shared() {
        return Holder.SHARED;
    }

    /**
     * Get the pool, creating it on the first call. Every call returns the same instance, including concurrent
     * first calls.
     * @return pool used for obtaining {@link HttpSocket}s
     */
    public synchronized ConnectionPool acquirePool() {
        if(connectionPool == null) {
            ConnectionPool pool = poolFactory.get();
            if(pool == null) throw new IllegalStateException("Pool factory returned null");
            connectionPool = pool;
            poolsCreated++;
            log.debug("Created connection pool {}", pool);
        }
        return connectionPool;
    }

    /**
     * @return how many pools this manager has created; never more than 1
     */
    public synchronized int getPoolsCreated() {
        return poolsCreated;
    }

    /**
     * Create a new transaction over the pool. This step does not open the connection to server.
     * @return new {@link HttpTransaction} instance
     */
    public HttpTransaction newTransaction() {
        return new HttpTransaction(acquirePool());
    }
}
