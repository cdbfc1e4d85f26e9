package io.dmart.sdk.client;

import io.dmart.sdk.connections.ConfigurableConnectionPool;
import io.dmart.sdk.connections.ConnectionPool;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

public class SessionManagerTest {

    /**
     * Many threads asking for the pool at once still end up with a single one.
     */
    @Test
    public void concurrentFirstUse() throws Exception {
        AtomicInteger created = new AtomicInteger();
        SessionManager session = new SessionManager(() -> {
            created.incrementAndGet();
            return new ConfigurableConnectionPool();
        });
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ConnectionPool>> pools = new ArrayList<>();
        for(int i = 0; i < 16; i++) {
            pools.add(executor.submit(() -> {
                start.await();
                return session.acquirePool();
            }));
        }
        start.countDown();
        ConnectionPool first = pools.get(0).get(5, TimeUnit.SECONDS);
        for(Future<ConnectionPool> pool : pools) {
            assertSame(first, pool.get(5, TimeUnit.SECONDS));
        }
        executor.shutdown();
        assertEquals(1, created.get());
        assertEquals(1, session.getPoolsCreated());
    }

    @Test
    public void lazyCreation() {
        SessionManager session = new SessionManager(new ClientConfig());
        assertEquals(0, session.getPoolsCreated());
        assertNotNull(session.newTransaction());
        assertEquals(1, session.getPoolsCreated());
    }

    @Test
    public void factoryReturnsNull() {
        SessionManager session = new SessionManager(() -> null);
        assertThrows(IllegalStateException.class, session::acquirePool);
        assertEquals(0, session.getPoolsCreated());
        assertThrows(IllegalArgumentException.class, () -> new SessionManager((Supplier<ConnectionPool>) null));
    }

    @Test
    public void sharedInstance() {
        assertSame(SessionManager.shared(), SessionManager.shared());
        assertSame(SessionManager.shared().acquirePool(), SessionManager.shared().acquirePool());
    }
}
