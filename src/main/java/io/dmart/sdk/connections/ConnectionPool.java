package io.dmart.sdk.connections;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Provides connections to the client. Connections == {@link HttpSocket}s. Implementations must be safe to use
 * from many threads at once.
 */
public interface ConnectionPool {
    /**
     * Get connection to a given endpoint and block the thread while waiting. If timeout is reached, exception is thrown.
     * Obtaining connections <em>does not</em> have to be on first-come first-serve basis. The returned connection is
     * acquired; release or close it when done.
     * @param endpoint endpoint to which connection should go
     * @return HttpSocket to the endpoint
     * @throws IOException if a new connection can't be opened
     * @throws TimeoutException if no free connections are available after timeout duration has passed
     */
    HttpSocket getConnectionBlocking(Endpoint endpoint) throws IOException, TimeoutException;

    /**
     * @return number of open connections currently in pool, busy or idle
     */
    int getPoolSize();
}
