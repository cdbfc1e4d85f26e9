package io.dmart.sdk.connections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.SocketFactory;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.*;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Represents a socket used for communicating with the network. Supports HTTP and HTTPS {@link Endpoint}s.
 * Socket and connection are used interchangeably.
 */
public class HttpSocket implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(HttpSocket.class);
    private static final int MAX_LINE_LENGTH = 64 * 1024;
    private static final int BUFFER_SIZE = 8192;
    /**
     * Largest response body this client reads, in bytes.
     */
    public static final int MAX_BODY_LENGTH = 64 * 1024 * 1024;

    private final Endpoint endpoint;
    private final Socket socket;
    private final BufferedInputStream input;
    private final OutputStream output;
    private final Object acquireLock = new Object();

    private volatile long openedAt;
    private volatile long lastUsedAt;
    private volatile boolean inUse;

    /**
     * Open a new socket to a given endpoint, using default timeouts.
     * @param endpoint endpoint for the socket
     * @throws IOException if connecting or the TLS handshake fails
     */
    public HttpSocket(Endpoint endpoint) throws IOException {
        this(endpoint, Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    /**
     * Open a new socket to a given endpoint.
     * @param endpoint endpoint for the socket
     * @param connectTimeout how long to wait for the TCP connection to be established
     * @param readTimeout how long a single read can block before {@link SocketTimeoutException} is thrown
     * @throws IOException if connecting or the TLS handshake fails
     */
    public HttpSocket(Endpoint endpoint, Duration connectTimeout, Duration readTimeout) throws IOException {
        this.endpoint = endpoint;
        this.socket = open(endpoint, connectTimeout, readTimeout);
        this.openedAt = System.currentTimeMillis();
        this.lastUsedAt = openedAt;
        this.input = new BufferedInputStream(socket.getInputStream());
        this.output = new BufferedOutputStream(socket.getOutputStream());
    }

    //0 means infinite for both connect and read timeouts, so it is never passed on
    private static int toMillis(Duration timeout) {
        long millis = timeout.toMillis();
        if(millis < 1 || millis > Integer.MAX_VALUE)
            throw new IllegalArgumentException("Timeout out of range: " + timeout);
        return (int) millis;
    }

    private static Socket open(Endpoint endpoint, Duration connectTimeout, Duration readTimeout) throws IOException {
        Socket plain = SocketFactory.getDefault().createSocket();
        try {
            plain.connect(new InetSocketAddress(endpoint.getHost(), endpoint.getPort()), toMillis(connectTimeout));
            plain.setSoTimeout(toMillis(readTimeout));
            plain.setKeepAlive(true);
            plain.setTcpNoDelay(true);
            if(!endpoint.isHttps()) return plain;
            //layering over the plain socket keeps the connect timeout and sends SNI for the host
            SSLSocket sslSocket = (SSLSocket) ((SSLSocketFactory) SSLSocketFactory.getDefault())
                    .createSocket(plain, endpoint.getHost(), endpoint.getPort(), true);
            sslSocket.startHandshake();
            return sslSocket;
        } catch (IOException e) {
            plain.close();
            throw e;
        }
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    /**
     * Get how long is this connection idling. Idle time is calculated as a duration between the time it was released
     * last time and this moment. If connection is in use, idling time is 0.
     * @return idling duration
     */
    public Duration getIdlingTime() {
        if(inUse) return Duration.ZERO;
        return Duration.ofMillis(System.currentTimeMillis() - lastUsedAt);
    }

    /**
     * Get how old is this socket. Age is calculated as duration between the time it was opened and this moment.
     * @return socket age
     */
    public Duration getAge() {
        return Duration.ofMillis(System.currentTimeMillis() - openedAt);
    }

    /**
     * Release the socket, allowing it to be used for other transactions. Releasing the socket does not close
     * the underlying connection with the server. Only release sockets whose last response was read completely.
     */
    public void release() {
        synchronized (acquireLock) {
            inUse = false;
            lastUsedAt = System.currentTimeMillis();
        }
    }

    /**
     * Acquires this connection if idle and not closed and returns true. Otherwise, returns false.
     * Connection must be acquired before writing to or reading from it.
     * @return whether the connection is acquired
     */
    //similar to read-modify-write; methods like "isAcquired" are inherently unsafe
    public boolean acquireIfIdle() {
        synchronized (acquireLock) {
            if(inUse || isClosed()) return false;
            inUse = true;
            return true;
        }
    }

    /**
     * Checks whether the server has closed (or written garbage to) this idle connection. Servers drop keep-alive
     * connections on their own schedule, and writing a request to such a socket only fails once the response
     * is read. Blocks for at most a millisecond.
     * @return true if the socket shouldn't be used anymore
     */
    public boolean isStale() {
        synchronized (acquireLock) {
            if(socket.isClosed() || socket.isInputShutdown() || socket.isOutputShutdown()) return true;
            int timeout = -1;
            try {
                if(input.available() > 0) return true; //unread leftovers of an earlier response
                timeout = socket.getSoTimeout();
                socket.setSoTimeout(1);
                input.read(); //either EOF (closed by server) or an unsolicited byte
                return true;
            } catch (SocketTimeoutException alive) {
                return false;
            } catch (IOException e) {
                log.debug("Connection to {} is unusable: {}", endpoint, e.getMessage());
                return true;
            } finally {
                restoreTimeout(timeout);
            }
        }
    }

    private void restoreTimeout(int timeout) {
        if(timeout < 0 || socket.isClosed()) return;
        try {
            socket.setSoTimeout(timeout);
        } catch (IOException e) {
            log.warn("Cannot restore read timeout on connection to {}; closing it", endpoint, e);
            closeQuietly();
        }
    }

    private void ensureAcquired() {
        if(!inUse) throw new IllegalStateException("Cannot use idling connection!");
    }

    /**
     * Write a string to the socket, encoded as UTF-8. This call is buffered; call {@link #flush()} to make sure
     * the bytes are sent.
     * @param s data to be sent
     */
    public void print(String s) throws IOException {
        write(s.getBytes(UTF_8));
    }

    /**
     * Write raw bytes to the socket. This call is buffered.
     * @param bytes data to be sent
     * @throws IOException if writing fails
     */
    public void write(byte[] bytes) throws IOException {
        ensureAcquired();
        output.write(bytes);
        lastUsedAt = System.currentTimeMillis();
    }

    /**
     * Flush the connection, sending the bytes to the server.
     */
    public void flush() throws IOException {
        ensureAcquired();
        output.flush();
        lastUsedAt = System.currentTimeMillis();
    }

    /**
     * Read a single byte from the server. This method is blocking (up to the read timeout).
     * @return next byte, or -1 if end of stream has been reached.
     * @throws IOException if reading fails or times out
     */
    public int read() throws IOException {
        ensureAcquired();
        lastUsedAt = System.currentTimeMillis();
        return input.read();
    }

    /**
     * Read a line from the server. Lines are terminated with <em>either</em> CRLF or just LF; the terminator is not
     * part of the returned line. This method should not be used for reading body of the response.
     * @return next line, possibly empty
     * @throws EOFException if the server closed the connection before a line was read
     * @throws IOException if reading fails or times out
     */
    //RFC 9112 only allows CRLF here, but bare LF is accepted as well
    public String readLine() throws IOException {
        ensureAcquired();
        ByteArrayOutputStream out = new ByteArrayOutputStream(64);
        int curr;
        while((curr = input.read()) != '\n') {
            if(curr == -1) {
                if(out.size() == 0) throw new EOFException("Connection closed by " + endpoint);
                break;
            }
            if(out.size() >= MAX_LINE_LENGTH) throw new InvalidResponseException("Header line too long");
            out.write(curr);
        }
        byte[] line = out.toByteArray();
        int len = line.length;
        if(len > 0 && line[len - 1] == '\r') len--;
        lastUsedAt = System.currentTimeMillis();
        return new String(line, 0, len, UTF_8);
    }

    /**
     * Read at most len bytes into the buffer, starting at offset. Number of read bytes is returned.
     * @param buf buffer used for storing read data
     * @param offset data is stored starting on this index
     * @param len maximum number of bytes to read
     * @return number of bytes read, or -1 on end of stream
     * @throws IOException if reading fails or times out
     */
    public int read(byte[] buf, int offset, int len) throws IOException {
        ensureAcquired();
        int ret = input.read(buf, offset, len);
        lastUsedAt = System.currentTimeMillis();
        return ret;
    }

    /**
     * Read exactly len bytes. Memory grows with the data actually received, not with the announced length.
     * @param len number of bytes to read
     * @return read bytes
     * @throws EOFException if the server closes the connection before len bytes arrive
     * @throws IOException if len exceeds {@link #MAX_BODY_LENGTH}
     */
    public byte[] readFully(long len) throws IOException {
        checkBodyLength(len);
        ByteArrayOutputStream data = new ByteArrayOutputStream((int) Math.min(len, BUFFER_SIZE));
        byte[] buf = new byte[BUFFER_SIZE];
        long off = 0;
        while(off < len) {
            int read = read(buf, 0, (int) Math.min(buf.length, len - off));
            if(read == -1) throw new EOFException("Expected " + len + " bytes, got " + off);
            data.write(buf, 0, read);
            off += read;
        }
        return data.toByteArray();
    }

    /**
     * Read until the server closes the connection. Used for responses without Content-Length which aren't chunked.
     * @return read bytes
     * @throws IOException if reading fails or the body grows over {@link #MAX_BODY_LENGTH}
     */
    public byte[] readToEnd() throws IOException {
        ensureAcquired();
        byte[] data = copyBounded(input);
        lastUsedAt = System.currentTimeMillis();
        return data;
    }

    /**
     * Read a body sent with Transfer-Encoding: chunked, including the trailer section.
     * @return body bytes, with chunk framing removed
     * @throws IOException if I/O exception occurs on underlying socket, chunks are malformed or the body grows
     *                     over {@link #MAX_BODY_LENGTH}
     */
    public byte[] readAllChunks() throws IOException {
        ensureAcquired();
        byte[] data = copyBounded(new ChunkedInputStream(input));
        lastUsedAt = System.currentTimeMillis();
        return data;
    }

    private static byte[] copyBounded(InputStream in) throws IOException {
        ByteArrayOutputStream body = new ByteArrayOutputStream(1024);
        byte[] buf = new byte[BUFFER_SIZE];
        long total = 0;
        int read;
        while((read = in.read(buf, 0, buf.length)) != -1) {
            total += read;
            checkBodyLength(total);
            body.write(buf, 0, read);
        }
        return body.toByteArray();
    }

    private static void checkBodyLength(long len) throws IOException {
        if(len < 0 || len > MAX_BODY_LENGTH)
            throw new IOException("Response body of " + len + " bytes is over the limit of " + MAX_BODY_LENGTH);
    }

    /**
     * Returns whether the underlying (and, by extension, this) socket is closed. You cannot write to nor read from
     * closed sockets.
     * @return true if socket is closed, false otherwise
     */
    public boolean isClosed() {
        return socket.isClosed();
    }

    /**
     * Close the connection to the server. After closing, socket cannot be re-acquired and no more data can be read
     * from or written to this socket.
     * @throws IOException if closing the socket fails
     */
    @Override
    public void close() throws IOException {
        release();
        socket.close();
    }

    void closeQuietly() {
        try {
            close();
        } catch (IOException e) {
            log.debug("Error while closing connection to {}", endpoint, e);
        }
    }
}
