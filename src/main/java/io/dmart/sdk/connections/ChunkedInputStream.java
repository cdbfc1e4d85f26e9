package io.dmart.sdk.connections;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * InputStream designed to read from HTTP chunked data (Transfer-Encoding: chunked), as described in RFC 9112.
 * Requires CRLF on all the right places, otherwise throws IOException. Use {@link #hasMoreChunks()} to see
 * whether more chunks are remaining and {@link #readChunk()} to read the next chunk. Chunk extensions are
 * ignored, trailers are read and discarded. Closing this stream doesn't close the underlying one.
 */
public class ChunkedInputStream extends InputStream {

    private final InputStream in;
    private long remaining = 0;
    private boolean closed = false;
    private boolean end = false;
    private boolean beginning = true;

    /**
     * @param socketStream input stream with data from server
     */
    public ChunkedInputStream(InputStream socketStream) {
        in = socketStream;
    }

    private void ensureOpen() throws IOException {
        if(closed) throw new IOException("Trying to read from closed stream!");
    }

    @Override
    public int read() throws IOException {
        ensureOpen();
        if(!hasMoreChunks()) return -1;
        int next = in.read();
        if(next == -1) throw new EOFException("Stream ended inside a chunk");
        remaining--;
        return next;
    }

    @Override
    public int read(byte[] buf, int off, int len) throws IOException {
        ensureOpen();
        if(len == 0) return 0;
        if(!hasMoreChunks()) return -1;
        int read = in.read(buf, off, (int) Math.min(len, remaining));
        if(read == -1) throw new EOFException("Stream ended inside a chunk");
        remaining -= read;
        return read;
    }

    private void enterChunk() throws IOException {
        if(!beginning) {
            int current = in.read(), next = in.read();
            if (!(current == '\r' && next == '\n')) throw new IOException("Ill-formed chunk: no CRLF at the end");
        }
        beginning = false;
        String sizeLine = readLine();
        int extension = sizeLine.indexOf(';');
        if(extension != -1) sizeLine = sizeLine.substring(0, extension);
        sizeLine = sizeLine.trim();
        if(sizeLine.isEmpty()) throw new IOException("Ill-formed chunk: missing size");
        long len;
        try {
            len = Long.parseLong(sizeLine, 16);
        } catch (NumberFormatException e) {
            throw new IOException("Ill-formed chunk size: " + sizeLine, e);
        }
        if(len < 0) throw new IOException("Negative chunk size: " + sizeLine);
        if(len > HttpSocket.MAX_BODY_LENGTH) throw new IOException("Chunk size over the body limit: " + sizeLine);
        if(len == 0) {
            end = true;
            while(!readLine().isEmpty()); //trailers, up to the final empty line
        }
        else remaining = len;
    }

    private String readLine() throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(16);
        int current;
        while((current = in.read()) != '\n') {
            if(current == -1) throw new EOFException("Stream ended inside chunk framing");
            if(current != '\r') line.write(current);
        }
        return line.toString(US_ASCII);
    }

    /**
     *
     * @return number of remaining bytes in current chunk
     */
    public long getRemaining() {
        return remaining;
    }

    /**
     * Reads bytes to the end of the chunk. Chunks are never larger than {@link HttpSocket#MAX_BODY_LENGTH}.
     * @return remaining bytes in current chunk
     * @throws IOException if the chunk can't be read completely
     */
    public byte[] readChunk() throws IOException {
        return readNBytes((int) getRemaining());
    }

    /**
     * Checks whether there are more chunks, and enters the next one if needed.
     * @return true if there are more chunks, false otherwise
     * @throws IOException if chunk framing is malformed
     */
    public boolean hasMoreChunks() throws IOException {
        if(remaining != 0) return true;
        if(end) return false;
        enterChunk();
        return !end;
    }

    @Override
    public int available() throws IOException {
        return (int) Math.min(in.available(), remaining);
    }

    @Override
    public void close() {
        closed = true;
    }
}
