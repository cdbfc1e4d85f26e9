package io.dmart.sdk.connections;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPOutputStream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

public class ContentEncodingTest {
    private static final byte[] TEXT = "{\"status\":\"success\",\"records\":[]}".getBytes(UTF_8);

    @Test
    public void gzip() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(TEXT);
        }
        assertArrayEquals(TEXT, ContentEncoding.decompress(out.toByteArray(), "gzip"));
        assertArrayEquals(TEXT, ContentEncoding.decompress(out.toByteArray(), " GZIP "));
    }

    @Test
    public void deflate() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DeflaterOutputStream deflate = new DeflaterOutputStream(out)) {
            deflate.write(TEXT);
        }
        assertArrayEquals(TEXT, ContentEncoding.decompress(out.toByteArray(), "deflate"));
    }

    @Test
    public void passThrough() throws IOException {
        assertSame(TEXT, ContentEncoding.decompress(TEXT, null));
        assertSame(TEXT, ContentEncoding.decompress(TEXT, "identity"));
        assertSame(TEXT, ContentEncoding.decompress(TEXT, "br"));
    }

    @Test
    public void corruptData() {
        assertThrows(IOException.class, () -> ContentEncoding.decompress(TEXT, "gzip"));
    }
}
