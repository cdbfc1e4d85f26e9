package io.dmart.sdk.connections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Decodes response bodies sent with Content-Encoding. Only gzip and deflate are supported, since those are the only
 * ones {@link RequestHeaders#createDefault()} advertises.
 */
public final class ContentEncoding {
    private static final Logger log = LoggerFactory.getLogger(ContentEncoding.class);

    private ContentEncoding() {
    }

    /**
     * Decompresses gzip- or deflate-encoded byte array. If encoding is "identity" or null, the data array is
     * returned. Unknown encodings are returned as-is, with a warning.
     * @param data data to decompress
     * @param encoding value of the Content-Encoding header
     * @return decompressed bytes
     * @throws IOException if the data isn't valid for the given encoding
     */
    public static byte[] decompress(byte[] data, String encoding) throws IOException {
        if(encoding == null) return data;
        encoding = encoding.trim().toLowerCase();
        if(encoding.isEmpty() || encoding.equals("identity") || data.length == 0) {
            return data;
        } else if(encoding.equals("gzip") || encoding.equals("x-gzip") || encoding.equals("deflate")) {
            ByteArrayInputStream bytein = new ByteArrayInputStream(data);
            InputStream compressed;
            if(encoding.equals("deflate")) compressed = new InflaterInputStream(bytein, new Inflater(false), 512);
            else compressed = new GZIPInputStream(bytein);
            try(compressed) {
                return compressed.readAllBytes();
            }
        } else {
            log.warn("Ignoring unknown content encoding {}", encoding);
            return data;
        }
    }
}
