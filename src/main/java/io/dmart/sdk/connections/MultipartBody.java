package io.dmart.sdk.connections;

import java.io.ByteArrayOutputStream;
import java.util.concurrent.ThreadLocalRandom;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Builds a multipart/form-data request body in memory. Parts are written in the order they're added.
 */
public class MultipartBody {
    private final String boundary;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream(1024);
    private boolean finished = false;

    public MultipartBody() {
        this("----DmartBoundary" + System.currentTimeMillis() + Long.toHexString(ThreadLocalRandom.current().nextLong()));
    }

    /**
     * @param boundary boundary separating the parts; must not occur inside any part
     */
    public MultipartBody(String boundary) {
        if(boundary == null || boundary.isEmpty() || boundary.length() > 70)
            throw new InvalidRequestException("Invalid multipart boundary");
        this.boundary = boundary;
    }

    public String getBoundary() {
        return boundary;
    }

    /**
     * @return value for the Content-Type header of the request carrying this body
     */
    public String getContentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    /**
     * Adds a plain form field.
     * @param name field name
     * @param value field value, written as UTF-8
     * @return this, to allow chaining
     */
    public MultipartBody addField(String name, String value) {
        writePart("Content-Disposition: form-data; name=\"" + escape(name) + "\"\r\n\r\n", value.getBytes(UTF_8));
        return this;
    }

    /**
     * Adds a file part.
     * @param name field name
     * @param fileName file name reported to the server
     * @param contentType media type of the file
     * @param data file contents
     * @return this, to allow chaining
     */
    public MultipartBody addFile(String name, String fileName, String contentType, byte[] data) {
        writePart("Content-Disposition: form-data; name=\"" + escape(name) + "\"; filename=\"" + escape(fileName) + "\"\r\n"
                + "Content-Type: " + contentType + "\r\n\r\n", data);
        return this;
    }

    private void writePart(String head, byte[] data) {
        if(finished) throw new IllegalStateException("Multipart body is already finished");
        out.writeBytes(("--" + boundary + "\r\n").getBytes(UTF_8));
        out.writeBytes(head.getBytes(UTF_8));
        out.writeBytes(data);
        out.writeBytes("\r\n".getBytes(UTF_8));
    }

    private static String escape(String value) {
        if(value.indexOf('\r') != -1 || value.indexOf('\n') != -1)
            throw new InvalidRequestException("Line break in multipart header: " + value);
        return value.replace("\"", "%22");
    }

    /**
     * Writes the closing boundary and returns the whole body. No parts can be added afterwards.
     * @return encoded body
     */
    public byte[] build() {
        if(!finished) {
            out.writeBytes(("--" + boundary + "--\r\n").getBytes(UTF_8));
            finished = true;
        }
        return out.toByteArray();
    }
}
