package io.dmart.sdk.connections;

import java.util.HashMap;
import java.util.Map;


/**
 * Represents headers which are received from server or sent as a part of the request.
 * Header names are case-insensitive and stored lowercase.
 */
public class Headers extends HashMap<String, String> {

    @Override
    public String put(String key, String value) {
        return setHeader(key, value);
    }

    /**
     * Get value of the header identified by the name passed
     * @param header name of the header
     * @return value of the header, or null if it doesn't exist
     */
    public String getHeader(String header) {
        return get(header.toLowerCase());
    }

    /**
     * Put a new header, replacing the existing one if it exists. Header names are stored lowercase.
     * @param header name of the header
     * @param value value of the header
     * @return previous value of the header, or null if it didn't exist
     * @throws InvalidHeaderException if the name or the value can't be written to the wire as-is
     */
    public String setHeader(String header, String value) {
        checkHeader(header, value);
        return super.put(header.toLowerCase(), value);
    }

    /**
     * Append header value if the header with the same name already exists, or put a new header
     * if it doesn't. Header values are separated by a comma.
     * @param header name of the header
     * @param value value of the header
     * @return previous value of the header, or null if it didn't exist
     */
    public String appendHeader(String header, String value) {
        String existing = getHeader(header);
        if(existing != null) {
            return setHeader(header, existing + ", " + value);
        } else {
            return setHeader(header, value);
        }
    }

    /**
     * Append a raw header line, where header name and value are separated by a colon.
     * @param line header line
     * @return previous value of the header, or null if it didn't exist
     * @throws InvalidResponseException if there's no colon in the line
     */
    public String appendHeader(String line) {
        String[] tokens = line.split(":", 2);
        if(tokens.length != 2) throw new InvalidResponseException("Malformed header line: " + line);
        return appendHeader(tokens[0].trim(), tokens[1].trim());
    }

    /**
     * Remove a header if it exists.
     * @param header header name
     * @return previous value of the header, or null if it didn't exist
     */
    public String removeHeader(String header) {
        return remove(header.toLowerCase());
    }

    /**
     * Check whether header exists.
     * @param header header name
     * @return true if it exists, false otherwise
     */
    public boolean hasHeader(String header) {
        return containsKey(header.toLowerCase());
    }

    private static void checkHeader(String header, String value) {
        if(header == null || header.isEmpty()) throw new InvalidHeaderException("Empty header name");
        for(int i = 0; i < header.length(); i++) {
            char c = header.charAt(i);
            if(c <= ' ' || c >= 127 || c == ':') throw new InvalidHeaderException("Invalid header name " + header);
        }
        if(value == null) throw new InvalidHeaderException("Null value for header " + header);
        if(value.indexOf('\r') != -1 || value.indexOf('\n') != -1)
            throw new InvalidHeaderException("Line break in value of header " + header);
    }

    /**
     * Returns headers in format appropriate for sending, with trailing CRLF.
     * @return String representation of headers
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(size() * 32);
        for(Map.Entry<String, String> headers : entrySet()) {
            builder.append(headers.getKey()).append(": ").append(headers.getValue()).append("\r\n"); //Windows newline, ew
        }
        return builder.toString();
    }
}
