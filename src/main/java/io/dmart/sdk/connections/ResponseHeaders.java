package io.dmart.sdk.connections;

/**
 * Headers which are received from server. Provides helper functions for getting them.
 */
public class ResponseHeaders extends Headers {

    public String getConnection() {
        return getHeader("Connection");
    }
    public String getContentEncoding() {
        return getHeader("Content-Encoding");
    }
    public String getTransferEncoding() {
        return getHeader("Transfer-Encoding");
    } //oh god these headers are a mess
    public String getContentLength() {
        return getHeader("Content-Length");
    }
    public String getContentType() {
        return getHeader("Content-Type");
    }

    /**
     * @return media type from Content-Type, without parameters, or null if there's no Content-Type
     */
    public String getMIME() {
        String contentType = getContentType();
        if(contentType == null) return null;
        return contentType.split(";", 2)[0].trim().toLowerCase();
    }

    /**
     * @return whether the server asked for the connection to be closed after this response
     */
    public boolean isConnectionClose() {
        String connection = getConnection();
        return connection != null && connection.toLowerCase().contains("close");
    }

    /**
     * @return whether the body is sent with Transfer-Encoding: chunked
     */
    public boolean isChunked() {
        String encoding = getTransferEncoding();
        return encoding != null && encoding.toLowerCase().contains("chunked");
    }
}
