package io.dmart.sdk.connections;

/**
 * Wrapper class for HTTP properties.
 */
public class Http {

    /**
     * Denotes a request method (i.e. "http verb"). Only the methods the dmart API uses are listed.
     */
    public enum Verb {
        GET("GET", false),
        POST("POST", true),
        PUT("PUT", true),
        PATCH("PATCH", true),
        DELETE("DELETE", false);

        private final String text;
        private final boolean expectsBody;

        Verb(String text, boolean expectsBody) {
            this.text = text;
            this.expectsBody = expectsBody;
        }

        /**
         * Whether servers expect a request body (or at least Content-Length: 0) with this method.
         * @return true if Content-Length should always be sent
         */
        public boolean expectsBody() {
            return expectsBody;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * HTTP version used for requests. This client speaks HTTP/1.1; 1.0 servers usually answer just fine.
     */
    public enum Version {
        HTTP10("HTTP/1.0"),
        HTTP11("HTTP/1.1");

        private final String text;

        Version(String text) {
            this.text = text;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * The only status code the dmart backend uses for success.
     */
    public static final int OK = 200;

    private Http() {
    }
}
