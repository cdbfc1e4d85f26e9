package io.dmart.sdk.connections;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * Endpoint to which pooled connections are opened. Consists of host, port and scheme. Host names are
 * resolved when a socket is opened, not when the endpoint is created.
 */
public class Endpoint {
    private final String host;
    private final int port;
    private final boolean https;

    /**
     * Create a new endpoint
     * @param host hostname of the server
     * @param port port on which to connect (e.g. 80 for HTTP, 443 for HTTPS)
     * @param isHttps should the connection be over TLS
     */
    public Endpoint(String host, int port, boolean isHttps) {
        if(host == null || host.isEmpty()) throw new InvalidRequestException("Host can't be empty!");
        if(port < 1 || port > 65535) throw new InvalidRequestException("Invalid port " + port);
        this.host = host;
        this.port = port;
        this.https = isHttps;
    }

    /**
     * Create Endpoint from an address passed as string
     * @param address address to which this endpoint should point
     * @return new Endpoint for the given address
     * @throws MalformedURLException if address is malformed
     */
    public static Endpoint fromUrl(String address) throws MalformedURLException {
        try {
            return fromUri(new URI(address));
        } catch (URISyntaxException e) {
            throw new MalformedURLException(e.getMessage());
        }
    }

    /**
     * Create Endpoint from URI passed. If not present, port will be inferred from scheme.
     * @param uri URI to which this endpoint should point
     * @return new Endpoint for given address
     * @throws MalformedURLException if scheme is neither http nor https, or host is missing
     */
    public static Endpoint fromUri(URI uri) throws MalformedURLException {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();
        if(!scheme.equals("http") && !scheme.equals("https"))
            throw new MalformedURLException("Unknown protocol: " + uri.getScheme());
        if(uri.getHost() == null) throw new MalformedURLException("No host in " + uri);
        int port = uri.getPort();
        if(port == -1) port = scheme.equals("https") ? 443 : 80;
        return new Endpoint(uri.getHost(), port, scheme.equals("https"));
    }

    public String getHost() {
        return host;
    }
    public int getPort() {
        return port;
    }
    public boolean isHttps() {
        return https;
    }

    /**
     * Value of the Host header for requests to this endpoint; default ports are omitted.
     * @return host, with port if it isn't the default one for the scheme
     */
    public String getHostHeader() {
        if((https && port == 443) || (!https && port == 80)) return host;
        return host + ":" + port;
    }

    @Override
    public boolean equals(Object obj) {
        if(!(obj instanceof Endpoint)) return false;
        Endpoint other = (Endpoint)obj;
        return port == other.port && https == other.https && host.equalsIgnoreCase(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host.toLowerCase(), port, https);
    }

    @Override
    public String toString() {
        return (https ? "https://" : "http://") + host + ":" + port;
    }
}
