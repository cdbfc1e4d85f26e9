package io.dmart.sdk.client;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the bearer token of one {@link DmartService}. The token is either absent or present; reads and writes are
 * atomic, so once the token is cleared no later call from any thread will send it.
 */
public class AuthTokenManager {
    private final AtomicReference<String> token = new AtomicReference<>();

    /**
     * @return current token, or null if not logged in
     */
    public String getToken() {
        return token.get();
    }

    public boolean hasToken() {
        return token.get() != null;
    }

    /**
     * @return current token
     * @throws DmartException of kind {@link ErrorKind#UNAUTHENTICATED} if there's no token
     */
    public String requireToken() throws DmartException {
        String current = token.get();
        if(current == null) throw DmartException.unauthenticated();
        return current;
    }

    /**
     * Replaces the token, e.g. after logging in again.
     * @param newToken new token; can't be empty
     * @throws IllegalArgumentException if the token can't be sent in an Authorization header
     */
    public void setToken(String newToken) {
        if(!isUsable(newToken)) throw new IllegalArgumentException("Token is empty or has characters not allowed in a header");
        token.set(newToken);
    }

    /**
     * Bearer tokens go into a header as-is, so only visible ASCII characters are accepted.
     * @param candidate token to check
     * @return whether the token is non-empty and made of visible ASCII characters only
     */
    public static boolean isUsable(String candidate) {
        if(candidate == null || candidate.isEmpty()) return false;
        for(int i = 0; i < candidate.length(); i++) {
            char c = candidate.charAt(i);
            if(c <= ' ' || c >= 127) return false;
        }
        return true;
    }

    public void clearToken() {
        token.set(null);
    }
}
