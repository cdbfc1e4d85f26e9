package io.dmart.sdk.client;

import io.dmart.sdk.model.NamePatterns;
import io.dmart.sdk.model.Record;

import java.nio.charset.StandardCharsets;

/**
 * Builds endpoint paths. Every interpolated value is checked and percent-encoded as UTF-8; slashes separating
 * subpath levels are kept.
 */
final class Paths {
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private Paths() {
    }

    /**
     * Percent-encodes everything except RFC 3986 unreserved characters.
     * @param value path segment
     * @return encoded segment
     */
    static String encodeSegment(String value) {
        StringBuilder out = new StringBuilder(value.length() + 16);
        for(byte b : value.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '.' || c == '_' || c == '~') {
                out.append((char) c);
            } else {
                out.append('%').append(HEX[c >> 4]).append(HEX[c & 0xF]);
            }
        }
        return out.toString();
    }

    static String space(String spaceName) {
        return encodeSegment(NamePatterns.defaults().checkShortname(spaceName));
    }

    static String shortname(String shortname) {
        return encodeSegment(NamePatterns.defaults().checkShortname(shortname));
    }

    /**
     * Normalizes the subpath like {@link Record} does and encodes each level. The root path stays "/".
     */
    static String subpath(String subpath) {
        String normalized = Record.normalizeSubpath(NamePatterns.defaults().checkSubpath(subpath));
        if(normalized.equals(Record.ROOT)) return normalized;
        String[] levels = normalized.split("/", -1);
        StringBuilder out = new StringBuilder(normalized.length() + 16);
        for(int i = 0; i < levels.length; i++) {
            if(i > 0) out.append('/');
            out.append(encodeSegment(levels[i]));
        }
        return out.toString();
    }
}
