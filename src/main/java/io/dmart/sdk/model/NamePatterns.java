package io.dmart.sdk.model;

import io.dmart.sdk.connections.InvalidConfigException;
import io.dmart.sdk.connections.InvalidRequestException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Identifier rules for shortnames and subpaths. Both allow ASCII letters and digits, underscore, and one extra
 * alphabet with its native digits; subpaths additionally allow '/'. The extra ranges are locale data, read from
 * {@code dmart-client.properties} ({@code dmart.names.letters}, {@code dmart.names.digits}) and defaulting to Arabic.
 */
public final class NamePatterns {
    public static final String PROPERTIES_FILE = "dmart-client.properties";
    public static final String LETTERS_KEY = "dmart.names.letters";
    public static final String DIGITS_KEY = "dmart.names.digits";
    public static final String DEFAULT_LETTERS = "\u0621-\u064A";
    public static final String DEFAULT_DIGITS = "\u0660-\u0669";

    private static final class Holder {
        private static final NamePatterns DEFAULTS = fromProperties(loadProperties());
    }

    private final Pattern shortname;
    private final Pattern subpath;

    /**
     * @param letters character class ranges for the extra alphabet, e.g. {@link #DEFAULT_LETTERS}
     * @param digits character class ranges for its digits
     * @throws InvalidConfigException if the ranges don't form a valid character class
     */
    public NamePatterns(String letters, String digits) {
        if(letters == null || digits == null) throw new InvalidConfigException("Name ranges can't be null");
        if(letters.contains("]") || digits.contains("]") || letters.contains("[") || digits.contains("["))
            throw new InvalidConfigException("Name ranges can't contain brackets: " + letters + " " + digits);
        String chars = "a-zA-Z" + letters + "0-9" + digits + "_";
        try {
            this.shortname = Pattern.compile("^[" + chars + "]{1,64}$");
            this.subpath = Pattern.compile("^[" + chars + "/]{1,128}$");
        } catch (PatternSyntaxException e) {
            throw new InvalidConfigException("Invalid name ranges: " + letters + " " + digits, e);
        }
    }

    /**
     * Patterns from the classpath configuration, loaded once.
     * @return shared default patterns
     */
    public static NamePatterns defaults() {
        return Holder.DEFAULTS;
    }

    public static NamePatterns fromProperties(Properties properties) {
        return new NamePatterns(properties.getProperty(LETTERS_KEY, DEFAULT_LETTERS),
                properties.getProperty(DIGITS_KEY, DEFAULT_DIGITS));
    }

    private static Properties loadProperties() {
        Properties properties = new Properties();
        try(InputStream in = NamePatterns.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if(in != null) properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + PROPERTIES_FILE, e);
        }
        return properties;
    }

    public Pattern getShortnamePattern() {
        return shortname;
    }
    public Pattern getSubpathPattern() {
        return subpath;
    }

    public boolean isValidShortname(String value) {
        return value != null && shortname.matcher(value).matches();
    }
    public boolean isValidSubpath(String value) {
        return value != null && subpath.matcher(value).matches();
    }

    /**
     * @param value shortname to check
     * @return the same shortname
     * @throws InvalidRequestException if the shortname doesn't match
     */
    public String checkShortname(String value) {
        if(!isValidShortname(value)) throw new InvalidRequestException("Invalid shortname: " + value);
        return value;
    }

    /**
     * @param value subpath to check
     * @return the same subpath
     * @throws InvalidRequestException if the subpath doesn't match
     */
    public String checkSubpath(String value) {
        if(!isValidSubpath(value)) throw new InvalidRequestException("Invalid subpath: " + value);
        return value;
    }
}
