package org.example.sdkgraph.sdk;

import org.example.sdkgraph.exception.InvalidSdkRefException;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifies one SDK at one version.
 *
 * <p>An empty version means the unversioned, in-development SDK. A non-empty
 * version is either {@value #CURRENT} or a non-negative {@code int}.</p>
 */
public final class SdkRef {

    public static final char VERSION_SEPARATOR = '@';
    public static final String CURRENT = "current";

    /**
     * The reference of a module that is not a member of any SDK.
     */
    public static final SdkRef NONE = new SdkRef("", "");

    private static final Pattern VERSION_NUMBER = Pattern.compile("^[0-9]+$");

    private final String name;
    private final String version;

    private SdkRef(String name, String version) {
        this.name = name;
        this.version = version;
    }

    /**
     * Creates a reference, validating the version token.
     *
     * @throws InvalidSdkRefException if the name is empty or the version is invalid
     */
    public static SdkRef of(String name, String version) throws InvalidSdkRefException {
        Objects.requireNonNull(name, "name cannot be null");
        String v = version == null ? "" : version;
        String display = v.isEmpty() ? name : name + VERSION_SEPARATOR + v;
        if (name.isEmpty()) {
            throw new InvalidSdkRefException(display, quote(display) + " has an empty sdk name");
        }
        validateVersion(display, v);
        return new SdkRef(name, v);
    }

    /**
     * Parses {@code name} or {@code name@version}.
     *
     * @throws InvalidSdkRefException if the string has more than one separator,
     *                                an empty name, or an invalid version
     */
    public static SdkRef parse(String str) throws InvalidSdkRefException {
        Objects.requireNonNull(str, "sdk reference cannot be null");
        String[] tokens = str.split(Pattern.quote(String.valueOf(VERSION_SEPARATOR)), -1);
        if (tokens.length > 2) {
            throw new InvalidSdkRefException(str, quote(str) + " does not follow name@version syntax");
        }
        return of(tokens[0], tokens.length == 2 ? tokens[1] : "");
    }

    /**
     * Checks a version token: empty, {@value #CURRENT}, or a non-negative integer that
     * fits in an {@code int}.
     */
    public static boolean isValidVersion(String version) {
        return version.isEmpty() || CURRENT.equals(version) || isVersionNumber(version);
    }

    private static boolean isVersionNumber(String version) {
        if (!VERSION_NUMBER.matcher(version).matches()) {
            return false;
        }
        try {
            Integer.parseInt(version);
            return true;
        } catch (NumberFormatException e) {
            // out of range
            return false;
        }
    }

    private static void validateVersion(String input, String version) throws InvalidSdkRefException {
        if (!isValidVersion(version)) {
            throw new InvalidSdkRefException(input,
                    "version " + quote(version) + " is neither a number nor " + quote(CURRENT));
        }
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Returns true for the in-development SDK.
     */
    public boolean isUnversioned() {
        return version.isEmpty();
    }

    public boolean isNone() {
        return name.isEmpty();
    }

    private static String quote(String s) {
        return "\"" + s + "\"";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SdkRef that = (SdkRef) o;
        return name.equals(that.name) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version);
    }

    @Override
    public String toString() {
        return isUnversioned() ? name : name + VERSION_SEPARATOR + version;
    }
}
