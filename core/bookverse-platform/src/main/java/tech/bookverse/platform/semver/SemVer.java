package tech.bookverse.platform.semver;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed semantic version.
 *
 * <p>Accepts {@code [v]MAJOR.MINOR.PATCH[-prerelease][+build]}. Numeric parts and
 * numeric prerelease identifiers must not carry leading zeros. Precedence follows
 * SemVer 2.0.0; build metadata does not take part in it.
 *
 * <p>Note: the natural ordering is inconsistent with {@code equals}. {@code 1.0.0},
 * {@code v1.0.0} and {@code 1.0.0+b.7} compare as 0 but are not equal, since
 * equality also covers {@code build} and {@code original}. Use {@link #compareTo}
 * when asking whether two versions have the same precedence.
 *
 * @param original the string this version was parsed from, untouched
 */
public record SemVer(
    BigInteger major,
    BigInteger minor,
    BigInteger patch,
    List<String> prerelease,
    String build,
    String original
) implements Comparable<SemVer> {

    private static final String NUMERIC = "0|[1-9]\\d*";
    private static final String PRERELEASE_ID = "(?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*)";

    private static final Pattern PATTERN = Pattern.compile(
        "^\\s*v?(?<major>" + NUMERIC + ")\\.(?<minor>" + NUMERIC + ")\\.(?<patch>" + NUMERIC + ")"
            + "(?:-(?<prerelease>" + PRERELEASE_ID + "(?:\\." + PRERELEASE_ID + ")*))?"
            + "(?:\\+(?<build>[0-9a-zA-Z-]+(?:\\.[0-9a-zA-Z-]+)*))?\\s*$"
    );

    public SemVer {
        prerelease = List.copyOf(prerelease);
    }

    /**
     * Parse a version string. Never throws; anything that is not a semantic version
     * yields an empty result.
     */
    public static Optional<SemVer> parse(String version) {
        if (version == null) {
            return Optional.empty();
        }
        Matcher m = PATTERN.matcher(version);
        if (!m.matches()) {
            return Optional.empty();
        }
        String pre = m.group("prerelease");
        return Optional.of(new SemVer(
            new BigInteger(m.group("major")),
            new BigInteger(m.group("minor")),
            new BigInteger(m.group("patch")),
            pre == null ? List.of() : Arrays.asList(pre.split("\\.")),
            m.group("build"),
            version
        ));
    }

    public boolean isPrerelease() {
        return !prerelease.isEmpty();
    }

    /**
     * The next patch release: {@code MAJOR.MINOR.(PATCH+1)}, without prerelease or build.
     */
    public String nextPatch() {
        return major + "." + minor + "." + patch.add(BigInteger.ONE);
    }

    @Override
    public int compareTo(SemVer other) {
        int c = major.compareTo(other.major);
        if (c != 0) {
            return Integer.signum(c);
        }
        c = minor.compareTo(other.minor);
        if (c != 0) {
            return Integer.signum(c);
        }
        c = patch.compareTo(other.patch);
        if (c != 0) {
            return Integer.signum(c);
        }

        // a release outranks any of its prereleases
        if (prerelease.isEmpty() || other.prerelease.isEmpty()) {
            return Boolean.compare(prerelease.isEmpty(), other.prerelease.isEmpty());
        }

        int shared = Math.min(prerelease.size(), other.prerelease.size());
        for (int i = 0; i < shared; i++) {
            c = compareIdentifiers(prerelease.get(i), other.prerelease.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.signum(Integer.compare(prerelease.size(), other.prerelease.size()));
    }

    private static int compareIdentifiers(String a, String b) {
        boolean aNumeric = isNumeric(a);
        boolean bNumeric = isNumeric(b);
        if (aNumeric && bNumeric) {
            return Integer.signum(new BigInteger(a).compareTo(new BigInteger(b)));
        }
        if (aNumeric != bNumeric) {
            return aNumeric ? -1 : 1;
        }
        return Integer.signum(a.compareTo(b));
    }

    private static boolean isNumeric(String identifier) {
        if (identifier.isEmpty()) {
            return false;
        }
        for (int i = 0; i < identifier.length(); i++) {
            if (!Character.isDigit(identifier.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return original;
    }
}
