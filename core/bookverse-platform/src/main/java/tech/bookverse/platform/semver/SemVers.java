package tech.bookverse.platform.semver;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordering helpers over version strings.
 */
public final class SemVers {

    private SemVers() {
    }

    /**
     * Compare two versions by SemVer precedence.
     *
     * @return -1, 0 or 1
     */
    public static int compare(SemVer a, SemVer b) {
        return a.compareTo(b);
    }

    /**
     * Sort version strings highest first. Strings that are not semantic versions are
     * dropped; equal versions keep their input order.
     */
    public static List<String> sortDescending(Collection<String> versions) {
        return sortDescending(versions, Function.identity());
    }

    /**
     * Sort items by the semantic version of a key, highest first. Items whose key does
     * not parse are dropped; items with equal versions keep their input order.
     */
    public static <T> List<T> sortDescending(Collection<T> items, Function<T, String> versionOf) {
        record Parsed<T>(SemVer semVer, T item) {}

        return items.stream()
            .map(item -> SemVer.parse(versionOf.apply(item)).map(sv -> new Parsed<>(sv, item)))
            .flatMap(Optional::stream)
            .sorted(Comparator.comparing((Parsed<T> p) -> p.semVer()).reversed())
            .map(Parsed::item)
            .toList();
    }

    /**
     * The item with the highest semantic version, ignoring items that do not parse.
     * On ties the first one in input order wins.
     */
    public static <T> Optional<T> highest(Collection<T> items, Function<T, String> versionOf) {
        List<T> sorted = sortDescending(items, versionOf);
        return sorted.isEmpty() ? Optional.empty() : Optional.of(sorted.get(0));
    }
}
