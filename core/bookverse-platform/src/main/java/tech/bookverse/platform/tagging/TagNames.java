package tech.bookverse.platform.tagging;

/**
 * Tag values and backup property keys understood by the tag reconciliation engine.
 */
public final class TagNames {

    public static final String LATEST = "latest";

    public static final String QUARANTINE_PREFIX = "quarantine-";

    /** Tag given back to a former latest version that has no recorded backup. */
    public static final String DEFAULT_RESTORE_TAG = "version";

    /** Property holding a version's tag from before it was made latest. */
    public static final String BACKUP_BEFORE_LATEST = "BACKUP_BEFORE_LATEST";

    /** Property holding a version's tag from before it was quarantined. */
    public static final String BACKUP_BEFORE_QUARANTINE = "BACKUP_BEFORE_QUARANTINE";

    private TagNames() {
    }

    public static boolean isQuarantined(String tag) {
        return tag != null && tag.startsWith(QUARANTINE_PREFIX);
    }

    public static boolean isLatest(String tag) {
        return LATEST.equals(tag);
    }

    public static String quarantineTag(String version) {
        return QUARANTINE_PREFIX + version;
    }
}
