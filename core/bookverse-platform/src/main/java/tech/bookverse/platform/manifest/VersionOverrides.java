package tech.bookverse.platform.manifest;

import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Manual {@code SERVICE=VERSION} pins that replace resolved versions.
 */
public final class VersionOverrides {

    private static final Logger LOG = Logger.getLogger(VersionOverrides.class);

    private final Map<String, String> byService;

    private VersionOverrides(Map<String, String> byService) {
        this.byService = Collections.unmodifiableMap(byService);
    }

    public static VersionOverrides none() {
        return new VersionOverrides(new LinkedHashMap<>());
    }

    /**
     * Parse {@code SERVICE=VERSION} entries. Malformed entries are logged and skipped;
     * a later entry for the same service wins.
     */
    public static VersionOverrides parse(List<String> entries) {
        Map<String, String> parsed = new LinkedHashMap<>();
        if (entries == null) {
            return new VersionOverrides(parsed);
        }
        for (String entry : entries) {
            int eq = entry == null ? -1 : entry.indexOf('=');
            if (eq < 0) {
                LOG.warnf("Ignoring malformed override: %s", entry);
                continue;
            }
            String service = entry.substring(0, eq).trim();
            String version = entry.substring(eq + 1).trim();
            if (service.isEmpty() || version.isEmpty()) {
                LOG.warnf("Ignoring malformed override: %s", entry);
                continue;
            }
            parsed.put(service, version);
        }
        return new VersionOverrides(parsed);
    }

    public List<ResolvedService> applyTo(List<ResolvedService> services) {
        if (byService.isEmpty()) {
            return services;
        }
        return services.stream()
            .map(s -> {
                String pinned = byService.get(s.name());
                if (pinned == null) {
                    return s;
                }
                LOG.infof("Overriding %s: %s -> %s", s.name(), s.version(), pinned);
                return s.withVersion(pinned);
            })
            .toList();
    }
}
