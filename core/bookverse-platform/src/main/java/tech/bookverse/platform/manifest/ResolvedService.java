package tech.bookverse.platform.manifest;

import tech.bookverse.sdk.dto.SourceVersion;

/**
 * A service together with the version chosen for the platform.
 */
public record ResolvedService(
    String name,
    String appKey,
    String version
) {
    public ResolvedService withVersion(String overriddenVersion) {
        return new ResolvedService(name, appKey, overriddenVersion);
    }

    public SourceVersion toSourceVersion() {
        return new SourceVersion(appKey, version);
    }
}
