package tech.bookverse.platform.manifest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * Deployable description of one platform release: which version of every
 * microservice it contains, and what those versions were built from.
 *
 * @param version            timestamp-derived manifest version, {@code yyyy.MM.dd.HHmmss} in UTC
 * @param platformAppVersion semantic version of the platform application, once known
 */
@JsonPropertyOrder({"version", "created_at", "source_stage", "applications", "provenance", "notes",
    "platform_app_version"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlatformManifest(
    String version,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("source_stage") String sourceStage,
    List<Application> applications,
    Provenance provenance,
    String notes,
    @JsonProperty("platform_app_version") String platformAppVersion
) {
    public PlatformManifest {
        applications = List.copyOf(applications);
    }

    public PlatformManifest withPlatformAppVersion(String appVersion) {
        return new PlatformManifest(version, createdAt, sourceStage, applications, provenance, notes, appVersion);
    }

    @JsonPropertyOrder({"application_key", "version", "sources", "releasables"})
    public record Application(
        @JsonProperty("application_key") String applicationKey,
        String version,
        Object sources,
        Object releasables
    ) {}

    public record Provenance(
        @JsonProperty("evidence_minimums") Map<String, Object> evidenceMinimums
    ) {
        /**
         * Signatures and SBOM evidence are collected by the registry itself; the manifest
         * only states that they must be present.
         */
        public static Provenance signaturesRequired() {
            return new Provenance(Map.of("signatures_present", true));
        }
    }
}
