package tech.bookverse.sdk.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.bookverse.sdk.enums.ReleaseStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One published version of an application.
 *
 * <p>{@code version} is required; a registry item without one is rejected when the
 * response is parsed. Missing tags read as the empty string and missing properties
 * as an empty map.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApplicationVersion(
    String version,
    String tag,
    @JsonProperty("release_status") ReleaseStatus releaseStatus,
    Map<String, List<String>> properties,
    @JsonProperty("created") String createdAt
) {
    public ApplicationVersion {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Application version is missing 'version'");
        }
        tag = tag != null ? tag : "";
        releaseStatus = releaseStatus != null ? releaseStatus : ReleaseStatus.UNKNOWN;
        properties = properties != null ? Map.copyOf(properties) : Map.of();
    }

    public static ApplicationVersion of(String version, String tag, ReleaseStatus releaseStatus) {
        return new ApplicationVersion(version, tag, releaseStatus, Map.of(), null);
    }

    public boolean isProductionEligible() {
        return releaseStatus.isProductionEligible();
    }

    /**
     * First value of a list-valued property, if present and non-blank.
     */
    public Optional<String> firstPropertyValue(String key) {
        List<String> values = properties.get(key);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0)).filter(v -> !v.isBlank());
    }
}
