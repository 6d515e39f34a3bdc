package tech.bookverse.sdk.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response of the version listing endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VersionList(
    List<ApplicationVersion> versions
) {
    public VersionList {
        versions = versions != null ? List.copyOf(versions) : List.of();
    }
}
