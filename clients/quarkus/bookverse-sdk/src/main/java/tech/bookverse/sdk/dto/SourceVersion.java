package tech.bookverse.sdk.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reference to a version of another application, used as a source of an aggregate version.
 */
public record SourceVersion(
    @JsonProperty("application_key") String applicationKey,
    String version
) {}
