package tech.bookverse.sdk.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Content of an application version: the sources it was built from and its releasables.
 * Both blocks are kept as the registry returns them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VersionContent(
    Object sources,
    Object releasables
) {
    public VersionContent {
        sources = sources != null ? sources : Map.of();
        releasables = releasables != null ? releasables : Map.of();
    }

    public static VersionContent empty() {
        return new VersionContent(null, null);
    }
}
