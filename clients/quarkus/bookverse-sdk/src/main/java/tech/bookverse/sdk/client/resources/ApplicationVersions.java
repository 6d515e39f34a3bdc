package tech.bookverse.sdk.client.resources;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import tech.bookverse.sdk.client.TrustRegistryClient;
import tech.bookverse.sdk.dto.ApplicationVersion;
import tech.bookverse.sdk.dto.SourceVersion;
import tech.bookverse.sdk.dto.VersionContent;
import tech.bookverse.sdk.dto.VersionList;

import java.util.List;
import java.util.Map;

import static tech.bookverse.sdk.client.TrustRegistryClient.pathSegment;

/**
 * Resource for the versions of an application.
 */
public class ApplicationVersions {

    private final TrustRegistryClient client;

    public ApplicationVersions(TrustRegistryClient client) {
        this.client = client;
    }

    /**
     * List versions of an application, newest created first, up to the configured page size.
     */
    public List<ApplicationVersion> list(String appKey) {
        return list(appKey, client.listLimit());
    }

    /**
     * List at most {@code limit} versions of an application, newest created first.
     */
    public List<ApplicationVersion> list(String appKey, int limit) {
        String endpoint = versionsPath(appKey)
            + "?limit=" + limit + "&order_by=created&order_asc=false";
        VersionList response = client.request("GET", endpoint, null, new TypeReference<VersionList>() {});
        return response != null ? response.versions() : List.of();
    }

    /**
     * Update the tag and/or properties of one version.
     */
    public void patch(String appKey, String version, PatchVersionRequest request) {
        client.requestVoid("PATCH", versionsPath(appKey) + "/" + pathSegment(version), request);
    }

    /**
     * Get the sources and releasables of one version.
     */
    public VersionContent content(String appKey, String version) {
        VersionContent response = client.request("GET",
            versionsPath(appKey) + "/" + pathSegment(version) + "/content",
            null, new TypeReference<VersionContent>() {});
        return response != null ? response : VersionContent.empty();
    }

    /**
     * Create a version assembled from versions of other applications.
     *
     * @return the raw registry response
     */
    public Map<String, Object> create(String appKey, CreateVersionRequest request) {
        Map<String, Object> response = client.request("POST", versionsPath(appKey), request,
            new TypeReference<Map<String, Object>>() {});
        return response != null ? response : Map.of();
    }

    private static String versionsPath(String appKey) {
        return "/applications/" + pathSegment(appKey) + "/versions";
    }

    // Request DTOs

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PatchVersionRequest(
        String tag,
        Map<String, List<String>> properties,
        @JsonProperty("delete_properties") List<String> deleteProperties
    ) {}

    public record CreateVersionRequest(
        String version,
        Sources sources
    ) {
        public static CreateVersionRequest of(String version, List<SourceVersion> sourceVersions) {
            return new CreateVersionRequest(version, new Sources(List.copyOf(sourceVersions)));
        }
    }

    public record Sources(
        List<SourceVersion> versions
    ) {}
}
