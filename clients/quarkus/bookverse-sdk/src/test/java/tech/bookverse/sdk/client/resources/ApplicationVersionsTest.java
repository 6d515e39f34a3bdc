package tech.bookverse.sdk.client.resources;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.bookverse.sdk.TestTrustRegistryConfig;
import tech.bookverse.sdk.client.TrustRegistryClient;
import tech.bookverse.sdk.client.auth.AccessTokenManager;
import tech.bookverse.sdk.client.resources.ApplicationVersions.CreateVersionRequest;
import tech.bookverse.sdk.client.resources.ApplicationVersions.PatchVersionRequest;
import tech.bookverse.sdk.dto.ApplicationVersion;
import tech.bookverse.sdk.dto.SourceVersion;
import tech.bookverse.sdk.dto.VersionContent;
import tech.bookverse.sdk.enums.ReleaseStatus;
import tech.bookverse.sdk.exception.TrustRegistryException;

import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.*;

class ApplicationVersionsTest {

    private static final String APP = "bookverse-inventory";
    private static final String VERSIONS_PATH = "/applications/" + APP + "/versions";

    private WireMockServer server;
    private ApplicationVersions versions;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        TestTrustRegistryConfig config = TestTrustRegistryConfig.withToken(server.baseUrl(), "test-token");
        versions = new TrustRegistryClient(config, new AccessTokenManager(config)).applicationVersions();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    // ========================================
    // LIST
    // ========================================

    @Test
    @DisplayName("list should request newest-created first with the default page size")
    void list_shouldRequestNewestFirst() {
        server.stubFor(get(urlPathEqualTo(VERSIONS_PATH))
            .willReturn(okJson("{\"versions\": []}")));

        versions.list(APP);

        server.verify(getRequestedFor(urlPathEqualTo(VERSIONS_PATH))
            .withQueryParam("limit", equalTo("200"))
            .withQueryParam("order_by", equalTo("created"))
            .withQueryParam("order_asc", equalTo("false")));
    }

    @Test
    @DisplayName("list should use the configured page size")
    void list_shouldUseConfiguredListLimit() {
        server.stubFor(get(urlPathEqualTo(VERSIONS_PATH))
            .willReturn(okJson("{\"versions\": []}")));
        TestTrustRegistryConfig config = TestTrustRegistryConfig.withToken(server.baseUrl(), "test-token")
            .withListLimit(500);

        new TrustRegistryClient(config, new AccessTokenManager(config)).applicationVersions().list(APP);

        server.verify(getRequestedFor(urlPathEqualTo(VERSIONS_PATH))
            .withQueryParam("limit", equalTo("500")));
    }

    @Test
    @DisplayName("list should parse tags, statuses and list-valued properties")
    void list_shouldParseVersions() {
        server.stubFor(get(urlPathEqualTo(VERSIONS_PATH))
            .willReturn(okJson("""
                {
                  "versions": [
                    {
                      "version": "1.4.0",
                      "tag": "latest",
                      "release_status": "TRUSTED_RELEASE",
                      "created": "2024-05-01T10:00:00Z",
                      "properties": {"original_tag_before_latest": ["stable"]},
                      "created_by": "ci"
                    },
                    {
                      "version": "1.3.0",
                      "release_status": "released"
                    },
                    {
                      "version": "1.5.0-rc.1",
                      "tag": "candidate",
                      "release_status": "SOMETHING_NEW"
                    }
                  ]
                }
                """)));

        List<ApplicationVersion> result = versions.list(APP);

        assertThat(result).extracting(ApplicationVersion::version)
            .containsExactly("1.4.0", "1.3.0", "1.5.0-rc.1");

        ApplicationVersion latest = result.get(0);
        assertThat(latest.tag()).isEqualTo("latest");
        assertThat(latest.releaseStatus()).isEqualTo(ReleaseStatus.TRUSTED_RELEASE);
        assertThat(latest.createdAt()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(latest.firstPropertyValue("original_tag_before_latest")).contains("stable");

        assertThat(result.get(1).tag()).isEmpty();
        assertThat(result.get(1).releaseStatus()).isEqualTo(ReleaseStatus.RELEASED);
        assertThat(result.get(1).properties()).isEmpty();

        assertThat(result.get(2).releaseStatus()).isEqualTo(ReleaseStatus.UNKNOWN);
        assertThat(result.get(2).isProductionEligible()).isFalse();
    }

    @Test
    @DisplayName("list should return empty when the response has no versions field")
    void list_shouldReturnEmpty_whenVersionsMissing() {
        server.stubFor(get(urlPathEqualTo(VERSIONS_PATH))
            .willReturn(okJson("{}")));

        assertThat(versions.list(APP)).isEmpty();
    }

    @Test
    @DisplayName("list should reject an item without a version")
    void list_shouldFail_whenItemHasNoVersion() {
        server.stubFor(get(urlPathEqualTo(VERSIONS_PATH))
            .willReturn(okJson("{\"versions\": [{\"tag\": \"latest\", \"release_status\": \"RELEASED\"}]}")));

        assertThatThrownBy(() -> versions.list(APP))
            .isExactlyInstanceOf(TrustRegistryException.class)
            .hasMessage("Failed to parse response");
    }

    @Test
    @DisplayName("list with a limit should pass it through")
    void list_shouldPassLimit() {
        server.stubFor(get(urlPathEqualTo(VERSIONS_PATH))
            .willReturn(okJson("{\"versions\": [{\"version\": \"2.0.0\"}]}")));

        assertThat(versions.list(APP, 1)).extracting(ApplicationVersion::version).containsExactly("2.0.0");
        server.verify(getRequestedFor(urlPathEqualTo(VERSIONS_PATH)).withQueryParam("limit", equalTo("1")));
    }

    // ========================================
    // PATCH
    // ========================================

    @Test
    @DisplayName("patch should send tag, properties and delete_properties")
    void patch_shouldSendFullBody() {
        server.stubFor(patch(urlEqualTo(VERSIONS_PATH + "/1.4.0"))
            .willReturn(okJson("{}")));

        versions.patch(APP, "1.4.0", new PatchVersionRequest(
            "latest",
            Map.of("original_tag_before_latest", List.of("stable")),
            List.of("original_tag_before_quarantine")
        ));

        server.verify(patchRequestedFor(urlEqualTo(VERSIONS_PATH + "/1.4.0"))
            .withHeader("Content-Type", equalTo("application/json"))
            .withRequestBody(equalToJson("""
                {
                  "tag": "latest",
                  "properties": {"original_tag_before_latest": ["stable"]},
                  "delete_properties": ["original_tag_before_quarantine"]
                }
                """)));
    }

    @Test
    @DisplayName("patch should omit absent fields from the body")
    void patch_shouldOmitNullFields() {
        server.stubFor(patch(urlEqualTo(VERSIONS_PATH + "/1.3.0"))
            .willReturn(aResponse().withStatus(204)));

        versions.patch(APP, "1.3.0", new PatchVersionRequest("stable", null, null));

        server.verify(patchRequestedFor(urlEqualTo(VERSIONS_PATH + "/1.3.0"))
            .withRequestBody(equalToJson("{\"tag\": \"stable\"}")));
    }

    // ========================================
    // CONTENT / CREATE
    // ========================================

    @Test
    @DisplayName("content should return sources and releasables as delivered")
    void content_shouldReturnSourcesAndReleasables() {
        server.stubFor(get(urlEqualTo(VERSIONS_PATH + "/1.4.0/content"))
            .willReturn(okJson("""
                {
                  "sources": {"builds": [{"name": "inventory-build", "number": "42"}]},
                  "releasables": [{"name": "inventory", "type": "docker"}]
                }
                """)));

        VersionContent content = versions.content(APP, "1.4.0");

        assertThat(content.sources()).isInstanceOf(Map.class);
        assertThat(content.releasables()).isInstanceOf(List.class);
        assertThat((List<?>) content.releasables()).hasSize(1);
    }

    @Test
    @DisplayName("content should default missing parts to empty maps")
    void content_shouldDefaultMissingParts() {
        server.stubFor(get(urlEqualTo(VERSIONS_PATH + "/1.4.0/content"))
            .willReturn(okJson("{}")));

        VersionContent content = versions.content(APP, "1.4.0");

        assertThat(content.sources()).isEqualTo(Map.of());
        assertThat(content.releasables()).isEqualTo(Map.of());
    }

    @Test
    @DisplayName("create should post the version with its source application versions")
    void create_shouldPostSources() {
        server.stubFor(post(urlEqualTo("/applications/bookverse-platform/versions"))
            .willReturn(aResponse().withStatus(201)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"version\": \"1.2.4\"}")));

        Map<String, Object> response = versions.create("bookverse-platform", CreateVersionRequest.of("1.2.4", List.of(
            new SourceVersion("bookverse-inventory", "1.4.0"),
            new SourceVersion("bookverse-web", "2.0.1")
        )));

        assertThat(response).containsEntry("version", "1.2.4");
        server.verify(postRequestedFor(urlEqualTo("/applications/bookverse-platform/versions"))
            .withRequestBody(equalToJson("""
                {
                  "version": "1.2.4",
                  "sources": {
                    "versions": [
                      {"application_key": "bookverse-inventory", "version": "1.4.0"},
                      {"application_key": "bookverse-web", "version": "2.0.1"}
                    ]
                  }
                }
                """)));
    }
}
