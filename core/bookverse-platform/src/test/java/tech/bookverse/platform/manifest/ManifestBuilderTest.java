package tech.bookverse.platform.manifest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.bookverse.platform.registry.InMemoryRegistryClient;
import tech.bookverse.sdk.dto.VersionContent;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ManifestBuilderTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T09:08:07Z"), ZoneOffset.UTC);

    private InMemoryRegistryClient registry;
    private ManifestBuilder builder;

    @BeforeEach
    void setUp() {
        registry = new InMemoryRegistryClient();
        builder = new ManifestBuilder(registry, FIXED);
    }

    @Test
    @DisplayName("build should stamp the manifest with a UTC timestamp version")
    void build_shouldUseTimestampVersion() {
        PlatformManifest manifest = builder.build(List.of(), "PROD");

        assertThat(manifest.version()).isEqualTo("2024.05.01.090807");
        assertThat(manifest.createdAt()).isEqualTo("2024-05-01T09:08:07Z");
        assertThat(manifest.sourceStage()).isEqualTo("PROD");
        assertThat(manifest.notes()).isEqualTo(ManifestBuilder.NOTES);
        assertThat(manifest.provenance().evidenceMinimums()).containsEntry("signatures_present", true);
        assertThat(manifest.platformAppVersion()).isNull();
    }

    @Test
    @DisplayName("build should embed each version's sources and releasables in service order")
    void build_shouldEmbedContent() {
        registry.content("bookverse-inventory", "1.4.0", new VersionContent(
            Map.of("builds", List.of(Map.of("name", "inventory-build", "number", "42"))),
            List.of(Map.of("name", "inventory", "type", "docker"))
        ));

        PlatformManifest manifest = builder.build(List.of(
            new ResolvedService("inventory", "bookverse-inventory", "1.4.0"),
            new ResolvedService("web", "bookverse-web", "2.0.1")
        ), "PROD");

        assertThat(manifest.applications()).extracting(PlatformManifest.Application::applicationKey)
            .containsExactly("bookverse-inventory", "bookverse-web");

        PlatformManifest.Application inventory = manifest.applications().get(0);
        assertThat(inventory.version()).isEqualTo("1.4.0");
        assertThat(inventory.sources()).isEqualTo(
            Map.of("builds", List.of(Map.of("name", "inventory-build", "number", "42"))));
        assertThat(inventory.releasables()).isEqualTo(List.of(Map.of("name", "inventory", "type", "docker")));

        PlatformManifest.Application web = manifest.applications().get(1);
        assertThat(web.sources()).isEqualTo(Map.of());
        assertThat(web.releasables()).isEqualTo(Map.of());
    }

    @Test
    @DisplayName("build should reject any stage other than PROD")
    void build_shouldRejectOtherStages() {
        assertThatThrownBy(() -> builder.build(List.of(), "QA"))
            .isInstanceOf(ManifestException.class)
            .hasMessageContaining("QA");
        assertThatThrownBy(() -> ManifestBuilder.requireSupportedStage("prod"))
            .isInstanceOf(ManifestException.class);
    }
}
