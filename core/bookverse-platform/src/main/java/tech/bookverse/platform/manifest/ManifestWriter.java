package tech.bookverse.platform.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes manifests as YAML files and renders their JSON summary.
 */
@ApplicationScoped
public class ManifestWriter {

    private static final Logger LOG = Logger.getLogger(ManifestWriter.class);

    private final ObjectMapper yamlMapper = YAMLMapper.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        .build();

    private final ObjectMapper jsonMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Write {@code platform-<version>.yaml} into {@code outputDir}, creating the directory if needed.
     *
     * @return path of the written file
     */
    public Path write(Path outputDir, PlatformManifest manifest) {
        Path target = outputDir.resolve("platform-" + manifest.version() + ".yaml");
        try {
            Files.createDirectories(outputDir);
            yamlMapper.writeValue(target.toFile(), manifest);
        } catch (IOException e) {
            throw ManifestException.writeFailed(target, e);
        }
        LOG.infof("Wrote manifest: %s", target);
        return target;
    }

    /**
     * Short JSON listing of the manifest version, the platform application version
     * and the version picked for every application.
     */
    public String summary(PlatformManifest manifest) {
        List<Map<String, String>> rows = manifest.applications().stream()
            .map(app -> {
                Map<String, String> row = new LinkedHashMap<>();
                row.put("application_key", app.applicationKey());
                row.put("version", app.version());
                return row;
            })
            .toList();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("platform_manifest_version", manifest.version());
        summary.put("platform_app_version", manifest.platformAppVersion() != null ? manifest.platformAppVersion() : "");
        summary.put("applications", rows);

        try {
            return jsonMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new ManifestException("Failed to render summary of manifest " + manifest.version(), e);
        }
    }
}
