package tech.bookverse.platform.manifest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the static list of microservices that make up the platform.
 *
 * <pre>
 * services:
 *   - name: inventory
 *     apptrust_application: bookverse-inventory
 *   - name: recommendations
 *     apptrust_application: bookverse-recommendations
 * </pre>
 */
@ApplicationScoped
public class ServicesConfigLoader {

    private static final Logger LOG = Logger.getLogger(ServicesConfigLoader.class);

    private final ObjectMapper yamlMapper = YAMLMapper.builder()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .build();

    public List<ServiceDefinition> load(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw ManifestException.configNotFound(configPath);
        }

        JsonNode root;
        try {
            root = yamlMapper.readTree(configPath.toFile());
        } catch (IOException e) {
            throw ManifestException.configUnreadable(configPath, e);
        }

        JsonNode services = root == null ? null : root.get("services");
        if (services == null || !services.isArray() || services.isEmpty()) {
            throw ManifestException.noServices();
        }

        List<ServiceDefinition> definitions;
        try {
            definitions = yamlMapper.convertValue(services, new TypeReference<List<ServiceDefinition>>() {});
        } catch (IllegalArgumentException e) {
            throw ManifestException.configUnreadable(configPath, e);
        }

        LOG.infof("Loaded %d services from %s", definitions.size(), configPath);
        return definitions;
    }
}
