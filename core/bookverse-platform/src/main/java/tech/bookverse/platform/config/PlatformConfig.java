package tech.bookverse.platform.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Defaults for the platform release commands. Command line options take precedence.
 */
@ConfigMapping(prefix = "platform")
public interface PlatformConfig {

    /**
     * Path of the services YAML file.
     */
    @WithName("services-config")
    @WithDefault("config/services.yaml")
    String servicesConfig();

    /**
     * Directory manifests are written to.
     */
    @WithName("output-dir")
    @WithDefault("manifests")
    String outputDir();

    /**
     * Stage the service versions are taken from. Only PROD is supported.
     */
    @WithName("source-stage")
    @WithDefault("PROD")
    String sourceStage();

    /**
     * Application key of the platform itself in the Trust Registry.
     */
    @WithName("platform-app")
    @WithDefault("bookverse-platform")
    String platformApp();
}
