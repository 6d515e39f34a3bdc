package tech.bookverse.platform.manifest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One microservice entry of the services config.
 *
 * @param name                short service name, used by version overrides
 * @param apptrustApplication application key in the Trust Registry
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceDefinition(
    String name,
    @JsonProperty("apptrust_application") String apptrustApplication,
    Map<String, Object> docker
) {
    public boolean isComplete() {
        return name != null && !name.isBlank()
            && apptrustApplication != null && !apptrustApplication.isBlank();
    }
}
