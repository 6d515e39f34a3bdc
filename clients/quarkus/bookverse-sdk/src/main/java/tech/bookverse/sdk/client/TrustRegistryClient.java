package tech.bookverse.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bookverse.sdk.client.auth.AccessTokenManager;
import tech.bookverse.sdk.client.resources.ApplicationVersions;
import tech.bookverse.sdk.config.TrustRegistryConfig;
import tech.bookverse.sdk.exception.AuthenticationException;
import tech.bookverse.sdk.exception.RegistryNotFoundException;
import tech.bookverse.sdk.exception.RegistryUnavailableException;
import tech.bookverse.sdk.exception.TrustRegistryException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Main client for the Trust Registry API.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Inject
 * TrustRegistryClient client;
 *
 * var versions = client.applicationVersions().list("bookverse-inventory");
 * client.applicationVersions().patch("bookverse-inventory", "1.4.2", patchRequest);
 * }</pre>
 *
 * <p>Only failures that signal an unavailable registry are retried, and only when
 * {@code trust-registry.http.retry-attempts} is above 1.
 */
@ApplicationScoped
public class TrustRegistryClient {

    private static final Logger LOG = Logger.getLogger(TrustRegistryClient.class);

    private final TrustRegistryConfig config;
    private final AccessTokenManager tokenManager;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private ApplicationVersions applicationVersions;

    @Inject
    public TrustRegistryClient(TrustRegistryConfig config, AccessTokenManager tokenManager) {
        this.config = config;
        this.tokenManager = tokenManager;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(config.http().timeout()))
            .build();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Get the Application Versions resource.
     */
    public ApplicationVersions applicationVersions() {
        if (applicationVersions == null) {
            applicationVersions = new ApplicationVersions(this);
        }
        return applicationVersions;
    }

    /**
     * Whether a base URL and credentials are configured.
     */
    public boolean isConfigured() {
        return config.baseUrl().filter(url -> !url.isBlank()).isPresent()
            && tokenManager.hasCredentials();
    }

    /**
     * Page size for version listings, from {@code trust-registry.http.list-limit}.
     */
    public int listLimit() {
        return config.http().listLimit();
    }

    /**
     * Make an authenticated API request.
     */
    public <T> T request(String method, String endpoint, Object body, TypeReference<T> responseType) {
        int maxAttempts = Math.max(1, config.http().retryAttempts());
        int attempts = 0;
        RegistryUnavailableException lastException = null;

        while (attempts < maxAttempts) {
            try {
                return doRequest(method, endpoint, body, responseType);
            } catch (RegistryUnavailableException e) {
                lastException = e;
                attempts++;
                if (attempts < maxAttempts) {
                    LOG.warnf("%s %s failed (%s), retrying (%d/%d)",
                        method, endpoint, e.getMessage(), attempts, maxAttempts - 1);
                    sleep(config.http().retryDelay() * attempts);
                }
            }
        }

        throw lastException;
    }

    /**
     * Make an authenticated API request, discarding any response body.
     */
    public void requestVoid(String method, String endpoint, Object body) {
        request(method, endpoint, body, new TypeReference<Map<String, Object>>() {});
    }

    private <T> T doRequest(String method, String endpoint, Object body,
                            TypeReference<T> responseType) {
        String baseUrl = config.baseUrl()
            .filter(url -> !url.isBlank())
            .orElseThrow(() -> new TrustRegistryException("trust-registry.base-url is not configured"));

        String token = tokenManager.getAccessToken();
        String url = baseUrl.replaceAll("/$", "") + endpoint;

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Authorization", "Bearer " + token)
            .header("Accept", "application/json")
            .timeout(Duration.ofSeconds(config.http().timeout()));

        try {
            if (body != null) {
                String jsonBody = objectMapper.writeValueAsString(body);
                requestBuilder.header("Content-Type", "application/json");
                requestBuilder.method(method, HttpRequest.BodyPublishers.ofString(jsonBody));
            } else {
                requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());
            }
        } catch (IOException e) {
            throw new TrustRegistryException("Failed to serialize request body", e);
        }

        HttpResponse<String> response;
        try {
            LOG.debugf("%s %s", method, endpoint);
            response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw RegistryUnavailableException.timeout(method, endpoint, e);
        } catch (IOException e) {
            throw RegistryUnavailableException.ioError(method, endpoint, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RegistryUnavailableException.interrupted(method, endpoint, e);
        }

        return handleResponse(response, responseType);
    }

    private <T> T handleResponse(HttpResponse<String> response, TypeReference<T> responseType) {
        int status = response.statusCode();
        String body = response.body();

        if (status >= 400) {
            Map<String, Object> data = readErrorBody(body);

            if (status == 401) {
                throw AuthenticationException.tokenRejected();
            }

            if (status == 404) {
                throw new RegistryNotFoundException(errorMessage(data, "Resource not found"), data);
            }

            if (status >= 500) {
                throw new RegistryUnavailableException(
                    errorMessage(data, "Server error: " + status), status, data
                );
            }

            throw new TrustRegistryException(
                errorMessage(data, "Client error: " + status), status, null, data
            );
        }

        if (body == null || body.isBlank()) {
            return null;
        }

        try {
            return objectMapper.readValue(body, responseType);
        } catch (IOException e) {
            throw TrustRegistryException.malformedResponse(e);
        }
    }

    private Map<String, Object> readErrorBody(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            return Map.of("error", body.length() > 200 ? body.substring(0, 200) : body);
        }
    }

    private static String errorMessage(Map<String, Object> data, String fallback) {
        Object error = data.get("error");
        return error != null ? error.toString() : fallback;
    }

    private void sleep(int millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Encode a value for use as a single path segment.
     */
    public static String pathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
