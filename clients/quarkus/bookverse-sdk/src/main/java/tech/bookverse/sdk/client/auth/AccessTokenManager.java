package tech.bookverse.sdk.client.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bookverse.sdk.config.TrustRegistryConfig;
import tech.bookverse.sdk.exception.AuthenticationException;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Supplies bearer tokens for Trust Registry calls.
 *
 * <p>A configured static access token is used as is. Otherwise a token is obtained
 * with the OAuth2 client credentials grant and held until shortly before it expires,
 * capped at {@code trust-registry.token-ttl}. One instance lives per process and is
 * shared through injection.
 */
@ApplicationScoped
public class AccessTokenManager {

    private static final Logger LOG = Logger.getLogger(AccessTokenManager.class);

    private static final Duration EXPIRY_MARGIN = Duration.ofSeconds(30);

    private final TrustRegistryConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    private String accessToken;
    private Instant expiresAt;

    @Inject
    public AccessTokenManager(TrustRegistryConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Get a valid access token, fetching a new one if necessary.
     */
    public String getAccessToken() {
        if (config.accessToken().isPresent()) {
            return config.accessToken().get();
        }
        lock.lock();
        try {
            if (isTokenValid()) {
                return accessToken;
            }
            return fetchNewToken();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether credentials of either kind are configured.
     */
    public boolean hasCredentials() {
        return config.accessToken().isPresent()
            || (config.clientId().isPresent() && config.clientSecret().isPresent());
    }

    private boolean isTokenValid() {
        return accessToken != null
            && expiresAt != null
            && Instant.now().plus(EXPIRY_MARGIN).isBefore(expiresAt);
    }

    private String fetchNewToken() {
        String clientId = config.clientId()
            .orElseThrow(AuthenticationException::missingCredentials);
        String clientSecret = config.clientSecret()
            .orElseThrow(AuthenticationException::missingCredentials);

        String tokenUrl = config.tokenUrl()
            .or(() -> config.baseUrl().map(url -> url.replaceAll("/$", "") + "/oauth/token"))
            .orElseThrow(AuthenticationException::missingCredentials);

        String body = "grant_type=client_credentials"
            + "&client_id=" + URLEncoder.encode(clientId, StandardCharsets.UTF_8)
            + "&client_secret=" + URLEncoder.encode(clientSecret, StandardCharsets.UTF_8);

        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .timeout(Duration.ofSeconds(config.http().timeout()))
                .build();

            HttpResponse<String> response = httpClient.send(
                request, HttpResponse.BodyHandlers.ofString()
            );

            if (response.statusCode() != 200) {
                LOG.warnf("Token endpoint %s returned %d", tokenUrl, response.statusCode());
                throw AuthenticationException.invalidCredentials();
            }

            JsonNode json = objectMapper.readTree(response.body());
            String token = json.path("access_token").asText(null);
            if (token == null || token.isBlank()) {
                throw new AuthenticationException("Token endpoint returned no access_token");
            }

            Duration lifetime = Duration.ofSeconds(json.path("expires_in").asLong(3600));
            if (lifetime.compareTo(config.tokenTtl()) > 0) {
                lifetime = config.tokenTtl();
            }

            this.accessToken = token;
            this.expiresAt = Instant.now().plus(lifetime);
            LOG.debugf("Fetched registry access token valid for %s", lifetime);

            return this.accessToken;
        } catch (AuthenticationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException("Interrupted while fetching access token", e);
        } catch (Exception e) {
            throw new AuthenticationException("Failed to fetch access token", e);
        }
    }
}
