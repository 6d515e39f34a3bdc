package tech.bookverse.sdk.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the Trust Registry SDK.
 *
 * <p>Configure in application.properties:
 * <pre>
 * trust-registry.base-url=https://acme.jfrog.io/apptrust/api/v1
 * trust-registry.access-token=your_access_token
 * </pre>
 *
 * <p>or, for OAuth2 client credentials:
 * <pre>
 * trust-registry.client-id=your_client_id
 * trust-registry.client-secret=your_client_secret
 * trust-registry.token-url=https://idp.example.com/oauth/token
 * </pre>
 */
@ConfigMapping(prefix = "trust-registry")
public interface TrustRegistryConfig {

    /**
     * Base URL for the Trust Registry API, without a trailing slash.
     */
    @WithName("base-url")
    Optional<String> baseUrl();

    /**
     * Static bearer token. Takes precedence over client credentials.
     */
    @WithName("access-token")
    Optional<String> accessToken();

    /**
     * OAuth2 client ID for authentication.
     */
    @WithName("client-id")
    Optional<String> clientId();

    /**
     * OAuth2 client secret for authentication.
     */
    @WithName("client-secret")
    Optional<String> clientSecret();

    /**
     * OAuth2 token endpoint. Defaults to {base-url}/oauth/token.
     */
    @WithName("token-url")
    Optional<String> tokenUrl();

    /**
     * Upper bound for how long a fetched token is reused,
     * even if the token endpoint reports a longer lifetime.
     */
    @WithName("token-ttl")
    @WithDefault("1h")
    Duration tokenTtl();

    /**
     * HTTP client configuration.
     */
    HttpConfig http();

    interface HttpConfig {
        /**
         * Request timeout in seconds.
         */
        @WithDefault("30")
        int timeout();

        /**
         * Number of attempts for requests failing with an unavailable registry.
         * 1 means a single attempt.
         */
        @WithName("retry-attempts")
        @WithDefault("1")
        int retryAttempts();

        /**
         * Delay between retries in milliseconds.
         */
        @WithName("retry-delay")
        @WithDefault("100")
        int retryDelay();

        /**
         * Page size used when listing application versions.
         */
        @WithName("list-limit")
        @WithDefault("200")
        int listLimit();
    }
}
