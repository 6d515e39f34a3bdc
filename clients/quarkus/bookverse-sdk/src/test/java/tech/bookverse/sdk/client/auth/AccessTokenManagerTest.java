package tech.bookverse.sdk.client.auth;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.bookverse.sdk.TestTrustRegistryConfig;
import tech.bookverse.sdk.exception.AuthenticationException;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.*;

class AccessTokenManagerTest {

    private WireMockServer server;

    @BeforeEach
    void startServer() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop();
    }

    private void stubToken(String token, int expiresIn) {
        server.stubFor(post(urlEqualTo("/oauth/token"))
            .willReturn(okJson("{\"access_token\": \"" + token + "\", \"expires_in\": " + expiresIn + "}")));
    }

    @Test
    @DisplayName("a static access token should be used without contacting the token endpoint")
    void getAccessToken_shouldReturnStaticToken() {
        AccessTokenManager manager = new AccessTokenManager(
            TestTrustRegistryConfig.withToken(server.baseUrl(), "static-token"));

        assertThat(manager.getAccessToken()).isEqualTo("static-token");
        server.verify(0, postRequestedFor(anyUrl()));
    }

    @Test
    @DisplayName("client credentials should be exchanged once and the token reused")
    void getAccessToken_shouldFetchOnceAndCache() {
        stubToken("fetched-token", 3600);
        AccessTokenManager manager = new AccessTokenManager(
            TestTrustRegistryConfig.withClientCredentials(server.baseUrl(), "ci-client", "s3cret&more"));

        assertThat(manager.getAccessToken()).isEqualTo("fetched-token");
        assertThat(manager.getAccessToken()).isEqualTo("fetched-token");

        server.verify(1, postRequestedFor(urlEqualTo("/oauth/token"))
            .withHeader("Content-Type", equalTo("application/x-www-form-urlencoded"))
            .withRequestBody(containing("grant_type=client_credentials"))
            .withRequestBody(containing("client_id=ci-client"))
            .withRequestBody(containing("client_secret=s3cret%26more")));
    }

    @Test
    @DisplayName("a token about to expire should be fetched again")
    void getAccessToken_shouldRefetch_whenTokenNearExpiry() {
        stubToken("short-lived", 10);
        AccessTokenManager manager = new AccessTokenManager(
            TestTrustRegistryConfig.withClientCredentials(server.baseUrl(), "ci-client", "secret"));

        manager.getAccessToken();
        manager.getAccessToken();

        server.verify(2, postRequestedFor(urlEqualTo("/oauth/token")));
    }

    @Test
    @DisplayName("the configured token TTL should cap the reported lifetime")
    void getAccessToken_shouldCapLifetimeAtTokenTtl() {
        stubToken("long-lived", 86400);
        AccessTokenManager manager = new AccessTokenManager(
            TestTrustRegistryConfig.withClientCredentials(server.baseUrl(), "ci-client", "secret")
                .withTokenTtl(Duration.ofSeconds(20)));

        manager.getAccessToken();
        manager.getAccessToken();

        // 20s is inside the expiry margin, so every call refetches
        server.verify(2, postRequestedFor(urlEqualTo("/oauth/token")));
    }

    @Test
    @DisplayName("an explicit token URL should override the base URL default")
    void getAccessToken_shouldUseConfiguredTokenUrl() {
        server.stubFor(post(urlEqualTo("/idp/token"))
            .willReturn(okJson("{\"access_token\": \"idp-token\"}")));
        AccessTokenManager manager = new AccessTokenManager(
            TestTrustRegistryConfig.withClientCredentials("https://registry.invalid", "ci-client", "secret")
                .withTokenUrl(server.baseUrl() + "/idp/token"));

        assertThat(manager.getAccessToken()).isEqualTo("idp-token");
    }

    @Test
    @DisplayName("a rejected client should raise AuthenticationException")
    void getAccessToken_shouldThrow_whenEndpointRejects() {
        server.stubFor(post(urlEqualTo("/oauth/token"))
            .willReturn(aResponse().withStatus(401)));
        AccessTokenManager manager = new AccessTokenManager(
            TestTrustRegistryConfig.withClientCredentials(server.baseUrl(), "ci-client", "wrong"));

        assertThatThrownBy(manager::getAccessToken)
            .isInstanceOf(AuthenticationException.class)
            .hasMessage("Invalid client credentials");
    }

    @Test
    @DisplayName("a response without access_token should raise AuthenticationException")
    void getAccessToken_shouldThrow_whenTokenMissing() {
        server.stubFor(post(urlEqualTo("/oauth/token"))
            .willReturn(okJson("{\"token_type\": \"bearer\"}")));
        AccessTokenManager manager = new AccessTokenManager(
            TestTrustRegistryConfig.withClientCredentials(server.baseUrl(), "ci-client", "secret"));

        assertThatThrownBy(manager::getAccessToken)
            .isInstanceOf(AuthenticationException.class)
            .hasMessageContaining("access_token");
    }

    @Test
    @DisplayName("missing credentials should be reported and not fetched")
    void getAccessToken_shouldThrow_whenNoCredentials() {
        AccessTokenManager manager = new AccessTokenManager(TestTrustRegistryConfig.unconfigured());

        assertThat(manager.hasCredentials()).isFalse();
        assertThatThrownBy(manager::getAccessToken)
            .isInstanceOf(AuthenticationException.class)
            .hasMessageContaining("client ID and secret");
    }
}
