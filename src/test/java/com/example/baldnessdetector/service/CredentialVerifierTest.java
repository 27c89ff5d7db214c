package com.example.baldnessdetector.service;

import com.example.baldnessdetector.config.GoogleOAuthProperties;
import com.example.baldnessdetector.exception.AuthenticationFailedException;
import com.example.baldnessdetector.model.IdentityClaims;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialVerifierTest {

    private static final String USERINFO =
            "{\"id\":\"g-123\",\"email\":\"alice@example.com\",\"verified_email\":true,"
                    + "\"name\":\"Alice\",\"picture\":\"https://img.example.com/alice.png\"}";

    private GoogleOAuthProperties properties;
    private final List<ClientRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new GoogleOAuthProperties();
        properties.setUserinfoUri("https://google.test/userinfo");
        properties.setTokeninfoUri("https://google.test/tokeninfo");
        properties.setClientId("client-123");
    }

    @Test
    void returnsClaimsForValidAccessToken() {
        CredentialVerifier verifier = verifier(req -> json(HttpStatus.OK, USERINFO));

        IdentityClaims claims = verifier.verifyGoogle("access-token", null);

        assertThat(claims.getEmail()).isEqualTo("alice@example.com");
        assertThat(claims.getName()).isEqualTo("Alice");
        assertThat(claims.getGoogleId()).isEqualTo("g-123");
        assertThat(claims.getPicture()).isEqualTo("https://img.example.com/alice.png");
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer access-token");
    }

    @Test
    void rejectsTokenGoogleRefuses() {
        CredentialVerifier verifier = verifier(req -> json(HttpStatus.UNAUTHORIZED,
                "{\"error\":{\"code\":401,\"message\":\"Invalid Credentials\"}}"));

        assertThatThrownBy(() -> verifier.verifyGoogle("bad-token", null))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid Google access token");
    }

    @Test
    void rejectsUnverifiedEmail() {
        CredentialVerifier verifier = verifier(req -> json(HttpStatus.OK,
                "{\"id\":\"g-1\",\"email\":\"x@example.com\",\"verified_email\":false,\"name\":\"X\"}"));

        assertThatThrownBy(() -> verifier.verifyGoogle("token", null))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void rejectsAccountWithoutEmail() {
        CredentialVerifier verifier = verifier(req -> json(HttpStatus.OK, "{\"id\":\"g-1\",\"name\":\"X\"}"));

        assertThatThrownBy(() -> verifier.verifyGoogle("token", null))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void derivesNameFromEmailWhenMissing() {
        CredentialVerifier verifier = verifier(req -> json(HttpStatus.OK,
                "{\"id\":\"g-2\",\"email\":\"bob@example.com\",\"verified_email\":true}"));

        assertThat(verifier.verifyGoogle("token", null).getName()).isEqualTo("bob");
    }

    @Test
    void clampsGoogleProfileToColumnLimits() {
        String longName = "N".repeat(300);
        String longPicture = "https://img.example.com/" + "p".repeat(1100);
        CredentialVerifier verifier = verifier(req -> json(HttpStatus.OK,
                "{\"id\":\"g-long\",\"email\":\"long@example.com\",\"verified_email\":true,"
                        + "\"name\":\"" + longName + "\",\"picture\":\"" + longPicture + "\"}"));

        IdentityClaims claims = verifier.verifyGoogle("token", null);

        assertThat(claims.getName()).hasSize(255).isEqualTo("N".repeat(255));
        assertThat(claims.getPicture()).isNull();
        assertThat(claims.getGoogleId()).isEqualTo("g-long");
    }

    @Test
    void rejectsUnparseableUserinfo() {
        CredentialVerifier verifier = verifier(req -> json(HttpStatus.OK, "{\"id\": \"g-1\", \"email\":"));

        assertThatThrownBy(() -> verifier.verifyGoogle("token", null))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Malformed response from Google");
    }

    @Test
    void rejectsUserinfoOfWrongShape() {
        CredentialVerifier verifier = verifier(req -> json(HttpStatus.OK, "[\"not\", \"an\", \"object\"]"));

        assertThatThrownBy(() -> verifier.verifyGoogle("token", null))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void rejectsNonJsonUserinfo() {
        CredentialVerifier verifier = verifier(req -> ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_HTML_VALUE)
                .body("<html>Service Unavailable</html>")
                .build());

        assertThatThrownBy(() -> verifier.verifyGoogle("token", null))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void checksIdTokenAgainstClientAndAccount() {
        CredentialVerifier verifier = verifier(req -> req.url().getPath().endsWith("/tokeninfo")
                ? json(HttpStatus.OK, "{\"aud\":\"client-123\",\"sub\":\"g-123\",\"email\":\"alice@example.com\"}")
                : json(HttpStatus.OK, USERINFO));

        IdentityClaims claims = verifier.verifyGoogle("access-token", "id-token");

        assertThat(claims.getGoogleId()).isEqualTo("g-123");
        assertThat(requests).hasSize(2);
        assertThat(requests.get(1).url().getQuery()).isEqualTo("id_token=id-token");
    }

    @Test
    void rejectsIdTokenForAnotherClient() {
        CredentialVerifier verifier = verifier(req -> req.url().getPath().endsWith("/tokeninfo")
                ? json(HttpStatus.OK, "{\"aud\":\"someone-else\",\"sub\":\"g-123\"}")
                : json(HttpStatus.OK, USERINFO));

        assertThatThrownBy(() -> verifier.verifyGoogle("access-token", "id-token"))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessageContaining("audience");
    }

    @Test
    void rejectsIdTokenOfAnotherAccount() {
        CredentialVerifier verifier = verifier(req -> req.url().getPath().endsWith("/tokeninfo")
                ? json(HttpStatus.OK, "{\"aud\":\"client-123\",\"sub\":\"g-999\"}")
                : json(HttpStatus.OK, USERINFO));

        assertThatThrownBy(() -> verifier.verifyGoogle("access-token", "id-token"))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void rejectsIdTokenGoogleRefuses() {
        CredentialVerifier verifier = verifier(req -> req.url().getPath().endsWith("/tokeninfo")
                ? json(HttpStatus.BAD_REQUEST, "{\"error\":\"invalid_token\"}")
                : json(HttpStatus.OK, USERINFO));

        assertThatThrownBy(() -> verifier.verifyGoogle("access-token", "id-token"))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid Google ID token");
    }

    @Test
    void acceptsEmailAssertionAsGiven() {
        CredentialVerifier verifier = verifier(req -> {
            throw new AssertionError("email login must not call Google");
        });

        IdentityClaims claims = verifier.acceptEmail("  carol@example.com ", " Carol ", " ");

        assertThat(claims.getEmail()).isEqualTo("carol@example.com");
        assertThat(claims.getName()).isEqualTo("Carol");
        assertThat(claims.getPicture()).isNull();
        assertThat(claims.hasGoogleId()).isFalse();
    }

    private CredentialVerifier verifier(Function<ClientRequest, ClientResponse> handler) {
        WebClient client = WebClient.builder()
                .exchangeFunction(req -> {
                    requests.add(req);
                    return Mono.just(handler.apply(req));
                })
                .build();
        return new CredentialVerifier(client, properties);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
