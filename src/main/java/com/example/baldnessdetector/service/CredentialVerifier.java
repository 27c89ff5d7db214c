package com.example.baldnessdetector.service;

import com.example.baldnessdetector.config.GoogleOAuthProperties;
import com.example.baldnessdetector.dto.GoogleTokenInfo;
import com.example.baldnessdetector.dto.GoogleUserInfo;
import com.example.baldnessdetector.exception.AuthenticationFailedException;
import com.example.baldnessdetector.model.IdentityClaims;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

/**
 * Turns login credentials into identity claims.
 * <p>
 * The Google path asks Google who the access token belongs to. The email path takes the
 * client's word for it.
 */
@Service
@Slf4j
public class CredentialVerifier {

    // Column limits of the users table
    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_PICTURE_LENGTH = 1024;

    private final WebClient googleOauthClient;
    private final GoogleOAuthProperties properties;

    public CredentialVerifier(@Qualifier("googleOauthClient") WebClient googleOauthClient,
                              GoogleOAuthProperties properties) {
        this.googleOauthClient = googleOauthClient;
        this.properties = properties;
    }

    public IdentityClaims verifyGoogle(String accessToken, String idToken) {
        GoogleUserInfo userInfo = fetchUserInfo(accessToken);

        if (userInfo.getEmail() == null || userInfo.getEmail().isBlank()) {
            throw new AuthenticationFailedException("Google account has no email address");
        }
        if (Boolean.FALSE.equals(userInfo.getVerifiedEmail())) {
            throw new AuthenticationFailedException("Google account email is not verified");
        }
        if (idToken != null && !idToken.isBlank()) {
            checkIdToken(idToken, userInfo);
        }

        String email = userInfo.getEmail();
        String name = userInfo.getName();
        if (name == null || name.isBlank()) {
            int at = email.indexOf('@');
            name = at > 0 ? email.substring(0, at) : email;
        }

        name = name.trim();
        if (name.length() > MAX_NAME_LENGTH) {
            name = name.substring(0, MAX_NAME_LENGTH);
        }
        String picture = userInfo.getPicture();
        if (picture != null && picture.length() > MAX_PICTURE_LENGTH) {
            log.debug("Dropping Google picture URL of {} characters for {}", picture.length(), email);
            picture = null;
        }

        return IdentityClaims.builder()
                .email(email)
                .name(name)
                .picture(picture)
                .googleId(userInfo.getId())
                .build();
    }

    /**
     * Lower-trust path: the caller's assertion is taken as is, nothing is verified.
     */
    public IdentityClaims acceptEmail(String email, String name, String picture) {
        return IdentityClaims.builder()
                .email(email.trim())
                .name(name.trim())
                .picture(picture == null || picture.isBlank() ? null : picture)
                .build();
    }

    private GoogleUserInfo fetchUserInfo(String accessToken) {
        GoogleUserInfo userInfo;
        try {
            userInfo = googleOauthClient.get()
                    .uri(properties.getUserinfoUri())
                    .headers(headers -> headers.setBearerAuth(accessToken))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .doOnNext(b -> log.warn("Google userinfo rejected token: {} - {}", resp.statusCode(), b))
                                    .then(Mono.error(new AuthenticationFailedException("Invalid Google access token"))))
                    .bodyToMono(GoogleUserInfo.class)
                    .block(properties.getTimeout());
        } catch (AuthenticationFailedException ex) {
            throw ex;
        } catch (CodecException ex) {
            log.warn("Malformed Google userinfo payload", ex);
            throw new AuthenticationFailedException("Malformed response from Google", ex);
        } catch (WebClientException | IllegalStateException ex) {
            log.error("Google userinfo request failed", ex);
            throw new AuthenticationFailedException("Unable to verify Google access token", ex);
        }

        if (userInfo == null) {
            throw new AuthenticationFailedException("Empty response from Google");
        }
        return userInfo;
    }

    private void checkIdToken(String idToken, GoogleUserInfo userInfo) {
        GoogleTokenInfo tokenInfo;
        try {
            tokenInfo = googleOauthClient.get()
                    .uri(properties.getTokeninfoUri() + "?id_token={idToken}", idToken)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            Mono.error(new AuthenticationFailedException("Invalid Google ID token")))
                    .bodyToMono(GoogleTokenInfo.class)
                    .block(properties.getTimeout());
        } catch (AuthenticationFailedException ex) {
            throw ex;
        } catch (CodecException ex) {
            throw new AuthenticationFailedException("Malformed response from Google", ex);
        } catch (WebClientException | IllegalStateException ex) {
            log.error("Google tokeninfo request failed", ex);
            throw new AuthenticationFailedException("Unable to verify Google ID token", ex);
        }

        if (tokenInfo == null) {
            throw new AuthenticationFailedException("Invalid Google ID token");
        }
        if (properties.hasClientId() && !properties.getClientId().equals(tokenInfo.getAud())) {
            throw new AuthenticationFailedException("Google ID token audience does not match");
        }
        if (tokenInfo.getSub() != null && userInfo.getId() != null && !tokenInfo.getSub().equals(userInfo.getId())) {
            throw new AuthenticationFailedException("Google ID token does not belong to the access token's account");
        }
    }
}
