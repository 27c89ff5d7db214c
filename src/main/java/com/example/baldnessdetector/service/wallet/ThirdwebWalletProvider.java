package com.example.baldnessdetector.service.wallet;

import com.example.baldnessdetector.config.WalletProperties;
import com.example.baldnessdetector.exception.WalletProvisioningException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
public class ThirdwebWalletProvider implements WalletProvider {

    private final WebClient walletProviderClient;
    private final WalletProperties properties;

    public ThirdwebWalletProvider(WebClient walletProviderClient, WalletProperties properties) {
        this.walletProviderClient = walletProviderClient;
        this.properties = properties;
    }

    @Override
    public String createWallet(Long userId) {
        Map<String, Object> body = Map.of(
                "identifier", "user-" + userId,
                "network", properties.getNetwork()
        );

        JsonNode json;
        try {
            json = walletProviderClient.post()
                    .uri(properties.getCreatePath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        h.set("x-secret-key", properties.getSecretKey());
                        if (properties.getClientId() != null && !properties.getClientId().isBlank()) {
                            h.set("x-client-id", properties.getClientId());
                        }
                    })
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .doOnNext(b -> log.error("Wallet provider error: {} - {}", resp.statusCode(), b))
                                    .then(Mono.error(new WalletProvisioningException(
                                            "Wallet provider returned " + resp.statusCode()))))
                    .bodyToMono(JsonNode.class)
                    .block(properties.getTimeout());
        } catch (WalletProvisioningException ex) {
            throw ex;
        } catch (WebClientException | IllegalStateException ex) {
            throw new WalletProvisioningException("Wallet provider unreachable: " + ex.getMessage(), ex);
        }

        String address = extractAddress(json);
        if (address == null || address.isBlank()) {
            throw new WalletProvisioningException("Wallet provider response carried no address");
        }
        log.info("Created wallet {} for user {}", address, userId);
        return address;
    }

    private static String extractAddress(JsonNode json) {
        if (json == null) {
            return null;
        }
        JsonNode address = json.path("result").path("address");
        if (address.isMissingNode() || address.isNull()) {
            address = json.path("address");
        }
        return address.isTextual() ? address.asText() : null;
    }
}
