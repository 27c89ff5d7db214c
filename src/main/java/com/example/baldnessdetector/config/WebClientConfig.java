package com.example.baldnessdetector.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient googleOauthClient(WebClient.Builder builder, GoogleOAuthProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getTimeout());

        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Bean
    public WebClient walletProviderClient(WebClient.Builder builder, WalletProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getTimeout());

        return builder
                .baseUrl(properties.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
