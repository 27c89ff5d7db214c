package com.example.baldnessdetector.config;

import com.example.baldnessdetector.service.wallet.DevelopmentWalletProvider;
import com.example.baldnessdetector.service.wallet.ThirdwebWalletProvider;
import com.example.baldnessdetector.service.wallet.WalletProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@Slf4j
public class WalletProvisioningConfig {

    @Bean
    public WalletProvider walletProvider(@Qualifier("walletProviderClient") WebClient walletProviderClient,
                                         WalletProperties properties) {
        if (!properties.hasSecretKey()) {
            log.warn("wallet.secret-key not set, wallets will be derived locally by the development provider");
            return new DevelopmentWalletProvider();
        }
        return new ThirdwebWalletProvider(walletProviderClient, properties);
    }
}
