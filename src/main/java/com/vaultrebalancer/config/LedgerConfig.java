package com.vaultrebalancer.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configuration properties and HTTP clients for the vault ledger.
 *
 * <p>Binds to the {@code ledger.*} prefix. Provides two {@link RestClient} beans:
 * <ul>
 *   <li>{@code ledgerInfoRestClient} for the public, unauthenticated info endpoint
 *       (balances, vault equities, fills, ledger updates)</li>
 *   <li>{@code ledgerSidecarRestClient} for the signing sidecar that holds the wallet key
 *       and submits vault transfers on our behalf</li>
 * </ul>
 *
 * <p>Timeouts live here and only here: the engine itself has no round-level deadline.
 */
@Configuration
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfig.class);

    /** Account whose capital is rebalanced. Required; the scheduler refuses to start without it. */
    private String wallet;

    private String infoUrl = "https://api.hyperliquid.xyz";
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(15);

    private Sidecar sidecar = new Sidecar();

    @Bean
    public RestClient ledgerInfoRestClient(RestClient.Builder builder) {
        log.info("Creating ledger info client for {}", infoUrl);
        return builder.clone()
                .baseUrl(infoUrl)
                .requestFactory(requestFactory(connectTimeout, readTimeout))
                .build();
    }

    @Bean
    public RestClient ledgerSidecarRestClient(RestClient.Builder builder) {
        log.info("Creating ledger signing sidecar client for {}", sidecar.getUrl());
        return builder.clone()
                .baseUrl(sidecar.getUrl())
                .requestFactory(requestFactory(sidecar.getConnectTimeout(), sidecar.getReadTimeout()))
                .build();
    }

    public boolean hasWallet() {
        return wallet != null && !wallet.isBlank();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connect, Duration read) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connect);
        requestFactory.setReadTimeout(read);
        return requestFactory;
    }

    @Getter
    @Setter
    public static class Sidecar {
        private String url = "http://localhost:3020";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
