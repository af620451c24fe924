package com.vaultrebalancer.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Connection settings for the external ranking service that produces recommendation sets.
 *
 * <p>Properties prefix: {@code recommender.*}. Ranking is slow (two LLM passes), so the
 * read timeout is generous and results are cached for {@link #cacheTtl}.
 */
@Configuration
@ConfigurationProperties(prefix = "recommender")
@Getter
@Setter
public class RecommenderConfig {

    private String url = "http://localhost:3030";
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofMinutes(3);
    private Duration cacheTtl = Duration.ofMinutes(30);

    @Bean
    public RestClient recommenderRestClient(RestClient.Builder builder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return builder.clone().baseUrl(url).requestFactory(requestFactory).build();
    }
}
