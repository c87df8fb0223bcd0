package com.example.echocheck.config;

import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * {@link RestClient} instances for the remote collaborators, each with its own timeouts.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient classifierRestClient(RestClient.Builder builder, ClassifierProperties properties) {
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(properties.getConnectTimeout())
                .withReadTimeout(properties.getReadTimeout());
        RestClient.Builder configured = builder.clone()
                .requestFactory(ClientHttpRequestFactories.get(settings));
        if (StringUtils.hasText(properties.getApiToken())) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiToken());
        }
        return configured.build();
    }

    @Bean
    public RestClient authRestClient(RestClient.Builder builder, AuthProperties properties) {
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(properties.getTimeout())
                .withReadTimeout(properties.getTimeout());
        return builder.clone()
                .requestFactory(ClientHttpRequestFactories.get(settings))
                .build();
    }
}
