package com.example.chathub.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Client for the identity service. One bounded attempt per call, no retries.
     */
    @Bean
    public RestTemplate identityRestTemplate(RestTemplateBuilder builder, ChathubProperties properties) {
        ChathubProperties.Identity identity = properties.getIdentity();
        return builder
                .rootUri(identity.getBaseUrl())
                .setConnectTimeout(identity.getConnectTimeout())
                .setReadTimeout(identity.getReadTimeout())
                .build();
    }
}
