package com.company.bookingsync.config;

import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

@Configuration
public class CalendlyClientConfig {

    @Bean
    public RestClient calendlyRestClient(RestClient.Builder builder, SyncProperties properties) {
        SyncProperties.Calendly calendly = properties.getCalendly();

        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(calendly.getConnectTimeout())
                .withReadTimeout(calendly.getReadTimeout());

        return builder
                .baseUrl(calendly.getBaseUrl())
                .requestFactory(ClientHttpRequestFactories.get(settings))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
