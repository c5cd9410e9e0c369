package com.subscription.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class IdentityClientConfig {

    @Bean
    public RestClient identityRestClient(RestClient.Builder restClientBuilder,
                                         @Value("${app.identity.base-url}") String baseUrl,
                                         @Value("${app.identity.connect-timeout:2s}") Duration connectTimeout,
                                         @Value("${app.identity.read-timeout:5s}") Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return restClientBuilder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
