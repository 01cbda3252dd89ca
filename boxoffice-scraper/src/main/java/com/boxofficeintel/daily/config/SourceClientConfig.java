package com.boxofficeintel.daily.config;

import com.boxofficeintel.daily.service.RequestThrottle;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Beans for talking to the reporting source.
 */
@Configuration
public class SourceClientConfig {

    @Bean
    public RestTemplate sourceRestTemplate(RestTemplateBuilder builder, BoxOfficeProperties properties) {
        BoxOfficeProperties.Source source = properties.getSource();
        return builder
                .setConnectTimeout(Duration.ofMillis(source.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(source.getReadTimeoutMs()))
                .defaultHeader(HttpHeaders.USER_AGENT, source.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml")
                .build();
    }

    @Bean
    public RequestThrottle requestThrottle(BoxOfficeProperties properties) {
        return new RequestThrottle(Duration.ofMillis(properties.getSource().getRequestDelayMs()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
