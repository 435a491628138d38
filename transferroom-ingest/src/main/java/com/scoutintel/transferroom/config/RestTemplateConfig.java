package com.scoutintel.transferroom.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Two clients against the same API: login is quick, a 10k-player page is not,
 * so each gets its own read timeout.
 *
 * Both run on the JDK HttpClient, which reports a 401 on POST /login as a plain
 * status error rather than a transport failure.
 */
@Configuration
public class RestTemplateConfig {

    private final TransferRoomProperties properties;

    public RestTemplateConfig(TransferRoomProperties properties) {
        this.properties = properties;
    }

    @Bean
    public RestTemplate loginRestTemplate(RestTemplateBuilder builder) {
        return build(builder, properties.getApi().getLoginTimeout());
    }

    @Bean
    public RestTemplate fetchRestTemplate(RestTemplateBuilder builder) {
        return build(builder, properties.getApi().getFetchTimeout());
    }

    private RestTemplate build(RestTemplateBuilder builder, Duration readTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(properties.getApi().getConnectTimeout())
                .build();
        return builder
                .requestFactory(() -> {
                    JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
                    factory.setReadTimeout(readTimeout);
                    return factory;
                })
                .build();
    }
}
