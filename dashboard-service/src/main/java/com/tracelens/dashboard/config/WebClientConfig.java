package com.tracelens.dashboard.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    static final String API_KEY_HEADER = "X-API-Key";

    @Value("${tracelens.feed.base-url}")
    private String baseUrl;

    @Value("${tracelens.feed.api-key:}")
    private String apiKey;

    @Value("${tracelens.feed.timeout-seconds:10}")
    private int timeoutSeconds;

    @Bean
    public WebClient traceFeedWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1000)
            .responseTimeout(Duration.ofSeconds(timeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            );

        WebClient.Builder configured = builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter());
        if (apiKey != null && !apiKey.isBlank()) {
            configured.defaultHeader(API_KEY_HEADER, apiKey);
        }
        log.info("Trace feed client configured. baseUrl={} timeoutSeconds={} apiKey={}",
                 baseUrl, timeoutSeconds, apiKey == null || apiKey.isBlank() ? "none" : "***");
        return configured.build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
