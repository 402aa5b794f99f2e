package com.toolfederation.federation.config;

import io.netty.channel.ChannelOption;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

@Configuration
public class WebClientConfig {

    /**
     * Client for every peer-facing call. No base URL: each call targets the endpoint of
     * the server being contacted. Per-call deadlines are applied by
     * {@link com.toolfederation.federation.client.PeerClient}; only the TCP connect
     * timeout lives here.
     */
    @Bean
    public WebClient peerWebClient(WebClient.Builder builder, FederationProperties properties) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.connectionTimeoutMs());

        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(WebClientConfig.class)
                .debug("Outbound peer request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
