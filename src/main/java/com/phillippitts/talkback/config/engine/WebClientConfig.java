package com.phillippitts.talkback.config.engine;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * HTTP clients for the three inference servers.
 *
 * <p>All clients share one connection pool. Response timeouts are per engine; streaming engines
 * additionally enforce an idle timeout between increments.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 20 * 1024 * 1024;

    private final ConnectionProvider connectionProvider = ConnectionProvider.builder("talkback-engines")
            .maxConnections(50)
            .pendingAcquireTimeout(Duration.ofSeconds(30))
            .build();

    @Bean("whisperWebClient")
    public WebClient whisperWebClient(WhisperConfig config) {
        return createWebClient(config.baseUrl(), Duration.ofMillis(config.timeoutMs()));
    }

    @Bean("ollamaWebClient")
    public WebClient ollamaWebClient(OllamaConfig config) {
        return createWebClient(config.baseUrl(), Duration.ofMillis(config.idleTimeoutMs()));
    }

    @Bean("kokoroWebClient")
    public WebClient kokoroWebClient(KokoroConfig config) {
        return createWebClient(config.baseUrl(), Duration.ofMillis(config.idleTimeoutMs()));
    }

    private WebClient createWebClient(String baseUrl, Duration responseTimeout) {
        HttpClient httpClient = HttpClient.create(connectionProvider).responseTimeout(responseTimeout);
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }
}
