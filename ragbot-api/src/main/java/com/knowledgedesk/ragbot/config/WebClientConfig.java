package com.knowledgedesk.ragbot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient qdrantWebClient(RagbotProperties properties) {
        RagbotProperties.Index index = properties.index();
        WebClient.Builder builder = jsonClient(index.baseUrl(), index.timeout(), 4 * 1024 * 1024);
        if (!index.apiKey().isBlank()) {
            builder.defaultHeader("api-key", index.apiKey());
        }
        return builder.build();
    }

    @Bean
    public WebClient embeddingsWebClient(RagbotProperties properties) {
        RagbotProperties.Embedding embedding = properties.embedding();
        return withBearer(jsonClient(embedding.baseUrl(), embedding.timeout(), 16 * 1024 * 1024), embedding.apiKey())
                .build();
    }

    @Bean
    public WebClient llmWebClient(RagbotProperties properties) {
        RagbotProperties.Llm llm = properties.llm();
        return withBearer(jsonClient(llm.baseUrl(), llm.timeout(), 4 * 1024 * 1024), llm.apiKey())
                .build();
    }

    @Bean
    public WebClient slackWebClient(RagbotProperties properties) {
        RagbotProperties.Slack slack = properties.slack();
        return withBearer(WebClient.builder()
                .baseUrl(slack.baseUrl())
                .exchangeStrategies(exchangeStrategies(properties.fetch().maxBytes()))
                .clientConnector(connector(properties.fetch().timeout(), true)), slack.botToken())
                .build();
    }

    @Bean
    public WebClient fetchWebClient(RagbotProperties properties) {
        RagbotProperties.Fetch fetch = properties.fetch();
        return WebClient.builder()
                .exchangeStrategies(exchangeStrategies(fetch.maxBytes()))
                .clientConnector(connector(fetch.timeout(), true))
                .defaultHeader(HttpHeaders.USER_AGENT, fetch.userAgent())
                .build();
    }

    private WebClient.Builder jsonClient(String baseUrl, Duration timeout, int maxInMemorySize) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies(maxInMemorySize))
                .clientConnector(connector(timeout, false))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
    }

    private WebClient.Builder withBearer(WebClient.Builder builder, String token) {
        if (token != null && !token.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }
        return builder;
    }

    private ReactorClientHttpConnector connector(Duration timeout, boolean followRedirects) {
        HttpClient httpClient = HttpClient.create().followRedirect(followRedirects);
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            httpClient = httpClient.responseTimeout(timeout);
        }
        return new ReactorClientHttpConnector(httpClient);
    }

    private ExchangeStrategies exchangeStrategies(int maxInMemorySize) {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .build();
    }
}
