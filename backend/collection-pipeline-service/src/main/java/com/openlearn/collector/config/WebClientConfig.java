package com.openlearn.collector.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 소스 어댑터가 공유하는 WebClient.
 * 응답 타임아웃은 collector.fetch.timeout 을 넘지 않습니다 (fetch 자체도 같은 값으로 끊김).
 */
@Configuration
public class WebClientConfig {

    @Value("${collector.http.user-agent:OpenLearn-Collector/1.0}")
    private String userAgent;

    @Value("${collector.http.timeout.connect:10000}")
    private int connectTimeoutMillis;

    @Value("${collector.http.timeout.read:30000}")
    private long readTimeoutMillis;

    @Value("${collector.http.max-in-memory-size:5242880}")
    private int maxInMemorySize;

    @Bean
    public WebClient sourceWebClient(CollectorProperties properties) {
        Duration fetchTimeout = properties.getFetch().getTimeout();
        Duration responseTimeout = Duration.ofMillis(Math.min(readTimeoutMillis, fetchTimeout.toMillis()));

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .responseTimeout(responseTimeout)
                .doOnConnected(conn -> conn.addHandlerLast(
                        new ReadTimeoutHandler(responseTimeout.toMillis(), TimeUnit.MILLISECONDS)))
                .followRedirect(true);

        // 정부 API 응답은 기본 256KB 버퍼보다 큰 경우가 많음
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .build();

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "es-CO,es;q=0.9")
                .build();
    }
}
