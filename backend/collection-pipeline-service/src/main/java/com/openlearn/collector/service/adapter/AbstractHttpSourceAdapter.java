package com.openlearn.collector.service.adapter;

import com.openlearn.collector.exception.CapacityExceededException;
import com.openlearn.collector.exception.ItemValidationException;
import com.openlearn.collector.exception.TransientSourceException;
import com.openlearn.collector.service.SourceDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.TimeoutException;

/**
 * WebClient 기반 어댑터 공통 부분. HTTP 오류를 수집 예외 분류로 변환합니다.
 */
@Slf4j
public abstract class AbstractHttpSourceAdapter implements SourceAdapter {

    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(60);

    protected final SourceDefinition source;
    protected final WebClient webClient;
    protected final Clock clock;

    protected AbstractHttpSourceAdapter(SourceDefinition source, WebClient webClient, Clock clock) {
        this.source = source;
        this.webClient = webClient;
        this.clock = clock;
    }

    @Override
    public String sourceKey() {
        return source.key();
    }

    @Override
    public boolean testConnection() {
        try {
            String body = get(source.url());
            return body != null;
        } catch (RuntimeException e) {
            log.warn("Connection test failed for {}: {}", source.key(), e.getMessage());
            return false;
        }
    }

    protected LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * GET 요청 후 본문을 문자열로 반환합니다.
     */
    protected String get(String url) {
        try {
            String body = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            if (body == null || body.isBlank()) {
                throw new ItemValidationException("Empty response from " + url, source.key());
            }
            return body;
        } catch (WebClientResponseException e) {
            throw translate(e);
        } catch (WebClientRequestException e) {
            throw new TransientSourceException("Request to " + url + " failed: " + e.getMessage(), source.key(), e);
        } catch (IllegalStateException e) {
            if (e.getCause() instanceof TimeoutException) {
                throw new TransientSourceException("Request to " + url + " timed out", source.key(), e);
            }
            throw e;
        }
    }

    private RuntimeException translate(WebClientResponseException e) {
        HttpStatusCode status = e.getStatusCode();
        if (status.value() == 429) {
            return CapacityExceededException.rateLimited(source.key(), parseRetryAfter(e));
        }
        if (status.is5xxServerError() || status.value() == 408) {
            return TransientSourceException.serverError(source.key(), status.value(), e);
        }
        return new ItemValidationException("Upstream rejected request with HTTP " + status.value(), source.key(), e);
    }

    private Duration parseRetryAfter(WebClientResponseException e) {
        String header = e.getHeaders().getFirst("Retry-After");
        if (header == null) {
            return DEFAULT_RETRY_AFTER;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(header.trim()));
        } catch (NumberFormatException ex) {
            log.debug("Unparseable Retry-After '{}' from {}", header, source.key());
            return DEFAULT_RETRY_AFTER;
        }
    }
}
