package com.openlearn.collector.service.adapter;

import com.openlearn.collector.entity.SourceKind;
import com.openlearn.collector.exception.CollectionException;
import com.openlearn.collector.exception.TransientSourceException;
import com.openlearn.collector.service.SourceDefinition;
import com.openlearn.collector.service.ratelimit.SourceRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 설정 가능한 셀렉터로 동작하는 범용 뉴스 스크래퍼.
 *
 * 목록 페이지에서 기사 링크를 찾고 각 기사의 제목/본문을 추출합니다.
 * 기사 페이지 요청마다 소스 rate limiter를 거칩니다.
 */
@Slf4j
public class HtmlScraperSourceAdapter extends AbstractHttpSourceAdapter {

    static final String DEFAULT_LINK_SELECTOR = "article a[href]";
    static final String DEFAULT_TITLE_SELECTOR = "h1";
    static final String DEFAULT_CONTENT_SELECTOR = "article p";
    static final int DEFAULT_MAX_ARTICLES = 20;

    private final SourceRateLimiter rateLimiter;
    private final Duration acquireTimeout;

    public HtmlScraperSourceAdapter(SourceDefinition source, WebClient webClient, SourceRateLimiter rateLimiter,
                                    Duration acquireTimeout, Clock clock) {
        super(source, webClient, clock);
        this.rateLimiter = rateLimiter;
        this.acquireTimeout = acquireTimeout;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.SCRAPER;
    }

    @Override
    public List<RawItem> fetch() {
        Document listing = Jsoup.parse(get(source.url()), source.url());
        List<String> links = articleLinks(listing);

        if (links.isEmpty()) {
            log.debug("No article links on {}, treating listing page as a single document", source.url());
            RawItem single = toItem(listing, source.url(), now());
            return single == null ? List.of() : List.of(single);
        }

        List<RawItem> items = new ArrayList<>();
        int attempted = 0;
        CollectionException lastFailure = null;
        int failed = 0;
        for (String link : links) {
            if (!acquirePermit()) {
                log.info("Rate limit reached for {} after {} articles, remaining links deferred",
                        source.key(), items.size());
                break;
            }
            attempted++;
            try {
                Document article = Jsoup.parse(get(link), link);
                RawItem item = toItem(article, link, now());
                if (item != null) {
                    items.add(item);
                }
            } catch (CollectionException e) {
                failed++;
                lastFailure = e;
                log.warn("Skipping article {} from {}: {}", link, source.key(), e.getMessage());
            }
        }
        if (attempted > 0 && failed == attempted) {
            // 모든 기사가 실패한 실행은 성공으로 기록하지 않는다
            throw new TransientSourceException(
                    "All " + attempted + " articles failed, last: " + lastFailure.getMessage(),
                    source.key(), lastFailure);
        }
        log.debug("Scraped {} articles from {}", items.size(), source.key());
        return items;
    }

    private boolean acquirePermit() {
        try {
            return rateLimiter.tryAcquire(acquireTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private List<String> articleLinks(Document listing) {
        int max = maxArticles();
        Set<String> links = new LinkedHashSet<>();
        listing.select(source.selector("link", DEFAULT_LINK_SELECTOR)).forEach(a -> {
            String href = a.absUrl("href");
            if (!href.isBlank()) {
                links.add(href);
            }
        });
        return links.stream().limit(max).toList();
    }

    private int maxArticles() {
        String value = source.selector("max-articles", null);
        if (value == null) {
            return DEFAULT_MAX_ARTICLES;
        }
        try {
            return Math.max(1, Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid max-articles '{}' for {}, using {}", value, source.key(), DEFAULT_MAX_ARTICLES);
            return DEFAULT_MAX_ARTICLES;
        }
    }

    private RawItem toItem(Document doc, String url, LocalDateTime fetchedAt) {
        doc.select("script, style, nav, footer, aside").remove();

        String title = normalizeText(doc.select(source.selector("title", DEFAULT_TITLE_SELECTOR)).text());
        if (title.isEmpty()) {
            title = normalizeText(doc.title());
        }
        String content = normalizeText(doc.select(source.selector("content", DEFAULT_CONTENT_SELECTOR)).text());
        if (content.isEmpty() && doc.body() != null) {
            content = normalizeText(doc.body().text());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", source.key());
        payload.put("title", title);
        payload.put("content", content);
        payload.put("url", url);
        if (source.category() != null) {
            payload.put("category", source.category());
        }
        payload.put("extracted_at", fetchedAt.toString());
        return new RawItem(source.key(), SourceKind.SCRAPER, fetchedAt, payload);
    }

    /**
     * 공백을 정리하여 텍스트를 정규화
     */
    private String normalizeText(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }
}
