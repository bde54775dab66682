package com.openlearn.collector.service.adapter;

import com.openlearn.collector.entity.SourceKind;
import com.openlearn.collector.entity.SourcePriority;
import com.openlearn.collector.exception.TransientSourceException;
import com.openlearn.collector.service.SourceDefinition;
import com.openlearn.collector.service.ratelimit.SourceRateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * HtmlScraperSourceAdapter 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class HtmlScraperSourceAdapterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneId.of("UTC"));
    private static final String LISTING = "https://news.example.co/politica";

    @Mock
    private SourceRateLimiter rateLimiter;

    private final StubExchange exchange = new StubExchange();

    private SourceDefinition source(Map<String, String> selectors) {
        return new SourceDefinition("el_tiempo", "El Tiempo", SourceKind.SCRAPER, SourcePriority.HIGH,
                Duration.ofMinutes(15), 30, 5, true, "politics", LISTING, selectors, Map.of());
    }

    private HtmlScraperSourceAdapter adapter(SourceDefinition source) {
        return new HtmlScraperSourceAdapter(source, exchange.webClient(), rateLimiter, Duration.ofSeconds(1), CLOCK);
    }

    private static String listing(String... hrefs) {
        StringBuilder sb = new StringBuilder("<html><body><section>");
        for (String href : hrefs) {
            sb.append("<article><a href=\"").append(href).append("\">nota</a></article>");
        }
        return sb.append("</section></body></html>").toString();
    }

    private static String article(String title, String... paragraphs) {
        StringBuilder sb = new StringBuilder("<html><head><title>ignored</title></head><body>")
                .append("<nav>menu</nav><h1>").append(title).append("</h1><article>");
        for (String p : paragraphs) {
            sb.append("<p>").append(p).append("</p>");
        }
        return sb.append("</article><script>track()</script><footer>pie</footer></body></html>").toString();
    }

    @Test
    @DisplayName("목록의 기사 링크를 따라가 제목과 본문을 추출한다")
    void scrapesLinkedArticles() throws Exception {
        // given
        when(rateLimiter.tryAcquire(any())).thenReturn(true);
        exchange.ok(LISTING, MediaType.TEXT_HTML, listing("/politica/reforma", "/politica/congreso", "/politica/reforma"))
                .ok("https://news.example.co/politica/reforma", MediaType.TEXT_HTML,
                        article("Reforma tributaria", "El gobierno   presentó", "la reforma."))
                .ok("https://news.example.co/politica/congreso", MediaType.TEXT_HTML,
                        article("Congreso", "Debate en el congreso."));

        // when
        List<RawItem> items = adapter(source(Map.of())).fetch();

        // then
        assertThat(items).hasSize(2);
        RawItem first = items.get(0);
        assertThat(first.kind()).isEqualTo(SourceKind.SCRAPER);
        assertThat(first.payload())
                .containsEntry("title", "Reforma tributaria")
                .containsEntry("content", "El gobierno presentó la reforma.")
                .containsEntry("url", "https://news.example.co/politica/reforma")
                .containsEntry("category", "politics");
    }

    @Test
    @DisplayName("rate limit 에 걸리면 그때까지 수집한 기사만 반환한다")
    void stopsWhenRateLimited() throws Exception {
        when(rateLimiter.tryAcquire(any())).thenReturn(true, false);
        exchange.ok(LISTING, MediaType.TEXT_HTML, listing("/a", "/b", "/c"))
                .ok("https://news.example.co/a", MediaType.TEXT_HTML, article("A", "uno"));

        List<RawItem> items = adapter(source(Map.of())).fetch();

        assertThat(items).singleElement().satisfies(i -> assertThat(i.payload()).containsEntry("title", "A"));
        assertThat(exchange.requested).doesNotContain("https://news.example.co/b", "https://news.example.co/c");
    }

    @Test
    @DisplayName("실패한 기사는 건너뛰고 나머지를 수집한다")
    void skipsFailedArticle() throws Exception {
        when(rateLimiter.tryAcquire(any())).thenReturn(true);
        exchange.ok(LISTING, MediaType.TEXT_HTML, listing("/roto", "/bien"))
                .status("https://news.example.co/roto", HttpStatus.INTERNAL_SERVER_ERROR)
                .ok("https://news.example.co/bien", MediaType.TEXT_HTML, article("Bien", "texto"));

        List<RawItem> items = adapter(source(Map.of())).fetch();

        assertThat(items).extracting(i -> i.payload().get("title")).containsExactly("Bien");
    }

    @Test
    @DisplayName("모든 기사가 실패하면 일시적 오류로 실행을 실패시킨다")
    void everyArticleFailedIsTransient() throws Exception {
        when(rateLimiter.tryAcquire(any())).thenReturn(true);
        exchange.ok(LISTING, MediaType.TEXT_HTML, listing("/uno", "/dos"))
                .status("https://news.example.co/uno", HttpStatus.SERVICE_UNAVAILABLE)
                .status("https://news.example.co/dos", HttpStatus.BAD_GATEWAY);

        assertThatThrownBy(() -> adapter(source(Map.of())).fetch())
                .isInstanceOf(TransientSourceException.class)
                .hasMessageContaining("All 2 articles failed");
        assertThat(exchange.requested).contains("https://news.example.co/uno", "https://news.example.co/dos");
    }

    @Test
    @DisplayName("설정된 셀렉터와 max-articles 를 따른다")
    void customSelectors() throws Exception {
        when(rateLimiter.tryAcquire(any())).thenReturn(true);
        String page = "<html><body><ul class=\"news\"><li><a href=\"/x\">x</a></li><li><a href=\"/y\">y</a></li></ul></body></html>";
        exchange.ok(LISTING, MediaType.TEXT_HTML, page)
                .ok("https://news.example.co/x", MediaType.TEXT_HTML,
                        "<html><body><h2 class=\"headline\">Titular</h2><div class=\"body\">Cuerpo</div></body></html>");

        List<RawItem> items = adapter(source(Map.of(
                "link", "ul.news a[href]",
                "title", "h2.headline",
                "content", "div.body",
                "max-articles", "1"))).fetch();

        assertThat(items).singleElement().satisfies(i -> assertThat(i.payload())
                .containsEntry("title", "Titular")
                .containsEntry("content", "Cuerpo"));
    }

    @Test
    @DisplayName("기사 링크가 없으면 목록 페이지 자체를 하나의 문서로 다룬다")
    void singlePageFallback() {
        exchange.ok(LISTING, MediaType.TEXT_HTML, "<html><head><title>Comunicado</title></head><body><p>Texto único</p></body></html>");

        List<RawItem> items = adapter(source(Map.of())).fetch();

        assertThat(items).singleElement().satisfies(i -> assertThat(i.payload())
                .containsEntry("title", "Comunicado")
                .containsEntry("content", "Texto único")
                .containsEntry("url", LISTING));
    }
}
