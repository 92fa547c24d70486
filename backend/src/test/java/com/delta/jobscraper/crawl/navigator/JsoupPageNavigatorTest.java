package com.delta.jobscraper.crawl.navigator;

import com.delta.jobscraper.config.ScraperProperties;
import com.delta.jobscraper.crawl.error.NavigationException;
import com.delta.jobscraper.crawl.error.SelectorException;
import com.delta.jobscraper.crawl.http.PoliteHttpClient;
import com.delta.jobscraper.crawl.retry.AdaptiveOriginThrottle;
import com.delta.jobscraper.crawl.util.RecordingSleeper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsoupPageNavigatorTest {
    private MockWebServer server;
    private ExecutorService executor;
    private JsoupPageNavigator navigator;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        ScraperProperties properties = new ScraperProperties();
        properties.setRequestMaxRetries(0);
        properties.setRequestTimeoutSeconds(5);
        executor = Executors.newFixedThreadPool(1);
        RecordingSleeper sleeper = new RecordingSleeper();
        AdaptiveOriginThrottle throttle = new AdaptiveOriginThrottle(Duration.ZERO, Duration.ZERO, sleeper);
        navigator = new JsoupPageNavigator(new PoliteHttpClient(properties, executor, throttle, sleeper));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void clickFollowsTheElementLink() {
        server.enqueue(new MockResponse().setBody("<a class=\"next\" href=\"/jobs?page=2\">Next</a>"));
        server.enqueue(new MockResponse().setBody("<a class=\"job\" href=\"/job/9\">Nine</a>"));

        PageHandle first = navigator.navigate(server.url("/jobs").toString());
        PageHandle second = first.click(first.selectOne("a.next").orElseThrow());

        assertThat(second.currentUrl()).endsWith("/jobs?page=2");
        assertThat(second.selectAll("a.job")).singleElement()
            .satisfies(link -> assertThat(link.absoluteUrl("href")).isEqualTo(server.url("/job/9").toString()));
    }

    @Test
    void enterFrameLoadsTheFrameSource() {
        server.enqueue(new MockResponse().setBody("<iframe id=\"jobs\" src=\"/frame\"></iframe>"));
        server.enqueue(new MockResponse().setBody("<a class=\"job\" href=\"/job/1\">One</a>"));

        PageHandle page = navigator.navigate(server.url("/host").toString());
        Optional<PageHandle> frame = page.enterFrame("#jobs");

        assertThat(frame).isPresent();
        assertThat(frame.get().selectAll("a.job")).hasSize(1);
        assertThat(page.enterFrame("#missing")).isEmpty();
    }

    @Test
    void failedLoadIsANavigationException() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> navigator.navigate(server.url("/broken").toString()))
            .isInstanceOf(NavigationException.class)
            .hasMessageContaining("http_500");
    }

    @Test
    void staticPagesCannotRunScriptsOrClickPlainButtons() {
        server.enqueue(new MockResponse().setBody("<button id=\"go\">Go</button>"));

        PageHandle page = navigator.navigate(server.url("/static").toString());

        assertThatThrownBy(() -> page.evaluate("1 + 1")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> page.click(page.selectOne("#go").orElseThrow())).isInstanceOf(SelectorException.class);
        assertThatThrownBy(() -> page.selectAll("a[")).isInstanceOf(SelectorException.class);
    }
}
