package com.delta.jobscraper.crawl.download;

import com.delta.jobscraper.crawl.navigator.StaticPageNavigator;
import com.delta.jobscraper.crawl.util.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FetchChainTest {

    @Test
    void firstSuccessfulStrategyWins() {
        StaticPageNavigator navigator = new StaticPageNavigator().page("https://acme.example/1", "<p>one</p>");
        FetchStrategy neverCalled = new FetchStrategy() {
            @Override
            public String name() {
                return "unused";
            }

            @Override
            public FetchOutcome fetch(String url) {
                throw new AssertionError("fallback should not run");
            }
        };
        FetchChain chain = new FetchChain(List.of(
            new NavigatorFetchStrategy(navigator, new RecordingSleeper(), Duration.ZERO),
            neverCalled
        ));

        FetchOutcome outcome = chain.fetch("https://acme.example/1");

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.fetchedBy()).isEqualTo("navigator");
        assertThat(outcome.content()).contains("<p>one</p>");
    }

    @Test
    void fallsBackWhenTheNavigatorFails() {
        FetchChain chain = new FetchChain(List.of(
            new NavigatorFetchStrategy(new StaticPageNavigator(), new RecordingSleeper(), Duration.ZERO),
            fixed("http", FetchOutcome.success("<p>from http</p>", "http"))
        ));

        FetchOutcome outcome = chain.fetch("https://acme.example/missing");

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.fetchedBy()).isEqualTo("http");
    }

    @Test
    void returnsTheLastFailureWhenEveryStrategyFails() {
        FetchChain chain = new FetchChain(List.of(
            fixed("first", FetchOutcome.failure("first broke", "first")),
            fixed("second", FetchOutcome.failure("second broke", "second"))
        ));

        FetchOutcome outcome = chain.fetch("https://acme.example/x");

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.error()).isEqualTo("second broke");
    }

    @Test
    void emptyChainIsRejected() {
        assertThatThrownBy(() -> new FetchChain(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    private static FetchStrategy fixed(String name, FetchOutcome outcome) {
        return new FetchStrategy() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public FetchOutcome fetch(String url) {
                return outcome;
            }
        };
    }
}
