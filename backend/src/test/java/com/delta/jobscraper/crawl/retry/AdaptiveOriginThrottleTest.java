package com.delta.jobscraper.crawl.retry;

import com.delta.jobscraper.crawl.util.ReasonCodeClassifier;
import com.delta.jobscraper.crawl.util.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AdaptiveOriginThrottleTest {

    @Test
    void doublesOnBackoffSignalsUpToCeilingAndResetsOnSuccess() {
        AdaptiveOriginThrottle throttle = new AdaptiveOriginThrottle(
            Duration.ofMillis(1000), Duration.ofMillis(5000), new RecordingSleeper()
        );

        throttle.recordOutcome("Jobs.Example", ReasonCodeClassifier.HTTP_429_RATE_LIMIT);
        assertThat(throttle.currentDelay("jobs.example")).isEqualTo(Duration.ofMillis(2000));
        throttle.recordOutcome("jobs.example", ReasonCodeClassifier.TIMEOUT);
        assertThat(throttle.currentDelay("jobs.example")).isEqualTo(Duration.ofMillis(4000));
        throttle.recordOutcome("jobs.example", ReasonCodeClassifier.HTTP_404);
        assertThat(throttle.currentDelay("jobs.example")).isEqualTo(Duration.ofMillis(5000));

        throttle.recordOutcome("jobs.example", null);
        assertThat(throttle.currentDelay("jobs.example")).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void otherFailuresLeaveTheDelayAlone() {
        AdaptiveOriginThrottle throttle = new AdaptiveOriginThrottle(
            Duration.ofMillis(1000), Duration.ofMillis(5000), new RecordingSleeper()
        );

        throttle.recordOutcome("jobs.example", ReasonCodeClassifier.HTTP_5XX);

        assertThat(throttle.currentDelay("jobs.example")).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void hostsAreThrottledIndependently() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        AdaptiveOriginThrottle throttle = new AdaptiveOriginThrottle(Duration.ofSeconds(30), Duration.ofSeconds(60), sleeper);

        throttle.beforeRequest("a.example");
        throttle.beforeRequest("b.example");
        assertThat(sleeper.sleeps()).isEmpty();

        throttle.beforeRequest("a.example");
        assertThat(sleeper.sleeps()).singleElement()
            .satisfies(wait -> assertThat(wait).isPositive().isLessThanOrEqualTo(Duration.ofSeconds(30)));
    }
}
