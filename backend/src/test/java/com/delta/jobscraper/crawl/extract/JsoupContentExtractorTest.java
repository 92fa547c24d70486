package com.delta.jobscraper.crawl.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupContentExtractorTest {
    private final JsoupContentExtractor extractor = new JsoupContentExtractor();

    @Test
    void keepsMainContentAndDropsBoilerplate() {
        String html = """
            <html><head><script>var x = 1;</script><style>p{}</style></head>
            <body>
              <nav><a href="/">Home</a></nav>
              <header>Site header</header>
              <main>
                <h1>Staff Accountant</h1>
                <p>Full time, Richmond VA</p>
                <ul><li>CPA preferred</li><li>3 years experience</li></ul>
              </main>
              <footer>Copyright</footer>
            </body></html>
            """;

        String text = extractor.extract(html, "https://acme.example/jobs/1");

        assertThat(text).isEqualTo("Staff Accountant\nFull time, Richmond VA\nCPA preferred\n3 years experience");
    }

    @Test
    void fallsBackToBodyTextWithoutBlockElements() {
        assertThat(extractor.extract("<body><div>Just a div</div></body>", null)).isEqualTo("Just a div");
    }

    @Test
    void blankInputYieldsEmptyText() {
        assertThat(extractor.extract("  ", "https://acme.example")).isEmpty();
        assertThat(extractor.extract(null, "https://acme.example")).isEmpty();
    }
}
