package com.delta.jobscraper.crawl.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class JsoupContentExtractor implements ContentExtractor {
    private static final String BOILERPLATE = "script, style, noscript, template, svg, nav, header, footer, form, iframe";
    private static final String BLOCKS = "h1, h2, h3, h4, h5, h6, p, li, dt, dd, td, th, pre, blockquote";

    @Override
    public String extract(String html, String url) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document document = Jsoup.parse(html, url == null ? "" : url);
        document.select(BOILERPLATE).remove();
        Element root = document.selectFirst("main, article, [role=main]");
        if (root == null) {
            root = document.body();
        }
        if (root == null) {
            return "";
        }

        List<String> lines = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Element block : root.select(BLOCKS)) {
            // select() matches the block itself, so more than one hit means nested blocks
            boolean hasNestedBlocks = block.select(BLOCKS).size() > 1;
            addLine(lines, seen, hasNestedBlocks ? block.ownText() : block.text());
        }
        if (lines.isEmpty()) {
            return root.text().trim();
        }
        return String.join("\n", lines);
    }

    private void addLine(List<String> lines, Set<String> seen, String text) {
        String trimmed = text == null ? "" : text.trim();
        if (!trimmed.isEmpty() && seen.add(trimmed)) {
            lines.add(trimmed);
        }
    }
}
