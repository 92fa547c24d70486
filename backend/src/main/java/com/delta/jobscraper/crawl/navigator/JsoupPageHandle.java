package com.delta.jobscraper.crawl.navigator;

import com.delta.jobscraper.crawl.error.SelectorException;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;

import java.util.List;
import java.util.Optional;

class JsoupPageHandle implements PageHandle {
    private final PageNavigator navigator;
    private final Document document;

    JsoupPageHandle(PageNavigator navigator, Document document) {
        this.navigator = navigator;
        this.document = document;
    }

    @Override
    public String currentUrl() {
        return document.location();
    }

    @Override
    public Optional<PageElement> selectOne(String selector) {
        try {
            Element element = document.selectFirst(selector);
            return Optional.ofNullable(element).map(JsoupPageElement::new);
        } catch (Selector.SelectorParseException e) {
            throw new SelectorException(selector, "Invalid selector '" + selector + "': " + e.getMessage(), e);
        }
    }

    @Override
    public List<PageElement> selectAll(String selector) {
        try {
            return document.select(selector).stream()
                .<PageElement>map(JsoupPageElement::new)
                .toList();
        } catch (Selector.SelectorParseException e) {
            throw new SelectorException(selector, "Invalid selector '" + selector + "': " + e.getMessage(), e);
        }
    }

    @Override
    public PageHandle click(PageElement element) {
        String target = element.absoluteUrl("href");
        if (target.isBlank()) {
            throw new SelectorException(
                null,
                "Element <" + describe(element) + "> has no link to follow without script support"
            );
        }
        return navigator.navigate(target);
    }

    @Override
    public Object evaluate(String script) {
        throw new UnsupportedOperationException("Script evaluation is not available for static pages");
    }

    @Override
    public String content() {
        return document.outerHtml();
    }

    @Override
    public Optional<PageHandle> enterFrame(String selector) {
        Optional<PageElement> frame = selectOne(selector);
        if (frame.isEmpty()) {
            return Optional.empty();
        }
        String source = frame.get().absoluteUrl("src");
        if (source.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(navigator.navigate(source));
    }

    private String describe(PageElement element) {
        String id = element.attribute("id");
        return id == null ? element.text() : "#" + id;
    }
}
