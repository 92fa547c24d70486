package com.delta.jobscraper.crawl.navigator;

import com.delta.jobscraper.crawl.error.SelectorException;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;

import java.util.List;

class JsoupPageElement implements PageElement {
    private final Element element;

    JsoupPageElement(Element element) {
        this.element = element;
    }

    @Override
    public String attribute(String name) {
        return element.hasAttr(name) ? element.attr(name) : null;
    }

    @Override
    public String absoluteUrl(String attribute) {
        // an empty attribute would otherwise resolve to the page itself
        if (element.attr(attribute).isBlank()) {
            return "";
        }
        return element.absUrl(attribute);
    }

    @Override
    public String text() {
        return element.text();
    }

    @Override
    public List<PageElement> selectAll(String selector) {
        try {
            return element.select(selector).stream()
                .<PageElement>map(JsoupPageElement::new)
                .toList();
        } catch (Selector.SelectorParseException e) {
            throw new SelectorException(selector, "Invalid selector '" + selector + "': " + e.getMessage(), e);
        }
    }
}
