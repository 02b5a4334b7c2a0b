package com.newsdigest.aggregator.util;

import lombok.experimental.UtilityClass;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.regex.Pattern;

@UtilityClass
public class HtmlText {

    private final Pattern MULTI_WS = Pattern.compile("\\s+");

    /**
     * Reduces a feed description to plain text: script and style blocks are
     * removed, tags stripped, entities decoded and whitespace collapsed.
     * Returns an empty string for {@code null} or blank input.
     */
    public String sanitize(String html) {
        if (html == null || html.isBlank()) return "";

        Document doc = Jsoup.parseBodyFragment(html);
        doc.select("script, style, noscript").remove();

        String text = doc.body().text();
        return MULTI_WS.matcher(text).replaceAll(" ").trim();
    }

    public String collapseWhitespace(String s) {
        if (s == null) return "";
        return MULTI_WS.matcher(s).replaceAll(" ").trim();
    }
}
