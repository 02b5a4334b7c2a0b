package com.newsdigest.aggregator.registry;

import com.newsdigest.aggregator.domain.enums.BiasSpectrum;
import com.newsdigest.aggregator.domain.enums.NewsCategory;
import com.newsdigest.aggregator.domain.model.NewsSource;
import lombok.experimental.UtilityClass;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.newsdigest.aggregator.domain.enums.BiasSpectrum.CENTER;
import static com.newsdigest.aggregator.domain.enums.BiasSpectrum.CENTER_LEFT;
import static com.newsdigest.aggregator.domain.enums.BiasSpectrum.CENTER_RIGHT;
import static com.newsdigest.aggregator.domain.enums.BiasSpectrum.LEFT;
import static com.newsdigest.aggregator.domain.enums.BiasSpectrum.RIGHT;
import static com.newsdigest.aggregator.domain.enums.NewsCategory.BUSINESS;
import static com.newsdigest.aggregator.domain.enums.NewsCategory.ENTERTAINMENT;
import static com.newsdigest.aggregator.domain.enums.NewsCategory.HEALTH;
import static com.newsdigest.aggregator.domain.enums.NewsCategory.SCIENCE;
import static com.newsdigest.aggregator.domain.enums.NewsCategory.SPORTS;
import static com.newsdigest.aggregator.domain.enums.NewsCategory.TECHNOLOGY;
import static com.newsdigest.aggregator.domain.enums.NewsCategory.US;
import static com.newsdigest.aggregator.domain.enums.NewsCategory.WORLD;

/**
 * Built-in feed catalog with bias and credibility ratings (Ad Fontes / AllSides
 * methodology). LOCAL has no built-ins; see {@link #localNewsSource}.
 */
@UtilityClass
public class BuiltInSources {

    private final List<NewsSource> ALL = List.of(
            source("google-news-us", "Google News US", "https://news.google.com/rss?hl=en-US&gl=US&ceid=US:en", US, CENTER, 85, 0.85),
            source("ap-news", "Associated Press", "https://rsshub.app/apnews/topics/apf-topnews", US, CENTER, 95, 0.95),
            source("reuters-us", "Reuters US", "https://www.reutersagency.com/feed/?taxonomy=best-topics&post_type=best", US, CENTER, 95, 0.94),
            source("npr-news", "NPR News", "https://feeds.npr.org/1001/rss.xml", US, CENTER_LEFT, 87, 0.90),
            source("cnn", "CNN", "http://rss.cnn.com/rss/cnn_topstories.rss", US, LEFT, 85, 0.82),
            source("fox-news", "Fox News", "https://moxie.foxnews.com/google-publisher/latest.xml", US, RIGHT, 80, 0.75),

            source("google-news-world", "Google News World", "https://news.google.com/rss/headlines/section/topic/WORLD", WORLD, CENTER, 85, 0.85),
            source("bbc-world", "BBC World", "http://feeds.bbci.co.uk/news/world/rss.xml", WORLD, CENTER_LEFT, 90, 0.92),
            source("al-jazeera", "Al Jazeera", "https://www.aljazeera.com/xml/rss/all.xml", WORLD, CENTER_LEFT, 75, 0.80),
            source("reuters-world", "Reuters World", "https://www.reutersagency.com/feed/?best-topics=international-news", WORLD, CENTER, 95, 0.94),

            source("google-news-business", "Google News Business", "https://news.google.com/rss/headlines/section/topic/BUSINESS", BUSINESS, CENTER, 85, 0.85),
            source("wsj", "Wall Street Journal", "https://feeds.a.dj.com/rss/RSSMarketsMain.xml", BUSINESS, CENTER_RIGHT, 92, 0.91),
            source("cnbc", "CNBC", "https://www.cnbc.com/id/100003114/device/rss/rss.html", BUSINESS, CENTER, 82, 0.85),

            source("google-news-tech", "Google News Tech", "https://news.google.com/rss/headlines/section/topic/TECHNOLOGY", TECHNOLOGY, CENTER, 85, 0.85),
            source("techcrunch", "TechCrunch", "https://techcrunch.com/feed/", TECHNOLOGY, CENTER_LEFT, 80, 0.83),
            source("the-verge", "The Verge", "https://www.theverge.com/rss/index.xml", TECHNOLOGY, CENTER_LEFT, 78, 0.80),
            source("ars-technica", "Ars Technica", "https://feeds.arstechnica.com/arstechnica/index", TECHNOLOGY, CENTER_LEFT, 85, 0.88),

            source("google-news-entertainment", "Google News Entertainment", "https://news.google.com/rss/headlines/section/topic/ENTERTAINMENT", ENTERTAINMENT, CENTER, 80, 0.80),
            source("google-news-sports", "Google News Sports", "https://news.google.com/rss/headlines/section/topic/SPORTS", SPORTS, CENTER, 80, 0.80),
            source("google-news-science", "Google News Science", "https://news.google.com/rss/headlines/section/topic/SCIENCE", SCIENCE, CENTER, 85, 0.88),
            source("google-news-health", "Google News Health", "https://news.google.com/rss/headlines/section/topic/HEALTH", HEALTH, CENTER, 85, 0.87)
    );

    private final Map<NewsCategory, List<NewsSource>> BY_CATEGORY = index();

    public List<NewsSource> all() {
        return ALL;
    }

    public List<NewsSource> forCategory(NewsCategory category) {
        return BY_CATEGORY.getOrDefault(category, List.of());
    }

    /** Google News search feed for the last 24 hours of coverage mentioning the given place. */
    public NewsSource localNewsSource(String city, String state) {
        String query = URLEncoder.encode(city + " " + state, StandardCharsets.UTF_8);
        return source(
                "local-" + city.toLowerCase().replaceAll("[^a-z0-9]+", "-"),
                "Local News - " + city + ", " + state,
                "https://news.google.com/rss/search?q=when:24h+allinurl:" + query,
                NewsCategory.LOCAL, CENTER, 80, 0.82);
    }

    private Map<NewsCategory, List<NewsSource>> index() {
        Map<NewsCategory, List<NewsSource>> map = new EnumMap<>(NewsCategory.class);
        Arrays.stream(NewsCategory.values()).forEach(c -> map.put(c, ALL.stream()
                .filter(s -> s.category() == c)
                .collect(Collectors.toUnmodifiableList())));
        return map;
    }

    private NewsSource source(String id, String name, String url, NewsCategory category,
                              BiasSpectrum bias, int credibility, double factuality) {
        return new NewsSource(id, name, url, category, bias, credibility, factuality);
    }
}
