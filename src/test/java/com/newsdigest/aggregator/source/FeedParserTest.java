package com.newsdigest.aggregator.source;

import com.newsdigest.aggregator.domain.enums.BiasSpectrum;
import com.newsdigest.aggregator.domain.enums.NewsCategory;
import com.newsdigest.aggregator.domain.model.Article;
import com.newsdigest.aggregator.domain.model.NewsSource;
import com.newsdigest.aggregator.support.TestArticles;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedParserTest {

    private static final Instant INGESTED = Instant.parse("2024-03-15T12:00:00Z");

    private final FeedParser parser = new FeedParser();
    private final NewsSource source = TestArticles.source("bbc-world");

    private List<Article> parse(String xml) {
        return parser.parse(xml.getBytes(StandardCharsets.UTF_8), null, source, INGESTED);
    }

    @Test
    void parse_rss2_itemsInDocumentOrder() {
        String xml = """
                <?xml version="1.0" encoding="UTF-8"?>
                <rss version="2.0">
                  <channel>
                    <title>Channel title</title>
                    <link>https://example.com/</link>
                    <item>
                      <title>First headline</title>
                      <link>https://example.com/a</link>
                      <pubDate>Fri, 15 Mar 2024 10:30:00 GMT</pubDate>
                      <description><![CDATA[<p>Some <b>bold</b> text &amp; more</p><script>track()</script>]]></description>
                      <enclosure url="https://img.example.com/a.jpg" type="image/jpeg" length="0"/>
                    </item>
                    <item>
                      <title>Second headline</title>
                      <link>https://example.com/b</link>
                      <pubDate>Fri, 15 Mar 2024 11:00:00 +0000</pubDate>
                    </item>
                  </channel>
                </rss>
                """;

        List<Article> out = parse(xml);

        assertEquals(2, out.size());
        Article first = out.get(0);
        assertEquals("First headline", first.getTitle());
        assertEquals("https://example.com/a", first.getUrl());
        assertEquals(Instant.parse("2024-03-15T10:30:00Z"), first.getPublishedAt());
        assertEquals("Some bold text & more", first.getDescription());
        assertEquals("https://img.example.com/a.jpg", first.getImageUrl());
        assertEquals(source, first.getSource());
        assertEquals(source.category(), first.getCategory());

        Article second = out.get(1);
        assertEquals("Second headline", second.getTitle());
        assertNull(second.getDescription());
        assertNull(second.getImageUrl());
    }

    @Test
    void parse_atom_readsLinkHrefPublishedAndSummary() {
        String xml = """
                <?xml version="1.0" encoding="utf-8"?>
                <feed xmlns="http://www.w3.org/2005/Atom">
                  <title>Atom feed</title>
                  <link href="https://example.org/"/>
                  <entry>
                    <title>Atom entry one</title>
                    <link rel="alternate" type="text/html" href="https://example.org/one"/>
                    <link rel="enclosure" type="image/png" href="https://example.org/one.png"/>
                    <id>urn:uuid:1</id>
                    <published>2024-03-15T09:00:00Z</published>
                    <updated>2024-03-15T10:00:00Z</updated>
                    <summary type="html">&lt;p&gt;Summary one&lt;/p&gt;</summary>
                  </entry>
                  <entry>
                    <title>Atom entry two</title>
                    <link rel="self" href="https://example.org/api/two"/>
                    <link href="https://example.org/two"/>
                    <updated>2024-03-15T08:15:00+01:00</updated>
                    <content type="html">Body two</content>
                  </entry>
                </feed>
                """;

        List<Article> out = parse(xml);

        assertEquals(2, out.size());
        assertEquals("https://example.org/one", out.get(0).getUrl());
        assertEquals(Instant.parse("2024-03-15T09:00:00Z"), out.get(0).getPublishedAt());
        assertEquals("Summary one", out.get(0).getDescription());
        assertEquals("https://example.org/one.png", out.get(0).getImageUrl());

        assertEquals("https://example.org/two", out.get(1).getUrl());
        assertEquals(Instant.parse("2024-03-15T07:15:00Z"), out.get(1).getPublishedAt());
        assertEquals("Body two", out.get(1).getDescription());
    }

    @Test
    void parse_rss1_withDublinCoreDate() {
        String xml = """
                <?xml version="1.0"?>
                <rdf:RDF xmlns:rdf="http://www.w3.org/1999/02/22-rdf-syntax-ns#"
                         xmlns="http://purl.org/rss/1.0/"
                         xmlns:dc="http://purl.org/dc/elements/1.1/">
                  <channel rdf:about="https://example.net/">
                    <title>RDF channel</title>
                  </channel>
                  <item rdf:about="https://example.net/x">
                    <title>RDF item</title>
                    <link>https://example.net/x</link>
                    <dc:date>2024-03-14T22:00:00Z</dc:date>
                  </item>
                </rdf:RDF>
                """;

        List<Article> out = parse(xml);

        assertEquals(1, out.size());
        assertEquals("RDF item", out.get(0).getTitle());
        assertEquals(Instant.parse("2024-03-14T22:00:00Z"), out.get(0).getPublishedAt());
    }

    @Test
    void parse_mediaThumbnail_firstNonEmptyUrlWins() {
        String xml = """
                <rss version="2.0" xmlns:media="http://search.yahoo.com/mrss/">
                  <channel>
                    <item>
                      <title>With media</title>
                      <link>https://example.com/m</link>
                      <media:thumbnail url=""/>
                      <media:group>
                        <media:content url="https://img.example.com/m1.jpg" medium="image"/>
                      </media:group>
                      <media:thumbnail url="https://img.example.com/m2.jpg"/>
                    </item>
                  </channel>
                </rss>
                """;

        List<Article> out = parse(xml);

        assertEquals(1, out.size());
        assertEquals("https://img.example.com/m1.jpg", out.get(0).getImageUrl());
    }

    @Test
    void parse_relativeLinkAndThumbnail_resolvedAgainstFeedUrl() {
        String xml = """
                <rss version="2.0">
                  <channel>
                    <item>
                      <title>Relative everything</title>
                      <link>stories/42.html</link>
                      <enclosure url="../img/42.jpg" type="image/jpeg"/>
                    </item>
                  </channel>
                </rss>
                """;
        NewsSource withPath = NewsSource.builder()
                .id("nested")
                .name("Nested feed")
                .feedUrl("https://news.example.com/feeds/world/rss.xml")
                .category(NewsCategory.WORLD)
                .bias(BiasSpectrum.CENTER)
                .credibility(80)
                .factuality(0.8)
                .build();

        List<Article> out = parser.parse(xml.getBytes(StandardCharsets.UTF_8), null, withPath, INGESTED);

        assertEquals(1, out.size());
        assertEquals("https://news.example.com/feeds/world/stories/42.html", out.get(0).getUrl());
        assertEquals("https://news.example.com/feeds/img/42.jpg", out.get(0).getImageUrl());
    }

    @Test
    void parse_contentEncoded_usedWhenNoDescription() {
        String xml = """
                <rss version="2.0" xmlns:content="http://purl.org/rss/1.0/modules/content/">
                  <channel>
                    <item>
                      <title>Encoded</title>
                      <link>https://example.com/e</link>
                      <content:encoded><![CDATA[<div>Full <i>body</i></div>]]></content:encoded>
                    </item>
                  </channel>
                </rss>
                """;

        assertEquals("Full body", parse(xml).get(0).getDescription());
    }

    @Test
    void parse_guidFallbackRelativeLinksAndDroppedItems() {
        String xml = """
                <rss version="2.0">
                  <channel>
                    <item>
                      <link>https://example.com/no-title</link>
                    </item>
                    <item>
                      <title>Guid only</title>
                      <guid>https://example.com/guid</guid>
                    </item>
                    <item>
                      <title>Opaque guid</title>
                      <guid isPermaLink="false">abc-123</guid>
                    </item>
                    <item>
                      <title>Relative link</title>
                      <link>/relative/path</link>
                    </item>
                    <item>
                      <title>Unresolvable link</title>
                      <link>https://exa mple.com/bad path</link>
                    </item>
                    <item>
                      <title>   </title>
                      <link>https://example.com/blank-title</link>
                    </item>
                    <item>
                      <title>Kept</title>
                      <link>https://example.com/kept</link>
                    </item>
                  </channel>
                </rss>
                """;

        List<Article> out = parse(xml);

        assertThat(out).extracting(Article::getTitle).containsExactly("Guid only", "Relative link", "Kept");
        assertEquals("https://example.com/guid", out.get(0).getUrl());
        assertEquals("https://bbc-world.example.com/relative/path", out.get(1).getUrl());
    }

    @Test
    void parse_unparsableOrMissingDate_usesIngestionTime() {
        String xml = """
                <rss version="2.0">
                  <channel>
                    <item>
                      <title>Bad date</title>
                      <link>https://example.com/bad</link>
                      <pubDate>sometime last week</pubDate>
                    </item>
                    <item>
                      <title>No date</title>
                      <link>https://example.com/none</link>
                    </item>
                  </channel>
                </rss>
                """;

        List<Article> out = parse(xml);

        assertEquals(2, out.size());
        assertTrue(out.stream().allMatch(a -> a.getPublishedAt().equals(INGESTED)));
    }

    @Test
    void parse_fragmentedCharacterData_isAppended() {
        String xml = """
                <rss version="2.0">
                  <channel>
                    <item>
                      <title>Markets &amp; <![CDATA[Politics]]> today</title>
                      <link>https://example.com/<![CDATA[frag]]></link>
                    </item>
                  </channel>
                </rss>
                """;

        List<Article> out = parse(xml);

        assertEquals("Markets & Politics today", out.get(0).getTitle());
        assertEquals("https://example.com/frag", out.get(0).getUrl());
    }

    @Test
    void parse_malformedDocument_returnsEmpty() {
        String xml = """
                <rss version="2.0">
                  <channel>
                    <item>
                      <title>Fine</title>
                      <link>https://example.com/fine</link>
                    </item>
                    <item>
                      <title>Broken
                """;

        assertThat(parse(xml)).isEmpty();
        assertThat(parse("this is not xml at all")).isEmpty();
        assertThat(parser.parse(new byte[0], source)).isEmpty();
    }

    @Test
    void parse_honoursDeclaredEncoding() {
        String xml = """
                <?xml version="1.0" encoding="ISO-8859-1"?>
                <rss version="2.0">
                  <channel>
                    <item>
                      <title>Café crème</title>
                      <link>https://example.com/cafe</link>
                    </item>
                  </channel>
                </rss>
                """;

        List<Article> out = parser.parse(xml.getBytes(StandardCharsets.ISO_8859_1), "text/xml", source, INGESTED);

        assertEquals("Café crème", out.get(0).getTitle());
    }

    @Test
    void parse_honoursContentTypeCharset() {
        String xml = """
                <?xml version="1.0"?>
                <rss version="2.0">
                  <channel>
                    <item>
                      <title>Zürich</title>
                      <link>https://example.com/zurich</link>
                    </item>
                  </channel>
                </rss>
                """;

        List<Article> out = parser.parse(xml.getBytes(StandardCharsets.ISO_8859_1),
                "text/xml; charset=ISO-8859-1", source, INGESTED);

        assertEquals("Zürich", out.get(0).getTitle());
    }

    @Test
    void parse_doesNotResolveExternalEntities() {
        String xml = """
                <?xml version="1.0"?>
                <!DOCTYPE rss [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
                <rss version="2.0">
                  <channel>
                    <item>
                      <title>Entity &xxe;</title>
                      <link>https://example.com/xxe</link>
                    </item>
                  </channel>
                </rss>
                """;

        List<Article> out = parse(xml);

        assertThat(out).noneMatch(a -> a.getTitle().contains("root:"));
    }
}
