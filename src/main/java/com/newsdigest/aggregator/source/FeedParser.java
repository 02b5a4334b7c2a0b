package com.newsdigest.aggregator.source;

import com.newsdigest.aggregator.domain.model.Article;
import com.newsdigest.aggregator.domain.model.NewsSource;
import com.newsdigest.aggregator.util.HtmlText;
import com.rometools.rome.io.XmlReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Streaming RSS 2.0 / RSS 1.0 / Atom parser.
 *
 * <p>The parser itself holds no per-document state: every call to
 * {@link #parse} runs its own {@link ParseSession}, so one instance can serve
 * any number of concurrent fetches.</p>
 */
@Slf4j
@Component
public class FeedParser {

    static final String ATOM_NS = "http://www.w3.org/2005/Atom";
    static final String RSS1_NS = "http://purl.org/rss/1.0/";
    static final String CONTENT_NS = "http://purl.org/rss/1.0/modules/content/";
    static final String DC_NS = "http://purl.org/dc/elements/1.1/";

    private final XMLInputFactory xmlInputFactory;

    public FeedParser() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        factory.setProperty(XMLInputFactory.IS_COALESCING, false);
        this.xmlInputFactory = factory;
    }

    public List<Article> parse(byte[] body, NewsSource source) {
        return parse(body, null, source, Instant.now());
    }

    /**
     * Parses one feed document. Never throws: an unreadable document yields an
     * empty list.
     *
     * @param contentType HTTP Content-Type of the response; its charset, when present, takes part in detection. May be null
     * @param ingestedAt  timestamp given to items whose date is missing or unparsable
     */
    public List<Article> parse(byte[] body, String contentType, NewsSource source, Instant ingestedAt) {
        if (body == null || body.length == 0) {
            log.warn("Feed: empty body sourceId={}", source.id());
            return List.of();
        }
        try {
            return parseOrThrow(body, contentType, source, ingestedAt);
        } catch (XMLStreamException | IOException e) {
            log.warn("Feed: unparsable document sourceId={} err={}", source.id(), e.toString());
            return List.of();
        }
    }

    private List<Article> parseOrThrow(byte[] body, String contentType, NewsSource source, Instant ingestedAt)
            throws XMLStreamException, IOException {
        InputStream in = new ByteArrayInputStream(body);
        // text/xml without a charset parameter would force US-ASCII; let the prolog decide then
        boolean declaresCharset = contentType != null && contentType.toLowerCase(Locale.ROOT).contains("charset=");
        try (XmlReader xml = declaresCharset ? new XmlReader(in, contentType) : new XmlReader(in)) {
            XMLStreamReader reader = xmlInputFactory.createXMLStreamReader(xml);
            try {
                ParseSession session = new ParseSession(source, ingestedAt);
                while (reader.hasNext()) {
                    switch (reader.next()) {
                        case XMLStreamConstants.START_ELEMENT -> session.onStart(reader);
                        case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA -> session.onText(reader.getText());
                        case XMLStreamConstants.END_ELEMENT -> session.onEnd(reader);
                        default -> {
                        }
                    }
                }
                log.debug("Feed: parsed sourceId={} articles={} dropped={}",
                        source.id(), session.articles.size(), session.dropped);
                return session.articles;
            } finally {
                reader.close();
            }
        }
    }

    private enum ParserState {
        IDLE,
        IN_ITEM
    }

    private enum ItemField {
        TITLE,
        LINK,
        GUID,
        DESCRIPTION,
        PUBLISHED,
        UPDATED
    }

    /**
     * Text collected for the item currently open. Each field keeps the first
     * element that produced content; later elements of the same kind are ignored.
     */
    private static final class ItemAccumulator {
        private final Map<ItemField, StringBuilder> fields = new EnumMap<>(ItemField.class);
        private String imageUrl;

        void append(ItemField field, String text) {
            fields.computeIfAbsent(field, f -> new StringBuilder()).append(text);
        }

        boolean has(ItemField field) {
            StringBuilder sb = fields.get(field);
            return sb != null && !sb.toString().isBlank();
        }

        String text(ItemField field) {
            StringBuilder sb = fields.get(field);
            return sb == null ? "" : sb.toString().trim();
        }

        void offerImage(String url) {
            if (imageUrl == null && url != null && !url.isBlank()) {
                imageUrl = url.trim();
            }
        }
    }

    /** Per-document parser state. Invariant: {@code item != null} exactly when {@code state == IN_ITEM}. */
    private static final class ParseSession {
        private final NewsSource source;
        private final Instant ingestedAt;
        private final URI base;
        private final List<Article> articles = new ArrayList<>();

        private ParserState state = ParserState.IDLE;
        private ItemAccumulator item;
        private ItemField openField;
        private int depth;
        private int itemDepth;
        private int fieldDepth;
        private int dropped;

        ParseSession(NewsSource source, Instant ingestedAt) {
            this.source = source;
            this.ingestedAt = ingestedAt;
            this.base = baseUri(source.feedUrl());
        }

        void onStart(XMLStreamReader reader) {
            depth++;
            String local = reader.getLocalName();
            String ns = reader.getNamespaceURI();

            if (isItemBoundary(local, ns)) {
                if (state == ParserState.IDLE) {
                    state = ParserState.IN_ITEM;
                    item = new ItemAccumulator();
                    openField = null;
                    itemDepth = depth;
                }
                return;
            }
            if (state != ParserState.IN_ITEM || openField != null) {
                return;
            }

            collectThumbnail(reader, local, ns);

            if (isCore(ns) && "link".equals(local)) {
                String href = reader.getAttributeValue(null, "href");
                if (href != null && !href.isBlank()) {
                    String rel = reader.getAttributeValue(null, "rel");
                    if ((rel == null || "alternate".equals(rel)) && !item.has(ItemField.LINK)) {
                        item.append(ItemField.LINK, href);
                    }
                    return;
                }
            }
            if (isCore(ns) && "guid".equals(local)
                    && "false".equalsIgnoreCase(reader.getAttributeValue(null, "isPermaLink"))) {
                return;
            }

            ItemField field = fieldFor(local, ns);
            if (field != null && !item.has(field)) {
                openField = field;
                fieldDepth = depth;
            }
        }

        void onText(String text) {
            if (state == ParserState.IN_ITEM && openField != null) {
                item.append(openField, text);
            }
        }

        void onEnd(XMLStreamReader reader) {
            if (state == ParserState.IN_ITEM) {
                if (openField != null && depth == fieldDepth) {
                    openField = null;
                } else if (depth == itemDepth && isItemBoundary(reader.getLocalName(), reader.getNamespaceURI())) {
                    emit();
                    state = ParserState.IDLE;
                    item = null;
                    openField = null;
                }
            }
            depth--;
        }

        private void collectThumbnail(XMLStreamReader reader, String local, String ns) {
            if (isCore(ns)) {
                if ("enclosure".equals(local)) {
                    item.offerImage(reader.getAttributeValue(null, "url"));
                } else if ("link".equals(local) && "enclosure".equals(reader.getAttributeValue(null, "rel"))) {
                    String type = reader.getAttributeValue(null, "type");
                    if (type != null && type.toLowerCase(Locale.ROOT).startsWith("image/")) {
                        item.offerImage(reader.getAttributeValue(null, "href"));
                    }
                }
            } else if ("content".equals(local) || "thumbnail".equals(local)) {
                // media:content / media:thumbnail, whatever URI the feed bound the prefix to
                item.offerImage(reader.getAttributeValue(null, "url"));
            }
        }

        private void emit() {
            String title = HtmlText.collapseWhitespace(item.text(ItemField.TITLE));
            String link = item.has(ItemField.LINK) ? item.text(ItemField.LINK) : item.text(ItemField.GUID);

            if (title.isEmpty() || link.isEmpty()) {
                dropped++;
                log.debug("Feed: skip item (missing title or link) sourceId={} title='{}' link='{}'",
                        source.id(), title, link);
                return;
            }
            String url = resolve(link);
            if (url == null) {
                dropped++;
                log.debug("Feed: skip item (unresolvable link) sourceId={} link='{}'", source.id(), link);
                return;
            }

            String rawDate = item.has(ItemField.PUBLISHED) ? item.text(ItemField.PUBLISHED) : item.text(ItemField.UPDATED);
            Instant publishedAt = FeedDates.parse(rawDate).orElse(ingestedAt);

            String description = HtmlText.sanitize(item.text(ItemField.DESCRIPTION));

            articles.add(Article.builder()
                    .title(title)
                    .source(source)
                    .url(url)
                    .publishedAt(publishedAt)
                    .category(source.category())
                    .description(description.isEmpty() ? null : description)
                    .imageUrl(item.imageUrl != null ? resolve(item.imageUrl) : null)
                    .build());
        }

        private static boolean isItemBoundary(String local, String ns) {
            return ("item".equals(local) || "entry".equals(local)) && isCore(ns);
        }

        private static boolean isCore(String ns) {
            return ns == null || ns.isEmpty() || ATOM_NS.equals(ns) || RSS1_NS.equals(ns);
        }

        private static ItemField fieldFor(String local, String ns) {
            if (isCore(ns)) {
                return switch (local) {
                    case "title" -> ItemField.TITLE;
                    case "link" -> ItemField.LINK;
                    case "guid" -> ItemField.GUID;
                    case "description", "summary", "content" -> ItemField.DESCRIPTION;
                    case "pubDate", "published", "issued" -> ItemField.PUBLISHED;
                    case "updated", "modified" -> ItemField.UPDATED;
                    default -> null;
                };
            }
            if (CONTENT_NS.equals(ns) && "encoded".equals(local)) {
                return ItemField.DESCRIPTION;
            }
            if (DC_NS.equals(ns) && "date".equals(local)) {
                return ItemField.PUBLISHED;
            }
            return null;
        }

        /** Absolute form of {@code value}; relative references are resolved against the feed URL. */
        private String resolve(String value) {
            try {
                URI uri = new URI(value.trim());
                if (uri.isAbsolute()) {
                    return uri.toString();
                }
                if (base == null) {
                    return null;
                }
                URI resolved = base.resolve(uri);
                return resolved.isAbsolute() ? resolved.toString() : null;
            } catch (URISyntaxException | IllegalArgumentException e) {
                return null;
            }
        }

        private static URI baseUri(String feedUrl) {
            try {
                URI uri = new URI(feedUrl.trim());
                return uri.isAbsolute() ? uri : null;
            } catch (URISyntaxException e) {
                return null;
            }
        }
    }
}
