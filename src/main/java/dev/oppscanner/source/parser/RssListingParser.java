package dev.oppscanner.source.parser;

import dev.oppscanner.model.RawListing;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses RSS 2.0 {@code <item>} elements (title, link, description, pubDate, category).
 */
@Slf4j
public class RssListingParser implements ListingParser {

    private static final List<DateTimeFormatter> PUB_DATE_FORMATS = List.of(
            DateTimeFormatter.RFC_1123_DATE_TIME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME);

    private final String type;

    public RssListingParser(String type) {
        this.type = type;
    }

    @Override
    public List<RawListing> parse(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        Document doc = Jsoup.parse(body, "", Parser.xmlParser());
        List<RawListing> listings = new ArrayList<>();

        for (Element item : doc.getElementsByTag("item")) {
            String title = childText(item, "title");
            String link = childText(item, "link");
            if (title.isBlank() && link.isBlank()) {
                log.debug("RSS item without title or link skipped");
                continue;
            }

            RawListing.RawListingBuilder listing = RawListing.builder()
                    .nativeId(idFromLink(link, title))
                    .title(title)
                    .body(childText(item, "description"))
                    .url(link)
                    .type(type)
                    .createdAt(toIso(childText(item, "pubDate")));

            String category = childText(item, "category");
            if (!category.isBlank()) {
                listing.extra("category", category);
            }
            listings.add(listing.build());
        }
        return listings;
    }

    /**
     * Last path segment of the link, or a hash of the title when there is no usable link.
     */
    static String idFromLink(String link, String title) {
        if (link == null || link.isBlank()) {
            return ListingParser.contentHash(title);
        }
        String path = link.trim();
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String segment = path.substring(path.lastIndexOf('/') + 1);
        return segment.isBlank() || segment.contains(":") ? ListingParser.contentHash(link) : segment;
    }

    // RFC 1123 or ISO offset dates become ISO-8601 instants; anything else is dropped
    static String toIso(String pubDate) {
        if (pubDate == null || pubDate.isBlank()) {
            return null;
        }
        String trimmed = pubDate.trim();
        for (DateTimeFormatter format : PUB_DATE_FORMATS) {
            try {
                return ZonedDateTime.parse(trimmed, format).toInstant().toString();
            } catch (DateTimeParseException e) {
                log.trace("pubDate '{}' does not match {}", trimmed, format);
            }
        }
        log.debug("Unparseable pubDate '{}' ignored", trimmed);
        return null;
    }

    private static String childText(Element item, String name) {
        for (Element child : item.children()) {
            if (child.tagName().equalsIgnoreCase(name)) {
                return child.text().trim();
            }
        }
        return "";
    }
}
