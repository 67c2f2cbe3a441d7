package dev.oppscanner.source.parser;

import dev.oppscanner.model.RawListing;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Craigslist search results (static markup): {@code li.cl-static-search-result}
 * holding a link, {@code div.title}, {@code div.price} and {@code div.location}.
 */
public class CraigslistSearchParser implements ListingParser {

    static final String ITEM_SELECTOR = "li.cl-static-search-result";

    private static final Pattern POSTING_ID = Pattern.compile("/(\\d+)\\.html");

    private final String city;

    public CraigslistSearchParser(String city) {
        this.city = city;
    }

    @Override
    public List<RawListing> parse(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        Document doc = Jsoup.parse(body);
        List<RawListing> listings = new ArrayList<>();

        for (Element result : doc.select(ITEM_SELECTOR)) {
            Element link = result.selectFirst("a[href]");
            if (link == null) {
                continue;
            }
            String href = link.attr("href").trim();
            Element titleElem = result.selectFirst("div.title");
            String title = titleElem != null ? titleElem.text().trim() : result.attr("title").trim();
            if (href.isEmpty() || title.isEmpty()) {
                continue;
            }
            String price = textOf(result, "div.price");
            String location = textOf(result, "div.location");

            RawListing.RawListingBuilder listing = RawListing.builder()
                    .nativeId(postingId(href))
                    .title(title)
                    .body((price + " " + location).trim())
                    .url(href)
                    .extra("city", city);
            if (!location.isEmpty()) {
                listing.extra("location", location);
            }
            listings.add(listing.build());
        }
        return listings;
    }

    static String postingId(String href) {
        Matcher m = POSTING_ID.matcher(href);
        return m.find() ? m.group(1) : ListingParser.contentHash(href);
    }

    private static String textOf(Element parent, String selector) {
        Element el = parent.selectFirst(selector);
        return el != null ? el.text().trim() : "";
    }
}
