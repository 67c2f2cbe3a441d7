package dev.oppscanner.source.parser;

import dev.oppscanner.model.RawListing;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Indie Hackers feed page: each post is a {@code div.feed-item} with an {@code h3} title and a link.
 */
public class IndieHackersFeedParser implements ListingParser {

    static final String ITEM_SELECTOR = "div.feed-item";

    private final String siteRoot;

    public IndieHackersFeedParser(String siteRoot) {
        this.siteRoot = siteRoot;
    }

    @Override
    public List<RawListing> parse(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        Document doc = Jsoup.parse(body, siteRoot);
        List<RawListing> listings = new ArrayList<>();

        for (Element post : doc.select(ITEM_SELECTOR)) {
            Element titleElem = post.selectFirst("h3");
            Element linkElem = post.selectFirst("a[href]");
            if (titleElem == null || linkElem == null) {
                continue;
            }
            String title = titleElem.text().trim();
            String href = linkElem.attr("href").trim();
            if (title.isEmpty() || href.isEmpty()) {
                continue;
            }
            String url = href.startsWith("/") ? siteRoot + href : href;
            Element excerpt = post.selectFirst("p");

            listings.add(RawListing.builder()
                    .nativeId(ListingParser.contentHash(href))
                    .title(title)
                    .body(excerpt != null ? excerpt.text() : "Indie Hackers post: " + title)
                    .url(url)
                    .build());
        }
        return listings;
    }
}
