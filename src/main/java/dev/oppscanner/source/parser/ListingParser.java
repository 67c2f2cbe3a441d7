package dev.oppscanner.source.parser;

import dev.oppscanner.model.RawListing;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Turns a raw response body (RSS, HTML) into listings.
 * All structural assumptions about a page live in its parser, so markup changes fail here and only here.
 */
public interface ListingParser {

    /**
     * Parse a body. Elements that do not have the expected shape are skipped, never thrown.
     */
    List<RawListing> parse(String body);

    /**
     * Stable id for listings without one: first 12 hex chars of the MD5 of the content.
     */
    static String contentHash(String content) {
        String hex = DigestUtils.md5DigestAsHex((content == null ? "" : content).getBytes(StandardCharsets.UTF_8));
        return hex.substring(0, 12);
    }
}
