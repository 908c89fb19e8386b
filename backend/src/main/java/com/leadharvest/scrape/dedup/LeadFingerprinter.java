package com.leadharvest.scrape.dedup;

import com.leadharvest.scrape.model.Area;
import com.leadharvest.scrape.model.Lead;
import com.leadharvest.scrape.model.RawListing;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives the stable dedup key for a listing. Two listings whose company name,
 * area name and source normalize to the same text share a fingerprint.
 */
@Component
public class LeadFingerprinter {
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String fingerprint(String companyName, String areaName, String source) {
        String key = normalize(companyName) + "|" + normalize(areaName) + "|" + normalize(source);
        return sha256Hex(key);
    }

    public Lead toLead(RawListing listing, Area area, String clientId, String jobId, String query, String source) {
        if (listing == null || listing.companyName() == null || listing.companyName().isBlank()) {
            return null;
        }
        String companyName = listing.companyName().trim();
        return new Lead(
            fingerprint(companyName, area.name(), source),
            clientId,
            jobId,
            companyName,
            area.name(),
            area.country(),
            listing.address(),
            listing.phone(),
            listing.website(),
            listing.rating(),
            listing.reviewsCount(),
            listing.externalId(),
            query,
            source,
            listing.rawPayload(),
            Instant.now()
        );
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(value.trim().toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
        String spaced = PUNCTUATION.matcher(stripped).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").trim();
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
