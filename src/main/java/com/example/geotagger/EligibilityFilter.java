package com.example.geotagger;

import com.example.geotagger.model.ItemDetail;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether an item is worth queueing at all, before looking at its coordinates.
 */
public class EligibilityFilter {
    private static final MediaType JPEG = MediaType.image("jpeg");

    private final Tika tika;
    private final String authorFilter;

    public EligibilityFilter(Tika tika, Optional<String> authorFilter) {
        this.tika = tika;
        this.authorFilter = authorFilter
                .filter(value -> !value.isBlank())
                .map(value -> value.toLowerCase(Locale.ROOT))
                .orElse(null);
    }

    /**
     * Returns the reason the item is excluded, or empty if it is eligible.
     */
    public Optional<String> rejectionReason(ItemDetail detail) {
        if (detail.missing()) {
            return Optional.of("page missing");
        }
        if (detail.redirect()) {
            return Optional.of("redirect");
        }
        if (!isJpeg(detail.id())) {
            return Optional.of("not a JPEG");
        }
        // Items without attribution pass; only a conflicting author excludes.
        if (authorFilter != null && detail.author() != null
                && !detail.author().toLowerCase(Locale.ROOT).contains(authorFilter)) {
            return Optional.of("author mismatch");
        }
        return Optional.empty();
    }

    private boolean isJpeg(String name) {
        MediaType mediaType = MediaType.parse(tika.detect(name));
        return mediaType != null && JPEG.equals(mediaType.getBaseType());
    }
}
