package ae.teletronics.mediaupload.domain.model;

import java.util.List;

/**
 * Snapshot of one endpoint's listing. Replaced as a whole, never edited in place.
 */
public record GalleryCacheEntry(String key, List<GalleryItem> items, long fetchedAtMs) {

    public GalleryCacheEntry {
        items = List.copyOf(items);
    }

    public boolean isFreshAt(long nowMs, long ttlMs) {
        return nowMs - fetchedAtMs < ttlMs;
    }
}
