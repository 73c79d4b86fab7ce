package ae.teletronics.mediaupload.domain.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Items returned by the gallery cache plus how they were obtained.
 * {@link Status#STALE} means a refresh failed and older items are served;
 * {@link Status#FAILED} means there was nothing to fall back to and {@code items} is empty.
 */
public record GalleryListing(List<GalleryItem> items, Status status, @Nullable String errorMessage) {

    public enum Status { FRESH, CACHED, STALE, FAILED }

    public GalleryListing {
        items = List.copyOf(items);
    }

    public static GalleryListing fresh(List<GalleryItem> items) {
        return new GalleryListing(items, Status.FRESH, null);
    }

    public static GalleryListing cached(List<GalleryItem> items) {
        return new GalleryListing(items, Status.CACHED, null);
    }

    public static GalleryListing stale(List<GalleryItem> items, String errorMessage) {
        return new GalleryListing(items, Status.STALE, errorMessage);
    }

    public static GalleryListing failed(String errorMessage) {
        return new GalleryListing(List.of(), Status.FAILED, errorMessage);
    }

    public boolean isStale() {
        return status == Status.STALE;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
