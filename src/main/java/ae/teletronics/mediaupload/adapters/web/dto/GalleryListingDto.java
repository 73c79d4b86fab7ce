package ae.teletronics.mediaupload.adapters.web.dto;

import ae.teletronics.mediaupload.domain.model.GalleryItem;
import ae.teletronics.mediaupload.domain.model.GalleryListing;

import java.util.List;

public record GalleryListingDto(
        List<GalleryItem> items,
        GalleryListing.Status status,
        boolean stale,
        String error
) {
    public static GalleryListingDto from(GalleryListing listing) {
        return new GalleryListingDto(listing.items(), listing.status(), listing.isStale(), listing.errorMessage());
    }
}
