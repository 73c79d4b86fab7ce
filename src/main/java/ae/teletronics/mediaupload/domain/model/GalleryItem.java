package ae.teletronics.mediaupload.domain.model;

import org.springframework.lang.Nullable;

/** Read-only description of a previously uploaded asset. */
public record GalleryItem(
        String remoteId,
        String remoteUrl,
        @Nullable String thumbnailUrl,
        String displayName
) { }
