package ae.teletronics.mediaupload.domain.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable settings for one batch run and for gallery lookups against the same endpoint.
 *
 * Defaults:
 * <ul>
 *   <li>maxFileSizeBytes: 5 MiB</li>
 *   <li>allowedMimeTypes: image/jpeg, image/jpg, image/png, image/gif, image/webp</li>
 *   <li>uploadTimeoutMs: 30 s, galleryTimeoutMs: 15 s, galleryCacheTtlMs: 5 min</li>
 *   <li>maxConcurrentUploads: 3</li>
 * </ul>
 */
public record UploadConfiguration(
        String endpointUrl,
        long maxFileSizeBytes,
        Set<String> allowedMimeTypes,
        long uploadTimeoutMs,
        int maxConcurrentUploads,
        long galleryTimeoutMs,
        long galleryCacheTtlMs
) {
    private static final Logger log = LoggerFactory.getLogger(UploadConfiguration.class);

    public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 5L * 1024 * 1024;
    public static final Set<String> DEFAULT_ALLOWED_MIME_TYPES =
            Set.of("image/jpeg", "image/jpg", "image/png", "image/gif", "image/webp");
    public static final long DEFAULT_UPLOAD_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_MAX_CONCURRENT_UPLOADS = 3;
    public static final long DEFAULT_GALLERY_TIMEOUT_MS = 15_000;
    public static final long DEFAULT_GALLERY_CACHE_TTL_MS = 300_000;

    static final long LARGE_FILE_SIZE_WARNING_BYTES = 100L * 1024 * 1024;

    public UploadConfiguration {
        List<String> errors = new ArrayList<>();
        if (endpointUrl == null || endpointUrl.isBlank()) {
            errors.add("endpointUrl is required");
        } else if (!endpointUrl.startsWith("http://") && !endpointUrl.startsWith("https://")) {
            errors.add("endpointUrl must be a valid http(s) URL");
        }
        if (maxFileSizeBytes <= 0) errors.add("maxFileSizeBytes must be greater than 0");
        if (allowedMimeTypes == null || allowedMimeTypes.isEmpty()) {
            errors.add("allowedMimeTypes must be a non-empty set");
        }
        if (uploadTimeoutMs <= 0) errors.add("uploadTimeoutMs must be greater than 0");
        if (maxConcurrentUploads < 1) errors.add("maxConcurrentUploads must be at least 1");
        if (galleryTimeoutMs <= 0) errors.add("galleryTimeoutMs must be greater than 0");
        if (galleryCacheTtlMs < 0) errors.add("galleryCacheTtlMs must not be negative");
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid upload configuration: " + String.join("; ", errors));
        }
        if (maxFileSizeBytes > LARGE_FILE_SIZE_WARNING_BYTES) {
            log.warn("maxFileSizeBytes={} is unusually large for image uploads", maxFileSizeBytes);
        }
        allowedMimeTypes = normalize(allowedMimeTypes);
    }

    public static Builder builder(String endpointUrl) {
        return new Builder(endpointUrl);
    }

    public boolean allows(String mimeType) {
        return mimeType != null && allowedMimeTypes.contains(mimeType.trim().toLowerCase(Locale.ROOT));
    }

    private static Set<String> normalize(Collection<String> types) {
        Set<String> out = new LinkedHashSet<>();
        for (String t : types) {
            if (t != null && !t.isBlank()) out.add(t.trim().toLowerCase(Locale.ROOT));
        }
        return Set.copyOf(out);
    }

    public static final class Builder {
        private final String endpointUrl;
        private long maxFileSizeBytes = DEFAULT_MAX_FILE_SIZE_BYTES;
        private Set<String> allowedMimeTypes = DEFAULT_ALLOWED_MIME_TYPES;
        private long uploadTimeoutMs = DEFAULT_UPLOAD_TIMEOUT_MS;
        private int maxConcurrentUploads = DEFAULT_MAX_CONCURRENT_UPLOADS;
        private long galleryTimeoutMs = DEFAULT_GALLERY_TIMEOUT_MS;
        private long galleryCacheTtlMs = DEFAULT_GALLERY_CACHE_TTL_MS;

        private Builder(String endpointUrl) {
            this.endpointUrl = endpointUrl;
        }

        public Builder maxFileSizeBytes(long v) { this.maxFileSizeBytes = v; return this; }
        public Builder allowedMimeTypes(Set<String> v) { this.allowedMimeTypes = v; return this; }
        public Builder uploadTimeoutMs(long v) { this.uploadTimeoutMs = v; return this; }
        public Builder maxConcurrentUploads(int v) { this.maxConcurrentUploads = v; return this; }
        public Builder galleryTimeoutMs(long v) { this.galleryTimeoutMs = v; return this; }
        public Builder galleryCacheTtlMs(long v) { this.galleryCacheTtlMs = v; return this; }

        public UploadConfiguration build() {
            return new UploadConfiguration(endpointUrl, maxFileSizeBytes, allowedMimeTypes,
                    uploadTimeoutMs, maxConcurrentUploads, galleryTimeoutMs, galleryCacheTtlMs);
        }
    }
}
