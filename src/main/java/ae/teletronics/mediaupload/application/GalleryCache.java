package ae.teletronics.mediaupload.application;

import ae.teletronics.mediaupload.application.exceptions.GalleryFetchException;
import ae.teletronics.mediaupload.domain.model.GalleryCacheEntry;
import ae.teletronics.mediaupload.domain.model.GalleryItem;
import ae.teletronics.mediaupload.domain.model.GalleryListing;
import ae.teletronics.mediaupload.domain.model.UploadConfiguration;
import ae.teletronics.mediaupload.ports.ClockProvider;
import ae.teletronics.mediaupload.ports.UploadTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Time-bounded cache of the remote gallery listing, keyed by endpoint.
 *
 * <ul>
 *   <li>An entry younger than {@code galleryCacheTtlMs} is served without a network call.</li>
 *   <li>Otherwise the listing is fetched; on success the entry is swapped as a whole.</li>
 *   <li>If the fetch fails, an existing entry (even an expired one) is served as stale and left untouched.
 *       With nothing cached the listing is empty and marked failed.</li>
 *   <li>At most {@code capacity} keys are kept; the oldest-inserted key goes first. Refreshing a key does not
 *       move it.</li>
 * </ul>
 *
 * Not a singleton: whoever needs gallery data owns an instance and decides its lifetime.
 */
public class GalleryCache {

    private static final Logger log = LoggerFactory.getLogger(GalleryCache.class);

    public static final int DEFAULT_CAPACITY = 50;
    static final String KEY_PREFIX = "gallery:";

    private final UploadTransport transport;
    private final ClockProvider clock;
    private final ObjectMapper objectMapper;
    private final int capacity;

    // insertion-ordered; guarded by this
    private final LinkedHashMap<String, GalleryCacheEntry> entries = new LinkedHashMap<>();

    public GalleryCache(UploadTransport transport, ClockProvider clock, ObjectMapper objectMapper, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.transport = transport;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.capacity = capacity;
    }

    public GalleryCache(UploadTransport transport, ClockProvider clock, ObjectMapper objectMapper) {
        this(transport, clock, objectMapper, DEFAULT_CAPACITY);
    }

    public Mono<GalleryListing> getListing(UploadConfiguration config) {
        return Mono.defer(() -> {
            final String key = keyFor(config.endpointUrl());
            final GalleryCacheEntry existing = lookup(key);
            final long now = clock.nowMillis();

            if (existing != null && existing.isFreshAt(now, config.galleryCacheTtlMs())) {
                log.debug("Gallery cache hit for {}", key);
                return Mono.just(GalleryListing.cached(existing.items()));
            }

            return transport.fetch(galleryUrl(config.endpointUrl(), now), config.galleryTimeoutMs())
                    .map(response -> parseListing(response.body()))
                    .map(items -> {
                        store(new GalleryCacheEntry(key, items, now));
                        log.info("Loaded {} gallery item(s) from {}", items.size(), config.endpointUrl());
                        return GalleryListing.fresh(items);
                    })
                    .onErrorResume(e -> Mono.just(recover(key, existing, e)));
        });
    }

    /** Drops every entry. Idempotent. */
    public synchronized void clearCache() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    @Nullable
    public synchronized GalleryCacheEntry lookup(String key) {
        return entries.get(key);
    }

    public static String keyFor(String endpointUrl) {
        return KEY_PREFIX + endpointUrl;
    }

    static String galleryUrl(String endpointUrl, long cacheBuster) {
        String separator = endpointUrl.contains("?") ? "&" : "?";
        return endpointUrl + separator + "action=gallery&_t=" + cacheBuster;
    }

    /**
     * Swaps in the entry unless a fetch that started later already landed.
     */
    synchronized void store(GalleryCacheEntry entry) {
        GalleryCacheEntry current = entries.get(entry.key());
        if (current != null && current.fetchedAtMs() >= entry.fetchedAtMs()) {
            log.debug("Discarding out-of-order gallery result for {}", entry.key());
            return;
        }
        entries.put(entry.key(), entry);
        Iterator<String> oldest = entries.keySet().iterator();
        while (entries.size() > capacity && oldest.hasNext()) {
            String evicted = oldest.next();
            oldest.remove();
            log.debug("Evicted gallery cache entry {}", evicted);
        }
    }

    private GalleryListing recover(String key, @Nullable GalleryCacheEntry existing, Throwable error) {
        String reason = UploadNotices.galleryFailure(error);
        if (existing != null) {
            log.warn("Gallery refresh failed for {} ({}), serving stale data", key, reason);
            return GalleryListing.stale(existing.items(), UploadNotices.staleGallery());
        }
        log.error("Gallery load failed for {}: {}", key, reason, error);
        return GalleryListing.failed("Gallery could not be loaded: " + reason);
    }

    List<GalleryItem> parseListing(String body) {
        final JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new GalleryFetchException("unreadable gallery response", e);
        }
        if (json == null || !json.path("success").asBoolean(false)) {
            String error = json == null ? null : json.path("error").asText(null);
            throw new GalleryFetchException(error != null && !error.isBlank() ? error : "gallery could not be loaded");
        }
        JsonNode images = json.get("images");
        if (images == null || !images.isArray()) {
            throw new GalleryFetchException("gallery response has no image list");
        }
        List<GalleryItem> items = new ArrayList<>();
        for (JsonNode image : images) {
            items.add(new GalleryItem(
                    image.path("id").asText(null),
                    image.path("url").asText(null),
                    image.path("thumbnail").asText(null),
                    image.path("name").asText(null)));
        }
        return items;
    }
}
