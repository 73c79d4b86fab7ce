package ae.teletronics.mediaupload.application;

import ae.teletronics.mediaupload.application.exceptions.TransportException;
import ae.teletronics.mediaupload.domain.model.GalleryCacheEntry;
import ae.teletronics.mediaupload.domain.model.GalleryItem;
import ae.teletronics.mediaupload.domain.model.GalleryListing;
import ae.teletronics.mediaupload.domain.model.UploadConfiguration;
import ae.teletronics.mediaupload.ports.ClockProvider;
import ae.teletronics.mediaupload.ports.UploadTransport;
import ae.teletronics.mediaupload.ports.UploadTransport.TransportResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GalleryCacheUnitTest {

    private static final String ENDPOINT = "https://storage.example.test/exec";
    private static final String THREE_IMAGES = """
            {"success":true,"images":[
              {"id":"1","url":"https://cdn.example.test/1","thumbnail":"https://cdn.example.test/t1","name":"one.png"},
              {"id":"2","url":"https://cdn.example.test/2","name":"two.png"},
              {"id":"3","url":"https://cdn.example.test/3","thumbnail":null,"name":"three.png"}
            ]}""";
    private static final String ONE_IMAGE = """
            {"success":true,"images":[{"id":"9","url":"https://cdn.example.test/9","name":"nine.png"}]}""";

    final AtomicLong time = new AtomicLong(0);
    final ClockProvider clock = () -> Instant.ofEpochMilli(time.get());

    @Mock UploadTransport transport;
    GalleryCache cache;

    final UploadConfiguration config = UploadConfiguration.builder(ENDPOINT)
            .galleryCacheTtlMs(1_000)
            .galleryTimeoutMs(2_000)
            .build();

    @BeforeEach
    void setUp() {
        cache = new GalleryCache(transport, clock, new ObjectMapper());
    }

    private void respond(String body) {
        when(transport.fetch(anyString(), anyLong())).thenReturn(Mono.just(new TransportResponse(200, body)));
    }

    private GalleryListing listing() {
        return cache.getListing(config).block();
    }

    private static UploadConfiguration configFor(String endpoint) {
        return UploadConfiguration.builder(endpoint).galleryCacheTtlMs(1_000).build();
    }

    // -- freshness ------------------------------------------------------------------

    @Test
    void ttlWindow_servesCache_thenRefreshes() {
        respond(THREE_IMAGES);

        GalleryListing first = listing();
        assertThat(first.status()).isEqualTo(GalleryListing.Status.FRESH);
        assertThat(first.items()).extracting(GalleryItem::remoteId).containsExactly("1", "2", "3");
        assertThat(first.items().get(0).thumbnailUrl()).isEqualTo("https://cdn.example.test/t1");
        assertThat(first.items().get(1).thumbnailUrl()).isNull();
        assertThat(first.items().get(2).thumbnailUrl()).isNull();

        time.set(500);
        GalleryListing second = listing();
        assertThat(second.status()).isEqualTo(GalleryListing.Status.CACHED);
        assertThat(second.items()).isEqualTo(first.items());
        verify(transport, times(1)).fetch(anyString(), anyLong());

        time.set(1_500);
        assertThat(listing().status()).isEqualTo(GalleryListing.Status.FRESH);
        verify(transport, times(2)).fetch(anyString(), anyLong());
    }

    @Test
    void fetch_usesGalleryActionCacheBusterAndGalleryTimeout() {
        respond(ONE_IMAGE);
        time.set(42);

        listing();

        ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
        verify(transport).fetch(url.capture(), eq(2_000L));
        assertThat(url.getValue()).isEqualTo(ENDPOINT + "?action=gallery&_t=42");
    }

    @Test
    void endpointWithQuery_getsParametersAppended() {
        assertThat(GalleryCache.galleryUrl("https://x.test/exec?key=1", 7))
                .isEqualTo("https://x.test/exec?key=1&action=gallery&_t=7");
    }

    // -- failure handling -----------------------------------------------------------

    @Test
    void failedRefresh_servesStaleItems_andKeepsEntry() {
        respond(THREE_IMAGES);
        List<GalleryItem> original = listing().items();
        GalleryCacheEntry before = cache.lookup(GalleryCache.keyFor(ENDPOINT));

        time.set(5_000);
        when(transport.fetch(anyString(), anyLong())).thenReturn(Mono.error(TransportException.timeout(2_000, null)));
        GalleryListing stale = listing();

        assertThat(stale.isStale()).isTrue();
        assertThat(stale.items()).isEqualTo(original).isNotEmpty();
        assertThat(stale.errorMessage()).isEqualTo(UploadNotices.staleGallery());
        assertThat(cache.lookup(GalleryCache.keyFor(ENDPOINT))).isSameAs(before);
    }

    @Test
    void coldFailure_returnsEmptyAndSignalsFailure() {
        when(transport.fetch(anyString(), anyLong()))
                .thenReturn(Mono.error(TransportException.network(new ConnectException("refused"))));

        GalleryListing listing = listing();

        assertThat(listing.isFailed()).isTrue();
        assertThat(listing.items()).isEmpty();
        assertThat(listing.errorMessage()).contains("network error");
        assertThat(cache.size()).isZero();
    }

    @Test
    void successFalseBody_isAFailure_withServerMessage() {
        respond("{\"success\":false,\"error\":\"drive quota\"}");

        GalleryListing listing = listing();

        assertThat(listing.isFailed()).isTrue();
        assertThat(listing.errorMessage()).contains("drive quota");
    }

    @Test
    void successWithoutImageList_keepsPreviousEntry_andServesStale() {
        respond(THREE_IMAGES);
        listing();
        GalleryCacheEntry before = cache.lookup(GalleryCache.keyFor(ENDPOINT));

        time.set(5_000);
        respond("{\"success\":true}");
        GalleryListing missing = listing();

        assertThat(missing.isStale()).isTrue();
        assertThat(missing.items()).hasSize(3);
        assertThat(cache.lookup(GalleryCache.keyFor(ENDPOINT))).isSameAs(before);

        time.set(10_000);
        respond("{\"success\":true,\"images\":\"none\"}");
        assertThat(listing().isStale()).isTrue();
        assertThat(cache.lookup(GalleryCache.keyFor(ENDPOINT))).isSameAs(before);
    }

    @Test
    void successWithoutImageList_onColdCache_isAFailure() {
        respond("{\"success\":true}");

        GalleryListing listing = listing();

        assertThat(listing.isFailed()).isTrue();
        assertThat(listing.errorMessage()).contains("no image list");
        assertThat(cache.size()).isZero();
    }

    @Test
    void forbidden_isReportedAsAccessDenied() {
        when(transport.fetch(anyString(), anyLong()))
                .thenReturn(Mono.error(TransportException.httpStatus(403, "nope")));

        assertThat(listing().errorMessage()).contains("access denied");
    }

    // -- capacity & clearing --------------------------------------------------------

    @Test
    void capacity_evictsOldestInsertedKey() {
        respond(ONE_IMAGE);
        for (int i = 0; i <= GalleryCache.DEFAULT_CAPACITY; i++) {
            cache.getListing(configFor("https://host" + i + ".example.test/exec")).block();
        }

        assertThat(cache.size()).isEqualTo(GalleryCache.DEFAULT_CAPACITY);
        assertThat(cache.lookup(GalleryCache.keyFor("https://host0.example.test/exec"))).isNull();
        assertThat(cache.lookup(GalleryCache.keyFor("https://host1.example.test/exec"))).isNotNull();
    }

    @Test
    void refreshingAKey_doesNotMoveItInEvictionOrder() {
        respond(ONE_IMAGE);
        GalleryCache small = new GalleryCache(transport, clock, new ObjectMapper(), 2);
        UploadConfiguration a = configFor("https://a.example.test");
        UploadConfiguration b = configFor("https://b.example.test");
        UploadConfiguration c = configFor("https://c.example.test");

        small.getListing(a).block();
        small.getListing(b).block();
        time.set(2_000);
        small.getListing(a).block();   // refreshed, still oldest by insertion
        small.getListing(c).block();

        assertThat(small.lookup(GalleryCache.keyFor("https://a.example.test"))).isNull();
        assertThat(small.lookup(GalleryCache.keyFor("https://b.example.test"))).isNotNull();
        assertThat(small.lookup(GalleryCache.keyFor("https://c.example.test"))).isNotNull();
    }

    @Test
    void clearCache_forcesNextLookupToFetch_andIsIdempotent() {
        respond(ONE_IMAGE);
        listing();

        cache.clearCache();
        cache.clearCache();
        assertThat(cache.size()).isZero();

        listing();
        verify(transport, times(2)).fetch(anyString(), anyLong());
    }

    @Test
    void olderFetch_neverReplacesNewerEntry() {
        String key = GalleryCache.keyFor(ENDPOINT);
        GalleryItem newer = new GalleryItem("n", "https://cdn.example.test/n", null, "n");
        GalleryItem older = new GalleryItem("o", "https://cdn.example.test/o", null, "o");

        cache.store(new GalleryCacheEntry(key, List.of(newer), 200));
        cache.store(new GalleryCacheEntry(key, List.of(older), 100));

        assertThat(cache.lookup(key).items()).containsExactly(newer);
    }

    @Test
    void capacityMustBePositive() {
        assertThatThrownBy(() -> new GalleryCache(transport, clock, new ObjectMapper(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
