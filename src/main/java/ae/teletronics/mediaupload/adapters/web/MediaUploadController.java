package ae.teletronics.mediaupload.adapters.web;

import ae.teletronics.mediaupload.adapters.web.dto.BatchReportDto;
import ae.teletronics.mediaupload.adapters.web.dto.GalleryListingDto;
import ae.teletronics.mediaupload.application.BatchUploadService;
import ae.teletronics.mediaupload.application.GalleryCache;
import ae.teletronics.mediaupload.domain.model.Asset;
import ae.teletronics.mediaupload.domain.model.UploadConfiguration;
import ae.teletronics.mediaupload.ports.FileTypeDetector;
import ae.teletronics.mediaupload.ports.StreamSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * HTTP entry point standing in for the editor UI: files in, report out, plus gallery access.
 */
@RestController
@RequestMapping("/media")
public class MediaUploadController {

    private static final Logger log = LoggerFactory.getLogger(MediaUploadController.class);

    private final BatchUploadService batchService;
    private final GalleryCache galleryCache;
    private final UploadConfiguration config;
    private final FileTypeDetector typeDetector;

    public MediaUploadController(BatchUploadService batchService,
                                 GalleryCache galleryCache,
                                 UploadConfiguration config,
                                 FileTypeDetector typeDetector) {
        this.batchService = batchService;
        this.galleryCache = galleryCache;
        this.config = config;
        this.typeDetector = typeDetector;
    }

    @PostMapping(path = "/batch",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<BatchReportDto> uploadBatch(@RequestPart("files") Flux<FilePart> files) {
        return toAssets(files)
                .flatMap(assets -> batchService.runBatch(assets, config))
                .map(BatchReportDto::from);
    }

    /**
     * Same upload, streamed: one {@code progress} event per settled file, then a single {@code report} event.
     */
    @PostMapping(path = "/batch",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> uploadBatchWithProgress(@RequestPart("files") Flux<FilePart> files) {
        return toAssets(files).flatMapMany(assets -> Flux.<ServerSentEvent<Object>>create(sink -> {
            Disposable batch = batchService.runBatch(assets, config, progress -> sink.next(event("progress", progress)))
                    .subscribe(report -> {
                        sink.next(event("report", BatchReportDto.from(report)));
                        sink.complete();
                    }, sink::error);
            sink.onDispose(batch);
        }));
    }

    @GetMapping(path = "/gallery", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<GalleryListingDto> gallery() {
        return galleryCache.getListing(config).map(GalleryListingDto::from);
    }

    @DeleteMapping("/gallery/cache")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> clearGalleryCache() {
        return Mono.fromRunnable(galleryCache::clearCache);
    }

    // ---- helpers --------------------------------------------------------------

    private static ServerSentEvent<Object> event(String name, Object data) {
        return ServerSentEvent.builder(data).event(name).build();
    }

    private Mono<List<Asset>> toAssets(Flux<FilePart> files) {
        return files.concatMap(this::toAsset).collectList();
    }

    /**
     * Streams the part, keeping at most {@code maxFileSizeBytes} in memory. An oversized part still
     * reports its full size, so validation rejects it as too large without it ever being held whole.
     */
    private Mono<Asset> toAsset(FilePart part) {
        final long limit = config.maxFileSizeBytes();
        return part.content()
                .doOnDiscard(DataBuffer.class, DataBufferUtils::release)
                .reduceWith(() -> new BoundedPartBuffer(limit), BoundedPartBuffer::append)
                .map(buffer -> {
                    byte[] bytes = buffer.bytes();
                    if (buffer.truncated()) {
                        log.info("Part {} exceeds {} bytes ({} bytes), kept only its head",
                                part.filename(), limit, buffer.size());
                    }
                    return new Asset(part.filename(), resolveMimeType(part, bytes), buffer.size(),
                            StreamSource.ofBytes(bytes));
                });
    }

    // Declared part type if meaningful, otherwise sniffed; empty means "unknown" and fails validation.
    private String resolveMimeType(FilePart part, byte[] bytes) {
        MediaType declared = part.headers().getContentType();
        if (declared != null && !MediaType.APPLICATION_OCTET_STREAM.equalsTypeAndSubtype(declared)) {
            return (declared.getType() + "/" + declared.getSubtype()).toLowerCase(Locale.ROOT);
        }
        try {
            return typeDetector.detect(StreamSource.ofBytes(bytes), part.filename()).orElse("");
        } catch (IOException e) {
            log.warn("Type detection failed for {}", part.filename(), e);
            return "";
        }
    }

    // Counts every byte of a part but retains only the first `limit` of them.
    private static final class BoundedPartBuffer {
        private final long limit;
        private final ByteArrayOutputStream head = new ByteArrayOutputStream();
        private long size;

        BoundedPartBuffer(long limit) {
            this.limit = limit;
        }

        BoundedPartBuffer append(DataBuffer buffer) {
            try {
                int readable = buffer.readableByteCount();
                long room = limit - head.size();
                if (room > 0) {
                    byte[] chunk = new byte[(int) Math.min(room, readable)];
                    buffer.read(chunk);
                    head.write(chunk, 0, chunk.length);
                }
                size += readable;
                return this;
            } finally {
                DataBufferUtils.release(buffer);
            }
        }

        long size() {
            return size;
        }

        boolean truncated() {
            return size > head.size();
        }

        byte[] bytes() {
            return head.toByteArray();
        }
    }
}
