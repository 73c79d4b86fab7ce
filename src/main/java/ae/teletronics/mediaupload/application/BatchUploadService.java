package ae.teletronics.mediaupload.application;

import ae.teletronics.mediaupload.domain.model.Asset;
import ae.teletronics.mediaupload.domain.model.BatchReport;
import ae.teletronics.mediaupload.domain.model.UploadConfiguration;
import ae.teletronics.mediaupload.domain.model.UploadErrorKind;
import ae.teletronics.mediaupload.domain.model.UploadOutcome;
import ae.teletronics.mediaupload.domain.model.UploadProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;

/**
 * Uploads an ordered list of assets in consecutive windows of {@code maxConcurrentUploads}.
 *
 * All uploads of a window are in flight together; the next window starts only after every member of the
 * current one has settled. Progress is reported per asset as it settles. The returned Mono always completes
 * with a report covering every input asset: one failure never cancels siblings or later windows.
 */
@Service
public class BatchUploadService {

    private static final Logger log = LoggerFactory.getLogger(BatchUploadService.class);

    private final UploadOrchestrator orchestrator;

    public BatchUploadService(UploadOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public Mono<BatchReport> runBatch(List<Asset> assets, UploadConfiguration config) {
        return runBatch(assets, config, null);
    }

    public Mono<BatchReport> runBatch(List<Asset> assets,
                                      UploadConfiguration config,
                                      @Nullable Consumer<UploadProgress> onProgress) {
        if (assets == null || assets.isEmpty()) {
            return Mono.just(BatchReport.empty());
        }
        final List<Asset> input = List.copyOf(assets);
        final int windowSize = config.maxConcurrentUploads();

        return Mono.defer(() -> {
            BatchRun run = new BatchRun(input.size(), onProgress);
            log.debug("Starting batch of {} asset(s), window size {}", input.size(), windowSize);
            return Flux.fromIterable(input)
                    .index()
                    .buffer(windowSize)
                    .concatMap(window -> runWindow(window, config, run))
                    .then(Mono.fromSupplier(run::finish));
        });
    }

    private Mono<Void> runWindow(List<Tuple2<Long, Asset>> window, UploadConfiguration config, BatchRun run) {
        return Flux.fromIterable(window)
                .flatMap(indexed -> uploadSafely(indexed.getT2(), config)
                                .doOnNext(run::settled)
                                .map(outcome -> Tuples.of(indexed.getT1(), outcome)),
                        window.size())
                .collectSortedList(Comparator.comparingLong((Tuple2<Long, UploadOutcome> t) -> t.getT1()))
                .doOnNext(run::append)
                .then();
    }

    private Mono<UploadOutcome> uploadSafely(Asset asset, UploadConfiguration config) {
        return Mono.defer(() -> orchestrator.upload(asset, config))
                .onErrorResume(e -> {
                    log.error("Unexpected error while uploading {}", asset.name(), e);
                    return Mono.just(unexpected(asset, e));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> unexpected(asset, null)));
    }

    private static UploadOutcome unexpected(Asset asset, @Nullable Throwable e) {
        String detail = e != null && e.getMessage() != null ? e.getMessage() : "upload did not produce a result";
        return new UploadOutcome.Failure(asset.name(), UploadErrorKind.VALIDATION_ERROR,
                UploadNotices.uploadFailure(UploadErrorKind.VALIDATION_ERROR, asset.name(), detail));
    }

    /**
     * Mutable state of one batch. Outcomes of a window may settle on different threads,
     * so counting, progress dispatch and report appends share one lock.
     */
    private static final class BatchRun {
        private final int total;
        @Nullable private final Consumer<UploadProgress> onProgress;
        private final BatchReport.Builder report = new BatchReport.Builder();
        private int completed;

        BatchRun(int total, @Nullable Consumer<UploadProgress> onProgress) {
            this.total = total;
            this.onProgress = onProgress;
        }

        synchronized void settled(UploadOutcome outcome) {
            completed++;
            if (onProgress == null) return;
            try {
                onProgress.accept(UploadProgress.of(completed, total, outcome));
            } catch (RuntimeException e) {
                log.warn("Progress callback failed for {}", outcome.assetName(), e);
            }
        }

        synchronized void append(List<Tuple2<Long, UploadOutcome>> windowOutcomes) {
            windowOutcomes.forEach(t -> report.add(t.getT2()));
        }

        synchronized BatchReport finish() {
            BatchReport built = report.build();
            log.info("Batch finished: {} succeeded, {} failed", built.successes().size(), built.failures().size());
            return built;
        }
    }
}
