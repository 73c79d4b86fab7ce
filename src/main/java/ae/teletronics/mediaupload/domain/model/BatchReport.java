package ae.teletronics.mediaupload.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregated outcome of a batch. Lists keep input order and are unmodifiable.
 */
public record BatchReport(List<UploadOutcome.Success> successes, List<UploadOutcome.Failure> failures) {

    public BatchReport {
        successes = List.copyOf(successes);
        failures = List.copyOf(failures);
    }

    public static BatchReport empty() {
        return new BatchReport(List.of(), List.of());
    }

    public int total() {
        return successes.size() + failures.size();
    }

    public BatchSummary summary() {
        return BatchSummary.of(successes.size(), failures.size());
    }

    /**
     * Not thread-safe; the scheduler serializes access.
     */
    public static final class Builder {
        private final List<UploadOutcome.Success> successes = new ArrayList<>();
        private final List<UploadOutcome.Failure> failures = new ArrayList<>();

        public Builder add(UploadOutcome outcome) {
            if (outcome instanceof UploadOutcome.Success s) {
                successes.add(s);
            } else if (outcome instanceof UploadOutcome.Failure f) {
                failures.add(f);
            }
            return this;
        }

        public int count() {
            return successes.size() + failures.size();
        }

        public BatchReport build() {
            return new BatchReport(successes, failures);
        }
    }
}
