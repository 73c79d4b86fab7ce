package ae.teletronics.mediaupload.domain.model;

/**
 * Single classification of a finished batch, used for notifications.
 * An empty batch counts as {@link AllSucceeded}.
 */
public sealed interface BatchSummary permits BatchSummary.AllSucceeded, BatchSummary.AllFailed, BatchSummary.Partial {

    record AllSucceeded(int successCount) implements BatchSummary { }

    record AllFailed(int failureCount) implements BatchSummary { }

    record Partial(int successCount, int failureCount) implements BatchSummary { }

    static BatchSummary of(int successCount, int failureCount) {
        if (failureCount == 0) return new AllSucceeded(successCount);
        if (successCount == 0) return new AllFailed(failureCount);
        return new Partial(successCount, failureCount);
    }
}
