package ae.teletronics.mediaupload.domain.model;

import org.springframework.lang.Nullable;

public record UploadProgress(
        int completedCount,
        int totalCount,
        String assetName,
        boolean succeeded,
        @Nullable String errorMessage
) {
    public static UploadProgress of(int completedCount, int totalCount, UploadOutcome outcome) {
        String error = outcome instanceof UploadOutcome.Failure f ? f.message() : null;
        return new UploadProgress(completedCount, totalCount, outcome.assetName(), outcome.succeeded(), error);
    }
}
