package ae.teletronics.mediaupload.domain.model;

import java.util.Objects;

/**
 * Result of exactly one asset's upload attempt.
 */
public sealed interface UploadOutcome permits UploadOutcome.Success, UploadOutcome.Failure {

    String assetName();

    boolean succeeded();

    /**
     * Everything a caller needs to insert a reference to the uploaded asset.
     *
     * @param displayName name reported by the endpoint, falling back to the asset name
     * @param elapsedMs   wall-clock time from request start to parsed response
     */
    record Success(
            String assetName,
            String remoteId,
            String remoteUrl,
            String displayName,
            TransportMode transportMode,
            long elapsedMs,
            String uploadId
    ) implements UploadOutcome {
        public Success {
            Objects.requireNonNull(remoteUrl, "remoteUrl");
            Objects.requireNonNull(transportMode, "transportMode");
        }

        @Override
        public boolean succeeded() { return true; }
    }

    record Failure(String assetName, UploadErrorKind errorKind, String message) implements UploadOutcome {
        public Failure {
            Objects.requireNonNull(errorKind, "errorKind");
        }

        @Override
        public boolean succeeded() { return false; }
    }
}
