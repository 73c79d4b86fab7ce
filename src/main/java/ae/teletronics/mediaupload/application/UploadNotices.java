package ae.teletronics.mediaupload.application;

import ae.teletronics.mediaupload.application.exceptions.TransportException;
import ae.teletronics.mediaupload.domain.model.BatchReport;
import ae.teletronics.mediaupload.domain.model.BatchSummary;
import ae.teletronics.mediaupload.domain.model.UploadErrorKind;
import ae.teletronics.mediaupload.domain.model.UploadOutcome;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Message templates for upload and gallery errors, and the notice lines a UI shows after a batch.
 * Localization is left to the caller; these are the canonical English texts.
 */
public final class UploadNotices {

    /** Up to this many failures are listed one by one, beyond it only a few names plus a count. */
    public static final int INDIVIDUAL_FAILURE_LIMIT = 3;
    static final int SUMMARIZED_NAME_COUNT = 2;

    private UploadNotices() { }

    public static String uploadFailure(UploadErrorKind kind, String assetName, @Nullable String detail) {
        String base = "\"" + assetName + "\" upload failed";
        return switch (kind) {
            case TIMEOUT -> base + ": request timed out";
            case PAYLOAD_TOO_LARGE -> base + ": file is too large for the server";
            case RATE_LIMITED -> base + ": rate limited, wait a moment and try again";
            case SERVER_ERROR -> base + ": server error (" + orDefault(detail, "unknown status") + ")";
            case NETWORK_ERROR -> base + ": network error, check the connection";
            case SERVER_REJECTED -> base + ": " + orDefault(detail, "unknown cause");
            case VALIDATION_ERROR -> base + ": " + orDefault(detail, "file could not be read");
            // validator messages are already complete sentences
            case UNSUPPORTED_TYPE, TOO_LARGE, NAME_TOO_LONG, NAME_INVALID -> orDefault(detail, base);
        };
    }

    public static String galleryFailure(Throwable error) {
        Throwable cause = error;
        while (cause != null && !(cause instanceof TransportException) && !(cause instanceof TimeoutException)
                && cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) return "request timed out";
        if (cause instanceof TransportException te) {
            return switch (te.getKind()) {
                case TIMEOUT -> "request timed out";
                case NETWORK -> "network error";
                case HTTP_STATUS -> switch (te.getStatusCode()) {
                    case 403 -> "access denied";
                    case 429 -> "rate limited, wait a moment and try again";
                    default -> "server error (HTTP " + te.getStatusCode() + ")";
                };
            };
        }
        return orDefault(error.getMessage(), "gallery could not be loaded");
    }

    public static String staleGallery() {
        return "Gallery refresh failed, showing cached data";
    }

    /**
     * Lines to show after a batch: one summary line, and for a partial result the failures,
     * individually when there are few of them.
     */
    public static List<String> forReport(BatchReport report) {
        List<String> lines = new ArrayList<>();
        BatchSummary summary = report.summary();
        if (summary instanceof BatchSummary.AllSucceeded s) {
            lines.add("Uploaded " + s.successCount() + " file(s)");
        } else if (summary instanceof BatchSummary.AllFailed f) {
            lines.add("Failed to upload " + f.failureCount() + " file(s)");
        } else if (summary instanceof BatchSummary.Partial p) {
            lines.add(p.successCount() + " succeeded, " + p.failureCount() + " failed (" + report.total() + " total)");
            List<UploadOutcome.Failure> failures = report.failures();
            if (failures.size() <= INDIVIDUAL_FAILURE_LIMIT) {
                failures.forEach(f -> lines.add(f.assetName() + ": " + f.message()));
            } else {
                String names = failures.stream()
                        .limit(SUMMARIZED_NAME_COUNT)
                        .map(UploadOutcome.Failure::assetName)
                        .collect(Collectors.joining(", "));
                lines.add("Failed files: " + names + " and " + (failures.size() - SUMMARIZED_NAME_COUNT) + " more");
            }
        }
        return lines;
    }

    private static String orDefault(@Nullable String s, String fallback) {
        return s == null || s.isBlank() ? fallback : s;
    }
}
