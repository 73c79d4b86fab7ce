package ae.teletronics.mediaupload.adapters.web.dto;

import ae.teletronics.mediaupload.application.UploadNotices;
import ae.teletronics.mediaupload.domain.model.BatchReport;
import ae.teletronics.mediaupload.domain.model.BatchSummary;
import ae.teletronics.mediaupload.domain.model.UploadOutcome;

import java.util.List;

public record BatchReportDto(
        int total,
        int successCount,
        int failureCount,
        String summary,            // ALL_SUCCEEDED, ALL_FAILED or PARTIAL
        List<UploadOutcome.Success> successes,
        List<UploadOutcome.Failure> failures,
        List<String> notices
) {
    public static BatchReportDto from(BatchReport report) {
        return new BatchReportDto(
                report.total(),
                report.successes().size(),
                report.failures().size(),
                summaryCode(report.summary()),
                report.successes(),
                report.failures(),
                UploadNotices.forReport(report)
        );
    }

    private static String summaryCode(BatchSummary summary) {
        if (summary instanceof BatchSummary.AllSucceeded) return "ALL_SUCCEEDED";
        if (summary instanceof BatchSummary.AllFailed) return "ALL_FAILED";
        return "PARTIAL";
    }
}
