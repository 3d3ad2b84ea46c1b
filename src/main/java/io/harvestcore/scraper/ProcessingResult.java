package io.harvestcore.scraper;

import io.harvestcore.model.ErrorKind;
import io.harvestcore.model.WorkItemStatus;

import java.util.Map;

public record ProcessingResult(
        Disposition disposition,
        ErrorKind errorKind,
        String error,
        Map<String, Object> resultFields
) {
    public enum Disposition {
        COMPLETED(WorkItemStatus.COMPLETED),
        ZERO_RESULT(WorkItemStatus.ZERO_RESULT),
        BLOCKED(WorkItemStatus.BLOCKED),
        FAILED(WorkItemStatus.FAILED);

        private final WorkItemStatus terminalStatus;

        Disposition(WorkItemStatus terminalStatus) {
            this.terminalStatus = terminalStatus;
        }

        public WorkItemStatus terminalStatus() {
            return terminalStatus;
        }
    }

    public static ProcessingResult completed(Map<String, Object> resultFields) {
        return new ProcessingResult(Disposition.COMPLETED, null, null, resultFields == null ? Map.of() : resultFields);
    }

    public static ProcessingResult zeroResult() {
        return new ProcessingResult(Disposition.ZERO_RESULT, null, null, Map.of());
    }

    public static ProcessingResult blocked(String reason) {
        return new ProcessingResult(Disposition.BLOCKED, null, reason, Map.of());
    }

    public static ProcessingResult failed(ErrorKind kind, String error) {
        return new ProcessingResult(Disposition.FAILED, kind == null ? ErrorKind.BUSINESS : kind, error, Map.of());
    }
}
