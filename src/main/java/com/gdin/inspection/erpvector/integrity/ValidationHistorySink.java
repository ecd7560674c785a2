package com.gdin.inspection.erpvector.integrity;

import java.util.List;
import java.util.Optional;

public interface ValidationHistorySink {

    ValidationHistoryEntry append(ValidationRunReport report);

    /**
     * 某个模型最近的记录，旧的在前
     */
    List<ValidationHistoryEntry.ModelHistory> trend(String model, int limit);

    Optional<ValidationHistoryEntry> lastRun();
}
