package com.gdin.inspection.erpvector.integrity;

import com.gdin.inspection.erpvector.query.OperationControl;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * fix-orphans：校验 -> 按目标模型归并缺失目标 -> 拉取写入 -> 再校验。
 */
@Slf4j
public class OrphanRepairService {
    private final FkGraphIntegrityEngine engine;
    private final RepairCoordinator coordinator;
    private final int perModelLimit;

    public OrphanRepairService(FkGraphIntegrityEngine engine, RepairCoordinator coordinator, int perModelLimit) {
        this.engine = engine;
        this.coordinator = coordinator;
        this.perModelLimit = Math.max(1, perModelLimit);
    }

    public FixOrphansResult fixOrphans(List<String> models, OperationControl control) {
        OperationControl ctl = control == null ? OperationControl.unbounded() : control;
        ValidationRunReport before = engine.validate(ValidationOptions.builder()
                .models(models)
                .orphanLimit(Integer.MAX_VALUE)
                .build(), ctl);

        Map<String, Set<String>> byTargetModel = new TreeMap<>();
        List<String> skipped = new ArrayList<>();
        for (ModelIntegrityReport report : before.getModels()) {
            for (OrphanRecord orphan : report.getOrphans()) {
                if (orphan.getTargetModel() == null) {
                    skipped.add(orphan.getTargetId());
                    continue;
                }
                byTargetModel.computeIfAbsent(orphan.getTargetModel(), k -> new LinkedHashSet<>()).add(orphan.getTargetId());
            }
        }

        FixOrphansResult result = FixOrphansResult.builder()
                .orphansBefore(before.getTotalOrphans())
                .skippedTargetIds(skipped)
                .build();
        for (Map.Entry<String, Set<String>> e : byTargetModel.entrySet()) {
            if (ctl.shouldStop()) {
                result.setIncomplete(true);
                break;
            }
            List<String> all = new ArrayList<>(e.getValue());
            List<String> batch = all.subList(0, Math.min(all.size(), perModelLimit));
            RepairOutcome outcome = coordinator.repair(e.getKey(), batch, ctl);
            if (!outcome.getDeferred().isEmpty()) result.setIncomplete(true);
            result.getTargets().add(FixOrphansResult.TargetSummary.builder()
                    .targetModel(e.getKey())
                    .missing(all.size())
                    .synced(outcome.getRepaired().size())
                    .failed(outcome.getUnrepairable().size())
                    .deferred(all.size() - batch.size() + outcome.getDeferred().size())
                    .build());
        }

        ValidationRunReport after = engine.validate(ValidationOptions.builder().models(models).build(), ctl);
        result.setAfter(after);
        result.setOrphansAfter(after.getTotalOrphans());
        result.setIncomplete(result.isIncomplete() || before.isIncomplete() || after.isIncomplete());
        log.info("fix orphans: before={}, after={}, target models={}, skipped={}",
                result.getOrphansBefore(), result.getOrphansAfter(), result.getTargets().size(), skipped.size());
        return result;
    }
}
