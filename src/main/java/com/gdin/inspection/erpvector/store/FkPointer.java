package com.gdin.inspection.erpvector.store;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 外键指针：to-one 为单个点位 ID，to-many 为有序 ID 列表。
 * 空的 to-many 关系不写入 payload，{@link #toMany} 对空列表返回 null。
 */
@EqualsAndHashCode
public class FkPointer {
    private final boolean toMany;
    private final List<String> targetIds;

    private FkPointer(boolean toMany, List<String> targetIds) {
        this.toMany = toMany;
        this.targetIds = Collections.unmodifiableList(targetIds);
    }

    public static FkPointer toOne(String targetId) {
        if (targetId == null) throw new IllegalArgumentException("targetId is required");
        return new FkPointer(false, List.of(targetId));
    }

    public static FkPointer toMany(Collection<String> targetIds) {
        if (targetIds == null || targetIds.isEmpty()) return null;
        return new FkPointer(true, new ArrayList<>(targetIds));
    }

    /**
     * 从 payload 原始值还原，无法识别返回 null
     */
    public static FkPointer fromRaw(Object raw) {
        if (raw instanceof String) return toOne((String) raw);
        if (raw instanceof Collection) {
            List<String> ids = new ArrayList<>();
            for (Object o : (Collection<?>) raw) {
                if (o != null) ids.add(o.toString());
            }
            return toMany(ids);
        }
        return null;
    }

    public boolean isToMany() {
        return toMany;
    }

    public List<String> getTargetIds() {
        return targetIds;
    }

    public Object toRaw() {
        return toMany ? new ArrayList<>(targetIds) : targetIds.get(0);
    }

    @Override
    public String toString() {
        return toMany ? targetIds.toString() : targetIds.get(0);
    }
}
