package com.gdin.inspection.erpvector.integrity;

import lombok.Value;

import java.util.List;

@Value
public class RepairOutcome {
    String targetModel;
    int requested;
    /** 修复后已能在向量库中找到的目标点位 */
    List<String> repaired;
    /** 拉取后仍然不存在的目标点位 */
    List<String> unrepairable;
    /** 取消或超时前没来得及处理的目标点位，下次可以再试 */
    List<String> deferred;
}
