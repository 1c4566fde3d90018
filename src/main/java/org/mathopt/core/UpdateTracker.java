package org.mathopt.core;

import lombok.Getter;
import org.mathopt.elemental.DiffHandle;
import org.mathopt.elemental.Elemental;
import org.mathopt.elemental.ModelUpdate;

import java.util.Optional;

/**
 * 跟踪模型自上一个检查点以来的变更。每个跟踪器相互独立。
 * 从模型中移除后继续使用会抛出 {@link org.mathopt.exceptions.UsedAfterRemovalException}。
 */
public final class UpdateTracker {

    private final Elemental elemental;

    @Getter
    private final DiffHandle diffHandle;

    UpdateTracker(Elemental elemental, DiffHandle diffHandle) {
        this.elemental = elemental;
        this.diffHandle = diffHandle;
    }

    /**
     * @return 自检查点以来的变更，没有变更时返回空。
     */
    public Optional<ModelUpdate> exportUpdate(boolean removeNames) {
        return elemental.exportModelUpdate(diffHandle, removeNames);
    }

    public Optional<ModelUpdate> exportUpdate() {
        return exportUpdate(false);
    }

    /**
     * 把检查点推进到模型的当前状态。
     */
    public void advanceCheckpoint() {
        elemental.advanceDiff(diffHandle);
    }

    Elemental getElemental() {
        return elemental;
    }
}
