package buaa.detect.model;

/**
 * 评测运行状态
 * PENDING -> PROCESSING -> COMPLETED | FAILED，终态不可再变更
 */
public enum RunStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 是否允许从当前状态迁移到目标状态
     */
    public boolean canTransitionTo(RunStatus target) {
        switch (this) {
            case PENDING:
                return target == PROCESSING || target == FAILED;
            case PROCESSING:
                return target == COMPLETED || target == FAILED;
            default:
                return false;
        }
    }
}
