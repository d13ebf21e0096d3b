package xyz.vvrf.reactor.exec.plan;

/**
 * 执行计划的生命周期状态，只能向后转换。
 *
 * @author ruifeng.wen
 */
public enum PlanState {
    UNVALIDATED,
    VALIDATED,
    RUNNING,
    STOPPING,
    FINISHED;

    public boolean isAfter(PlanState other) {
        return ordinal() > other.ordinal();
    }
}
