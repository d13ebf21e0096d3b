package xyz.vvrf.reactor.exec.monitor;

import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.time.Duration;

/**
 * 用于观察执行计划生命周期事件的监听器接口。
 * 包括计划级别和节点级别的事件。回调中抛出的异常会被记录并忽略，不影响计划执行。
 *
 * @author ruifeng.wen
 */
public interface ExecPlanListener {

    /**
     * 计划开始启动时调用，早于任何节点的启动。
     *
     * @param plan 执行计划
     */
    void onPlanStart(ExecPlan plan);

    /**
     * 计划所有节点完成后调用 (无论成功或失败)。
     *
     * @param plan          执行计划
     * @param totalDuration 自启动起的总耗时
     * @param error         计划的最终错误；成功时为 null
     */
    void onPlanFinished(ExecPlan plan, Duration totalDuration, Throwable error);

    /**
     * 即将调用节点的 {@code startProducing()} 时调用。
     *
     * @param plan 执行计划
     * @param node 节点
     */
    void onNodeStart(ExecPlan plan, ExecNode node);

    /**
     * 节点启动失败时调用。
     *
     * @param plan  执行计划
     * @param node  节点
     * @param error 启动错误
     */
    void onNodeStartFailure(ExecPlan plan, ExecNode node, Throwable error);

    /**
     * 即将调用节点的 {@code stopProducing()} 时调用。
     *
     * @param plan 执行计划
     * @param node 节点
     */
    void onNodeStop(ExecPlan plan, ExecNode node);

    /**
     * 已启动节点的完成信号解析时调用。
     *
     * @param plan     执行计划
     * @param node     节点
     * @param duration 自节点启动起的耗时
     * @param error    节点错误；成功时为 null
     */
    void onNodeFinished(ExecPlan plan, ExecNode node, Duration duration, Throwable error);

    /**
     * 汇节点背压状态转换时调用。
     *
     * @param plan       执行计划
     * @param node       汇节点
     * @param paused     转换后是否暂停
     * @param bytesInUse 转换时的缓冲字节数
     */
    void onBackpressureChange(ExecPlan plan, ExecNode node, boolean paused, long bytesInUse);
}
