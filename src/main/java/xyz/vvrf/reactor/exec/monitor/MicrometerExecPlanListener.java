package xyz.vvrf.reactor.exec.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 把计划与节点的运行时间、完成状态和背压转换记录到 Micrometer。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MicrometerExecPlanListener implements ExecPlanListener {

    // 指标名称
    public static final String METRIC_NODE_RUN_TIME = "exec.node.run.time";
    public static final String METRIC_NODE_FINISHED_TOTAL = "exec.node.finished.total";
    public static final String METRIC_NODE_START_FAILURE_TOTAL = "exec.node.start.failure.total";
    public static final String METRIC_PLAN_RUN_TIME = "exec.plan.run.time";
    public static final String METRIC_BACKPRESSURE_TRANSITION_TOTAL = "exec.backpressure.transition.total";

    // 标签键
    private static final String TAG_PLAN_NAME = "plan.name";
    private static final String TAG_NODE_LABEL = "node.label";
    private static final String TAG_NODE_KIND = "node.kind";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ERROR = "error";
    private static final String TAG_STATE = "state";

    // 状态标签值
    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_FAILURE = "FAILURE";

    private final MeterRegistry meterRegistry;

    public MicrometerExecPlanListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onPlanStart(ExecPlan plan) {
        // 计时在完成时记录
    }

    @Override
    public void onPlanFinished(ExecPlan plan, Duration totalDuration, Throwable error) {
        Tags tags = Tags.of(
                Tag.of(TAG_PLAN_NAME, plan.getName()),
                Tag.of(TAG_STATUS, error == null ? STATUS_SUCCESS : STATUS_FAILURE));
        recordTimer(METRIC_PLAN_RUN_TIME, "执行计划运行时间", tags, totalDuration);
    }

    @Override
    public void onNodeStart(ExecPlan plan, ExecNode node) {
        // 计时在完成时记录
    }

    @Override
    public void onNodeStartFailure(ExecPlan plan, ExecNode node, Throwable error) {
        Tags tags = nodeTags(plan, node).and(TAG_ERROR, errorTagValue(error));
        incrementCounter(METRIC_NODE_START_FAILURE_TOTAL, "节点启动失败总数", tags);
    }

    @Override
    public void onNodeStop(ExecPlan plan, ExecNode node) {
        // 停止请求不单独计数，节点完成时一并记录
    }

    @Override
    public void onNodeFinished(ExecPlan plan, ExecNode node, Duration duration, Throwable error) {
        Tags tags = nodeTags(plan, node).and(TAG_STATUS, error == null ? STATUS_SUCCESS : STATUS_FAILURE);
        recordTimer(METRIC_NODE_RUN_TIME, "节点从启动到完成的时间", tags, duration);
        if (error != null) {
            tags = tags.and(TAG_ERROR, errorTagValue(error));
        }
        incrementCounter(METRIC_NODE_FINISHED_TOTAL, "按状态统计的节点完成总数", tags);
    }

    @Override
    public void onBackpressureChange(ExecPlan plan, ExecNode node, boolean paused, long bytesInUse) {
        Tags tags = Tags.of(
                Tag.of(TAG_PLAN_NAME, plan.getName()),
                Tag.of(TAG_NODE_LABEL, node.getLabel()),
                Tag.of(TAG_STATE, paused ? "PAUSED" : "RESUMED"));
        incrementCounter(METRIC_BACKPRESSURE_TRANSITION_TOTAL, "汇节点背压状态转换总数", tags);
    }

    private static Tags nodeTags(ExecPlan plan, ExecNode node) {
        return Tags.of(
                Tag.of(TAG_PLAN_NAME, plan.getName()),
                Tag.of(TAG_NODE_LABEL, node.getLabel()),
                Tag.of(TAG_NODE_KIND, node.getKindName()));
    }

    private static String errorTagValue(Throwable error) {
        return error != null ? error.getClass().getSimpleName() : "Unknown";
    }

    private void recordTimer(String name, String description, Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(name)
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标 {} 失败: {}", name, e.getMessage(), e);
        }
    }

    private void incrementCounter(String name, String description, Tags tags) {
        try {
            Counter counter = Counter.builder(name)
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标 {} 失败: {}", name, e.getMessage(), e);
        }
    }
}
