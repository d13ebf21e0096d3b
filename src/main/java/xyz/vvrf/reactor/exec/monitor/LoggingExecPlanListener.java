package xyz.vvrf.reactor.exec.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.time.Duration;

/**
 * 以 {@code [MONITOR]} 前缀把计划与节点的生命周期事件写入日志。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LoggingExecPlanListener implements ExecPlanListener {

    @Override
    public void onPlanStart(ExecPlan plan) {
        log.info("[MONITOR] 计划:[{}] 开始。 节点数:[{}]", plan.getName(), plan.getNodes().size());
    }

    @Override
    public void onPlanFinished(ExecPlan plan, Duration totalDuration, Throwable error) {
        if (error == null) {
            log.info("[MONITOR] 计划:[{}] 成功。 耗时:[{}ms]", plan.getName(), totalDuration.toMillis());
        } else {
            log.error("[MONITOR] 计划:[{}] 失败。 耗时:[{}ms], 错误:[{}]",
                    plan.getName(), totalDuration.toMillis(), error.getMessage());
        }
    }

    @Override
    public void onNodeStart(ExecPlan plan, ExecNode node) {
        log.info("[MONITOR] 计划:[{}] 节点:[{}] 启动。 类型:[{}]", plan.getName(), node.getLabel(), node.getKindName());
    }

    @Override
    public void onNodeStartFailure(ExecPlan plan, ExecNode node, Throwable error) {
        log.error("[MONITOR] 计划:[{}] 节点:[{}] 启动失败。 类型:[{}], 错误:[{}]",
                plan.getName(), node.getLabel(), node.getKindName(), error.getMessage(), error);
    }

    @Override
    public void onNodeStop(ExecPlan plan, ExecNode node) {
        log.info("[MONITOR] 计划:[{}] 节点:[{}] 停止。 类型:[{}]", plan.getName(), node.getLabel(), node.getKindName());
    }

    @Override
    public void onNodeFinished(ExecPlan plan, ExecNode node, Duration duration, Throwable error) {
        if (error == null) {
            log.info("[MONITOR] 计划:[{}] 节点:[{}] 完成。 耗时:[{}ms], 类型:[{}]",
                    plan.getName(), node.getLabel(), duration.toMillis(), node.getKindName());
        } else {
            log.error("[MONITOR] 计划:[{}] 节点:[{}] 失败。 耗时:[{}ms], 错误:[{}], 类型:[{}]",
                    plan.getName(), node.getLabel(), duration.toMillis(), error.getMessage(), node.getKindName());
        }
    }

    @Override
    public void onBackpressureChange(ExecPlan plan, ExecNode node, boolean paused, long bytesInUse) {
        log.warn("[MONITOR] 计划:[{}] 节点:[{}] 背压{}。 缓冲:[{} bytes]",
                plan.getName(), node.getLabel(), paused ? "暂停" : "恢复", bytesInUse);
    }
}
