package xyz.vvrf.reactor.exec.options;

import lombok.Getter;
import xyz.vvrf.reactor.exec.backpressure.BackpressureMonitor;
import xyz.vvrf.reactor.exec.backpressure.BackpressureOptions;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.node.BatchGenerator;

import java.util.Objects;

/**
 * 生成器汇节点选项。节点创建后通过 {@link #getGenerator()} 拉取结果，
 * 通过 {@link #getBackpressureMonitor()} 观察背压状态。
 *
 * @author ruifeng.wen
 */
public class SinkNodeOptions extends ExecNodeOptions {

    @Getter
    private final BackpressureOptions backpressure;

    private volatile BatchGenerator generator;
    private volatile BackpressureMonitor backpressureMonitor;

    public SinkNodeOptions() {
        this(BackpressureOptions.noBackpressure());
    }

    public SinkNodeOptions(BackpressureOptions backpressure) {
        this.backpressure = Objects.requireNonNull(backpressure, "背压选项不能为空");
    }

    /**
     * 由汇节点在构造时调用。
     */
    public void attach(BatchGenerator generator, BackpressureMonitor backpressureMonitor) {
        this.generator = Objects.requireNonNull(generator, "生成器不能为空");
        this.backpressureMonitor = Objects.requireNonNull(backpressureMonitor, "背压监控不能为空");
    }

    public BatchGenerator getGenerator() {
        if (generator == null) {
            throw ExecPlanException.invalid("%s has not been used to create a sink node yet", getClass().getSimpleName());
        }
        return generator;
    }

    public BackpressureMonitor getBackpressureMonitor() {
        if (backpressureMonitor == null) {
            throw ExecPlanException.invalid("%s has not been used to create a sink node yet", getClass().getSimpleName());
        }
        return backpressureMonitor;
    }
}
