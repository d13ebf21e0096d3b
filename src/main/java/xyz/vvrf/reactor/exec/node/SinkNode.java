package xyz.vvrf.reactor.exec.node;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.exec.backpressure.BackpressureControl;
import xyz.vvrf.reactor.exec.backpressure.BackpressureMonitor;
import xyz.vvrf.reactor.exec.backpressure.BackpressureOptions;
import xyz.vvrf.reactor.exec.backpressure.BackpressureReservoir;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.options.SinkNodeOptions;
import xyz.vvrf.reactor.exec.plan.AbstractExecNode;
import xyz.vvrf.reactor.exec.plan.BatchCounter;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 把收到的批次推入 {@link BatchGenerator}，由计划外部的使用方拉取。
 * <p>
 * 配置了背压时，缓冲字节数超过上限会让上游暂停，被拉走到下限以下时恢复。
 * 计划关闭后生成器随之关闭。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SinkNode extends AbstractExecNode {

    public static final String KIND_NAME = "SinkNode";

    protected final BatchGenerator generator;
    private final BackpressureReservoir reservoir;
    private final BatchCounter inputCounter = new BatchCounter();
    private final AtomicInteger backpressureCounter = new AtomicInteger();

    public SinkNode(ExecPlan plan, List<ExecNode> inputs, SinkNodeOptions options) {
        super(plan, inputs, Collections.singletonList("collected"), inputs.isEmpty() ? null : inputs.get(0).getOutputSchema(), 0);
        BackpressureOptions backpressure = options.getBackpressure();
        this.reservoir = new BackpressureReservoir(backpressure, new InputControl(),
                (paused, bytes) -> plan.notifyBackpressureChange(this, paused, bytes));
        this.generator = new BatchGenerator(reservoir);
        options.attach(generator, reservoir);
        plan.registerCloseHandler(generator::close);
    }

    public static ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        NodeArgs.requireInputs(inputs, 1, KIND_NAME);
        SinkNodeOptions sinkOptions = NodeArgs.castOptions(options, SinkNodeOptions.class, KIND_NAME);
        return plan.addNode(new SinkNode(plan, inputs, sinkOptions));
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }

    public BatchGenerator getGenerator() {
        return generator;
    }

    public BackpressureMonitor getBackpressureMonitor() {
        return reservoir;
    }

    @Override
    public void startProducing() {
        log.debug("汇节点 '{}' ({}) 已启动", getLabel(), getKindName());
    }

    @Override
    public void inputReceived(ExecNode input, ExecBatch batch) {
        if (isFinished()) {
            return;
        }
        accept(batch);
        if (inputCounter.increment()) {
            finish();
        }
    }

    /**
     * 处理一个输入批次，默认直接推入生成器。
     */
    protected void accept(ExecBatch batch) {
        for (ExecBatch slice : ExecBatch.sliceToMaxSize(batch, ExecPlan.MAX_BATCH_SIZE)) {
            generator.push(slice);
        }
    }

    @Override
    public void errorReceived(ExecNode input, Throwable error) {
        log.debug("汇节点 '{}' 收到上游错误: {}", getLabel(), error.toString());
        generator.fail(error);
        if (inputCounter.cancel()) {
            markFinished(null);
        }
        getInputs().get(0).stopProducing(this);
    }

    @Override
    public void inputFinished(ExecNode input, int totalBatches) {
        if (inputCounter.setTotal(totalBatches)) {
            finish();
        }
    }

    @Override
    public void pauseProducing(ExecNode output, int counter) {
        // 没有下游
    }

    @Override
    public void resumeProducing(ExecNode output, int counter) {
        // 没有下游
    }

    @Override
    public void stopProducing(ExecNode output) {
        stopProducing();
    }

    @Override
    public void stopProducing() {
        if (inputCounter.cancel()) {
            finish();
        }
        getInputs().get(0).stopProducing(this);
    }

    /**
     * 全部输入到达或被停止时调用一次。
     */
    protected void finish() {
        generator.end();
        markFinished(null);
    }

    private final class InputControl implements BackpressureControl {

        @Override
        public void pause() {
            getInputs().get(0).pauseProducing(SinkNode.this, backpressureCounter.incrementAndGet());
        }

        @Override
        public void resume() {
            getInputs().get(0).resumeProducing(SinkNode.this, backpressureCounter.incrementAndGet());
        }
    }
}
