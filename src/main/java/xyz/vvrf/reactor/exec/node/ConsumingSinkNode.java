package xyz.vvrf.reactor.exec.node;

import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.vector.types.pojo.Schema;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.exec.backpressure.BackpressureControl;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.Schemas;
import xyz.vvrf.reactor.exec.options.ConsumingSinkNodeOptions;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.plan.AbstractExecNode;
import xyz.vvrf.reactor.exec.plan.BatchCounter;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 把推送协议适配到外部提供的 {@link SinkNodeConsumer}。
 * <p>
 * 启动时检查输出列名数量并调用 {@code init}；每个批次调用 {@code consume}；
 * 输入结束、出错或被停止时调用一次 {@code finish}，节点在其返回的信号完成后才完成。
 * 最终状态取第一个出现的错误。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ConsumingSinkNode extends AbstractExecNode {

    public static final String KIND_NAME = "ConsumingSinkNode";

    private final SinkNodeConsumer consumer;
    private final List<String> names;
    private final BatchCounter inputCounter = new BatchCounter();
    private final AtomicInteger backpressureCounter = new AtomicInteger();

    public ConsumingSinkNode(ExecPlan plan, List<ExecNode> inputs, SinkNodeConsumer consumer, List<String> names) {
        super(plan, inputs, Collections.singletonList("to_consume"),
                inputs.isEmpty() ? null : inputs.get(0).getOutputSchema(), 0);
        this.consumer = Objects.requireNonNull(consumer, "消费者不能为空");
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
    }

    public static ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        NodeArgs.requireInputs(inputs, 1, KIND_NAME);
        ConsumingSinkNodeOptions sinkOptions = NodeArgs.castOptions(options, ConsumingSinkNodeOptions.class, KIND_NAME);
        if (sinkOptions.getConsumer() == null) {
            throw ExecPlanException.invalid("%s requires a consumer which is not null", KIND_NAME);
        }
        return plan.addNode(new ConsumingSinkNode(plan, inputs, sinkOptions.getConsumer(), sinkOptions.getNames()));
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }

    @Override
    public void startProducing() {
        Schema schema = getInputs().get(0).getOutputSchema();
        if (!names.isEmpty()) {
            int numFields = Schemas.numFields(schema);
            if (names.size() != numFields) {
                throw ExecPlanException.invalid("ConsumingSinkNode with mismatched number of names. Expected %d names but got %d",
                        numFields, names.size());
            }
            schema = Schemas.rename(schema, names);
        }
        log.debug("节点 '{}' ({}) 初始化消费者，schema: {}", getLabel(), getKindName(), Schemas.describe(schema));
        consumer.init(schema, new InputControl(), plan);
    }

    @Override
    public void inputReceived(ExecNode input, ExecBatch batch) {
        if (isFinished() || inputCounter.isCompleted()) {
            return;
        }
        try {
            consumer.consume(batch);
        } catch (RuntimeException e) {
            log.warn("节点 '{}' ({}) 消费批次失败: {}", getLabel(), getKindName(), e.toString());
            if (inputCounter.cancel()) {
                finish(ExecPlanException.wrap(e));
            }
            getInputs().get(0).stopProducing(this);
            return;
        }
        if (inputCounter.increment()) {
            finish(null);
        }
    }

    @Override
    public void errorReceived(ExecNode input, Throwable error) {
        if (inputCounter.cancel()) {
            finish(error);
        }
        getInputs().get(0).stopProducing(this);
    }

    @Override
    public void inputFinished(ExecNode input, int totalBatches) {
        if (inputCounter.setTotal(totalBatches)) {
            finish(null);
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
            finish(null);
        }
        getInputs().get(0).stopProducing(this);
    }

    private void finish(Throwable status) {
        log.debug("节点 '{}' ({}) 调用消费者 finish", getLabel(), getKindName());
        Mono.defer(consumer::finish).subscribe(
                null,
                error -> markFinished(status != null ? status : error),
                () -> markFinished(status));
    }

    private final class InputControl implements BackpressureControl {

        @Override
        public void pause() {
            getInputs().get(0).pauseProducing(ConsumingSinkNode.this, backpressureCounter.incrementAndGet());
        }

        @Override
        public void resume() {
            getInputs().get(0).resumeProducing(ConsumingSinkNode.this, backpressureCounter.incrementAndGet());
        }
    }
}
