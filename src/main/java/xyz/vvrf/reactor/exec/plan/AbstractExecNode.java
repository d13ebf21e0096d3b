package xyz.vvrf.reactor.exec.plan;

import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.vector.types.pojo.Schema;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import xyz.vvrf.reactor.exec.core.ExecPlanException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 节点的公共骨架：图元数据、输出绑定、一次性的完成信号以及诊断输出。
 * 具体节点只需实现数据与控制信号的处理。
 *
 * @author ruifeng.wen
 */
@Slf4j
public abstract class AbstractExecNode implements ExecNode {

    protected final ExecPlan plan;
    private final List<ExecNode> inputs;
    private final List<String> inputLabels;
    private final List<ExecNode> outputs = new CopyOnWriteArrayList<>();
    private final int numOutputs;
    private final Schema outputSchema;

    private volatile String label;
    private volatile boolean autoLabeled;

    private final Sinks.One<Void> finishedSink = Sinks.one();
    private final AtomicBoolean finishedFlag = new AtomicBoolean(false);

    protected AbstractExecNode(ExecPlan plan, List<ExecNode> inputs, List<String> inputLabels,
                               Schema outputSchema, int numOutputs) {
        this.plan = Objects.requireNonNull(plan, "ExecPlan 不能为空");
        Objects.requireNonNull(inputs, "输入列表不能为空");
        Objects.requireNonNull(inputLabels, "输入名称列表不能为空");
        if (inputs.size() != inputLabels.size()) {
            throw ExecPlanException.invalid("%s got %d inputs but %d input labels",
                    getClass().getSimpleName(), inputs.size(), inputLabels.size());
        }
        for (ExecNode input : inputs) {
            Objects.requireNonNull(input, "输入节点不能为空");
            if (input.getPlan() != plan) {
                throw ExecPlanException.invalid("Input node '%s' belongs to a different ExecPlan", input.getLabel());
            }
        }
        if (numOutputs < 0) {
            throw ExecPlanException.invalid("Declared output count must be >= 0, but got %d", numOutputs);
        }
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.inputLabels = Collections.unmodifiableList(new ArrayList<>(inputLabels));
        this.outputSchema = outputSchema;
        this.numOutputs = numOutputs;
        for (ExecNode input : this.inputs) {
            input.bindOutput(this);
        }
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public void setLabel(String label) {
        this.label = label;
        this.autoLabeled = false;
    }

    @Override
    public void assignAutoLabel(int ordinal) {
        this.label = String.valueOf(ordinal);
        this.autoLabeled = true;
    }

    @Override
    public boolean hasAutoLabel() {
        return autoLabeled;
    }

    @Override
    public ExecPlan getPlan() {
        return plan;
    }

    @Override
    public List<ExecNode> getInputs() {
        return inputs;
    }

    @Override
    public List<String> getInputLabels() {
        return inputLabels;
    }

    @Override
    public List<ExecNode> getOutputs() {
        return Collections.unmodifiableList(outputs);
    }

    @Override
    public int getNumOutputs() {
        return numOutputs;
    }

    @Override
    public Schema getOutputSchema() {
        return outputSchema;
    }

    @Override
    public void bindOutput(ExecNode output) {
        outputs.add(Objects.requireNonNull(output, "输出节点不能为空"));
    }

    @Override
    public void validate() {
        if (outputs.size() != numOutputs) {
            throw ExecPlanException.invalid("Node '%s' (%s) declares %d outputs but %d are bound: output not bound",
                    label, getKindName(), numOutputs, outputs.size());
        }
    }

    @Override
    public void abandon() {
        if (markFinished(null)) {
            log.debug("节点 '{}' 未启动，直接标记为完成", label);
        }
    }

    @Override
    public Mono<Void> finished() {
        return finishedSink.asMono();
    }

    public boolean isFinished() {
        return finishedFlag.get();
    }

    /**
     * 解析完成信号，只有第一次调用生效。
     *
     * @return 本次调用是否真正完成了信号
     */
    protected boolean markFinished(Throwable error) {
        if (!finishedFlag.compareAndSet(false, true)) {
            return false;
        }
        if (error == null) {
            log.debug("节点 '{}' ({}) 已完成", label, getKindName());
            finishedSink.tryEmitEmpty();
        } else {
            log.debug("节点 '{}' ({}) 以错误结束: {}", label, getKindName(), error.toString());
            finishedSink.tryEmitError(error);
        }
        return true;
    }

    protected ExecNode getOutput() {
        return outputs.get(0);
    }

    protected ExecContext getContext() {
        return plan.getContext();
    }

    protected int inputIndex(ExecNode input) {
        int index = inputs.indexOf(input);
        if (index < 0) {
            throw new IllegalStateException("Node '" + input.getLabel() + "' is not an input of '" + label + "'");
        }
        return index;
    }

    /**
     * 节点类型特有的诊断参数，出现在 {@code Kind{...}} 的花括号内。
     */
    protected String toStringExtra(int indent) {
        return "";
    }

    @Override
    public String toString(int indent) {
        String shownLabel = autoLabeled || label == null ? "" : label;
        return shownLabel + ":" + getKindName() + "{" + toStringExtra(indent) + "}";
    }

    @Override
    public String toString() {
        return toString(0);
    }
}
