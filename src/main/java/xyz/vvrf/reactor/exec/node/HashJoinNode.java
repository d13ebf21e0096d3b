package xyz.vvrf.reactor.exec.node;

import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.compute.JoinType;
import xyz.vvrf.reactor.exec.compute.Values;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.Schemas;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.options.HashJoinNodeOptions;
import xyz.vvrf.reactor.exec.plan.AbstractExecNode;
import xyz.vvrf.reactor.exec.plan.BatchCounter;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 两输入的哈希连接。两侧输入分别缓冲，两侧都结束后以右侧建表、左侧探测，
 * 一次性产出连接结果。任一侧的键含 null 时该行不参与匹配。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class HashJoinNode extends AbstractExecNode {

    public static final String KIND_NAME = "HashJoinNode";

    private static final int LEFT = 0;
    private static final int RIGHT = 1;

    private final HashJoinNodeOptions options;
    private final int[] leftKeyIndices;
    private final int[] rightKeyIndices;
    private final int leftWidth;
    private final int rightWidth;

    private final List<List<List<Object>>> buffered = Arrays.asList(new ArrayList<>(), new ArrayList<>());
    private final BatchCounter[] counters = {new BatchCounter(), new BatchCounter()};
    private final AtomicInteger pendingInputs = new AtomicInteger(2);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public HashJoinNode(ExecPlan plan, List<ExecNode> inputs, HashJoinNodeOptions options,
                        int[] leftKeyIndices, int[] rightKeyIndices, Schema outputSchema) {
        super(plan, inputs, Arrays.asList("left", "right"), outputSchema, 1);
        this.options = options;
        this.leftKeyIndices = leftKeyIndices.clone();
        this.rightKeyIndices = rightKeyIndices.clone();
        this.leftWidth = Schemas.numFields(inputs.get(LEFT).getOutputSchema());
        this.rightWidth = Schemas.numFields(inputs.get(RIGHT).getOutputSchema());
    }

    public static ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        NodeArgs.requireInputs(inputs, 2, KIND_NAME);
        HashJoinNodeOptions joinOptions = NodeArgs.castOptions(options, HashJoinNodeOptions.class, KIND_NAME);
        List<String> leftKeys = joinOptions.getLeftKeys();
        List<String> rightKeys = joinOptions.getRightKeys();
        if (leftKeys.size() != rightKeys.size()) {
            throw ExecPlanException.invalid("left and right key counts do not match: %d vs %d", leftKeys.size(), rightKeys.size());
        }
        if (leftKeys.isEmpty()) {
            throw ExecPlanException.invalid("%s requires at least one key", KIND_NAME);
        }
        Schema leftSchema = inputs.get(LEFT).getOutputSchema();
        Schema rightSchema = inputs.get(RIGHT).getOutputSchema();
        int[] leftKeyIndices = new int[leftKeys.size()];
        int[] rightKeyIndices = new int[rightKeys.size()];
        for (int i = 0; i < leftKeys.size(); i++) {
            leftKeyIndices[i] = Schemas.fieldIndex(leftSchema, leftKeys.get(i));
            rightKeyIndices[i] = Schemas.fieldIndex(rightSchema, rightKeys.get(i));
        }
        Schema outputSchema = outputSchema(joinOptions, leftSchema, rightSchema);
        return plan.addNode(new HashJoinNode(plan, inputs, joinOptions, leftKeyIndices, rightKeyIndices, outputSchema));
    }

    private static Schema outputSchema(HashJoinNodeOptions options, Schema leftSchema, Schema rightSchema) {
        JoinType joinType = options.getJoinType();
        Set<String> leftNames = new HashSet<>();
        Set<String> rightNames = new HashSet<>();
        for (Field field : leftSchema.getFields()) {
            leftNames.add(field.getName());
        }
        for (Field field : rightSchema.getFields()) {
            rightNames.add(field.getName());
        }
        boolean both = joinType.outputsLeft() && joinType.outputsRight();
        List<Field> fields = new ArrayList<>();
        if (joinType.outputsLeft()) {
            for (Field field : leftSchema.getFields()) {
                String name = both && rightNames.contains(field.getName()) ? field.getName() + options.getLeftSuffix() : field.getName();
                fields.add(Schemas.field(name, field.getType()));
            }
        }
        if (joinType.outputsRight()) {
            for (Field field : rightSchema.getFields()) {
                String name = both && leftNames.contains(field.getName()) ? field.getName() + options.getRightSuffix() : field.getName();
                fields.add(Schemas.field(name, field.getType()));
            }
        }
        return Schemas.schema(fields);
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }

    @Override
    public void startProducing() {
        log.debug("节点 '{}' ({}) 已启动，连接类型 {}", getLabel(), getKindName(), options.getJoinType());
    }

    @Override
    public void inputReceived(ExecNode input, ExecBatch batch) {
        int side = inputIndex(input);
        if (isFinished() || stopped.get()) {
            return;
        }
        List<List<Object>> rows = batch.getRows();
        List<List<Object>> sideRows = buffered.get(side);
        synchronized (sideRows) {
            sideRows.addAll(rows);
        }
        if (counters[side].increment()) {
            onInputComplete();
        }
    }

    @Override
    public void errorReceived(ExecNode input, Throwable error) {
        getOutput().errorReceived(this, error);
        stopProducing();
    }

    @Override
    public void inputFinished(ExecNode input, int totalBatches) {
        int side = inputIndex(input);
        if (counters[side].setTotal(totalBatches)) {
            onInputComplete();
        }
    }

    private void onInputComplete() {
        if (pendingInputs.decrementAndGet() != 0 || stopped.get()) {
            return;
        }
        List<List<Object>> rows;
        try {
            rows = join();
        } catch (RuntimeException e) {
            ExecPlanException error = ExecPlanException.wrap(e);
            stopped.set(true);
            getOutput().errorReceived(this, error);
            markFinished(error);
            return;
        }
        List<ExecBatch> result = rows.isEmpty()
                ? Collections.emptyList()
                : ExecBatch.sliceToMaxSize(ExecBatch.fromRows(Schemas.numFields(getOutputSchema()), rows), ExecPlan.MAX_BATCH_SIZE);
        log.debug("节点 '{}' ({}) 连接完成，输出 {} 行", getLabel(), getKindName(), rows.size());
        ExecNode output = getOutput();
        for (ExecBatch batch : result) {
            output.inputReceived(this, batch);
        }
        output.inputFinished(this, result.size());
        markFinished(null);
    }

    private List<List<Object>> join() {
        List<List<Object>> leftRows;
        List<List<Object>> rightRows;
        synchronized (buffered.get(LEFT)) {
            leftRows = new ArrayList<>(buffered.get(LEFT));
        }
        synchronized (buffered.get(RIGHT)) {
            rightRows = new ArrayList<>(buffered.get(RIGHT));
        }

        Map<List<Object>, List<Integer>> table = new HashMap<>();
        for (int i = 0; i < rightRows.size(); i++) {
            List<Object> key = keyOf(rightRows.get(i), rightKeyIndices);
            if (key != null) {
                table.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
            }
        }

        JoinType joinType = options.getJoinType();
        boolean[] rightMatched = new boolean[rightRows.size()];
        List<List<Object>> out = new ArrayList<>();
        for (List<Object> leftRow : leftRows) {
            List<Object> key = keyOf(leftRow, leftKeyIndices);
            List<Integer> matches = key == null ? Collections.emptyList() : table.getOrDefault(key, Collections.emptyList());
            for (int rightIndex : matches) {
                rightMatched[rightIndex] = true;
            }
            switch (joinType) {
                case LEFT_SEMI:
                    if (!matches.isEmpty()) {
                        out.add(leftRow);
                    }
                    break;
                case LEFT_ANTI:
                    if (matches.isEmpty()) {
                        out.add(leftRow);
                    }
                    break;
                case RIGHT_SEMI:
                case RIGHT_ANTI:
                    break;
                default:
                    for (int rightIndex : matches) {
                        out.add(concat(leftRow, rightRows.get(rightIndex)));
                    }
                    if (matches.isEmpty() && joinType.keepsUnmatchedLeft()) {
                        out.add(concat(leftRow, null));
                    }
                    break;
            }
        }
        for (int i = 0; i < rightRows.size(); i++) {
            boolean matched = rightMatched[i];
            if ((joinType == JoinType.RIGHT_SEMI && matched) || (joinType == JoinType.RIGHT_ANTI && !matched)) {
                out.add(rightRows.get(i));
            } else if (!matched && joinType.keepsUnmatchedRight()) {
                out.add(concat(null, rightRows.get(i)));
            }
        }
        return out;
    }

    private static List<Object> keyOf(List<Object> row, int[] keyIndices) {
        List<Object> key = new ArrayList<>(keyIndices.length);
        for (int index : keyIndices) {
            Object value = row.get(index);
            if (value == null) {
                return null;
            }
            // 不同宽度的整数按值比较
            key.add(Values.isIntegral(value) ? (Object) ((Number) value).longValue() : value);
        }
        return key;
    }

    private List<Object> concat(List<Object> leftRow, List<Object> rightRow) {
        List<Object> row = new ArrayList<>(leftWidth + rightWidth);
        if (leftRow == null) {
            row.addAll(Collections.nCopies(leftWidth, null));
        } else {
            row.addAll(leftRow);
        }
        if (rightRow == null) {
            row.addAll(Collections.nCopies(rightWidth, null));
        } else {
            row.addAll(rightRow);
        }
        return row;
    }

    @Override
    public void pauseProducing(ExecNode output, int counter) {
        // 结果在两侧结束后一次性产出，暂停无意义
    }

    @Override
    public void resumeProducing(ExecNode output, int counter) {
        // 同上
    }

    @Override
    public void stopProducing(ExecNode output) {
        stopProducing();
    }

    @Override
    public void stopProducing() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        counters[LEFT].cancel();
        counters[RIGHT].cancel();
        markFinished(null);
        for (ExecNode input : getInputs()) {
            input.stopProducing(this);
        }
    }

    @Override
    protected String toStringExtra(int indent) {
        return "type=" + options.getJoinType() + ", left_keys=" + options.getLeftKeys() + ", right_keys=" + options.getRightKeys();
    }
}
