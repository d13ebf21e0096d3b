package xyz.vvrf.reactor.exec.node;

import org.apache.arrow.vector.types.pojo.Schema;
import reactor.core.publisher.Flux;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.RecordBatch;
import xyz.vvrf.reactor.exec.core.Schemas;
import xyz.vvrf.reactor.exec.options.ArrayVectorSourceNodeOptions;
import xyz.vvrf.reactor.exec.options.ExecBatchSourceNodeOptions;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.options.RecordBatchSourceNodeOptions;
import xyz.vvrf.reactor.exec.options.SchemaSourceNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * schema 加迭代器工厂描述的源节点，三种元素类型共用：
 * 列数组 ({@code ArrayVectorSourceNode})、{@link ExecBatch} ({@code ExecBatchSourceNode})
 * 与 {@link RecordBatch} ({@code RecordBatchSourceNode})。
 *
 * @param <T> 迭代出的元素类型
 * @author ruifeng.wen
 */
public class SchemaSourceNode<T> extends SourceNode {

    public static final String ARRAY_VECTOR_KIND_NAME = "ArrayVectorSourceNode";
    public static final String EXEC_BATCH_KIND_NAME = "ExecBatchSourceNode";
    public static final String RECORD_BATCH_KIND_NAME = "RecordBatchSourceNode";

    private final String kindName;

    public SchemaSourceNode(ExecPlan plan, String kindName, Schema schema, Supplier<Iterator<T>> itMaker,
                            Function<T, ExecBatch> converter) {
        super(plan, schema, Flux.fromIterable(itMaker::get).map(converter));
        this.kindName = kindName;
    }

    public static ExecNode makeArrayVectorSource(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        ArrayVectorSourceNodeOptions vectorOptions =
                checkOptions(inputs, options, ArrayVectorSourceNodeOptions.class, ARRAY_VECTOR_KIND_NAME);
        int numFields = Schemas.numFields(vectorOptions.getSchema());
        return plan.addNode(new SchemaSourceNode<>(plan, ARRAY_VECTOR_KIND_NAME, vectorOptions.getSchema(),
                vectorOptions.getItMaker(), columns -> {
                    if (columns.size() != numFields) {
                        throw ExecPlanException.typeError("Array vector with %d columns does not match schema %s",
                                columns.size(), Schemas.describe(vectorOptions.getSchema()));
                    }
                    return ExecBatch.of(columns);
                }));
    }

    public static ExecNode makeExecBatchSource(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        ExecBatchSourceNodeOptions batchOptions =
                checkOptions(inputs, options, ExecBatchSourceNodeOptions.class, EXEC_BATCH_KIND_NAME);
        return plan.addNode(new SchemaSourceNode<>(plan, EXEC_BATCH_KIND_NAME, batchOptions.getSchema(),
                batchOptions.getItMaker(), Function.identity()));
    }

    public static ExecNode makeRecordBatchSource(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        RecordBatchSourceNodeOptions batchOptions =
                checkOptions(inputs, options, RecordBatchSourceNodeOptions.class, RECORD_BATCH_KIND_NAME);
        Schema schema = batchOptions.getSchema();
        return plan.addNode(new SchemaSourceNode<>(plan, RECORD_BATCH_KIND_NAME, schema,
                batchOptions.getItMaker(), recordBatch -> {
                    if (!schema.equals(recordBatch.getSchema())) {
                        throw ExecPlanException.typeError("RecordBatch schema %s does not match source schema %s",
                                Schemas.describe(recordBatch.getSchema()), Schemas.describe(schema));
                    }
                    return recordBatch.getBatch();
                }));
    }

    private static <O extends SchemaSourceNodeOptions<?>> O checkOptions(List<ExecNode> inputs, ExecNodeOptions options,
                                                                        Class<O> type, String kindName) {
        NodeArgs.requireInputs(inputs, 0, kindName);
        O schemaOptions = NodeArgs.castOptions(options, type, kindName);
        if (schemaOptions.getSchema() == null) {
            throw ExecPlanException.invalid("%s requires schema which is not null", kindName);
        }
        if (schemaOptions.getItMaker() == null) {
            throw ExecPlanException.invalid("%s requires it_maker which is not null", kindName);
        }
        return schemaOptions;
    }

    @Override
    public String getKindName() {
        return kindName;
    }
}
