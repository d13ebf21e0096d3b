package xyz.vvrf.reactor.exec.builder;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.vector.types.pojo.Schema;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.exec.backpressure.BackpressureControl;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.Table;
import xyz.vvrf.reactor.exec.node.SinkNodeConsumer;
import xyz.vvrf.reactor.exec.options.ConsumingSinkNodeOptions;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.options.SinkNodeOptions;
import xyz.vvrf.reactor.exec.options.TableSinkNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecContext;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;
import xyz.vvrf.reactor.exec.registry.ExecFactoryRegistry;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 把一个声明包装上汇节点，构建计划、运行并返回结果。计划在返回的 Mono 终止后关闭。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class Declarations {

    private Declarations() {}

    public static Mono<Table> toTable(Declaration declaration, boolean useThreads) {
        return toTable(declaration, ExecContext.of(useThreads));
    }

    public static Mono<Table> toTable(Declaration declaration, ExecContext context) {
        return toTable(declaration, context, ExecFactoryRegistry.defaultRegistry());
    }

    public static Mono<Table> toTable(Declaration declaration, ExecContext context, ExecFactoryRegistry registry) {
        AtomicReference<Table> outputTable = new AtomicReference<>();
        Declaration withSink = withSink(declaration, "table_sink", new TableSinkNodeOptions(outputTable));
        return Mono.using(
                () -> buildPlan(withSink, context, registry),
                plan -> run(plan).then(Mono.fromCallable(outputTable::get)),
                ExecPlan::close);
    }

    public static Mono<BatchesWithSchema> toExecBatches(Declaration declaration, boolean useThreads) {
        return toExecBatches(declaration, ExecContext.of(useThreads));
    }

    public static Mono<BatchesWithSchema> toExecBatches(Declaration declaration, ExecContext context) {
        return toExecBatches(declaration, context, ExecFactoryRegistry.defaultRegistry());
    }

    public static Mono<BatchesWithSchema> toExecBatches(Declaration declaration, ExecContext context,
                                                        ExecFactoryRegistry registry) {
        SinkNodeOptions sinkOptions = new SinkNodeOptions();
        Declaration withSink = withSink(declaration, "sink", sinkOptions);
        AtomicReference<ExecNode> sinkNode = new AtomicReference<>();
        return Mono.using(
                () -> {
                    ExecPlan plan = ExecPlan.make(context);
                    sinkNode.set(withSink.addToPlan(plan, registry));
                    return plan;
                },
                plan -> Mono.fromRunnable(plan::startProducing)
                        .then(sinkOptions.getGenerator().asFlux().collectList())
                        .flatMap(batches -> plan.finished()
                                .thenReturn(new BatchesWithSchema(sinkNode.get().getOutputSchema(), batches))),
                ExecPlan::close);
    }

    public static Mono<Void> toStatus(Declaration declaration, boolean useThreads) {
        return toStatus(declaration, ExecContext.of(useThreads));
    }

    public static Mono<Void> toStatus(Declaration declaration, ExecContext context) {
        return toStatus(declaration, context, ExecFactoryRegistry.defaultRegistry());
    }

    /**
     * 运行计划并丢弃全部输出，只关心是否成功。
     */
    public static Mono<Void> toStatus(Declaration declaration, ExecContext context, ExecFactoryRegistry registry) {
        Declaration withSink = withSink(declaration, "consuming_sink", new ConsumingSinkNodeOptions(new DiscardingConsumer()));
        return Mono.using(
                () -> buildPlan(withSink, context, registry),
                Declarations::run,
                ExecPlan::close);
    }

    private static Declaration withSink(Declaration declaration, String sinkFactory, ExecNodeOptions sinkOptions) {
        return new Declaration(sinkFactory, Collections.singletonList(Declaration.Input.of(declaration)), sinkOptions);
    }

    private static ExecPlan buildPlan(Declaration declaration, ExecContext context, ExecFactoryRegistry registry) {
        ExecPlan plan = ExecPlan.make(context);
        declaration.addToPlan(plan, registry);
        return plan;
    }

    private static Mono<Void> run(ExecPlan plan) {
        return Mono.fromRunnable(plan::startProducing)
                .then(plan.finished())
                .doOnError(e -> log.warn("[Plan: '{}'] 声明执行失败: {}", plan.getName(), e.toString()));
    }

    /**
     * 输出 schema 与按到达顺序收集的批次。
     */
    @Getter
    public static final class BatchesWithSchema {

        private final Schema schema;
        private final List<ExecBatch> batches;

        public BatchesWithSchema(Schema schema, List<ExecBatch> batches) {
            this.schema = schema;
            this.batches = Collections.unmodifiableList(batches);
        }
    }

    private static final class DiscardingConsumer implements SinkNodeConsumer {

        @Override
        public void init(Schema schema, BackpressureControl backpressureControl, ExecPlan plan) {
        }

        @Override
        public void consume(ExecBatch batch) {
        }

        @Override
        public Mono<Void> finish() {
            return Mono.empty();
        }
    }
}
