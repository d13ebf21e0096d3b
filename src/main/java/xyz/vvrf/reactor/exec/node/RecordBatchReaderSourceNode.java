package xyz.vvrf.reactor.exec.node;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.RecordBatch;
import xyz.vvrf.reactor.exec.core.RecordBatchReader;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.options.RecordBatchReaderSourceNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.io.IOException;
import java.util.List;

/**
 * 从 {@link RecordBatchReader} 读取批次，读完或失败后关闭 reader。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class RecordBatchReaderSourceNode extends SourceNode {

    public static final String KIND_NAME = "RecordBatchReaderSourceNode";

    public RecordBatchReaderSourceNode(ExecPlan plan, RecordBatchReader reader) {
        super(plan, reader.getSchema(), readerFlux(reader));
    }

    public static ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        NodeArgs.requireInputs(inputs, 0, KIND_NAME);
        RecordBatchReaderSourceNodeOptions readerOptions =
                NodeArgs.castOptions(options, RecordBatchReaderSourceNodeOptions.class, KIND_NAME);
        if (readerOptions.getReader() == null) {
            throw ExecPlanException.invalid("%s requires a reader which is not null", KIND_NAME);
        }
        if (readerOptions.getReader().getSchema() == null) {
            throw ExecPlanException.invalid("%s requires a reader schema which is not null", KIND_NAME);
        }
        return plan.addNode(new RecordBatchReaderSourceNode(plan, readerOptions.getReader()));
    }

    private static Flux<ExecBatch> readerFlux(RecordBatchReader reader) {
        return Flux.using(
                () -> reader,
                r -> Flux.<ExecBatch>generate(sink -> {
                    try {
                        RecordBatch next = r.next();
                        if (next == null) {
                            sink.complete();
                        } else {
                            sink.next(next.getBatch());
                        }
                    } catch (IOException e) {
                        sink.error(ExecPlanException.ioError("Failed to read next RecordBatch", e));
                    }
                }),
                RecordBatchReaderSourceNode::closeReader);
    }

    private static void closeReader(RecordBatchReader reader) {
        try {
            reader.close();
        } catch (Exception e) {
            log.warn("关闭 RecordBatchReader 失败: {}", e.toString(), e);
        }
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }
}
