package xyz.vvrf.reactor.exec.options;

import lombok.Getter;
import org.apache.arrow.vector.types.pojo.Schema;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.exec.core.ExecBatch;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 通用源节点选项：输出 schema 与批次生成器。生成器结束即表示数据结束。
 *
 * @author ruifeng.wen
 */
@Getter
public class SourceNodeOptions extends ExecNodeOptions {

    private final Schema outputSchema;
    private final Flux<ExecBatch> generator;

    public SourceNodeOptions(Schema outputSchema, Flux<ExecBatch> generator) {
        this.outputSchema = outputSchema;
        this.generator = generator;
    }

    /**
     * 由拉取式生成器构造：反复调用 {@code next}，得到空的 Optional 时结束。
     */
    public static SourceNodeOptions fromGenerator(Schema outputSchema, Supplier<Mono<Optional<ExecBatch>>> next) {
        Objects.requireNonNull(next, "生成器不能为空");
        Flux<ExecBatch> generator = Mono.defer(next)
                .repeat()
                .takeWhile(Optional::isPresent)
                .map(Optional::get);
        return new SourceNodeOptions(outputSchema, generator);
    }
}
