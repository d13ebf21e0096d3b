package xyz.vvrf.reactor.exec.options;

import lombok.Getter;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.Iterator;
import java.util.function.Supplier;

/**
 * 以 schema 加迭代器工厂描述的源节点选项。每次启动时调用一次 {@code itMaker}。
 *
 * @param <T> 迭代出的元素类型
 * @author ruifeng.wen
 */
@Getter
public abstract class SchemaSourceNodeOptions<T> extends ExecNodeOptions {

    private final Schema schema;
    private final Supplier<Iterator<T>> itMaker;

    protected SchemaSourceNodeOptions(Schema schema, Supplier<Iterator<T>> itMaker) {
        this.schema = schema;
        this.itMaker = itMaker;
    }
}
