package xyz.vvrf.reactor.exec.options;

import org.apache.arrow.vector.types.pojo.Schema;

import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

/**
 * 迭代元素为一组列 (每列一个值列表)。
 */
public class ArrayVectorSourceNodeOptions extends SchemaSourceNodeOptions<List<List<Object>>> {

    public ArrayVectorSourceNodeOptions(Schema schema, Supplier<Iterator<List<List<Object>>>> itMaker) {
        super(schema, itMaker);
    }
}
