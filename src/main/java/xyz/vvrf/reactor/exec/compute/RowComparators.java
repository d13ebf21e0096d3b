package xyz.vvrf.reactor.exec.compute;

import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.core.Schemas;

import java.util.Comparator;
import java.util.List;

/**
 * 按排序键比较行 ({@code List<Object>})。
 *
 * @author ruifeng.wen
 */
public final class RowComparators {

    private RowComparators() {}

    /**
     * @throws xyz.vvrf.reactor.exec.core.ExecPlanException KEY_ERROR，排序字段不在 schema 中时
     */
    public static Comparator<List<Object>> forKeys(Schema schema, List<SortKey> keys, NullPlacement nullPlacement) {
        Comparator<List<Object>> comparator = (a, b) -> 0;
        for (SortKey key : keys) {
            int index = Schemas.fieldIndex(schema, key.getTarget());
            boolean descending = key.getOrder() == SortOrder.DESCENDING;
            comparator = comparator.thenComparing((a, b) -> compareValues(a.get(index), b.get(index), descending, nullPlacement));
        }
        return comparator;
    }

    private static int compareValues(Object a, Object b, boolean descending, NullPlacement nullPlacement) {
        if (a == null || b == null) {
            if (a == b) {
                return 0;
            }
            int nullFirst = nullPlacement == NullPlacement.AT_START ? -1 : 1;
            return a == null ? nullFirst : -nullFirst;
        }
        int result = Values.compare(a, b);
        return descending ? -result : result;
    }
}
