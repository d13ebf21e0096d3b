package xyz.vvrf.reactor.exec.compute;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 选取排序后前 k 行的选项。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
public final class SelectKOptions {

    private final int k;
    private final List<SortKey> sortKeys;

    public SelectKOptions(int k, List<SortKey> sortKeys) {
        this.k = k;
        this.sortKeys = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(sortKeys, "排序键不能为空")));
    }

    /**
     * 最大的 k 行 (按给定字段降序)。
     */
    public static SelectKOptions topKDefault(int k, String... fieldNames) {
        return withOrder(k, SortOrder.DESCENDING, fieldNames);
    }

    /**
     * 最小的 k 行 (按给定字段升序)。
     */
    public static SelectKOptions bottomKDefault(int k, String... fieldNames) {
        return withOrder(k, SortOrder.ASCENDING, fieldNames);
    }

    private static SelectKOptions withOrder(int k, SortOrder order, String... fieldNames) {
        List<SortKey> keys = new ArrayList<>(fieldNames.length);
        for (String name : fieldNames) {
            keys.add(new SortKey(name, order));
        }
        return new SelectKOptions(k, keys);
    }

    @Override
    public String toString() {
        return "k=" + k + ", sort_keys=" + sortKeys;
    }
}
