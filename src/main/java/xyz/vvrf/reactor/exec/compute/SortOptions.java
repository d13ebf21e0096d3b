package xyz.vvrf.reactor.exec.compute;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 多键排序选项。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
public final class SortOptions {

    private final List<SortKey> sortKeys;
    private final NullPlacement nullPlacement;

    public SortOptions(List<SortKey> sortKeys) {
        this(sortKeys, NullPlacement.AT_END);
    }

    public SortOptions(List<SortKey> sortKeys, NullPlacement nullPlacement) {
        this.sortKeys = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(sortKeys, "排序键不能为空")));
        this.nullPlacement = Objects.requireNonNull(nullPlacement, "null 位置不能为空");
    }

    @Override
    public String toString() {
        return "sort_keys=" + sortKeys + ", null_placement=" + nullPlacement;
    }
}
