package xyz.vvrf.reactor.exec.compute;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

@Getter
@EqualsAndHashCode
public final class SortKey {

    private final String target;
    private final SortOrder order;

    public SortKey(String target) {
        this(target, SortOrder.ASCENDING);
    }

    public SortKey(String target, SortOrder order) {
        this.target = Objects.requireNonNull(target, "排序字段不能为空");
        this.order = Objects.requireNonNull(order, "排序方向不能为空");
    }

    @Override
    public String toString() {
        return target + " " + order.getShortName();
    }
}
