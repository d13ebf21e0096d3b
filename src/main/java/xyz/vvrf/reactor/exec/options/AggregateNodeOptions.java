package xyz.vvrf.reactor.exec.options;

import lombok.Getter;
import xyz.vvrf.reactor.exec.compute.Aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 聚合选项。{@code keys} 为空时是标量聚合，否则按 keys 分组。
 *
 * @author ruifeng.wen
 */
@Getter
public class AggregateNodeOptions extends ExecNodeOptions {

    private final List<Aggregate> aggregates;
    private final List<String> keys;

    public AggregateNodeOptions(List<Aggregate> aggregates) {
        this(aggregates, Collections.emptyList());
    }

    public AggregateNodeOptions(List<Aggregate> aggregates, List<String> keys) {
        this.aggregates = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(aggregates, "聚合列表不能为空")));
        this.keys = keys == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(keys));
    }
}
