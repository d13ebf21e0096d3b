package xyz.vvrf.reactor.exec.options;

import lombok.Getter;
import xyz.vvrf.reactor.exec.backpressure.BackpressureOptions;
import xyz.vvrf.reactor.exec.compute.SortOptions;

import java.util.Objects;

@Getter
public class OrderBySinkNodeOptions extends SinkNodeOptions {

    private final SortOptions sortOptions;

    public OrderBySinkNodeOptions(SortOptions sortOptions) {
        this(sortOptions, BackpressureOptions.noBackpressure());
    }

    public OrderBySinkNodeOptions(SortOptions sortOptions, BackpressureOptions backpressure) {
        super(backpressure);
        this.sortOptions = Objects.requireNonNull(sortOptions, "排序选项不能为空");
    }
}
