package xyz.vvrf.reactor.exec.options;

import lombok.Getter;
import xyz.vvrf.reactor.exec.backpressure.BackpressureOptions;
import xyz.vvrf.reactor.exec.compute.SelectKOptions;

import java.util.Objects;

@Getter
public class SelectKSinkNodeOptions extends SinkNodeOptions {

    private final SelectKOptions selectKOptions;

    public SelectKSinkNodeOptions(SelectKOptions selectKOptions) {
        this(selectKOptions, BackpressureOptions.noBackpressure());
    }

    public SelectKSinkNodeOptions(SelectKOptions selectKOptions, BackpressureOptions backpressure) {
        super(backpressure);
        this.selectKOptions = Objects.requireNonNull(selectKOptions, "select-k 选项不能为空");
    }
}
