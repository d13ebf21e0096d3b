package xyz.vvrf.reactor.exec.options;

import lombok.Getter;
import xyz.vvrf.reactor.exec.node.SinkNodeConsumer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @author ruifeng.wen
 */
@Getter
public class ConsumingSinkNodeOptions extends ExecNodeOptions {

    private final SinkNodeConsumer consumer;
    /**
     * 输出列名。为空时沿用输入 schema 的字段名。
     */
    private final List<String> names;

    public ConsumingSinkNodeOptions(SinkNodeConsumer consumer) {
        this(consumer, Collections.emptyList());
    }

    public ConsumingSinkNodeOptions(SinkNodeConsumer consumer, List<String> names) {
        this.consumer = consumer;
        this.names = names == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(names));
    }
}
