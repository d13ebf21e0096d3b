package xyz.vvrf.reactor.exec.options;

import lombok.Getter;
import xyz.vvrf.reactor.exec.core.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 计划完成时把收到的全部批次物化为 {@link Table} 写入 {@code outputTable}。
 */
@Getter
public class TableSinkNodeOptions extends ExecNodeOptions {

    private final AtomicReference<Table> outputTable;
    private final List<String> names;

    public TableSinkNodeOptions(AtomicReference<Table> outputTable) {
        this(outputTable, Collections.emptyList());
    }

    public TableSinkNodeOptions(AtomicReference<Table> outputTable, List<String> names) {
        this.outputTable = outputTable;
        this.names = names == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(names));
    }
}
