package xyz.vvrf.reactor.exec.options;

import lombok.Getter;
import xyz.vvrf.reactor.exec.core.RecordBatchReader;

@Getter
public class RecordBatchReaderSourceNodeOptions extends ExecNodeOptions {

    private final RecordBatchReader reader;

    public RecordBatchReaderSourceNodeOptions(RecordBatchReader reader) {
        this.reader = reader;
    }
}
