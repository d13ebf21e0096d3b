package xyz.vvrf.reactor.exec.core;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 在节点之间流动的不可变列式批次。
 * 每一列是等长的值列表，{@code null} 表示空槽位。
 *
 * @author ruifeng.wen
 */
public final class ExecBatch {

    private final List<List<Object>> columns;
    private final int length;

    public ExecBatch(List<? extends List<?>> columns, int length) {
        Objects.requireNonNull(columns, "列不能为空");
        if (length < 0) {
            throw ExecPlanException.invalid("ExecBatch length must be >= 0, but got %d", length);
        }
        List<List<Object>> copy = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            List<?> column = Objects.requireNonNull(columns.get(i), "列不能为空");
            if (column.size() != length) {
                throw ExecPlanException.invalid("Column %d has %d values but batch length is %d", i, column.size(), length);
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(column)));
        }
        this.columns = Collections.unmodifiableList(copy);
        this.length = length;
    }

    public static ExecBatch of(List<? extends List<?>> columns) {
        int length = columns.isEmpty() ? 0 : columns.get(0).size();
        return new ExecBatch(columns, length);
    }

    public static ExecBatch empty(int numColumns) {
        List<List<Object>> columns = new ArrayList<>(numColumns);
        for (int i = 0; i < numColumns; i++) {
            columns.add(Collections.emptyList());
        }
        return new ExecBatch(columns, 0);
    }

    /**
     * 从行数据构建批次。
     */
    public static ExecBatch fromRows(int numColumns, List<? extends List<?>> rows) {
        List<List<Object>> columns = new ArrayList<>(numColumns);
        for (int c = 0; c < numColumns; c++) {
            columns.add(new ArrayList<>(rows.size()));
        }
        for (List<?> row : rows) {
            if (row.size() != numColumns) {
                throw ExecPlanException.invalid("Row %s does not have %d values", row, numColumns);
            }
            for (int c = 0; c < numColumns; c++) {
                columns.get(c).add(row.get(c));
            }
        }
        return new ExecBatch(columns, rows.size());
    }

    public static ExecBatch fromRows(int numColumns, Object[]... rows) {
        List<List<Object>> list = new ArrayList<>(rows.length);
        for (Object[] row : rows) {
            list.add(Arrays.asList(row));
        }
        return fromRows(numColumns, list);
    }

    public int getLength() {
        return length;
    }

    public int getNumValues() {
        return columns.size();
    }

    public List<Object> getColumn(int index) {
        return columns.get(index);
    }

    public List<List<Object>> getColumns() {
        return columns;
    }

    public Object getValue(int column, int row) {
        return columns.get(column).get(row);
    }

    public List<Object> getRow(int row) {
        List<Object> values = new ArrayList<>(columns.size());
        for (List<Object> column : columns) {
            values.add(column.get(row));
        }
        return values;
    }

    public List<List<Object>> getRows() {
        List<List<Object>> rows = new ArrayList<>(length);
        for (int r = 0; r < length; r++) {
            rows.add(getRow(r));
        }
        return rows;
    }

    public ExecBatch slice(int offset, int sliceLength) {
        if (offset < 0 || sliceLength < 0 || offset + sliceLength > length) {
            throw ExecPlanException.invalid("Slice [%d, %d) out of bounds for batch of length %d",
                    offset, offset + sliceLength, length);
        }
        List<List<Object>> sliced = new ArrayList<>(columns.size());
        for (List<Object> column : columns) {
            sliced.add(column.subList(offset, offset + sliceLength));
        }
        return new ExecBatch(sliced, sliceLength);
    }

    public ExecBatch selectRows(List<Integer> rowIndices) {
        List<List<Object>> selected = new ArrayList<>(columns.size());
        for (List<Object> column : columns) {
            List<Object> values = new ArrayList<>(rowIndices.size());
            for (Integer index : rowIndices) {
                values.add(column.get(index));
            }
            selected.add(values);
        }
        return new ExecBatch(selected, rowIndices.size());
    }

    /**
     * 把超过 {@code maxSize} 行的批次切成不超过该行数的块，行顺序与总行数保持不变。
     */
    public static List<ExecBatch> sliceToMaxSize(ExecBatch batch, int maxSize) {
        if (maxSize <= 0) {
            throw ExecPlanException.invalid("maxSize must be > 0, but got %d", maxSize);
        }
        if (batch.length <= maxSize) {
            return Collections.singletonList(batch);
        }
        List<ExecBatch> chunks = new ArrayList<>();
        for (int offset = 0; offset < batch.length; offset += maxSize) {
            chunks.add(batch.slice(offset, Math.min(maxSize, batch.length - offset)));
        }
        return chunks;
    }

    /**
     * 缓冲字节数的确定性估算，用于背压记账。
     */
    public long getTotalBufferSize() {
        long total = 0;
        for (List<Object> column : columns) {
            for (Object value : column) {
                total += 1 + valueWidth(value);
            }
        }
        return total;
    }

    private static long valueWidth(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Boolean || value instanceof Byte) {
            return 1;
        }
        if (value instanceof Integer || value instanceof Float || value instanceof Short) {
            return 4;
        }
        if (value instanceof Long || value instanceof Double) {
            return 8;
        }
        if (value instanceof String) {
            return 4 + ((String) value).getBytes(StandardCharsets.UTF_8).length;
        }
        return 8;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecBatch that = (ExecBatch) o;
        return length == that.length && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, length);
    }

    @Override
    public String toString() {
        return "ExecBatch{length=" + length + ", rows=" + getRows() + '}';
    }
}
