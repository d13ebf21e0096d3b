package xyz.vvrf.reactor.exec.compute;

import org.apache.arrow.vector.types.pojo.ArrowType;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.Schemas;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * 内置聚合函数。标量函数为 {@code sum/count/min/max/mean/any/all}，
 * 分组函数为对应的 {@code hash_} 前缀版本。
 *
 * @author ruifeng.wen
 */
public final class AggregateFunctions {

    private static final String HASH_PREFIX = "hash_";

    private static final Set<String> BASE_FUNCTIONS = Collections.unmodifiableSet(
            new HashSet<>(Arrays.asList("sum", "count", "min", "max", "mean", "any", "all")));

    private AggregateFunctions() {}

    public static boolean isHashFunction(String function) {
        return function.startsWith(HASH_PREFIX);
    }

    /**
     * 检查函数是否存在，以及是否与有无分组键相符。
     *
     * @throws ExecPlanException INVALID
     */
    public static void validate(Aggregate aggregate, boolean grouped) {
        String function = aggregate.getFunction();
        if (!BASE_FUNCTIONS.contains(baseName(function))) {
            throw ExecPlanException.invalid("No function registered with name: %s", function);
        }
        if (grouped && !isHashFunction(function)) {
            throw ExecPlanException.invalid("The provided function (%s) is a scalar aggregate function. "
                    + "Since there are keys to group by, a hash aggregate function was expected "
                    + "(normally these start with hash_)", function);
        }
        if (!grouped && isHashFunction(function)) {
            throw ExecPlanException.invalid("The provided function (%s) is a hash aggregate function. "
                    + "Since there are no keys to group by, a scalar aggregate function was expected "
                    + "(normally these do not start with hash_)", function);
        }
    }

    public static ArrowType outputType(Aggregate aggregate, ArrowType inputType) {
        switch (baseName(aggregate.getFunction())) {
            case "count":
                return Schemas.INT64;
            case "mean":
                return Schemas.FLOAT64;
            case "any":
            case "all":
                requireBool(aggregate, inputType);
                return Schemas.BOOL;
            case "sum":
                requireNumeric(aggregate, inputType);
                return inputType instanceof ArrowType.FloatingPoint ? Schemas.FLOAT64 : Schemas.INT64;
            default:
                return inputType;
        }
    }

    public static Aggregator newAggregator(Aggregate aggregate) {
        switch (baseName(aggregate.getFunction())) {
            case "sum":
                return new SumAggregator();
            case "count":
                return new CountAggregator(aggregate.effectiveCountMode());
            case "min":
                return new ExtremumAggregator(true);
            case "max":
                return new ExtremumAggregator(false);
            case "mean":
                return new MeanAggregator();
            case "any":
                return new BooleanAggregator(false);
            case "all":
                return new BooleanAggregator(true);
            default:
                throw ExecPlanException.invalid("No function registered with name: %s", aggregate.getFunction());
        }
    }

    private static String baseName(String function) {
        return isHashFunction(function) ? function.substring(HASH_PREFIX.length()) : function;
    }

    private static void requireNumeric(Aggregate aggregate, ArrowType inputType) {
        if (!Schemas.isNumeric(inputType) && !(inputType instanceof ArrowType.Null)) {
            throw ExecPlanException.typeError("Aggregate %s requires a numeric input, but got %s",
                    aggregate, Schemas.typeName(inputType));
        }
    }

    private static void requireBool(Aggregate aggregate, ArrowType inputType) {
        if (!(inputType instanceof ArrowType.Bool) && !(inputType instanceof ArrowType.Null)) {
            throw ExecPlanException.typeError("Aggregate %s requires a bool input, but got %s",
                    aggregate, Schemas.typeName(inputType));
        }
    }

    private static final class SumAggregator implements Aggregator {
        private long longSum;
        private double doubleSum;
        private boolean floating;
        private boolean seen;

        @Override
        public void update(Object value) {
            if (value == null) {
                return;
            }
            seen = true;
            if (Values.isIntegral(value)) {
                longSum += ((Number) value).longValue();
            } else {
                floating = true;
                doubleSum += ((Number) value).doubleValue();
            }
        }

        @Override
        public Object finish() {
            if (!seen) {
                return null;
            }
            return floating ? (Object) (doubleSum + longSum) : (Object) longSum;
        }
    }

    private static final class CountAggregator implements Aggregator {
        private final CountMode mode;
        private long count;

        CountAggregator(CountMode mode) {
            this.mode = mode;
        }

        @Override
        public void update(Object value) {
            if (mode == CountMode.ALL
                    || (mode == CountMode.ONLY_VALID && value != null)
                    || (mode == CountMode.ONLY_NULL && value == null)) {
                count++;
            }
        }

        @Override
        public Object finish() {
            return count;
        }
    }

    private static final class ExtremumAggregator implements Aggregator {
        private final boolean min;
        private Object current;

        ExtremumAggregator(boolean min) {
            this.min = min;
        }

        @Override
        public void update(Object value) {
            if (value == null) {
                return;
            }
            if (current == null) {
                current = value;
                return;
            }
            int cmp = Values.compare(value, current);
            if (min ? cmp < 0 : cmp > 0) {
                current = value;
            }
        }

        @Override
        public Object finish() {
            return current;
        }
    }

    private static final class MeanAggregator implements Aggregator {
        private double sum;
        private long count;

        @Override
        public void update(Object value) {
            if (value == null) {
                return;
            }
            sum += ((Number) value).doubleValue();
            count++;
        }

        @Override
        public Object finish() {
            return count == 0 ? null : sum / count;
        }
    }

    // any: 初始 false，遇 true 变 true；all: 初始 true，遇 false 变 false。空输入返回 null。
    private static final class BooleanAggregator implements Aggregator {
        private final boolean identity;
        private boolean result;
        private boolean seen;

        BooleanAggregator(boolean identity) {
            this.identity = identity;
            this.result = identity;
        }

        @Override
        public void update(Object value) {
            if (value == null) {
                return;
            }
            seen = true;
            if ((Boolean) value != identity) {
                result = !identity;
            }
        }

        @Override
        public Object finish() {
            return seen ? result : null;
        }
    }
}
