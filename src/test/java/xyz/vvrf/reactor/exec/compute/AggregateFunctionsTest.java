package xyz.vvrf.reactor.exec.compute;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.Schemas;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregateFunctionsTest {

    private static Object run(Aggregate aggregate, Object... values) {
        Aggregator aggregator = AggregateFunctions.newAggregator(aggregate);
        for (Object value : values) {
            aggregator.update(value);
        }
        return aggregator.finish();
    }

    @Test
    void sumWidensAndSkipsNulls() {
        assertThat(run(new Aggregate("sum", "x", "s"), 1, null, 2L)).isEqualTo(3L);
        assertThat(run(new Aggregate("sum", "x", "s"), 1, 0.5)).isEqualTo(1.5);
        assertThat(run(new Aggregate("sum", "x", "s"), (Object) null)).isNull();
    }

    @Test
    void countHonorsMode() {
        Object[] values = {1, null, null, 4};
        assertThat(run(new Aggregate("count", "x", "c"), values)).isEqualTo(2L);
        assertThat(run(new Aggregate("count", CountMode.ONLY_NULL, "x", "c"), values)).isEqualTo(2L);
        assertThat(run(new Aggregate("hash_count", CountMode.ALL, "x", "c"), values)).isEqualTo(4L);
    }

    @Test
    void minMaxMeanAnyAll() {
        assertThat(run(new Aggregate("min", "x", "m"), 5, null, -3, 8)).isEqualTo(-3);
        assertThat(run(new Aggregate("max", "x", "m"), "beta", "alfa", "gama")).isEqualTo("gama");
        assertThat(run(new Aggregate("mean", "x", "m"), 1, 2, 3, 4)).isEqualTo(2.5);
        assertThat(run(new Aggregate("any", "x", "a"), false, null, true)).isEqualTo(true);
        assertThat(run(new Aggregate("all", "x", "a"), true, false)).isEqualTo(false);
        assertThat(run(new Aggregate("all", "x", "a"))).isNull();
    }

    @Test
    void outputTypes() {
        assertThat(AggregateFunctions.outputType(new Aggregate("sum", "x", "s"), Schemas.INT32)).isEqualTo(Schemas.INT64);
        assertThat(AggregateFunctions.outputType(new Aggregate("hash_sum", "x", "s"), Schemas.FLOAT64)).isEqualTo(Schemas.FLOAT64);
        assertThat(AggregateFunctions.outputType(new Aggregate("count", "x", "c"), Schemas.UTF8)).isEqualTo(Schemas.INT64);
        assertThat(AggregateFunctions.outputType(new Aggregate("mean", "x", "m"), Schemas.INT32)).isEqualTo(Schemas.FLOAT64);
        assertThat(AggregateFunctions.outputType(new Aggregate("min", "x", "m"), Schemas.UTF8)).isEqualTo(Schemas.UTF8);
        assertThatThrownBy(() -> AggregateFunctions.outputType(new Aggregate("any", "x", "a"), Schemas.INT32))
                .hasMessage("Aggregate any(x) requires a bool input, but got int32");
    }

    @Test
    void validateChecksNameAndGrouping() {
        List<String> scalar = Arrays.asList("sum", "count", "min", "max", "mean", "any", "all");
        for (String function : scalar) {
            AggregateFunctions.validate(new Aggregate(function, "x", "y"), false);
            AggregateFunctions.validate(new Aggregate("hash_" + function, "x", "y"), true);
        }
        assertThatThrownBy(() -> AggregateFunctions.validate(new Aggregate("median", "x", "y"), false))
                .isInstanceOf(ExecPlanException.class)
                .hasMessage("No function registered with name: median");
        assertThatThrownBy(() -> AggregateFunctions.validate(new Aggregate("sum", "x", "y"), true))
                .hasMessageStartingWith("The provided function (sum) is a scalar aggregate function.");
    }

    @Test
    void aggregateToStringShowsCountMode() {
        assertThat(new Aggregate("hash_sum", "i32", "sum(i32)")).hasToString("hash_sum(i32)");
        assertThat(new Aggregate("count", CountMode.ALL, "i32", "n")).hasToString("count(i32, {mode=ALL})");
    }
}
