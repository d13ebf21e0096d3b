package xyz.vvrf.reactor.exec.plan;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.exec.builder.Declaration;
import xyz.vvrf.reactor.exec.compute.Aggregate;
import xyz.vvrf.reactor.exec.compute.CountMode;
import xyz.vvrf.reactor.exec.compute.SortKey;
import xyz.vvrf.reactor.exec.compute.SortOptions;
import xyz.vvrf.reactor.exec.options.AggregateNodeOptions;
import xyz.vvrf.reactor.exec.options.FilterNodeOptions;
import xyz.vvrf.reactor.exec.options.OrderBySinkNodeOptions;
import xyz.vvrf.reactor.exec.options.ProjectNodeOptions;
import xyz.vvrf.reactor.exec.options.SinkNodeOptions;
import xyz.vvrf.reactor.exec.options.SourceNodeOptions;
import xyz.vvrf.reactor.exec.registry.ExecNodes;
import xyz.vvrf.reactor.exec.test.util.TestBatches;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static xyz.vvrf.reactor.exec.compute.Expressions.field;
import static xyz.vvrf.reactor.exec.compute.Expressions.greater;
import static xyz.vvrf.reactor.exec.compute.Expressions.greaterEqual;
import static xyz.vvrf.reactor.exec.compute.Expressions.literal;
import static xyz.vvrf.reactor.exec.compute.Expressions.multiply;

class ExecPlanToStringTest {

    @Test
    void simplePlan() {
        TestBatches data = TestBatches.basic();
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        ExecNode source = ExecNodes.makeExecNode("source", plan, Collections.emptyList(),
                new SourceNodeOptions(data.getSchema(), data.flux()));
        ExecNode sink = ExecNodes.makeExecNode("sink", plan, Collections.singletonList(source), new SinkNodeOptions());

        assertThat(sink.toString()).isEqualTo(":SinkNode{}");
        assertThat(plan.toString()).isEqualTo("ExecPlan with 2 nodes:\n"
                + ":SinkNode{}\n"
                + "  :SourceNode{}\n");
    }

    @Test
    void declarationSequenceRendersAsIndentedTree() {
        TestBatches data = TestBatches.basic();
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        Declaration.sequence(Arrays.asList(
                new Declaration("source", Collections.emptyList(),
                        new SourceNodeOptions(data.getSchema(), data.flux()), "custom_source_label"),
                new Declaration("filter", new FilterNodeOptions(greaterEqual(field("i32"), literal(0)))),
                new Declaration("project", new ProjectNodeOptions(Arrays.asList(field("bool"), multiply(field("i32"), literal(2))))),
                new Declaration("aggregate", Collections.emptyList(), new AggregateNodeOptions(
                        Arrays.asList(
                                new Aggregate("hash_sum", "multiply(i32, 2)", "sum(multiply(i32, 2))"),
                                new Aggregate("hash_count", CountMode.ONLY_VALID, "multiply(i32, 2)", "count(multiply(i32, 2))")),
                        Collections.singletonList("bool")), "custom_aggregate_label"),
                new Declaration("filter", new FilterNodeOptions(greater(field("sum(multiply(i32, 2))"), literal(10)))),
                new Declaration("order_by_sink", new OrderBySinkNodeOptions(
                        new SortOptions(Collections.singletonList(new SortKey("sum(multiply(i32, 2))"))))))
        ).addToPlan(plan);

        assertThat(plan.toString()).isEqualTo("ExecPlan with 6 nodes:\n"
                + ":OrderBySinkNode{by={sort_keys=[sum(multiply(i32, 2)) ASC], null_placement=AtEnd}}\n"
                + "  :FilterNode{filter=(sum(multiply(i32, 2)) > 10)}\n"
                + "    custom_aggregate_label:GroupByNode{keys=[\"bool\"], aggregates=[\n"
                + "    \thash_sum(multiply(i32, 2)),\n"
                + "    \thash_count(multiply(i32, 2), {mode=ONLY_VALID}),\n"
                + "    ]}\n"
                + "      :ProjectNode{projection=[bool, multiply(i32, 2)]}\n"
                + "        :FilterNode{filter=(i32 >= 0)}\n"
                + "          custom_source_label:SourceNode{}\n");
    }

    @Test
    void scalarAggregateUsesSameIndentation() {
        TestBatches data = TestBatches.basic();
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        Declaration.sequence(Arrays.asList(
                new Declaration("source", new SourceNodeOptions(data.getSchema(), data.flux())),
                new Declaration("aggregate", new AggregateNodeOptions(
                        Collections.singletonList(new Aggregate("sum", "i32", "sum(i32)")))),
                new Declaration("sink", new SinkNodeOptions()))
        ).addToPlan(plan);

        assertThat(plan.toString()).isEqualTo("ExecPlan with 3 nodes:\n"
                + ":SinkNode{}\n"
                + "  :ScalarAggregateNode{aggregates=[\n"
                + "  \tsum(i32),\n"
                + "  ]}\n"
                + "    :SourceNode{}\n");
    }
}
