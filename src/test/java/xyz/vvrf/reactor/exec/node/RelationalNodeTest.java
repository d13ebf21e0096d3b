package xyz.vvrf.reactor.exec.node;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.exec.compute.Aggregate;
import xyz.vvrf.reactor.exec.compute.CountMode;
import xyz.vvrf.reactor.exec.compute.NullPlacement;
import xyz.vvrf.reactor.exec.compute.SelectKOptions;
import xyz.vvrf.reactor.exec.compute.SortKey;
import xyz.vvrf.reactor.exec.compute.SortOptions;
import xyz.vvrf.reactor.exec.compute.SortOrder;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.Schemas;
import xyz.vvrf.reactor.exec.core.StatusCode;
import xyz.vvrf.reactor.exec.options.AggregateNodeOptions;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.options.FilterNodeOptions;
import xyz.vvrf.reactor.exec.options.OrderBySinkNodeOptions;
import xyz.vvrf.reactor.exec.options.ProjectNodeOptions;
import xyz.vvrf.reactor.exec.options.SelectKSinkNodeOptions;
import xyz.vvrf.reactor.exec.options.SinkNodeOptions;
import xyz.vvrf.reactor.exec.options.SourceNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecContext;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;
import xyz.vvrf.reactor.exec.registry.ExecNodes;
import xyz.vvrf.reactor.exec.test.util.TestBatches;
import xyz.vvrf.reactor.exec.test.util.TestPlans;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static xyz.vvrf.reactor.exec.compute.Expressions.add;
import static xyz.vvrf.reactor.exec.compute.Expressions.divide;
import static xyz.vvrf.reactor.exec.compute.Expressions.equal;
import static xyz.vvrf.reactor.exec.compute.Expressions.field;
import static xyz.vvrf.reactor.exec.compute.Expressions.isValid;
import static xyz.vvrf.reactor.exec.compute.Expressions.literal;
import static xyz.vvrf.reactor.exec.compute.Expressions.multiply;
import static xyz.vvrf.reactor.exec.compute.Expressions.not;
import static xyz.vvrf.reactor.exec.test.util.TestBatches.row;
import static xyz.vvrf.reactor.exec.test.util.TestPlans.TIMEOUT;
import static xyz.vvrf.reactor.exec.test.util.TestPlans.rowsOf;

class RelationalNodeTest {

    private final ExecPlan plan = ExecPlan.make(ExecContext.serial());

    private ExecNode source(TestBatches data) {
        return ExecNodes.makeExecNode("source", plan, Collections.emptyList(),
                new SourceNodeOptions(data.getSchema(), data.flux()));
    }

    private ExecNode node(String factoryName, ExecNode input, ExecNodeOptions options) {
        return ExecNodes.makeExecNode(factoryName, plan, Collections.singletonList(input), options);
    }

    private List<ExecBatch> runToSink(ExecNode last) {
        SinkNodeOptions sinkOptions = new SinkNodeOptions();
        node("sink", last, sinkOptions);
        return TestPlans.startAndCollect(plan, sinkOptions.getGenerator()).block(TIMEOUT);
    }

    @Test
    void orderBySinkSortsWithNullsAtEnd() {
        OrderBySinkNodeOptions options = new OrderBySinkNodeOptions(
                new SortOptions(Collections.singletonList(new SortKey("i32", SortOrder.ASCENDING))));
        node("order_by_sink", source(TestBatches.basic()), options);

        List<ExecBatch> batches = TestPlans.startAndCollect(plan, options.getGenerator()).block(TIMEOUT);

        assertThat(batches).hasSize(1);
        assertThat(batches.get(0).getRows()).containsExactly(
                row(4, false), row(5, null), row(6, false), row(7, false), row(null, true));
    }

    @Test
    void orderBySinkDescending() {
        OrderBySinkNodeOptions options = new OrderBySinkNodeOptions(
                new SortOptions(Collections.singletonList(new SortKey("i32", SortOrder.DESCENDING))));
        node("order_by_sink", source(TestBatches.basic()), options);

        List<ExecBatch> batches = TestPlans.startAndCollect(plan, options.getGenerator()).block(TIMEOUT);

        assertThat(rowsOf(batches)).extracting(r -> r.get(0)).containsExactly(7, 6, 5, 4, null);
    }

    private List<List<Object>> filterValidThenOrderBy(SortOrder order, NullPlacement nullPlacement) {
        ExecNode filtered = node("filter", source(TestBatches.basic()), new FilterNodeOptions(isValid(field("bool"))));
        OrderBySinkNodeOptions options = new OrderBySinkNodeOptions(
                new SortOptions(Collections.singletonList(new SortKey("i32", order)), nullPlacement));
        node("order_by_sink", filtered, options);
        return rowsOf(TestPlans.startAndCollect(plan, options.getGenerator()).block(TIMEOUT));
    }

    @Test
    void filterThenOrderByPlacesNullsAtStart() {
        assertThat(filterValidThenOrderBy(SortOrder.ASCENDING, NullPlacement.AT_START)).containsExactly(
                row(null, true), row(4, false), row(6, false), row(7, false));
    }

    @Test
    void filterThenOrderByPlacesNullsAtEndRegardlessOfDirection() {
        assertThat(filterValidThenOrderBy(SortOrder.DESCENDING, NullPlacement.AT_END)).containsExactly(
                row(7, false), row(6, false), row(4, false), row(null, true));
    }

    @Test
    void orderBySinkRejectsUnknownField() {
        ExecNode source = source(TestBatches.basic());

        assertThatThrownBy(() -> node("order_by_sink", source, new OrderBySinkNodeOptions(
                new SortOptions(Collections.singletonList(new SortKey("missing"))))))
                .isInstanceOf(ExecPlanException.class)
                .extracting(e -> ((ExecPlanException) e).getCode())
                .isEqualTo(StatusCode.KEY_ERROR);
    }

    @Test
    void filterKeepsMatchingRowsAndEmptyBatches() {
        ExecNode filter = node("filter", source(TestBatches.basic()), new FilterNodeOptions(equal(field("i32"), literal(6))));

        List<ExecBatch> batches = runToSink(filter);

        assertThat(batches).hasSize(2);
        assertThat(batches.get(0).getLength()).isZero();
        assertThat(batches.get(1).getRows()).containsExactly(row(6, false));
        assertThat(filter.getOutputSchema()).isEqualTo(TestBatches.basic().getSchema());
    }

    @Test
    void filterRequiresBoolExpression() {
        ExecNode source = source(TestBatches.basic());

        assertThatThrownBy(() -> node("filter", source, new FilterNodeOptions(field("i32"))))
                .isInstanceOf(ExecPlanException.class)
                .extracting(e -> ((ExecPlanException) e).getCode())
                .isEqualTo(StatusCode.TYPE_ERROR);
    }

    @Test
    void projectEvaluatesExpressions() {
        ExecNode project = node("project", source(TestBatches.basic()),
                new ProjectNodeOptions(Arrays.asList(not(field("bool")), add(field("i32"), literal(1)))));

        List<ExecBatch> batches = runToSink(project);

        assertThat(batches).hasSize(2);
        assertThat(batches.get(0).getRows()).containsExactly(row(false, null), row(true, 5));
        assertThat(batches.get(1).getRows()).containsExactly(row(null, 6), row(true, 7), row(true, 8));
        assertThat(project.getOutputSchema().getFields().get(0).getName()).isEqualTo("invert(bool)");
        assertThat(project.getOutputSchema().getFields().get(1).getType()).isEqualTo(Schemas.INT32);
    }

    @Test
    void projectUsesExplicitNames() {
        ExecNode project = node("project", source(TestBatches.basic()),
                new ProjectNodeOptions(Collections.singletonList(field("i32")), Collections.singletonList("renamed")));

        assertThat(project.getOutputSchema().getFields().get(0).getName()).isEqualTo("renamed");
    }

    @Test
    void projectRejectsNameCountMismatch() {
        ExecNode source = source(TestBatches.basic());

        assertThatThrownBy(() -> node("project", source, new ProjectNodeOptions(
                Collections.singletonList(field("i32")), Arrays.asList("a", "b"))))
                .isInstanceOf(ExecPlanException.class)
                .matches(e -> ((ExecPlanException) e).isInvalid());
    }

    @Test
    void groupedSumByKey() {
        ExecNode aggregate = node("aggregate", source(TestBatches.groupable()), new AggregateNodeOptions(
                Collections.singletonList(new Aggregate("hash_sum", "i32", "sum(i32)")),
                Collections.singletonList("str")));

        List<ExecBatch> batches = runToSink(aggregate);

        assertThat(rowsOf(batches)).containsExactly(row(8L, "alfa"), row(10L, "beta"), row(4L, "gama"));
        assertThat(aggregate.getKindName()).isEqualTo("GroupByNode");
        assertThat(aggregate.getOutputSchema().getFields().get(0).getType()).isEqualTo(Schemas.INT64);
    }

    @Test
    void groupedCountModes() {
        ExecNode aggregate = node("aggregate", source(TestBatches.basic()), new AggregateNodeOptions(
                Arrays.asList(
                        new Aggregate("hash_count", CountMode.ALL, "i32", "count_all"),
                        new Aggregate("hash_count", CountMode.ONLY_NULL, "i32", "count_null")),
                Collections.singletonList("bool")));

        List<ExecBatch> batches = runToSink(aggregate);

        assertThat(rowsOf(batches)).containsExactly(row(1L, 1L, true), row(3L, 0L, false), row(1L, 0L, null));
    }

    @Test
    void scalarAggregates() {
        ExecNode aggregate = node("aggregate", source(TestBatches.basic()), new AggregateNodeOptions(Arrays.asList(
                new Aggregate("sum", "i32", "sum"),
                new Aggregate("count", "i32", "count"),
                new Aggregate("min", "i32", "min"),
                new Aggregate("max", "i32", "max"),
                new Aggregate("mean", "i32", "mean"),
                new Aggregate("any", "bool", "any"),
                new Aggregate("all", "bool", "all"))));

        List<ExecBatch> batches = runToSink(aggregate);

        assertThat(aggregate.getKindName()).isEqualTo("ScalarAggregateNode");
        assertThat(rowsOf(batches)).containsExactly(row(22L, 4L, 4, 7, 5.5, true, false));
    }

    @Test
    void scalarFunctionWithKeysIsInvalid() {
        ExecNode source = source(TestBatches.groupable());

        assertThatThrownBy(() -> node("aggregate", source, new AggregateNodeOptions(
                Collections.singletonList(new Aggregate("sum", "i32", "sum(i32)")),
                Collections.singletonList("str"))))
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("is a scalar aggregate function");
    }

    @Test
    void hashFunctionWithoutKeysIsInvalid() {
        ExecNode source = source(TestBatches.groupable());

        assertThatThrownBy(() -> node("aggregate", source, new AggregateNodeOptions(
                Collections.singletonList(new Aggregate("hash_sum", "i32", "sum(i32)")))))
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("is a hash aggregate function");
    }

    @Test
    void selectKAfterGroupAndProject() {
        ExecNode aggregate = node("aggregate", source(TestBatches.groupable()), new AggregateNodeOptions(
                Collections.singletonList(new Aggregate("hash_sum", "i32", "sum(i32)")),
                Collections.singletonList("str")));
        ExecNode project = node("project", aggregate, new ProjectNodeOptions(
                Arrays.asList(multiply(field("sum(i32)"), literal(2)), field("str"))));
        SelectKSinkNodeOptions options = new SelectKSinkNodeOptions(
                SelectKOptions.bottomKDefault(1, "multiply(sum(i32), 2)"));
        node("select_k_sink", project, options);

        List<ExecBatch> batches = TestPlans.startAndCollect(plan, options.getGenerator()).block(TIMEOUT);

        assertThat(rowsOf(batches)).containsExactly(row(8L, "gama"));
    }

    @Test
    void topKKeepsLargestRows() {
        SelectKSinkNodeOptions options = new SelectKSinkNodeOptions(SelectKOptions.topKDefault(2, "i32"));
        node("select_k_sink", source(TestBatches.groupable()), options);

        List<ExecBatch> batches = TestPlans.startAndCollect(plan, options.getGenerator()).block(TIMEOUT);

        assertThat(rowsOf(batches)).containsExactly(row(12, "alfa"), row(7, "beta"));
    }

    @Test
    void selectKRejectsNegativeK() {
        ExecNode source = source(TestBatches.groupable());

        assertThatThrownBy(() -> node("select_k_sink", source,
                new SelectKSinkNodeOptions(SelectKOptions.topKDefault(-1, "i32"))))
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("k >= 0");
    }

    @Test
    void unionForwardsBatchesFromAllInputs() {
        TestBatches data = TestBatches.basic();
        ExecNode union = ExecNodes.makeExecNode("union", plan, Arrays.asList(source(data), source(data)), null);

        List<ExecBatch> batches = runToSink(union);

        assertThat(batches).hasSize(4);
        assertThat(rowsOf(batches)).hasSize(10);
        assertThat(union.getInputLabels()).containsExactly("input_0_label", "input_1_label");
    }

    @Test
    void unionRejectsDifferentSchemas() {
        List<ExecNode> inputs = Arrays.asList(source(TestBatches.basic()), source(TestBatches.groupable()));

        assertThatThrownBy(() -> ExecNodes.makeExecNode("union", plan, inputs, null))
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("schemas must all match");
    }

    @Test
    void projectErrorFailsPlan() {
        ExecNode project = node("project", source(TestBatches.groupable()),
                new ProjectNodeOptions(Collections.singletonList(
                        divide(field("i32"), literal(0)))));

        SinkNodeOptions sinkOptions = new SinkNodeOptions();
        node("sink", project, sinkOptions);
        plan.startProducing();

        assertThatThrownBy(() -> plan.finished().block(TIMEOUT))
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("divide by zero");
    }
}
