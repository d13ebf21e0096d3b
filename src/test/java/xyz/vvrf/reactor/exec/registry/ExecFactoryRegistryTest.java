package xyz.vvrf.reactor.exec.registry;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.StatusCode;
import xyz.vvrf.reactor.exec.options.FilterNodeOptions;
import xyz.vvrf.reactor.exec.options.SourceNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecContext;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;
import xyz.vvrf.reactor.exec.test.util.DummyNode;
import xyz.vvrf.reactor.exec.test.util.TestBatches;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static xyz.vvrf.reactor.exec.compute.Expressions.literal;

class ExecFactoryRegistryTest {

    private static final ExecNodeFactory DUMMY_FACTORY =
            (plan, inputs, options) -> DummyNode.builder(plan).inputs(inputs.toArray(new ExecNode[0])).numOutputs(1).add();

    @Test
    void defaultRegistryHasAllBuiltinFactories() {
        assertThat(ExecFactoryRegistry.defaultRegistry().getFactoryNames()).containsExactlyInAnyOrder(
                "source", "table_source", "record_batch_reader_source", "array_vector_source",
                "exec_batch_source", "record_batch_source",
                "sink", "order_by_sink", "select_k_sink", "consuming_sink", "table_sink",
                "filter", "project", "aggregate", "hashjoin", "union");
    }

    @Test
    void duplicateNameIsKeyError() {
        DefaultExecFactoryRegistry registry = new DefaultExecFactoryRegistry();
        registry.addFactory("dummy", DUMMY_FACTORY);

        assertThatThrownBy(() -> registry.addFactory("dummy", DUMMY_FACTORY))
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("already registered")
                .extracting(e -> ((ExecPlanException) e).getCode())
                .isEqualTo(StatusCode.KEY_ERROR);
    }

    @Test
    void unknownNameIsInvalid() {
        DefaultExecFactoryRegistry registry = new DefaultExecFactoryRegistry();

        assertThatThrownBy(() -> registry.getFactory("no_such_factory"))
                .isInstanceOf(ExecPlanException.class)
                .hasMessage("ExecNode factory named no_such_factory not present in registry.")
                .matches(e -> ((ExecPlanException) e).isInvalid());
    }

    @Test
    void nestedRegistryFallsBackToParent() {
        DefaultExecFactoryRegistry child = new DefaultExecFactoryRegistry(ExecFactoryRegistry.defaultRegistry());
        child.addFactory("dummy", DUMMY_FACTORY);

        assertThat(child.getFactory("dummy")).isSameAs(DUMMY_FACTORY);
        assertThat(child.getFactory("source")).isNotNull();
        assertThat(child.getFactoryNames()).contains("dummy", "source", "union");
        assertThat(ExecFactoryRegistry.defaultRegistry().getFactoryNames()).doesNotContain("dummy");
        assertThatThrownBy(() -> child.addFactory("source", DUMMY_FACTORY))
                .isInstanceOf(ExecPlanException.class)
                .extracting(e -> ((ExecPlanException) e).getCode())
                .isEqualTo(StatusCode.KEY_ERROR);
    }

    @Test
    void customFactoryCreatesNodeThroughRegistry() {
        DefaultExecFactoryRegistry registry = new DefaultExecFactoryRegistry(ExecFactoryRegistry.defaultRegistry());
        registry.addFactory("dummy", DUMMY_FACTORY);
        TestBatches data = TestBatches.basic();
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        ExecNode source = ExecNodes.makeExecNode("source", plan, Collections.emptyList(),
                new SourceNodeOptions(data.getSchema(), data.flux()), registry);

        ExecNode dummy = ExecNodes.makeExecNode("dummy", plan, Collections.singletonList(source), null, registry);

        assertThat(dummy.getKindName()).isEqualTo("DummyNode");
        assertThat(dummy.getInputs()).containsExactly(source);
        assertThat(source.getOutputs()).containsExactly(dummy);
    }

    @Test
    void wrongOptionsTypeIsInvalid() {
        TestBatches data = TestBatches.basic();
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        ExecNode source = ExecNodes.makeExecNode("source", plan, Collections.emptyList(),
                new SourceNodeOptions(data.getSchema(), data.flux()));

        assertThatThrownBy(() -> ExecNodes.makeExecNode("sink", plan, Collections.singletonList(source),
                new FilterNodeOptions(literal(true))))
                .isInstanceOf(ExecPlanException.class)
                .hasMessage("SinkNode requires SinkNodeOptions but got FilterNodeOptions");
        assertThatThrownBy(() -> ExecNodes.makeExecNode("sink", plan, Collections.singletonList(source), null))
                .hasMessage("SinkNode requires SinkNodeOptions but got null");
    }
}
