package xyz.vvrf.reactor.exec.plan;

import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.StatusCode;
import xyz.vvrf.reactor.exec.monitor.ExecPlanListener;
import xyz.vvrf.reactor.exec.test.util.DummyNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static xyz.vvrf.reactor.exec.test.util.TestPlans.TIMEOUT;

class ExecPlanTest {

    private final List<String> started = new CopyOnWriteArrayList<>();
    private final List<String> stopped = new CopyOnWriteArrayList<>();

    /**
     * s1 -> p1, p3; s2 -> p2; p1 -> p2, p3; p2 -> p3; p3 -> sink
     */
    private List<DummyNode> buildDiamond(ExecPlan plan, RuntimeException s1Error, RuntimeException p1Error) {
        DummyNode s1 = DummyNode.builder(plan).label("s1").numOutputs(2).recordTo(started, stopped).failOnStart(s1Error).add();
        DummyNode s2 = DummyNode.builder(plan).label("s2").numOutputs(1).recordTo(started, stopped).add();
        DummyNode p1 = DummyNode.builder(plan).label("p1").inputs(s1).numOutputs(2).recordTo(started, stopped).failOnStart(p1Error).add();
        DummyNode p2 = DummyNode.builder(plan).label("p2").inputs(p1, s2).numOutputs(1).recordTo(started, stopped).add();
        DummyNode p3 = DummyNode.builder(plan).label("p3").inputs(p1, s1, p2).numOutputs(1).recordTo(started, stopped).add();
        DummyNode sink = DummyNode.builder(plan).label("sink").inputs(p3).recordTo(started, stopped).add();
        return Arrays.asList(s1, s2, p1, p2, p3, sink);
    }

    @Test
    void startsInReverseTopologicalOrderAndStopsInTopologicalOrder() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        buildDiamond(plan, null, null);

        plan.validate();
        assertThat(plan.getState()).isEqualTo(PlanState.VALIDATED);
        plan.startProducing();
        assertThat(started).containsExactly("sink", "p3", "p2", "p1", "s2", "s1");
        assertThat(stopped).isEmpty();

        plan.stopProducing();
        plan.finished().block(TIMEOUT);
        assertThat(stopped).containsExactly("s1", "s2", "p1", "p2", "p3", "sink");
        assertThat(plan.getState()).isEqualTo(PlanState.FINISHED);
    }

    @Test
    void startFailureStopsStartedNodesInReverseStartOrder() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        buildDiamond(plan, ExecPlanException.notImplemented("zzz"), ExecPlanException.ioError("xxx", null));

        assertThatThrownBy(plan::startProducing)
                .isInstanceOf(ExecPlanException.class)
                .hasMessage("xxx")
                .extracting(e -> ((ExecPlanException) e).getCode())
                .isEqualTo(StatusCode.IO_ERROR);
        assertThat(started).containsExactly("sink", "p3", "p2", "p1");
        assertThat(stopped).containsExactly("p2", "p3", "sink");

        assertThatThrownBy(() -> plan.finished().block(TIMEOUT))
                .isInstanceOf(ExecPlanException.class)
                .hasMessage("xxx");
    }

    @Test
    void nodeFailureStopsWholePlan() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        List<DummyNode> nodes = buildDiamond(plan, null, null);
        plan.startProducing();

        nodes.get(3).fail(ExecPlanException.invalid("boom"));

        assertThatThrownBy(() -> plan.finished().block(TIMEOUT))
                .isInstanceOf(ExecPlanException.class)
                .hasMessage("boom");
        assertThat(stopped).containsExactly("s1", "s2", "p1", "p3", "sink");
    }

    @Test
    void unlabeledNodesAreLabeledWithTheirOrdinal() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        DummyNode source = DummyNode.builder(plan).numOutputs(1).add();
        DummyNode labeled = DummyNode.builder(plan).label("some_label").inputs(source).numOutputs(1).add();
        DummyNode sink = DummyNode.builder(plan).inputs(labeled).add();

        assertThat(source.getLabel()).isEqualTo("0");
        assertThat(labeled.getLabel()).isEqualTo("some_label");
        assertThat(sink.getLabel()).isEqualTo("2");
        assertThat(source.hasAutoLabel()).isTrue();
        assertThat(labeled.hasAutoLabel()).isFalse();
        assertThat(source.toString()).isEqualTo(":DummyNode{}");
        assertThat(labeled.toString()).isEqualTo("some_label:DummyNode{}");
    }

    @Test
    void duplicateExplicitLabelIsRejected() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        DummyNode.builder(plan).label("x").numOutputs(1).add();

        assertThatThrownBy(() -> DummyNode.builder(plan).label("x").add())
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("Label 'x'")
                .extracting(e -> ((ExecPlanException) e).getCode())
                .isEqualTo(StatusCode.INVALID);
        assertThat(plan.getNodes()).hasSize(1);
    }

    @Test
    void explicitLabelCannotReuseAnOrdinalLabel() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        DummyNode source = DummyNode.builder(plan).numOutputs(1).add();

        assertThatThrownBy(() -> DummyNode.builder(plan).label("0").inputs(source).add())
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("Label '0'");
        assertThat(plan.getNodes()).containsExactly(source);
    }

    @Test
    void ordinalLabelCannotReuseAnExplicitLabel() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        DummyNode source = DummyNode.builder(plan).label("1").numOutputs(1).add();

        assertThatThrownBy(() -> DummyNode.builder(plan).inputs(source).add())
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("Label '1'");
    }

    @Test
    void relabelingOntoAnotherNodesLabelIsRejected() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        DummyNode source = DummyNode.builder(plan).label("src").numOutputs(1).add();
        DummyNode sink = DummyNode.builder(plan).inputs(source).add();

        assertThatThrownBy(() -> plan.relabelNode(sink, "src"))
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("Label 'src'");
        assertThat(sink.getLabel()).isEqualTo("1");

        plan.relabelNode(sink, "dst");
        assertThat(sink.getLabel()).isEqualTo("dst");
        assertThat(sink.hasAutoLabel()).isFalse();
    }

    @Test
    void validateRejectsLabelsChangedIntoDuplicates() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        DummyNode source = DummyNode.builder(plan).label("src").numOutputs(1).add();
        DummyNode sink = DummyNode.builder(plan).inputs(source).add();
        sink.setLabel("src");

        assertThatThrownBy(plan::validate)
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("more than one node labeled 'src'");
        assertThat(plan.getState()).isEqualTo(PlanState.UNVALIDATED);
    }

    @Test
    void emptyPlanIsInvalid() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());

        assertThatThrownBy(plan::validate)
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("has no node")
                .matches(e -> ((ExecPlanException) e).isInvalid());
        assertThatThrownBy(plan::startProducing).hasMessageContaining("has no node");
    }

    @Test
    void unboundOutputIsInvalid() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        DummyNode.builder(plan).numOutputs(1).add();

        assertThatThrownBy(plan::validate)
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("not bound");
    }

    @Test
    void planCannotBeRestarted() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        buildDiamond(plan, null, null);
        plan.startProducing();

        assertThatThrownBy(plan::startProducing)
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("restarted");
        assertThat(started).hasSize(6);
        assertThat(stopped).isEmpty();
        assertThat(plan.getState()).isEqualTo(PlanState.RUNNING);

        plan.stopProducing();
        plan.finished().block(TIMEOUT);
        assertThat(stopped).hasSize(6);

        assertThatThrownBy(plan::startProducing).hasMessageContaining("restarted");
        assertThat(started).hasSize(6);
        assertThat(stopped).hasSize(6);
    }

    @Test
    void planCannotBeRestartedAfterFinishingCleanly() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        List<DummyNode> nodes = buildDiamond(plan, null, null);
        plan.startProducing();
        for (DummyNode node : nodes) {
            node.finish();
        }
        plan.finished().block(TIMEOUT);
        assertThat(plan.getState()).isEqualTo(PlanState.FINISHED);

        assertThatThrownBy(plan::startProducing)
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("restarted");
        assertThat(started).hasSize(6);
        assertThat(stopped).isEmpty();
        assertThat(plan.getState()).isEqualTo(PlanState.FINISHED);
    }

    @Test
    void nodesCannotBeAddedAfterStart() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        buildDiamond(plan, null, null);
        plan.startProducing();

        assertThatThrownBy(() -> DummyNode.builder(plan).add())
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("after it has been started");
        plan.stopProducing();
    }

    @Test
    void stopBeforeStartFinishesWithoutStartingNodes() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        buildDiamond(plan, null, null);

        plan.stopProducing();

        plan.finished().block(TIMEOUT);
        assertThat(started).isEmpty();
        assertThat(stopped).isEmpty();
        assertThatThrownBy(plan::startProducing).isInstanceOf(ExecPlanException.class);
    }

    @Test
    void stopIsIdempotent() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        buildDiamond(plan, null, null);
        plan.startProducing();

        plan.stopProducing();
        plan.stopProducing();

        plan.finished().block(TIMEOUT);
        assertThat(stopped).hasSize(6);
    }

    @Test
    void sourcesAndSinksFollowRegistrationOrder() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        List<DummyNode> nodes = buildDiamond(plan, null, null);

        assertThat(plan.getSources()).containsExactly(nodes.get(0), nodes.get(1));
        assertThat(plan.getSinks()).containsExactly(nodes.get(5));
        assertThat(plan.getNodes()).hasSize(6);
    }

    @Test
    void dotOutputContainsEdgesWithInputLabels() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial(), "dot_plan", Collections.emptyList());
        DummyNode source = DummyNode.builder(plan).label("src").numOutputs(1).add();
        DummyNode.builder(plan).label("dst").inputs(source).add();

        String dot = plan.toDot();

        assertThat(dot).startsWith("digraph \"dot_plan\" {");
        assertThat(dot).contains("\"src\" -> \"dst\"");
        assertThat(dot).contains("input_0");
    }

    @Test
    void listenersObserveLifecycleInOrder() {
        ExecPlanListener listener = mock(ExecPlanListener.class);
        ExecPlan plan = ExecPlan.make(ExecContext.serial(), "listened", Collections.singletonList(listener));
        DummyNode source = DummyNode.builder(plan).label("src").numOutputs(1).add();
        DummyNode sink = DummyNode.builder(plan).label("dst").inputs(source).add();

        plan.startProducing();
        plan.stopProducing();
        plan.finished().block(TIMEOUT);

        InOrder order = inOrder(listener);
        order.verify(listener).onPlanStart(plan);
        order.verify(listener).onNodeStart(plan, sink);
        order.verify(listener).onNodeStart(plan, source);
        order.verify(listener).onNodeStop(plan, source);
        order.verify(listener).onNodeStop(plan, sink);
        order.verify(listener).onPlanFinished(eq(plan), any(Duration.class), isNull());
        verify(listener).onNodeFinished(eq(plan), eq(source), any(Duration.class), isNull());
        verify(listener).onNodeFinished(eq(plan), eq(sink), any(Duration.class), isNull());
    }

    @Test
    void throwingListenerDoesNotBreakPlan() {
        ExecPlanListener listener = mock(ExecPlanListener.class);
        doThrow(new IllegalStateException("listener failure")).when(listener).onPlanStart(any());
        doThrow(new IllegalStateException("listener failure")).when(listener).onNodeStart(any(), any());
        ExecPlan plan = ExecPlan.make(ExecContext.serial(), "fragile", Collections.singletonList(listener));
        DummyNode source = DummyNode.builder(plan).label("src").numOutputs(1).recordTo(started, stopped).add();
        DummyNode.builder(plan).label("dst").inputs(source).recordTo(started, stopped).add();

        plan.startProducing();
        plan.stopProducing();
        plan.finished().block(TIMEOUT);

        assertThat(started).containsExactly("dst", "src");
        assertThat(new ArrayList<>(stopped)).containsExactly("src", "dst");
    }

    @Test
    void nodeFromAnotherPlanIsRejected() {
        ExecPlan plan = ExecPlan.make(ExecContext.serial());
        ExecPlan other = ExecPlan.make(ExecContext.serial());
        DummyNode foreign = DummyNode.builder(other).numOutputs(1).add();

        assertThatThrownBy(() -> DummyNode.builder(plan).inputs(foreign).add())
                .isInstanceOf(ExecPlanException.class)
                .hasMessageContaining("different ExecPlan");
    }
}
