package xyz.vvrf.reactor.exec.backpressure;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import xyz.vvrf.reactor.exec.core.ExecPlanException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BackpressureReservoirTest {

    @Mock
    private BackpressureControl control;

    @Test
    void pausesAboveUpperAndResumesAtLowerThreshold() {
        List<String> transitions = new ArrayList<>();
        BackpressureReservoir reservoir = new BackpressureReservoir(new BackpressureOptions(2, 4), control,
                (paused, bytes) -> transitions.add(paused + "@" + bytes));

        reservoir.recordProduced(3);
        assertThat(reservoir.isPaused()).isFalse();
        verify(control, never()).pause();

        reservoir.recordProduced(2);
        assertThat(reservoir.isPaused()).isTrue();
        assertThat(reservoir.getBytesInUse()).isEqualTo(5);

        reservoir.recordConsumed(2);
        assertThat(reservoir.isPaused()).isTrue();
        verify(control, never()).resume();

        reservoir.recordConsumed(1);
        assertThat(reservoir.isPaused()).isFalse();
        assertThat(reservoir.getBytesInUse()).isEqualTo(2);

        InOrder order = inOrder(control);
        order.verify(control).pause();
        order.verify(control).resume();
        assertThat(transitions).containsExactly("true@5", "false@2");
    }

    @Test
    void pauseTriggeredInsideResumeIsReportedAfterTheResume() {
        List<String> transitions = new ArrayList<>();
        AtomicReference<BackpressureReservoir> ref = new AtomicReference<>();
        BackpressureReservoir reservoir = new BackpressureReservoir(new BackpressureOptions(2, 4), control,
                (paused, bytes) -> transitions.add(paused + "@" + bytes));
        ref.set(reservoir);
        // 单线程模式下恢复上游会在 resume 回调内立即推入新批次
        doAnswer(invocation -> {
            ref.get().recordProduced(10);
            return null;
        }).when(control).resume();

        reservoir.recordProduced(5);
        reservoir.recordConsumed(3);

        assertThat(transitions).containsExactly("true@5", "false@2", "true@12");
        assertThat(reservoir.isPaused()).isTrue();
        InOrder order = inOrder(control);
        order.verify(control).pause();
        order.verify(control).resume();
        order.verify(control).pause();
    }

    @Test
    void repeatedProductionWhilePausedDoesNotPauseAgain() {
        BackpressureReservoir reservoir = new BackpressureReservoir(new BackpressureOptions(2, 4), control);

        reservoir.recordProduced(5);
        reservoir.recordProduced(5);

        verify(control).pause();
        assertThat(reservoir.getBytesInUse()).isEqualTo(10);
    }

    @Test
    void disabledBackpressureOnlyCountsBytes() {
        BackpressureReservoir reservoir = new BackpressureReservoir(BackpressureOptions.noBackpressure(), control);

        reservoir.recordProduced(1_000_000);
        reservoir.recordConsumed(10);

        verifyNoInteractions(control);
        assertThat(reservoir.isPaused()).isFalse();
        assertThat(reservoir.getBytesInUse()).isEqualTo(999_990);
    }

    @Test
    void optionsValidateThresholds() {
        assertThatThrownBy(() -> new BackpressureOptions(5, 4))
                .isInstanceOf(ExecPlanException.class)
                .matches(e -> ((ExecPlanException) e).isInvalid());
        assertThatThrownBy(() -> new BackpressureOptions(-1, 4))
                .isInstanceOf(ExecPlanException.class);

        assertThat(BackpressureOptions.noBackpressure().shouldApplyBackpressure()).isFalse();
        assertThat(BackpressureOptions.defaultBackpressure().shouldApplyBackpressure()).isTrue();
        assertThat(BackpressureOptions.defaultBackpressure().getResumeIfBelow()).isEqualTo(32L * 1024 * 1024);
        assertThat(BackpressureOptions.defaultBackpressure().getPauseIfAbove()).isEqualTo(64L * 1024 * 1024);
    }
}
