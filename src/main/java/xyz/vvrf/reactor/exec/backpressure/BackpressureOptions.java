package xyz.vvrf.reactor.exec.backpressure;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import xyz.vvrf.reactor.exec.core.ExecPlanException;

/**
 * 汇节点背压阈值：缓冲字节数超过 {@code pauseIfAbove} 时暂停上游，
 * 回落到 {@code resumeIfBelow} 及以下时恢复。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
public final class BackpressureOptions {

    private static final long DEFAULT_RESUME_IF_BELOW = 32L * 1024 * 1024;
    private static final long DEFAULT_PAUSE_IF_ABOVE = 64L * 1024 * 1024;

    private final long resumeIfBelow;
    private final long pauseIfAbove;

    public BackpressureOptions(long resumeIfBelow, long pauseIfAbove) {
        if (resumeIfBelow < 0 || pauseIfAbove < 0) {
            throw ExecPlanException.invalid("Backpressure thresholds must be >= 0, but got resume_if_below=%d, pause_if_above=%d",
                    resumeIfBelow, pauseIfAbove);
        }
        if (resumeIfBelow > pauseIfAbove) {
            throw ExecPlanException.invalid("Backpressure requires resume_if_below <= pause_if_above, but got %d > %d",
                    resumeIfBelow, pauseIfAbove);
        }
        this.resumeIfBelow = resumeIfBelow;
        this.pauseIfAbove = pauseIfAbove;
    }

    public static BackpressureOptions defaultBackpressure() {
        return new BackpressureOptions(DEFAULT_RESUME_IF_BELOW, DEFAULT_PAUSE_IF_ABOVE);
    }

    public static BackpressureOptions noBackpressure() {
        return new BackpressureOptions(0, 0);
    }

    public boolean shouldApplyBackpressure() {
        return pauseIfAbove > 0;
    }

    @Override
    public String toString() {
        return "BackpressureOptions{resumeIfBelow=" + resumeIfBelow + ", pauseIfAbove=" + pauseIfAbove + '}';
    }
}
