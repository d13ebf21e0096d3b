package xyz.vvrf.reactor.exec.backpressure;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 记录汇节点缓冲字节数并据此触发暂停/恢复。
 * 字节计数与暂停标志均为原子变量，可被监控方无锁读取；
 * 状态转换在锁内完成，保证 pause/resume 回调按发生顺序交替调用。
 * 转换监听按转换发生的顺序逐个通知。控制回调中嵌套触发的转换 (单线程模式下恢复上游会立即推入新批次)
 * 排在外层转换之后，同一时刻只有一个线程在通知。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class BackpressureReservoir implements BackpressureMonitor {

    /**
     * 状态转换监听，参数为转换后的暂停状态与当时的缓冲字节数。
     */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(boolean paused, long bytesInUse);
    }

    private final BackpressureOptions options;
    private final BackpressureControl control;
    private final TransitionListener transitionListener;

    private final AtomicLong bytesInUse = new AtomicLong();
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final Object transitionLock = new Object();
    private final Queue<Transition> pendingTransitions = new ConcurrentLinkedQueue<>();
    private final AtomicInteger notifyWip = new AtomicInteger();

    public BackpressureReservoir(BackpressureOptions options, BackpressureControl control) {
        this(options, control, (p, b) -> { });
    }

    public BackpressureReservoir(BackpressureOptions options, BackpressureControl control, TransitionListener transitionListener) {
        this.options = Objects.requireNonNull(options, "背压选项不能为空");
        this.control = Objects.requireNonNull(control, "背压控制不能为空");
        this.transitionListener = Objects.requireNonNull(transitionListener, "转换监听不能为空");
    }

    public void recordProduced(long numBytes) {
        long current = bytesInUse.addAndGet(numBytes);
        if (!options.shouldApplyBackpressure()) {
            return;
        }
        synchronized (transitionLock) {
            if (!paused.get() && bytesInUse.get() > options.getPauseIfAbove()) {
                paused.set(true);
                pendingTransitions.add(new Transition(true, bytesInUse.get()));
                log.debug("缓冲字节数 {} 超过 {}，暂停上游", current, options.getPauseIfAbove());
                control.pause();
            }
        }
        drainTransitions();
    }

    public void recordConsumed(long numBytes) {
        long current = bytesInUse.addAndGet(-numBytes);
        if (!options.shouldApplyBackpressure()) {
            return;
        }
        synchronized (transitionLock) {
            if (paused.get() && bytesInUse.get() <= options.getResumeIfBelow()) {
                paused.set(false);
                pendingTransitions.add(new Transition(false, bytesInUse.get()));
                log.debug("缓冲字节数 {} 回落到 {} 以下，恢复上游", current, options.getResumeIfBelow());
                control.resume();
            }
        }
        drainTransitions();
    }

    private void drainTransitions() {
        if (notifyWip.getAndIncrement() != 0) {
            return;
        }
        do {
            Transition transition;
            while ((transition = pendingTransitions.poll()) != null) {
                try {
                    transitionListener.onTransition(transition.paused, transition.bytesInUse);
                } catch (RuntimeException e) {
                    log.warn("背压转换监听执行失败: {}", e.toString(), e);
                }
            }
        } while (notifyWip.decrementAndGet() != 0);
    }

    @Override
    public long getBytesInUse() {
        return bytesInUse.get();
    }

    @Override
    public boolean isPaused() {
        return paused.get();
    }

    public BackpressureOptions getOptions() {
        return options;
    }

    private static final class Transition {
        private final boolean paused;
        private final long bytesInUse;

        Transition(boolean paused, long bytesInUse) {
            this.paused = paused;
            this.bytesInUse = bytesInUse;
        }
    }
}
