package xyz.vvrf.reactor.exec.plan;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 跟踪某个输入已到达的批次数与声明的总数。
 * {@link #increment()}、{@link #setTotal(int)}、{@link #cancel()} 中恰好有一次调用返回 true，
 * 与批次和总数到达的先后顺序无关。
 *
 * @author ruifeng.wen
 */
public final class BatchCounter {

    private final AtomicInteger count = new AtomicInteger();
    private final AtomicInteger total = new AtomicInteger(-1);
    private final AtomicBoolean complete = new AtomicBoolean(false);

    public int count() {
        return count.get();
    }

    public int total() {
        return total.get();
    }

    public boolean increment() {
        int current = count.incrementAndGet();
        if (current != total.get()) {
            return false;
        }
        return doneOnce();
    }

    public boolean setTotal(int newTotal) {
        total.set(newTotal);
        if (count.get() != newTotal) {
            return false;
        }
        return doneOnce();
    }

    public boolean cancel() {
        return doneOnce();
    }

    public boolean isCompleted() {
        return complete.get();
    }

    private boolean doneOnce() {
        return complete.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "BatchCounter{count=" + count.get() + ", total=" + total.get() + ", complete=" + complete.get() + '}';
    }
}
