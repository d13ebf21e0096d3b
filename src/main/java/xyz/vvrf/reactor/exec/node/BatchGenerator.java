package xyz.vvrf.reactor.exec.node;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import xyz.vvrf.reactor.exec.backpressure.BackpressureReservoir;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 汇节点的可拉取输出。
 * <p>
 * {@link #next()} 按推入顺序返回缓冲的批次；数据结束后持续返回空的 Optional；
 * 上游错误只交付一次，之后视为结束；生成器关闭 (计划关闭) 后的拉取以 INVALID 失败。
 * 交给拉取方的批次字节数从背压水库中释放。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class BatchGenerator {

    private final BackpressureReservoir reservoir;
    private final Object lock = new Object();

    private final Deque<ExecBatch> buffered = new ArrayDeque<>();
    private final Deque<Sinks.One<Optional<ExecBatch>>> waiters = new ArrayDeque<>();
    private boolean ended;
    private Throwable pendingError;
    private boolean closed;

    public BatchGenerator(BackpressureReservoir reservoir) {
        this.reservoir = Objects.requireNonNull(reservoir, "背压水库不能为空");
    }

    /**
     * 推入一个批次。结束或关闭后推入的批次被丢弃。
     */
    public void push(ExecBatch batch) {
        Sinks.One<Optional<ExecBatch>> waiter;
        synchronized (lock) {
            if (ended || closed) {
                log.debug("生成器已结束，丢弃 {} 行的批次", batch.getLength());
                return;
            }
            waiter = waiters.poll();
            if (waiter == null) {
                buffered.add(batch);
            }
        }
        reservoir.recordProduced(batch.getTotalBufferSize());
        if (waiter != null) {
            reservoir.recordConsumed(batch.getTotalBufferSize());
            waiter.tryEmitValue(Optional.of(batch));
        }
    }

    /**
     * 标记数据结束，正在等待的拉取得到空的 Optional。
     */
    public void end() {
        List<Sinks.One<Optional<ExecBatch>>> released;
        synchronized (lock) {
            if (ended) {
                return;
            }
            ended = true;
            released = new ArrayList<>(waiters);
            waiters.clear();
        }
        for (Sinks.One<Optional<ExecBatch>> waiter : released) {
            waiter.tryEmitValue(Optional.empty());
        }
    }

    /**
     * 标记以错误结束。错误在缓冲的批次之后交付给一次拉取。
     */
    public void fail(Throwable error) {
        Sinks.One<Optional<ExecBatch>> errorWaiter;
        List<Sinks.One<Optional<ExecBatch>>> released;
        synchronized (lock) {
            if (ended) {
                return;
            }
            ended = true;
            errorWaiter = waiters.poll();
            if (errorWaiter == null) {
                pendingError = error;
            }
            released = new ArrayList<>(waiters);
            waiters.clear();
        }
        if (errorWaiter != null) {
            errorWaiter.tryEmitError(error);
        }
        for (Sinks.One<Optional<ExecBatch>> waiter : released) {
            waiter.tryEmitValue(Optional.empty());
        }
    }

    /**
     * 释放生成器，之后的拉取立即失败，正在等待的拉取也以失败结束。
     */
    public void close() {
        List<Sinks.One<Optional<ExecBatch>>> released;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            released = new ArrayList<>(waiters);
            waiters.clear();
            buffered.clear();
        }
        for (Sinks.One<Optional<ExecBatch>> waiter : released) {
            waiter.tryEmitError(closedError());
        }
    }

    /**
     * @return 下一个批次；空的 Optional 表示数据结束
     */
    public Mono<Optional<ExecBatch>> next() {
        ExecBatch batch;
        synchronized (lock) {
            if (closed) {
                return Mono.error(closedError());
            }
            batch = buffered.poll();
            if (batch == null) {
                if (pendingError != null) {
                    Throwable error = pendingError;
                    pendingError = null;
                    return Mono.error(error);
                }
                if (ended) {
                    return Mono.just(Optional.empty());
                }
                Sinks.One<Optional<ExecBatch>> waiter = Sinks.one();
                waiters.add(waiter);
                return waiter.asMono();
            }
        }
        reservoir.recordConsumed(batch.getTotalBufferSize());
        return Mono.just(Optional.of(batch));
    }

    /**
     * 以 Flux 形式拉取全部批次，直到数据结束。
     */
    public Flux<ExecBatch> asFlux() {
        return Mono.defer(this::next)
                .repeat()
                .takeWhile(Optional::isPresent)
                .map(Optional::get);
    }

    private static ExecPlanException closedError() {
        return ExecPlanException.invalid("Sink generator was used after its ExecPlan was closed");
    }
}
