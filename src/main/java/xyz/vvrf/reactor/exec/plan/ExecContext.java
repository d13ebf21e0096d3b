package xyz.vvrf.reactor.exec.plan;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * 计划的执行上下文：决定推送在调用线程内联执行，还是作为任务提交到共享的 {@link Scheduler}。
 * Scheduler 由外部持有，计划不负责其生命周期。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Getter
public final class ExecContext {

    private final Scheduler scheduler;
    private final boolean useThreads;

    private ExecContext(Scheduler scheduler, boolean useThreads) {
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler 不能为空");
        this.useThreads = useThreads;
    }

    /**
     * 单线程模式：所有推送都在驱动生产的线程上同步发生。
     */
    public static ExecContext serial() {
        return new ExecContext(Schedulers.immediate(), false);
    }

    public static ExecContext threaded(Scheduler scheduler) {
        return new ExecContext(scheduler, true);
    }

    public static ExecContext defaultThreaded() {
        return threaded(Schedulers.parallel());
    }

    public static ExecContext of(boolean useThreads) {
        return useThreads ? defaultThreaded() : serial();
    }

    /**
     * 执行一个推送任务。任务抛出的异常交给 {@code onError} 处理。
     */
    public void execute(Runnable task, Consumer<Throwable> onError) {
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (Throwable t) {
                log.warn("执行任务失败: {}", t.toString());
                onError.accept(t);
            }
        };
        if (useThreads) {
            scheduler.schedule(guarded);
        } else {
            guarded.run();
        }
    }

    @Override
    public String toString() {
        return "ExecContext{useThreads=" + useThreads + ", scheduler=" + scheduler + '}';
    }
}
