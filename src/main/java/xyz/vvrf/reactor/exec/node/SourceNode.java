package xyz.vvrf.reactor.exec.node;

import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.vector.types.pojo.Schema;
import org.reactivestreams.Subscription;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.options.SourceNodeOptions;
import xyz.vvrf.reactor.exec.plan.AbstractExecNode;
import xyz.vvrf.reactor.exec.plan.ExecContext;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 从 {@link Flux} 拉取批次并推给唯一的下游。
 * <p>
 * 每次只请求一个批次，上一个批次推送完毕后才请求下一个；处于暂停状态时不再请求，恢复时补发请求。
 * 多线程模式下生成器在调度器上被订阅，推送作为任务提交到同一调度器，任一时刻最多只有一个批次在途；
 * 超过 {@link ExecPlan#MAX_BATCH_SIZE} 的批次切分后再转发。
 * 生成器结束 (或出错、或被停止) 时向下游报告已产出的批次总数。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SourceNode extends AbstractExecNode {

    public static final String KIND_NAME = "SourceNode";

    private final Flux<ExecBatch> generator;
    private final AtomicInteger batchCount = new AtomicInteger();
    private final AtomicBoolean sourceFinished = new AtomicBoolean(false);

    private final Object flowLock = new Object();
    private int backpressureCounter = -1;
    private boolean paused;
    private boolean awaitingResume;
    private boolean stopRequested;
    private GeneratorSubscriber subscriber;

    public SourceNode(ExecPlan plan, Schema outputSchema, Flux<ExecBatch> generator) {
        super(plan, Collections.emptyList(), Collections.emptyList(), outputSchema, 1);
        this.generator = Objects.requireNonNull(generator, "批次生成器不能为空");
    }

    public static ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        NodeArgs.requireInputs(inputs, 0, KIND_NAME);
        SourceNodeOptions sourceOptions = NodeArgs.castOptions(options, SourceNodeOptions.class, KIND_NAME);
        if (sourceOptions.getOutputSchema() == null) {
            throw ExecPlanException.invalid("%s requires an output schema which is not null", KIND_NAME);
        }
        if (sourceOptions.getGenerator() == null) {
            throw ExecPlanException.invalid("%s requires a generator which is not null", KIND_NAME);
        }
        return plan.addNode(new SourceNode(plan, sourceOptions.getOutputSchema(), sourceOptions.getGenerator()));
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }

    @Override
    public void startProducing() {
        GeneratorSubscriber newSubscriber = new GeneratorSubscriber();
        synchronized (flowLock) {
            if (stopRequested) {
                log.debug("源节点 '{}' 在启动前已被停止", getLabel());
                return;
            }
            subscriber = newSubscriber;
        }
        ExecContext context = getContext();
        Flux<ExecBatch> flux = context.isUseThreads() ? generator.subscribeOn(context.getScheduler()) : generator;
        log.debug("源节点 '{}' 开始拉取批次", getLabel());
        flux.subscribe(newSubscriber);
    }

    @Override
    public void inputReceived(ExecNode input, ExecBatch batch) {
        throw new IllegalStateException(getKindName() + " has no input");
    }

    @Override
    public void errorReceived(ExecNode input, Throwable error) {
        throw new IllegalStateException(getKindName() + " has no input");
    }

    @Override
    public void inputFinished(ExecNode input, int totalBatches) {
        throw new IllegalStateException(getKindName() + " has no input");
    }

    @Override
    public void pauseProducing(ExecNode output, int counter) {
        synchronized (flowLock) {
            if (counter <= backpressureCounter) {
                return;
            }
            backpressureCounter = counter;
            paused = true;
        }
        log.debug("源节点 '{}' 暂停 (counter={})", getLabel(), counter);
    }

    @Override
    public void resumeProducing(ExecNode output, int counter) {
        GeneratorSubscriber toRequest = null;
        synchronized (flowLock) {
            if (counter <= backpressureCounter) {
                return;
            }
            backpressureCounter = counter;
            paused = false;
            if (awaitingResume && !stopRequested) {
                awaitingResume = false;
                toRequest = subscriber;
            }
        }
        log.debug("源节点 '{}' 恢复 (counter={})", getLabel(), counter);
        if (toRequest != null) {
            toRequest.request(1);
        }
    }

    @Override
    public void stopProducing(ExecNode output) {
        stopProducing();
    }

    @Override
    public void stopProducing() {
        GeneratorSubscriber toCancel;
        synchronized (flowLock) {
            if (stopRequested) {
                return;
            }
            stopRequested = true;
            toCancel = subscriber;
        }
        log.debug("源节点 '{}' 收到停止请求", getLabel());
        if (toCancel != null) {
            toCancel.dispose();
        }
        finishSource(null);
    }

    public boolean isPaused() {
        synchronized (flowLock) {
            return paused;
        }
    }

    private void finishSource(Throwable error) {
        if (!sourceFinished.compareAndSet(false, true)) {
            return;
        }
        int total = batchCount.get();
        log.debug("源节点 '{}' 结束，共产出 {} 个批次", getLabel(), total);
        getOutput().inputFinished(this, total);
        markFinished(error);
    }

    /**
     * 把批次 (切分后) 交给下游。全部切片的推送任务执行完毕后才决定是否请求下一批，
     * 因此下游在推送中触发的暂停一定先于下一次请求生效。
     */
    private void deliver(ExecBatch batch) {
        ExecNode output = getOutput();
        List<ExecBatch> slices = ExecBatch.sliceToMaxSize(batch, ExecPlan.MAX_BATCH_SIZE);
        AtomicInteger remaining = new AtomicInteger(slices.size());
        for (ExecBatch slice : slices) {
            synchronized (flowLock) {
                if (stopRequested) {
                    return;
                }
                batchCount.incrementAndGet();
            }
            getContext().execute(() -> {
                output.inputReceived(this, slice);
                if (remaining.decrementAndGet() == 0) {
                    requestNextUnlessPaused();
                }
            }, this::onDeliveryFailure);
        }
    }

    private void requestNextUnlessPaused() {
        GeneratorSubscriber toRequest;
        synchronized (flowLock) {
            if (stopRequested || subscriber == null) {
                return;
            }
            if (paused) {
                awaitingResume = true;
                return;
            }
            toRequest = subscriber;
        }
        toRequest.request(1);
    }

    private void onDeliveryFailure(Throwable error) {
        log.warn("源节点 '{}' 向下游推送批次失败: {}", getLabel(), error.toString());
        GeneratorSubscriber toCancel;
        synchronized (flowLock) {
            stopRequested = true;
            toCancel = subscriber;
        }
        if (toCancel != null) {
            toCancel.dispose();
        }
        finishSource(ExecPlanException.wrap(error));
    }

    private final class GeneratorSubscriber extends BaseSubscriber<ExecBatch> {

        @Override
        protected void hookOnSubscribe(Subscription subscription) {
            subscription.request(1);
        }

        @Override
        protected void hookOnNext(ExecBatch batch) {
            deliver(batch);
        }

        @Override
        protected void hookOnComplete() {
            finishSource(null);
        }

        @Override
        protected void hookOnError(Throwable throwable) {
            log.warn("源节点 '{}' 的生成器出错: {}", getLabel(), throwable.toString());
            if (!sourceFinished.compareAndSet(false, true)) {
                return;
            }
            // 先占住结束标志，下游在 errorReceived 中回调 stopProducing 时不会覆盖错误
            getOutput().errorReceived(SourceNode.this, throwable);
            int total = batchCount.get();
            getOutput().inputFinished(SourceNode.this, total);
            markFinished(throwable);
        }
    }
}
