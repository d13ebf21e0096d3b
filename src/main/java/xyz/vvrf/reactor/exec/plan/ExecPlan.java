package xyz.vvrf.reactor.exec.plan;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Signal;
import reactor.core.publisher.Sinks;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.monitor.ExecPlanListener;
import xyz.vvrf.reactor.exec.util.GraphUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 执行计划：持有全部节点，负责校验拓扑并驱动整个图的启动、停止与完成。
 * <p>
 * 生命周期: {@code UNVALIDATED → VALIDATED → RUNNING → STOPPING → FINISHED}，不可回退。
 * <ul>
 *     <li>启动按拓扑逆序 (汇节点在前，源节点在后) 逐个调用 {@link ExecNode#startProducing()}。
 *     任一节点启动失败时，未轮到的节点不再启动，已启动的节点按启动的逆序停止，错误同步抛出并成为计划的最终结果。</li>
 *     <li>停止按拓扑顺序 (源节点在前) 调用 {@link ExecNode#stopProducing()}，幂等。</li>
 *     <li>{@link #finished()} 在所有节点完成后解析，携带按发现顺序的第一个错误。</li>
 * </ul>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ExecPlan implements AutoCloseable {

    /**
     * 计划范围内单个批次的最大行数，超过的批次在转发前被切分。
     */
    public static final int MAX_BATCH_SIZE = 1 << 15;

    private static final AtomicInteger PLAN_COUNTER = new AtomicInteger();

    @Getter
    private final String name;
    @Getter
    private final ExecContext context;
    private final List<ExecPlanListener> listeners;

    private final List<ExecNode> nodes = new CopyOnWriteArrayList<>();
    private final List<Runnable> closeHandlers = new CopyOnWriteArrayList<>();

    private final Object lifecycleLock = new Object();
    private volatile PlanState state = PlanState.UNVALIDATED;
    private boolean startCalled;
    private boolean starting;
    private boolean stopCalled;
    private boolean stopDeferred;
    private boolean closed;

    private volatile List<ExecNode> sortedNodes = Collections.emptyList();
    private final List<ExecNode> startedNodes = new CopyOnWriteArrayList<>();
    private final Map<ExecNode, Long> nodeStartNanos = new ConcurrentHashMap<>();
    private volatile long startNanos;

    private final Sinks.One<Void> finishedSink = Sinks.one();
    private final AtomicBoolean planFinished = new AtomicBoolean(false);

    protected ExecPlan(ExecContext context, String name, List<ExecPlanListener> listeners) {
        this.context = Objects.requireNonNull(context, "ExecContext 不能为空");
        this.name = Objects.requireNonNull(name, "计划名称不能为空");
        this.listeners = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(listeners, "监听器列表不能为空")));
    }

    public static ExecPlan make() {
        return make(ExecContext.defaultThreaded());
    }

    public static ExecPlan make(ExecContext context) {
        return make(context, "plan-" + PLAN_COUNTER.incrementAndGet(), Collections.emptyList());
    }

    public static ExecPlan make(ExecContext context, String name, List<ExecPlanListener> listeners) {
        return new ExecPlan(context, name, listeners);
    }

    /**
     * 将节点加入计划。未设置标签的节点获得其注册序号作为标签。
     * 标签在计划内唯一，显式标签与已有标签 (包括序号标签) 重复时拒绝加入。
     *
     * @throws ExecPlanException INVALID 计划已启动或标签重复
     */
    public <T extends ExecNode> T addNode(T node) {
        Objects.requireNonNull(node, "节点不能为空");
        if (node.getPlan() != this) {
            throw ExecPlanException.invalid("Node %s belongs to a different ExecPlan", node.getKindName());
        }
        synchronized (lifecycleLock) {
            if (startCalled || stopCalled) {
                throw ExecPlanException.invalid("Cannot add %s to ExecPlan '%s' after it has been started or stopped",
                        node.getKindName(), name);
            }
            if (node.getLabel() == null || node.getLabel().isEmpty()) {
                node.assignAutoLabel(nodes.size());
            }
            ExecNode existing = findNodeByLabel(node.getLabel());
            if (existing != null) {
                throw ExecPlanException.invalid("Label '%s' of %s is already used by %s in ExecPlan '%s'",
                        node.getLabel(), node.getKindName(), existing.getKindName(), name);
            }
            nodes.add(node);
        }
        log.debug("[Plan: '{}'] 已添加节点 '{}' ({})，输入: {}", name, node.getLabel(), node.getKindName(),
                node.getInputs().stream().map(ExecNode::getLabel).collect(Collectors.toList()));
        return node;
    }

    /**
     * 为已加入计划的节点设置显式标签。
     *
     * @throws ExecPlanException INVALID 节点不属于本计划或标签已被其他节点使用
     */
    public void relabelNode(ExecNode node, String label) {
        Objects.requireNonNull(node, "节点不能为空");
        Objects.requireNonNull(label, "标签不能为空");
        synchronized (lifecycleLock) {
            if (!nodes.contains(node)) {
                throw ExecPlanException.invalid("Node '%s' (%s) is not part of ExecPlan '%s'",
                        node.getLabel(), node.getKindName(), name);
            }
            ExecNode existing = findNodeByLabel(label);
            if (existing != null && existing != node) {
                throw ExecPlanException.invalid("Label '%s' of %s is already used by %s in ExecPlan '%s'",
                        label, node.getKindName(), existing.getKindName(), name);
            }
            node.setLabel(label);
        }
    }

    private ExecNode findNodeByLabel(String label) {
        for (ExecNode node : nodes) {
            if (label.equals(node.getLabel())) {
                return node;
            }
        }
        return null;
    }

    /**
     * 校验计划：至少有一个节点，标签互不相同，且每个节点声明的输出数量都已被下游绑定。可重复调用，无副作用。
     *
     * @throws ExecPlanException INVALID
     */
    public void validate() {
        if (nodes.isEmpty()) {
            throw ExecPlanException.invalid("ExecPlan '%s' has no node", name);
        }
        Set<String> labels = new HashSet<>();
        for (ExecNode node : nodes) {
            if (!labels.add(node.getLabel())) {
                throw ExecPlanException.invalid("ExecPlan '%s' has more than one node labeled '%s'", name, node.getLabel());
            }
        }
        for (ExecNode node : nodes) {
            node.validate();
        }
        synchronized (lifecycleLock) {
            if (state == PlanState.UNVALIDATED) {
                state = PlanState.VALIDATED;
            }
        }
    }

    /**
     * 启动计划。只允许调用一次。
     *
     * @throws ExecPlanException 重复启动 (INVALID, "restarted")、校验失败，或某个节点启动失败
     */
    public void startProducing() {
        synchronized (lifecycleLock) {
            if (startCalled) {
                throw ExecPlanException.invalid("restarted ExecPlan '%s': an ExecPlan can only be started once", name);
            }
            if (stopCalled) {
                throw ExecPlanException.invalid("ExecPlan '%s' was stopped before it started and cannot be restarted", name);
            }
            validate();
            startCalled = true;
            starting = true;
            state = PlanState.RUNNING;
            sortedNodes = GraphUtils.topologicalSort(nodes, name);
        }
        startNanos = System.nanoTime();

        List<ExecNode> startOrder = new ArrayList<>(sortedNodes);
        Collections.reverse(startOrder);
        log.info("[Plan: '{}'] 开始启动 {} 个节点，启动顺序: {}", name, startOrder.size(),
                startOrder.stream().map(ExecNode::getLabel).collect(Collectors.toList()));
        safeNotifyListeners(l -> l.onPlanStart(this));

        for (ExecNode node : startOrder) {
            safeNotifyListeners(l -> l.onNodeStart(this, node));
            nodeStartNanos.put(node, System.nanoTime());
            try {
                node.startProducing();
            } catch (RuntimeException e) {
                ExecPlanException error = ExecPlanException.wrap(e);
                log.error("[Plan: '{}'] 节点 '{}' ({}) 启动失败: {}", name, node.getLabel(), node.getKindName(), error.toString());
                safeNotifyListeners(l -> l.onNodeStartFailure(this, node, error));
                abortStart(error);
                throw error;
            }
            startedNodes.add(node);
            watchNode(node);
        }

        awaitNodes(startOrder, null);

        boolean runDeferredStop;
        synchronized (lifecycleLock) {
            starting = false;
            runDeferredStop = stopDeferred;
        }
        log.debug("[Plan: '{}'] 全部节点启动完成", name);
        if (runDeferredStop) {
            log.debug("[Plan: '{}'] 执行启动期间收到的停止请求", name);
            stopProducing();
        }
    }

    /**
     * 请求协作式停止。幂等；启动前调用会使所有节点直接完成，启动期间调用会推迟到启动结束后执行。
     */
    public void stopProducing() {
        boolean started;
        synchronized (lifecycleLock) {
            if (stopCalled) {
                return;
            }
            if (starting) {
                stopDeferred = true;
                return;
            }
            stopCalled = true;
            started = startCalled;
            if (started && state != PlanState.FINISHED) {
                state = PlanState.STOPPING;
            }
        }

        if (!started) {
            log.info("[Plan: '{}'] 在启动前被停止", name);
            for (ExecNode node : nodes) {
                node.abandon();
            }
            completePlan(null);
            return;
        }

        log.info("[Plan: '{}'] 停止 {} 个节点", name, sortedNodes.size());
        for (ExecNode node : sortedNodes) {
            stopNode(node);
        }
    }

    private void abortStart(ExecPlanException error) {
        synchronized (lifecycleLock) {
            stopCalled = true;
            starting = false;
            state = PlanState.STOPPING;
        }
        List<ExecNode> toStop = new ArrayList<>(startedNodes);
        Collections.reverse(toStop);
        log.warn("[Plan: '{}'] 启动失败，按启动逆序停止已启动的 {} 个节点", name, toStop.size());
        for (ExecNode node : toStop) {
            stopNode(node);
        }
        for (ExecNode node : sortedNodes) {
            if (!startedNodes.contains(node)) {
                node.abandon();
            }
        }
        awaitNodes(toStop, error);
    }

    private void stopNode(ExecNode node) {
        safeNotifyListeners(l -> l.onNodeStop(this, node));
        try {
            node.stopProducing();
        } catch (RuntimeException e) {
            log.error("[Plan: '{}'] 停止节点 '{}' ({}) 时出错", name, node.getLabel(), node.getKindName(), e);
        }
    }

    private void watchNode(ExecNode node) {
        node.finished().subscribe(
                null,
                error -> onNodeFinished(node, error),
                () -> onNodeFinished(node, null));
    }

    private void onNodeFinished(ExecNode node, Throwable error) {
        Long nodeStart = nodeStartNanos.get(node);
        Duration duration = Duration.ofNanos(nodeStart == null ? 0 : System.nanoTime() - nodeStart);
        safeNotifyListeners(l -> l.onNodeFinished(this, node, duration, error));
        if (error != null) {
            log.warn("[Plan: '{}'] 节点 '{}' ({}) 失败，停止整个计划: {}", name, node.getLabel(), node.getKindName(), error.toString());
            stopProducing();
        }
    }

    /**
     * 等待给定节点全部完成后解析计划的完成信号。
     * {@code override} 非空时以它作为最终错误，否则取按列表顺序的第一个节点错误。
     */
    private void awaitNodes(List<ExecNode> awaited, Throwable override) {
        Flux.fromIterable(awaited)
                .concatMap(node -> node.finished().materialize())
                .collectList()
                .subscribe(signals -> completePlan(override != null ? override : firstError(signals)));
    }

    private static Throwable firstError(List<Signal<Void>> signals) {
        for (Signal<Void> signal : signals) {
            if (signal.isOnError()) {
                return signal.getThrowable();
            }
        }
        return null;
    }

    private void completePlan(Throwable error) {
        if (!planFinished.compareAndSet(false, true)) {
            return;
        }
        synchronized (lifecycleLock) {
            state = PlanState.FINISHED;
        }
        Duration duration = Duration.ofNanos(startNanos == 0 ? 0 : System.nanoTime() - startNanos);
        if (error == null) {
            log.info("[Plan: '{}'] 执行完成，耗时 {}ms", name, duration.toMillis());
        } else {
            log.warn("[Plan: '{}'] 执行失败，耗时 {}ms: {}", name, duration.toMillis(), error.toString());
        }
        safeNotifyListeners(l -> l.onPlanFinished(this, duration, error));
        if (error == null) {
            finishedSink.tryEmitEmpty();
        } else {
            finishedSink.tryEmitError(error);
        }
    }

    /**
     * @return 整个计划的完成信号
     */
    public Mono<Void> finished() {
        return finishedSink.asMono();
    }

    /**
     * 停止仍在运行的计划并释放汇节点的生成器，之后轮询这些生成器会失败。
     */
    @Override
    public void close() {
        boolean needStop;
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            needStop = startCalled && !stopCalled && state != PlanState.FINISHED;
        }
        if (needStop) {
            stopProducing();
        }
        for (Runnable handler : closeHandlers) {
            try {
                handler.run();
            } catch (RuntimeException e) {
                log.error("[Plan: '{}'] 执行关闭回调时出错", name, e);
            }
        }
        log.debug("[Plan: '{}'] 已关闭", name);
    }

    public boolean isClosed() {
        synchronized (lifecycleLock) {
            return closed;
        }
    }

    /**
     * 注册在 {@link #close()} 时执行的回调。
     */
    public void registerCloseHandler(Runnable handler) {
        closeHandlers.add(Objects.requireNonNull(handler, "关闭回调不能为空"));
    }

    public void notifyBackpressureChange(ExecNode node, boolean paused, long bytesInUse) {
        log.debug("[Plan: '{}'] 节点 '{}' 背压{}，缓冲 {} 字节", name, node.getLabel(), paused ? "暂停" : "恢复", bytesInUse);
        safeNotifyListeners(l -> l.onBackpressureChange(this, node, paused, bytesInUse));
    }

    public PlanState getState() {
        return state;
    }

    public List<ExecNode> getNodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    /**
     * @return 没有输入的节点，按注册顺序
     */
    public List<ExecNode> getSources() {
        return nodes.stream().filter(node -> node.getInputs().isEmpty()).collect(Collectors.toList());
    }

    /**
     * @return 输出未被任何节点消费的节点，按注册顺序
     */
    public List<ExecNode> getSinks() {
        return nodes.stream().filter(node -> node.getOutputs().isEmpty()).collect(Collectors.toList());
    }

    public String toDot() {
        return GraphUtils.toDot(name, nodes);
    }

    @Override
    public String toString() {
        return GraphUtils.renderTree(nodes.size(), getSinks());
    }

    private void safeNotifyListeners(Consumer<ExecPlanListener> action) {
        for (ExecPlanListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                log.error("[Plan: '{}'] 监听器 {} 执行失败: {}", name, listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
