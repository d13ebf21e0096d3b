package xyz.vvrf.reactor.exec.spring.boot;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.exec.backpressure.BackpressureOptions;
import xyz.vvrf.reactor.exec.builder.Declaration;
import xyz.vvrf.reactor.exec.monitor.ExecPlanListener;
import xyz.vvrf.reactor.exec.plan.ExecContext;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;
import xyz.vvrf.reactor.exec.registry.ExecFactoryRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 按配置创建执行计划：计划使用自动配置的调度器与监听器，声明通过自动配置的注册表实例化。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ExecPlanProvider {

    private final ExecPlanProperties properties;
    private final Scheduler scheduler;
    @Getter
    private final ExecFactoryRegistry registry;
    @Getter
    private final List<ExecPlanListener> listeners;

    public ExecPlanProvider(ExecPlanProperties properties, Scheduler scheduler, ExecFactoryRegistry registry,
                            List<ExecPlanListener> listeners) {
        this.properties = Objects.requireNonNull(properties, "ExecPlanProperties 不能为空");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler 不能为空");
        this.registry = Objects.requireNonNull(registry, "ExecFactoryRegistry 不能为空");
        this.listeners = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(listeners, "监听器列表不能为空")));
        log.info("ExecPlanProvider 已初始化，配置: {}, 监听器数: {}", properties, this.listeners.size());
    }

    public ExecPlan newPlan(String name) {
        return newPlan(name, properties.isUseThreads());
    }

    /**
     * @param useThreads 覆盖配置中的线程模式
     */
    public ExecPlan newPlan(String name, boolean useThreads) {
        Objects.requireNonNull(name, "计划名称不能为空");
        ExecContext context = useThreads ? ExecContext.threaded(scheduler) : ExecContext.serial();
        log.debug("创建执行计划 '{}'，上下文: {}", name, context);
        return ExecPlan.make(context, name, listeners);
    }

    /**
     * 使用本提供者的注册表把声明加入计划。
     */
    public ExecNode addToPlan(Declaration declaration, ExecPlan plan) {
        return declaration.addToPlan(plan, registry);
    }

    /**
     * @return 由 {@code exec.backpressure.*} 配置的汇节点背压阈值
     */
    public BackpressureOptions backpressureOptions() {
        ExecPlanProperties.BackpressureProps props = properties.getBackpressure();
        return new BackpressureOptions(props.getResumeIfBelow(), props.getPauseIfAbove());
    }
}
