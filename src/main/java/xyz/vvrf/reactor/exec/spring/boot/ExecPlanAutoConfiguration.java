package xyz.vvrf.reactor.exec.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.exec.monitor.ExecPlanListener;
import xyz.vvrf.reactor.exec.monitor.LoggingExecPlanListener;
import xyz.vvrf.reactor.exec.monitor.MicrometerExecPlanListener;
import xyz.vvrf.reactor.exec.registry.ExecFactoryRegistry;
import xyz.vvrf.reactor.exec.registry.SpringScanningExecFactoryRegistry;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 执行计划运行时的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link ExecPlanProperties}。
 * 2. 提供可配置的调度器 Bean ("execPlanScheduler")。
 * 3. 提供节点工厂注册表，包含内置节点类型以及使用 {@link xyz.vvrf.reactor.exec.annotation.ExecNodeKind} 注解的工厂 Bean。
 * 4. 提供日志与 Micrometer 监听器，并把所有 {@link ExecPlanListener} Bean 收集到列表 Bean ("execPlanListeners")。
 * 5. 提供 {@link ExecPlanProvider}。
 *
 * @author ruifeng.wen
 */
@Configuration
@EnableConfigurationProperties(ExecPlanProperties.class)
@Slf4j
public class ExecPlanAutoConfiguration {

    public static final String SCHEDULER_BEAN_NAME = "execPlanScheduler";
    public static final String LISTENERS_BEAN_NAME = "execPlanListeners";

    private final ApplicationContext applicationContext;

    public ExecPlanAutoConfiguration(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
        log.info("执行计划自动配置 (ExecPlanAutoConfiguration) 已加载。");
    }

    @Bean
    @ConditionalOnMissingBean(ExecPlanProvider.class)
    public ExecPlanProvider execPlanProvider(ExecPlanProperties properties,
                                             @Qualifier(SCHEDULER_BEAN_NAME) Scheduler scheduler,
                                             ExecFactoryRegistry registry,
                                             @Qualifier(LISTENERS_BEAN_NAME) List<ExecPlanListener> listeners) {
        log.info("正在创建 ExecPlanProvider Bean...");
        return new ExecPlanProvider(properties, scheduler, registry, listeners);
    }

    /**
     * 调度器类型和参数可由 {@link ExecPlanProperties.SchedulerProps} 配置。
     * 已存在同名 Bean 时不创建。
     */
    @Bean(name = SCHEDULER_BEAN_NAME, destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = SCHEDULER_BEAN_NAME)
    public Scheduler execPlanScheduler(ExecPlanProperties properties) {
        ExecPlanProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case BOUNDED_ELASTIC:
                log.info("正在创建 '{}' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s", SCHEDULER_BEAN_NAME,
                        namePrefix, schedulerProps.getBoundedElastic().getThreadCap(),
                        schedulerProps.getBoundedElastic().getQueuedTaskCap(), schedulerProps.getBoundedElastic().getTtlSeconds());
                return newBoundedElastic(schedulerProps, namePrefix);
            case PARALLEL:
                ExecPlanProperties.ParallelProps pProps = schedulerProps.getParallel();
                log.info("正在创建 '{}' (Parallel): prefix={}, parallelism={}", SCHEDULER_BEAN_NAME, namePrefix, pProps.getParallelism());
                return Schedulers.newParallel(namePrefix, pProps.getParallelism(), true);
            case SINGLE:
                log.info("正在创建 '{}' (Single): prefix={}", SCHEDULER_BEAN_NAME, namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case CUSTOM:
                String customBeanName = schedulerProps.getCustomBeanName();
                if (customBeanName == null || customBeanName.trim().isEmpty()) {
                    log.error("'exec.scheduler.type=CUSTOM' 但 'exec.scheduler.custom-bean-name' 未配置。回退到默认 BoundedElastic。");
                    return newBoundedElastic(schedulerProps, namePrefix + "-fallback");
                }
                log.info("正在从 Spring 上下文获取自定义调度器 Bean，名称: {}", customBeanName);
                try {
                    return applicationContext.getBean(customBeanName, Scheduler.class);
                } catch (Exception e) {
                    log.error("获取自定义 Scheduler Bean '{}' 失败。回退到默认 BoundedElastic。", customBeanName, e);
                    return newBoundedElastic(schedulerProps, namePrefix + "-fallback-custom-failed");
                }
            default:
                log.warn("未知的 'exec.scheduler.type': {}. 回退到默认 BoundedElastic。", schedulerProps.getType());
                return newBoundedElastic(schedulerProps, namePrefix + "-default");
        }
    }

    private static Scheduler newBoundedElastic(ExecPlanProperties.SchedulerProps schedulerProps, String namePrefix) {
        ExecPlanProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
        return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(), namePrefix,
                beProps.getTtlSeconds(), true);
    }

    /**
     * 内置节点类型加上扫描到的 {@code @ExecNodeKind} 工厂 Bean。
     */
    @Bean
    @ConditionalOnMissingBean(ExecFactoryRegistry.class)
    public SpringScanningExecFactoryRegistry execFactoryRegistry() {
        return new SpringScanningExecFactoryRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(LoggingExecPlanListener.class)
    @ConditionalOnProperty(prefix = "exec.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingExecPlanListener loggingExecPlanListener() {
        return new LoggingExecPlanListener();
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean(MicrometerExecPlanListener.class)
    public MicrometerExecPlanListener micrometerExecPlanListener(MeterRegistry meterRegistry) {
        log.info("检测到 MeterRegistry，注册 MicrometerExecPlanListener。");
        return new MicrometerExecPlanListener(meterRegistry);
    }

    /**
     * 收集应用上下文中的全部 {@link ExecPlanListener} Bean，按 Order 排序。
     */
    @Bean(name = LISTENERS_BEAN_NAME)
    @ConditionalOnMissingBean(name = LISTENERS_BEAN_NAME)
    public List<ExecPlanListener> execPlanListeners(ObjectProvider<ExecPlanListener> listenersProvider) {
        List<ExecPlanListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 ExecPlanListener Bean。");
        } else {
            log.info("收集到 {} 个 ExecPlanListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }
}
