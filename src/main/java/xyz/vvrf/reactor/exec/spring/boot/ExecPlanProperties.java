package xyz.vvrf.reactor.exec.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;

import javax.validation.Valid;
import javax.validation.constraints.AssertTrue;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * 执行计划运行时的配置属性，绑定 'exec' 前缀下的属性。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "exec")
@Validated
public class ExecPlanProperties {

    /**
     * 计划默认是否把推送提交到调度器执行。为 false 时所有推送在调用线程内联执行。
     */
    private boolean useThreads = true;

    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final BackpressureProps backpressure = new BackpressureProps();
    @Valid
    private final MonitorProps monitor = new MonitorProps();

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 调度器类型。
         */
        @NotNull
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器线程名称前缀。
         */
        @NotBlank
        private String namePrefix = "exec-plan";

        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        @Valid
        private final ParallelProps parallel = new ParallelProps();

        /**
         * 当 type 为 CUSTOM 时，自定义 Scheduler Bean 的名称。
         */
        private String customBeanName;
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE, CUSTOM
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    /**
     * 汇节点默认背压阈值 (字节)。两者为 0 表示不启用背压。
     */
    @Getter
    @Setter
    public static class BackpressureProps {
        @Min(0)
        private long resumeIfBelow = 32L * 1024 * 1024;
        @Min(0)
        private long pauseIfAbove = 64L * 1024 * 1024;

        @AssertTrue(message = "exec.backpressure.resume-if-below 不能大于 pause-if-above")
        public boolean isResumeBelowPause() {
            return resumeIfBelow <= pauseIfAbove;
        }
    }

    @Getter
    @Setter
    public static class MonitorProps {
        /**
         * 是否注册 {@link xyz.vvrf.reactor.exec.monitor.LoggingExecPlanListener}。
         */
        private boolean loggingEnabled = true;
    }

    @Override
    public String toString() {
        return "ExecPlanProperties{" +
                "useThreads=" + useThreads +
                ", scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                ", boundedElastic={threadCap=" + scheduler.boundedElastic.threadCap +
                ", queuedTaskCap=" + scheduler.boundedElastic.queuedTaskCap +
                ", ttlSeconds=" + scheduler.boundedElastic.ttlSeconds +
                "}, parallel={parallelism=" + scheduler.parallel.parallelism +
                "}, customBeanName='" + scheduler.customBeanName + '\'' +
                "}, backpressure={resumeIfBelow=" + backpressure.resumeIfBelow +
                ", pauseIfAbove=" + backpressure.pauseIfAbove +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                "}}";
    }
}
