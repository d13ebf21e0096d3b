package xyz.vvrf.reactor.exec.node;

import org.apache.arrow.vector.types.pojo.Schema;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.exec.backpressure.BackpressureControl;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

/**
 * 由调用方提供的批次消费者，通过 {@link ConsumingSinkNode} 接入计划。
 *
 * @author ruifeng.wen
 */
public interface SinkNodeConsumer {

    /**
     * 在汇节点启动时调用一次。抛出的异常使计划启动失败。
     *
     * @param schema              输入的 schema，配置了输出列名时已重命名
     * @param backpressureControl 暂停/恢复上游
     * @param plan                所属计划
     */
    void init(Schema schema, BackpressureControl backpressureControl, ExecPlan plan);

    /**
     * 消费一个批次，可能被并发调用。抛出的异常使汇节点以该错误结束并停止上游。
     */
    void consume(ExecBatch batch);

    /**
     * 在全部批次消费完 (或被停止) 后调用一次。返回的信号完成之前，汇节点不会完成。
     */
    Mono<Void> finish();
}
