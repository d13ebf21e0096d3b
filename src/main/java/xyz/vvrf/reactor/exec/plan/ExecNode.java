package xyz.vvrf.reactor.exec.plan;

import org.apache.arrow.vector.types.pojo.Schema;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.exec.core.ExecBatch;

import java.util.List;

/**
 * 执行计划中的节点契约。
 * <p>
 * 数据沿 {@link #inputReceived} / {@link #inputFinished} / {@link #errorReceived} 从上游推向下游；
 * 控制信号 (暂停、恢复、停止) 沿 {@link #pauseProducing} / {@link #resumeProducing} / {@link #stopProducing(ExecNode)}
 * 从下游传向上游。计划只依赖本接口，不依赖任何具体节点类型。
 *
 * @author ruifeng.wen
 */
public interface ExecNode {

    /**
     * @return 节点标签。未显式设置时由计划分配为节点在计划中的序号。
     */
    String getLabel();

    /**
     * 显式设置标签。
     */
    void setLabel(String label);

    /**
     * 由计划在节点未设置标签时调用，分配序号标签。
     */
    void assignAutoLabel(int ordinal);

    /**
     * @return 标签是否由计划自动分配
     */
    boolean hasAutoLabel();

    /**
     * @return 节点类型名称，例如 {@code "SourceNode"}
     */
    String getKindName();

    ExecPlan getPlan();

    /**
     * @return 输入节点，构造后不再变化
     */
    List<ExecNode> getInputs();

    /**
     * @return 与 {@link #getInputs()} 一一对应的输入名称
     */
    List<String> getInputLabels();

    /**
     * @return 已绑定的下游节点
     */
    List<ExecNode> getOutputs();

    /**
     * @return 声明的输出数量
     */
    int getNumOutputs();

    Schema getOutputSchema();

    /**
     * 下游节点构造时调用，把自己登记为本节点的一个输出。
     */
    void bindOutput(ExecNode output);

    /**
     * 检查输入与输出的绑定数量是否与声明一致。
     *
     * @throws xyz.vvrf.reactor.exec.core.ExecPlanException INVALID，存在未绑定的输出时
     */
    void validate();

    /**
     * 每个节点在计划启动时恰好被调用一次。不得阻塞，实际的数据生产异步进行。
     *
     * @throws xyz.vvrf.reactor.exec.core.ExecPlanException 初始化失败
     */
    void startProducing();

    /**
     * 上游产出一个批次。可能被多个上游并发调用，多线程模式下同一上游也可能并发调用。
     */
    void inputReceived(ExecNode input, ExecBatch batch);

    /**
     * 上游报告错误。
     */
    void errorReceived(ExecNode input, Throwable error);

    /**
     * 上游已产出全部批次，{@code totalBatches} 为该上游产出的批次总数。
     * 可能先于部分 {@link #inputReceived} 到达。
     */
    void inputFinished(ExecNode input, int totalBatches);

    /**
     * 下游请求暂停。{@code counter} 单调递增，不大于已见计数的信号应被忽略。
     */
    void pauseProducing(ExecNode output, int counter);

    /**
     * 下游请求恢复。
     */
    void resumeProducing(ExecNode output, int counter);

    /**
     * 某个下游不再需要数据。
     */
    void stopProducing(ExecNode output);

    /**
     * 协作式停止。幂等，可在 {@link #startProducing()} 返回前调用，并保证节点最终进入完成状态。
     */
    void stopProducing();

    /**
     * 未被启动的节点由计划调用，使 {@link #finished()} 以成功完成，不触发任何生命周期钩子。
     */
    void abandon();

    /**
     * @return 节点不再有工作时完成的信号 (成功或携带错误)
     */
    Mono<Void> finished();

    /**
     * @param indent 当前缩进，用于多行参数的对齐
     */
    String toString(int indent);
}
