package xyz.vvrf.reactor.exec.registry;

import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.List;

/**
 * 按选项创建节点并加入计划。选项类型不符或取值非法时同步抛出 INVALID。
 *
 * @author ruifeng.wen
 */
@FunctionalInterface
public interface ExecNodeFactory {

    ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options);
}
