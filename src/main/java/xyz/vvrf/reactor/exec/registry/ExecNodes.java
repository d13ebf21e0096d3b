package xyz.vvrf.reactor.exec.registry;

import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.List;

/**
 * 按工厂名称创建节点的入口。
 */
public final class ExecNodes {

    private ExecNodes() {}

    public static ExecNode makeExecNode(String factoryName, ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        return makeExecNode(factoryName, plan, inputs, options, ExecFactoryRegistry.defaultRegistry());
    }

    public static ExecNode makeExecNode(String factoryName, ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options,
                                        ExecFactoryRegistry registry) {
        return registry.getFactory(factoryName).make(plan, inputs, options);
    }
}
