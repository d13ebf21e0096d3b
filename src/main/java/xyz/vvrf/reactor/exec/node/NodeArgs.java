package xyz.vvrf.reactor.exec.node;

import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecNode;

import java.util.List;

/**
 * 节点工厂共用的参数校验。
 */
final class NodeArgs {

    private NodeArgs() {}

    static void requireInputs(List<ExecNode> inputs, int expected, String kindName) {
        if (inputs.size() != expected) {
            throw ExecPlanException.invalid("%s requires %d inputs but got %d", kindName, expected, inputs.size());
        }
    }

    static <T extends ExecNodeOptions> T castOptions(ExecNodeOptions options, Class<T> type, String kindName) {
        if (!type.isInstance(options)) {
            throw ExecPlanException.invalid("%s requires %s but got %s", kindName, type.getSimpleName(),
                    options == null ? "null" : options.getClass().getSimpleName());
        }
        return type.cast(options);
    }
}
