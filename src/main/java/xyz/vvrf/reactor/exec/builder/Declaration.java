package xyz.vvrf.reactor.exec.builder;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;
import xyz.vvrf.reactor.exec.registry.ExecFactoryRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 尚未实例化的节点描述：工厂名称、输入、选项与可选标签。
 * 输入可以是已存在于计划中的节点，也可以是另一个 Declaration，由 {@link #addToPlan} 递归实例化。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Getter
public final class Declaration {

    private final String factoryName;
    private final List<Input> inputs;
    private final ExecNodeOptions options;
    private final String label;

    public Declaration(String factoryName, ExecNodeOptions options) {
        this(factoryName, Collections.emptyList(), options, "");
    }

    public Declaration(String factoryName, List<Input> inputs, ExecNodeOptions options) {
        this(factoryName, inputs, options, "");
    }

    public Declaration(String factoryName, List<Input> inputs, ExecNodeOptions options, String label) {
        this.factoryName = factoryName;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(inputs, "输入列表不能为空")));
        this.options = options;
        this.label = label == null ? "" : label;
    }

    /**
     * 把一串声明串成链：每个声明被追加为后一个声明的输入，返回最后一个声明。
     *
     * @throws IllegalArgumentException 列表为空时
     */
    public static Declaration sequence(List<Declaration> declarations) {
        Objects.requireNonNull(declarations, "声明列表不能为空");
        if (declarations.isEmpty()) {
            throw new IllegalArgumentException("声明列表不能为空");
        }
        Declaration chained = declarations.get(0);
        for (int i = 1; i < declarations.size(); i++) {
            chained = declarations.get(i).withInput(Input.of(chained));
        }
        return chained;
    }

    private Declaration withInput(Input input) {
        List<Input> newInputs = new ArrayList<>(inputs);
        newInputs.add(input);
        return new Declaration(factoryName, newInputs, options, label);
    }

    public ExecNode addToPlan(ExecPlan plan) {
        return addToPlan(plan, ExecFactoryRegistry.defaultRegistry());
    }

    /**
     * 先实例化作为输入的声明，再用注册表中的工厂创建本节点。
     *
     * @return 新创建的节点
     * @throws xyz.vvrf.reactor.exec.core.ExecPlanException 工厂不存在或选项非法时
     */
    public ExecNode addToPlan(ExecPlan plan, ExecFactoryRegistry registry) {
        Objects.requireNonNull(plan, "ExecPlan 不能为空");
        Objects.requireNonNull(registry, "ExecFactoryRegistry 不能为空");
        List<ExecNode> inputNodes = new ArrayList<>(inputs.size());
        for (Input input : inputs) {
            if (input.getNode() != null) {
                inputNodes.add(input.getNode());
            } else {
                inputNodes.add(input.getDeclaration().addToPlan(plan, registry));
            }
        }
        ExecNode node = registry.getFactory(factoryName).make(plan, inputNodes, options);
        if (!label.isEmpty()) {
            plan.relabelNode(node, label);
        }
        log.debug("[Plan: '{}'] 声明 '{}' 已实例化为节点 '{}'", plan.getName(), factoryName, node.getLabel());
        return node;
    }

    /**
     * @return 工厂名称非空、选项非空且全部输入声明有效
     */
    public boolean isValid() {
        if (factoryName == null || factoryName.isEmpty() || options == null) {
            return false;
        }
        for (Input input : inputs) {
            if (input.getDeclaration() != null && !input.getDeclaration().isValid()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Declaration{" + factoryName + (label.isEmpty() ? "" : ":" + label) + ", inputs=" + inputs + '}';
    }

    /**
     * 声明的一个输入：已有节点或另一个声明，二者只有一个非空。
     */
    @Getter
    public static final class Input {

        private final ExecNode node;
        private final Declaration declaration;

        private Input(ExecNode node, Declaration declaration) {
            this.node = node;
            this.declaration = declaration;
        }

        public static Input of(ExecNode node) {
            return new Input(Objects.requireNonNull(node, "输入节点不能为空"), null);
        }

        public static Input of(Declaration declaration) {
            return new Input(null, Objects.requireNonNull(declaration, "输入声明不能为空"));
        }

        @Override
        public String toString() {
            return node != null ? node.getLabel() : declaration.toString();
        }
    }
}
