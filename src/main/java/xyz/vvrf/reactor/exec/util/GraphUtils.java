package xyz.vvrf.reactor.exec.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.exec.plan.ExecNode;

import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 执行计划图的排序与渲染工具。
 * 节点只能引用已存在的节点作为输入，因此图天然无环，无需单独的环检测。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 计算拓扑顺序 (生产者在消费者之前)。
     * 按注册顺序遍历节点，对每个节点先按声明顺序访问其输入，再输出自身 (深度优先后序)。
     * 该规则在多种合法顺序中确定地选出一种，启动顺序是它的逆序。
     *
     * @param nodes   按注册顺序排列的节点
     * @param planName 计划名称，用于日志
     * @return 不可修改的拓扑顺序列表
     */
    public static List<ExecNode> topologicalSort(List<ExecNode> nodes, String planName) {
        log.debug("Plan '{}': Starting topological sort of {} nodes...", planName, nodes.size());
        Set<ExecNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        List<ExecNode> sorted = new ArrayList<>(nodes.size());
        for (ExecNode node : nodes) {
            visit(node, visited, sorted);
        }
        if (sorted.size() != nodes.size()) {
            throw new IllegalStateException(String.format(
                    "Plan '%s': Topological sort reached %d nodes but the plan owns %d. An input was never added to the plan.",
                    planName, sorted.size(), nodes.size()));
        }
        log.debug("Plan '{}': Topological sort successful.", planName);
        return Collections.unmodifiableList(sorted);
    }

    private static void visit(ExecNode node, Set<ExecNode> visited, List<ExecNode> sorted) {
        if (!visited.add(node)) {
            return;
        }
        for (ExecNode input : node.getInputs()) {
            visit(input, visited, sorted);
        }
        sorted.add(node);
    }

    /**
     * 以每个汇节点为根渲染缩进树，每层缩进两个空格。
     * 输入节点依次压栈，因此同一节点的输入按声明的逆序输出。
     */
    public static String renderTree(int numNodes, List<ExecNode> sinks) {
        StringBuilder sb = new StringBuilder();
        sb.append("ExecPlan with ").append(numNodes).append(" nodes:\n");
        for (ExecNode sink : sinks) {
            Deque<Map.Entry<ExecNode, Integer>> stack = new ArrayDeque<>();
            stack.push(new AbstractMap.SimpleImmutableEntry<>(sink, 0));
            while (!stack.isEmpty()) {
                Map.Entry<ExecNode, Integer> entry = stack.pop();
                ExecNode node = entry.getKey();
                int indent = entry.getValue();
                sb.append(spaces(indent)).append(node.toString(indent)).append('\n');
                for (ExecNode input : node.getInputs()) {
                    stack.push(new AbstractMap.SimpleImmutableEntry<>(input, indent + 2));
                }
            }
        }
        return sb.toString();
    }

    /**
     * 生成 Graphviz DOT 描述，边从输入指向消费者，边标签为输入名称。
     */
    public static String toDot(String planName, List<ExecNode> nodes) {
        StringBuilder dot = new StringBuilder();
        String safePlanName = escapeDotString(planName);

        dot.append(String.format("digraph \"%s\" {\n", safePlanName));
        dot.append("  rankdir=LR;\n");
        dot.append(String.format("  label=\"%s\";\n", safePlanName));
        dot.append("  node [shape=box, style=rounded];\n");

        for (ExecNode node : nodes) {
            String id = escapeDotString(node.getLabel());
            String nodeLabel = String.format("%s\\n(%s)", id, escapeDotString(node.getKindName()));
            dot.append(String.format("  \"%s\" [label=\"%s\"];\n", id, nodeLabel));
        }

        for (ExecNode node : nodes) {
            String downName = escapeDotString(node.getLabel());
            List<ExecNode> inputs = node.getInputs();
            for (int i = 0; i < inputs.size(); i++) {
                String upName = escapeDotString(inputs.get(i).getLabel());
                String inputLabel = escapeDotString(node.getInputLabels().get(i));
                dot.append(String.format("  \"%s\" -> \"%s\" [label=\"%s\"];\n", upName, downName, inputLabel));
            }
        }

        dot.append("}\n");
        return dot.toString();
    }

    public static String spaces(int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }

    private static String escapeDotString(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
