package xyz.vvrf.reactor.exec.node;

import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.compute.Expression;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.Schemas;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.options.ProjectNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 对每个批次计算一组表达式，结果按顺序组成输出列。
 *
 * @author ruifeng.wen
 */
public class ProjectNode extends MapNode {

    public static final String KIND_NAME = "ProjectNode";

    private final List<Expression> expressions;

    public ProjectNode(ExecPlan plan, List<ExecNode> inputs, List<Expression> expressions, Schema outputSchema) {
        super(plan, inputs, outputSchema);
        this.expressions = Collections.unmodifiableList(new ArrayList<>(expressions));
    }

    public static ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        NodeArgs.requireInputs(inputs, 1, KIND_NAME);
        ProjectNodeOptions projectOptions = NodeArgs.castOptions(options, ProjectNodeOptions.class, KIND_NAME);
        List<Expression> expressions = projectOptions.getExpressions();
        List<String> names = projectOptions.getNames();
        if (!names.isEmpty() && names.size() != expressions.size()) {
            throw ExecPlanException.invalid("%s got %d expressions but %d names", KIND_NAME, expressions.size(), names.size());
        }
        Schema inputSchema = inputs.get(0).getOutputSchema();
        List<Field> fields = new ArrayList<>(expressions.size());
        for (int i = 0; i < expressions.size(); i++) {
            Expression expression = expressions.get(i);
            String name = names.isEmpty() ? expression.toString() : names.get(i);
            fields.add(Schemas.field(name, expression.getType(inputSchema)));
        }
        return plan.addNode(new ProjectNode(plan, inputs, expressions, Schemas.schema(fields)));
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }

    @Override
    protected ExecBatch process(ExecBatch batch) {
        Schema inputSchema = getInputSchema();
        List<List<Object>> columns = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            columns.add(expression.evaluate(batch, inputSchema));
        }
        return new ExecBatch(columns, batch.getLength());
    }

    @Override
    protected String toStringExtra(int indent) {
        return "projection=[" + expressions.stream().map(Expression::toString).collect(Collectors.joining(", ")) + "]";
    }
}
