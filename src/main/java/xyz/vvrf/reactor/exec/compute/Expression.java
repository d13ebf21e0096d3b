package xyz.vvrf.reactor.exec.compute;

import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.core.ExecBatch;

import java.util.List;

/**
 * 在批次上按行求值的表达式。
 *
 * @author ruifeng.wen
 */
public abstract class Expression {

    /**
     * 根据输入 schema 推断结果类型。
     *
     * @throws xyz.vvrf.reactor.exec.core.ExecPlanException KEY_ERROR 或 TYPE_ERROR
     */
    public abstract ArrowType getType(Schema schema);

    /**
     * @return 与批次等长的结果列
     */
    public abstract List<Object> evaluate(ExecBatch batch, Schema schema);

    @Override
    public abstract String toString();
}
