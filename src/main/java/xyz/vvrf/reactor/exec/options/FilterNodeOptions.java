package xyz.vvrf.reactor.exec.options;

import lombok.Getter;
import xyz.vvrf.reactor.exec.compute.Expression;

import java.util.Objects;

@Getter
public class FilterNodeOptions extends ExecNodeOptions {

    private final Expression filterExpression;

    public FilterNodeOptions(Expression filterExpression) {
        this.filterExpression = Objects.requireNonNull(filterExpression, "过滤表达式不能为空");
    }
}
