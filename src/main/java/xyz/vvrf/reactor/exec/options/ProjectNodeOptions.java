package xyz.vvrf.reactor.exec.options;

import lombok.Getter;
import xyz.vvrf.reactor.exec.compute.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 投影选项。{@code names} 为空时以表达式的文本作为输出字段名。
 */
@Getter
public class ProjectNodeOptions extends ExecNodeOptions {

    private final List<Expression> expressions;
    private final List<String> names;

    public ProjectNodeOptions(List<Expression> expressions) {
        this(expressions, Collections.emptyList());
    }

    public ProjectNodeOptions(List<Expression> expressions, List<String> names) {
        this.expressions = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(expressions, "投影表达式不能为空")));
        this.names = names == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(names));
    }
}
