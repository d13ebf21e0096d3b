package xyz.vvrf.reactor.exec.compute;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 一个聚合：函数名、可选的计数模式、输入字段与输出字段名。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
public final class Aggregate {

    private final String function;
    private final CountMode countMode;
    private final String target;
    private final String name;

    public Aggregate(String function, String target, String name) {
        this(function, null, target, name);
    }

    /**
     * @param countMode 仅对 count 类函数有意义，为 null 时按 {@link CountMode#ONLY_VALID} 计数
     */
    public Aggregate(String function, CountMode countMode, String target, String name) {
        this.function = Objects.requireNonNull(function, "聚合函数名不能为空");
        this.countMode = countMode;
        this.target = Objects.requireNonNull(target, "聚合目标字段不能为空");
        this.name = Objects.requireNonNull(name, "聚合输出名不能为空");
    }

    public CountMode effectiveCountMode() {
        return countMode == null ? CountMode.ONLY_VALID : countMode;
    }

    @Override
    public String toString() {
        if (countMode == null) {
            return function + "(" + target + ")";
        }
        return function + "(" + target + ", {mode=" + countMode + "})";
    }
}
