package xyz.vvrf.reactor.exec.options;

import lombok.Getter;
import xyz.vvrf.reactor.exec.compute.JoinType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 哈希连接选项。输出字段与另一侧重名时追加对应一侧的后缀。
 *
 * @author ruifeng.wen
 */
@Getter
public class HashJoinNodeOptions extends ExecNodeOptions {

    public static final String DEFAULT_LEFT_SUFFIX = "";
    public static final String DEFAULT_RIGHT_SUFFIX = "";

    private final JoinType joinType;
    private final List<String> leftKeys;
    private final List<String> rightKeys;
    private final String leftSuffix;
    private final String rightSuffix;

    public HashJoinNodeOptions(JoinType joinType, List<String> leftKeys, List<String> rightKeys) {
        this(joinType, leftKeys, rightKeys, DEFAULT_LEFT_SUFFIX, DEFAULT_RIGHT_SUFFIX);
    }

    public HashJoinNodeOptions(JoinType joinType, List<String> leftKeys, List<String> rightKeys,
                               String leftSuffix, String rightSuffix) {
        this.joinType = Objects.requireNonNull(joinType, "连接类型不能为空");
        this.leftKeys = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(leftKeys, "左侧连接键不能为空")));
        this.rightKeys = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(rightKeys, "右侧连接键不能为空")));
        this.leftSuffix = Objects.requireNonNull(leftSuffix, "左侧后缀不能为空");
        this.rightSuffix = Objects.requireNonNull(rightSuffix, "右侧后缀不能为空");
    }
}
