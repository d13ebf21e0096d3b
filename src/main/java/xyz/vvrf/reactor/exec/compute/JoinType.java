package xyz.vvrf.reactor.exec.compute;

/**
 * 哈希连接的类型。semi/anti 连接只输出一侧的字段。
 *
 * @author ruifeng.wen
 */
public enum JoinType {
    INNER,
    LEFT_OUTER,
    RIGHT_OUTER,
    FULL_OUTER,
    LEFT_SEMI,
    LEFT_ANTI,
    RIGHT_SEMI,
    RIGHT_ANTI;

    public boolean outputsLeft() {
        return this != RIGHT_SEMI && this != RIGHT_ANTI;
    }

    public boolean outputsRight() {
        return this != LEFT_SEMI && this != LEFT_ANTI;
    }

    public boolean keepsUnmatchedLeft() {
        return this == LEFT_OUTER || this == FULL_OUTER;
    }

    public boolean keepsUnmatchedRight() {
        return this == RIGHT_OUTER || this == FULL_OUTER;
    }
}
