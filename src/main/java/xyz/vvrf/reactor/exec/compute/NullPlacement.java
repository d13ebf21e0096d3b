package xyz.vvrf.reactor.exec.compute;

/**
 * 排序时 null 的位置，与升降序无关。
 */
public enum NullPlacement {
    AT_START("AtStart"),
    AT_END("AtEnd");

    private final String displayName;

    NullPlacement(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
