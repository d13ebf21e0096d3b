package xyz.vvrf.reactor.exec.compute;

/**
 * count 聚合统计哪些值。
 */
public enum CountMode {
    ONLY_VALID,
    ONLY_NULL,
    ALL
}
