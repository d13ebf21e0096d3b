package xyz.vvrf.reactor.exec.core;

/**
 * 执行计划错误的分类码。
 *
 * @author ruifeng.wen
 */
public enum StatusCode {
    INVALID,
    KEY_ERROR,
    TYPE_ERROR,
    IO_ERROR,
    NOT_IMPLEMENTED,
    CANCELLED,
    UNKNOWN_ERROR
}
