package xyz.vvrf.reactor.exec.compute;

/**
 * 单个分组 (或标量聚合) 的累加状态。非线程安全，由节点自行同步。
 */
public interface Aggregator {

    void update(Object value);

    Object finish();
}
