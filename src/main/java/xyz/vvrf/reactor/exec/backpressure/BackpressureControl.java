package xyz.vvrf.reactor.exec.backpressure;

/**
 * 由汇节点提供给消费方的暂停/恢复回调。
 *
 * @author ruifeng.wen
 */
public interface BackpressureControl {

    void pause();

    void resume();
}
