package xyz.vvrf.reactor.exec.backpressure;

/**
 * 汇节点背压状态的只读视图，可在不消费缓冲数据的情况下轮询。
 *
 * @author ruifeng.wen
 */
public interface BackpressureMonitor {

    /**
     * @return 当前尚未被消费的缓冲字节数
     */
    long getBytesInUse();

    /**
     * @return 上游当前是否处于暂停状态
     */
    boolean isPaused();
}
