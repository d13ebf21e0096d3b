package xyz.vvrf.reactor.exec.options;

/**
 * 节点选项的基类。不需要参数的节点类型 (例如 union) 直接使用本类的实例。
 *
 * @author ruifeng.wen
 */
public class ExecNodeOptions {

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
