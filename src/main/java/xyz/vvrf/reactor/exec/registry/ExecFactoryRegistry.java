package xyz.vvrf.reactor.exec.registry;

import java.util.Set;

/**
 * 按名称索引的节点工厂注册表。
 *
 * @author ruifeng.wen
 */
public interface ExecFactoryRegistry {

    /**
     * @throws xyz.vvrf.reactor.exec.core.ExecPlanException INVALID，名称未注册时
     */
    ExecNodeFactory getFactory(String factoryName);

    /**
     * @throws xyz.vvrf.reactor.exec.core.ExecPlanException KEY_ERROR，名称已注册时
     */
    void addFactory(String factoryName, ExecNodeFactory factory);

    Set<String> getFactoryNames();

    /**
     * @return 进程内共享的注册表，包含全部内置节点类型
     */
    static ExecFactoryRegistry defaultRegistry() {
        return DefaultExecFactoryRegistry.DEFAULT;
    }
}
