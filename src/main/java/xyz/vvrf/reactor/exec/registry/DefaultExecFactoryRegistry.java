package xyz.vvrf.reactor.exec.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.exec.core.ExecPlanException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ExecFactoryRegistry} 的内存实现，线程安全。
 * 可以指定父注册表：查找时先查自身再查父级，注册时名称不能与父级冲突。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class DefaultExecFactoryRegistry implements ExecFactoryRegistry {

    static final DefaultExecFactoryRegistry DEFAULT = withBuiltins();

    private final ExecFactoryRegistry parent;
    private final Map<String, ExecNodeFactory> factories = new ConcurrentHashMap<>();

    public DefaultExecFactoryRegistry() {
        this(null);
    }

    public DefaultExecFactoryRegistry(ExecFactoryRegistry parent) {
        this.parent = parent;
    }

    /**
     * @return 注册了全部内置节点类型的新注册表
     */
    public static DefaultExecFactoryRegistry withBuiltins() {
        DefaultExecFactoryRegistry registry = new DefaultExecFactoryRegistry();
        BuiltinExecFactories.registerAll(registry);
        return registry;
    }

    @Override
    public ExecNodeFactory getFactory(String factoryName) {
        Objects.requireNonNull(factoryName, "工厂名称不能为空");
        ExecNodeFactory factory = factories.get(factoryName);
        if (factory != null) {
            return factory;
        }
        if (parent != null) {
            return parent.getFactory(factoryName);
        }
        throw ExecPlanException.invalid("ExecNode factory named %s not present in registry.", factoryName);
    }

    @Override
    public void addFactory(String factoryName, ExecNodeFactory factory) {
        Objects.requireNonNull(factoryName, "工厂名称不能为空");
        Objects.requireNonNull(factory, "节点工厂不能为空");
        if (parent != null && parent.getFactoryNames().contains(factoryName)) {
            throw ExecPlanException.keyError("ExecNode factory named %s already registered in parent registry", factoryName);
        }
        if (factories.putIfAbsent(factoryName, factory) != null) {
            throw ExecPlanException.keyError("ExecNode factory named %s already registered.", factoryName);
        }
        log.debug("已注册节点工厂 '{}'", factoryName);
    }

    @Override
    public Set<String> getFactoryNames() {
        Set<String> names = new TreeSet<>(factories.keySet());
        if (parent != null) {
            names.addAll(parent.getFactoryNames());
        }
        return Collections.unmodifiableSet(names);
    }
}
