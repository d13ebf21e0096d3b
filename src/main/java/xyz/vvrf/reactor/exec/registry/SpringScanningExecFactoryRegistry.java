package xyz.vvrf.reactor.exec.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.lang.NonNull;
import xyz.vvrf.reactor.exec.annotation.ExecNodeKind;
import xyz.vvrf.reactor.exec.core.ExecPlanException;

import java.util.Map;
import java.util.Set;

/**
 * 在内置节点类型之外，自动注册 ApplicationContext 中使用 {@link ExecNodeKind} 注解的
 * {@link ExecNodeFactory} Bean。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SpringScanningExecFactoryRegistry implements ExecFactoryRegistry, ApplicationContextAware, InitializingBean {

    private final DefaultExecFactoryRegistry delegateRegistry;
    private ApplicationContext applicationContext;

    public SpringScanningExecFactoryRegistry() {
        this(ExecFactoryRegistry.defaultRegistry());
    }

    /**
     * @param parent 内置节点类型所在的父注册表
     */
    public SpringScanningExecFactoryRegistry(ExecFactoryRegistry parent) {
        this.delegateRegistry = new DefaultExecFactoryRegistry(parent);
    }

    @Override
    public void setApplicationContext(@NonNull ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterPropertiesSet() {
        if (applicationContext == null) {
            throw new BeanCreationException("SpringScanningExecFactoryRegistry 中 ApplicationContext 未设置");
        }
        log.info("开始扫描 @ExecNodeKind Bean...");
        scanAndRegisterFactories();
    }

    private void scanAndRegisterFactories() {
        Map<String, Object> beansWithAnnotation = applicationContext.getBeansWithAnnotation(ExecNodeKind.class);
        int registeredCount = 0;

        for (Map.Entry<String, Object> entry : beansWithAnnotation.entrySet()) {
            String beanName = entry.getKey();
            Object beanInstance = entry.getValue();
            ExecNodeKind annotation = applicationContext.findAnnotationOnBean(beanName, ExecNodeKind.class);
            if (annotation == null) {
                log.warn("在 Bean '{}' 上找不到 @ExecNodeKind 注解，尽管 getBeansWithAnnotation 返回了它。", beanName);
                continue;
            }
            if (!(beanInstance instanceof ExecNodeFactory)) {
                log.error("Bean '{}' 使用了 @ExecNodeKind 注解，但未实现 ExecNodeFactory 接口。跳过注册。", beanName);
                continue;
            }
            String factoryName = determineFactoryName(annotation, beanName);
            try {
                delegateRegistry.addFactory(factoryName, (ExecNodeFactory) beanInstance);
                log.debug("注册节点工厂: 名称='{}', Bean名='{}'", factoryName, beanName);
                registeredCount++;
            } catch (ExecPlanException e) {
                // 重复名称只记录，继续扫描
                log.error("注册节点工厂 Bean '{}' (名称: '{}') 失败: {}", beanName, factoryName, e.getMessage());
            }
        }
        log.info("扫描完成。共注册了 {} 个自定义节点工厂。", registeredCount);
    }

    private String determineFactoryName(ExecNodeKind annotation, String beanName) {
        String name = annotation.name();
        if (name.isEmpty()) {
            name = annotation.value();
        }
        if (name.isEmpty()) {
            log.warn("在 Bean '{}' 的 @ExecNodeKind 注解中未提供名称。将使用 Bean 名称作为工厂名称。", beanName);
            return beanName;
        }
        return name;
    }

    @Override
    public ExecNodeFactory getFactory(String factoryName) {
        return delegateRegistry.getFactory(factoryName);
    }

    @Override
    public void addFactory(String factoryName, ExecNodeFactory factory) {
        delegateRegistry.addFactory(factoryName, factory);
    }

    @Override
    public Set<String> getFactoryNames() {
        return delegateRegistry.getFactoryNames();
    }
}
