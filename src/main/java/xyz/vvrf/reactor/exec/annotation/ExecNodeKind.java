package xyz.vvrf.reactor.exec.annotation;

import org.springframework.core.annotation.AliasFor;
import org.springframework.stereotype.Component;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记一个 {@link xyz.vvrf.reactor.exec.registry.ExecNodeFactory} 实现为可被发现的节点类型，
 * 由 {@link xyz.vvrf.reactor.exec.registry.SpringScanningExecFactoryRegistry} 以注解中的名称注册。
 * <p>
 * 包含 {@link Component} 以便 Spring 在组件扫描期间自动检测这些类。
 *
 * @author ruifeng.wen
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
@Component
public @interface ExecNodeKind {

    /**
     * 工厂名称，{@link #name()} 的别名。
     */
    @AliasFor("name")
    String value() default "";

    /**
     * 工厂名称，{@link #value()} 的别名。
     */
    @AliasFor("value")
    String name() default "";
}
