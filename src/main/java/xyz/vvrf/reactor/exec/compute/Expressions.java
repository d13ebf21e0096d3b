package xyz.vvrf.reactor.exec.compute;

/**
 * 表达式的静态工厂。
 *
 * @author ruifeng.wen
 */
public final class Expressions {

    private Expressions() {}

    public static FieldRef field(String name) {
        return new FieldRef(name);
    }

    public static Literal literal(Object value) {
        return new Literal(value);
    }

    public static Call call(String function, Expression... arguments) {
        return new Call(function, arguments);
    }

    public static Call equal(Expression left, Expression right) {
        return call("equal", left, right);
    }

    public static Call notEqual(Expression left, Expression right) {
        return call("not_equal", left, right);
    }

    public static Call less(Expression left, Expression right) {
        return call("less", left, right);
    }

    public static Call lessEqual(Expression left, Expression right) {
        return call("less_equal", left, right);
    }

    public static Call greater(Expression left, Expression right) {
        return call("greater", left, right);
    }

    public static Call greaterEqual(Expression left, Expression right) {
        return call("greater_equal", left, right);
    }

    public static Call and(Expression left, Expression right) {
        return call("and", left, right);
    }

    public static Call or(Expression left, Expression right) {
        return call("or", left, right);
    }

    public static Call not(Expression operand) {
        return call("invert", operand);
    }

    public static Call isNull(Expression operand) {
        return call("is_null", operand);
    }

    public static Call isValid(Expression operand) {
        return call("is_valid", operand);
    }

    public static Call add(Expression left, Expression right) {
        return call("add", left, right);
    }

    public static Call subtract(Expression left, Expression right) {
        return call("subtract", left, right);
    }

    public static Call multiply(Expression left, Expression right) {
        return call("multiply", left, right);
    }

    public static Call divide(Expression left, Expression right) {
        return call("divide", left, right);
    }
}
