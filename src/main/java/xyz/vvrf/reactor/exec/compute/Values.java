package xyz.vvrf.reactor.exec.compute;

import xyz.vvrf.reactor.exec.core.ExecPlanException;

/**
 * 标量值的比较与算术运算，null 由调用方处理。
 *
 * @author ruifeng.wen
 */
public final class Values {

    private Values() {}

    public static int compare(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            if (isIntegral(a) && isIntegral(b)) {
                return Long.compare(((Number) a).longValue(), ((Number) b).longValue());
            }
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof String && b instanceof String) {
            return ((String) a).compareTo((String) b);
        }
        if (a instanceof Boolean && b instanceof Boolean) {
            return Boolean.compare((Boolean) a, (Boolean) b);
        }
        throw ExecPlanException.typeError("Cannot compare %s with %s",
                a.getClass().getSimpleName(), b.getClass().getSimpleName());
    }

    /**
     * 数值按值比较 (例如 Integer 4 与 Long 4 相等)，其他类型按 equals 比较。
     */
    public static boolean valueEquals(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number && b instanceof Number) {
            return compare(a, b) == 0;
        }
        return a.equals(b);
    }

    public static Object add(Object a, Object b) {
        return arithmetic("add", a, b);
    }

    public static Object subtract(Object a, Object b) {
        return arithmetic("subtract", a, b);
    }

    public static Object multiply(Object a, Object b) {
        return arithmetic("multiply", a, b);
    }

    public static Object divide(Object a, Object b) {
        return arithmetic("divide", a, b);
    }

    public static Object negate(Object a) {
        if (a == null) {
            return null;
        }
        if (a instanceof Integer) {
            return -(Integer) a;
        }
        if (a instanceof Long) {
            return -(Long) a;
        }
        if (a instanceof Double) {
            return -(Double) a;
        }
        throw ExecPlanException.typeError("Cannot negate %s", a.getClass().getSimpleName());
    }

    private static Object arithmetic(String function, Object a, Object b) {
        if (a == null || b == null) {
            return null;
        }
        if (!(a instanceof Number) || !(b instanceof Number)) {
            throw ExecPlanException.typeError("%s requires numeric arguments, but got %s and %s", function,
                    a.getClass().getSimpleName(), b.getClass().getSimpleName());
        }
        Number x = (Number) a;
        Number y = (Number) b;
        if (a instanceof Integer && b instanceof Integer) {
            int l = x.intValue();
            int r = y.intValue();
            switch (function) {
                case "add": return l + r;
                case "subtract": return l - r;
                case "multiply": return l * r;
                default:
                    if (r == 0) {
                        throw ExecPlanException.invalid("divide by zero");
                    }
                    return l / r;
            }
        }
        if (isIntegral(a) && isIntegral(b)) {
            long l = x.longValue();
            long r = y.longValue();
            switch (function) {
                case "add": return l + r;
                case "subtract": return l - r;
                case "multiply": return l * r;
                default:
                    if (r == 0) {
                        throw ExecPlanException.invalid("divide by zero");
                    }
                    return l / r;
            }
        }
        double l = x.doubleValue();
        double r = y.doubleValue();
        switch (function) {
            case "add": return l + r;
            case "subtract": return l - r;
            case "multiply": return l * r;
            default: return l / r;
        }
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
    }
}
