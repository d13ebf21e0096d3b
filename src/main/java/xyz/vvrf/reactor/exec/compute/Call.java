package xyz.vvrf.reactor.exec.compute;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.Schemas;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 函数调用表达式。
 * 比较与逻辑运算以中缀形式输出 (例如 {@code (i32 >= 0)})，其余函数以 {@code name(args)} 形式输出。
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class Call extends Expression {

    private static final Map<String, String> INFIX_OPERATORS = new HashMap<>();

    static {
        INFIX_OPERATORS.put("equal", "==");
        INFIX_OPERATORS.put("not_equal", "!=");
        INFIX_OPERATORS.put("less", "<");
        INFIX_OPERATORS.put("less_equal", "<=");
        INFIX_OPERATORS.put("greater", ">");
        INFIX_OPERATORS.put("greater_equal", ">=");
        INFIX_OPERATORS.put("and", "and");
        INFIX_OPERATORS.put("or", "or");
    }

    private final String function;
    private final List<Expression> arguments;

    public Call(String function, List<Expression> arguments) {
        this.function = Objects.requireNonNull(function, "函数名不能为空");
        this.arguments = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(arguments, "参数不能为空")));
        int expected = arity(function);
        if (expected != this.arguments.size()) {
            throw ExecPlanException.invalid("Function '%s' takes %d arguments but got %d", function, expected, this.arguments.size());
        }
    }

    public Call(String function, Expression... arguments) {
        this(function, Arrays.asList(arguments));
    }

    private static int arity(String function) {
        switch (function) {
            case "equal":
            case "not_equal":
            case "less":
            case "less_equal":
            case "greater":
            case "greater_equal":
            case "and":
            case "or":
            case "add":
            case "subtract":
            case "multiply":
            case "divide":
                return 2;
            case "invert":
            case "is_null":
            case "is_valid":
            case "negate":
                return 1;
            default:
                throw ExecPlanException.invalid("No function registered with name: %s", function);
        }
    }

    @Override
    public ArrowType getType(Schema schema) {
        List<ArrowType> types = arguments.stream().map(arg -> arg.getType(schema)).collect(Collectors.toList());
        switch (function) {
            case "equal":
            case "not_equal":
            case "less":
            case "less_equal":
            case "greater":
            case "greater_equal":
            case "is_null":
            case "is_valid":
                return Schemas.BOOL;
            case "and":
            case "or":
            case "invert":
                for (ArrowType type : types) {
                    if (!(type instanceof ArrowType.Bool) && !(type instanceof ArrowType.Null)) {
                        throw ExecPlanException.typeError("Function '%s' requires bool arguments, but got %s", function, Schemas.typeName(type));
                    }
                }
                return Schemas.BOOL;
            case "negate":
                requireNumeric(types);
                return types.get(0);
            default:
                requireNumeric(types);
                return promote(types.get(0), types.get(1));
        }
    }

    private void requireNumeric(List<ArrowType> types) {
        for (ArrowType type : types) {
            if (!Schemas.isNumeric(type) && !(type instanceof ArrowType.Null)) {
                throw ExecPlanException.typeError("Function '%s' requires numeric arguments, but got %s", function, Schemas.typeName(type));
            }
        }
    }

    private static ArrowType promote(ArrowType left, ArrowType right) {
        if (left instanceof ArrowType.FloatingPoint || right instanceof ArrowType.FloatingPoint) {
            return Schemas.FLOAT64;
        }
        if (left.equals(Schemas.INT32) && right.equals(Schemas.INT32)) {
            return Schemas.INT32;
        }
        if (left instanceof ArrowType.Null) {
            return right;
        }
        if (right instanceof ArrowType.Null) {
            return left;
        }
        return Schemas.INT64;
    }

    @Override
    public List<Object> evaluate(ExecBatch batch, Schema schema) {
        List<List<Object>> args = new ArrayList<>(arguments.size());
        for (Expression argument : arguments) {
            args.add(argument.evaluate(batch, schema));
        }
        int length = batch.getLength();
        List<Object> result = new ArrayList<>(length);
        for (int row = 0; row < length; row++) {
            Object first = args.get(0).get(row);
            Object second = args.size() > 1 ? args.get(1).get(row) : null;
            result.add(apply(first, second));
        }
        return result;
    }

    private Object apply(Object first, Object second) {
        switch (function) {
            case "is_null":
                return first == null;
            case "is_valid":
                return first != null;
            case "invert":
                return first == null ? null : !(Boolean) first;
            case "negate":
                return Values.negate(first);
            case "add":
                return Values.add(first, second);
            case "subtract":
                return Values.subtract(first, second);
            case "multiply":
                return Values.multiply(first, second);
            case "divide":
                return Values.divide(first, second);
            default:
                break;
        }
        if (first == null || second == null) {
            return null;
        }
        switch (function) {
            case "and":
                return (Boolean) first && (Boolean) second;
            case "or":
                return (Boolean) first || (Boolean) second;
            case "equal":
                return Values.valueEquals(first, second);
            case "not_equal":
                return !Values.valueEquals(first, second);
            case "less":
                return Values.compare(first, second) < 0;
            case "less_equal":
                return Values.compare(first, second) <= 0;
            case "greater":
                return Values.compare(first, second) > 0;
            default:
                return Values.compare(first, second) >= 0;
        }
    }

    @Override
    public String toString() {
        String operator = INFIX_OPERATORS.get(function);
        if (operator != null) {
            return "(" + arguments.get(0) + " " + operator + " " + arguments.get(1) + ")";
        }
        return function + "(" + arguments.stream().map(Expression::toString).collect(Collectors.joining(", ")) + ")";
    }
}
