package xyz.vvrf.reactor.exec.core;

import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Arrow {@link Schema} 的构造与查询工具。
 *
 * @author ruifeng.wen
 */
public final class Schemas {

    public static final ArrowType INT32 = new ArrowType.Int(32, true);
    public static final ArrowType INT64 = new ArrowType.Int(64, true);
    public static final ArrowType FLOAT64 = new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
    public static final ArrowType BOOL = ArrowType.Bool.INSTANCE;
    public static final ArrowType UTF8 = ArrowType.Utf8.INSTANCE;
    public static final ArrowType NULL = ArrowType.Null.INSTANCE;

    private Schemas() {}

    public static Field field(String name, ArrowType type) {
        return Field.nullable(Objects.requireNonNull(name, "字段名不能为空"), Objects.requireNonNull(type, "字段类型不能为空"));
    }

    public static Schema schema(Field... fields) {
        return new Schema(Arrays.asList(fields));
    }

    public static Schema schema(List<Field> fields) {
        return new Schema(fields);
    }

    public static int numFields(Schema schema) {
        return schema.getFields().size();
    }

    /**
     * 按名称查找字段下标。
     *
     * @throws ExecPlanException KEY_ERROR，字段不存在时
     */
    public static int fieldIndex(Schema schema, String name) {
        List<Field> fields = schema.getFields();
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equals(name)) {
                return i;
            }
        }
        throw ExecPlanException.keyError("No field named '%s' in schema %s", name, describe(schema));
    }

    /**
     * 保留字段类型，替换字段名称。
     */
    public static Schema rename(Schema schema, List<String> names) {
        List<Field> fields = schema.getFields();
        if (fields.size() != names.size()) {
            throw ExecPlanException.invalid("Cannot rename %d fields with %d names", fields.size(), names.size());
        }
        List<Field> renamed = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            renamed.add(field(names.get(i), fields.get(i).getType()));
        }
        return new Schema(renamed);
    }

    /**
     * 按 Java 值推断 Arrow 类型，null 推断为 Null 类型。
     */
    public static ArrowType typeOf(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return INT32;
        }
        if (value instanceof Long) {
            return INT64;
        }
        if (value instanceof Double || value instanceof Float) {
            return FLOAT64;
        }
        if (value instanceof Boolean) {
            return BOOL;
        }
        if (value instanceof String) {
            return UTF8;
        }
        throw ExecPlanException.typeError("Unsupported value type: %s", value.getClass().getName());
    }

    public static String typeName(ArrowType type) {
        if (type instanceof ArrowType.Int) {
            ArrowType.Int intType = (ArrowType.Int) type;
            return (intType.getIsSigned() ? "int" : "uint") + intType.getBitWidth();
        }
        if (type instanceof ArrowType.FloatingPoint) {
            return ((ArrowType.FloatingPoint) type).getPrecision() == FloatingPointPrecision.DOUBLE ? "double" : "float";
        }
        if (type instanceof ArrowType.Bool) {
            return "bool";
        }
        if (type instanceof ArrowType.Utf8) {
            return "string";
        }
        if (type instanceof ArrowType.Null) {
            return "null";
        }
        return type.toString();
    }

    public static boolean isNumeric(ArrowType type) {
        return type instanceof ArrowType.Int || type instanceof ArrowType.FloatingPoint;
    }

    public static String describe(Schema schema) {
        if (schema == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder("[");
        List<Field> fields = schema.getFields();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(fields.get(i).getName()).append(": ").append(typeName(fields.get(i).getType()));
        }
        return sb.append(']').toString();
    }
}
