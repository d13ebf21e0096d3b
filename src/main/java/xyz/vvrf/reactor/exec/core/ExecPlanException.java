package xyz.vvrf.reactor.exec.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 执行计划运行时统一使用的异常类型。
 * 构造期错误 (非法选项、未绑定的输出、空计划) 同步抛出；
 * 运行期错误通过 {@code ExecPlan.startProducing()} 或 {@code ExecPlan.finished()} 报告。
 *
 * @author ruifeng.wen
 */
@Getter
public class ExecPlanException extends RuntimeException {

    private final StatusCode code;

    public ExecPlanException(StatusCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "错误码不能为空");
    }

    public ExecPlanException(StatusCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "错误码不能为空");
    }

    public static ExecPlanException invalid(String format, Object... args) {
        return new ExecPlanException(StatusCode.INVALID, String.format(format, args));
    }

    public static ExecPlanException keyError(String format, Object... args) {
        return new ExecPlanException(StatusCode.KEY_ERROR, String.format(format, args));
    }

    public static ExecPlanException typeError(String format, Object... args) {
        return new ExecPlanException(StatusCode.TYPE_ERROR, String.format(format, args));
    }

    public static ExecPlanException ioError(String message, Throwable cause) {
        return new ExecPlanException(StatusCode.IO_ERROR, message, cause);
    }

    public static ExecPlanException notImplemented(String format, Object... args) {
        return new ExecPlanException(StatusCode.NOT_IMPLEMENTED, String.format(format, args));
    }

    public static ExecPlanException cancelled(String format, Object... args) {
        return new ExecPlanException(StatusCode.CANCELLED, String.format(format, args));
    }

    /**
     * 将任意异常转换为 {@link ExecPlanException}，已是该类型时原样返回。
     */
    public static ExecPlanException wrap(Throwable error) {
        if (error instanceof ExecPlanException) {
            return (ExecPlanException) error;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new ExecPlanException(StatusCode.UNKNOWN_ERROR, message, error);
    }

    public boolean isInvalid() {
        return code == StatusCode.INVALID;
    }

    @Override
    public String toString() {
        return code + ": " + getMessage();
    }
}
