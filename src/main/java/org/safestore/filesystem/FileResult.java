package org.safestore.filesystem;

import java.util.List;

/**
 * 所有 {@link FileStore} 操作的返回值：调用方根据 {@link #success()} 分支处理，操作本身从不抛异常。
 *
 * @param success   是否成功
 * @param value     成功时的结果
 * @param errorKind 失败类型（成功时为 null）
 * @param message   失败原因（成功时为 null）
 * @param warnings  非致命告警（例如 checksum 不一致）；没有告警时为空列表
 * @param <T>       结果类型
 */
public record FileResult<T>(
        boolean success,
        T value,
        FileErrorKind errorKind,
        String message,
        List<String> warnings
) {
    public FileResult {
        warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
    }

    public static <T> FileResult<T> ok(T value) {
        return new FileResult<>(true, value, null, null, List.of());
    }

    public static <T> FileResult<T> ok(T value, List<String> warnings) {
        return new FileResult<>(true, value, null, null, warnings);
    }

    public static <T> FileResult<T> failure(FileErrorKind errorKind, String message) {
        return new FileResult<>(false, null, errorKind, message, List.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
