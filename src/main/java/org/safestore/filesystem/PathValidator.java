package org.safestore.filesystem;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 路径校验器：把用户传入的相对路径限制在 BaseDirectory 之内，并拒绝明显不安全的路径模式。
 * <p>
 * 一个路径只有同时满足以下条件才被视为安全：
 * <ul>
 *   <li>解析并规范化后的绝对路径仍位于 BaseDirectory 之下（挡住 {@code ../} 越界与绝对路径覆盖）。</li>
 *   <li>原始输入不命中黑名单：连续的上级目录跳转、系统目录（{@code /etc/}、{@code C:\Windows}、{@code /proc/}）、
 *       版本控制元数据目录、环境变量密钥文件。</li>
 *   <li>第一级不是存储自身的保留目录（日志、元数据、版本区、归档区、临时区），这些区域只由存储内部维护。</li>
 *   <li>最后一级不是隐藏文件（以 . 开头），白名单中的文件名除外。</li>
 * </ul>
 * <p>
 * 校验失败不会抛异常：返回 {@code false}，并写一条安全审计日志，由调用方转换成“拒绝访问”的结果。
 */
public class PathValidator {

    private static final List<DeniedPattern> DENIED_PATTERNS = List.of(
            new DeniedPattern(Pattern.compile("\\.\\.[/\\\\]+\\.\\."), "连续的上级目录跳转"),
            new DeniedPattern(Pattern.compile("(?i)[/\\\\]etc[/\\\\]"), "系统目录 /etc/"),
            new DeniedPattern(Pattern.compile("(?i)[/\\\\]proc[/\\\\]"), "系统目录 /proc/"),
            new DeniedPattern(Pattern.compile("(?i)[a-z]:[/\\\\]+windows([/\\\\]|$)"), "系统目录 C:\\Windows"),
            new DeniedPattern(Pattern.compile("(?i)(^|[/\\\\])\\.(git|svn|hg|bzr)([/\\\\]|$)"), "版本控制元数据目录"),
            new DeniedPattern(Pattern.compile("(?i)(^|[/\\\\])\\.env(\\.[^/\\\\]*)?$"), "环境变量密钥文件")
    );

    private final Path baseDir;
    private final Set<String> hiddenWhitelist;
    private final Set<String> reservedDirs;
    private final SecurityAuditLog auditLog;

    /**
     * @param reservedDirs BaseDirectory 下只允许存储内部访问的一级目录名（不区分大小写）
     */
    public PathValidator(Path baseDir, Set<String> hiddenWhitelist, Set<String> reservedDirs, SecurityAuditLog auditLog) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.hiddenWhitelist = Set.copyOf(hiddenWhitelist);
        this.reservedDirs = reservedDirs.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
    }

    /**
     * 判断相对路径是否安全（拒绝时写审计日志）。
     */
    public boolean isSafe(String relativePath) {
        return check(relativePath) == null;
    }

    /**
     * 校验并解析路径。
     *
     * @return 位于 BaseDirectory 内的规范化绝对路径；不安全时返回 {@code null}
     */
    public Path resolve(String relativePath) {
        String reason = check(relativePath);
        if (reason != null) {
            return null;
        }
        return baseDir.resolve(relativePath).normalize();
    }

    /**
     * 返回拒绝原因；安全时返回 {@code null}。
     */
    private String check(String relativePath) {
        if (relativePath == null) {
            return reject("null", "路径为空");
        }
        if (relativePath.indexOf('\0') >= 0) {
            return reject(relativePath, "路径包含 NUL 字符");
        }

        // 1) 字符串层面的黑名单
        for (DeniedPattern denied : DENIED_PATTERNS) {
            if (denied.pattern().matcher(relativePath).find()) {
                return reject(relativePath, denied.reason());
            }
        }

        // 2) 规范化后必须仍在根目录内（绝对路径输入会直接替换掉 baseDir，从而被这里挡住）
        Path absolute;
        try {
            absolute = baseDir.resolve(relativePath).normalize();
        } catch (InvalidPathException e) {
            return reject(relativePath, "非法路径：" + e.getReason());
        }
        if (!absolute.startsWith(baseDir)) {
            return reject(relativePath, "路径越出根目录");
        }

        // 3) 存储内部的保留目录
        Path relative = baseDir.relativize(absolute);
        if (isReserved(relative)) {
            return reject(relativePath, "不允许访问存储内部目录");
        }

        // 4) 隐藏文件（只看最后一级）
        Path last = relative.getFileName();
        if (last != null) {
            String name = last.toString();
            if (name.startsWith(".") && !hiddenWhitelist.contains(name)) {
                return reject(relativePath, "不允许访问隐藏文件");
            }
        }
        return null;
    }

    /**
     * 相对路径的第一级是否为保留目录。
     */
    boolean isReserved(Path relative) {
        if (relative.getNameCount() == 0) {
            return false;
        }
        String first = relative.getName(0).toString();
        return !first.isEmpty() && reservedDirs.contains(first.toLowerCase(Locale.ROOT));
    }

    private String reject(String input, String reason) {
        auditLog.record("PATH_REJECTED", "path=" + input + " reason=" + reason);
        return reason;
    }

    private record DeniedPattern(Pattern pattern, String reason) {
    }
}
