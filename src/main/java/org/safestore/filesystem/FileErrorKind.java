package org.safestore.filesystem;

/**
 * 操作失败的类型。
 * <p>
 * 注意：checksum 不一致不是失败，只作为成功结果中的告警（{@link FileResult#warnings()}）返回。
 */
public enum FileErrorKind {
    /** 路径未通过安全校验。 */
    ACCESS_DENIED,
    NOT_FOUND,
    NOT_A_FILE,
    NOT_A_DIRECTORY,
    /** 操作系统层面的权限拒绝。 */
    PERMISSION_DENIED,
    /** 文本无法按 UTF-8 解码。文本读取对非法字节用替换字符兜底，目前没有操作返回该类型。 */
    DECODE_ERROR,
    /** 二进制内容超过大小上限。 */
    SIZE_EXCEEDED,
    /** 参数不合法（例如正则表达式、权限位格式）。 */
    INVALID_ARGUMENT,
    OS_FAILURE,
    /** 临时文件写入或原子替换失败。 */
    WRITE_FAILURE
}
