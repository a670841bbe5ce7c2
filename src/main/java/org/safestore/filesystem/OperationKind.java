package org.safestore.filesystem;

/**
 * 计入性能指标的操作类型；{@link #key()} 为指标快照中的名称。
 */
public enum OperationKind {
    READ("read"),
    READ_BINARY("read_binary"),
    WRITE("write"),
    WRITE_BINARY("write_binary"),
    LIST("list"),
    CREATE_DIR("create_dir"),
    DELETE("delete"),
    MOVE("move"),
    COPY("copy"),
    INFO("info"),
    SEARCH("search"),
    INDEX_SEARCH("index_search"),
    VERSIONS("versions"),
    CLEANUP("cleanup");

    private final String key;

    OperationKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
