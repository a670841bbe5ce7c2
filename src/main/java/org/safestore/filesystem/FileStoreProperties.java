package org.safestore.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * 文件存储的业务配置（{@code app.store.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #baseDir} 指定唯一的根目录，所有相对路径都只能解析到该目录之内。</li>
 *   <li>通过 cache/size 相关配置控制内存占用与单次写入体积。</li>
 *   <li>通过 retention 相关配置控制归档区/版本区的清理年龄（只在显式调用清理时生效，不会后台自动删除）。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.store")
public class FileStoreProperties {

    /**
     * 存储根目录（BaseDirectory）。启动时创建，之后不可变更。
     */
    @NotBlank
    private String baseDir = "./ai_files";

    /**
     * 覆盖写入前是否为旧内容保存版本快照。
     */
    private boolean versioningEnabled = true;

    /**
     * 文本内容缓存最多保留的条目数。
     */
    @Min(1)
    @Max(1_000_000)
    private int cacheMaxEntries = 100;

    /**
     * 缓存条目的有效期（从写入缓存时开始计算，与容量淘汰互相独立）。
     */
    @NotNull
    private Duration cacheTtl = Duration.ofMinutes(5);

    /**
     * {@code writeBinary} 单次允许写入的最大字节数（十进制 100 MB，即 100,000,000 字节）。
     */
    @NotNull
    private DataSize maxBinarySize = DataSize.ofBytes(100_000_000);

    /**
     * 每累计多少次 checksum 更新落盘一次（避免每次写入都序列化整张表）。
     */
    @Min(1)
    @Max(1_000_000)
    private int checksumPersistInterval = 10;

    /**
     * {@code cleanupArchive} 的默认保留期。
     */
    @NotNull
    private Duration archiveRetention = Duration.ofDays(30);

    /**
     * {@code cleanupVersions} 的默认保留期。
     */
    @NotNull
    private Duration versionRetention = Duration.ofDays(30);

    /**
     * 写入临时文件超过该年龄仍存在，即视为崩溃遗留的孤儿文件，可被清理。
     */
    @NotNull
    private Duration tempFileMaxAge = Duration.ofHours(1);

    /**
     * 每个路径保留的最近读取时间戳条数（环形缓冲，超出后丢弃最旧的记录）。
     */
    @Min(1)
    @Max(100_000)
    private int accessLogMaxEntries = 100;

    /**
     * {@code searchFiles} 最多返回多少条结果（上限保护）。
     */
    @Min(1)
    @Max(1_000_000)
    private int searchMaxResults = 1_000;

    /**
     * 文件索引最多收录多少个上传文件。
     */
    @Min(1)
    @Max(1_000_000)
    private int indexMaxEntries = 10_000;

    /**
     * 允许访问的隐藏文件名（其余以 . 开头的文件名一律拒绝）。
     */
    @NotNull
    private List<String> hiddenFileWhitelist = List.of(".gitkeep", ".htaccess");

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public boolean isVersioningEnabled() {
        return versioningEnabled;
    }

    public void setVersioningEnabled(boolean versioningEnabled) {
        this.versioningEnabled = versioningEnabled;
    }

    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public void setCacheMaxEntries(int cacheMaxEntries) {
        this.cacheMaxEntries = cacheMaxEntries;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public DataSize getMaxBinarySize() {
        return maxBinarySize;
    }

    public void setMaxBinarySize(DataSize maxBinarySize) {
        this.maxBinarySize = maxBinarySize;
    }

    public int getChecksumPersistInterval() {
        return checksumPersistInterval;
    }

    public void setChecksumPersistInterval(int checksumPersistInterval) {
        this.checksumPersistInterval = checksumPersistInterval;
    }

    public Duration getArchiveRetention() {
        return archiveRetention;
    }

    public void setArchiveRetention(Duration archiveRetention) {
        this.archiveRetention = archiveRetention;
    }

    public Duration getVersionRetention() {
        return versionRetention;
    }

    public void setVersionRetention(Duration versionRetention) {
        this.versionRetention = versionRetention;
    }

    public Duration getTempFileMaxAge() {
        return tempFileMaxAge;
    }

    public void setTempFileMaxAge(Duration tempFileMaxAge) {
        this.tempFileMaxAge = tempFileMaxAge;
    }

    public int getAccessLogMaxEntries() {
        return accessLogMaxEntries;
    }

    public void setAccessLogMaxEntries(int accessLogMaxEntries) {
        this.accessLogMaxEntries = accessLogMaxEntries;
    }

    public int getSearchMaxResults() {
        return searchMaxResults;
    }

    public void setSearchMaxResults(int searchMaxResults) {
        this.searchMaxResults = searchMaxResults;
    }

    public List<String> getHiddenFileWhitelist() {
        return hiddenFileWhitelist;
    }

    public void setHiddenFileWhitelist(List<String> hiddenFileWhitelist) {
        this.hiddenFileWhitelist = hiddenFileWhitelist;
    }

    public int getIndexMaxEntries() {
        return indexMaxEntries;
    }

    public void setIndexMaxEntries(int indexMaxEntries) {
        this.indexMaxEntries = indexMaxEntries;
    }
}
