package org.safestore.filesystem;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 文件存储的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>把配置 {@link FileStoreProperties} 注入到 {@link FileStore}。</li>
 *   <li>容器关闭时调用 {@link FileStore#close()}，保证 checksum 表最终落盘。</li>
 *   <li>这里不引入任何数据库/外部依赖，全部基于本地文件系统。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class FileStoreConfiguration {

    @Bean
    public Clock fileStoreClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public FileStore fileStore(FileStoreProperties properties, Clock fileStoreClock) {
        return new FileStore(properties, fileStoreClock);
    }
}
