package com.example.pdfrewriter.config;

import com.example.pdfrewriter.util.font.FileSystemFontCache;
import com.example.pdfrewriter.util.font.FontCache;
import com.example.pdfrewriter.util.font.InMemoryFontCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * 字体缓存：整个进程一个实例，注入给需要的服务
 */
@Slf4j
@Configuration
public class FontCacheConfig {

    @Bean
    public FontCache fontCache(RewriterProperties properties) throws IOException {
        if ("memory".equalsIgnoreCase(properties.getFontCacheType())) {
            log.info("字体缓存: 内存");
            return new InMemoryFontCache();
        }
        log.info("字体缓存: 文件系统 {}", properties.getFontCacheDir());
        return new FileSystemFontCache(Paths.get(properties.getFontCacheDir()));
    }
}
