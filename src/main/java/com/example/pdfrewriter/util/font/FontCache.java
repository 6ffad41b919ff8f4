package com.example.pdfrewriter.util.font;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 派生字体的内容寻址缓存
 *
 * key 是 {@link FontAttackBuilder} 算出的 SHA-256 十六进制串。
 * 实现必须支持并发读；写入必须原子发布，读方不会看到写了一半的文件。
 */
public interface FontCache {

    /**
     * @return 缓存中的字体文件；未命中返回 empty
     */
    Optional<Path> get(String key);

    void put(String key, byte[] fontBytes) throws IOException;

    /**
     * 删除损坏的条目，默认什么也不做
     */
    default void evict(String key) {
    }
}
