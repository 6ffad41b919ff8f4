package com.example.pdfrewriter.util.font;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 文件系统字体缓存：{@code <storageDir>/<key>.ttf}
 *
 * 写入先落到同目录的临时文件，再原子改名；文件系统不支持原子移动时退回普通替换。
 */
@Slf4j
public class FileSystemFontCache implements FontCache {

    private static final String SUFFIX = ".ttf";

    private final Path storageDir;

    public FileSystemFontCache(Path storageDir) throws IOException {
        this.storageDir = storageDir;
        Files.createDirectories(storageDir);
    }

    @Override
    public Optional<Path> get(String key) {
        Path candidate = storageDir.resolve(key + SUFFIX);
        if (Files.isRegularFile(candidate)) {
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    @Override
    public void put(String key, byte[] fontBytes) throws IOException {
        Path destination = storageDir.resolve(key + SUFFIX);
        if (Files.isRegularFile(destination) && Files.size(destination) == fontBytes.length) {
            return;
        }
        Path temp = Files.createTempFile(storageDir, key, ".tmp");
        try {
            Files.write(temp, fontBytes);
            try {
                Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("字体缓存写入: {}", destination);
    }

    @Override
    public void evict(String key) {
        try {
            Files.deleteIfExists(storageDir.resolve(key + SUFFIX));
        } catch (IOException e) {
            log.warn("删除损坏的缓存字体失败: key={}, error={}", key, e.getMessage());
        }
    }

    public Path getStorageDir() {
        return storageDir;
    }
}
