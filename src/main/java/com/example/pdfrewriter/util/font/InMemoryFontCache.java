package com.example.pdfrewriter.util.font;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内字体缓存
 *
 * 字节保存在内存里；get 时才落到进程私有的临时目录（每个 key 只落一次，重新 put 后再落一次），
 * 给调用方一个可以直接复制的路径。落盘先写临时文件再原子替换。
 */
@Slf4j
public class InMemoryFontCache implements FontCache {

    private final Map<String, byte[]> entries = new ConcurrentHashMap<>();
    private final Map<String, Path> materialized = new ConcurrentHashMap<>();
    private volatile Path spoolDir;

    @Override
    public Optional<Path> get(String key) {
        final byte[] bytes = entries.get(key);
        if (bytes == null) {
            return Optional.empty();
        }
        try {
            Path path = materialized.computeIfAbsent(key, k -> spool(k, bytes));
            return Optional.of(path);
        } catch (UncheckedIOException e) {
            log.warn("内存缓存落盘失败，按未命中处理: key={}, error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, byte[] fontBytes) {
        entries.put(key, fontBytes.clone());
        materialized.remove(key);
    }

    @Override
    public void evict(String key) {
        entries.remove(key);
        materialized.remove(key);
    }

    public int size() {
        return entries.size();
    }

    private Path spool(String key, byte[] bytes) {
        try {
            Path directory = spoolDirectory();
            Path file = directory.resolve(key + ".ttf");
            // 先写临时文件再整体替换，正在读旧文件的调用方不会读到写了一半的内容
            Path temp = Files.createTempFile(directory, key, ".tmp");
            try {
                Files.write(temp, bytes);
                try {
                    Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private synchronized Path spoolDirectory() throws IOException {
        if (spoolDir == null) {
            spoolDir = Files.createTempDirectory("font-cache");
            spoolDir.toFile().deleteOnExit();
        }
        return spoolDir;
    }
}
