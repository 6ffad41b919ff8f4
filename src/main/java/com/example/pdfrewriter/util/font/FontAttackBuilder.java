package com.example.pdfrewriter.util.font;

import com.example.pdfrewriter.exception.FontBuildException;
import com.example.pdfrewriter.util.font.dto.AttackPlan;
import com.example.pdfrewriter.util.font.dto.AttackPosition;
import com.example.pdfrewriter.util.font.dto.FontBuildResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.fontbox.ttf.TTFParser;
import org.apache.fontbox.ttf.TrueTypeFont;
import org.apache.pdfbox.io.RandomAccessReadBuffer;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 派生字体构建器
 *
 * <h3>每个需要字体的位置</h3>
 * <ol>
 *   <li>算缓存 key：SHA-256(基础字体文件名, 隐藏字符, 可见文本, 前进宽度取整)</li>
 *   <li>缓存命中：复制到输出目录；复制失败或文件不是合法 sfnt 时按未命中处理并清掉该条目</li>
 *   <li>未命中：隐藏字符的字形换成可见字形平移拼接的轮廓，前进宽度为累计宽度（零宽位置为 0），
 *       写出 attack_pos{index}.ttf 并放入缓存</li>
 * </ol>
 *
 * FontBox 的字体对象不是线程安全的，构建方法整体加锁；缓存本身可以跨构建器共享。
 */
@Slf4j
public class FontAttackBuilder implements Closeable {

    private static final int SFNT_TRUETYPE = 0x00010000;
    private static final int SFNT_TRUE = 0x74727565;

    private final Path baseFontPath;
    private final byte[] baseFontBytes;
    private final TrueTypeFont baseFont;
    private final TrueTypeGlyphLookup glyphLookup;
    private final FontCache cache;

    /**
     * @param baseFontPath 基础 TrueType 字体
     * @param cache        字体缓存，可以为 null（不缓存）
     * @throws IOException          读取字体失败
     * @throws FontBuildException   字体缺少 glyf / hmtx 表
     */
    public FontAttackBuilder(Path baseFontPath, FontCache cache) throws IOException {
        if (baseFontPath == null || !Files.isRegularFile(baseFontPath)) {
            throw new IOException("Base font not found at " + baseFontPath);
        }
        this.baseFontPath = baseFontPath;
        this.baseFontBytes = Files.readAllBytes(baseFontPath);
        this.baseFont = new TTFParser().parse(new RandomAccessReadBuffer(baseFontBytes));
        if (!baseFont.getTableMap().containsKey("glyf") || !baseFont.getTableMap().containsKey("hmtx")) {
            baseFont.close();
            throw new FontBuildException("Base font must contain 'glyf' and 'hmtx' tables: " + baseFontPath);
        }
        this.glyphLookup = new TrueTypeGlyphLookup(baseFont);
        this.cache = cache;
        log.info("加载基础字体: {} ({}), glyphs={}", baseFontPath.getFileName(), glyphLookup.fontName(),
                baseFont.getNumberOfGlyphs());
    }

    public GlyphLookup getGlyphLookup() {
        return glyphLookup;
    }

    /**
     * 为计划中每个需要字体的位置生成派生字体
     *
     * @param plan      字形分配计划
     * @param outputDir 输出目录（不存在时创建）
     * @return 构建结果，按位置顺序；不需要字体的位置不出现
     */
    public synchronized List<FontBuildResult> buildFonts(AttackPlan plan, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        List<FontBuildResult> results = new ArrayList<>();
        int hits = 0;
        long startTime = System.currentTimeMillis();

        for (AttackPosition position : plan) {
            if (!position.requiresFont()) {
                continue;
            }
            String key = cacheKey(position);

            Path cached = copyFromCache(key, outputDir);
            if (cached != null) {
                results.add(new FontBuildResult(position.getIndex(), position.getHiddenChar(),
                        position.getVisualText(), cached, true));
                hits++;
                continue;
            }

            byte[] fontBytes = buildPositionFont(position);
            Path fontPath = outputDir.resolve("attack_pos" + position.getIndex() + ".ttf");
            Files.write(fontPath, fontBytes);
            if (cache != null) {
                try {
                    cache.put(key, fontBytes);
                } catch (IOException e) {
                    log.warn("字体缓存写入失败，忽略: key={}, error={}", key, e.getMessage());
                }
            }
            results.add(new FontBuildResult(position.getIndex(), position.getHiddenChar(),
                    position.getVisualText(), fontPath, false));
        }

        log.info("派生字体构建完成: {} 个, 缓存命中 {} 个, 耗时 {} ms",
                results.size(), hits, System.currentTimeMillis() - startTime);
        return Collections.unmodifiableList(results);
    }

    private byte[] buildPositionFont(AttackPosition position) throws IOException {
        int hiddenGid = glyphLookup.glyphId(position.getHiddenChar().codePointAt(0));
        int advance = (int) Math.round(position.getAdvanceWidth());
        try {
            return TrueTypeFontPatcher.patch(baseFontBytes, baseFont, hiddenGid, position.getGlyphIds(),
                    advance, position.isZeroWidth());
        } catch (RuntimeException e) {
            if (e instanceof FontBuildException) {
                throw e;
            }
            throw new FontBuildException("派生字体生成失败: position=" + position, e);
        }
    }

    /**
     * 缓存命中时复制到输出目录；任何问题都当未命中
     */
    private Path copyFromCache(String key, Path outputDir) {
        if (cache == null) {
            return null;
        }
        Optional<Path> hit = cache.get(key);
        if (!hit.isPresent()) {
            return null;
        }
        Path target = outputDir.resolve(key + ".ttf");
        try {
            if (!isValidFont(hit.get())) {
                throw new IOException("cached font is empty or not a TrueType file");
            }
            Files.copy(hit.get(), target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException e) {
            log.warn("缓存字体损坏，重新构建: key={}, error={}", key, e.getMessage());
            cache.evict(key);
            return null;
        }
    }

    private static boolean isValidFont(Path path) throws IOException {
        if (Files.size(path) < 12) {
            return false;
        }
        byte[] header = new byte[4];
        try (InputStream in = Files.newInputStream(path)) {
            if (in.read(header) != 4) {
                return false;
            }
        }
        int version = ByteBuffer.wrap(header).getInt();
        return version == SFNT_TRUETYPE || version == SFNT_TRUE;
    }

    String cacheKey(AttackPosition position) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            // 字段之间用 NUL 字符隔开，("ab","c") 和 ("a","bc") 不会得到同一个键
            String material = baseFontPath.getFileName().toString()
                    + '\u0000' + position.getHiddenChar()
                    + '\u0000' + position.getVisualText()
                    + '\u0000' + Math.round(position.getAdvanceWidth());
            digest.update(material.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : digest.digest()) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public void close() throws IOException {
        baseFont.close();
    }
}
