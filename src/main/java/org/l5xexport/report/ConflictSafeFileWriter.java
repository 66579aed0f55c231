package org.l5xexport.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * 冲突安全的文本写入器：永远不覆盖已存在的文件。
 * <p>
 * 写入顺序：
 * <ol>
 *   <li>目标路径不存在：直接创建并写入。</li>
 *   <li>目标已存在：改写为 {@code <stem>_<timestamp><ext>}。</li>
 *   <li>时间戳文件名也已存在：依次尝试 {@code <stem>_<timestamp>_1<ext>}、{@code _2} …，直到上限。</li>
 * </ol>
 * <p>
 * 每次尝试都使用 {@link StandardOpenOption#CREATE_NEW}（“存在性检查 + 创建”由文件系统原子完成），
 * 不使用 move：在 Unix 上 {@code ATOMIC_MOVE} 会静默替换已存在的目标文件。
 */
public class ConflictSafeFileWriter {

    private static final Logger log = LoggerFactory.getLogger(ConflictSafeFileWriter.class);

    private final Charset charset;
    private final DateTimeFormatter timestampFormat;
    private final int maxAttempts;
    private final Clock clock;

    public ConflictSafeFileWriter(Charset charset, DateTimeFormatter timestampFormat, int maxAttempts, Clock clock) {
        this.charset = Objects.requireNonNull(charset, "charset");
        this.timestampFormat = Objects.requireNonNull(timestampFormat, "timestampFormat");
        this.maxAttempts = maxAttempts;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * 写入文本，返回实际写入的路径（可能与 {@code target} 不同）。
     */
    public Path write(Path target, String content) throws IOException {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(content, "content");

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        byte[] bytes = content.getBytes(charset);

        if (tryCreate(target, bytes)) {
            return target;
        }

        String fileName = target.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        String timestamp = LocalDateTime.now(clock).format(timestampFormat);

        Path candidate = target.resolveSibling(stem + "_" + timestamp + extension);
        for (int counter = 1; counter <= maxAttempts; counter++) {
            if (tryCreate(candidate, bytes)) {
                log.info("{} already exists, wrote {} instead", target, candidate.getFileName());
                return candidate;
            }
            candidate = target.resolveSibling(stem + "_" + timestamp + "_" + counter + extension);
        }
        throw new FileAlreadyExistsException(target.toString(), null,
                "no free file name after " + maxAttempts + " attempts");
    }

    private static boolean tryCreate(Path path, byte[] bytes) throws IOException {
        try {
            Files.write(path, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }
}
