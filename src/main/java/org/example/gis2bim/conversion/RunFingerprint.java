package org.example.gis2bim.conversion;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * 一次转换的指纹（sha256 十六进制）：输出文件名 + 每个输入文件的文件名与内容。
 * <p>
 * 作为 GlobalId 的运行种子：同样的输入写到同名输出得到同样的 id；换了输入或输出文件名，id 就不同。
 * 文件内容流式读取，不整体载入内存。
 */
final class RunFingerprint {

    private static final HexFormat HEX = HexFormat.of();

    private RunFingerprint() {
    }

    static String of(Path output, List<Path> inputFiles) {
        MessageDigest digest = sha256Digest();
        update(digest, output.getFileName().toString());
        byte[] buffer = new byte[8192];
        for (Path file : inputFiles) {
            update(digest, file.getFileName().toString());
            try (InputStream in = Files.newInputStream(file)) {
                int read;
                while ((read = in.read(buffer)) >= 0) {
                    digest.update(buffer, 0, read);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("计算输入文件指纹失败：" + file, e);
            }
        }
        return HEX.formatHex(digest.digest());
    }

    private static void update(MessageDigest digest, String text) {
        digest.update(text.getBytes(StandardCharsets.UTF_8));
        // 分隔符，避免 "ab"+"c" 与 "a"+"bc" 得到同一摘要
        digest.update((byte) 0);
    }

    private static MessageDigest sha256Digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("当前运行环境不支持 SHA-256 摘要算法（MessageDigest）", e);
        }
    }
}
