package org.iceforge.heimdall.execution;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Gzip + base64 encoding for large results. Anything reading a persisted result with the compressed
 * flag set must run it through {@link #decompress(String)}.
 */
public final class ResultCompressor {
    private ResultCompressor() {}

    public static String compress(String data) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(bos)) {
            gz.write(data.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("gzip failed", e);
        }
        return Base64.getEncoder().encodeToString(bos.toByteArray());
    }

    public static String decompress(String compressed) {
        byte[] raw = Base64.getDecoder().decode(compressed);
        try (GZIPInputStream gz = new GZIPInputStream(new ByteArrayInputStream(raw))) {
            return new String(gz.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("gunzip failed", e);
        }
    }

    public static long byteSize(String data) {
        return data == null ? 0L : data.getBytes(StandardCharsets.UTF_8).length;
    }

    public static boolean shouldCompress(String data, long thresholdBytes) {
        return byteSize(data) > thresholdBytes;
    }

    public static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024L * 1024L) return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024.0));
    }
}
