package in.leanvibe.service.streaming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Conditional gzip compression for outgoing messages.
 *
 * Payloads under {@link #MIN_COMPRESSION_SIZE} bytes are never compressed.
 * Larger payloads are compressed only when the result is at least 20% smaller.
 */
public final class CompressionManager {
    private static final Logger log = LoggerFactory.getLogger(CompressionManager.class);

    public static final int MIN_COMPRESSION_SIZE = 1024;
    public static final double MAX_COMPRESSED_RATIO = 0.8;

    public CompressionResult compressMessage(String message) {
        byte[] raw = message.getBytes(StandardCharsets.UTF_8);
        if (raw.length < MIN_COMPRESSION_SIZE) {
            return new CompressionResult(raw, false);
        }

        byte[] compressed;
        try {
            compressed = gzip(raw);
        } catch (IOException e) {
            log.warn("[Compression] gzip failed for {} byte payload, sending raw: {}", raw.length, e.toString());
            return new CompressionResult(raw, false);
        }

        if (compressed.length < raw.length * MAX_COMPRESSED_RATIO) {
            log.debug("[Compression] {} -> {} bytes", raw.length, compressed.length);
            return new CompressionResult(compressed, true);
        }
        return new CompressionResult(raw, false);
    }

    /**
     * Inverse of a compressed {@link #compressMessage(String)} result.
     */
    public String decompress(byte[] compressed) {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid gzip payload", e);
        }
    }

    private static byte[] gzip(byte[] raw) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(raw.length / 2);
        try (GZIPOutputStream out = new GZIPOutputStream(buffer)) {
            out.write(raw);
        }
        return buffer.toByteArray();
    }
}
