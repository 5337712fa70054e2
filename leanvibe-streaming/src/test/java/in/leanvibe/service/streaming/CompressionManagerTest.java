package in.leanvibe.service.streaming;

import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

import static org.junit.jupiter.api.Assertions.*;

class CompressionManagerTest {

    private final CompressionManager compression = new CompressionManager();

    @Test
    void testSmallMessageNotCompressed() {
        String message = "{\"message_type\":\"notification\"}";

        CompressionResult result = compression.compressMessage(message);

        assertFalse(result.compressed(), "Below 1024 bytes");
        assertEquals(message, new String(result.bytes(), StandardCharsets.UTF_8));
    }

    @Test
    void testRepetitiveLargeMessageCompressed() {
        String message = "{\"events\":[" + "{\"file_path\":\"src/app/module.py\"},".repeat(200) + "{}]}";

        CompressionResult result = compression.compressMessage(message);

        assertTrue(result.compressed(), "Highly repetitive payload should shrink");
        assertTrue(result.bytes().length < message.length() * CompressionManager.MAX_COMPRESSED_RATIO);
        assertEquals(message, compression.decompress(result.bytes()));
    }

    @Test
    void testIncompressibleMessageSentRaw() {
        SecureRandom random = new SecureRandom();
        StringBuilder noise = new StringBuilder();
        for (int i = 0; i < 4096; i++) {
            noise.append((char) (1 + random.nextInt(127)));
        }
        String message = noise.toString();

        CompressionResult result = compression.compressMessage(message);

        assertFalse(result.compressed(), "Random ASCII does not shrink by 20%");
        assertEquals(message, new String(result.bytes(), StandardCharsets.UTF_8));
    }

    @Test
    void testDecompressRejectsGarbage() {
        assertThrows(UncheckedIOException.class,
            () -> compression.decompress("not gzip".getBytes(StandardCharsets.UTF_8)));
    }
}
