package in.leanvibe.service.streaming;

/**
 * Output of {@link CompressionManager#compressMessage(String)}.
 *
 * @param bytes      payload to put on the wire (gzip when {@code compressed}, UTF-8 otherwise)
 * @param compressed whether the binary send path must be used
 */
public record CompressionResult(byte[] bytes, boolean compressed) {
}
