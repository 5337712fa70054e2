package in.leanvibe.transport.ws;

import in.leanvibe.transport.ClientTransport;
import in.leanvibe.transport.SendResult;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * {@link ClientTransport} over an Undertow WebSocket channel.
 *
 * Sends block until the frame is written; call from a worker thread, never the IO thread.
 * Compressed payloads go out as binary frames, everything else as text frames.
 */
public final class UndertowClientTransport implements ClientTransport {
    private static final Logger log = LoggerFactory.getLogger(UndertowClientTransport.class);

    private final WebSocketChannel channel;

    public UndertowClientTransport(WebSocketChannel channel) {
        this.channel = channel;
    }

    @Override
    public SendResult sendText(String text) {
        if (!channel.isOpen()) {
            return SendResult.TRANSPORT_CLOSED;
        }
        try {
            WebSockets.sendTextBlocking(text, channel);
            return SendResult.OK;
        } catch (IOException e) {
            log.debug("[WS] Text send to {} failed: {}", channel.getSourceAddress(), e.toString());
            return SendResult.TRANSPORT_CLOSED;
        }
    }

    @Override
    public SendResult sendBytes(byte[] bytes) {
        if (!channel.isOpen()) {
            return SendResult.TRANSPORT_CLOSED;
        }
        try {
            WebSockets.sendBinaryBlocking(ByteBuffer.wrap(bytes), channel);
            return SendResult.OK;
        } catch (IOException e) {
            log.debug("[WS] Binary send to {} failed: {}", channel.getSourceAddress(), e.toString());
            return SendResult.TRANSPORT_CLOSED;
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.sendClose();
        } catch (IOException e) {
            log.warn("[WS] Failed to close connection to {}: {}", channel.getSourceAddress(), e.getMessage());
        }
    }

    WebSocketChannel channel() {
        return channel;
    }
}
