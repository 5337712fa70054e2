package in.leanvibe.transport;

/**
 * Outbound connection to one streaming client.
 *
 * Implementations never throw on a dead connection: a send on a closed or
 * broken connection returns {@link SendResult#TRANSPORT_CLOSED}.
 */
public interface ClientTransport {

    /**
     * Send an uncompressed JSON message.
     */
    SendResult sendText(String text);

    /**
     * Send a gzip-compressed message.
     */
    SendResult sendBytes(byte[] bytes);

    boolean isOpen();

    /**
     * Close the underlying connection. Safe to call more than once.
     */
    void close();
}
