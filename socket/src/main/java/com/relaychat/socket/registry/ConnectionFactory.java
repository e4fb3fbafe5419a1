package com.relaychat.socket.registry;

import com.relaychat.core.msg.ClientFrame;
import com.relaychat.socket.config.SocketConfig;
import reactor.core.publisher.Sinks;

import java.util.UUID;

/**
 * Creates connections with their bounded outbound buffer.
 */
public class ConnectionFactory {
    private final int bufferSize;

    public ConnectionFactory(SocketConfig config) {
        this.bufferSize = config.getPerConnBufferSize();
    }

    /**
     * Creates a connection with a fresh random identifier.
     *
     * @return Connection instance
     */
    public Connection create() {
        return create(UUID.randomUUID().toString());
    }

    /**
     * Creates a connection with the given identifier.
     *
     * @param connectionId Connection identifier
     * @return Connection instance
     */
    public Connection create(String connectionId) {
        // Overflow is reported as FAIL_OVERFLOW instead of blocking the broadcaster
        Sinks.Many<ClientFrame> sink = Sinks.many().multicast().onBackpressureBuffer(bufferSize, false);
        return new Connection(connectionId, sink);
    }

}
