package com.relaychat.socket.registry;

import com.relaychat.core.msg.ChatMessage;
import com.relaychat.core.msg.ClientFrame;

import java.util.Set;

/**
 * Membership of live client connections and in-process broadcast.
 * <p>
 * Broadcasts never block on a slow receiver: a frame that does not fit in a connection's
 * bounded buffer is dropped for that connection only.
 * </p>
 */
public interface IConnectionRegistry {

    /**
     * Creates and registers a connection for a freshly accepted client.
     *
     * @return The registered connection
     */
    Connection open();

    /**
     * Adds a connection to the membership set.
     *
     * @param connection Live connection
     * @return Its identifier
     * @throws IllegalStateException if the id is already registered or the registry was drained
     */
    String register(Connection connection);

    /**
     * Removes a connection. Unknown ids are ignored.
     *
     * @param connectionId Connection identifier
     */
    void unregister(String connectionId);

    /**
     * Delivers a message to every registered connection except its sender.
     *
     * @param message  Message to deliver
     * @param senderId Connection to skip
     * @return Number of connections the frame was queued for
     */
    int broadcastExceptSender(ChatMessage message, String senderId);

    /**
     * Delivers a message relayed from another node to every registered connection.
     *
     * @param message Message to deliver
     * @return Number of connections the frame was queued for
     */
    int broadcastAll(ChatMessage message);

    /**
     * Sends a frame to a single connection.
     *
     * @return true if queued
     */
    boolean sendTo(String connectionId, ClientFrame frame);

    /**
     * Unregisters every connection and stops accepting new ones (node shutdown).
     */
    void drainAll();

    /**
     * @return false once {@link #drainAll()} was called
     */
    boolean isAccepting();

    Set<String> getActiveConnectionIds();

    int size();
}
