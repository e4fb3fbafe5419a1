package com.relaychat.socket.registry;

import com.relaychat.core.metrics.MetricsNames;
import com.relaychat.core.msg.ChatMessage;
import com.relaychat.core.msg.ClientFrame;
import com.relaychat.socket.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracks live connections of this node and fans messages out to them.
 * <p>
 * Membership changes hold the write lock, broadcasts hold the read lock. Once
 * {@link #unregister(String)} returns, no broadcast can still be enumerating the removed
 * connection, so it never receives another frame.
 * </p>
 */
public class ConnectionRegistry implements IConnectionRegistry {
	private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

	private final ConnectionFactory connectionFactory;
	private final MetricsService metricsService;

	// Active connections: connectionId -> Connection
	private final Map<String, Connection> connections = new ConcurrentHashMap<>();
	private final ReadWriteLock membershipLock = new ReentrantReadWriteLock();
	private volatile boolean running = true;

	public ConnectionRegistry(ConnectionFactory connectionFactory, MetricsService metricsService) {
		this.connectionFactory = connectionFactory;
		this.metricsService = metricsService;
		metricsService.gauge(MetricsNames.CONNECTIONS, connections::size);
	}

	@Override
	public Connection open() {
		Connection connection = connectionFactory.create();
		register(connection);
		return connection;
	}

	@Override
	public String register(Connection connection) {
		Lock lock = membershipLock.writeLock();
		lock.lock();
		try {
			if (!running) {
				throw new IllegalStateException("Registry is drained, refusing connection " + connection.getId());
			}
			Connection existing = connections.putIfAbsent(connection.getId(), connection);
			if (existing != null) {
				throw new IllegalStateException("Connection already registered: " + connection.getId());
			}
		} finally {
			lock.unlock();
		}
		log.debug("Registered connection {} ({} live)", connection.getId(), connections.size());
		return connection.getId();
	}

	@Override
	public void unregister(String connectionId) {
		Connection removed;
		Lock lock = membershipLock.writeLock();
		lock.lock();
		try {
			removed = connections.remove(connectionId);
			if (removed != null) {
				removed.close();
			}
		} finally {
			lock.unlock();
		}
		if (removed != null) {
			log.debug("Unregistered connection {} ({} live)", connectionId, connections.size());
		}
	}

	@Override
	public int broadcastExceptSender(ChatMessage message, String senderId) {
		int delivered = fanOut(ClientFrame.received(message.getText()), senderId);
		metricsService.recordDeliveredLocal(delivered);
		return delivered;
	}

	@Override
	public int broadcastAll(ChatMessage message) {
		int delivered = fanOut(ClientFrame.received(message.getText()), null);
		metricsService.recordDeliveredRelay(delivered);
		return delivered;
	}

	private int fanOut(ClientFrame frame, String excludedId) {
		int delivered = 0;
		Lock lock = membershipLock.readLock();
		lock.lock();
		try {
			for (Connection connection : connections.values()) {
				if (connection.getId().equals(excludedId)) {
					continue;
				}
				if (emit(connection, frame)) {
					delivered++;
				}
			}
		} finally {
			lock.unlock();
		}
		return delivered;
	}

	@Override
	public boolean sendTo(String connectionId, ClientFrame frame) {
		Lock lock = membershipLock.readLock();
		lock.lock();
		try {
			Connection connection = connections.get(connectionId);
			return connection != null && emit(connection, frame);
		} finally {
			lock.unlock();
		}
	}

	private boolean emit(Connection connection, ClientFrame frame) {
		Sinks.EmitResult result = connection.send(frame);
		if (result.isSuccess()) {
			return true;
		}
		// a full buffer with no subscriber reports FAIL_ZERO_SUBSCRIBER
		if (result == Sinks.EmitResult.FAIL_OVERFLOW || result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
			log.warn("Outbound buffer full for connection {}, dropping frame", connection.getId());
			metricsService.recordDropBufferFull();
		} else {
			log.debug("Could not emit to connection {}: {}", connection.getId(), result);
			metricsService.recordDropClosed();
		}
		return false;
	}

	@Override
	public void drainAll() {
		List<String> ids;
		Lock lock = membershipLock.writeLock();
		lock.lock();
		try {
			running = false;
			ids = List.copyOf(connections.keySet());
		} finally {
			lock.unlock();
		}
		log.info("Draining {} active connections", ids.size());
		ids.forEach(this::unregister);
	}

	@Override
	public boolean isAccepting() {
		return running;
	}

	@Override
	public Set<String> getActiveConnectionIds() {
		return Set.copyOf(connections.keySet());
	}

	@Override
	public int size() {
		return connections.size();
	}

}
