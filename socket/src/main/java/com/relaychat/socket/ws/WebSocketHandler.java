package com.relaychat.socket.ws;

import com.relaychat.core.error.TransportException;
import com.relaychat.core.msg.ClientFrame;
import com.relaychat.core.util.BytesUtils;
import com.relaychat.core.util.JsonUtils;
import com.relaychat.socket.config.SocketConfig;
import com.relaychat.socket.metrics.MetricsService;
import com.relaychat.socket.pipeline.MessagePipeline;
import com.relaychat.socket.registry.Connection;
import com.relaychat.socket.registry.IConnectionRegistry;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * WebSocket handler for client connections.
 * <p>
 * Protocol (server → client):
 * <ul>
 *   <li>connected: {connectionId}</li>
 *   <li>message received: {message}</li>
 *   <li>message rejected: {message}</li>
 * </ul>
 * </p>
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>submit message: {message}</li>
 * </ul>
 * </p>
 */
public class WebSocketHandler {
	private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

	private final SocketConfig config;
	private final IConnectionRegistry registry;
	private final MessagePipeline pipeline;
	private final MetricsService metricsService;

	public WebSocketHandler(
			SocketConfig config,
			IConnectionRegistry registry,
			MessagePipeline pipeline,
			MetricsService metricsService
	) {
		this.config = config;
		this.registry = registry;
		this.pipeline = pipeline;
		this.metricsService = metricsService;
	}

	/**
	 * Handles the WebSocket connection lifecycle.
	 *
	 * @param inbound  WebSocket inbound
	 * @param outbound WebSocket outbound
	 * @return Publisher completing when the connection ends
	 */
	public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound) {
		Connection connection;
		try {
			connection = registry.open();
		} catch (IllegalStateException e) {
			log.warn("Refusing WebSocket connection: {}", e.getMessage());
			return outbound.sendClose();
		}

		String connectionId = connection.getId();
		log.debug("WebSocket connection {} accepted", connectionId);
		handleConnectionStateUpdates(inbound, outbound, connectionId);

		// Combined: send outbound and receive inbound in parallel
		return Mono.when(
						outbound.sendString(sendOutboundMessages(connection)),
						handleInboundMessages(inbound, connectionId)
				)
				.onErrorResume(err -> {
					TransportException failure = new TransportException(connectionId, "WebSocket failure", err);
					log.error("{} for connection {}", failure.getMessage(), connectionId, err);
					return outbound.sendClose();
				})
				.doFinally(signal -> registry.unregister(connectionId));
	}

	private void handleConnectionStateUpdates(WebsocketInbound inbound, WebsocketOutbound outbound, String connectionId) {
		inbound.withConnection(connection -> {
			long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
			long pingTimeoutInMillis = config.getPingInterval() * 1000L;

			connection.onWriteIdle(pingTimeoutInMillis, () -> connection.outbound().sendObject(
							Mono.just(new PingWebSocketFrame())
					).then().subscribe())
					.onReadIdle(idleTimeoutInMillis, () -> outbound.sendClose().subscribe())
					.onDispose(() -> {
						log.debug("WebSocket connection {} disposed, unregistering", connectionId);
						registry.unregister(connectionId);
					});
		});
	}

	private Flux<String> sendOutboundMessages(Connection connection) {
		return Flux.concat(
				Flux.just(ClientFrame.connected(connection.getId())),
				connection.getOutboundFlux()
		).map(JsonUtils::writeValueAsString).doOnNext(message ->
				metricsService.recordNetworkOutboundWs(BytesUtils.getBytesLength(message))
		);
	}

	private Mono<Void> handleInboundMessages(WebsocketInbound inbound, String connectionId) {
		return inbound.aggregateFrames()
				.receive()
				.asString()
				.onBackpressureBuffer(config.getPerConnBufferSize())
				.concatMap(msg -> handleInboundMessage(connectionId, msg).onErrorResume(err -> {
							log.warn("Error processing message from {}: {}", connectionId, err.getMessage());
							return Mono.empty();
						})
				)
				.doOnError(err -> {
					// AbortedException is expected on close
					if (!(err instanceof AbortedException)) {
						log.error("Fatal error in inbound stream for {}", connectionId, err);
					}
				})
				.onErrorResume(err -> Mono.empty())
				.then();
	}

	private Mono<Void> handleInboundMessage(String connectionId, String frameJson) {
		metricsService.recordNetworkInboundWs(BytesUtils.getBytesLength(frameJson));

		ClientFrame frame;
		try {
			frame = JsonUtils.readValue(frameJson, ClientFrame.class);
		} catch (IllegalArgumentException e) {
			log.warn("Malformed frame from {}: {}", connectionId, e.getMessage());
			return Mono.empty();
		}

		if (!ClientFrame.SUBMIT_MESSAGE.equals(frame.getType())) {
			log.warn("Unknown frame type '{}' from {}", frame.getType(), connectionId);
			return Mono.empty();
		}

		String text = frame.getMessage() != null ? frame.getMessage() : "";
		log.debug("Message submitted by {}", connectionId);
		return pipeline.submit(connectionId, text);
	}
}
