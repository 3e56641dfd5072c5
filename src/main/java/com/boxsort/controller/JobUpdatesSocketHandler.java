package com.boxsort.controller;

import com.boxsort.model.BoxDelta;
import com.boxsort.service.JobObserver;
import com.boxsort.service.RealtimeBroadcaster;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint through which dashboards follow a job.
 *
 * Protocol (JSON text frames):
 * <ul>
 *   <li>client {@code {"type":"subscribe","jobId":"..."}} - server {@code {"type":"subscribed","jobId":"..."}}</li>
 *   <li>client {@code {"type":"unsubscribe"}} - server {@code {"type":"unsubscribed"}}</li>
 *   <li>server {@code {"type":"box_update","data":{...}}} for every delta of the subscribed job</li>
 * </ul>
 * A connection follows at most one job; subscribing again switches jobs.
 */
@Component
public class JobUpdatesSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(JobUpdatesSocketHandler.class);

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, WebSocketSession> outbound = new ConcurrentHashMap<>();

    @Autowired
    private RealtimeBroadcaster broadcaster;

    @Autowired
    private ObjectMapper objectMapper;

    @Value("${boxsort.realtime.send-time-limit-ms:10000}")
    private int sendTimeLimitMs;

    @Value("${boxsort.realtime.buffer-size-limit:524288}")
    private int bufferSizeLimit;

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        JsonNode request;
        try {
            request = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            reply(session, Map.of("type", "error", "message", "Malformed message"));
            return;
        }

        String type = request.path("type").asText("");
        switch (type) {
            case "subscribe" -> {
                String jobId = request.path("jobId").asText("");
                if (jobId.isBlank()) {
                    reply(session, Map.of("type", "error", "message", "jobId is required"));
                    return;
                }
                dropSubscription(session.getId());
                SocketObserver observer = new SocketObserver(outbound(session));
                subscriptions.put(session.getId(), new Subscription(jobId, observer));
                broadcaster.subscribe(jobId, observer);
                reply(session, Map.of("type", "subscribed", "jobId", jobId));
            }
            case "unsubscribe" -> {
                dropSubscription(session.getId());
                reply(session, Map.of("type", "unsubscribed"));
            }
            default -> reply(session, Map.of("type", "error", "message", "Unknown message type: " + type));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        dropSubscription(session.getId());
        outbound.remove(session.getId());
        log.debug("Socket {} closed: {}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Socket {} transport error: {}", session.getId(), exception.getMessage());
        dropSubscription(session.getId());
        outbound.remove(session.getId());
    }

    public int getSubscriptionCount() {
        return subscriptions.size();
    }

    private void dropSubscription(String socketId) {
        Subscription previous = subscriptions.remove(socketId);
        if (previous != null) {
            broadcaster.unsubscribe(previous.jobId(), previous.observer());
        }
    }

    // every frame to one socket goes through the same decorator so sends never overlap
    private WebSocketSession outbound(WebSocketSession session) {
        return outbound.computeIfAbsent(session.getId(),
            id -> new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit));
    }

    private void reply(WebSocketSession session, Map<String, ?> body) throws IOException {
        outbound(session).sendMessage(new TextMessage(objectMapper.writeValueAsString(body)));
    }

    private record Subscription(String jobId, SocketObserver observer) {
    }

    private class SocketObserver implements JobObserver {

        private final WebSocketSession out;

        SocketObserver(WebSocketSession out) {
            this.out = out;
        }

        @Override
        public String getObserverId() {
            return out.getId();
        }

        @Override
        public void onDelta(BoxDelta delta) throws IOException {
            if (!out.isOpen()) {
                throw new IOException("Socket " + out.getId() + " is closed");
            }
            Map<String, Object> frame = new LinkedHashMap<>();
            frame.put("type", "box_update");
            frame.put("data", delta);
            out.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
        }
    }
}
