package com.refinery.orchestrator.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.refinery.orchestrator.error.NotFoundException;
import com.refinery.orchestrator.model.JobEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.UUID;

/**
 * WS /ws/progress/{jobId}?since=N
 *
 * Sends a "connected" frame, then the job's events after 'since' and live
 * ones as they happen, with heartbeats while idle. After the terminal event
 * (or a resync_required frame) it sends "end" and closes the socket.
 * Messages from the client are ignored.
 */
@Component
public class ProgressWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ProgressWebSocketHandler.class);

    public static final String PATH = "/ws/progress/*";

    static final CloseStatus JOB_NOT_FOUND = new CloseStatus(4404, "Job not found");
    static final CloseStatus BAD_REQUEST   = new CloseStatus(4400, "Invalid job id or since");

    private static final String RELAY_ATTRIBUTE = "progressRelay";

    private final ProgressRelay relay;
    private final ObjectMapper  json;
    private final Clock         clock;

    public ProgressWebSocketHandler(ProgressRelay relay, ObjectMapper json, Clock clock) {
        this.relay = relay;
        this.json  = json;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        UUID jobId;
        long since;
        try {
            URI uri = session.getUri();
            String path = uri.getPath();
            jobId = UUID.fromString(path.substring(path.lastIndexOf('/') + 1));
            String sinceParam = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("since");
            since = sinceParam == null ? 0 : Long.parseLong(sinceParam);
            if (since < 0) {
                throw new IllegalArgumentException("since must be >= 0");
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            log.debug("Rejecting progress socket {}: {}", session.getUri(), e.getMessage());
            session.close(BAD_REQUEST);
            return;
        }

        send(session, ProgressFrame.connected(jobId, since, clock.instant()));
        try {
            ProgressRelay.Handle handle = relay.start(jobId, since, new SessionSink(session, jobId));
            session.getAttributes().put(RELAY_ATTRIBUTE, handle);
            log.info("WebSocket observer {} attached to job {} from sequence {}", session.getId(), jobId, since);
        } catch (NotFoundException e) {
            session.close(JOB_NOT_FOUND);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Object handle = session.getAttributes().remove(RELAY_ATTRIBUTE);
        if (handle instanceof ProgressRelay.Handle relayHandle) {
            relayHandle.stop();
        }
        log.debug("WebSocket observer {} closed ({})", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on progress socket {}: {}", session.getId(), exception.getMessage());
    }

    private void send(WebSocketSession session, ProgressFrame frame) throws IOException {
        synchronized (session) {
            if (session.isOpen()) {
                session.sendMessage(new TextMessage(json.writeValueAsString(frame)));
            }
        }
    }

    private final class SessionSink implements ProgressRelay.FrameSink {
        private final WebSocketSession session;
        private final UUID             jobId;

        SessionSink(WebSocketSession session, UUID jobId) {
            this.session = session;
            this.jobId   = jobId;
        }

        @Override
        public void event(JobEvent event) throws IOException {
            send(session, ProgressFrame.event(event, clock.instant()));
        }

        @Override
        public void heartbeat() throws IOException {
            send(session, ProgressFrame.heartbeat(jobId, clock.instant()));
        }

        @Override
        public void end() throws IOException {
            send(session, ProgressFrame.end(jobId, clock.instant()));
            session.close(CloseStatus.NORMAL);
        }
    }
}
