package com.questrail.dap.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.dap.protocol.channel.MessageChannel;
import com.questrail.dap.protocol.channel.MessageSource;
import com.questrail.dap.protocol.codec.DapFrameDecoder;
import com.questrail.dap.protocol.codec.DapFrameEncoder;
import com.questrail.dap.protocol.codec.DapFrameListener;
import com.questrail.dap.protocol.codec.impl.ContentLengthFrameDecoder;
import com.questrail.dap.protocol.codec.impl.ContentLengthFrameEncoder;
import com.questrail.dap.protocol.config.DapTransportConfig;
import com.questrail.dap.protocol.internal.correlation.AnsweredRequests;
import com.questrail.dap.protocol.internal.correlation.PendingRequestTable;
import com.questrail.dap.protocol.internal.decode.DapDecodeException;
import com.questrail.dap.protocol.internal.decode.DapMessageDecoder;
import com.questrail.dap.protocol.internal.encode.DapMessageEncoder;
import com.questrail.dap.protocol.model.Event;
import com.questrail.dap.protocol.model.ProtocolMessage;
import com.questrail.dap.protocol.model.Request;
import com.questrail.dap.protocol.model.Response;
import com.questrail.dap.protocol.observability.DapDiagnosticEvent;
import com.questrail.dap.protocol.observability.DapErrorEvent;
import com.questrail.dap.protocol.observability.DapObservabilitySink;
import com.questrail.dap.protocol.observability.DapTransportEvent;
import com.questrail.dap.protocol.observability.TransportStats;
import com.questrail.dap.protocol.observability.WireTrace;
import com.questrail.dap.protocol.transport.ByteStreamEndpoint;
import com.questrail.dap.protocol.transport.ByteStreamEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntFunction;

/**
 * DebugAdapterProtocol
 * =============================================================================
 * Message transport for one Debug Adapter Protocol connection.
 *
 * <h2>Inbound path (decode-before-dispatch)</h2>
 * <pre>
 *   ByteStreamEndpoint
 *        → DapFrameDecoder       (Content-Length framing)
 *            → DapMessageDecoder (JSON → ProtocolMessage)
 *                → event    → {@link #events()}
 *                → request  → {@link #requests()}
 *                → response → pending request handler, once
 * </pre>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   Request / Response / Event
 *        → seq assignment
 *            → DapMessageEncoder
 *                → DapFrameEncoder
 *                    → ByteStreamEndpoint.write(...)
 * </pre>
 *
 * <h2>Sequence numbers</h2>
 * One counter per instance, starting at 1 and advanced by every send of any
 * kind. Assignment, serialization and the write happen under one lock, so
 * concurrent senders never interleave frames and wire order equals seq order.
 *
 * <h2>Execution model</h2>
 * Inbound bytes are processed serially: the endpoint delivers chunks from one
 * thread and the decode pass is additionally guarded by its own lock. Event,
 * request and response delivery happen synchronously on that thread, in
 * decode order. Processing never blocks waiting for input.
 *
 * <h2>Errors</h2>
 * No failure is fatal to the connection:
 * <ul>
 *   <li>Header without {@code Content-Length}: dropped, diagnostic only</li>
 *   <li>Malformed JSON body: {@link DapDecodeException} on {@link #errors()}</li>
 *   <li>Duplicate response: {@link DapProtocolMisuseException} on
 *       {@link #errors()}, nothing written</li>
 *   <li>Response for an unknown request: dropped, diagnostic only</li>
 * </ul>
 */
public final class DebugAdapterProtocol implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DebugAdapterProtocol.class);

    private final DapTransportConfig config;
    private final DapObservabilitySink sink;

    private final DapFrameEncoder frameEncoder;
    private final DapFrameDecoder frameDecoder;
    private final DapMessageEncoder messageEncoder;
    private final DapMessageDecoder messageDecoder;

    private final PendingRequestTable pendingRequests = new PendingRequestTable();
    private final TransportStats stats = new TransportStats();

    private final MessageChannel<Event> events = new MessageChannel<>("events");
    private final MessageChannel<Request> requests = new MessageChannel<>("requests");
    private final MessageChannel<DapProtocolException> errors = new MessageChannel<>("errors");

    private final Object writeLock = new Object();
    private final Object readLock = new Object();
    private final FrameListener frameListener = new FrameListener();

    // guarded by writeLock
    private int sequence = 1;
    private boolean closed;
    private final AnsweredRequests answeredRequests = new AnsweredRequests();

    private volatile ByteStreamEndpoint endpoint;

    public DebugAdapterProtocol() {
        this(DapTransportConfig.defaults());
    }

    public DebugAdapterProtocol(DapTransportConfig config) {
        this(config,
             new ContentLengthFrameEncoder(),
             new ContentLengthFrameDecoder(config.initialBufferCapacity()),
             new DapMessageEncoder(),
             new DapMessageDecoder());
    }

    public DebugAdapterProtocol(DapTransportConfig config,
                                DapFrameEncoder frameEncoder,
                                DapFrameDecoder frameDecoder,
                                DapMessageEncoder messageEncoder,
                                DapMessageDecoder messageDecoder) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = config.observabilitySink();
        this.frameEncoder = Objects.requireNonNull(frameEncoder, "frameEncoder");
        this.frameDecoder = Objects.requireNonNull(frameDecoder, "frameDecoder");
        this.messageEncoder = Objects.requireNonNull(messageEncoder, "messageEncoder");
        this.messageDecoder = Objects.requireNonNull(messageDecoder, "messageDecoder");
    }

    /**
     * Attach the byte stream. Inbound bytes start flowing once the endpoint is
     * started, which remains the caller's decision.
     */
    public void connect(ByteStreamEndpoint endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        if (this.endpoint != null) {
            throw new IllegalStateException("Already connected");
        }
        this.endpoint = endpoint;
        endpoint.setListener(new EndpointListener());
    }

    // -------------------------------------------------------------------------
    // Subscriptions
    // -------------------------------------------------------------------------

    /** Inbound events, in decode order. */
    public MessageSource<Event> events() {
        return events;
    }

    /**
     * Inbound requests, in decode order. Subscribers answer them with
     * {@link #sendResponse(Response)}.
     */
    public MessageSource<Request> requests() {
        return requests;
    }

    /** Decode failures, protocol misuse and failing response handlers. */
    public MessageSource<DapProtocolException> errors() {
        return errors;
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Send a request.
     *
     * <p>{@code arguments} are left off the wire when null or empty. If
     * {@code handler} is given it is registered under the new seq before the
     * frame is written, so a fast response cannot miss it.</p>
     *
     * @param handler completion callback; may be {@code null}
     * @return the request as sent, carrying its assigned seq
     */
    public Request sendRequest(String command, JsonNode arguments, ResponseHandler handler) {
        Objects.requireNonNull(command, "command");
        return send(seq -> new Request(seq, command, arguments), handler);
    }

    /**
     * Send a request and expose its response as a future.
     *
     * <p>The future completes exceptionally with {@link DapTransportClosedException}
     * if the transport is closed first, or with the send failure if the frame
     * could not be written.</p>
     */
    public CompletableFuture<Response> request(String command, JsonNode arguments) {
        CompletableFuture<Response> future = new CompletableFuture<>();
        try {
            sendRequest(command, arguments, new ResponseHandler() {
                @Override
                public void onResponse(Response response) {
                    future.complete(response);
                }

                @Override
                public void onFailure(DapProtocolException cause) {
                    future.completeExceptionally(cause);
                }
            });
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Send a response to an inbound request.
     *
     * <p>A request is answered at most once. A response for a {@code request_seq}
     * that was already answered, or one whose {@code seq} is already set, is
     * rejected: nothing is written and a {@link DapProtocolMisuseException} is
     * published on {@link #errors()}.</p>
     *
     * @return the response as sent, or empty if it was rejected
     */
    public Optional<Response> sendResponse(Response response) {
        Objects.requireNonNull(response, "response");

        final Response sent;
        synchronized (writeLock) {
            if (response.seq() != ProtocolMessage.UNSENT || answeredRequests.contains(response.requestSeq())) {
                sent = null;
            } else {
                sent = send(response::withSeq, null);
                answeredRequests.add(response.requestSeq());
            }
        }

        if (sent == null) {
            reportError(new DapProtocolMisuseException("attempt to send more than one response for command "
                    + response.command() + " (request_seq " + response.requestSeq() + ")"));
            return Optional.empty();
        }
        return Optional.of(sent);
    }

    /**
     * Send an event.
     *
     * @return the event as sent, carrying its assigned seq
     */
    public Event sendEvent(String event, JsonNode body) {
        Objects.requireNonNull(event, "event");
        return send(seq -> new Event(seq, event, body), null);
    }

    private <M extends ProtocolMessage> M send(IntFunction<M> stamp, ResponseHandler handler) {
        ByteStreamEndpoint ep = endpoint;
        if (ep == null) {
            throw new IllegalStateException("Not connected");
        }

        final M message;
        final CompletableFuture<Void> written;
        synchronized (writeLock) {
            if (closed) {
                throw new DapTransportClosedException("Transport '" + config.connectionName() + "' is closed");
            }

            final int seq = sequence;
            message = stamp.apply(seq);
            final String json = messageEncoder.encode(message);
            final byte[] frame = frameEncoder.encode(json);

            // The seq is spent once the message is serializable, even if the write fails.
            sequence++;

            if (handler != null) {
                pendingRequests.register(seq, handler);
            }
            try {
                written = Objects.requireNonNull(ep.write(frame), "write result");
            } catch (RuntimeException e) {
                if (handler != null) {
                    pendingRequests.discard(seq);
                }
                throw e;
            }

            stats.recordMessageSent();
            if (config.traceWire()) {
                WireTrace.tx(config.connectionName(), seq, json);
            }
        }

        if (handler != null) {
            final int seq = message.seq();
            written.whenComplete((ignored, failure) -> {
                if (failure != null) {
                    failPendingRequest(seq, failure);
                }
            });
        }
        return message;
    }

    // Write failed after the endpoint accepted the frame.
    private void failPendingRequest(int seq, Throwable cause) {
        Optional<ResponseHandler> handler = pendingRequests.complete(seq);
        if (handler.isEmpty()) {
            return;
        }
        try {
            handler.get().onFailure(new DapProtocolException("Write of request " + seq + " failed", cause));
        } catch (RuntimeException e) {
            reportError(new DapProtocolException("Response handler for request " + seq + " failed", e));
        }
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    private void receive(byte[] chunk) {
        synchronized (readLock) {
            frameDecoder.decode(chunk, frameListener);
        }
    }

    private void dispatch(String body) {
        final Optional<ProtocolMessage> decoded;
        try {
            decoded = messageDecoder.decode(body);
        } catch (DapDecodeException e) {
            stats.recordDecodeError();
            reportError(e);
            return;
        }

        if (decoded.isEmpty()) {
            stats.recordUnknownMessage();
            diagnostic(DapDiagnosticEvent.Kind.UNKNOWN_MESSAGE, WireTrace.truncate(body, 200));
            return;
        }

        ProtocolMessage message = decoded.get();
        if (message instanceof Event event) {
            events.publish(event);
        } else if (message instanceof Request request) {
            requests.publish(request);
        } else if (message instanceof Response response) {
            completeRequest(response);
        }
    }

    private void completeRequest(Response response) {
        Optional<ResponseHandler> handler = pendingRequests.complete(response.requestSeq());
        if (handler.isEmpty()) {
            stats.recordUnmatchedResponse();
            diagnostic(DapDiagnosticEvent.Kind.UNMATCHED_RESPONSE,
                    "request_seq=" + response.requestSeq() + " command=" + response.command());
            return;
        }
        try {
            handler.get().onResponse(response);
        } catch (RuntimeException e) {
            reportError(new DapProtocolException(
                    "Response handler for request " + response.requestSeq() + " failed", e));
        }
    }

    // -------------------------------------------------------------------------
    // Teardown
    // -------------------------------------------------------------------------

    /**
     * Tear the transport down. Later sends fail with
     * {@link DapTransportClosedException}; requests still pending are failed or
     * dropped according to the configured policy. Idempotent.
     *
     * <p>The endpoint is not stopped here; it belongs to whoever started it.</p>
     */
    @Override
    public void close() {
        synchronized (writeLock) {
            if (closed) {
                return;
            }
            closed = true;
        }

        List<ResponseHandler> orphaned = pendingRequests.drain();
        if (orphaned.isEmpty()) {
            return;
        }

        switch (config.pendingRequestPolicy()) {
            case FAIL -> {
                for (ResponseHandler handler : orphaned) {
                    try {
                        handler.onFailure(new DapTransportClosedException(
                                "Transport '" + config.connectionName() + "' closed before response arrived"));
                    } catch (RuntimeException e) {
                        log.warn("Pending request handler failed during teardown", e);
                    }
                }
            }
            case DROP -> diagnostic(DapDiagnosticEvent.Kind.PENDING_DROPPED,
                    orphaned.size() + " pending request(s) dropped on " + config.connectionName());
        }
    }

    public boolean isClosed() {
        synchronized (writeLock) {
            return closed;
        }
    }

    // -------------------------------------------------------------------------
    // Introspection
    // -------------------------------------------------------------------------

    public int pendingRequestCount() {
        return pendingRequests.size();
    }

    public TransportStats stats() {
        return stats;
    }

    public DapTransportConfig config() {
        return config;
    }

    // -------------------------------------------------------------------------
    // Reporting
    // -------------------------------------------------------------------------

    // Sink failures are logged and never reach the decode loop or the caller.

    private void reportError(DapProtocolException e) {
        try {
            sink.onError(new DapErrorEvent(Instant.now(), e.getMessage(), e));
        } catch (RuntimeException sinkFailure) {
            log.warn("Observability sink rejected error event", sinkFailure);
        }
        errors.publish(e);
    }

    private void diagnostic(DapDiagnosticEvent.Kind kind, String detail) {
        try {
            sink.onDiagnostic(new DapDiagnosticEvent(Instant.now(), kind, detail));
        } catch (RuntimeException sinkFailure) {
            log.warn("Observability sink rejected {} diagnostic", kind, sinkFailure);
        }
    }

    private void transportEvent(DapTransportEvent.State state, Throwable cause) {
        try {
            sink.onTransportEvent(new DapTransportEvent(Instant.now(), state, cause));
        } catch (RuntimeException sinkFailure) {
            log.warn("Observability sink rejected transport {} event", state, sinkFailure);
        }
    }

    // -------------------------------------------------------------------------
    // Listeners
    // -------------------------------------------------------------------------

    private final class FrameListener implements DapFrameListener {
        @Override
        public void onFrame(String body) {
            stats.recordFrameDecoded();
            try {
                if (config.traceWire()) {
                    WireTrace.rx(config.connectionName(), body);
                }
                dispatch(body);
            } catch (RuntimeException e) {
                // Frame is already consumed; keep draining the rest of the chunk.
                log.warn("Dispatch of inbound frame on '{}' failed", config.connectionName(), e);
            }
        }

        @Override
        public void onHeaderDiscarded(String headerText) {
            stats.recordHeaderDiscarded();
            diagnostic(DapDiagnosticEvent.Kind.HEADER_DISCARDED, WireTrace.truncate(headerText, 200));
        }
    }

    private final class EndpointListener implements ByteStreamEndpointListener {
        @Override
        public void onTransportUp() {
            transportEvent(DapTransportEvent.State.UP, null);
        }

        @Override
        public void onTransportDown(Throwable cause) {
            transportEvent(DapTransportEvent.State.DOWN, cause);
        }

        @Override
        public void onBytes(byte[] chunk) {
            receive(chunk);
        }
    }
}
