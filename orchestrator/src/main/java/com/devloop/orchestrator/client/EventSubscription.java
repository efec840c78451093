package com.devloop.orchestrator.client;

import com.devloop.orchestrator.client.dto.AgentEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A live, lazily read sequence of agent events parsed from Server-Sent-Events frames.
 *
 * Frames are read one line at a time; a blank line terminates a frame and its
 * {@code data:} lines (joined with newlines when there are several) are
 * deserialized into an {@link AgentEvent}. Frames that fail to parse are logged
 * and skipped.
 *
 * <p>The sequence ends when the server closes the connection or when
 * {@link #close()} is called from any thread. Closing releases the underlying
 * socket stream, which makes a reader blocked in {@link #hasNext()} return
 * promptly. A subscription cannot be restarted.
 */
public class EventSubscription implements Iterator<AgentEvent>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventSubscription.class);

    private final BufferedReader reader;
    private final Closeable      connection;
    private final ObjectMapper   json;
    private final String         source;

    private volatile boolean closed;
    private boolean ended;
    private AgentEvent pending;

    EventSubscription(BufferedReader reader, Closeable connection, ObjectMapper json, String source) {
        this.reader     = reader;
        this.connection = connection;
        this.json       = json;
        this.source     = source;
    }

    /** Subscription over an in-memory or already-open character stream. */
    public static EventSubscription over(Reader reader, ObjectMapper json) {
        BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        return new EventSubscription(buffered, buffered, json, "reader");
    }

    @Override
    public boolean hasNext() {
        if (pending != null) return true;
        if (ended || closed) return false;
        pending = readNextEvent();
        return pending != null;
    }

    @Override
    public AgentEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Event stream from " + source + " has ended");
        }
        AgentEvent event = pending;
        pending = null;
        return event;
    }

    /** Sequential stream view; closing the stream closes the subscription. */
    public Stream<AgentEvent> stream() {
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(this::close);
    }

    /** True once {@link #close()} has been called, as opposed to the server ending the stream. */
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            connection.close();
        } catch (IOException e) {
            log.debug("Error closing event stream from {}: {}", source, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Frame parsing
    // ------------------------------------------------------------------

    private AgentEvent readNextEvent() {
        StringBuilder data = new StringBuilder();
        boolean hasData = false;
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    if (hasData) {
                        AgentEvent event = parse(data.toString().trim());
                        if (event != null) {
                            return event;
                        }
                    }
                    data.setLength(0);
                    hasData = false;
                    continue;
                }
                if (line.startsWith("data:")) {
                    if (hasData) data.append('\n');
                    data.append(line.substring("data:".length()));
                    hasData = true;
                }
                // event:, id:, retry: and ":" comment lines carry nothing we use
            }
        } catch (IOException e) {
            if (!closed) {
                log.info("Event stream from {} interrupted: {}", source, e.getMessage());
            }
        }
        ended = true;
        return null;
    }

    private AgentEvent parse(String payload) {
        if (payload.isEmpty()) return null;
        try {
            AgentEvent event = json.readValue(payload, AgentEvent.class);
            if (log.isDebugEnabled() && event != null) {
                log.debug("SSE event from {}: type={} session={}", source, event.type(),
                        event.properties() != null ? event.properties().sessionId() : null);
            }
            return event;
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed SSE payload from {}: {}", source, payload);
            return null;
        }
    }
}
