package com.questrail.dap.protocol.internal.correlation;

import com.questrail.dap.protocol.ResponseHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * PendingRequestTable
 * =============================================================================
 * Correlation map from the {@code seq} of an outstanding request to its
 * {@link ResponseHandler}.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>At most one handler per {@code seq}</li>
 *   <li>Every handler leaves the table exactly once, either through
 *       {@link #complete(int)} or {@link #drain()}</li>
 *   <li>A lookup for a {@code seq} that is not present is a no-op</li>
 * </ul>
 *
 * <p>Removal is atomic, so a handler can never be returned to two callers
 * even if completion and teardown race.</p>
 *
 * <p>The table is owned exclusively by its transport; handlers are never
 * exposed back to callers.</p>
 */
public final class PendingRequestTable {

    private final ConcurrentHashMap<Integer, ResponseHandler> pending = new ConcurrentHashMap<>();

    /**
     * Registers {@code handler} for the request sent with {@code seq}.
     *
     * @throws IllegalStateException if a handler is already registered for {@code seq}
     */
    public void register(int seq, ResponseHandler handler) {
        Objects.requireNonNull(handler, "handler");
        if (pending.putIfAbsent(seq, handler) != null) {
            throw new IllegalStateException("Handler already registered for seq " + seq);
        }
    }

    /**
     * Removes and returns the handler for {@code requestSeq}.
     *
     * @return the handler, or empty if none is pending for that seq
     */
    public Optional<ResponseHandler> complete(int requestSeq) {
        return Optional.ofNullable(pending.remove(requestSeq));
    }

    /**
     * Forgets the handler for {@code seq} without invoking it.
     * Used when the request frame could not be written.
     *
     * @return {@code true} if a handler was removed
     */
    public boolean discard(int seq) {
        return pending.remove(seq) != null;
    }

    /**
     * Removes every pending handler and returns them in request order.
     */
    public List<ResponseHandler> drain() {
        List<ResponseHandler> drained = new ArrayList<>();
        for (Integer seq : new TreeSet<>(pending.keySet())) {
            ResponseHandler handler = pending.remove(seq);
            if (handler != null) {
                drained.add(handler);
            }
        }
        return drained;
    }

    public int size() {
        return pending.size();
    }

    public boolean isPending(int seq) {
        return pending.containsKey(seq);
    }
}
