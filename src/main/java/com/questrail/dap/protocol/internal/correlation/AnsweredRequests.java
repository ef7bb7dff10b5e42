package com.questrail.dap.protocol.internal.correlation;

import java.util.LinkedHashSet;
import java.util.Iterator;

/**
 * AnsweredRequests
 * =============================================================================
 * Remembers the {@code request_seq} values this side has already answered, so
 * a second response to the same peer request can be refused.
 *
 * <p>Peer seqs only grow, so only recent answers can be repeated. The set keeps
 * the most recent {@link #DEFAULT_CAPACITY} entries and evicts the oldest.</p>
 *
 * <p>Not thread-safe. Guarded by the transport's write lock.</p>
 */
public final class AnsweredRequests {

    public static final int DEFAULT_CAPACITY = 4096;

    private final int capacity;
    private final LinkedHashSet<Integer> answered = new LinkedHashSet<>();

    public AnsweredRequests() {
        this(DEFAULT_CAPACITY);
    }

    public AnsweredRequests(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public boolean contains(int requestSeq) {
        return answered.contains(requestSeq);
    }

    /**
     * @return {@code false} if {@code requestSeq} was already recorded
     */
    public boolean add(int requestSeq) {
        if (!answered.add(requestSeq)) {
            return false;
        }
        if (answered.size() > capacity) {
            Iterator<Integer> oldest = answered.iterator();
            oldest.next();
            oldest.remove();
        }
        return true;
    }

    public int size() {
        return answered.size();
    }
}
