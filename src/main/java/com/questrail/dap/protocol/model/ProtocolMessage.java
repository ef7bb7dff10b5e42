package com.questrail.dap.protocol.model;

/**
 * Base of every message exchanged over a Debug Adapter Protocol connection.
 *
 * <h2>Sequence numbers</h2>
 * <p>
 * Every message carries a {@code seq} assigned by its sender. Numbers start at
 * {@code 1} and increase by one for every message sent on a connection,
 * regardless of kind.
 * </p>
 *
 * <p>
 * A message built locally for sending carries {@code seq == 0}, meaning
 * "not yet sent". The transport assigns the real number at send time and
 * hands back a stamped copy; the original instance is never mutated.
 * </p>
 *
 * <h2>Kinds</h2>
 * <ul>
 *   <li>{@link Request}: asks the peer to perform a command</li>
 *   <li>{@link Response}: answers a previously received request</li>
 *   <li>{@link Event}: unsolicited notification</li>
 * </ul>
 */
public sealed interface ProtocolMessage
        permits Request, Response, Event {

    /** Seq value carried by a message that has not been sent yet. */
    int UNSENT = 0;

    /**
     * Returns the sender-assigned sequence number, or {@link #UNSENT}.
     */
    int seq();

    /**
     * Returns the wire {@code type} tag of this message.
     */
    MessageType type();

    /**
     * Returns a copy of this message carrying the given sequence number.
     */
    ProtocolMessage withSeq(int seq);
}
