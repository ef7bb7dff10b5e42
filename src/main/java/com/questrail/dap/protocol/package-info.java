/**
 * Debug Adapter Protocol message transport.
 *
 * <p>{@link com.questrail.dap.protocol.DebugAdapterProtocol} is the entry point:
 * it frames and sends requests, responses and events, reassembles inbound
 * frames from a byte stream, and correlates responses with the requests that
 * caused them. The meaning of individual DAP commands is left to callers.</p>
 *
 * <h2>Layers</h2>
 * <pre>
 *   transport   byte[] chunks in, byte[] frames out   (ByteStreamEndpoint)
 *   codec       Content-Length framing                 (DapFrameDecoder / Encoder)
 *   internal    JSON ⇄ ProtocolMessage, correlation    (not public API)
 *   model       Request / Response / Event
 * </pre>
 */
package com.questrail.dap.protocol;
