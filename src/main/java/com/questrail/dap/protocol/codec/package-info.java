/**
 * DAP Codec - Wire-Level Framing
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> of the transport.
 * The codec layer implements the wire framing rules and nothing else:</p>
 *
 * <pre>
 *   Content-Length: &lt;N&gt;\r\n\r\n&lt;N bytes of UTF-8 JSON&gt;
 * </pre>
 *
 * <ul>
 *   <li>{@code N} is ASCII decimal and counts <em>bytes</em>, not characters</li>
 *   <li>No other header is recognized</li>
 *   <li>Consecutive frames are concatenated with no extra separator</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] chunk (stream fragment)
 *        → DapFrameDecoder        (framing applied here)
 *            → String body
 *                → DapMessageDecoder
 *                    → ProtocolMessage
 * </pre>
 *
 * <p>JSON structure is not interpreted at this layer. A body is handed on even
 * if it turns out not to be valid JSON; that failure belongs to the message
 * decoder.</p>
 */
package com.questrail.dap.protocol.codec;
