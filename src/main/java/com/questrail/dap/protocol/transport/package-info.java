/**
 * DAP Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete byte stream (process stdio, a Netty socket, a test double)
 * and the protocol transport.
 *
 * <h2>Why these ports exist</h2>
 * Netty is used for socket connections <strong>without</strong> allowing Netty
 * types to leak into the codec, correlation or dispatch code. Everything above
 * the endpoint sees only:
 * <ul>
 *   <li>Raw byte chunks as {@code byte[]}</li>
 *   <li>Complete outbound frames as {@code byte[]}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform I/O only (no framing, no JSON)</li>
 *   <li>Deliver inbound chunks serially and in stream order</li>
 *   <li>Write each outbound frame as one unit</li>
 * </ul>
 */
package com.questrail.dap.protocol.transport;
