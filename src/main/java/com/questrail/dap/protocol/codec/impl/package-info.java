/**
 * {@code Content-Length} implementations of the codec ports.
 *
 * <p>Header rules live in {@code ContentLengthHeader}; buffering of partial
 * input lives in {@code ReceiveBuffer}. Neither is visible outside this
 * package.</p>
 */
package com.questrail.dap.protocol.codec.impl;
