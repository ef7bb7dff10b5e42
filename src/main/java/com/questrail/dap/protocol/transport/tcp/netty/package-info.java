/**
 * Netty adapter for the byte-stream transport port. Netty types stay inside
 * this package.
 */
package com.questrail.dap.protocol.transport.tcp.netty;
