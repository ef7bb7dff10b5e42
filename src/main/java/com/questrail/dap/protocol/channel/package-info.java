/**
 * Publish/subscribe channels through which the transport delivers inbound
 * events, inbound requests and errors.
 *
 * <p>One channel exists per kind of value. Callers only ever see the
 * {@link com.questrail.dap.protocol.channel.MessageSource} view; publishing is
 * reserved to the transport.</p>
 */
package com.questrail.dap.protocol.channel;
