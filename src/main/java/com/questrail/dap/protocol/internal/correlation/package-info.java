/**
 * Request/response correlation state. Internal to the transport.
 */
package com.questrail.dap.protocol.internal.correlation;
