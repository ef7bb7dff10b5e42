package com.questrail.dap.protocol;

import com.questrail.dap.protocol.model.Response;

/**
 * Completion callback registered for an outgoing request.
 *
 * <p>Exactly one of the two methods is invoked, at most once: {@link #onResponse}
 * when the matching response is decoded, or {@link #onFailure} when the
 * transport is torn down first and the teardown policy fails pending requests.
 * Neither is invoked when the policy drops them.</p>
 */
@FunctionalInterface
public interface ResponseHandler
{
    void onResponse(Response response);

    default void onFailure(DapProtocolException cause) {
    }
}
