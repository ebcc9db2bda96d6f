//
// ========================================================================
// Copyright (c) 1995-2020 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under
// the terms of the Eclipse Public License 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0
//
// This Source Code may also be made available under the following
// Secondary Licenses when the conditions for such availability set
// forth in the Eclipse Public License, v. 2.0 are satisfied:
// the Apache License v2.0 which is available at
// https://www.apache.org/licenses/LICENSE-2.0
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.skein.client;

import java.nio.ByteBuffer;

/**
 * <p>Callbacks notified of the progress of a request submitted to an {@link HttpClient}.</p>
 * <p>All methods are invoked by the thread driving the client, in this order:
 * {@link #onResponseStart(HttpRequest, String, int)} once per final response,
 * {@link #onHeader(HttpRequest, String)} for each header line and for the blank line
 * that ends the headers, {@link #onData(HttpRequest, ByteBuffer)} for each chunk of
 * content, and {@link #onDone(HttpRequest, HttpClientError)} exactly once.
 * A request that fails early may skip straight to {@link #onDone(HttpRequest, HttpClientError)}.</p>
 * <p>Implementations must not block: every other request of the client waits for them.</p>
 */
public interface HttpClientCallbacks
{
    /**
     * @param request the request
     * @param httpVersion the protocol version of the status line, such as {@code HTTP/1.1}
     * @param statusCode the status code of the response
     */
    default void onResponseStart(HttpRequest request, String httpVersion, int statusCode)
    {
    }

    /**
     * @param request the request
     * @param line the raw header line, including its terminator
     */
    default void onHeader(HttpRequest request, String line)
    {
    }

    /**
     * @param request the request
     * @param chunk the content bytes, only valid during the call
     */
    default void onData(HttpRequest request, ByteBuffer chunk)
    {
    }

    /**
     * @param request the request
     * @param error {@link HttpClientError#NONE} if the exchange succeeded, otherwise the failure
     */
    void onDone(HttpRequest request, HttpClientError error);
}
