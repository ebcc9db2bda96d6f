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

import org.skein.client.transport.ResultCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>The outcome of a request, as reported by {@link HttpClientCallbacks#onDone(HttpRequest, HttpClientError)}.</p>
 */
public enum HttpClientError
{
    NONE,
    TIMEOUT,
    HOST_NOT_FOUND,
    COULD_NOT_CONNECT,
    SEND_ERROR,
    RECV_ERROR,
    /**
     * The response status line could not be parsed.
     */
    PROTOCOL_ERROR,
    UNKNOWN;

    private static final Logger LOG = LoggerFactory.getLogger(HttpClientError.class);

    /**
     * <p>Translates a transport result code.</p>
     * <p>Every code maps to exactly one kind; codes without a dedicated kind map to {@link #UNKNOWN}.</p>
     *
     * @param code the {@link ResultCode} reported by the transport engine
     * @return the corresponding kind
     */
    public static HttpClientError fromResultCode(int code)
    {
        switch (code)
        {
            case ResultCode.OK:
                return NONE;
            case ResultCode.OPERATION_TIMEDOUT:
                return TIMEOUT;
            case ResultCode.COULDNT_RESOLVE_HOST:
                return HOST_NOT_FOUND;
            case ResultCode.COULDNT_CONNECT:
                return COULD_NOT_CONNECT;
            case ResultCode.SEND_ERROR:
                return SEND_ERROR;
            case ResultCode.RECV_ERROR:
                return RECV_ERROR;
            default:
                LOG.info("Returning UNKNOWN for transport code {}", ResultCode.toString(code));
                return UNKNOWN;
        }
    }
}
