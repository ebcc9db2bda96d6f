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

package org.skein.client.transport;

/**
 * <p>Result codes reported by a {@link TransportEngine} for completed handles.</p>
 * <p>Engines may report codes not listed here; consumers must treat them as unknown failures.</p>
 */
public final class ResultCode
{
    public static final int OK = 0;
    public static final int UNSUPPORTED_PROTOCOL = 1;
    public static final int COULDNT_RESOLVE_HOST = 2;
    public static final int COULDNT_CONNECT = 3;
    public static final int WEIRD_SERVER_REPLY = 4;
    /**
     * A handle listener refused the received data.
     */
    public static final int WRITE_ERROR = 5;
    /**
     * The upload supplier did not provide the declared amount of data.
     */
    public static final int READ_ERROR = 6;
    public static final int OPERATION_TIMEDOUT = 7;
    public static final int SEND_ERROR = 8;
    public static final int RECV_ERROR = 9;

    private ResultCode()
    {
    }

    /**
     * @param code a result code
     * @return a human readable name for the code
     */
    public static String toString(int code)
    {
        switch (code)
        {
            case OK:
                return "OK";
            case UNSUPPORTED_PROTOCOL:
                return "UNSUPPORTED_PROTOCOL";
            case COULDNT_RESOLVE_HOST:
                return "COULDNT_RESOLVE_HOST";
            case COULDNT_CONNECT:
                return "COULDNT_CONNECT";
            case WEIRD_SERVER_REPLY:
                return "WEIRD_SERVER_REPLY";
            case WRITE_ERROR:
                return "WRITE_ERROR";
            case READ_ERROR:
                return "READ_ERROR";
            case OPERATION_TIMEDOUT:
                return "OPERATION_TIMEDOUT";
            case SEND_ERROR:
                return "SEND_ERROR";
            case RECV_ERROR:
                return "RECV_ERROR";
            default:
                return "CODE_" + code;
        }
    }
}
