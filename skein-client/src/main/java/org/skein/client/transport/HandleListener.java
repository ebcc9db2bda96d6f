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

import java.nio.ByteBuffer;

/**
 * <p>Receives the data of the exchange performed by a {@link TransportEngine.Handle}.</p>
 * <p>Methods are invoked by the engine from within its drive methods, on the thread driving it.</p>
 */
public interface HandleListener
{
    /**
     * <p>Callback method invoked for each raw response header line, in order,
     * including status lines, interim responses and the blank line ending each header block.</p>
     *
     * @param line the line, including its terminator
     * @return false to abort the exchange with {@link ResultCode#WRITE_ERROR}
     */
    boolean onHeaderLine(String line);

    /**
     * <p>Callback method invoked for each chunk of response content.</p>
     * <p>The buffer is only valid during the call.</p>
     *
     * @param content the content bytes
     */
    void onContent(ByteBuffer content);

    /**
     * <p>Callback method invoked to obtain the next bytes of an upload.</p>
     * <p>Implementations put at most {@code buffer.remaining()} bytes into the buffer.
     * The engine calls this method until it returns 0.</p>
     *
     * @param buffer the buffer to fill
     * @return the number of bytes put into the buffer, 0 at the end of the upload
     */
    int onUpload(ByteBuffer buffer);
}
