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

import org.skein.io.ReadinessMultiplexer;

/**
 * <p>What a {@link TransportEngine} wants its embedder to watch on a socket.</p>
 */
public enum SocketAction
{
    /**
     * Keep the socket registered without any interest.
     */
    NONE(0),
    IN(ReadinessMultiplexer.INPUT),
    OUT(ReadinessMultiplexer.OUTPUT),
    INOUT(ReadinessMultiplexer.INPUT | ReadinessMultiplexer.OUTPUT),
    /**
     * Stop watching the socket, it is about to be closed.
     */
    REMOVE(0);

    private final int interest;

    SocketAction(int interest)
    {
        this.interest = interest;
    }

    /**
     * @return the {@link ReadinessMultiplexer} interest flags for this action
     */
    public int getInterest()
    {
        return interest;
    }
}
