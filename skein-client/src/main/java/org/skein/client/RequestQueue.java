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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.eclipse.jetty.util.thread.AutoLock;

/**
 * <p>The FIFO of requests submitted to an {@link HttpClient} and not yet bound to a connection.</p>
 * <p>Requests are offered by any thread and polled by the thread driving the client.
 * Once {@link #close() closed}, the queue rejects further requests.</p>
 */
public class RequestQueue
{
    private final AutoLock lock = new AutoLock();
    private final Deque<HttpRequest> requests = new ArrayDeque<>();
    private boolean closed;

    /**
     * @param request the request to append
     * @return false if this queue is closed
     */
    public boolean offer(HttpRequest request)
    {
        try (AutoLock l = lock.lock())
        {
            if (closed)
                return false;
            requests.offer(request);
            return true;
        }
    }

    /**
     * <p>Removes the oldest requests.</p>
     *
     * @param max the maximum number of requests to remove
     * @return the removed requests, oldest first
     */
    public List<HttpRequest> poll(int max)
    {
        try (AutoLock l = lock.lock())
        {
            int count = Math.min(max, requests.size());
            List<HttpRequest> result = new ArrayList<>(count);
            for (int i = 0; i < count; ++i)
            {
                result.add(requests.poll());
            }
            return result;
        }
    }

    /**
     * <p>Rejects the requests offered from now on.</p>
     *
     * @return the requests still queued, oldest first
     */
    public List<HttpRequest> close()
    {
        try (AutoLock l = lock.lock())
        {
            closed = true;
            List<HttpRequest> result = new ArrayList<>(requests);
            requests.clear();
            return result;
        }
    }

    public boolean isClosed()
    {
        try (AutoLock l = lock.lock())
        {
            return closed;
        }
    }

    /**
     * @return the number of queued requests
     */
    public int size()
    {
        try (AutoLock l = lock.lock())
        {
            return requests.size();
        }
    }
}
