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

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RequestQueueTest
{
    private static HttpRequest newRequest(String path)
    {
        return new HttpRequest("GET", "http://localhost" + path, (request, error) ->
        {
        }, null, null, -1);
    }

    @Test
    public void testPollIsFifo()
    {
        RequestQueue queue = new RequestQueue();
        HttpRequest first = newRequest("/1");
        HttpRequest second = newRequest("/2");
        HttpRequest third = newRequest("/3");
        queue.offer(first);
        queue.offer(second);
        queue.offer(third);

        assertThat(queue.poll(2), contains(first, second));
        assertThat(queue.size(), is(1));
        assertThat(queue.poll(10), contains(third));
        assertThat(queue.poll(10), empty());
        assertThat(queue.poll(0), empty());
    }

    @Test
    public void testCloseReturnsQueuedAndRejectsOffers()
    {
        RequestQueue queue = new RequestQueue();
        HttpRequest first = newRequest("/1");
        HttpRequest second = newRequest("/2");
        assertTrue(queue.offer(first));
        assertTrue(queue.offer(second));

        assertThat(queue.close(), contains(first, second));
        assertTrue(queue.isClosed());
        assertFalse(queue.offer(newRequest("/3")));
        assertThat(queue.size(), is(0));
        assertThat(queue.close(), empty());
    }

    @Test
    public void testConcurrentOffers() throws Exception
    {
        RequestQueue queue = new RequestQueue();
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; ++t)
        {
            Thread thread = new Thread(() ->
            {
                for (int i = 0; i < 250; ++i)
                {
                    queue.offer(newRequest("/" + i));
                }
            });
            threads.add(thread);
            thread.start();
        }
        for (Thread thread : threads)
        {
            thread.join();
        }

        assertThat(queue.size(), is(1000));
        assertThat(queue.poll(Integer.MAX_VALUE).size(), is(1000));
    }
}
