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

import java.lang.reflect.Field;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConnectionPoolTest
{
    private final FakeTransportEngine engine = new FakeTransportEngine();
    private ConnectionPool pool;

    @BeforeEach
    public void before()
    {
        pool = new ConnectionPool(3, index -> new Connection(index, engine.newHandle()));
    }

    @Test
    public void testAcquireUntilSaturated()
    {
        assertThat(pool.getIdleCount(), is(3));
        assertThat(pool.acquire().getIndex(), is(0));
        assertThat(pool.acquire().getIndex(), is(1));
        assertThat(pool.acquire().getIndex(), is(2));
        assertThat(pool.acquire(), nullValue());
        assertThat(pool.getActiveCount(), is(3));
        assertThat(pool.getIdleCount(), is(0));
    }

    @Test
    public void testLastReleasedIsFirstAcquired()
    {
        Connection first = pool.acquire();
        Connection second = pool.acquire();
        assertTrue(pool.release(first));
        assertTrue(pool.release(second));

        assertThat(pool.acquire(), sameInstance(second));
        assertThat(pool.acquire(), sameInstance(first));
    }

    @Test
    public void testConnectionKeepsHandleAcrossCycles()
    {
        Connection connection = pool.acquire();
        Object handle = connection.getHandle();
        for (int i = 0; i < 5; ++i)
        {
            assertTrue(pool.release(connection));
            Connection next = pool.acquire();
            assertThat(next, sameInstance(connection));
            assertThat(next.getHandle(), sameInstance(handle));
            assertThat(next.getHandle().getAttachment(), sameInstance(connection));
        }
    }

    @Test
    public void testReleaseClearsConnection()
    {
        Connection connection = pool.acquire();
        connection.bind(new HttpRequest("GET", "http://localhost/", (request, error) ->
        {
        }, null, null, -1));
        assertTrue(pool.isActive(connection));

        assertTrue(pool.release(connection));
        assertFalse(pool.isActive(connection));
        assertThat(connection.getRequest(), nullValue());
    }

    @Test
    public void testInvalidRelease()
    {
        Connection connection = pool.acquire();
        assertTrue(pool.release(connection));
        assertFalse(pool.release(connection));
        assertThat(pool.getIdleCount(), is(3));

        ConnectionPool other = new ConnectionPool(1, index -> new Connection(index, engine.newHandle()));
        Connection foreign = other.acquire();
        assertFalse(pool.release(foreign));
        assertThat(pool.getIdleCount(), is(3));
    }

    @Test
    public void testAcquireSkipsFreeIndexMarkedBound() throws Exception
    {
        Field field = ConnectionPool.class.getDeclaredField("bound");
        field.setAccessible(true);
        boolean[] bound = (boolean[])field.get(pool);
        bound[0] = true;

        Connection connection = pool.acquire();
        assertThat(connection.getIndex(), is(1));
        assertThat(pool.acquire().getIndex(), is(2));
        assertThat(pool.acquire(), nullValue());

        // Releasing the inconsistent slot makes it free again.
        assertTrue(pool.release(pool.getConnection(0)));
        assertThat(pool.acquire().getIndex(), is(0));
    }

    @Test
    public void testInvalidConstruction()
    {
        assertThrows(IllegalArgumentException.class, () -> new ConnectionPool(0, index -> new Connection(index, engine.newHandle())));
        assertThrows(IllegalArgumentException.class, () -> new ConnectionPool(2, index -> new Connection(0, engine.newHandle())));
    }
}
