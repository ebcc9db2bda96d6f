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

import java.util.function.IntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A fixed set of {@link Connection}s that are bound to requests and then recycled.</p>
 * <p>Connections are created once, at construction. Free connections are tracked by
 * index in a stack, so the most recently released connection is the next acquired,
 * and a bitmap records which indexes are bound; both are checked on every
 * {@link #acquire()} and {@link #release(Connection)}.</p>
 * <p>This class is not thread safe, it is only used by the thread driving the client.</p>
 */
public class ConnectionPool
{
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionPool.class);

    private final Connection[] connections;
    private final int[] idle;
    private final boolean[] bound;
    private int idleCount;

    /**
     * @param maxConnections the number of connections
     * @param factory creates the connection for each index
     */
    public ConnectionPool(int maxConnections, IntFunction<Connection> factory)
    {
        if (maxConnections < 1)
            throw new IllegalArgumentException("Invalid max connections " + maxConnections);
        connections = new Connection[maxConnections];
        idle = new int[maxConnections];
        bound = new boolean[maxConnections];
        for (int i = 0; i < maxConnections; ++i)
        {
            Connection connection = factory.apply(i);
            if (connection.getIndex() != i)
                throw new IllegalArgumentException("Connection " + connection + " created for index " + i);
            connections[i] = connection;
        }
        // Index 0 on top of the stack.
        for (int i = 0; i < maxConnections; ++i)
        {
            idle[i] = maxConnections - 1 - i;
        }
        idleCount = maxConnections;
    }

    /**
     * <p>Returns a free connection, now bound.</p>
     *
     * @return a connection, or null if all the connections are bound
     */
    public Connection acquire()
    {
        while (idleCount > 0)
        {
            int index = idle[--idleCount];
            if (bound[index])
            {
                // The index stays out of the free list until its connection is released.
                LOG.warn("Skipped free index {} bound in {}", index, this);
                continue;
            }
            bound[index] = true;
            Connection connection = connections[index];
            if (LOG.isDebugEnabled())
                LOG.debug("Acquired {} from {}", connection, this);
            return connection;
        }
        return null;
    }

    /**
     * <p>Clears the given connection and makes it free again.</p>
     *
     * @param connection a connection returned by {@link #acquire()}
     * @return false if the connection is not a bound connection of this pool
     */
    public boolean release(Connection connection)
    {
        int index = connection.getIndex();
        if (index < 0 || index >= connections.length || connections[index] != connection)
        {
            LOG.warn("Released {} not owned by {}", connection, this);
            return false;
        }
        if (!bound[index])
        {
            LOG.warn("Released {} not bound in {}", connection, this);
            return false;
        }
        connection.clear();
        bound[index] = false;
        idle[idleCount++] = index;
        if (LOG.isDebugEnabled())
            LOG.debug("Released {} to {}", connection, this);
        return true;
    }

    /**
     * @param connection the connection to test
     * @return whether the given connection is currently bound
     */
    public boolean isActive(Connection connection)
    {
        int index = connection.getIndex();
        return index >= 0 && index < connections.length && connections[index] == connection && bound[index];
    }

    /**
     * @param index the position of the connection
     * @return the connection at the given position, bound or free
     */
    public Connection getConnection(int index)
    {
        return connections[index];
    }

    public int getMaxConnectionCount()
    {
        return connections.length;
    }

    public int getIdleCount()
    {
        return idleCount;
    }

    public int getActiveCount()
    {
        return connections.length - idleCount;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[a=%d,i=%d]", getClass().getSimpleName(), hashCode(), getActiveCount(), getIdleCount());
    }
}
