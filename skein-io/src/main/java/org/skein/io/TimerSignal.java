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

package org.skein.io;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Pipe;
import java.nio.channels.SelectableChannel;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.eclipse.jetty.util.IO;
import org.eclipse.jetty.util.thread.ScheduledExecutorScheduler;
import org.eclipse.jetty.util.thread.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A rearmable deadline that makes a selectable channel readable when it expires.</p>
 * <p>Each call to {@link #arm(long)} replaces the previous deadline, {@link #cancel()}
 * removes it. Expirations are delivered by a daemon scheduler thread writing to a
 * pipe, so the loop thread waits on the {@link #getChannel() channel} exactly as it
 * waits on sockets.</p>
 * <p>A wakeup scheduled for a deadline that has since been replaced or cancelled
 * is discarded, except when it races with the replacement; handlers must
 * therefore tolerate a spurious expiration.</p>
 */
public class TimerSignal implements Closeable
{
    private static final Logger LOG = LoggerFactory.getLogger(TimerSignal.class);
    private static final AtomicInteger THREADS = new AtomicInteger();

    private final AtomicLong _generation = new AtomicLong();
    private final ByteBuffer _scratch = ByteBuffer.allocate(64);
    private final ScheduledExecutorScheduler _scheduler;
    private final Pipe _pipe;
    private Scheduler.Task _task;

    public TimerSignal() throws IOException
    {
        _pipe = Pipe.open();
        _scheduler = new ScheduledExecutorScheduler("skein-timer-" + THREADS.incrementAndGet(), true);
        try
        {
            _pipe.source().configureBlocking(false);
            _pipe.sink().configureBlocking(false);
            _scheduler.start();
        }
        catch (IOException x)
        {
            close();
            throw x;
        }
        catch (Exception x)
        {
            close();
            throw new IOException("Could not start " + _scheduler, x);
        }
    }

    /**
     * @return the channel that becomes readable when the deadline expires
     */
    public SelectableChannel getChannel()
    {
        return _pipe.source();
    }

    /**
     * <p>Schedules the deadline, replacing any pending one.</p>
     *
     * @param delay the delay in milliseconds before expiration, must not be negative
     */
    public void arm(long delay)
    {
        if (delay < 0)
            throw new IllegalArgumentException("Invalid delay: " + delay);
        long generation = _generation.incrementAndGet();
        cancelTask();
        _task = _scheduler.schedule(() -> expire(generation), delay, TimeUnit.MILLISECONDS);
        if (LOG.isDebugEnabled())
            LOG.debug("Armed {} in {} ms", this, delay);
    }

    /**
     * <p>Removes the pending deadline, if any.</p>
     *
     * @return whether a deadline was pending
     */
    public boolean cancel()
    {
        _generation.incrementAndGet();
        boolean pending = cancelTask();
        if (LOG.isDebugEnabled())
            LOG.debug("Cancelled {}, pending={}", this, pending);
        return pending;
    }

    private boolean cancelTask()
    {
        Scheduler.Task task = _task;
        _task = null;
        return task != null && task.cancel();
    }

    private void expire(long generation)
    {
        if (_generation.get() != generation)
            return;
        try
        {
            _pipe.sink().write(ByteBuffer.wrap(new byte[]{1}));
        }
        catch (IOException x)
        {
            LOG.warn("Could not signal expiration of {}", this, x);
        }
    }

    /**
     * <p>Consumes the expirations delivered so far.</p>
     *
     * @return whether at least one expiration was pending
     * @throws IOException if the channel cannot be read
     */
    public boolean drain() throws IOException
    {
        boolean expired = false;
        while (true)
        {
            _scratch.clear();
            int read = _pipe.source().read(_scratch);
            if (read <= 0)
                return expired;
            expired = true;
        }
    }

    @Override
    public void close()
    {
        _generation.incrementAndGet();
        try
        {
            _scheduler.stop();
        }
        catch (Exception x)
        {
            LOG.warn("Could not stop {}", _scheduler, x);
        }
        IO.close(_pipe.sink());
        IO.close(_pipe.source());
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[generation=%d]", getClass().getSimpleName(), hashCode(), _generation.get());
    }
}
