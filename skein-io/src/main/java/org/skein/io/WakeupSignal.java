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
import java.nio.channels.ClosedChannelException;
import java.nio.channels.Pipe;
import java.nio.channels.SelectableChannel;
import java.util.concurrent.atomic.AtomicBoolean;

import org.eclipse.jetty.util.IO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A cross-thread notification that makes a selectable channel readable.</p>
 * <p>{@link #signal()} may be called from any thread; signals raised before the
 * loop thread calls {@link #drain()} coalesce into a single readiness event.</p>
 * <p>The {@link #getChannel() channel} is meant to be registered for input with a
 * {@link ReadinessMultiplexer} and stays registered for the lifetime of the signal.</p>
 */
public class WakeupSignal implements Closeable
{
    private static final Logger LOG = LoggerFactory.getLogger(WakeupSignal.class);

    private final AtomicBoolean _pending = new AtomicBoolean();
    private final ByteBuffer _scratch = ByteBuffer.allocate(64);
    private final Pipe _pipe;

    public WakeupSignal() throws IOException
    {
        _pipe = Pipe.open();
        try
        {
            _pipe.source().configureBlocking(false);
            _pipe.sink().configureBlocking(false);
        }
        catch (IOException x)
        {
            close();
            throw x;
        }
    }

    /**
     * @return the channel that becomes readable when this signal is raised
     */
    public SelectableChannel getChannel()
    {
        return _pipe.source();
    }

    /**
     * <p>Raises this signal.</p>
     * <p>Does nothing if the signal is already raised and not yet drained.</p>
     */
    public void signal()
    {
        if (_pending.getAndSet(true))
            return;
        try
        {
            // A full pipe is already readable.
            _pipe.sink().write(ByteBuffer.wrap(new byte[]{1}));
        }
        catch (ClosedChannelException x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Ignored signal on closed {}", this);
        }
        catch (IOException x)
        {
            _pending.set(false);
            LOG.warn("Could not raise {}", this, x);
        }
    }

    /**
     * <p>Consumes all the pending signals.</p>
     * <p>Must be called by the thread that waits on the channel, before it looks
     * for the work announced by the signals.</p>
     *
     * @return whether there was at least one pending signal
     * @throws IOException if the channel cannot be read
     */
    public boolean drain() throws IOException
    {
        long drained = 0;
        while (true)
        {
            _scratch.clear();
            int read = _pipe.source().read(_scratch);
            if (read <= 0)
                break;
            drained += read;
        }
        // Cleared only after the pipe is empty: a signal suppressed by the
        // flag was raised before this point and its work is visible to the caller.
        _pending.set(false);
        if (LOG.isDebugEnabled())
            LOG.debug("Drained {} signal bytes from {}", drained, this);
        return drained > 0;
    }

    /**
     * @return whether this signal has been raised and not yet drained
     */
    public boolean isPending()
    {
        return _pending.get();
    }

    @Override
    public void close()
    {
        IO.close(_pipe.sink());
        IO.close(_pipe.source());
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[pending=%b]", getClass().getSimpleName(), hashCode(), _pending.get());
    }
}
