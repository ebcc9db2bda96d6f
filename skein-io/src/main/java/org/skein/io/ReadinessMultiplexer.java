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
import java.nio.channels.SelectableChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;

import org.eclipse.jetty.util.IO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>{@link ReadinessMultiplexer} wraps a {@link Selector} and dispatches readiness
 * notifications to the {@link Handler} registered for each channel.</p>
 * <p>Unlike a selector loop, this class does not own a thread: the embedder waits on
 * {@link #getSelector()} (or calls {@link #select(long)}) and then calls
 * {@link #processOne()} until it returns false. Each call delivers at most one
 * notification, so the embedder keeps control between events.</p>
 * <p>Interests are expressed with {@link #INPUT} and {@link #OUTPUT}; output interest
 * on a socket whose connection is pending waits for the connection to complete.</p>
 * <p>All methods except {@link #getSelector()} must be called by the thread driving
 * the multiplexer.</p>
 */
public class ReadinessMultiplexer implements Closeable
{
    private static final Logger LOG = LoggerFactory.getLogger(ReadinessMultiplexer.class);

    public static final int INPUT = 1;
    public static final int OUTPUT = 2;

    private final Selector _selector;

    public ReadinessMultiplexer() throws IOException
    {
        _selector = Selector.open();
    }

    /**
     * @return the selector an embedder waits on before calling {@link #processOne()}
     */
    public Selector getSelector()
    {
        return _selector;
    }

    /**
     * <p>Registers a non-blocking channel with the given interest.</p>
     *
     * @param channel the channel to register
     * @param interest a combination of {@link #INPUT} and {@link #OUTPUT}, possibly 0
     * @param handler the handler notified when the channel is ready
     * @throws IOException if the channel is closed
     * @throws IllegalStateException if the channel is already registered
     */
    public void register(SelectableChannel channel, int interest, Handler handler) throws IOException
    {
        Objects.requireNonNull(handler);
        SelectionKey key = channel.keyFor(_selector);
        if (key != null && key.isValid())
            throw new IllegalStateException("Already registered " + channel);
        channel.register(_selector, toInterestOps(channel, interest), new Registration(handler, interest));
        if (LOG.isDebugEnabled())
            LOG.debug("Registered {} interest={} on {}", channel, interest, this);
    }

    /**
     * <p>Changes the interest of a registered channel.</p>
     *
     * @param channel the registered channel
     * @param interest a combination of {@link #INPUT} and {@link #OUTPUT}, possibly 0
     * @throws IllegalStateException if the channel is not registered
     */
    public void modify(SelectableChannel channel, int interest)
    {
        SelectionKey key = channel.keyFor(_selector);
        if (key == null || !key.isValid())
            throw new IllegalStateException("Not registered " + channel);
        Registration registration = (Registration)key.attachment();
        registration._interest = interest;
        key.interestOps(toInterestOps(channel, interest));
        if (LOG.isDebugEnabled())
            LOG.debug("Modified {} interest={} on {}", channel, interest, this);
    }

    /**
     * <p>Removes the registration of a channel.</p>
     * <p>A notification already selected for the channel is discarded.</p>
     *
     * @param channel the channel to unregister
     * @return whether the channel was registered
     */
    public boolean unregister(SelectableChannel channel)
    {
        SelectionKey key = channel.keyFor(_selector);
        if (key == null || !key.isValid())
            return false;
        key.cancel();
        _selector.selectedKeys().remove(key);
        if (LOG.isDebugEnabled())
            LOG.debug("Unregistered {} from {}", channel, this);
        return true;
    }

    /**
     * @param channel the channel to test
     * @return whether the channel is currently registered
     */
    public boolean isRegistered(SelectableChannel channel)
    {
        SelectionKey key = channel.keyFor(_selector);
        return key != null && key.isValid();
    }

    /**
     * <p>Blocks until at least one registered channel is ready, the selector is
     * woken up, or the timeout expires.</p>
     *
     * @param timeout the timeout in milliseconds, or 0 to wait indefinitely
     * @return the number of notifications waiting to be processed
     * @throws IOException if the selection fails
     */
    public int select(long timeout) throws IOException
    {
        Set<SelectionKey> selected = _selector.selectedKeys();
        if (selected.isEmpty())
            _selector.select(timeout);
        return selected.size();
    }

    /**
     * <p>Delivers one readiness notification to the handler of its channel.</p>
     * <p>If no notification is waiting, a non-blocking selection is performed first.
     * Failures thrown by handlers are logged and do not propagate.</p>
     *
     * @return whether a notification was processed
     * @throws IOException if the selection fails
     */
    public boolean processOne() throws IOException
    {
        Set<SelectionKey> selected = _selector.selectedKeys();
        if (selected.isEmpty())
            _selector.selectNow();
        Iterator<SelectionKey> iterator = selected.iterator();
        if (!iterator.hasNext())
            return false;

        SelectionKey key = iterator.next();
        iterator.remove();
        if (!key.isValid())
            return true;

        SelectableChannel channel = key.channel();
        Registration registration = (Registration)key.attachment();
        int readiness = toReadiness(key.readyOps());
        if (LOG.isDebugEnabled())
            LOG.debug("Ready {} readiness={} on {}", channel, readiness, this);
        try
        {
            registration._handler.onReady(channel, readiness);
        }
        catch (Throwable x)
        {
            LOG.warn("Failure while handling readiness {} of {}", readiness, channel, x);
        }
        registration.update(key);
        return true;
    }

    @Override
    public void close()
    {
        IO.close(_selector);
    }

    private static int toInterestOps(SelectableChannel channel, int interest)
    {
        int ops = 0;
        if ((interest & INPUT) != 0)
            ops |= SelectionKey.OP_READ;
        if ((interest & OUTPUT) != 0)
        {
            if (channel instanceof SocketChannel && ((SocketChannel)channel).isConnectionPending())
                ops |= SelectionKey.OP_CONNECT;
            else
                ops |= SelectionKey.OP_WRITE;
        }
        return ops;
    }

    private static int toReadiness(int readyOps)
    {
        int readiness = 0;
        if ((readyOps & SelectionKey.OP_READ) != 0)
            readiness |= INPUT;
        if ((readyOps & (SelectionKey.OP_WRITE | SelectionKey.OP_CONNECT)) != 0)
            readiness |= OUTPUT;
        return readiness;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[keys=%d]", getClass().getSimpleName(), hashCode(), _selector.isOpen() ? _selector.keys().size() : -1);
    }

    /**
     * <p>Receives readiness notifications for a registered channel.</p>
     */
    @FunctionalInterface
    public interface Handler
    {
        /**
         * @param channel the ready channel
         * @param readiness a combination of {@link #INPUT} and {@link #OUTPUT}
         */
        void onReady(SelectableChannel channel, int readiness);
    }

    private static class Registration
    {
        private final Handler _handler;
        private int _interest;

        private Registration(Handler handler, int interest)
        {
            _handler = handler;
            _interest = interest;
        }

        // A socket that finished connecting must move from OP_CONNECT to OP_WRITE.
        private void update(SelectionKey key)
        {
            if (!key.isValid())
                return;
            int ops = toInterestOps(key.channel(), _interest);
            if (key.interestOps() != ops)
                key.interestOps(ops);
        }
    }
}
