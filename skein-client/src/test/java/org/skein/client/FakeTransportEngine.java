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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.SelectableChannel;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.skein.client.transport.HandleOptions;
import org.skein.client.transport.SocketAction;
import org.skein.client.transport.TransportEngine;
import org.skein.client.transport.TransportException;

/**
 * <p>A {@link TransportEngine} whose exchanges are completed by the test.</p>
 */
public class FakeTransportEngine implements TransportEngine
{
    public final List<FakeHandle> handles = new ArrayList<>();
    public final List<FakeHandle> registered = new ArrayList<>();
    public final List<FakeHandle> executed = new ArrayList<>();
    public final List<FakeHandle> unregistered = new ArrayList<>();
    public final List<SelectableChannel> readyChannels = new ArrayList<>();
    public final Map<SelectableChannel, Object> tokens = new HashMap<>();
    private final List<Completion> completions = new ArrayList<>();
    public Listener listener;
    public boolean failRegister;
    public boolean failUnregister;
    public int timeoutDrives;
    public boolean closed;

    @Override
    public void setListener(Listener listener)
    {
        this.listener = listener;
    }

    @Override
    public Handle newHandle()
    {
        FakeHandle handle = new FakeHandle(handles.size());
        handles.add(handle);
        return handle;
    }

    @Override
    public void configureHandle(Handle handle, HandleOptions options)
    {
        if (registered.contains(handle))
            throw new IllegalStateException("Registered " + handle);
        ((FakeHandle)handle).options = options;
    }

    @Override
    public void registerHandleForExecution(Handle handle) throws TransportException
    {
        if (failRegister)
            throw new TransportException("explicitly_thrown_by_test");
        if (registered.contains(handle))
            throw new TransportException("Registered " + handle);
        registered.add((FakeHandle)handle);
        executed.add((FakeHandle)handle);
    }

    @Override
    public boolean unregisterHandle(Handle handle)
    {
        boolean removed = registered.remove(handle);
        unregistered.add((FakeHandle)handle);
        return removed && !failUnregister;
    }

    @Override
    public void assign(SelectableChannel channel, Object token)
    {
        tokens.put(channel, token);
    }

    @Override
    public int driveOnSocketReady(SelectableChannel channel, int readiness)
    {
        readyChannels.add(channel);
        if (channel instanceof ReadableByteChannel)
        {
            try
            {
                ByteBuffer buffer = ByteBuffer.allocate(64);
                while (((ReadableByteChannel)channel).read(buffer) > 0)
                {
                    buffer.clear();
                }
            }
            catch (IOException x)
            {
                throw new UncheckedIOException(x);
            }
        }
        return registered.size();
    }

    @Override
    public int driveOnTimeout()
    {
        ++timeoutDrives;
        return registered.size();
    }

    @Override
    public List<Completion> pollCompletedHandles()
    {
        List<Completion> result = new ArrayList<>(completions);
        completions.clear();
        return result;
    }

    @Override
    public void close()
    {
        closed = true;
    }

    /**
     * <p>Completes the exchange of the given handle, as if the engine detected it.</p>
     */
    public void complete(FakeHandle handle, int resultCode)
    {
        completions.add(new Completion(handle, resultCode));
        listener.onTimeoutRequested(0);
    }

    public void watch(SelectableChannel channel, SocketAction action)
    {
        listener.onSocketStateChanged(channel, action, tokens.get(channel));
    }

    public FakeHandle lastExecuted()
    {
        return executed.get(executed.size() - 1);
    }

    public static class FakeHandle implements Handle
    {
        private final int id;
        private Object attachment;
        private HandleOptions options;

        private FakeHandle(int id)
        {
            this.id = id;
        }

        @Override
        public Object getAttachment()
        {
            return attachment;
        }

        @Override
        public void setAttachment(Object attachment)
        {
            this.attachment = attachment;
        }

        public HandleOptions getOptions()
        {
            return options;
        }

        /**
         * <p>Feeds the given header lines to the handle listener.</p>
         *
         * @return false as soon as the listener rejects a line
         */
        public boolean receive(String... lines)
        {
            for (String line : lines)
            {
                if (!options.getListener().onHeaderLine(line))
                    return false;
            }
            return true;
        }

        @Override
        public String toString()
        {
            return String.format("%s#%d", getClass().getSimpleName(), id);
        }
    }
}
