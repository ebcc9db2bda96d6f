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

package org.skein.client.http;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.SelectableChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.eclipse.jetty.util.Fields;
import org.eclipse.jetty.util.IO;
import org.skein.client.transport.HandleListener;
import org.skein.client.transport.HandleOptions;
import org.skein.client.transport.ResultCode;
import org.skein.client.transport.SocketAction;
import org.skein.client.transport.TransportEngine;
import org.skein.client.transport.TransportException;
import org.skein.io.ReadinessMultiplexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A {@link TransportEngine} that performs plain HTTP/1.1 exchanges over
 * non-blocking {@link SocketChannel}s, one connection per exchange.</p>
 * <p>Registered handles are started the next time {@link #driveOnTimeout()} is called,
 * which the engine requests immediately. Host names are resolved when a handle starts.</p>
 * <p>Requests are sent with {@code Connection: close}. Content is sent from the post
 * fields along with the request head, or pulled from the {@link HandleListener} until
 * it returns 0, with chunked transfer coding when the upload size is unknown.</p>
 */
public class NioTransportEngine implements TransportEngine
{
    private static final Logger LOG = LoggerFactory.getLogger(NioTransportEngine.class);
    private static final long NO_DEADLINE = Long.MAX_VALUE;
    private static final long UNKNOWN_DEADLINE = Long.MIN_VALUE;
    private static final String CRLF = "\r\n";

    private final Set<NioHandle> registered = new LinkedHashSet<>();
    private final Queue<NioHandle> pending = new ArrayDeque<>();
    private final Map<SelectableChannel, NioHandle> channels = new HashMap<>();
    private final List<Completion> completions = new ArrayList<>();
    private Listener listener;
    private long scheduledDeadline = UNKNOWN_DEADLINE;
    private boolean closed;

    @Override
    public void setListener(Listener listener)
    {
        this.listener = listener;
    }

    @Override
    public Handle newHandle()
    {
        return new NioHandle(this);
    }

    @Override
    public void configureHandle(Handle handle, HandleOptions options)
    {
        NioHandle nioHandle = toNioHandle(handle);
        if (nioHandle == null)
            throw new IllegalArgumentException("Unknown handle " + handle);
        if (registered.contains(nioHandle))
            throw new IllegalStateException("Registered handle " + handle);
        nioHandle.options = Objects.requireNonNull(options);
    }

    @Override
    public void registerHandleForExecution(Handle handle) throws TransportException
    {
        if (closed)
            throw new TransportException("Closed " + this);
        NioHandle nioHandle = toNioHandle(handle);
        if (nioHandle == null)
            throw new TransportException("Unknown handle " + handle);
        if (nioHandle.options == null)
            throw new TransportException("Handle not configured " + handle);
        if (!registered.add(nioHandle))
            throw new TransportException("Handle already registered " + handle);

        nioHandle.reset();
        nioHandle.state = State.PENDING;
        pending.offer(nioHandle);
        if (LOG.isDebugEnabled())
            LOG.debug("Registered {}", nioHandle);

        // The timer request is going to be replaced by the immediate drive.
        scheduledDeadline = UNKNOWN_DEADLINE;
        listener.onTimeoutRequested(0);
    }

    @Override
    public boolean unregisterHandle(Handle handle)
    {
        NioHandle nioHandle = toNioHandle(handle);
        if (nioHandle == null || !registered.remove(nioHandle))
            return false;

        if (nioHandle.state != State.DONE && LOG.isDebugEnabled())
            LOG.debug("Aborting {}", nioHandle);
        pending.remove(nioHandle);
        completions.removeIf(completion -> completion.getHandle() == nioHandle);
        disconnect(nioHandle);
        nioHandle.reset();
        if (!closed)
            updateTimeout();
        return true;
    }

    @Override
    public void assign(SelectableChannel channel, Object token)
    {
        NioHandle nioHandle = channels.get(channel);
        if (nioHandle == null)
        {
            LOG.warn("Cannot assign token to unknown {}", channel);
            return;
        }
        nioHandle.token = token;
    }

    @Override
    public int driveOnSocketReady(SelectableChannel channel, int readiness)
    {
        NioHandle nioHandle = channels.get(channel);
        if (nioHandle == null)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Readiness {} of unknown {}", readiness, channel);
        }
        else
        {
            try
            {
                if (nioHandle.state == State.CONNECTING && (readiness & ReadinessMultiplexer.OUTPUT) != 0)
                    connect(nioHandle);
                if (nioHandle.state == State.SENDING && (readiness & ReadinessMultiplexer.OUTPUT) != 0)
                    send(nioHandle);
                if (nioHandle.state == State.RECEIVING && (readiness & ReadinessMultiplexer.INPUT) != 0)
                    receive(nioHandle);
            }
            catch (ExchangeFailure x)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Failed {}", nioHandle, x);
                complete(nioHandle, x.getResultCode());
            }
        }
        updateTimeout();
        return getRunningCount();
    }

    @Override
    public int driveOnTimeout()
    {
        // The timer that drove this call, if any, is spent.
        scheduledDeadline = UNKNOWN_DEADLINE;

        NioHandle nioHandle;
        while ((nioHandle = pending.poll()) != null)
        {
            try
            {
                start(nioHandle);
            }
            catch (ExchangeFailure x)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Could not start {}", nioHandle, x);
                complete(nioHandle, x.getResultCode());
            }
        }

        long now = now();
        for (NioHandle handle : new ArrayList<>(registered))
        {
            if (handle.state != State.DONE && handle.deadline <= now)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Timed out {}", handle);
                complete(handle, ResultCode.OPERATION_TIMEDOUT);
            }
        }

        updateTimeout();
        return getRunningCount();
    }

    @Override
    public List<Completion> pollCompletedHandles()
    {
        if (completions.isEmpty())
            return List.of();
        List<Completion> result = new ArrayList<>(completions);
        completions.clear();
        return result;
    }

    @Override
    public void close()
    {
        if (closed)
            return;
        closed = true;
        for (NioHandle nioHandle : registered)
        {
            disconnect(nioHandle);
            nioHandle.reset();
        }
        registered.clear();
        pending.clear();
        completions.clear();
        if (LOG.isDebugEnabled())
            LOG.debug("Closed {}", this);
    }

    private int getRunningCount()
    {
        int count = 0;
        for (NioHandle nioHandle : registered)
        {
            if (nioHandle.state != State.DONE)
                ++count;
        }
        return count;
    }

    private NioHandle toNioHandle(Handle handle)
    {
        if (handle instanceof NioHandle && ((NioHandle)handle).engine == this)
            return (NioHandle)handle;
        return null;
    }

    private void start(NioHandle nioHandle) throws ExchangeFailure
    {
        HandleOptions options = nioHandle.options;
        if (options.getTimeoutSeconds() > 0)
            nioHandle.deadline = now() + TimeUnit.SECONDS.toMillis(options.getTimeoutSeconds());

        URI uri = options.getURI();
        if (!"http".equalsIgnoreCase(uri.getScheme()))
            throw new ExchangeFailure(ResultCode.UNSUPPORTED_PROTOCOL, "Unsupported scheme " + uri.getScheme());
        String host = uri.getHost();
        if (host == null)
            throw new ExchangeFailure(ResultCode.COULDNT_RESOLVE_HOST, "No host in " + uri);
        int port = uri.getPort() < 0 ? 80 : uri.getPort();
        InetSocketAddress address = new InetSocketAddress(host, port);
        if (address.isUnresolved())
            throw new ExchangeFailure(ResultCode.COULDNT_RESOLVE_HOST, "Unresolved " + host);

        nioHandle.output = newRequestHead(options, host, uri.getPort());
        nioHandle.chunkedUpload = options.isUpload() && options.getUploadSize() < 0;
        nioHandle.input = ByteBuffer.allocate(Math.max(1, options.getBufferSize()));
        nioHandle.parser = new ResponseParser(options.getListener(), options.isNoBody(), options.isVerbose());

        SocketChannel channel = null;
        try
        {
            channel = SocketChannel.open();
            channel.configureBlocking(false);
            channel.setOption(StandardSocketOptions.TCP_NODELAY, options.isTcpNoDelay());
            boolean connected = channel.connect(address);
            nioHandle.channel = channel;
            channels.put(channel, nioHandle);
            nioHandle.state = connected ? State.SENDING : State.CONNECTING;
            if (LOG.isDebugEnabled())
                LOG.debug("Started {} to {}", nioHandle, address);
        }
        catch (IOException x)
        {
            if (nioHandle.channel == null)
                IO.close(channel);
            throw new ExchangeFailure(ResultCode.COULDNT_CONNECT, "Could not connect to " + address + ": " + x);
        }
        watch(nioHandle, SocketAction.OUT);
    }

    private ByteBuffer newRequestHead(HandleOptions options, String host, int port)
    {
        URI uri = options.getURI();
        String target = uri.getRawPath();
        if (target == null || target.isEmpty())
            target = "/";
        if (uri.getRawQuery() != null)
            target += "?" + uri.getRawQuery();

        Fields headers = new Fields();
        headers.put("Host", port < 0 ? host : host + ":" + port);
        headers.put("Accept", "*/*");
        headers.put("Connection", "close");
        byte[] postFields = options.getPostFields();
        if (postFields != null)
        {
            headers.put("Content-Length", String.valueOf(postFields.length));
            headers.put("Content-Type", "application/x-www-form-urlencoded");
        }
        else if (options.isUpload())
        {
            if (options.getUploadSize() >= 0)
                headers.put("Content-Length", String.valueOf(options.getUploadSize()));
            else
                headers.put("Transfer-Encoding", "chunked");
        }

        // Caller fields replace the defaults of the same name, empty values remove them.
        for (Fields.Field field : options.getHeaders())
        {
            if (isEmpty(field))
                headers.remove(field.getName());
            else
                headers.put(field);
        }

        StringBuilder head = new StringBuilder();
        head.append(options.getMethod()).append(' ').append(target).append(" HTTP/1.1").append(CRLF);
        for (Fields.Field field : headers)
        {
            for (String value : field.getValues())
            {
                if (!value.isEmpty())
                    head.append(field.getName()).append(": ").append(value).append(CRLF);
            }
        }
        head.append(CRLF);
        if (options.isVerbose())
            LOG.info("> {}", head.toString().trim().replace(CRLF, CRLF + "> "));

        byte[] bytes = head.toString().getBytes(StandardCharsets.ISO_8859_1);
        int length = bytes.length + (postFields == null ? 0 : postFields.length);
        ByteBuffer buffer = ByteBuffer.allocate(length);
        buffer.put(bytes);
        if (postFields != null)
            buffer.put(postFields);
        return buffer.flip();
    }

    private static boolean isEmpty(Fields.Field field)
    {
        for (String value : field.getValues())
        {
            if (!value.isEmpty())
                return false;
        }
        return true;
    }

    private void connect(NioHandle nioHandle) throws ExchangeFailure
    {
        try
        {
            if (!nioHandle.channel.finishConnect())
                return;
        }
        catch (IOException x)
        {
            throw new ExchangeFailure(ResultCode.COULDNT_CONNECT, "Could not connect: " + x);
        }
        if (LOG.isDebugEnabled())
            LOG.debug("Connected {}", nioHandle);
        nioHandle.state = State.SENDING;
    }

    private void send(NioHandle nioHandle) throws ExchangeFailure
    {
        SocketChannel channel = nioHandle.channel;
        HandleOptions options = nioHandle.options;
        while (true)
        {
            if (nioHandle.output.hasRemaining())
            {
                try
                {
                    channel.write(nioHandle.output);
                }
                catch (IOException x)
                {
                    throw new ExchangeFailure(ResultCode.SEND_ERROR, "Could not send: " + x);
                }
                // Wait for the socket to be writable again.
                if (nioHandle.output.hasRemaining())
                    return;
            }

            if (!options.isUpload() || nioHandle.uploadComplete)
                break;

            nioHandle.output = nextUpload(nioHandle);
        }

        nioHandle.state = State.RECEIVING;
        watch(nioHandle, SocketAction.IN);
    }

    private ByteBuffer nextUpload(NioHandle nioHandle) throws ExchangeFailure
    {
        HandleOptions options = nioHandle.options;
        ByteBuffer buffer = nioHandle.input;
        buffer.clear();
        int length = options.getListener().onUpload(buffer);
        if (length < 0 || length != buffer.position())
            throw new ExchangeFailure(ResultCode.READ_ERROR, "Invalid upload length " + length);
        buffer.flip();
        nioHandle.uploaded += length;

        long expected = options.getUploadSize();
        if (length == 0)
        {
            nioHandle.uploadComplete = true;
            if (expected >= 0 && nioHandle.uploaded != expected)
                throw new ExchangeFailure(ResultCode.READ_ERROR, "Uploaded " + nioHandle.uploaded + "/" + expected);
        }
        else if (expected >= 0 && nioHandle.uploaded > expected)
        {
            throw new ExchangeFailure(ResultCode.READ_ERROR, "Uploaded " + nioHandle.uploaded + "/" + expected);
        }

        if (!nioHandle.chunkedUpload)
            return buffer;

        byte[] prefix = length == 0 ? new byte[0] : (Integer.toHexString(length) + CRLF).getBytes(StandardCharsets.ISO_8859_1);
        byte[] suffix = (length == 0 ? "0" + CRLF + CRLF : CRLF).getBytes(StandardCharsets.ISO_8859_1);
        ByteBuffer chunk = ByteBuffer.allocate(prefix.length + length + suffix.length);
        chunk.put(prefix).put(buffer).put(suffix);
        return chunk.flip();
    }

    private void receive(NioHandle nioHandle) throws ExchangeFailure
    {
        ByteBuffer buffer = nioHandle.input;
        buffer.clear();
        int read;
        try
        {
            read = nioHandle.channel.read(buffer);
        }
        catch (IOException x)
        {
            throw new ExchangeFailure(ResultCode.RECV_ERROR, "Could not receive: " + x);
        }
        if (LOG.isDebugEnabled())
            LOG.debug("Read {} bytes on {}", read, nioHandle);

        if (read < 0)
        {
            nioHandle.parser.atEOF();
            complete(nioHandle, ResultCode.OK);
        }
        else if (read > 0)
        {
            buffer.flip();
            if (nioHandle.parser.parse(buffer))
                complete(nioHandle, ResultCode.OK);
        }
    }

    private void watch(NioHandle nioHandle, SocketAction action)
    {
        if (nioHandle.action == action)
            return;
        nioHandle.action = action;
        listener.onSocketStateChanged(nioHandle.channel, action, nioHandle.token);
    }

    private void complete(NioHandle nioHandle, int resultCode)
    {
        if (nioHandle.state == State.DONE || nioHandle.state == State.IDLE)
            return;
        if (LOG.isDebugEnabled())
            LOG.debug("Completed {} with {}", nioHandle, ResultCode.toString(resultCode));
        pending.remove(nioHandle);
        disconnect(nioHandle);
        nioHandle.state = State.DONE;
        nioHandle.deadline = NO_DEADLINE;
        completions.add(new Completion(nioHandle, resultCode));
    }

    private void disconnect(NioHandle nioHandle)
    {
        SocketChannel channel = nioHandle.channel;
        if (channel == null)
            return;
        channels.remove(channel);
        if (nioHandle.action != null && listener != null)
            listener.onSocketStateChanged(channel, SocketAction.REMOVE, nioHandle.token);
        IO.close(channel);
        nioHandle.channel = null;
        nioHandle.token = null;
        nioHandle.action = null;
    }

    private void updateTimeout()
    {
        long deadline = NO_DEADLINE;
        for (NioHandle nioHandle : registered)
        {
            if (nioHandle.state != State.DONE)
                deadline = Math.min(deadline, nioHandle.deadline);
        }
        if (deadline == scheduledDeadline)
            return;
        scheduledDeadline = deadline;
        if (deadline == NO_DEADLINE)
            listener.onTimeoutRequested(-1);
        else
            listener.onTimeoutRequested(Math.max(1, deadline - now()));
    }

    private static long now()
    {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[registered=%d,pending=%d,sockets=%d]", getClass().getSimpleName(), hashCode(), registered.size(), pending.size(), channels.size());
    }

    private enum State
    {
        IDLE, PENDING, CONNECTING, SENDING, RECEIVING, DONE
    }

    private static class NioHandle implements Handle
    {
        private final NioTransportEngine engine;
        private Object attachment;
        private HandleOptions options;
        private State state = State.IDLE;
        private long deadline = NO_DEADLINE;
        private SocketChannel channel;
        private Object token;
        private SocketAction action;
        private ResponseParser parser;
        private ByteBuffer output;
        private ByteBuffer input;
        private boolean chunkedUpload;
        private boolean uploadComplete;
        private long uploaded;

        private NioHandle(NioTransportEngine engine)
        {
            this.engine = engine;
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

        private void reset()
        {
            state = State.IDLE;
            deadline = NO_DEADLINE;
            parser = null;
            output = null;
            input = null;
            chunkedUpload = false;
            uploadComplete = false;
            uploaded = 0;
        }

        @Override
        public String toString()
        {
            return String.format("%s@%x[%s,%s]", getClass().getSimpleName(), hashCode(), state, options);
        }
    }
}
