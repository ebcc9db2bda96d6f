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

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.SelectableChannel;
import java.nio.channels.Selector;
import java.util.List;

import org.eclipse.jetty.util.Fields;
import org.eclipse.jetty.util.IO;
import org.eclipse.jetty.util.UrlEncoded;
import org.skein.client.http.NioTransportEngine;
import org.skein.client.transport.HandleOptions;
import org.skein.client.transport.SocketAction;
import org.skein.client.transport.TransportEngine;
import org.skein.client.transport.TransportException;
import org.skein.io.ReadinessMultiplexer;
import org.skein.io.TimerSignal;
import org.skein.io.WakeupSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>{@link HttpClient} performs HTTP requests against a base URL using a fixed
 * number of connections, all driven by a single thread provided by the embedder.</p>
 * <p>Requests may be {@link #submit(String, String, HttpClientCallbacks, RequestContent, Fields, Fields, int) submitted}
 * from any thread. They are queued, then bound in submission order to free
 * connections, and their progress is reported to their {@link HttpClientCallbacks}.</p>
 * <p>{@link HttpClient} does not start threads to perform I/O. The embedder waits on
 * {@link #getSelector()} and calls {@link #processOneReadyEvent()} until it returns
 * false, typically:</p>
 * <pre>
 * HttpClient client = new HttpClient("http://localhost:8080", 4, 0);
 * client.get("/status", callbacks);
 * while (running)
 * {
 *     client.select(1000);
 *     while (client.processOneReadyEvent())
 *     {
 *     }
 * }
 * </pre>
 * <p>Except for the submit methods and {@link #getPendingCount()}, methods must be
 * called by the thread stepping the client; so are the callbacks.</p>
 */
public class HttpClient implements Closeable
{
    private static final Logger LOG = LoggerFactory.getLogger(HttpClient.class);

    private final ResponseNotifier notifier = new ResponseNotifier();
    private final RequestQueue queue = new RequestQueue();
    private final String baseUrl;
    private final TransportEngine engine;
    private final ReadinessMultiplexer multiplexer;
    private final WakeupSignal wakeup;
    private final TimerSignal timer;
    private final ConnectionPool pool;
    private int bufferSize = IO.bufferSize;
    private boolean tcpNoDelay;
    private boolean verbose;
    private volatile boolean closed;

    /**
     * <p>Creates a client performing plain HTTP/1.1 exchanges with a {@link NioTransportEngine}.</p>
     *
     * @param baseUrl the URL prepended to the resource of every request
     * @param maxConnections the number of requests performed in parallel
     * @param maxQueued must be 0: bounded request queues are not supported
     * @throws IOException if the selector or the signals cannot be created
     */
    public HttpClient(String baseUrl, int maxConnections, int maxQueued) throws IOException
    {
        this(baseUrl, maxConnections, maxQueued, new NioTransportEngine());
    }

    /**
     * @param baseUrl the URL prepended to the resource of every request
     * @param maxConnections the number of requests performed in parallel
     * @param maxQueued must be 0: bounded request queues are not supported
     * @param engine the engine performing the exchanges, owned by this client from now on
     * @throws IOException if the selector or the signals cannot be created
     * @throws IllegalArgumentException if {@code maxQueued} is positive or {@code maxConnections} is less than 1
     */
    public HttpClient(String baseUrl, int maxConnections, int maxQueued, TransportEngine engine) throws IOException
    {
        if (maxQueued > 0)
            throw new IllegalArgumentException("Bounded request queue not supported, maxQueued=" + maxQueued);
        if (maxConnections < 1)
            throw new IllegalArgumentException("Invalid maxConnections=" + maxConnections);

        this.baseUrl = baseUrl;
        this.engine = engine;

        ReadinessMultiplexer multiplexer = new ReadinessMultiplexer();
        WakeupSignal wakeup = null;
        TimerSignal timer = null;
        try
        {
            wakeup = new WakeupSignal();
            timer = new TimerSignal();
            multiplexer.register(wakeup.getChannel(), ReadinessMultiplexer.INPUT, this::onWakeup);
            multiplexer.register(timer.getChannel(), ReadinessMultiplexer.INPUT, this::onTimerFired);
        }
        catch (IOException | RuntimeException x)
        {
            IO.close(timer);
            IO.close(wakeup);
            multiplexer.close();
            throw x;
        }
        this.multiplexer = multiplexer;
        this.wakeup = wakeup;
        this.timer = timer;

        pool = new ConnectionPool(maxConnections, index -> new Connection(index, engine.newHandle()));
        engine.setListener(new EngineListener());

        // Give the engine a chance to schedule its housekeeping.
        driveTimeout();
    }

    public String getBaseURL()
    {
        return baseUrl;
    }

    /**
     * @return the size of the buffer used by the engine to read responses and uploads
     */
    public int getBufferSize()
    {
        return bufferSize;
    }

    /**
     * @param bufferSize the size of the buffer used by the engine, applied to the requests bound afterwards
     */
    public void setBufferSize(int bufferSize)
    {
        this.bufferSize = bufferSize;
    }

    public boolean isTcpNoDelay()
    {
        return tcpNoDelay;
    }

    /**
     * @param tcpNoDelay whether to disable Nagle's algorithm, applied to the requests bound afterwards
     */
    public void setTcpNoDelay(boolean tcpNoDelay)
    {
        this.tcpNoDelay = tcpNoDelay;
    }

    public boolean isVerbose()
    {
        return verbose;
    }

    /**
     * @param verbose whether the engine logs the exchanges, applied to the requests bound afterwards
     */
    public void setVerbose(boolean verbose)
    {
        this.verbose = verbose;
    }

    /**
     * <p>Queues a request.</p>
     * <p>If the request is accepted, its callbacks will be notified of its completion
     * exactly once, via {@link HttpClientCallbacks#onDone(HttpRequest, HttpClientError)}.</p>
     *
     * @param verb the HTTP method
     * @param resource the path appended to the base URL
     * @param callbacks the callbacks notified of the progress of the request
     * @param content the request content, or null
     * @param queryParams the query parameters, or null
     * @param headers the request headers, or null
     * @param timeout the timeout of the whole exchange in seconds, or -1 for no timeout
     * @return false if the request is rejected, because the client is closed or the URL is invalid
     */
    public boolean submit(String verb, String resource, HttpClientCallbacks callbacks, RequestContent content, Fields queryParams, Fields headers, int timeout)
    {
        if (closed)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Rejected {} {} on closed {}", verb, resource, this);
            return false;
        }

        String url = baseUrl + resource + toQueryString(queryParams);
        HttpRequest request;
        try
        {
            request = new HttpRequest(verb, url, callbacks, content, headers, timeout);
        }
        catch (IllegalArgumentException x)
        {
            LOG.info("Rejected {} {}: {}", verb, url, x.getMessage());
            return false;
        }

        if (!queue.offer(request))
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Rejected {} on closed {}", request, this);
            return false;
        }
        if (LOG.isDebugEnabled())
            LOG.debug("Queued {} for {}", request, this);
        wakeup.signal();
        return true;
    }

    private static String toQueryString(Fields queryParams)
    {
        if (queryParams == null || queryParams.isEmpty())
            return "";
        StringBuilder builder = new StringBuilder();
        for (Fields.Field field : queryParams)
        {
            for (String value : field.getValues())
            {
                builder.append(builder.length() == 0 ? '?' : '&');
                builder.append(UrlEncoded.encodeString(field.getName()));
                builder.append('=');
                builder.append(UrlEncoded.encodeString(value));
            }
        }
        return builder.toString();
    }

    public boolean get(String resource, HttpClientCallbacks callbacks)
    {
        return get(resource, callbacks, null, null, -1);
    }

    public boolean get(String resource, HttpClientCallbacks callbacks, Fields queryParams, Fields headers, int timeout)
    {
        return submit("GET", resource, callbacks, null, queryParams, headers, timeout);
    }

    public boolean head(String resource, HttpClientCallbacks callbacks, Fields queryParams, Fields headers, int timeout)
    {
        return submit("HEAD", resource, callbacks, null, queryParams, headers, timeout);
    }

    public boolean post(String resource, HttpClientCallbacks callbacks, RequestContent content, Fields queryParams, Fields headers, int timeout)
    {
        return submit("POST", resource, callbacks, content, queryParams, headers, timeout);
    }

    public boolean put(String resource, HttpClientCallbacks callbacks, RequestContent content, Fields queryParams, Fields headers, int timeout)
    {
        return submit("PUT", resource, callbacks, content, queryParams, headers, timeout);
    }

    public boolean delete(String resource, HttpClientCallbacks callbacks, Fields queryParams, Fields headers, int timeout)
    {
        return submit("DELETE", resource, callbacks, null, queryParams, headers, timeout);
    }

    /**
     * @return the number of requests waiting for a free connection
     */
    public int getPendingCount()
    {
        return queue.size();
    }

    /**
     * @return the number of connections bound to a request
     */
    public int getActiveCount()
    {
        return pool.getActiveCount();
    }

    /**
     * @return the number of free connections
     */
    public int getIdleCount()
    {
        return pool.getIdleCount();
    }

    public int getMaxConnectionCount()
    {
        return pool.getMaxConnectionCount();
    }

    /**
     * @return the selector the embedder waits on before calling {@link #processOneReadyEvent()}
     */
    public Selector getSelector()
    {
        return multiplexer.getSelector();
    }

    /**
     * <p>Blocks until there is an event to process or the timeout expires.</p>
     *
     * @param timeout the timeout in milliseconds, or 0 to wait indefinitely
     * @return the number of events waiting to be processed
     * @throws IOException if the selection fails
     */
    public int select(long timeout) throws IOException
    {
        return multiplexer.select(timeout);
    }

    /**
     * <p>Processes one ready event: a wakeup, a timer expiration or a ready socket.</p>
     *
     * @return whether an event was processed
     * @throws IOException if the selection fails
     */
    public boolean processOneReadyEvent() throws IOException
    {
        if (closed)
            return false;
        return multiplexer.processOne();
    }

    private void onWakeup(SelectableChannel channel, int readiness)
    {
        try
        {
            wakeup.drain();
        }
        catch (IOException x)
        {
            LOG.warn("Could not drain {}", wakeup, x);
        }

        int available = pool.getIdleCount();
        if (available == 0)
            return;
        List<HttpRequest> requests = queue.poll(available);
        for (HttpRequest request : requests)
        {
            Connection connection = pool.acquire();
            if (connection == null)
            {
                LOG.warn("No free connection for {} in {}", request, pool);
                notifier.notifyDone(request, HttpClientError.UNKNOWN);
                continue;
            }
            dispatch(connection, request);
        }
    }

    private void dispatch(Connection connection, HttpRequest request)
    {
        connection.bind(request);
        HandleOptions options = connection.configure(new HandleOptions()
            .bufferSize(bufferSize)
            .tcpNoDelay(tcpNoDelay)
            .verbose(verbose));
        if (LOG.isDebugEnabled())
            LOG.debug("Dispatching {} on {}", request, connection);
        try
        {
            engine.configureHandle(connection.getHandle(), options);
            engine.registerHandleForExecution(connection.getHandle());
        }
        catch (TransportException | IllegalStateException x)
        {
            LOG.warn("Could not execute {} on {}", request, connection, x);
            complete(connection, HttpClientError.UNKNOWN, false);
        }
    }

    private void onTimerFired(SelectableChannel channel, int readiness)
    {
        try
        {
            timer.drain();
        }
        catch (IOException x)
        {
            LOG.warn("Could not drain {}", timer, x);
        }
        driveTimeout();
    }

    private void onSocketReady(SelectableChannel channel, int readiness)
    {
        int running = engine.driveOnSocketReady(channel, readiness);
        if (LOG.isDebugEnabled())
            LOG.debug("Socket {} ready {}, {} running", channel, readiness, running);
        processCompletions();
    }

    private void driveTimeout()
    {
        int running = engine.driveOnTimeout();
        if (LOG.isDebugEnabled())
            LOG.debug("Timeout driven, {} running", running);
        processCompletions();
    }

    private void processCompletions()
    {
        for (TransportEngine.Completion completion : engine.pollCompletedHandles())
        {
            onHandleCompleted(completion.getHandle(), completion.getResultCode());
        }
    }

    private void onHandleCompleted(TransportEngine.Handle handle, int resultCode)
    {
        Object attachment = handle.getAttachment();
        if (!(attachment instanceof Connection) || !pool.isActive((Connection)attachment))
        {
            LOG.warn("Completed handle {} is not bound to a connection of {}", handle, pool);
            engine.unregisterHandle(handle);
            return;
        }
        Connection connection = (Connection)attachment;
        HttpClientError error = connection.isProtocolError() ? HttpClientError.PROTOCOL_ERROR : HttpClientError.fromResultCode(resultCode);
        complete(connection, error, true);
    }

    private void complete(Connection connection, HttpClientError error, boolean registered)
    {
        HttpRequest request = connection.getRequest();
        if (LOG.isDebugEnabled())
            LOG.debug("Completed {} with {} on {}", request, error, connection);
        notifier.notifyDone(request, error);
        if (registered && !engine.unregisterHandle(connection.getHandle()))
            LOG.warn("Could not unregister the handle of {}, forcing release", connection);
        pool.release(connection);
        // A queued request may now use the free connection.
        wakeup.signal();
    }

    /**
     * <p>Closes this client.</p>
     * <p>Requests in flight and queued requests are completed with {@link HttpClientError#UNKNOWN};
     * requests submitted afterwards are rejected.</p>
     */
    @Override
    public void close()
    {
        if (closed)
            return;
        closed = true;

        for (int i = 0; i < pool.getMaxConnectionCount(); ++i)
        {
            Connection connection = pool.getConnection(i);
            if (pool.isActive(connection))
                complete(connection, HttpClientError.UNKNOWN, true);
        }
        for (HttpRequest request : queue.close())
        {
            notifier.notifyDone(request, HttpClientError.UNKNOWN);
        }

        engine.close();
        timer.close();
        wakeup.close();
        multiplexer.close();
        if (LOG.isDebugEnabled())
            LOG.debug("Closed {}", this);
    }

    public boolean isClosed()
    {
        return closed;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s,queued=%d,%s]", getClass().getSimpleName(), hashCode(), baseUrl, queue.size(), pool);
    }

    private class EngineListener implements TransportEngine.Listener
    {
        @Override
        public void onSocketStateChanged(SelectableChannel channel, SocketAction action, Object token)
        {
            if (action == SocketAction.REMOVE)
            {
                multiplexer.unregister(channel);
                return;
            }
            try
            {
                if (token == null)
                {
                    multiplexer.register(channel, action.getInterest(), HttpClient.this::onSocketReady);
                    engine.assign(channel, HttpClient.this);
                }
                else
                {
                    multiplexer.modify(channel, action.getInterest());
                }
            }
            catch (IOException | IllegalStateException x)
            {
                LOG.warn("Could not watch {} for {}", channel, action, x);
            }
        }

        @Override
        public void onTimeoutRequested(long delay)
        {
            if (delay < -1)
            {
                LOG.warn("Invalid timeout request {}, cancelling timer", delay);
                delay = -1;
            }
            if (delay < 0)
            {
                timer.cancel();
            }
            else if (delay == 0)
            {
                timer.cancel();
                driveTimeout();
            }
            else
            {
                timer.arm(delay);
            }
        }
    }
}
