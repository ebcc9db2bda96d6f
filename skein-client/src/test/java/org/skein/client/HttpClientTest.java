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

import java.nio.ByteBuffer;
import java.nio.channels.Pipe;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.jetty.util.Fields;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.skein.client.FakeTransportEngine.FakeHandle;
import org.skein.client.transport.HandleOptions;
import org.skein.client.transport.ResultCode;
import org.skein.client.transport.SocketAction;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HttpClientTest
{
    private final FakeTransportEngine engine = new FakeTransportEngine();
    private final RecordingCallbacks callbacks = new RecordingCallbacks();
    private HttpClient client;

    @AfterEach
    public void dispose()
    {
        if (client != null)
            client.close();
    }

    private void start(int maxConnections) throws Exception
    {
        client = new HttpClient("http://localhost:8080", maxConnections, 0, engine);
    }

    private void step() throws Exception
    {
        while (client.processOneReadyEvent())
        {
        }
    }

    private List<String> executedPaths()
    {
        List<String> result = new ArrayList<>();
        for (FakeHandle handle : engine.executed)
        {
            result.add(handle.getOptions().getURI().getPath());
        }
        return result;
    }

    @Test
    public void testBoundedQueueIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new HttpClient("http://localhost", 2, 5, engine));
        assertThat(engine.listener, nullValue());
        assertThat(engine.handles, empty());
        assertThat(engine.timeoutDrives, is(0));
    }

    @Test
    public void testInvalidMaxConnections()
    {
        assertThrows(IllegalArgumentException.class, () -> new HttpClient("http://localhost", 0, 0, engine));
        assertThat(engine.handles, empty());
    }

    @Test
    public void testConstruction() throws Exception
    {
        start(3);

        assertThat(engine.handles, hasSize(3));
        assertThat(engine.listener, notNullValue());
        assertThat(engine.timeoutDrives, is(1));
        assertThat(client.getIdleCount(), is(3));
        assertThat(client.getActiveCount(), is(0));
        assertThat(client.getSelector(), notNullValue());
    }

    @Test
    public void testRequestsBeyondCapacityWaitInOrder() throws Exception
    {
        start(2);
        for (int i = 0; i < 5; ++i)
        {
            assertTrue(client.get("/" + i, callbacks));
        }
        assertThat(client.getPendingCount(), is(5));

        step();
        assertThat(executedPaths(), contains("/0", "/1"));
        assertThat(client.getActiveCount(), is(2));
        assertThat(client.getPendingCount(), is(3));

        while (!engine.registered.isEmpty())
        {
            engine.complete(engine.registered.get(0), ResultCode.OK);
            step();
            assertThat(engine.registered.size() <= 2, is(true));
        }

        assertThat(executedPaths(), contains("/0", "/1", "/2", "/3", "/4"));
        assertThat(callbacks.getCompletedResources(), contains("/0", "/1", "/2", "/3", "/4"));
        assertThat(callbacks.errors, everyItem(is(HttpClientError.NONE)));
        assertThat(client.getIdleCount(), is(2));
        assertThat(client.getPendingCount(), is(0));
    }

    @Test
    public void testFreedConnectionIsReusedFirst() throws Exception
    {
        start(3);
        client.get("/a", callbacks);
        client.get("/b", callbacks);
        step();
        FakeHandle second = engine.lastExecuted();

        engine.complete(second, ResultCode.OK);
        step();
        client.get("/c", callbacks);
        step();

        assertThat(engine.lastExecuted(), sameInstance(second));
        assertThat(executedPaths(), contains("/a", "/b", "/c"));
    }

    @Test
    public void testSubmitBuildsURL() throws Exception
    {
        start(1);
        Fields query = new Fields();
        query.add("q", "a b");
        query.add("n", "1");
        Fields headers = new Fields();
        headers.add("Accept", "text/plain");
        assertTrue(client.submit("GET", "/search", callbacks, null, query, headers, 7));
        step();

        HandleOptions options = engine.lastExecuted().getOptions();
        assertThat(options.getURI().toString(), is("http://localhost:8080/search?q=a+b&n=1"));
        assertThat(options.getHeaders().get("Accept").getValue(), is("text/plain"));
        assertThat(options.getTimeoutSeconds(), is(7));
    }

    @Test
    public void testInvalidURLIsRejected() throws Exception
    {
        start(1);
        assertFalse(client.get("/a path", callbacks));
        assertThat(client.getPendingCount(), is(0));
        step();
        assertThat(engine.executed, empty());
        assertThat(callbacks.completed, empty());
    }

    @Test
    public void testSettingsApplyToNextRequests() throws Exception
    {
        start(1);
        client.setVerbose(true);
        client.setTcpNoDelay(true);
        client.setBufferSize(1024);
        client.get("/", callbacks);
        step();

        HandleOptions options = engine.lastExecuted().getOptions();
        assertTrue(options.isVerbose());
        assertTrue(options.isTcpNoDelay());
        assertThat(options.getBufferSize(), is(1024));
    }

    @Test
    public void testResponseNotifications() throws Exception
    {
        start(1);
        client.get("/", callbacks);
        step();
        FakeHandle handle = engine.lastExecuted();

        assertTrue(handle.receive("HTTP/1.1 200 OK\r\n", "Content-Type: text/plain\r\n", "\r\n"));
        handle.getOptions().getListener().onContent(ByteBuffer.wrap(new byte[]{'h', 'i'}));
        engine.complete(handle, ResultCode.OK);
        step();

        assertThat(callbacks.statuses, contains(200));
        assertThat(callbacks.headers, contains("Content-Type: text/plain\r\n", "\r\n"));
        assertThat(callbacks.getContentAsString(), is("hi"));
        assertThat(callbacks.errors, contains(HttpClientError.NONE));
        assertThat(engine.unregistered, contains(handle));
    }

    @Test
    public void testProtocolErrorDoesNotAffectOtherRequests() throws Exception
    {
        start(2);
        RecordingCallbacks broken = new RecordingCallbacks();
        client.get("/broken", broken);
        client.get("/fine", callbacks);
        step();
        FakeHandle first = engine.executed.get(0);
        FakeHandle second = engine.executed.get(1);

        assertFalse(first.receive("HTTP/1.1\r\n"));
        engine.complete(first, ResultCode.WRITE_ERROR);
        assertTrue(second.receive("HTTP/1.1 204 No Content\r\n", "\r\n"));
        engine.complete(second, ResultCode.OK);
        step();

        assertThat(broken.errors, contains(HttpClientError.PROTOCOL_ERROR));
        assertThat(broken.statuses, empty());
        assertThat(callbacks.errors, contains(HttpClientError.NONE));
        assertThat(callbacks.statuses, contains(204));

        // The flag does not survive the release.
        client.get("/again", callbacks);
        step();
        engine.complete(engine.lastExecuted(), ResultCode.OK);
        assertThat(callbacks.errors, contains(HttpClientError.NONE, HttpClientError.NONE));
    }

    @Test
    public void testTransportErrorsAreTranslated() throws Exception
    {
        start(3);
        RecordingCallbacks timeout = new RecordingCallbacks();
        RecordingCallbacks unresolved = new RecordingCallbacks();
        RecordingCallbacks weird = new RecordingCallbacks();
        client.get("/timeout", timeout);
        client.get("/unresolved", unresolved);
        client.get("/weird", weird);
        step();

        engine.complete(engine.executed.get(0), ResultCode.OPERATION_TIMEDOUT);
        engine.complete(engine.executed.get(1), ResultCode.COULDNT_RESOLVE_HOST);
        engine.complete(engine.executed.get(2), ResultCode.WEIRD_SERVER_REPLY);

        assertThat(timeout.errors, contains(HttpClientError.TIMEOUT));
        assertThat(unresolved.errors, contains(HttpClientError.HOST_NOT_FOUND));
        assertThat(weird.errors, contains(HttpClientError.UNKNOWN));
        assertThat(client.getIdleCount(), is(3));
    }

    @Test
    public void testUnregisterFailureStillReleases() throws Exception
    {
        start(1);
        engine.failUnregister = true;
        client.get("/1", callbacks);
        client.get("/2", callbacks);
        step();

        engine.complete(engine.lastExecuted(), ResultCode.OK);
        assertThat(callbacks.errors, hasSize(1));
        assertThat(client.getIdleCount(), is(1));

        step();
        assertThat(executedPaths(), contains("/1", "/2"));
    }

    @Test
    public void testRegistrationFailureCompletesRequest() throws Exception
    {
        start(1);
        engine.failRegister = true;
        client.get("/1", callbacks);
        client.get("/2", callbacks);
        step();

        assertThat(callbacks.getCompletedResources(), contains("/1", "/2"));
        assertThat(callbacks.errors, contains(HttpClientError.UNKNOWN, HttpClientError.UNKNOWN));
        assertThat(client.getIdleCount(), is(1));
        assertThat(client.getPendingCount(), is(0));
    }

    @Test
    public void testCompletionOfUnboundHandleIsIgnored() throws Exception
    {
        start(1);
        engine.complete(engine.handles.get(0), ResultCode.OK);

        assertThat(callbacks.completed, empty());
        assertThat(client.getIdleCount(), is(1));
    }

    @Test
    public void testSocketWatching() throws Exception
    {
        start(1);
        Pipe pipe = Pipe.open();
        try
        {
            pipe.source().configureBlocking(false);

            engine.watch(pipe.source(), SocketAction.IN);
            assertThat(engine.tokens.get(pipe.source()), notNullValue());

            pipe.sink().write(ByteBuffer.wrap(new byte[]{1}));
            client.select(1000);
            step();
            assertThat(engine.readyChannels, contains(pipe.source()));

            engine.watch(pipe.source(), SocketAction.NONE);
            pipe.sink().write(ByteBuffer.wrap(new byte[]{1}));
            step();
            assertThat(engine.readyChannels, hasSize(1));

            engine.watch(pipe.source(), SocketAction.IN);
            step();
            assertThat(engine.readyChannels, hasSize(2));

            engine.watch(pipe.source(), SocketAction.REMOVE);
            pipe.sink().write(ByteBuffer.wrap(new byte[]{1}));
            step();
            assertThat(engine.readyChannels, hasSize(2));
        }
        finally
        {
            pipe.sink().close();
            pipe.source().close();
        }
    }

    @Test
    public void testCloseCompletesEveryRequest() throws Exception
    {
        start(1);
        client.get("/1", callbacks);
        client.get("/2", callbacks);
        client.get("/3", callbacks);
        step();

        client.close();

        assertThat(callbacks.getCompletedResources(), contains("/1", "/2", "/3"));
        assertThat(callbacks.errors, everyItem(is(HttpClientError.UNKNOWN)));
        assertTrue(engine.closed);
        assertTrue(client.isClosed());
        assertFalse(client.get("/4", callbacks));
        assertFalse(client.processOneReadyEvent());
    }

    @Test
    public void testSubmitsRacingCloseAreCompletedOrRejected() throws Exception
    {
        start(2);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger done = new AtomicInteger();
        CountDownLatch submitting = new CountDownLatch(4);
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; ++t)
        {
            Thread thread = new Thread(() ->
            {
                submitting.countDown();
                for (int i = 0; i < 2000; ++i)
                {
                    if (client.get("/" + i, (request, error) -> done.incrementAndGet()))
                        accepted.incrementAndGet();
                }
            });
            threads.add(thread);
            thread.start();
        }

        assertTrue(submitting.await(5, TimeUnit.SECONDS));
        client.close();
        for (Thread thread : threads)
        {
            thread.join();
        }

        assertThat(done.get(), is(accepted.get()));
        assertFalse(client.get("/late", callbacks));
    }

    @Test
    public void testCallbackFailureDoesNotBreakClient() throws Exception
    {
        start(1);
        List<HttpClientError> errors = new ArrayList<>();
        client.get("/1", (request, error) ->
        {
            errors.add(error);
            throw new IllegalStateException("explicitly_thrown_by_test");
        });
        client.get("/2", callbacks);
        step();
        engine.complete(engine.lastExecuted(), ResultCode.OK);
        step();
        engine.complete(engine.lastExecuted(), ResultCode.OK);

        assertThat(errors, contains(HttpClientError.NONE));
        assertThat(callbacks.errors, contains(HttpClientError.NONE));
    }
}
