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

package org.skein.client.transport;

import java.io.Closeable;
import java.nio.channels.SelectableChannel;
import java.util.List;

/**
 * <p>The engine that performs HTTP exchanges on behalf of a coordinator, driven by
 * socket readiness rather than by threads.</p>
 * <p>The coordinator creates {@link Handle}s once, then repeatedly
 * {@link #configureHandle(Handle, HandleOptions) configures} and
 * {@link #registerHandleForExecution(Handle) registers} them. While handles run,
 * the engine tells its {@link Listener} which sockets to watch and when to call
 * {@link #driveOnTimeout()}; the coordinator calls {@link #driveOnSocketReady(SelectableChannel, int)}
 * when a watched socket is ready, and collects finished handles with
 * {@link #pollCompletedHandles()}.</p>
 * <p>Implementations are not thread safe: all methods are called by the thread
 * driving the coordinator, and listener methods are invoked from within the engine
 * methods on that same thread.</p>
 */
public interface TransportEngine extends Closeable
{
    /**
     * @param listener the listener notified of socket and timeout requests
     */
    void setListener(Listener listener);

    /**
     * @return a new idle handle, reusable for any number of exchanges
     */
    Handle newHandle();

    /**
     * <p>Replaces the options of an idle handle.</p>
     *
     * @param handle the handle to configure
     * @param options the options of the next exchange
     * @throws IllegalStateException if the handle is registered
     */
    void configureHandle(Handle handle, HandleOptions options);

    /**
     * <p>Starts the exchange configured on the given handle.</p>
     *
     * @param handle a configured handle
     * @throws TransportException if the handle is already registered or is not configured
     */
    void registerHandleForExecution(Handle handle) throws TransportException;

    /**
     * <p>Removes a handle, aborting its exchange if it has not completed yet.</p>
     *
     * @param handle the handle to remove
     * @return false if the handle was not registered
     */
    boolean unregisterHandle(Handle handle);

    /**
     * <p>Associates an opaque token with a socket, passed back in
     * {@link Listener#onSocketStateChanged(SelectableChannel, SocketAction, Object)}.</p>
     *
     * @param channel the socket
     * @param token the token
     */
    void assign(SelectableChannel channel, Object token);

    /**
     * <p>Performs the work that is possible now that a socket is ready.</p>
     *
     * @param channel the ready socket
     * @param readiness the {@link org.skein.io.ReadinessMultiplexer} readiness flags
     * @return the number of handles still running
     */
    int driveOnSocketReady(SelectableChannel channel, int readiness);

    /**
     * <p>Performs the time based work: starting handles, expiring timed out handles.</p>
     *
     * @return the number of handles still running
     */
    int driveOnTimeout();

    /**
     * @return the handles completed since the last call, in completion order
     */
    List<Completion> pollCompletedHandles();

    /**
     * <p>Closes the engine and any socket it still has open.</p>
     */
    @Override
    void close();

    /**
     * <p>One unit of work of the engine: a single request/response exchange at a time.</p>
     */
    interface Handle
    {
        /**
         * @return the object attached by the handle owner
         */
        Object getAttachment();

        /**
         * @param attachment an object the handle owner wants to retrieve from the handle
         */
        void setAttachment(Object attachment);
    }

    /**
     * <p>The outcome of a handle.</p>
     */
    class Completion
    {
        private final Handle handle;
        private final int resultCode;

        public Completion(Handle handle, int resultCode)
        {
            this.handle = handle;
            this.resultCode = resultCode;
        }

        public Handle getHandle()
        {
            return handle;
        }

        /**
         * @return one of the {@link ResultCode} constants, or an engine specific code
         */
        public int getResultCode()
        {
            return resultCode;
        }

        @Override
        public String toString()
        {
            return String.format("%s[%s,%s]", getClass().getSimpleName(), handle, ResultCode.toString(resultCode));
        }
    }

    /**
     * <p>Receives the requests of the engine to its embedder.</p>
     */
    interface Listener
    {
        /**
         * <p>Callback method invoked when the engine wants a socket watched differently.</p>
         *
         * @param channel the socket
         * @param action what to watch, or {@link SocketAction#REMOVE}
         * @param token the token previously {@link #assign(SelectableChannel, Object) assigned}
         * to the socket, or null if none was assigned yet
         */
        void onSocketStateChanged(SelectableChannel channel, SocketAction action, Object token);

        /**
         * <p>Callback method invoked when the engine wants {@link #driveOnTimeout()}
         * to be called after the given delay.</p>
         *
         * @param delay the delay in milliseconds, 0 to be driven immediately,
         * or -1 to cancel the pending request
         */
        void onTimeoutRequested(long delay);
    }
}
