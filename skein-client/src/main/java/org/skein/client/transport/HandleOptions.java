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

import java.net.URI;

import org.eclipse.jetty.util.Fields;
import org.eclipse.jetty.util.IO;

/**
 * <p>The configuration of one exchange performed by a {@link TransportEngine.Handle}.</p>
 * <p>An empty header value asks the engine to remove the header it would otherwise send.</p>
 */
public class HandleOptions
{
    private URI uri;
    private String customMethod;
    private Fields headers = new Fields();
    private boolean noBody;
    private boolean upload;
    private long uploadSize = -1;
    private byte[] postFields;
    private int timeoutSeconds = -1;
    private int bufferSize = IO.bufferSize;
    private boolean tcpNoDelay;
    private boolean verbose;
    private HandleListener listener;

    public URI getURI()
    {
        return uri;
    }

    public HandleOptions uri(URI uri)
    {
        this.uri = uri;
        return this;
    }

    /**
     * @return the method to send, either the custom one or the one implied by the other options
     */
    public String getMethod()
    {
        if (customMethod != null)
            return customMethod;
        if (noBody)
            return "HEAD";
        if (postFields != null)
            return "POST";
        if (upload)
            return "PUT";
        return "GET";
    }

    public HandleOptions customMethod(String method)
    {
        this.customMethod = method;
        return this;
    }

    public Fields getHeaders()
    {
        return headers;
    }

    public HandleOptions headers(Fields headers)
    {
        this.headers = headers;
        return this;
    }

    /**
     * @return whether the response has no content, as for HEAD requests
     */
    public boolean isNoBody()
    {
        return noBody;
    }

    public HandleOptions noBody(boolean noBody)
    {
        this.noBody = noBody;
        return this;
    }

    /**
     * @return whether the request content is pulled from {@link HandleListener#onUpload(java.nio.ByteBuffer)}
     */
    public boolean isUpload()
    {
        return upload;
    }

    public HandleOptions upload(boolean upload)
    {
        this.upload = upload;
        return this;
    }

    public long getUploadSize()
    {
        return uploadSize;
    }

    public HandleOptions uploadSize(long uploadSize)
    {
        this.uploadSize = uploadSize;
        return this;
    }

    /**
     * @return the fixed request content sent by POST, or null
     */
    public byte[] getPostFields()
    {
        return postFields;
    }

    public HandleOptions postFields(byte[] postFields)
    {
        this.postFields = postFields;
        return this;
    }

    /**
     * @return the maximum duration of the whole exchange in seconds, or -1 for no limit
     */
    public int getTimeoutSeconds()
    {
        return timeoutSeconds;
    }

    public HandleOptions timeoutSeconds(int timeoutSeconds)
    {
        this.timeoutSeconds = timeoutSeconds;
        return this;
    }

    public int getBufferSize()
    {
        return bufferSize;
    }

    public HandleOptions bufferSize(int bufferSize)
    {
        this.bufferSize = bufferSize;
        return this;
    }

    public boolean isTcpNoDelay()
    {
        return tcpNoDelay;
    }

    public HandleOptions tcpNoDelay(boolean tcpNoDelay)
    {
        this.tcpNoDelay = tcpNoDelay;
        return this;
    }

    public boolean isVerbose()
    {
        return verbose;
    }

    public HandleOptions verbose(boolean verbose)
    {
        this.verbose = verbose;
        return this;
    }

    public HandleListener getListener()
    {
        return listener;
    }

    public HandleOptions listener(HandleListener listener)
    {
        this.listener = listener;
        return this;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s %s]", getClass().getSimpleName(), hashCode(), getMethod(), uri);
    }
}
