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

import java.net.URI;
import java.util.Objects;

import org.eclipse.jetty.util.Fields;

/**
 * <p>A request submitted to an {@link HttpClient}.</p>
 * <p>Instances are immutable and are passed back to the {@link HttpClientCallbacks}.</p>
 */
public class HttpRequest
{
    private final String verb;
    private final String url;
    private final URI uri;
    private final HttpClientCallbacks callbacks;
    private final RequestContent content;
    private final Fields headers;
    private final int timeout;

    /**
     * @throws IllegalArgumentException if the URL is not a valid URI
     */
    public HttpRequest(String verb, String url, HttpClientCallbacks callbacks, RequestContent content, Fields headers, int timeout)
    {
        this.verb = Objects.requireNonNull(verb);
        this.url = Objects.requireNonNull(url);
        this.uri = URI.create(url);
        this.callbacks = Objects.requireNonNull(callbacks);
        this.content = content == null ? RequestContent.EMPTY : content;
        this.headers = new Fields(headers == null ? new Fields() : headers, true);
        this.timeout = timeout;
    }

    public String getVerb()
    {
        return verb;
    }

    /**
     * @return the absolute URL, query string included
     */
    public String getURL()
    {
        return url;
    }

    public URI getURI()
    {
        return uri;
    }

    public HttpClientCallbacks getCallbacks()
    {
        return callbacks;
    }

    public RequestContent getContent()
    {
        return content;
    }

    /**
     * @return the caller supplied headers, not modifiable
     */
    public Fields getHeaders()
    {
        return headers;
    }

    /**
     * @return the timeout of the whole exchange in seconds, or -1 for no timeout
     */
    public int getTimeout()
    {
        return timeout;
    }

    @Override
    public String toString()
    {
        return String.format("%s[%s %s]@%x", getClass().getSimpleName(), verb, url, hashCode());
    }
}
