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

import org.eclipse.jetty.util.Fields;
import org.skein.client.transport.HandleListener;
import org.skein.client.transport.HandleOptions;
import org.skein.client.transport.TransportEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A reusable slot of a {@link ConnectionPool} that carries one request at a time.</p>
 * <p>A connection owns a transport engine handle for its whole life. While bound to
 * a request, it configures the handle for that request and translates the events of
 * the handle into {@link HttpClientCallbacks} notifications:</p>
 * <ul>
 * <li>interim {@code 100} responses are swallowed, up to and including their blank line;</li>
 * <li>status lines are split into version and status code for
 * {@link HttpClientCallbacks#onResponseStart(HttpRequest, String, int)};</li>
 * <li>every other header line, blank terminator included, is passed verbatim.</li>
 * </ul>
 * <p>A status line that cannot be split aborts the exchange; the request is then
 * completed with {@link HttpClientError#PROTOCOL_ERROR}.</p>
 */
public class Connection implements HandleListener
{
    private static final Logger LOG = LoggerFactory.getLogger(Connection.class);

    private final ResponseNotifier notifier = new ResponseNotifier();
    private final int index;
    private final TransportEngine.Handle handle;
    private HttpRequest request;
    private int uploadOffset;
    private boolean afterContinue;
    private boolean protocolError;

    public Connection(int index, TransportEngine.Handle handle)
    {
        this.index = index;
        this.handle = handle;
        handle.setAttachment(this);
    }

    /**
     * @return the position of this connection in its pool
     */
    public int getIndex()
    {
        return index;
    }

    public TransportEngine.Handle getHandle()
    {
        return handle;
    }

    /**
     * @return the request this connection is bound to, or null if it is free
     */
    public HttpRequest getRequest()
    {
        return request;
    }

    public int getUploadOffset()
    {
        return uploadOffset;
    }

    /**
     * @return whether a malformed status line aborted the current exchange
     */
    public boolean isProtocolError()
    {
        return protocolError;
    }

    void bind(HttpRequest request)
    {
        if (this.request != null)
            throw new IllegalStateException(this + " already bound");
        this.request = request;
    }

    void clear()
    {
        request = null;
        uploadOffset = 0;
        afterContinue = false;
        protocolError = false;
    }

    /**
     * <p>Fills the given options with the settings of the bound request.</p>
     * <p>Requests with content get their framing headers replaced, whatever the
     * caller asked for: exact {@code Content-Length}, no {@code Transfer-Encoding},
     * the content type and no {@code Expect}.</p>
     *
     * @param options the options holding the client wide settings
     * @return the given options
     */
    HandleOptions configure(HandleOptions options)
    {
        HttpRequest request = this.request;
        RequestContent content = request.getContent();
        Fields headers = new Fields();
        for (Fields.Field field : request.getHeaders())
        {
            headers.put(field);
        }
        String verb = request.getVerb();

        options.uri(request.getURI())
            .customMethod(verb)
            .timeoutSeconds(request.getTimeout())
            .listener(this);

        switch (verb)
        {
            case "GET":
                break;
            case "HEAD":
                options.noBody(true);
                break;
            case "PUT":
                options.upload(true).uploadSize(content.getLength());
                addContentHeaders(headers, content);
                break;
            case "POST":
                options.postFields(content.getBody());
                addContentHeaders(headers, content);
                break;
            default:
                if (content.getLength() > 0)
                {
                    options.upload(true).uploadSize(content.getLength());
                    addContentHeaders(headers, content);
                }
                break;
        }

        options.headers(headers);
        if (LOG.isDebugEnabled())
            LOG.debug("Configured {} with {}", this, options);
        return options;
    }

    private static void addContentHeaders(Fields headers, RequestContent content)
    {
        headers.put("Content-Length", String.valueOf(content.getLength()));
        headers.put("Transfer-Encoding", "");
        headers.put("Content-Type", content.getContentType());
        headers.put("Expect", "");
    }

    @Override
    public boolean onHeaderLine(String line)
    {
        HttpRequest request = this.request;
        if (request == null)
        {
            LOG.warn("Header line on free {}", this);
            return false;
        }
        if (protocolError)
            return false;

        if (isInterimStatusLine(line))
        {
            afterContinue = true;
            return true;
        }

        if (afterContinue)
        {
            if (isBlank(line))
                afterContinue = false;
            return true;
        }

        if (line.startsWith("HTTP/"))
        {
            int space = line.indexOf(' ');
            if (space < 0)
                return malformed(line);
            String version = line.substring(0, space);
            int next = line.indexOf(' ', space + 1);
            if (next < 0)
                return malformed(line);
            int status;
            try
            {
                status = Integer.parseInt(line.substring(space + 1, next));
            }
            catch (NumberFormatException x)
            {
                return malformed(line);
            }
            notifier.notifyResponseStart(request, version, status);
        }
        else
        {
            notifier.notifyHeader(request, line);
        }
        return true;
    }

    private boolean malformed(String line)
    {
        if (LOG.isDebugEnabled())
            LOG.debug("Malformed status line '{}' on {}", line.trim(), this);
        protocolError = true;
        return false;
    }

    private static boolean isInterimStatusLine(String line)
    {
        if (!line.startsWith("HTTP/"))
            return false;
        int space = line.indexOf(' ');
        if (space < 0 || !line.startsWith("100", space + 1))
            return false;
        int end = space + 4;
        return end == line.length() || !Character.isDigit(line.charAt(end));
    }

    private static boolean isBlank(String line)
    {
        return "\r\n".equals(line) || "\n".equals(line);
    }

    @Override
    public void onContent(ByteBuffer content)
    {
        HttpRequest request = this.request;
        if (request == null)
        {
            LOG.warn("Content on free {}", this);
            return;
        }
        notifier.notifyData(request, content);
    }

    @Override
    public int onUpload(ByteBuffer buffer)
    {
        HttpRequest request = this.request;
        if (request == null)
        {
            LOG.warn("Upload on free {}", this);
            return 0;
        }
        RequestContent content = request.getContent();
        int length = Math.min(content.getLength() - uploadOffset, buffer.remaining());
        content.put(buffer, uploadOffset, length);
        uploadOffset += length;
        return length;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[#%d,%s]", getClass().getSimpleName(), hashCode(), index, request);
    }
}
