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

import java.nio.ByteBuffer;
import java.util.Locale;

import org.skein.client.transport.HandleListener;
import org.skein.client.transport.ResultCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>An incremental HTTP/1.1 response parser.</p>
 * <p>Header lines, status lines and blank terminators included, are passed to the
 * {@link HandleListener} verbatim with their line terminator. Interim {@code 1xx}
 * responses other than {@code 101} are followed by the final response. Content is
 * delimited by {@code Content-Length}, by chunked transfer coding or by the end of
 * the stream, and delivered without framing.</p>
 */
class ResponseParser
{
    private static final Logger LOG = LoggerFactory.getLogger(ResponseParser.class);
    private static final int MAX_LINE_LENGTH = 8 * 1024;

    enum State
    {
        STATUS,
        HEADER,
        CONTENT,
        CHUNK_SIZE,
        CHUNK_CONTENT,
        CHUNK_END,
        TRAILER,
        EOF_CONTENT,
        END
    }

    private final StringBuilder line = new StringBuilder();
    private final HandleListener listener;
    private final boolean noBody;
    private final boolean verbose;
    private State state = State.STATUS;
    private int status;
    private long contentLength;
    private boolean chunked;
    private long remaining;

    /**
     * @param listener the listener notified of header lines and content
     * @param noBody whether the response has no content whatever its headers say
     * @param verbose whether to log the header lines
     */
    ResponseParser(HandleListener listener, boolean noBody, boolean verbose)
    {
        this.listener = listener;
        this.noBody = noBody;
        this.verbose = verbose;
    }

    State getState()
    {
        return state;
    }

    /**
     * @return the status code of the response being parsed, or 0
     */
    int getStatus()
    {
        return status;
    }

    /**
     * @param buffer the bytes received
     * @return whether the response is complete; remaining bytes are left in the buffer
     * @throws ExchangeFailure if the response is malformed or the listener rejects a line
     */
    boolean parse(ByteBuffer buffer) throws ExchangeFailure
    {
        while (buffer.hasRemaining() && state != State.END)
        {
            switch (state)
            {
                case CONTENT:
                case CHUNK_CONTENT:
                case EOF_CONTENT:
                    parseContent(buffer);
                    break;
                default:
                    String next = readLine(buffer);
                    if (next == null)
                        return false;
                    parseLine(next);
                    break;
            }
        }
        return state == State.END;
    }

    /**
     * <p>Signals that the server closed the connection.</p>
     *
     * @throws ExchangeFailure if the response is not complete
     */
    void atEOF() throws ExchangeFailure
    {
        if (state == State.EOF_CONTENT)
            state = State.END;
        if (state != State.END)
            throw new ExchangeFailure(ResultCode.RECV_ERROR, "Early EOF in " + state);
    }

    private String readLine(ByteBuffer buffer) throws ExchangeFailure
    {
        while (buffer.hasRemaining())
        {
            byte b = buffer.get();
            line.append((char)(b & 0xFF));
            if (b == '\n')
            {
                String result = line.toString();
                line.setLength(0);
                return result;
            }
            if (line.length() > MAX_LINE_LENGTH)
                throw new ExchangeFailure(ResultCode.WEIRD_SERVER_REPLY, "Line too long in " + state);
        }
        return null;
    }

    private void parseLine(String next) throws ExchangeFailure
    {
        switch (state)
        {
            case STATUS:
            {
                // Tolerate empty lines before the status line.
                if (isBlank(next))
                    return;
                if (!next.startsWith("HTTP/"))
                    throw new ExchangeFailure(ResultCode.WEIRD_SERVER_REPLY, "Bad status line " + next.trim());
                notifyHeaderLine(next);
                status = parseStatus(next);
                if (status < 0)
                    throw new ExchangeFailure(ResultCode.WEIRD_SERVER_REPLY, "Bad status line " + next.trim());
                contentLength = -1;
                chunked = false;
                state = State.HEADER;
                break;
            }
            case HEADER:
            {
                notifyHeaderLine(next);
                if (isBlank(next))
                    endOfHeaders();
                else
                    parseHeader(next);
                break;
            }
            case CHUNK_SIZE:
            {
                String size = next.trim();
                int semicolon = size.indexOf(';');
                if (semicolon >= 0)
                    size = size.substring(0, semicolon).trim();
                try
                {
                    remaining = Long.parseLong(size, 16);
                }
                catch (NumberFormatException x)
                {
                    throw new ExchangeFailure(ResultCode.WEIRD_SERVER_REPLY, "Bad chunk size " + size);
                }
                if (remaining < 0)
                    throw new ExchangeFailure(ResultCode.WEIRD_SERVER_REPLY, "Bad chunk size " + size);
                state = remaining == 0 ? State.TRAILER : State.CHUNK_CONTENT;
                break;
            }
            case CHUNK_END:
            {
                if (!isBlank(next))
                    throw new ExchangeFailure(ResultCode.WEIRD_SERVER_REPLY, "Bad chunk terminator");
                state = State.CHUNK_SIZE;
                break;
            }
            case TRAILER:
            {
                if (isBlank(next))
                    state = State.END;
                break;
            }
            default:
                throw new IllegalStateException(state.toString());
        }
    }

    private void parseHeader(String next) throws ExchangeFailure
    {
        int colon = next.indexOf(':');
        if (colon <= 0)
            return;
        String name = next.substring(0, colon).trim().toLowerCase(Locale.ENGLISH);
        String value = next.substring(colon + 1).trim();
        switch (name)
        {
            case "content-length":
                try
                {
                    contentLength = Long.parseLong(value);
                }
                catch (NumberFormatException x)
                {
                    throw new ExchangeFailure(ResultCode.WEIRD_SERVER_REPLY, "Bad Content-Length " + value);
                }
                if (contentLength < 0)
                    throw new ExchangeFailure(ResultCode.WEIRD_SERVER_REPLY, "Bad Content-Length " + value);
                break;
            case "transfer-encoding":
                if (value.toLowerCase(Locale.ENGLISH).contains("chunked"))
                    chunked = true;
                break;
            default:
                break;
        }
    }

    private void endOfHeaders()
    {
        if (status >= 100 && status < 200 && status != 101)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Interim response {}, expecting final response", status);
            state = State.STATUS;
            return;
        }

        if (noBody || status == 101 || status == 204 || status == 304)
        {
            state = State.END;
        }
        else if (chunked)
        {
            state = State.CHUNK_SIZE;
        }
        else if (contentLength >= 0)
        {
            remaining = contentLength;
            state = remaining == 0 ? State.END : State.CONTENT;
        }
        else
        {
            state = State.EOF_CONTENT;
        }
        if (LOG.isDebugEnabled())
            LOG.debug("Response {} headers complete, {}", status, state);
    }

    private void parseContent(ByteBuffer buffer)
    {
        int length = buffer.remaining();
        if (state != State.EOF_CONTENT)
            length = (int)Math.min(length, remaining);

        ByteBuffer content = buffer.slice();
        content.limit(length);
        buffer.position(buffer.position() + length);
        listener.onContent(content);

        if (state != State.EOF_CONTENT)
        {
            remaining -= length;
            if (remaining == 0)
                state = state == State.CONTENT ? State.END : State.CHUNK_END;
        }
    }

    private void notifyHeaderLine(String next) throws ExchangeFailure
    {
        if (verbose)
            LOG.info("< {}", next.trim());
        if (!listener.onHeaderLine(next))
            throw new ExchangeFailure(ResultCode.WRITE_ERROR, "Header line rejected");
    }

    private static int parseStatus(String statusLine)
    {
        int space = statusLine.indexOf(' ');
        if (space < 0)
            return -1;
        int start = space + 1;
        int end = start;
        while (end < statusLine.length() && Character.isDigit(statusLine.charAt(end)))
        {
            ++end;
        }
        if (end - start != 3)
            return -1;
        return Integer.parseInt(statusLine.substring(start, end));
    }

    private static boolean isBlank(String next)
    {
        return "\r\n".equals(next) || "\n".equals(next);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s,status=%d]", getClass().getSimpleName(), hashCode(), state, status);
    }
}
