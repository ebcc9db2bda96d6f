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
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * <p>The body of a request together with its content type.</p>
 */
public class RequestContent
{
    public static final RequestContent EMPTY = new RequestContent(new byte[0], "");

    private final byte[] body;
    private final String contentType;

    public RequestContent(byte[] body, String contentType)
    {
        this.body = Objects.requireNonNull(body).clone();
        this.contentType = Objects.requireNonNull(contentType);
    }

    public RequestContent(String body, String contentType)
    {
        this(body, contentType, StandardCharsets.UTF_8);
    }

    public RequestContent(String body, String contentType, Charset charset)
    {
        this(body.getBytes(charset), contentType);
    }

    /**
     * @return the number of bytes of the body
     */
    public int getLength()
    {
        return body.length;
    }

    /**
     * @return a copy of the body bytes
     */
    public byte[] getBody()
    {
        return body.clone();
    }

    /**
     * <p>Puts part of the body into a buffer.</p>
     *
     * @param buffer the destination buffer
     * @param offset the offset in the body
     * @param length the number of bytes to put
     */
    public void put(ByteBuffer buffer, int offset, int length)
    {
        buffer.put(body, offset, length);
    }

    public String getContentType()
    {
        return contentType;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s,%d]", getClass().getSimpleName(), hashCode(), contentType, body.length);
    }
}
