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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Notifies the {@link HttpClientCallbacks} of a request, shielding the caller
 * from the failures of application code.</p>
 */
public class ResponseNotifier
{
    private static final Logger LOG = LoggerFactory.getLogger(ResponseNotifier.class);

    public void notifyResponseStart(HttpRequest request, String version, int status)
    {
        try
        {
            request.getCallbacks().onResponseStart(request, version, status);
        }
        catch (Throwable x)
        {
            LOG.info("Exception while notifying callbacks {}", request.getCallbacks(), x);
        }
    }

    public void notifyHeader(HttpRequest request, String line)
    {
        try
        {
            request.getCallbacks().onHeader(request, line);
        }
        catch (Throwable x)
        {
            LOG.info("Exception while notifying callbacks {}", request.getCallbacks(), x);
        }
    }

    public void notifyData(HttpRequest request, ByteBuffer chunk)
    {
        try
        {
            request.getCallbacks().onData(request, chunk);
        }
        catch (Throwable x)
        {
            LOG.info("Exception while notifying callbacks {}", request.getCallbacks(), x);
        }
    }

    public void notifyDone(HttpRequest request, HttpClientError error)
    {
        try
        {
            request.getCallbacks().onDone(request, error);
        }
        catch (Throwable x)
        {
            LOG.info("Exception while notifying callbacks {}", request.getCallbacks(), x);
        }
    }
}
