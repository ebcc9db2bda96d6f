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

import org.skein.client.transport.ResultCode;

/**
 * <p>Aborts an exchange with the given {@link ResultCode}.</p>
 */
class ExchangeFailure extends Exception
{
    private final int resultCode;

    ExchangeFailure(int resultCode, String message)
    {
        super(message);
        this.resultCode = resultCode;
    }

    int getResultCode()
    {
        return resultCode;
    }

    @Override
    public String toString()
    {
        return String.format("%s[%s,%s]", getClass().getSimpleName(), ResultCode.toString(resultCode), getMessage());
    }
}
