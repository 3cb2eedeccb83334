/*
 * Copyright @ 2018 - present 8x8, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.jitsi.sfu.transport;

import org.jetbrains.annotations.*;

import java.util.*;

/**
 * The parameter block of an {@link RtpSender}, as returned by
 * {@link RtpSender#getParameters()}. Engines which have not negotiated any
 * encodings yet return a block without an encodings list.
 */
public class RtpParameters
{
    @Nullable
    private List<RtpEncodingParameters> encodings;

    public RtpParameters()
    {
    }

    public RtpParameters(@Nullable List<RtpEncodingParameters> encodings)
    {
        this.encodings = encodings;
    }

    /**
     * @return the encodings of the sender, or <tt>null</tt> if the engine
     * has not configured any.
     */
    public @Nullable List<RtpEncodingParameters> getEncodings()
    {
        return encodings;
    }

    public void setEncodings(@Nullable List<RtpEncodingParameters> encodings)
    {
        this.encodings = encodings;
    }

    @Override
    public String toString()
    {
        return "RtpParameters[encodings=" + encodings + "]";
    }
}
