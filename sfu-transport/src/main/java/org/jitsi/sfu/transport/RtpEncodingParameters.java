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
 * The parameters of one encoding (layer) of an {@link RtpSender}, modelled
 * after the W3C <tt>RTCRtpEncodingParameters</tt> dictionary. A
 * <tt>null</tt> value means "let the engine choose".
 */
public class RtpEncodingParameters
{
    /**
     * The RTP stream id of this encoding, used to tell simulcast layers apart.
     */
    @Nullable
    private String rid;

    /**
     * The maximum bitrate of this encoding, in bits per second.
     */
    @Nullable
    private Long maxBitrate;

    /**
     * The factor by which the resolution is scaled down for this encoding.
     */
    @Nullable
    private Double scaleResolutionDownBy;

    /**
     * The SVC scalability mode (e.g. <tt>L3T3_KEY</tt>).
     */
    @Nullable
    private String scalabilityMode;

    public RtpEncodingParameters()
    {
    }

    public RtpEncodingParameters(
            @Nullable String rid,
            @Nullable Long maxBitrate,
            @Nullable Double scaleResolutionDownBy)
    {
        this.rid = rid;
        this.maxBitrate = maxBitrate;
        this.scaleResolutionDownBy = scaleResolutionDownBy;
    }

    /**
     * Copy constructor.
     */
    public RtpEncodingParameters(@NotNull RtpEncodingParameters other)
    {
        this.rid = other.rid;
        this.maxBitrate = other.maxBitrate;
        this.scaleResolutionDownBy = other.scaleResolutionDownBy;
        this.scalabilityMode = other.scalabilityMode;
    }

    public @Nullable String getRid()
    {
        return rid;
    }

    public void setRid(@Nullable String rid)
    {
        this.rid = rid;
    }

    public @Nullable Long getMaxBitrate()
    {
        return maxBitrate;
    }

    public void setMaxBitrate(@Nullable Long maxBitrate)
    {
        this.maxBitrate = maxBitrate;
    }

    public @Nullable Double getScaleResolutionDownBy()
    {
        return scaleResolutionDownBy;
    }

    public void setScaleResolutionDownBy(@Nullable Double scaleResolutionDownBy)
    {
        this.scaleResolutionDownBy = scaleResolutionDownBy;
    }

    public @Nullable String getScalabilityMode()
    {
        return scalabilityMode;
    }

    public void setScalabilityMode(@Nullable String scalabilityMode)
    {
        this.scalabilityMode = scalabilityMode;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (o == null || getClass() != o.getClass())
        {
            return false;
        }
        RtpEncodingParameters that = (RtpEncodingParameters) o;
        return Objects.equals(rid, that.rid)
            && Objects.equals(maxBitrate, that.maxBitrate)
            && Objects.equals(scaleResolutionDownBy, that.scaleResolutionDownBy)
            && Objects.equals(scalabilityMode, that.scalabilityMode);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(rid, maxBitrate, scaleResolutionDownBy, scalabilityMode);
    }

    @Override
    public String toString()
    {
        return "RtpEncodingParameters[rid=" + rid
            + ", maxBitrate=" + maxBitrate
            + ", scaleResolutionDownBy=" + scaleResolutionDownBy
            + ", scalabilityMode=" + scalabilityMode + "]";
    }
}
