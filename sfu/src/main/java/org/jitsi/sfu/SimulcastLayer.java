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
package org.jitsi.sfu;

import org.jetbrains.annotations.*;
import org.jitsi.sfu.transport.*;

import java.util.*;

/**
 * Describes one simulcast layer: its RID, its bitrate ceiling and how much
 * its resolution is scaled down relative to the source.
 */
public class SimulcastLayer
{
    @NotNull
    private final String rid;

    /**
     * The maximum bitrate in bits per second.
     */
    private final long maxBitrate;

    /**
     * The resolution downscale factor, <tt>null</tt> for full resolution.
     */
    @Nullable
    private final Double scaleResolutionDownBy;

    public SimulcastLayer(@NotNull String rid, long maxBitrate, @Nullable Double scaleResolutionDownBy)
    {
        this.rid = Objects.requireNonNull(rid, "rid");
        this.maxBitrate = maxBitrate;
        this.scaleResolutionDownBy = scaleResolutionDownBy;
    }

    public @NotNull String getRid()
    {
        return rid;
    }

    public long getMaxBitrate()
    {
        return maxBitrate;
    }

    public @Nullable Double getScaleResolutionDownBy()
    {
        return scaleResolutionDownBy;
    }

    /**
     * @return a new encoding which carries this layer.
     */
    public RtpEncodingParameters toEncoding()
    {
        return new RtpEncodingParameters(rid, maxBitrate, scaleResolutionDownBy);
    }

    @Override
    public String toString()
    {
        return rid + ":" + maxBitrate + "bps/" + (scaleResolutionDownBy == null ? 1 : scaleResolutionDownBy);
    }
}
