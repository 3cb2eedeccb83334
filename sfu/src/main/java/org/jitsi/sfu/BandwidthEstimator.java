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
import org.jitsi.sfu.config.*;
import org.jitsi.sfu.transport.*;

import java.util.*;

/**
 * Estimates the bandwidth available to an outbound RTP stream from a single
 * statistics entry. The base is the average send throughput; it is reduced
 * by a multiplicative penalty for each of excessive loss, round-trip time and
 * jitter, in that order. No state is kept between estimates.
 */
public class BandwidthEstimator
{
    private final EstimatorConfig config;

    public BandwidthEstimator(@NotNull EstimatorConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @param stats the statistics of one outbound RTP stream.
     * @return the estimated available bandwidth in bits per second. Zero if
     * the entry has no time basis.
     */
    public double estimate(@NotNull RtcStats stats)
    {
        if (stats.getTimestamp() <= 0)
        {
            return 0;
        }

        double estimate = stats.getBytesSent() * 8d / stats.getTimestamp();

        if (getLossRatio(stats) > config.getLossThreshold())
        {
            estimate *= config.getLossFactor();
        }
        if (stats.getRoundTripTime() > config.getRttThresholdMs())
        {
            estimate *= config.getRttFactor();
        }
        if (stats.getJitter() > config.getJitterThresholdMs())
        {
            estimate *= config.getJitterFactor();
        }

        return estimate;
    }

    /**
     * @return the ratio of lost to sent packets, 0 if nothing was sent.
     */
    static double getLossRatio(@NotNull RtcStats stats)
    {
        if (stats.getPacketsSent() <= 0)
        {
            return 0;
        }
        return stats.getPacketsLost() / (double) stats.getPacketsSent();
    }
}
