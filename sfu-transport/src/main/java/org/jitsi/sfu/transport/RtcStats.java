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

/**
 * One entry of a {@link StatsReport}: the cumulative counters of one RTP
 * stream at the time the report was generated. Instances are immutable.
 */
public class RtcStats
{
    /**
     * The type of the stats entry describing an RTP stream sent by the local
     * side.
     */
    public static final String TYPE_OUTBOUND_RTP = "outbound-rtp";

    /**
     * The type of the stats entry describing an RTP stream received by the
     * local side.
     */
    public static final String TYPE_INBOUND_RTP = "inbound-rtp";

    @NotNull
    private final String type;

    /**
     * Whether this entry was computed by the remote side (from RTCP reports)
     * rather than measured locally.
     */
    private final boolean remote;

    private final long bytesSent;

    private final long packetsSent;

    private final long packetsLost;

    /**
     * Round-trip time in milliseconds.
     */
    private final double roundTripTime;

    /**
     * Interarrival jitter in milliseconds.
     */
    private final double jitter;

    /**
     * The time basis of the cumulative counters, in seconds.
     */
    private final double timestamp;

    public RtcStats(
            @NotNull String type,
            boolean remote,
            long bytesSent,
            long packetsSent,
            long packetsLost,
            double roundTripTime,
            double jitter,
            double timestamp)
    {
        this.type = type;
        this.remote = remote;
        this.bytesSent = bytesSent;
        this.packetsSent = packetsSent;
        this.packetsLost = packetsLost;
        this.roundTripTime = roundTripTime;
        this.jitter = jitter;
        this.timestamp = timestamp;
    }

    public @NotNull String getType()
    {
        return type;
    }

    public boolean isRemote()
    {
        return remote;
    }

    public long getBytesSent()
    {
        return bytesSent;
    }

    public long getPacketsSent()
    {
        return packetsSent;
    }

    public long getPacketsLost()
    {
        return packetsLost;
    }

    public double getRoundTripTime()
    {
        return roundTripTime;
    }

    public double getJitter()
    {
        return jitter;
    }

    public double getTimestamp()
    {
        return timestamp;
    }

    /**
     * @return <tt>true</tt> if this entry describes an RTP stream sent by the
     * local side and was measured locally.
     */
    public boolean isLocalOutbound()
    {
        return TYPE_OUTBOUND_RTP.equals(type) && !remote;
    }

    @Override
    public String toString()
    {
        return "RtcStats[type=" + type
            + ", remote=" + remote
            + ", bytesSent=" + bytesSent
            + ", packetsSent=" + packetsSent
            + ", packetsLost=" + packetsLost
            + ", roundTripTime=" + roundTripTime
            + ", jitter=" + jitter
            + ", timestamp=" + timestamp + "]";
    }
}
