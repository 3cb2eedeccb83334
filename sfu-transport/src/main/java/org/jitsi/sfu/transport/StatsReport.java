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
import java.util.stream.*;

/**
 * A snapshot of the statistics of a {@link PeerConnection}, as returned by
 * {@link PeerConnection#getStats()}.
 */
public class StatsReport
    implements Iterable<RtcStats>
{
    private final List<RtcStats> stats;

    public StatsReport(@NotNull List<RtcStats> stats)
    {
        this.stats = Collections.unmodifiableList(new ArrayList<>(stats));
    }

    public static StatsReport empty()
    {
        return new StatsReport(Collections.emptyList());
    }

    public @NotNull List<RtcStats> getStats()
    {
        return stats;
    }

    /**
     * @return the entries which describe RTP streams sent and measured by
     * the local side.
     */
    public @NotNull List<RtcStats> getLocalOutboundStats()
    {
        return stats.stream()
            .filter(RtcStats::isLocalOutbound)
            .collect(Collectors.toList());
    }

    @Override
    public @NotNull Iterator<RtcStats> iterator()
    {
        return stats.iterator();
    }

    public int size()
    {
        return stats.size();
    }
}
