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

package org.jitsi.sfu.config;

import com.typesafe.config.*;
import org.jetbrains.annotations.*;

import java.time.*;

/**
 * Configuration of the bandwidth adaptation loop.
 */
public class AdaptationConfig
{
    protected static final String INTERVAL_PNAME = "adaptation.interval";

    private final Duration interval;

    public AdaptationConfig()
    {
        this(SfuConfig.getSfuConfig());
    }

    /**
     * @param config the <tt>sfu</tt> configuration block.
     */
    public AdaptationConfig(@NotNull Config config)
    {
        interval = config.getDuration(INTERVAL_PNAME);
        if (interval.isZero() || interval.isNegative())
        {
            throw new ConfigException.BadValue(INTERVAL_PNAME, "must be positive, got " + interval);
        }
    }

    /**
     * @return the time between two adaptation ticks of one connection.
     */
    public Duration getInterval()
    {
        return interval;
    }
}
