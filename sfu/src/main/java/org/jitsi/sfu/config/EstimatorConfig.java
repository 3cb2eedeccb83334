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

import java.util.concurrent.*;

/**
 * Thresholds and penalty factors of the bandwidth estimator. Each penalty
 * applies when its measurement strictly exceeds its threshold.
 */
public class EstimatorConfig
{
    protected static final String LOSS_THRESHOLD_PNAME = "estimator.loss.threshold";
    protected static final String LOSS_FACTOR_PNAME = "estimator.loss.factor";
    protected static final String RTT_THRESHOLD_PNAME = "estimator.rtt.threshold";
    protected static final String RTT_FACTOR_PNAME = "estimator.rtt.factor";
    protected static final String JITTER_THRESHOLD_PNAME = "estimator.jitter.threshold";
    protected static final String JITTER_FACTOR_PNAME = "estimator.jitter.factor";

    /**
     * Packet loss ratio (0 to 1) above which the loss penalty applies.
     */
    private final double lossThreshold;

    private final double lossFactor;

    /**
     * Round-trip time in milliseconds above which the RTT penalty applies.
     */
    private final double rttThresholdMs;

    private final double rttFactor;

    /**
     * Jitter in milliseconds above which the jitter penalty applies.
     */
    private final double jitterThresholdMs;

    private final double jitterFactor;

    public EstimatorConfig()
    {
        this(SfuConfig.getSfuConfig());
    }

    /**
     * @param config the <tt>sfu</tt> configuration block.
     */
    public EstimatorConfig(@NotNull Config config)
    {
        lossThreshold = config.getDouble(LOSS_THRESHOLD_PNAME);
        lossFactor = factor(config, LOSS_FACTOR_PNAME);
        rttThresholdMs = config.getDuration(RTT_THRESHOLD_PNAME, TimeUnit.MILLISECONDS);
        rttFactor = factor(config, RTT_FACTOR_PNAME);
        jitterThresholdMs = config.getDuration(JITTER_THRESHOLD_PNAME, TimeUnit.MILLISECONDS);
        jitterFactor = factor(config, JITTER_FACTOR_PNAME);
    }

    private static double factor(Config config, String path)
    {
        double factor = config.getDouble(path);
        if (factor < 0 || factor > 1)
        {
            throw new ConfigException.BadValue(path, "must be between 0 and 1, got " + factor);
        }
        return factor;
    }

    public double getLossThreshold()
    {
        return lossThreshold;
    }

    public double getLossFactor()
    {
        return lossFactor;
    }

    public double getRttThresholdMs()
    {
        return rttThresholdMs;
    }

    public double getRttFactor()
    {
        return rttFactor;
    }

    public double getJitterThresholdMs()
    {
        return jitterThresholdMs;
    }

    public double getJitterFactor()
    {
        return jitterFactor;
    }
}
