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

import com.typesafe.config.*;
import org.jitsi.sfu.config.*;
import org.jitsi.sfu.transport.*;
import org.junit.*;

import static org.jitsi.sfu.TestHelpers.*;
import static org.junit.Assert.*;

public class BandwidthEstimatorTest
{
    private static final double DELTA = 1e-6;

    private final BandwidthEstimator estimator = new BandwidthEstimator(new EstimatorConfig(defaultConfig()));

    @Test
    public void noPenaltiesYieldThroughput()
    {
        RtcStats stats = outboundStats(125000, 1, 0, 1000, 100, 10);

        assertEquals(1_000_000, estimator.estimate(stats), DELTA);
    }

    @Test
    public void allPenaltiesCompound()
    {
        RtcStats stats = outboundStats(125000, 1, 60, 1000, 350, 150);

        assertEquals(573_750, estimator.estimate(stats), DELTA);
    }

    @Test
    public void eachPenaltyAppliesOnItsOwn()
    {
        assertEquals(750_000, estimator.estimate(outboundStats(125000, 1, 60, 1000, 100, 10)), DELTA);
        assertEquals(850_000, estimator.estimate(outboundStats(125000, 1, 0, 1000, 350, 10)), DELTA);
        assertEquals(900_000, estimator.estimate(outboundStats(125000, 1, 0, 1000, 100, 150)), DELTA);
    }

    @Test
    public void thresholdsAreExclusive()
    {
        // Exactly 5% loss, 300 ms RTT and 100 ms jitter do not trigger penalties.
        RtcStats stats = outboundStats(125000, 1, 50, 1000, 300, 100);

        assertEquals(1_000_000, estimator.estimate(stats), DELTA);
    }

    @Test
    public void throughputUsesTimestampBasis()
    {
        RtcStats stats = outboundStats(125000, 4, 0, 1000, 0, 0);

        assertEquals(250_000, estimator.estimate(stats), DELTA);
    }

    @Test
    public void zeroThroughputYieldsZero()
    {
        assertEquals(0, estimator.estimate(outboundStats(0, 1, 60, 1000, 350, 150)), DELTA);
    }

    @Test
    public void missingTimeBasisYieldsZero()
    {
        assertEquals(0, estimator.estimate(outboundStats(125000, 0, 0, 1000, 0, 0)), DELTA);
    }

    @Test
    public void nothingSentMeansNoLoss()
    {
        RtcStats stats = outboundStats(125000, 1, 5, 0, 0, 0);

        assertEquals(0, BandwidthEstimator.getLossRatio(stats), DELTA);
        assertEquals(1_000_000, estimator.estimate(stats), DELTA);
    }

    @Test
    public void thresholdsComeFromConfig()
    {
        Config config = ConfigFactory.parseString("estimator.rtt.threshold = 50 ms")
            .withFallback(defaultConfig());
        BandwidthEstimator strict = new BandwidthEstimator(new EstimatorConfig(config));

        assertEquals(850_000, strict.estimate(outboundStats(125000, 1, 0, 1000, 100, 10)), DELTA);
    }
}
