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

import org.jitsi.sfu.transport.*;
import org.junit.*;

import java.util.*;

import static org.junit.Assert.*;

public class LayerConfigurationTest
{
    @Test
    public void missingEncodingsAreUnconfigured()
    {
        assertSame(LayerConfiguration.UNCONFIGURED, LayerConfiguration.of(null));
        assertSame(LayerConfiguration.UNCONFIGURED, LayerConfiguration.of(new RtpParameters()));
        assertSame(
            LayerConfiguration.UNCONFIGURED,
            LayerConfiguration.of(new RtpParameters(new ArrayList<>())));
        assertFalse(LayerConfiguration.UNCONFIGURED.isConfigured());
        assertEquals(LayerMode.NONE, LayerConfiguration.UNCONFIGURED.getMode());
    }

    @Test
    public void scalabilityModeOnFirstEncodingMeansSvc()
    {
        RtpEncodingParameters first = new RtpEncodingParameters();
        first.setScalabilityMode("L1T3");

        LayerConfiguration configuration = LayerConfiguration.of(
            new RtpParameters(Arrays.asList(first, new RtpEncodingParameters())));

        assertEquals(LayerMode.SVC, configuration.getMode());
        assertEquals("L1T3", ((LayerConfiguration.Svc) configuration).getScalabilityMode());
    }

    @Test
    public void plainEncodingsMeanSimulcast()
    {
        LayerConfiguration configuration = LayerConfiguration.of(new RtpParameters(
            Collections.singletonList(new RtpEncodingParameters("f", 500_000L, null))));

        assertEquals(LayerMode.SIMULCAST, configuration.getMode());
        assertTrue(configuration.isConfigured());
    }

    @Test
    public void simulcastFromLayers()
    {
        LayerConfiguration.Simulcast simulcast = LayerConfiguration.simulcast(Arrays.asList(
            new SimulcastLayer("f", 500_000, null),
            new SimulcastLayer("q", 100_000, 4.0)));

        List<RtpEncodingParameters> encodings = simulcast.getEncodings();
        assertEquals(2, encodings.size());
        assertEquals("f", encodings.get(0).getRid());
        assertEquals(Long.valueOf(100_000), encodings.get(1).getMaxBitrate());
        assertEquals(4.0, encodings.get(1).getScaleResolutionDownBy(), 0);
    }

    @Test
    public void clampingLowersButNeverRaises()
    {
        LayerConfiguration configuration = LayerConfiguration.of(new RtpParameters(Arrays.asList(
            new RtpEncodingParameters("a", 500_000L, null),
            new RtpEncodingParameters("b", 100_000L, 2.0),
            new RtpEncodingParameters("c", null, 4.0))));

        LayerConfiguration clamped = configuration.clampBitrate(300_000);

        assertEquals(LayerMode.SIMULCAST, clamped.getMode());
        List<RtpEncodingParameters> encodings = clamped.getEncodings();
        assertEquals(Long.valueOf(300_000), encodings.get(0).getMaxBitrate());
        assertEquals(Long.valueOf(100_000), encodings.get(1).getMaxBitrate());
        assertEquals(Long.valueOf(300_000), encodings.get(2).getMaxBitrate());
        assertEquals(2.0, encodings.get(1).getScaleResolutionDownBy(), 0);
        // The clamped configuration is a copy.
        assertNull(configuration.getEncodings().get(2).getMaxBitrate());
    }

    @Test
    public void clampingToZero()
    {
        LayerConfiguration clamped = LayerConfiguration.of(new RtpParameters(
            Collections.singletonList(new RtpEncodingParameters("a", 500_000L, null)))).clampBitrate(0);

        assertEquals(Long.valueOf(0), clamped.getEncodings().get(0).getMaxBitrate());
    }

    @Test
    public void svcKeepsTheOtherEncodings()
    {
        LayerConfiguration current = LayerConfiguration.of(new RtpParameters(Arrays.asList(
            new RtpEncodingParameters("a", 500_000L, null),
            new RtpEncodingParameters("b", 100_000L, 2.0))));

        LayerConfiguration.Svc svc = LayerConfiguration.svc(current, "L3T3_KEY");

        List<RtpEncodingParameters> encodings = svc.getEncodings();
        assertEquals(2, encodings.size());
        assertEquals("L3T3_KEY", encodings.get(0).getScalabilityMode());
        assertEquals("b", encodings.get(1).getRid());
        assertNull(encodings.get(1).getScalabilityMode());
    }

    @Test
    public void applyToWritesCopies()
    {
        LayerConfiguration.Svc svc = LayerConfiguration.svc(LayerConfiguration.UNCONFIGURED, "L1T2");
        RtpParameters parameters = new RtpParameters();

        svc.applyTo(parameters);
        parameters.getEncodings().get(0).setMaxBitrate(1L);

        assertEquals(1, parameters.getEncodings().size());
        assertNull(svc.getEncodings().get(0).getMaxBitrate());
    }
}
