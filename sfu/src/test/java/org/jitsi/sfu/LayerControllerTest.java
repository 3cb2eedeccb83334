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

import org.jitsi.sfu.config.*;
import org.jitsi.sfu.transport.*;
import org.jitsi.utils.logging2.*;
import org.junit.*;

import java.util.*;
import java.util.concurrent.*;

import static org.jitsi.sfu.TestHelpers.*;
import static org.junit.Assert.*;

public class LayerControllerTest
{
    private final LayerController layerController
        = new LayerController(new LayerConfig(defaultConfig()), new LoggerImpl(LayerControllerTest.class.getName()));

    private final TestPeerConnection connection = new TestPeerConnection();

    private static void assertSimulcastLayers(List<RtpEncodingParameters> encodings)
    {
        assertEquals(3, encodings.size());

        assertEquals(Long.valueOf(500_000), encodings.get(0).getMaxBitrate());
        assertNull(encodings.get(0).getScaleResolutionDownBy());

        assertEquals(Long.valueOf(200_000), encodings.get(1).getMaxBitrate());
        assertEquals(2.0, encodings.get(1).getScaleResolutionDownBy(), 0);

        assertEquals(Long.valueOf(100_000), encodings.get(2).getMaxBitrate());
        assertEquals(4.0, encodings.get(2).getScaleResolutionDownBy(), 0);
    }

    @Test
    public void enableSimulcastOnUnconfiguredSender()
    {
        MediaStreamTrack track = videoTrack("v1");

        RtpSender sender = layerController.enableSimulcast(connection, track);

        assertEquals(Collections.singletonList(track), connection.getAddedTracks());
        assertSimulcastLayers(((TestRtpSender) sender).getEncodings());
        assertEquals(LayerMode.SIMULCAST, layerController.getLayerConfiguration(sender).getMode());
    }

    @Test
    public void enableSimulcastReplacesPriorEncodings()
    {
        RtpEncodingParameters svc = new RtpEncodingParameters("x", 42L, 8.0);
        svc.setScalabilityMode("L1T2");
        connection.setInitialParameters(new RtpParameters(Arrays.asList(svc, new RtpEncodingParameters())));

        TestRtpSender sender = (TestRtpSender) layerController.enableSimulcast(connection, videoTrack("v1"));

        assertSimulcastLayers(sender.getEncodings());
        sender.getEncodings().forEach(encoding -> assertNull(encoding.getScalabilityMode()));
    }

    @Test
    public void enableSimulcastIsIdempotent()
    {
        TestRtpSender sender = (TestRtpSender) layerController.enableSimulcast(connection, videoTrack("v1"));
        List<RtpEncodingParameters> first = sender.getEncodings();

        layerController.configureSimulcast(connection, sender);

        assertEquals(first, sender.getEncodings());
    }

    @Test
    public void enableSvcOnUnconfiguredSenderCreatesOneLayer()
    {
        TestRtpSender sender = (TestRtpSender) layerController.enableSVC(connection, videoTrack("v1"));

        List<RtpEncodingParameters> encodings = sender.getEncodings();
        assertEquals(1, encodings.size());
        assertEquals("L3T3_KEY", encodings.get(0).getScalabilityMode());

        LayerConfiguration configuration = layerController.getLayerConfiguration(sender);
        assertTrue(configuration instanceof LayerConfiguration.Svc);
        assertEquals("L3T3_KEY", ((LayerConfiguration.Svc) configuration).getScalabilityMode());
    }

    @Test
    public void enableSvcOnlyTouchesFirstLayer()
    {
        connection.setInitialParameters(new RtpParameters(Arrays.asList(
            new RtpEncodingParameters("a", 300_000L, null),
            new RtpEncodingParameters("b", 100_000L, 2.0))));

        TestRtpSender sender = (TestRtpSender) layerController.enableSVC(connection, videoTrack("v1"));

        List<RtpEncodingParameters> encodings = sender.getEncodings();
        assertEquals(2, encodings.size());
        assertEquals("L3T3_KEY", encodings.get(0).getScalabilityMode());
        assertEquals(Long.valueOf(300_000), encodings.get(0).getMaxBitrate());
        assertNull(encodings.get(1).getScalabilityMode());
        assertEquals(Long.valueOf(100_000), encodings.get(1).getMaxBitrate());
    }

    @Test
    public void adjustBitrateClampsEveryLayerToTheEstimate()
    {
        TestRtpSender sender = (TestRtpSender) layerController.enableSimulcast(connection, videoTrack("v1"));

        layerController.adjustBitrate(connection, 150_000);

        List<RtpEncodingParameters> encodings = sender.getEncodings();
        assertEquals(Long.valueOf(150_000), encodings.get(0).getMaxBitrate());
        assertEquals(Long.valueOf(150_000), encodings.get(1).getMaxBitrate());
        assertEquals(Long.valueOf(100_000), encodings.get(2).getMaxBitrate());
    }

    @Test
    public void adjustBitrateNeverRaisesCaps()
    {
        TestRtpSender sender = (TestRtpSender) layerController.enableSimulcast(connection, videoTrack("v1"));

        layerController.adjustBitrate(connection, 10_000_000);
        assertSimulcastLayers(sender.getEncodings());

        layerController.adjustBitrate(connection, 150_000);
        layerController.adjustBitrate(connection, 10_000_000);
        assertEquals(Long.valueOf(150_000), sender.getEncodings().get(0).getMaxBitrate());
    }

    @Test
    public void adjustBitrateSetsUnsetCapsToTheEstimate()
    {
        TestRtpSender sender = (TestRtpSender) layerController.enableSVC(connection, videoTrack("v1"));
        assertNull(sender.getEncodings().get(0).getMaxBitrate());

        layerController.adjustBitrate(connection, 700_000);

        assertEquals(Long.valueOf(700_000), sender.getEncodings().get(0).getMaxBitrate());
        assertEquals("L3T3_KEY", sender.getEncodings().get(0).getScalabilityMode());
    }

    @Test
    public void adjustBitrateCoversEverySender()
    {
        TestRtpSender video = (TestRtpSender) layerController.enableSimulcast(connection, videoTrack("v1"));
        TestRtpSender audio = (TestRtpSender) connection.addTrack(audioTrack("a1"));
        connection.setInitialParameters(new RtpParameters(
            Collections.singletonList(new RtpEncodingParameters(null, 64_000L, null))));
        TestRtpSender other = (TestRtpSender) connection.addTrack(audioTrack("a2"));

        layerController.adjustBitrate(connection, 50_000);

        video.getEncodings().forEach(encoding -> assertEquals(Long.valueOf(50_000), encoding.getMaxBitrate()));
        assertEquals(Long.valueOf(50_000), other.getEncodings().get(0).getMaxBitrate());
        // No encodings, nothing to clamp.
        assertNull(audio.getEncodings());
        assertEquals(0, audio.getSetParametersCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void adjustBitrateRejectsNegativeBandwidth()
    {
        layerController.adjustBitrate(connection, -1);
    }

    @Test
    public void adjustBitrateOnClosedConnectionFails()
    {
        layerController.enableSimulcast(connection, videoTrack("v1"));
        connection.close();

        assertThrows(RtcException.class, () -> layerController.adjustBitrate(connection, 100_000));
    }

    @Test
    public void configureNoneLeavesSenderUntouched()
    {
        TestRtpSender sender = (TestRtpSender) connection.addTrack(videoTrack("v1"));

        layerController.configure(connection, sender, LayerMode.NONE);

        assertEquals(0, sender.getSetParametersCount());
        assertEquals(LayerConfiguration.UNCONFIGURED, layerController.getLayerConfiguration(sender));
    }

    @Test
    public void eachConnectionHasItsOwnLock()
    {
        TestPeerConnection other = new TestPeerConnection();

        assertSame(layerController.lockFor(connection), layerController.lockFor(connection));
        assertNotSame(layerController.lockFor(connection), layerController.lockFor(other));
        assertNotSame(connection, layerController.lockFor(connection));
    }

    @Test
    public void adjustBitrateDoesNotLockTheConnection()
        throws Exception
    {
        TestRtpSender sender = (TestRtpSender) layerController.enableSimulcast(connection, videoTrack("v1"));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try
        {
            synchronized (connection)
            {
                executor.submit(() -> layerController.adjustBitrate(connection, 150_000))
                    .get(5, TimeUnit.SECONDS);
            }
        }
        finally
        {
            executor.shutdownNow();
        }

        assertEquals(Long.valueOf(150_000), sender.getEncodings().get(0).getMaxBitrate());
    }
}
