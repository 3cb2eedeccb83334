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
import java.util.stream.*;

/**
 * The layering of one sender's encodings, read from (and written back to) its
 * {@link RtpParameters}. A sender is {@link Unconfigured} until the engine or
 * the {@link LayerController} gives it encodings; a sender whose first
 * encoding carries a scalability mode is {@link Svc}; any other encoding list
 * is {@link Simulcast}. Instances are immutable.
 */
public abstract class LayerConfiguration
{
    public static final LayerConfiguration UNCONFIGURED = new Unconfigured();

    /**
     * Copies of the encodings, never exposed directly.
     */
    protected final List<RtpEncodingParameters> encodings;

    private LayerConfiguration(List<RtpEncodingParameters> encodings)
    {
        this.encodings = encodings.stream()
            .map(RtpEncodingParameters::new)
            .collect(Collectors.toList());
    }

    /**
     * Interprets the parameter block of a sender.
     *
     * @param parameters the parameters, possibly <tt>null</tt> if the engine
     * has none.
     */
    public static @NotNull LayerConfiguration of(@Nullable RtpParameters parameters)
    {
        List<RtpEncodingParameters> encodings = parameters == null ? null : parameters.getEncodings();
        if (encodings == null || encodings.isEmpty())
        {
            return UNCONFIGURED;
        }
        if (encodings.get(0).getScalabilityMode() != null)
        {
            return new Svc(encodings);
        }
        return new Simulcast(encodings);
    }

    /**
     * @return a simulcast configuration with exactly the given layers.
     */
    public static @NotNull Simulcast simulcast(@NotNull List<SimulcastLayer> layers)
    {
        return new Simulcast(layers.stream().map(SimulcastLayer::toEncoding).collect(Collectors.toList()));
    }

    /**
     * Turns <tt>current</tt> into an SVC configuration: the first encoding
     * (or a new, empty one if there are none) gets <tt>scalabilityMode</tt>,
     * the other encodings are kept as they are.
     */
    public static @NotNull Svc svc(@NotNull LayerConfiguration current, @NotNull String scalabilityMode)
    {
        List<RtpEncodingParameters> encodings = current.getEncodings();
        if (encodings.isEmpty())
        {
            encodings.add(new RtpEncodingParameters());
        }
        encodings.get(0).setScalabilityMode(Objects.requireNonNull(scalabilityMode, "scalabilityMode"));
        return new Svc(encodings);
    }

    public abstract @NotNull LayerMode getMode();

    /**
     * Caps the bitrate of every encoding at <tt>availableBandwidth</tt>. An
     * encoding without a cap gets exactly <tt>availableBandwidth</tt>; an
     * encoding whose cap is already lower keeps it.
     *
     * @param availableBandwidth the ceiling in bits per second.
     * @return the clamped configuration, of the same kind as this one.
     */
    public abstract @NotNull LayerConfiguration clampBitrate(long availableBandwidth);

    /**
     * @return fresh copies of the encodings of this configuration.
     */
    public @NotNull List<RtpEncodingParameters> getEncodings()
    {
        return encodings.stream()
            .map(RtpEncodingParameters::new)
            .collect(Collectors.toList());
    }

    public boolean isConfigured()
    {
        return !encodings.isEmpty();
    }

    /**
     * Writes this configuration into a parameter block.
     */
    public void applyTo(@NotNull RtpParameters parameters)
    {
        parameters.setEncodings(getEncodings());
    }

    protected List<RtpEncodingParameters> clampedEncodings(long availableBandwidth)
    {
        List<RtpEncodingParameters> clamped = getEncodings();
        for (RtpEncodingParameters encoding : clamped)
        {
            Long current = encoding.getMaxBitrate();
            encoding.setMaxBitrate(Math.min(availableBandwidth, current == null ? availableBandwidth : current));
        }
        return clamped;
    }

    @Override
    public String toString()
    {
        return getMode() + encodings.toString();
    }

    /**
     * A sender without any encodings.
     */
    public static final class Unconfigured
        extends LayerConfiguration
    {
        private Unconfigured()
        {
            super(Collections.emptyList());
        }

        @Override
        public @NotNull LayerMode getMode()
        {
            return LayerMode.NONE;
        }

        @Override
        public @NotNull LayerConfiguration clampBitrate(long availableBandwidth)
        {
            return this;
        }
    }

    /**
     * A sender with independent encodings.
     */
    public static final class Simulcast
        extends LayerConfiguration
    {
        private Simulcast(List<RtpEncodingParameters> encodings)
        {
            super(encodings);
        }

        @Override
        public @NotNull LayerMode getMode()
        {
            return LayerMode.SIMULCAST;
        }

        @Override
        public @NotNull Simulcast clampBitrate(long availableBandwidth)
        {
            return new Simulcast(clampedEncodings(availableBandwidth));
        }
    }

    /**
     * A sender whose first encoding carries a scalability mode.
     */
    public static final class Svc
        extends LayerConfiguration
    {
        private Svc(List<RtpEncodingParameters> encodings)
        {
            super(encodings);
        }

        @Override
        public @NotNull LayerMode getMode()
        {
            return LayerMode.SVC;
        }

        /**
         * @return the scalability mode of the first encoding.
         */
        public @NotNull String getScalabilityMode()
        {
            return encodings.get(0).getScalabilityMode();
        }

        @Override
        public @NotNull Svc clampBitrate(long availableBandwidth)
        {
            return new Svc(clampedEncodings(availableBandwidth));
        }
    }
}
