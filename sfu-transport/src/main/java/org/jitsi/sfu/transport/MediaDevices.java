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
import org.jitsi.utils.logging2.*;

import java.util.*;

/**
 * Validating front-end to the capture devices of a {@link MediaCaptureEngine}.
 * Device enumeration and constraint discovery are not available from the
 * engine and always fail.
 */
public class MediaDevices
{
    private static final Logger logger = new LoggerImpl(MediaDevices.class.getName());

    private final MediaCaptureEngine engine;

    public MediaDevices(@NotNull MediaCaptureEngine engine)
    {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Opens the capture devices described by <tt>constraints</tt>.
     *
     * @throws IllegalArgumentException if the constraints are missing or ask
     * for no media at all.
     */
    public @NotNull MediaStream getUserMedia(MediaConstraints constraints)
    {
        validate(constraints);
        logger.debug(() -> "getUserMedia " + constraints);
        return engine.getUserMedia(constraints);
    }

    /**
     * Opens a screen capture described by <tt>constraints</tt>.
     *
     * @throws IllegalArgumentException if the constraints are missing or ask
     * for no media at all.
     */
    public @NotNull MediaStream getDisplayMedia(MediaConstraints constraints)
    {
        validate(constraints);
        logger.debug(() -> "getDisplayMedia " + constraints);
        return engine.getDisplayMedia(constraints);
    }

    public @NotNull MediaStream getUserMediaAudioOnly()
    {
        return engine.getUserMedia(MediaConstraints.AUDIO_ONLY);
    }

    public @NotNull MediaStream getUserMediaVideoOnly()
    {
        return engine.getUserMedia(MediaConstraints.VIDEO_ONLY);
    }

    /**
     * Not supported by this build.
     *
     * @throws UnsupportedOperationException always.
     */
    public List<String> enumerateDevices()
    {
        throw new UnsupportedOperationException("enumerateDevices is not supported by this build");
    }

    /**
     * Not supported by this build.
     *
     * @throws UnsupportedOperationException always.
     */
    public Set<String> getSupportedConstraints()
    {
        throw new UnsupportedOperationException("getSupportedConstraints is not supported by this build");
    }

    private static void validate(MediaConstraints constraints)
    {
        if (constraints == null)
        {
            throw new IllegalArgumentException("Invalid input: constraints must not be null");
        }
        if (!constraints.isAudio() && !constraints.isVideo())
        {
            throw new IllegalArgumentException("Invalid input: at least one of audio or video must be requested");
        }
    }
}
