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

/**
 * Which kinds of media a capture request asks for.
 */
public class MediaConstraints
{
    public static final MediaConstraints AUDIO_ONLY = new MediaConstraints(true, false);

    public static final MediaConstraints VIDEO_ONLY = new MediaConstraints(false, true);

    public static final MediaConstraints AUDIO_AND_VIDEO = new MediaConstraints(true, true);

    private final boolean audio;

    private final boolean video;

    public MediaConstraints(boolean audio, boolean video)
    {
        this.audio = audio;
        this.video = video;
    }

    public boolean isAudio()
    {
        return audio;
    }

    public boolean isVideo()
    {
        return video;
    }

    @Override
    public String toString()
    {
        return "MediaConstraints[audio=" + audio + ", video=" + video + "]";
    }
}
