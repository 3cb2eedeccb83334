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
import java.util.concurrent.*;

/**
 * The stream to which the SFU binds all tracks which arrived from one inbound
 * stream when it forwards them to other participants. Its identifier is the
 * identifier of the inbound stream, so receivers group the forwarded tracks
 * the way the sender grouped them.
 */
public class MixedStream
    implements MediaStream
{
    @NotNull
    private final String id;

    private final CopyOnWriteArrayList<MediaStreamTrack> tracks = new CopyOnWriteArrayList<>();

    public MixedStream(@NotNull String id)
    {
        this.id = Objects.requireNonNull(id, "id");
    }

    @Override
    public @NotNull String getId()
    {
        return id;
    }

    @Override
    public @NotNull List<MediaStreamTrack> getTracks()
    {
        return new ArrayList<>(tracks);
    }

    /**
     * Adds a member track.
     *
     * @return <tt>true</tt> if the track was not yet a member.
     */
    public boolean addTrack(@NotNull MediaStreamTrack track)
    {
        return tracks.addIfAbsent(track);
    }

    @Override
    public String toString()
    {
        return "MixedStream[" + id + ", " + tracks.size() + " tracks]";
    }
}
