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
 * Maps participant identifiers to {@link Participant}s. At most one
 * participant is registered per identifier.
 */
public class ParticipantRegistry
{
    private final ConcurrentHashMap<String, Participant> participantsById = new ConcurrentHashMap<>();

    /**
     * Registers a participant.
     *
     * @return the participant previously registered with the same
     * identifier, which is no longer registered, or <tt>null</tt>.
     */
    public @Nullable Participant add(@NotNull Participant participant)
    {
        return participantsById.put(participant.getId(), participant);
    }

    /**
     * Unregisters a participant.
     *
     * @return the participant which was removed, or <tt>null</tt> if none was
     * registered with <tt>id</tt>.
     */
    public @Nullable Participant remove(@NotNull String id)
    {
        return participantsById.remove(id);
    }

    public @Nullable Participant get(@NotNull String id)
    {
        return participantsById.get(id);
    }

    public boolean contains(@NotNull String id)
    {
        return participantsById.containsKey(id);
    }

    /**
     * @return the participant which owns <tt>connection</tt>, or
     * <tt>null</tt>.
     */
    public @Nullable Participant findByConnection(@NotNull PeerConnection connection)
    {
        for (Participant participant : participantsById.values())
        {
            if (participant.getConnection() == connection)
            {
                return participant;
            }
        }
        return null;
    }

    /**
     * @return a snapshot of the registered participants.
     */
    public @NotNull List<Participant> getParticipants()
    {
        return new ArrayList<>(participantsById.values());
    }

    public int size()
    {
        return participantsById.size();
    }
}
