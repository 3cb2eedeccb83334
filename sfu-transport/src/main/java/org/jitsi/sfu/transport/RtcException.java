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

/**
 * An error reported by the transport engine, e.g. when an operation is
 * attempted on a connection which has already been closed.
 */
public class RtcException
    extends RuntimeException
{
    /**
     * The reasons an engine operation can fail with.
     */
    public enum Reason
    {
        NO_ERROR,
        INVALID_CONSTRAINTS_TYPE,
        INVALID_CANDIDATE_TYPE,
        INVALID_STATE,
        INVALID_SESSION_DESCRIPTION,
        INCOMPATIBLE_SESSION_DESCRIPTION,
        INCOMPATIBLE_CONSTRAINTS,
        INTERNAL_ERROR
    }

    @NotNull
    private final Reason reason;

    public RtcException(@NotNull Reason reason)
    {
        this(reason, reason.name());
    }

    public RtcException(@NotNull Reason reason, String message)
    {
        super(message);
        this.reason = reason;
    }

    public RtcException(@NotNull Reason reason, String message, Throwable cause)
    {
        super(message, cause);
        this.reason = reason;
    }

    public @NotNull Reason getReason()
    {
        return reason;
    }
}
