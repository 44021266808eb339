/********************************************************************
 *  As a subpart of Twake Mail, this file is edited by Linagora.    *
 *                                                                  *
 *  https://twake-mail.com/                                         *
 *  https://linagora.com                                            *
 *                                                                  *
 *  This file is subject to The Affero Gnu Public License           *
 *  version 3.                                                      *
 *                                                                  *
 *  https://www.gnu.org/licenses/agpl-3.0.en.html                   *
 *                                                                  *
 *  This program is distributed in the hope that it will be         *
 *  useful, but WITHOUT ANY WARRANTY; without even the implied      *
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR         *
 *  PURPOSE. See the GNU Affero General Public License for          *
 *  more details.                                                   *
 ********************************************************************/

package com.linagora.federation.scheduling.group;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.apache.james.core.Username;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.linagora.federation.scheduling.session.CreateSessionRequest;
import com.linagora.federation.storage.model.TimeInterval;

public record CreateGroupSessionRequest(Username creator,
                                        List<Username> participants,
                                        String title,
                                        int durationMinutes,
                                        Instant windowStart,
                                        Instant windowEnd,
                                        Optional<Integer> maxCandidates,
                                        Optional<Duration> holdTimeout) {

    public CreateGroupSessionRequest(Username creator, List<Username> participants, String title, int durationMinutes,
                                     Instant windowStart, Instant windowEnd) {
        this(creator, participants, title, durationMinutes, windowStart, windowEnd, Optional.empty(), Optional.empty());
    }

    public CreateGroupSessionRequest {
        Preconditions.checkNotNull(creator, "'creator' must not be null");
        Preconditions.checkNotNull(participants, "'participants' must not be null");
        participants = participants.stream().distinct().collect(ImmutableList.toImmutableList());
        Preconditions.checkArgument(participants.size() >= 2, "At least two participant user IDs are required for group scheduling");
        Preconditions.checkArgument(participants.contains(creator), "Creator must be included in participant list");
        CreateSessionRequest.validateCommon(title, durationMinutes, windowStart, windowEnd);
        CreateSessionRequest.validateOverrides(maxCandidates, holdTimeout);
    }

    public CreateGroupSessionRequest withMaxCandidates(int maxCandidates) {
        return new CreateGroupSessionRequest(creator, participants, title, durationMinutes, windowStart, windowEnd,
            Optional.of(maxCandidates), holdTimeout);
    }

    public CreateGroupSessionRequest withHoldTimeout(Duration holdTimeout) {
        return new CreateGroupSessionRequest(creator, participants, title, durationMinutes, windowStart, windowEnd,
            maxCandidates, Optional.of(holdTimeout));
    }

    public TimeInterval window() {
        return new TimeInterval(windowStart, windowEnd);
    }

    public Duration duration() {
        return Duration.ofMinutes(durationMinutes);
    }
}
