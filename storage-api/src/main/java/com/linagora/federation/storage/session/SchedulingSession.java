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

package com.linagora.federation.storage.session;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.apache.james.core.Username;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.linagora.federation.storage.event.EventId;
import com.linagora.federation.storage.hold.Hold;
import com.linagora.federation.storage.model.AccountId;
import com.linagora.federation.storage.model.CalendarId;

/**
 * A single-user scheduling request. {@code holds} is a read-time view of the hold table.
 */
public record SchedulingSession(SessionId sessionId,
                                Username username,
                                String title,
                                int durationMinutes,
                                Instant windowStart,
                                Instant windowEnd,
                                Set<AccountId> requiredAccountIds,
                                int maxCandidates,
                                Duration holdTimeout,
                                CalendarId targetCalendarId,
                                Status status,
                                List<Candidate> candidates,
                                List<Hold> holds,
                                Optional<CandidateId> committedCandidateId,
                                Optional<EventId> committedEventId,
                                Instant createdAt) {

    public enum Status {
        OPEN("open"),
        CANDIDATES_READY("candidates_ready"),
        COMMITTED("committed"),
        CANCELLED("cancelled");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        public boolean isTerminal() {
            return this == COMMITTED || this == CANCELLED;
        }
    }

    public SchedulingSession {
        Preconditions.checkNotNull(sessionId, "'sessionId' must not be null");
        Preconditions.checkNotNull(username, "'username' must not be null");
        Preconditions.checkNotNull(status, "'status' must not be null");
        Preconditions.checkNotNull(committedCandidateId, "'committedCandidateId' must not be null");
        Preconditions.checkNotNull(committedEventId, "'committedEventId' must not be null");
        requiredAccountIds = ImmutableSet.copyOf(requiredAccountIds);
        candidates = ImmutableList.copyOf(candidates);
        holds = ImmutableList.copyOf(holds);
    }

    public Duration duration() {
        return Duration.ofMinutes(durationMinutes);
    }

    public Optional<Candidate> findCandidate(CandidateId candidateId) {
        return candidates.stream()
            .filter(candidate -> candidate.candidateId().equals(candidateId))
            .findFirst();
    }

    public SchedulingSession withHolds(List<Hold> holds) {
        return new SchedulingSession(sessionId, username, title, durationMinutes, windowStart, windowEnd,
            requiredAccountIds, maxCandidates, holdTimeout, targetCalendarId, status, candidates, holds,
            committedCandidateId, committedEventId, createdAt);
    }

    public SchedulingSession committed(CandidateId candidateId, EventId eventId) {
        return new SchedulingSession(sessionId, username, title, durationMinutes, windowStart, windowEnd,
            requiredAccountIds, maxCandidates, holdTimeout, targetCalendarId, Status.COMMITTED, candidates, holds,
            Optional.of(candidateId), Optional.of(eventId), createdAt);
    }

    public SchedulingSession cancelled() {
        return new SchedulingSession(sessionId, username, title, durationMinutes, windowStart, windowEnd,
            requiredAccountIds, maxCandidates, holdTimeout, targetCalendarId, Status.CANCELLED, candidates, holds,
            committedCandidateId, committedEventId, createdAt);
    }
}
