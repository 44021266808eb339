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

package com.linagora.federation.storage.group;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.apache.james.core.Username;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.linagora.federation.storage.session.Candidate;
import com.linagora.federation.storage.session.CandidateId;
import com.linagora.federation.storage.session.SessionId;

public record GroupSession(SessionId sessionId,
                           Username creator,
                           List<Username> participants,
                           String title,
                           int durationMinutes,
                           Instant windowStart,
                           Instant windowEnd,
                           int maxCandidates,
                           Duration holdTimeout,
                           Status status,
                           List<Candidate> candidates,
                           Optional<CandidateId> committedCandidateId,
                           Instant createdAt) {

    public enum Status {
        GATHERING("gathering"),
        CANDIDATES_READY("candidates_ready"),
        COMMITTED("committed"),
        CANCELLED("cancelled");

        public static Status parse(String value) {
            for (Status status : values()) {
                if (status.value.equals(value)) {
                    return status;
                }
            }
            throw new IllegalArgumentException("Unknown group session status: " + value);
        }

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

    public GroupSession {
        Preconditions.checkNotNull(sessionId, "'sessionId' must not be null");
        Preconditions.checkNotNull(creator, "'creator' must not be null");
        Preconditions.checkNotNull(status, "'status' must not be null");
        Preconditions.checkNotNull(committedCandidateId, "'committedCandidateId' must not be null");
        participants = ImmutableList.copyOf(participants);
        candidates = ImmutableList.copyOf(candidates);
    }

    public boolean isParticipant(Username username) {
        return participants.contains(username);
    }

    public Optional<Candidate> findCandidate(CandidateId candidateId) {
        return candidates.stream()
            .filter(candidate -> candidate.candidateId().equals(candidateId))
            .findFirst();
    }

    public GroupSession withStatus(Status status) {
        return new GroupSession(sessionId, creator, participants, title, durationMinutes, windowStart, windowEnd,
            maxCandidates, holdTimeout, status, candidates, committedCandidateId, createdAt);
    }

    public GroupSession committed(CandidateId candidateId) {
        return new GroupSession(sessionId, creator, participants, title, durationMinutes, windowStart, windowEnd,
            maxCandidates, holdTimeout, Status.COMMITTED, candidates, Optional.of(candidateId), createdAt);
    }

    public GroupSessionRegistration asRegistration(Instant updatedAt) {
        return new GroupSessionRegistration(sessionId, creator, participants, title, status, createdAt, updatedAt);
    }
}
