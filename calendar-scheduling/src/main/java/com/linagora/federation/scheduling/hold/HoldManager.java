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

package com.linagora.federation.scheduling.hold;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

import jakarta.inject.Inject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.linagora.federation.storage.hold.Hold;
import com.linagora.federation.storage.hold.HoldDAO;
import com.linagora.federation.storage.model.SubjectId;
import com.linagora.federation.storage.model.TimeInterval;
import com.linagora.federation.storage.session.Candidate;
import com.linagora.federation.storage.session.SessionId;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class HoldManager {
    public static final Duration MIN_EXTENSION = Duration.ofHours(1);
    public static final Duration MAX_EXTENSION = Duration.ofHours(72);

    private static final Logger LOGGER = LoggerFactory.getLogger(HoldManager.class);

    private final HoldDAO holdDAO;
    private final Clock clock;

    @Inject
    public HoldManager(HoldDAO holdDAO, Clock clock) {
        this.holdDAO = holdDAO;
        this.clock = clock;
    }

    /**
     * One held hold per candidate and subject, expiring after {@code holdTimeout}. A zero timeout creates none.
     */
    public Mono<List<Hold>> createHolds(SessionId sessionId, List<Candidate> candidates, Collection<SubjectId> subjects, Duration holdTimeout) {
        Preconditions.checkArgument(!holdTimeout.isNegative(), "holdTimeout must not be negative");
        if (holdTimeout.isZero() || candidates.isEmpty()) {
            return Mono.just(List.of());
        }
        Instant expiresAt = clock.instant().plus(holdTimeout);
        List<Hold> holds = candidates.stream()
            .flatMap(candidate -> subjects.stream()
                .map(subject -> Hold.held(sessionId, subject, candidate.interval(), expiresAt)))
            .toList();
        return holdDAO.create(holds)
            .doOnSuccess(any -> LOGGER.debug("Created {} hold(s) for session {} expiring at {}", holds.size(), sessionId.value(), expiresAt))
            .thenReturn(holds);
    }

    public Mono<Long> releaseAllHoldsForSession(SessionId sessionId) {
        return holdDAO.releaseBySession(sessionId)
            .doOnNext(count -> LOGGER.debug("Released {} hold(s) of session {}", count, sessionId.value()));
    }

    public static void validateExtension(Duration extension) {
        Preconditions.checkNotNull(extension, "'extension' must not be null");
        Preconditions.checkArgument(extension.compareTo(MIN_EXTENSION) >= 0 && extension.compareTo(MAX_EXTENSION) <= 0,
            "extension must be between 1h and 72h");
    }

    public Mono<List<Hold>> extendHolds(SessionId sessionId, Duration extension) {
        validateExtension(extension);
        Instant expiresAt = clock.instant().plus(extension);
        return holdDAO.extend(sessionId, expiresAt)
            .doOnNext(count -> LOGGER.info("Extended {} hold(s) of session {} until {}", count, sessionId.value(), expiresAt))
            .then(getHolds(sessionId));
    }

    public Mono<List<Hold>> getHolds(SessionId sessionId) {
        return holdDAO.listBySession(sessionId).collectList();
    }

    public Flux<Hold> findConflicts(SubjectId subject, TimeInterval interval) {
        return holdDAO.listActiveBySubject(subject, clock.instant())
            .filter(hold -> hold.interval().overlaps(interval));
    }

    public Mono<Long> expireHolds(Instant now) {
        return holdDAO.expire(now);
    }
}
