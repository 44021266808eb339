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

package com.linagora.federation.scheduling.candidate;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import jakarta.inject.Inject;

import com.google.common.base.Preconditions;
import com.linagora.federation.scheduling.SchedulingConfiguration;
import com.linagora.federation.scheduling.availability.SubjectAvailability;
import com.linagora.federation.storage.model.TimeInterval;
import com.linagora.federation.storage.session.Candidate;
import com.linagora.federation.storage.session.CandidateId;
import com.linagora.federation.storage.session.SessionId;

/**
 * Walks the window on a fixed step and keeps the slots free for every subject,
 * best score first, ties broken by the earliest start.
 */
public class CandidateGenerator {

    public record GenerationRequest(SessionId sessionId,
                                    TimeInterval window,
                                    Duration duration,
                                    int maxCandidates,
                                    List<SubjectAvailability> availabilities) {
        public GenerationRequest {
            Preconditions.checkNotNull(sessionId, "'sessionId' must not be null");
            Preconditions.checkNotNull(window, "'window' must not be null");
            Preconditions.checkNotNull(duration, "'duration' must not be null");
            Preconditions.checkArgument(!duration.isNegative() && !duration.isZero(), "'duration' must be positive");
            Preconditions.checkArgument(maxCandidates > 0, "'maxCandidates' must be positive");
            Preconditions.checkNotNull(availabilities, "'availabilities' must not be null");
        }
    }

    private record ScoredSlot(TimeInterval slot, CandidateScorer.Score score) {
    }

    private static final Comparator<ScoredSlot> BEST_FIRST = Comparator
        .comparingInt((ScoredSlot scored) -> scored.score().value()).reversed()
        .thenComparing(scored -> scored.slot().start());

    private final Duration step;
    private final CandidateScorer scorer;

    @Inject
    public CandidateGenerator(SchedulingConfiguration configuration) {
        this(configuration.slotStep(), new CandidateScorer(configuration.scoringTimeZone()));
    }

    public CandidateGenerator(Duration step, CandidateScorer scorer) {
        Preconditions.checkArgument(!step.isNegative() && !step.isZero(), "'step' must be positive");
        this.step = step;
        this.scorer = scorer;
    }

    public List<Candidate> generate(GenerationRequest request) {
        return slots(request.window(), request.duration())
            .filter(slot -> request.availabilities().stream().noneMatch(availability -> availability.isBlocked(slot)))
            .map(slot -> new ScoredSlot(slot, scorer.score(slot, request.window(), request.availabilities())))
            .sorted(BEST_FIRST)
            .limit(request.maxCandidates())
            .map(scored -> new Candidate(CandidateId.generate(), request.sessionId(),
                scored.slot().start(), scored.slot().end(), scored.score().value(), scored.score().explanation()))
            .toList();
    }

    private Stream<TimeInterval> slots(TimeInterval window, Duration duration) {
        Instant windowEnd = window.end();
        return Stream.iterate(window.start(),
                slotStart -> !slotStart.plus(duration).isAfter(windowEnd),
                slotStart -> slotStart.plus(step))
            .map(slotStart -> TimeInterval.of(slotStart, duration));
    }
}
