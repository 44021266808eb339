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

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.Range;
import com.linagora.federation.scheduling.availability.SubjectAvailability;
import com.linagora.federation.scheduling.candidate.CandidateGenerator.GenerationRequest;
import com.linagora.federation.storage.model.SubjectId;
import com.linagora.federation.storage.model.TimeInterval;
import com.linagora.federation.storage.session.Candidate;
import com.linagora.federation.storage.session.SessionId;

class CandidateGeneratorTest {
    static final SessionId SESSION_ID = SessionId.generate();
    static final TimeInterval MORNING = new TimeInterval(Instant.parse("2026-03-02T09:00:00Z"), Instant.parse("2026-03-02T12:00:00Z"));
    static final Duration ONE_HOUR = Duration.ofHours(1);

    CandidateGenerator testee = new CandidateGenerator(Duration.ofMinutes(30), new CandidateScorer(ZoneOffset.UTC));

    static SubjectAvailability busy(String subject, String start, String end) {
        return SubjectAvailability.of(new SubjectId(subject),
            ImmutableRangeSet.of(Range.closedOpen(Instant.parse(start), Instant.parse(end))), Optional.empty());
    }

    static SubjectAvailability free(String subject) {
        return SubjectAvailability.of(new SubjectId(subject), ImmutableRangeSet.of(), Optional.empty());
    }

    @Test
    void generateShouldSkipSlotsOverlappingHardBlocks() {
        List<Candidate> candidates = testee.generate(new GenerationRequest(SESSION_ID, MORNING, ONE_HOUR, 10,
            List.of(busy("acc_1", "2026-03-02T10:00:00Z", "2026-03-02T11:00:00Z"))));

        assertThat(candidates)
            .extracting(Candidate::start)
            .containsExactly(Instant.parse("2026-03-02T09:00:00Z"), Instant.parse("2026-03-02T11:00:00Z"));
    }

    @Test
    void generateShouldBreakScoreTiesByEarliestStart() {
        List<Candidate> candidates = testee.generate(new GenerationRequest(SESSION_ID, MORNING, ONE_HOUR, 1,
            List.of(busy("acc_1", "2026-03-02T10:00:00Z", "2026-03-02T11:00:00Z"))));

        assertThat(candidates)
            .extracting(Candidate::start)
            .containsExactly(Instant.parse("2026-03-02T09:00:00Z"));
    }

    @Test
    void generateShouldRequireEverySubjectToBeFree() {
        List<Candidate> candidates = testee.generate(new GenerationRequest(SESSION_ID, MORNING, ONE_HOUR, 10,
            List.of(busy("alice", "2026-03-02T09:00:00Z", "2026-03-02T10:00:00Z"),
                busy("bob", "2026-03-02T10:00:00Z", "2026-03-02T11:00:00Z"))));

        assertThat(candidates)
            .extracting(Candidate::start)
            .containsExactly(Instant.parse("2026-03-02T11:00:00Z"));
    }

    @Test
    void generateShouldRespectMaxCandidates() {
        List<Candidate> candidates = testee.generate(new GenerationRequest(SESSION_ID, MORNING, ONE_HOUR, 3,
            List.of(free("acc_1"))));

        assertThat(candidates).hasSize(3);
    }

    @Test
    void generateShouldKeepSlotsInsideTheWindow() {
        List<Candidate> candidates = testee.generate(new GenerationRequest(SESSION_ID, MORNING, ONE_HOUR, 10,
            List.of(free("acc_1"))));

        assertThat(candidates).hasSize(5);
        assertThat(candidates).allSatisfy(candidate -> {
            assertThat(candidate.start()).isAfterOrEqualTo(MORNING.start());
            assertThat(candidate.end()).isBeforeOrEqualTo(MORNING.end());
            assertThat(Duration.between(candidate.start(), candidate.end())).isEqualTo(ONE_HOUR);
        });
    }

    @Test
    void generateShouldSortByScoreDescending() {
        TimeInterval week = new TimeInterval(Instant.parse("2026-03-02T00:00:00Z"), Instant.parse("2026-03-09T00:00:00Z"));

        List<Candidate> candidates = testee.generate(new GenerationRequest(SESSION_ID, week, ONE_HOUR, 20,
            List.of(free("acc_1"))));

        assertThat(candidates).extracting(Candidate::score).isSortedAccordingTo((a, b) -> Integer.compare(b, a));
        assertThat(candidates).allSatisfy(candidate -> {
            assertThat(candidate.sessionId()).isEqualTo(SESSION_ID);
            assertThat(candidate.score()).isNotNegative();
            assertThat(candidate.explanation()).isNotBlank();
        });
    }

    @Test
    void generateShouldReturnNothingWhenFullyBlocked() {
        List<Candidate> candidates = testee.generate(new GenerationRequest(SESSION_ID, MORNING, ONE_HOUR, 10,
            List.of(busy("acc_1", "2026-03-02T08:00:00Z", "2026-03-02T13:00:00Z"))));

        assertThat(candidates).isEmpty();
    }

    @Test
    void generateShouldReturnNothingWhenWindowIsShorterThanDuration() {
        TimeInterval shortWindow = new TimeInterval(Instant.parse("2026-03-02T09:00:00Z"), Instant.parse("2026-03-02T09:45:00Z"));

        List<Candidate> candidates = testee.generate(new GenerationRequest(SESSION_ID, shortWindow, ONE_HOUR, 10,
            List.of(free("acc_1"))));

        assertThat(candidates).isEmpty();
    }

    @Test
    void candidateIdsShouldBeUnique() {
        List<Candidate> candidates = testee.generate(new GenerationRequest(SESSION_ID, MORNING, ONE_HOUR, 10,
            List.of(free("acc_1"))));

        assertThat(candidates).extracting(Candidate::candidateId).doesNotHaveDuplicates();
    }
}
