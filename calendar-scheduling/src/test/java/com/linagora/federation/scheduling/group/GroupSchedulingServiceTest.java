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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.james.core.Username;
import org.apache.james.metrics.tests.RecordingMetricFactory;
import org.apache.james.utils.UpdatableTickingClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.linagora.federation.scheduling.SchedulingConfiguration;
import com.linagora.federation.scheduling.availability.AvailabilityResolver;
import com.linagora.federation.scheduling.candidate.CandidateGenerator;
import com.linagora.federation.scheduling.exception.AvailabilityUnavailableException;
import com.linagora.federation.scheduling.exception.CandidateNotFoundException;
import com.linagora.federation.scheduling.exception.GroupCommitException;
import com.linagora.federation.scheduling.exception.NotAParticipantException;
import com.linagora.federation.scheduling.exception.SessionAlreadyCommittedException;
import com.linagora.federation.scheduling.exception.SessionCancelledException;
import com.linagora.federation.scheduling.exception.SessionNotFoundException;
import com.linagora.federation.scheduling.hold.HoldManager;
import com.linagora.federation.storage.constraint.MemoryConstraintDAO;
import com.linagora.federation.storage.event.CanonicalEvent;
import com.linagora.federation.storage.event.CanonicalEvent.CreationRequest;
import com.linagora.federation.storage.event.CanonicalEventDAO;
import com.linagora.federation.storage.event.EventId;
import com.linagora.federation.storage.event.MemoryCanonicalEventDAO;
import com.linagora.federation.storage.group.GroupSession;
import com.linagora.federation.storage.group.GroupSessionDAO;
import com.linagora.federation.storage.group.GroupSessionRegistration;
import com.linagora.federation.storage.group.MemoryGroupSessionDAO;
import com.linagora.federation.storage.group.MemoryGroupSessionRegistry;
import com.linagora.federation.storage.hold.Hold;
import com.linagora.federation.storage.hold.MemoryHoldDAO;
import com.linagora.federation.storage.milestone.MemoryMilestoneDAO;
import com.linagora.federation.storage.model.CalendarId;
import com.linagora.federation.storage.model.SubjectId;
import com.linagora.federation.storage.model.TimeInterval;
import com.linagora.federation.storage.session.Candidate;
import com.linagora.federation.storage.session.CandidateId;
import com.linagora.federation.storage.session.SessionId;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

class GroupSchedulingServiceTest {
    static final Username ALICE = Username.of("alice@linagora.com");
    static final Username BOB = Username.of("bob@linagora.com");
    static final Username CAROL = Username.of("carol@linagora.com");
    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    static final Instant WINDOW_START = Instant.parse("2026-03-02T09:00:00Z");
    static final Instant WINDOW_END = Instant.parse("2026-03-02T17:00:00Z");
    static final TimeInterval ALICE_BUSY = new TimeInterval(Instant.parse("2026-03-02T09:00:00Z"), Instant.parse("2026-03-02T10:00:00Z"));
    static final TimeInterval BOB_BUSY = new TimeInterval(Instant.parse("2026-03-02T10:00:00Z"), Instant.parse("2026-03-02T11:00:00Z"));

    MemoryCanonicalEventDAO canonicalEventDAO;
    MemoryHoldDAO holdDAO;
    MemoryGroupSessionDAO groupSessionDAO;
    MemoryGroupSessionRegistry registry;
    UpdatableTickingClock clock;
    RecordingMetricFactory metricFactory;
    GroupSchedulingService testee;

    @BeforeEach
    void setUp() {
        canonicalEventDAO = new MemoryCanonicalEventDAO();
        holdDAO = new MemoryHoldDAO();
        groupSessionDAO = new MemoryGroupSessionDAO();
        registry = new MemoryGroupSessionRegistry();
        clock = new UpdatableTickingClock(NOW);
        metricFactory = new RecordingMetricFactory();
        testee = service(canonicalEventDAO);

        busy(ALICE, ALICE_BUSY, "Secret Salary Review");
        busy(BOB, BOB_BUSY, "Therapy");
    }

    GroupSchedulingService service(CanonicalEventDAO eventDAO) {
        return service(eventDAO, groupSessionDAO);
    }

    GroupSchedulingService service(CanonicalEventDAO eventDAO, GroupSessionDAO sessionDAO) {
        SchedulingConfiguration configuration = SchedulingConfiguration.DEFAULT;
        AvailabilityResolver resolver = new AvailabilityResolver(eventDAO, new MemoryConstraintDAO(),
            new MemoryMilestoneDAO(), holdDAO, configuration, clock);
        return new GroupSchedulingService(sessionDAO, registry, eventDAO, resolver,
            new CandidateGenerator(configuration), new HoldManager(holdDAO, clock), configuration, clock, metricFactory);
    }

    void busy(Username user, TimeInterval interval, String title) {
        canonicalEventDAO.create(new CreationRequest(SubjectId.of(user), CalendarId.PRIMARY, title, interval,
            CanonicalEvent.Source.PROVIDER, CanonicalEvent.Status.CONFIRMED, CanonicalEvent.Transparency.OPAQUE)).block();
    }

    static CreateGroupSessionRequest request(Username creator, Username... participants) {
        return new CreateGroupSessionRequest(creator, List.of(participants), "Roadmap review", 60, WINDOW_START, WINDOW_END);
    }

    List<CanonicalEvent> systemEventsOf(Username user) {
        return canonicalEventDAO.list(SubjectId.of(user))
            .filter(event -> event.source() == CanonicalEvent.Source.SYSTEM)
            .collectList()
            .block();
    }

    @Nested
    class Create {
        @Test
        void candidatesShouldAvoidEveryParticipantBusyTime() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB).withMaxCandidates(20)).block();

            assertThat(session.status()).isEqualTo(GroupSession.Status.CANDIDATES_READY);
            assertThat(session.candidates()).isNotEmpty();
            assertThat(session.candidates()).noneMatch(candidate -> candidate.interval().overlaps(ALICE_BUSY)
                || candidate.interval().overlaps(BOB_BUSY));
        }

        @Test
        void bestCandidateShouldBeTheFirstSlotFreeForEveryone() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();

            assertThat(session.candidates().get(0).start()).isEqualTo(Instant.parse("2026-03-02T11:00:00Z"));
        }

        @Test
        void holdsShouldBePlacedForEveryParticipant() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB).withMaxCandidates(3)).block();

            List<Hold> holds = holdDAO.listBySession(session.sessionId()).collectList().block();
            assertThat(holds).hasSize(6);
            assertThat(holds).extracting(Hold::subject).containsOnly(SubjectId.of(ALICE), SubjectId.of(BOB));
        }

        @Test
        void sessionShouldBeRegisteredForEveryParticipant() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();

            assertThat(testee.listGroupSessions(BOB).collectList().block())
                .extracting(GroupSessionRegistration::sessionId)
                .containsExactly(session.sessionId());
            assertThat(testee.listGroupSessions(CAROL).collectList().block()).isEmpty();
        }

        @Test
        void fullyBusyParticipantShouldLeaveTheSessionGathering() {
            busy(CAROL, new TimeInterval(WINDOW_START, WINDOW_END), "Offsite");

            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, CAROL)).block();

            assertThat(session.status()).isEqualTo(GroupSession.Status.GATHERING);
            assertThat(session.candidates()).isEmpty();
        }

        @Test
        void sessionShouldNeverExposeParticipantEventTitles() throws Exception {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();

            String json = new GroupSessionSerializer().serialize(session);

            assertThat(json).doesNotContain("Secret Salary Review", "Therapy");
            assertThat(session.candidates()).extracting(Candidate::explanation)
                .noneMatch(explanation -> explanation.contains("Secret Salary Review") || explanation.contains("Therapy"));
        }

        @Test
        void createShouldRecordItsDuration() {
            testee.createGroupSession(request(ALICE, ALICE, BOB)).block();

            assertThat(metricFactory.executionTimesFor("federation.scheduling.group.create.duration")).hasSize(1);
        }

        @Test
        void unreadableParticipantShouldAbortTheCreation() {
            CanonicalEventDAO failingForBob = spy(canonicalEventDAO);
            doReturn(Flux.error(new RuntimeException("provider down")))
                .when(failingForBob).getBusyIntervals(eq(SubjectId.of(BOB)), any(Instant.class), any(Instant.class));
            GroupSchedulingService failingService = service(failingForBob);

            assertThatThrownBy(() -> failingService.createGroupSession(request(ALICE, ALICE, BOB)).block())
                .isInstanceOf(AvailabilityUnavailableException.class);

            assertThat(registry.listByParticipant(ALICE).collectList().block()).isEmpty();
            assertThat(registry.listByParticipant(BOB).collectList().block()).isEmpty();
            assertThat(holdDAO.listActiveBySubject(SubjectId.of(ALICE), NOW).collectList().block()).isEmpty();
            assertThat(holdDAO.listActiveBySubject(SubjectId.of(BOB), NOW).collectList().block()).isEmpty();
        }
    }

    @Nested
    class Validation {
        @Test
        void singleParticipantShouldBeRejected() {
            assertThatThrownBy(() -> request(ALICE, ALICE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("At least two participant user IDs are required for group scheduling");
        }

        @Test
        void duplicatedParticipantShouldCountOnce() {
            assertThatThrownBy(() -> request(ALICE, ALICE, ALICE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("At least two participant user IDs are required for group scheduling");
        }

        @Test
        void creatorShouldBeAParticipant() {
            assertThatThrownBy(() -> request(ALICE, BOB, CAROL))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Creator must be included in participant list");
        }

        @Test
        void commonRulesShouldApply() {
            assertThatThrownBy(() -> new CreateGroupSessionRequest(ALICE, List.of(ALICE, BOB), "Roadmap review", 5, WINDOW_START, WINDOW_END))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("durationMinutes must be between 15 and 480");
        }
    }

    @Nested
    class Access {
        @Test
        void participantShouldReadTheSession() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();

            assertThat(testee.getGroupSession(session.sessionId(), BOB).block()).isEqualTo(session);
        }

        @Test
        void nonParticipantShouldBeRejected() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();

            assertThatThrownBy(() -> testee.getGroupSession(session.sessionId(), CAROL).block())
                .isInstanceOf(NotAParticipantException.class)
                .hasMessage("User " + CAROL.asString() + " is not a participant in session " + session.sessionId().value());
            assertThatThrownBy(() -> testee.commitGroupSession(session.sessionId(), session.candidates().get(0).candidateId(), CAROL).block())
                .isInstanceOf(NotAParticipantException.class);
            assertThatThrownBy(() -> testee.cancelGroupSession(session.sessionId(), CAROL).block())
                .isInstanceOf(NotAParticipantException.class);
        }

        @Test
        void unknownSessionShouldNotBeFound() {
            assertThatThrownBy(() -> testee.getGroupSession(SessionId.generate(), ALICE).block())
                .isInstanceOf(SessionNotFoundException.class);
        }
    }

    @Nested
    class Commit {
        @Test
        void commitShouldWriteOneEventPerParticipant() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();
            Candidate chosen = session.candidates().get(0);

            GroupCommitResult result = testee.commitGroupSession(session.sessionId(), chosen.candidateId(), BOB).block();

            assertThat(result.eventIds()).containsOnlyKeys(ALICE, BOB);
            assertThat(systemEventsOf(ALICE)).singleElement().satisfies(event -> {
                assertThat(event.title()).isEqualTo("Roadmap review");
                assertThat(event.interval()).isEqualTo(chosen.interval());
                assertThat(event.eventId()).isEqualTo(result.eventIds().get(ALICE));
            });
            assertThat(systemEventsOf(BOB)).singleElement()
                .satisfies(event -> assertThat(event.eventId()).isEqualTo(result.eventIds().get(BOB)));
        }

        @Test
        void commitShouldMarkTheSessionCommitted() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();
            CandidateId chosen = session.candidates().get(0).candidateId();

            GroupCommitResult result = testee.commitGroupSession(session.sessionId(), chosen, ALICE).block();

            assertThat(result.session().status()).isEqualTo(GroupSession.Status.COMMITTED);
            assertThat(result.session().committedCandidateId()).contains(chosen);
            assertThat(testee.getGroupSession(session.sessionId(), BOB).block().status()).isEqualTo(GroupSession.Status.COMMITTED);
            assertThat(registry.find(session.sessionId()).block().status()).isEqualTo(GroupSession.Status.COMMITTED);
            assertThat(metricFactory.countFor("federation.scheduling.group.commit")).isEqualTo(1);
        }

        @Test
        void commitShouldReleaseTheHolds() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();

            testee.commitGroupSession(session.sessionId(), session.candidates().get(0).candidateId(), ALICE).block();

            assertThat(holdDAO.listBySession(session.sessionId()).collectList().block())
                .isNotEmpty()
                .extracting(Hold::status)
                .containsOnly(Hold.Status.RELEASED);
        }

        @Test
        void secondCommitShouldFail() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();
            testee.commitGroupSession(session.sessionId(), session.candidates().get(0).candidateId(), ALICE).block();

            assertThatThrownBy(() -> testee.commitGroupSession(session.sessionId(), session.candidates().get(1).candidateId(), BOB).block())
                .isInstanceOf(SessionAlreadyCommittedException.class)
                .hasMessage("Session " + session.sessionId().value() + " is already committed");
            assertThat(systemEventsOf(ALICE)).hasSize(1);
            assertThat(systemEventsOf(BOB)).hasSize(1);
        }

        @Test
        void concurrentCommitsShouldWriteEventsOnce() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();
            CandidateId first = session.candidates().get(0).candidateId();
            CandidateId second = session.candidates().get(1).candidateId();

            List<GroupCommitResult> results = Flux.just(Map.entry(ALICE, first), Map.entry(BOB, second))
                .flatMap(entry -> testee.commitGroupSession(session.sessionId(), entry.getValue(), entry.getKey())
                    .onErrorResume(SessionAlreadyCommittedException.class, e -> Mono.empty())
                    .subscribeOn(Schedulers.parallel()))
                .collectList()
                .block();

            assertThat(results).hasSize(1);
            assertThat(systemEventsOf(ALICE)).hasSize(1);
            assertThat(systemEventsOf(BOB)).hasSize(1);
        }

        @Test
        void unknownCandidateShouldFail() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();

            assertThatThrownBy(() -> testee.commitGroupSession(session.sessionId(), CandidateId.generate(), ALICE).block())
                .isInstanceOf(CandidateNotFoundException.class);
            assertThat(registry.find(session.sessionId()).block().status()).isEqualTo(GroupSession.Status.CANDIDATES_READY);
        }

        @Test
        void failedWriteShouldBeCompensated() {
            CanonicalEventDAO failingForBob = spy(canonicalEventDAO);
            doReturn(Mono.error(new RuntimeException("provider down")))
                .when(failingForBob).create(argThat(request -> request != null && request.subject().equals(SubjectId.of(BOB))));
            GroupSchedulingService failingService = service(failingForBob);
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();

            assertThatThrownBy(() -> failingService.commitGroupSession(session.sessionId(), session.candidates().get(0).candidateId(), ALICE).block())
                .isInstanceOfSatisfying(GroupCommitException.class, e -> {
                    assertThat(e.sessionId()).isEqualTo(session.sessionId());
                    assertThat(e.succeededParticipants()).containsExactly(ALICE);
                    assertThat(e.failedParticipant()).isEqualTo(BOB);
                })
                .hasRootCauseMessage("provider down");

            assertThat(systemEventsOf(ALICE)).isEmpty();
            assertThat(registry.find(session.sessionId()).block().status()).isEqualTo(GroupSession.Status.CANDIDATES_READY);
            assertThat(holdDAO.listBySession(session.sessionId()).collectList().block())
                .extracting(Hold::status)
                .containsOnly(Hold.Status.HELD);
        }

        @Test
        void commitShouldBePossibleAgainAfterACompensatedFailure() {
            CanonicalEventDAO failingForBob = spy(canonicalEventDAO);
            doReturn(Mono.error(new RuntimeException("provider down")))
                .when(failingForBob).create(argThat(request -> request != null && request.subject().equals(SubjectId.of(BOB))));
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();
            CandidateId chosen = session.candidates().get(0).candidateId();
            Mono<GroupCommitResult> failing = service(failingForBob).commitGroupSession(session.sessionId(), chosen, ALICE);
            assertThatThrownBy(failing::block).isInstanceOf(GroupCommitException.class);

            Map<Username, EventId> eventIds = testee.commitGroupSession(session.sessionId(), chosen, ALICE).block().eventIds();

            assertThat(eventIds).containsOnlyKeys(ALICE, BOB);
            assertThat(systemEventsOf(ALICE)).hasSize(1);
        }

        @Test
        void unstoredCommittedStateShouldNotHideTheCommit() {
            GroupSessionDAO failingOnCommit = spy(groupSessionDAO);
            doReturn(Mono.error(new RuntimeException("store down")))
                .when(failingOnCommit).save(argThat(saved -> saved != null && saved.status() == GroupSession.Status.COMMITTED));
            GroupSchedulingService failingService = service(canonicalEventDAO, failingOnCommit);
            GroupSession session = failingService.createGroupSession(request(ALICE, ALICE, BOB)).block();

            GroupCommitResult result = failingService.commitGroupSession(session.sessionId(), session.candidates().get(0).candidateId(), ALICE).block();

            assertThat(result.eventIds()).containsOnlyKeys(ALICE, BOB);
            assertThat(groupSessionDAO.find(session.sessionId()).block().status()).isEqualTo(GroupSession.Status.CANDIDATES_READY);
            assertThat(failingService.getGroupSession(session.sessionId(), BOB).block().status()).isEqualTo(GroupSession.Status.COMMITTED);
            assertThat(holdDAO.listBySession(session.sessionId()).collectList().block())
                .extracting(Hold::status)
                .containsOnly(Hold.Status.RELEASED);
        }
    }

    @Nested
    class Cancel {
        @Test
        void anyParticipantShouldCancel() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();

            GroupSession cancelled = testee.cancelGroupSession(session.sessionId(), BOB).block();

            assertThat(cancelled.status()).isEqualTo(GroupSession.Status.CANCELLED);
            assertThat(registry.find(session.sessionId()).block().status()).isEqualTo(GroupSession.Status.CANCELLED);
            assertThat(holdDAO.listBySession(session.sessionId()).collectList().block())
                .extracting(Hold::status)
                .containsOnly(Hold.Status.RELEASED);
        }

        @Test
        void commitAfterCancelShouldFail() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();
            testee.cancelGroupSession(session.sessionId(), ALICE).block();

            assertThatThrownBy(() -> testee.commitGroupSession(session.sessionId(), session.candidates().get(0).candidateId(), BOB).block())
                .isInstanceOf(SessionCancelledException.class);
            assertThat(systemEventsOf(ALICE)).isEmpty();
        }

        @Test
        void cancelAfterCommitShouldFail() {
            GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB)).block();
            testee.commitGroupSession(session.sessionId(), session.candidates().get(0).candidateId(), ALICE).block();

            assertThatThrownBy(() -> testee.cancelGroupSession(session.sessionId(), BOB).block())
                .isInstanceOf(SessionAlreadyCommittedException.class);
        }
    }

    @Test
    void holdTimeoutOverrideShouldBeKept() {
        GroupSession session = testee.createGroupSession(request(ALICE, ALICE, BOB).withHoldTimeout(Duration.ofHours(2))).block();

        assertThat(session.holdTimeout()).isEqualTo(Duration.ofHours(2));
        assertThat(session.committedCandidateId()).isEqualTo(Optional.empty());
    }
}
