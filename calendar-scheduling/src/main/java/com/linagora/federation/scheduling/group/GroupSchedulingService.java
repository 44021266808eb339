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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.inject.Inject;

import org.apache.james.core.Username;
import org.apache.james.metrics.api.Metric;
import org.apache.james.metrics.api.MetricFactory;
import org.apache.james.util.ReactorUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.linagora.federation.scheduling.SchedulingConfiguration;
import com.linagora.federation.scheduling.availability.AvailabilityResolver;
import com.linagora.federation.scheduling.candidate.CandidateGenerator;
import com.linagora.federation.scheduling.candidate.CandidateGenerator.GenerationRequest;
import com.linagora.federation.scheduling.exception.CandidateNotFoundException;
import com.linagora.federation.scheduling.exception.GroupCommitException;
import com.linagora.federation.scheduling.exception.NotAParticipantException;
import com.linagora.federation.scheduling.exception.SessionAlreadyCommittedException;
import com.linagora.federation.scheduling.exception.SessionCancelledException;
import com.linagora.federation.scheduling.exception.SessionNotFoundException;
import com.linagora.federation.scheduling.hold.HoldManager;
import com.linagora.federation.storage.event.CanonicalEvent.CreationRequest;
import com.linagora.federation.storage.event.CanonicalEventDAO;
import com.linagora.federation.storage.event.EventId;
import com.linagora.federation.storage.group.GroupSession;
import com.linagora.federation.storage.group.GroupSession.Status;
import com.linagora.federation.storage.group.GroupSessionDAO;
import com.linagora.federation.storage.group.GroupSessionRegistration;
import com.linagora.federation.storage.group.GroupSessionRegistry;
import com.linagora.federation.storage.model.SubjectId;
import com.linagora.federation.storage.session.Candidate;
import com.linagora.federation.storage.session.CandidateId;
import com.linagora.federation.storage.session.SessionId;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Multi-user scheduling. Availability is gathered from each participant's own store in parallel,
 * the double commit guard is a compare-and-set on the shared registry.
 */
public class GroupSchedulingService {
    private static final Logger LOGGER = LoggerFactory.getLogger(GroupSchedulingService.class);

    private static class ParticipantWriteFailure extends RuntimeException {
        private final Username participant;

        ParticipantWriteFailure(Username participant, Throwable cause) {
            super(cause);
            this.participant = participant;
        }
    }

    private final GroupSessionDAO groupSessionDAO;
    private final GroupSessionRegistry registry;
    private final CanonicalEventDAO canonicalEventDAO;
    private final AvailabilityResolver availabilityResolver;
    private final CandidateGenerator candidateGenerator;
    private final HoldManager holdManager;
    private final SchedulingConfiguration configuration;
    private final Clock clock;
    private final MetricFactory metricFactory;
    private final Metric commitMetric;

    @Inject
    public GroupSchedulingService(GroupSessionDAO groupSessionDAO, GroupSessionRegistry registry,
                                  CanonicalEventDAO canonicalEventDAO, AvailabilityResolver availabilityResolver,
                                  CandidateGenerator candidateGenerator, HoldManager holdManager,
                                  SchedulingConfiguration configuration, Clock clock, MetricFactory metricFactory) {
        this.groupSessionDAO = groupSessionDAO;
        this.registry = registry;
        this.canonicalEventDAO = canonicalEventDAO;
        this.availabilityResolver = availabilityResolver;
        this.candidateGenerator = candidateGenerator;
        this.holdManager = holdManager;
        this.configuration = configuration;
        this.clock = clock;
        this.metricFactory = metricFactory;
        this.commitMetric = metricFactory.generate("federation.scheduling.group.commit");
    }

    public Mono<GroupSession> createGroupSession(CreateGroupSessionRequest request) {
        SessionId sessionId = SessionId.generate();
        int maxCandidates = request.maxCandidates().orElse(configuration.defaultMaxCandidates());
        Duration holdTimeout = request.holdTimeout().orElse(configuration.defaultHoldTimeout());
        List<SubjectId> subjects = request.participants().stream()
            .map(SubjectId::of)
            .toList();

        return Mono.from(metricFactory.decoratePublisherWithTimerMetric("federation.scheduling.group.create.duration",
            Flux.fromIterable(request.participants())
                .flatMapSequential(participant -> availabilityResolver.resolveForParticipant(participant, request.window()),
                    ReactorUtils.DEFAULT_CONCURRENCY)
                .collectList()
                .map(availabilities -> candidateGenerator.generate(new GenerationRequest(sessionId, request.window(),
                    request.duration(), maxCandidates, availabilities)))
                .flatMap(candidates -> holdManager.createHolds(sessionId, candidates, subjects, holdTimeout)
                    .thenReturn(newSession(sessionId, request, maxCandidates, holdTimeout, candidates)))
                .flatMap(session -> groupSessionDAO.save(session)
                    .then(registry.register(session.asRegistration(session.createdAt())))
                    .thenReturn(session))
                .doOnNext(session -> LOGGER.info("Created group session {} by {} for {} participant(s) with {} candidate(s)",
                    sessionId.value(), request.creator().asString(), session.participants().size(), session.candidates().size()))));
    }

    public Mono<GroupSession> getGroupSession(SessionId sessionId, Username requestingUser) {
        return findRegistration(sessionId, requestingUser)
            .flatMap(registration -> loadSession(sessionId)
                .map(session -> reconcile(session, registration)));
    }

    public Flux<GroupSessionRegistration> listGroupSessions(Username username) {
        return registry.listByParticipant(username);
    }

    public Mono<GroupCommitResult> commitGroupSession(SessionId sessionId, CandidateId candidateId, Username committer) {
        return Mono.from(metricFactory.decoratePublisherWithTimerMetric("federation.scheduling.group.commit.duration",
            findRegistration(sessionId, committer)
                .flatMap(registration -> ensureNotTerminal(sessionId, registration.status())
                    .then(loadSession(sessionId))
                    .flatMap(session -> Mono.justOrEmpty(session.findCandidate(candidateId))
                        .switchIfEmpty(Mono.error(() -> new CandidateNotFoundException(sessionId, candidateId)))
                        .flatMap(candidate -> guardedStatusChange(sessionId, registration.status(), Status.COMMITTED)
                            .then(writeEvents(session, candidate, registration.status()))
                            .flatMap(eventIds -> finishCommit(session, candidate, eventIds)))))));
    }

    public Mono<GroupSession> cancelGroupSession(SessionId sessionId, Username requestingUser) {
        return findRegistration(sessionId, requestingUser)
            .flatMap(registration -> ensureNotTerminal(sessionId, registration.status())
                .then(guardedStatusChange(sessionId, registration.status(), Status.CANCELLED))
                .then(loadSession(sessionId))
                .flatMap(session -> groupSessionDAO.save(session.withStatus(Status.CANCELLED))
                    .then(holdManager.releaseAllHoldsForSession(sessionId))
                    .doOnNext(released -> LOGGER.info("Cancelled group session {} by {}, released {} hold(s)",
                        sessionId.value(), requestingUser.asString(), released))
                    .thenReturn(session.withStatus(Status.CANCELLED))));
    }

    private Mono<ImmutableMap<Username, EventId>> writeEvents(GroupSession session, Candidate candidate, Status previousStatus) {
        Map<Username, EventId> written = new LinkedHashMap<>();
        return Flux.fromIterable(session.participants())
            .concatMap(participant -> canonicalEventDAO.create(CreationRequest.systemConfirmed(SubjectId.of(participant),
                    configuration.defaultTargetCalendarId(), session.title(), candidate.interval()))
                .timeout(configuration.requestTimeout())
                .doOnNext(eventId -> written.put(participant, eventId))
                .onErrorMap(error -> new ParticipantWriteFailure(participant, error)))
            .then(Mono.fromCallable(() -> ImmutableMap.copyOf(written)))
            .onErrorResume(ParticipantWriteFailure.class, failure -> compensate(session.sessionId(), written, previousStatus)
                .then(Mono.error(() -> {
                    LOGGER.error("Commit of group session {} aborted, writing the event of {} failed",
                        session.sessionId().value(), failure.participant.asString(), failure.getCause());
                    return new GroupCommitException(session.sessionId(), ImmutableList.copyOf(written.keySet()),
                        failure.participant, failure.getCause());
                })));
    }

    private Mono<Void> compensate(SessionId sessionId, Map<Username, EventId> written, Status previousStatus) {
        return Flux.fromIterable(ImmutableList.copyOf(written.entrySet()))
            .concatMap(entry -> canonicalEventDAO.delete(SubjectId.of(entry.getKey()), entry.getValue())
                .timeout(configuration.requestTimeout())
                .onErrorResume(error -> {
                    LOGGER.warn("Could not delete event {} of {} while compensating group session {}",
                        entry.getValue().value(), entry.getKey().asString(), sessionId.value(), error);
                    return Mono.empty();
                }))
            .then(registry.updateStatus(sessionId, Status.COMMITTED, previousStatus, clock.instant()))
            .doOnNext(reverted -> {
                if (!reverted) {
                    LOGGER.warn("Could not revert the status of group session {} to {}", sessionId.value(), previousStatus.value());
                }
            })
            .onErrorResume(error -> {
                LOGGER.warn("Could not revert the status of group session {}", sessionId.value(), error);
                return Mono.empty();
            })
            .then();
    }

    private Mono<GroupCommitResult> finishCommit(GroupSession session, Candidate candidate, Map<Username, EventId> eventIds) {
        GroupSession committed = session.committed(candidate.candidateId());
        return groupSessionDAO.save(committed)
            .onErrorResume(error -> {
                LOGGER.error("Could not store the committed state of group session {}, its registry status stays authoritative",
                    session.sessionId().value(), error);
                return Mono.empty();
            })
            .then(holdManager.releaseAllHoldsForSession(session.sessionId()))
            .map(released -> {
                commitMetric.increment();
                LOGGER.info("Committed candidate {} of group session {} for {} participant(s), released {} hold(s)",
                    candidate.candidateId().value(), session.sessionId().value(), eventIds.size(), released);
                return new GroupCommitResult(eventIds, committed);
            });
    }

    private Mono<Void> guardedStatusChange(SessionId sessionId, Status expected, Status target) {
        return registry.updateStatus(sessionId, expected, target, clock.instant())
            .flatMap(updated -> {
                if (updated) {
                    return Mono.empty();
                }
                return registry.find(sessionId)
                    .switchIfEmpty(Mono.error(() -> new SessionNotFoundException(sessionId)))
                    .flatMap(current -> ensureNotTerminal(sessionId, current.status()))
                    .then(Mono.error(() -> new SessionAlreadyCommittedException(sessionId)));
            });
    }

    private Mono<GroupSessionRegistration> findRegistration(SessionId sessionId, Username requestingUser) {
        return registry.find(sessionId)
            .switchIfEmpty(Mono.error(() -> new SessionNotFoundException(sessionId)))
            .flatMap(registration -> {
                if (!registration.isParticipant(requestingUser)) {
                    return Mono.error(new NotAParticipantException(requestingUser, sessionId));
                }
                return Mono.just(registration);
            });
    }

    private Mono<GroupSession> loadSession(SessionId sessionId) {
        return groupSessionDAO.find(sessionId)
            .switchIfEmpty(Mono.error(() -> new SessionNotFoundException(sessionId)));
    }

    private GroupSession reconcile(GroupSession session, GroupSessionRegistration registration) {
        if (session.status() == registration.status()) {
            return session;
        }
        return session.withStatus(registration.status());
    }

    private Mono<Void> ensureNotTerminal(SessionId sessionId, Status status) {
        return switch (status) {
            case COMMITTED -> Mono.error(new SessionAlreadyCommittedException(sessionId));
            case CANCELLED -> Mono.error(new SessionCancelledException(sessionId));
            default -> Mono.empty();
        };
    }

    private GroupSession newSession(SessionId sessionId, CreateGroupSessionRequest request, int maxCandidates,
                                    Duration holdTimeout, List<Candidate> candidates) {
        Status status = candidates.isEmpty() ? Status.GATHERING : Status.CANDIDATES_READY;
        Instant now = clock.instant();
        return new GroupSession(sessionId, request.creator(), request.participants(), request.title(),
            request.durationMinutes(), request.windowStart(), request.windowEnd(), maxCandidates, holdTimeout,
            status, candidates, Optional.empty(), now);
    }
}
