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

package com.linagora.federation.scheduling.session;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import jakarta.inject.Inject;

import org.apache.james.core.Username;
import org.apache.james.metrics.api.Metric;
import org.apache.james.metrics.api.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Iterables;
import com.linagora.federation.scheduling.SchedulingConfiguration;
import com.linagora.federation.scheduling.actor.UserActorRegistry;
import com.linagora.federation.scheduling.availability.AvailabilityResolver;
import com.linagora.federation.scheduling.candidate.CandidateGenerator;
import com.linagora.federation.scheduling.candidate.CandidateGenerator.GenerationRequest;
import com.linagora.federation.scheduling.exception.CandidateNotFoundException;
import com.linagora.federation.scheduling.exception.SessionAlreadyCommittedException;
import com.linagora.federation.scheduling.exception.SessionCancelledException;
import com.linagora.federation.scheduling.exception.SessionNotFoundException;
import com.linagora.federation.scheduling.hold.HoldManager;
import com.linagora.federation.storage.event.CanonicalEvent.CreationRequest;
import com.linagora.federation.storage.event.CanonicalEventDAO;
import com.linagora.federation.storage.hold.Hold;
import com.linagora.federation.storage.model.SubjectId;
import com.linagora.federation.storage.session.Candidate;
import com.linagora.federation.storage.session.CandidateId;
import com.linagora.federation.storage.session.SchedulingSession;
import com.linagora.federation.storage.session.SchedulingSessionDAO;
import com.linagora.federation.storage.session.SessionId;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Single-user scheduling workflow. Every operation of a user runs on that user's actor,
 * one after the other.
 */
public class SchedulingSessionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchedulingSessionService.class);

    private final SchedulingSessionDAO sessionDAO;
    private final CanonicalEventDAO canonicalEventDAO;
    private final AvailabilityResolver availabilityResolver;
    private final CandidateGenerator candidateGenerator;
    private final HoldManager holdManager;
    private final UserActorRegistry actorRegistry;
    private final SchedulingConfiguration configuration;
    private final Clock clock;
    private final MetricFactory metricFactory;
    private final Metric commitMetric;

    @Inject
    public SchedulingSessionService(SchedulingSessionDAO sessionDAO, CanonicalEventDAO canonicalEventDAO,
                                    AvailabilityResolver availabilityResolver, CandidateGenerator candidateGenerator,
                                    HoldManager holdManager, UserActorRegistry actorRegistry,
                                    SchedulingConfiguration configuration, Clock clock, MetricFactory metricFactory) {
        this.sessionDAO = sessionDAO;
        this.canonicalEventDAO = canonicalEventDAO;
        this.availabilityResolver = availabilityResolver;
        this.candidateGenerator = candidateGenerator;
        this.holdManager = holdManager;
        this.actorRegistry = actorRegistry;
        this.configuration = configuration;
        this.clock = clock;
        this.metricFactory = metricFactory;
        this.commitMetric = metricFactory.generate("federation.scheduling.session.commit");
    }

    public Mono<SchedulingSession> createSession(CreateSessionRequest request) {
        SessionId sessionId = SessionId.generate();
        int maxCandidates = request.maxCandidates().orElse(configuration.defaultMaxCandidates());
        Duration holdTimeout = request.holdTimeout().orElse(configuration.defaultHoldTimeout());
        List<SubjectId> subjects = request.requiredAccountIds().stream()
            .map(SubjectId::of)
            .toList();

        return onActorOf(request.username(), () -> Mono.from(metricFactory.decoratePublisherWithTimerMetric(
            "federation.scheduling.session.create.duration",
            availabilityResolver.resolveForOwner(request.username(), subjects, request.window())
                .map(availabilities -> candidateGenerator.generate(new GenerationRequest(sessionId, request.window(),
                    request.duration(), maxCandidates, availabilities)))
                .flatMap(candidates -> holdManager.createHolds(sessionId, candidates, subjects, holdTimeout)
                    .map(holds -> newSession(sessionId, request, maxCandidates, holdTimeout, candidates, holds)))
                .flatMap(session -> sessionDAO.save(session.withHolds(List.of())).thenReturn(session))
                .doOnNext(session -> LOGGER.info("Created scheduling session {} for {} with {} candidate(s) and {} hold(s)",
                    sessionId.value(), request.username().asString(), session.candidates().size(), session.holds().size())))));
    }

    public Mono<SchedulingSession> getCandidates(Username username, SessionId sessionId) {
        return onActorOf(username, () -> load(username, sessionId));
    }

    public Mono<CommitResult> commitCandidate(Username username, SessionId sessionId, CandidateId candidateId) {
        return onActorOf(username, () -> Mono.from(metricFactory.decoratePublisherWithTimerMetric(
            "federation.scheduling.session.commit.duration",
            loadStored(username, sessionId)
                .flatMap(session -> ensureNotTerminal(session)
                    .then(Mono.justOrEmpty(session.findCandidate(candidateId)))
                    .switchIfEmpty(Mono.error(() -> new CandidateNotFoundException(sessionId, candidateId)))
                    .flatMap(candidate -> commit(session, candidate))))));
    }

    public Mono<SchedulingSession> cancelSession(Username username, SessionId sessionId) {
        return onActorOf(username, () -> loadStored(username, sessionId)
            .flatMap(session -> ensureNotTerminal(session)
                .then(sessionDAO.save(session.cancelled()))
                .then(holdManager.releaseAllHoldsForSession(sessionId))
                .doOnNext(released -> LOGGER.info("Cancelled scheduling session {} of {}, released {} hold(s)",
                    sessionId.value(), username.asString(), released))
                .then(load(username, sessionId))));
    }

    public Mono<List<Hold>> getHoldsBySession(Username username, SessionId sessionId) {
        return onActorOf(username, () -> loadStored(username, sessionId)
            .flatMap(session -> holdManager.getHolds(sessionId)));
    }

    public Mono<List<Hold>> extendHolds(Username username, SessionId sessionId, Duration extension) {
        HoldManager.validateExtension(extension);
        return onActorOf(username, () -> loadStored(username, sessionId)
            .flatMap(session -> ensureNotTerminal(session)
                .then(holdManager.extendHolds(sessionId, extension))));
    }

    public Flux<SchedulingSession> listSessions(Username username) {
        return onActorOf(username, () -> sessionDAO.list(username)
            .concatMap(this::withHolds)
            .collectList())
            .flatMapIterable(sessions -> sessions);
    }

    private Mono<CommitResult> commit(SchedulingSession session, Candidate candidate) {
        SubjectId target = SubjectId.of(Iterables.getFirst(session.requiredAccountIds(), null));
        CreationRequest event = CreationRequest.systemConfirmed(target, session.targetCalendarId(), session.title(), candidate.interval());

        return canonicalEventDAO.create(event)
            .timeout(configuration.requestTimeout())
            .flatMap(eventId -> sessionDAO.save(session.committed(candidate.candidateId(), eventId))
                .then(holdManager.releaseAllHoldsForSession(session.sessionId()))
                .doOnNext(released -> {
                    commitMetric.increment();
                    LOGGER.info("Committed candidate {} of session {} as event {}, released {} hold(s)",
                        candidate.candidateId().value(), session.sessionId().value(), eventId.value(), released);
                })
                .then(load(session.username(), session.sessionId()))
                .map(committed -> new CommitResult(eventId, committed)));
    }

    private Mono<Void> ensureNotTerminal(SchedulingSession session) {
        return switch (session.status()) {
            case COMMITTED -> Mono.error(new SessionAlreadyCommittedException(session.sessionId()));
            case CANCELLED -> Mono.error(new SessionCancelledException(session.sessionId()));
            default -> Mono.empty();
        };
    }

    private Mono<SchedulingSession> loadStored(Username username, SessionId sessionId) {
        return sessionDAO.find(username, sessionId)
            .switchIfEmpty(Mono.error(() -> new SessionNotFoundException(sessionId)));
    }

    private Mono<SchedulingSession> load(Username username, SessionId sessionId) {
        return loadStored(username, sessionId)
            .flatMap(this::withHolds);
    }

    private Mono<SchedulingSession> withHolds(SchedulingSession session) {
        return holdManager.getHolds(session.sessionId())
            .map(session::withHolds);
    }

    private SchedulingSession newSession(SessionId sessionId, CreateSessionRequest request, int maxCandidates,
                                         Duration holdTimeout, List<Candidate> candidates, List<Hold> holds) {
        SchedulingSession.Status status = candidates.isEmpty() ? SchedulingSession.Status.OPEN : SchedulingSession.Status.CANDIDATES_READY;
        return new SchedulingSession(sessionId, request.username(), request.title(), request.durationMinutes(),
            request.windowStart(), request.windowEnd(), request.requiredAccountIds(), maxCandidates, holdTimeout,
            request.targetCalendarId().orElse(configuration.defaultTargetCalendarId()), status, candidates, holds,
            Optional.empty(), Optional.empty(), clock.instant());
    }

    private <T> Mono<T> onActorOf(Username username, Supplier<Mono<T>> operation) {
        return actorRegistry.forUser(username).submit(operation);
    }
}
