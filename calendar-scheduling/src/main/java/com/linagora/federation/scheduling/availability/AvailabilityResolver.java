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

package com.linagora.federation.scheduling.availability;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import jakarta.inject.Inject;

import org.apache.james.core.Username;
import org.apache.james.util.ReactorUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;
import com.linagora.federation.scheduling.SchedulingConfiguration;
import com.linagora.federation.scheduling.exception.AvailabilityUnavailableException;
import com.linagora.federation.storage.constraint.Constraint;
import com.linagora.federation.storage.constraint.Constraint.WorkingHours;
import com.linagora.federation.storage.constraint.ConstraintDAO;
import com.linagora.federation.storage.event.BusyInterval;
import com.linagora.federation.storage.event.CanonicalEventDAO;
import com.linagora.federation.storage.hold.Hold;
import com.linagora.federation.storage.hold.HoldDAO;
import com.linagora.federation.storage.milestone.Milestone;
import com.linagora.federation.storage.milestone.MilestoneDAO;
import com.linagora.federation.storage.model.SubjectId;
import com.linagora.federation.storage.model.TimeInterval;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Computes, per subject, the hard blocks and the preference mask over a window.
 * Any source that fails or exceeds the request timeout fails the whole resolution.
 */
public class AvailabilityResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(AvailabilityResolver.class);

    private record OwnerRules(List<Constraint> constraints, List<Milestone> milestones) {
    }

    private final CanonicalEventDAO canonicalEventDAO;
    private final ConstraintDAO constraintDAO;
    private final MilestoneDAO milestoneDAO;
    private final HoldDAO holdDAO;
    private final SchedulingConfiguration configuration;
    private final Clock clock;

    @Inject
    public AvailabilityResolver(CanonicalEventDAO canonicalEventDAO, ConstraintDAO constraintDAO, MilestoneDAO milestoneDAO,
                                HoldDAO holdDAO, SchedulingConfiguration configuration, Clock clock) {
        this.canonicalEventDAO = canonicalEventDAO;
        this.constraintDAO = constraintDAO;
        this.milestoneDAO = milestoneDAO;
        this.holdDAO = holdDAO;
        this.configuration = configuration;
        this.clock = clock;
    }

    /**
     * Single-user flow: every subject is one of the owner's accounts, the owner's rules apply to all of them.
     */
    public Mono<List<SubjectAvailability>> resolveForOwner(Username owner, Collection<SubjectId> subjects, TimeInterval window) {
        SubjectId ownerSubject = SubjectId.of(owner);
        return loadRules(owner, ownerSubject)
            .flatMapMany(rules -> Flux.fromIterable(subjects)
                .flatMapSequential(subject -> resolve(subject, rules, window), ReactorUtils.DEFAULT_CONCURRENCY))
            .collectList();
    }

    /**
     * Group flow: the participant is the subject and everything is read from its own store.
     */
    public Mono<SubjectAvailability> resolveForParticipant(Username participant, TimeInterval window) {
        SubjectId subject = SubjectId.of(participant);
        return loadRules(participant, subject)
            .flatMap(rules -> resolve(subject, rules, window));
    }

    private Mono<OwnerRules> loadRules(Username owner, SubjectId subject) {
        Mono<List<Constraint>> constraints = guard(subject, constraintDAO.list(owner).collectList());
        Mono<List<Milestone>> milestones = guard(subject, milestoneDAO.list(owner).collectList());
        return Mono.zip(constraints, milestones)
            .map(tuple -> new OwnerRules(tuple.getT1(), tuple.getT2()));
    }

    private Mono<SubjectAvailability> resolve(SubjectId subject, OwnerRules rules, TimeInterval window) {
        Duration margin = ConstraintExpander.maxBufferAround(rules.constraints());
        Mono<List<BusyInterval>> busyIntervals = guard(subject, canonicalEventDAO
            .getBusyIntervals(subject, window.start().minus(margin), window.end().plus(margin))
            .collectList());

        return Mono.zip(busyIntervals, activeHolds(subject, window))
            .map(tuple -> compute(subject, rules, window, tuple.getT1(), tuple.getT2()))
            .doOnNext(availability -> LOGGER.debug("Resolved {} hard block(s) for {} over {}",
                availability.hardBlocks().asRanges().size(), subject.value(), window));
    }

    private Mono<List<Hold>> activeHolds(SubjectId subject, TimeInterval window) {
        if (!configuration.holdsBlockAvailability()) {
            return Mono.just(List.of());
        }
        Instant now = clock.instant();
        return guard(subject, holdDAO.listActiveBySubject(subject, now)
            .filter(hold -> hold.interval().overlaps(window))
            .collectList());
    }

    private SubjectAvailability compute(SubjectId subject, OwnerRules rules, TimeInterval window,
                                        List<BusyInterval> busyIntervals, List<Hold> holds) {
        RangeSet<Instant> hardBlocks = TreeRangeSet.create();
        busyIntervals.forEach(busy -> hardBlocks.add(busy.interval().toRange()));
        holds.forEach(hold -> hardBlocks.add(hold.interval().toRange()));
        rules.constraints().forEach(constraint ->
            ConstraintExpander.hardBlocks(constraint, window, busyIntervals).forEach(hardBlocks::add));
        rules.milestones().forEach(milestone ->
            ConstraintExpander.milestoneBlocks(milestone, window).forEach(hardBlocks::add));

        List<WorkingHours> workingHours = rules.constraints().stream()
            .filter(WorkingHours.class::isInstance)
            .map(WorkingHours.class::cast)
            .filter(rule -> rule.isActiveDuring(window.start(), window.end()))
            .toList();
        Optional<RangeSet<Instant>> preferred = Optional.empty();
        if (!workingHours.isEmpty()) {
            RangeSet<Instant> mask = TreeRangeSet.create();
            workingHours.forEach(rule -> ConstraintExpander.preferredRanges(rule, window).forEach(mask::add));
            preferred = Optional.of(mask);
        }
        return SubjectAvailability.of(subject, hardBlocks, preferred);
    }

    private <T> Mono<T> guard(SubjectId subject, Mono<T> read) {
        return read.timeout(configuration.requestTimeout())
            .onErrorMap(error -> !(error instanceof AvailabilityUnavailableException),
                error -> new AvailabilityUnavailableException(subject, error));
    }
}
