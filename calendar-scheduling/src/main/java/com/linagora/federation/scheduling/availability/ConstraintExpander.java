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

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import com.google.common.collect.Range;
import com.linagora.federation.storage.constraint.Constraint;
import com.linagora.federation.storage.constraint.Constraint.Buffer;
import com.linagora.federation.storage.constraint.Constraint.NoMeetingsAfter;
import com.linagora.federation.storage.constraint.Constraint.Trip;
import com.linagora.federation.storage.constraint.Constraint.WorkingHours;
import com.linagora.federation.storage.event.BusyInterval;
import com.linagora.federation.storage.milestone.Milestone;
import com.linagora.federation.storage.model.TimeInterval;

/**
 * Turns constraints and milestones into concrete time ranges within a window.
 */
public final class ConstraintExpander {

    private ConstraintExpander() {
    }

    public static Duration maxBufferAround(List<Constraint> constraints) {
        return constraints.stream()
            .filter(Buffer.class::isInstance)
            .map(Buffer.class::cast)
            .map(buffer -> Duration.ofMinutes(buffer.minutes()))
            .max(Duration::compareTo)
            .orElse(Duration.ZERO);
    }

    public static List<Range<Instant>> hardBlocks(Constraint constraint, TimeInterval window, List<BusyInterval> busyIntervals) {
        if (!constraint.isActiveDuring(window.start(), window.end())) {
            return List.of();
        }
        if (constraint instanceof Trip trip) {
            return clip(Stream.of(trip.interval().toRange()), constraint, window);
        }
        if (constraint instanceof Buffer buffer) {
            return clip(bufferRanges(buffer, busyIntervals), constraint, window);
        }
        if (constraint instanceof NoMeetingsAfter noMeetingsAfter) {
            return clip(eveningRanges(noMeetingsAfter, window), constraint, window);
        }
        return List.of();
    }

    public static List<Range<Instant>> preferredRanges(WorkingHours workingHours, TimeInterval window) {
        if (!workingHours.isActiveDuring(window.start(), window.end())) {
            return List.of();
        }
        ZoneId zone = workingHours.timeZone();
        Stream<Range<Instant>> ranges = days(window, zone)
            .filter(day -> workingHours.days().contains(day.getDayOfWeek()))
            .map(day -> Range.closedOpen(
                day.atTime(workingHours.start()).atZone(zone).toInstant(),
                day.atTime(workingHours.end()).atZone(zone).toInstant()));
        return clip(ranges, workingHours, window);
    }

    // A milestone blocks its whole UTC day.
    public static List<Range<Instant>> milestoneBlocks(Milestone milestone, TimeInterval window) {
        LocalDate from = window.start().atZone(ZoneOffset.UTC).toLocalDate();
        LocalDate to = window.end().atZone(ZoneOffset.UTC).toLocalDate();
        return milestone.occurrencesBetween(from, to).stream()
            .map(day -> Range.closedOpen(
                day.atStartOfDay(ZoneOffset.UTC).toInstant(),
                day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant()))
            .filter(range -> window.overlaps(range.lowerEndpoint(), range.upperEndpoint()))
            .toList();
    }

    private static Stream<Range<Instant>> bufferRanges(Buffer buffer, List<BusyInterval> busyIntervals) {
        Duration length = Duration.ofMinutes(buffer.minutes());
        return busyIntervals.stream()
            .filter(busy -> buffer.appliesTo() == Buffer.AppliesTo.ALL || busy.isExternal())
            .map(BusyInterval::interval)
            .map(interval -> {
                if (buffer.type().isBeforeEvent()) {
                    return Range.closedOpen(interval.start().minus(length), interval.start());
                }
                return Range.closedOpen(interval.end(), interval.end().plus(length));
            });
    }

    private static Stream<Range<Instant>> eveningRanges(NoMeetingsAfter noMeetingsAfter, TimeInterval window) {
        ZoneId zone = noMeetingsAfter.timeZone();
        return days(window, zone)
            .map(day -> Range.closedOpen(
                day.atTime(noMeetingsAfter.cutoff()).atZone(zone).toInstant(),
                day.plusDays(1).atStartOfDay(zone).toInstant()));
    }

    // one extra day on each side so that zone offsets never drop an edge day
    private static Stream<LocalDate> days(TimeInterval window, ZoneId zone) {
        LocalDate first = window.start().atZone(zone).toLocalDate().minusDays(1);
        LocalDate last = window.end().atZone(zone).toLocalDate().plusDays(1);
        return first.datesUntil(last.plusDays(1));
    }

    private static List<Range<Instant>> clip(Stream<Range<Instant>> ranges, Constraint constraint, TimeInterval window) {
        Range<Instant> bounds = activeRange(constraint.activeFrom(), constraint.activeTo())
            .intersection(window.toRange());
        return ranges
            .filter(range -> range.isConnected(bounds))
            .map(range -> range.intersection(bounds))
            .filter(range -> !range.isEmpty())
            .toList();
    }

    private static Range<Instant> activeRange(Optional<Instant> activeFrom, Optional<Instant> activeTo) {
        if (activeFrom.isPresent() && activeTo.isPresent()) {
            return Range.closedOpen(activeFrom.get(), activeTo.get());
        }
        if (activeFrom.isPresent()) {
            return Range.atLeast(activeFrom.get());
        }
        return activeTo.map(Range::lessThan).orElse(Range.all());
    }
}
