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

package com.linagora.federation.storage.constraint;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.linagora.federation.storage.constraint.Constraint.Buffer;
import com.linagora.federation.storage.constraint.Constraint.NoMeetingsAfter;
import com.linagora.federation.storage.constraint.Constraint.Trip;
import com.linagora.federation.storage.constraint.Constraint.WorkingHours;
import com.linagora.federation.storage.model.TimeInterval;

/**
 * A scheduling rule owned by a user. Working hours only shape the score of a slot;
 * every other kind blocks the time it covers.
 */
public sealed interface Constraint permits WorkingHours, Trip, Buffer, NoMeetingsAfter {

    enum Kind {
        WORKING_HOURS("working_hours"),
        TRIP("trip"),
        BUFFER("buffer"),
        NO_MEETINGS_AFTER("no_meetings_after");

        public static Kind parse(String value) {
            return Arrays.stream(values())
                .filter(kind -> kind.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown constraint kind: " + value));
        }

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    ConstraintId id();

    Kind kind();

    Optional<Instant> activeFrom();

    Optional<Instant> activeTo();

    default boolean isActiveDuring(Instant start, Instant end) {
        return activeFrom().map(from -> from.isBefore(end)).orElse(true)
            && activeTo().map(to -> to.isAfter(start)).orElse(true);
    }

    private static void validateActiveBounds(Optional<Instant> activeFrom, Optional<Instant> activeTo) {
        Preconditions.checkNotNull(activeFrom, "'activeFrom' must not be null");
        Preconditions.checkNotNull(activeTo, "'activeTo' must not be null");
        activeFrom.ifPresent(from -> activeTo.ifPresent(to ->
            Preconditions.checkArgument(from.isBefore(to), "'activeFrom' must be before 'activeTo'")));
    }

    record WorkingHours(ConstraintId id, Set<DayOfWeek> days, LocalTime start, LocalTime end, ZoneId timeZone,
                        Optional<Instant> activeFrom, Optional<Instant> activeTo) implements Constraint {

        public static final Set<DayOfWeek> WEEKDAYS = ImmutableSet.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY,
            DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY);

        public static WorkingHours perpetual(Set<DayOfWeek> days, LocalTime start, LocalTime end, ZoneId timeZone) {
            return new WorkingHours(ConstraintId.generate(), days, start, end, timeZone, Optional.empty(), Optional.empty());
        }

        public WorkingHours {
            Preconditions.checkNotNull(id, "'id' must not be null");
            Preconditions.checkArgument(days != null && !days.isEmpty(), "'days' must not be empty");
            Preconditions.checkNotNull(start, "'start' must not be null");
            Preconditions.checkNotNull(end, "'end' must not be null");
            Preconditions.checkNotNull(timeZone, "'timeZone' must not be null");
            Preconditions.checkArgument(start.isBefore(end), "'start' must be before 'end'");
            validateActiveBounds(activeFrom, activeTo);
            days = ImmutableSet.copyOf(days);
        }

        @Override
        public Kind kind() {
            return Kind.WORKING_HOURS;
        }
    }

    record Trip(ConstraintId id, TimeInterval interval) implements Constraint {

        public static Trip of(Instant from, Instant to) {
            return new Trip(ConstraintId.generate(), new TimeInterval(from, to));
        }

        public Trip {
            Preconditions.checkNotNull(id, "'id' must not be null");
            Preconditions.checkNotNull(interval, "a trip requires both 'activeFrom' and 'activeTo'");
            Preconditions.checkArgument(interval.start().isBefore(interval.end()), "'activeFrom' must be before 'activeTo'");
        }

        @Override
        public Kind kind() {
            return Kind.TRIP;
        }

        @Override
        public Optional<Instant> activeFrom() {
            return Optional.of(interval.start());
        }

        @Override
        public Optional<Instant> activeTo() {
            return Optional.of(interval.end());
        }
    }

    record Buffer(ConstraintId id, Type type, int minutes, AppliesTo appliesTo,
                  Optional<Instant> activeFrom, Optional<Instant> activeTo) implements Constraint {

        public enum Type {
            TRAVEL,
            PREP,
            COOLDOWN;

            public boolean isBeforeEvent() {
                return this != COOLDOWN;
            }
        }

        public enum AppliesTo {
            ALL,
            EXTERNAL
        }

        public static Buffer of(Type type, int minutes, AppliesTo appliesTo) {
            return new Buffer(ConstraintId.generate(), type, minutes, appliesTo, Optional.empty(), Optional.empty());
        }

        public Buffer {
            Preconditions.checkNotNull(id, "'id' must not be null");
            Preconditions.checkNotNull(type, "'type' must not be null");
            Preconditions.checkNotNull(appliesTo, "'appliesTo' must not be null");
            Preconditions.checkArgument(minutes > 0, "'minutes' must be positive");
            validateActiveBounds(activeFrom, activeTo);
        }

        @Override
        public Kind kind() {
            return Kind.BUFFER;
        }
    }

    record NoMeetingsAfter(ConstraintId id, LocalTime cutoff, ZoneId timeZone,
                           Optional<Instant> activeFrom, Optional<Instant> activeTo) implements Constraint {

        public static NoMeetingsAfter of(LocalTime cutoff, ZoneId timeZone) {
            return new NoMeetingsAfter(ConstraintId.generate(), cutoff, timeZone, Optional.empty(), Optional.empty());
        }

        public NoMeetingsAfter {
            Preconditions.checkNotNull(id, "'id' must not be null");
            Preconditions.checkNotNull(cutoff, "'cutoff' must not be null");
            Preconditions.checkNotNull(timeZone, "'timeZone' must not be null");
            validateActiveBounds(activeFrom, activeTo);
        }

        @Override
        public Kind kind() {
            return Kind.NO_MEETINGS_AFTER;
        }
    }
}
