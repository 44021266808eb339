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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.linagora.federation.storage.constraint.Constraint.Kind;
import com.linagora.federation.storage.constraint.Constraint.Trip;
import com.linagora.federation.storage.constraint.Constraint.WorkingHours;

class ConstraintTest {

    @Test
    void perpetualWorkingHoursShouldBeActiveAnytime() {
        WorkingHours workingHours = WorkingHours.perpetual(WorkingHours.WEEKDAYS,
            LocalTime.parse("09:00"), LocalTime.parse("17:00"), ZoneOffset.UTC);

        assertThat(workingHours.isActiveDuring(Instant.parse("1999-01-01T00:00:00Z"), Instant.parse("1999-01-02T00:00:00Z")))
            .isTrue();
    }

    @Test
    void scopedConstraintShouldOnlyBeActiveWithinItsBounds() {
        WorkingHours workingHours = new WorkingHours(ConstraintId.generate(), Set.of(DayOfWeek.MONDAY),
            LocalTime.parse("09:00"), LocalTime.parse("17:00"), ZoneOffset.UTC,
            Optional.of(Instant.parse("2026-03-01T00:00:00Z")), Optional.of(Instant.parse("2026-04-01T00:00:00Z")));

        assertThat(workingHours.isActiveDuring(Instant.parse("2026-03-10T00:00:00Z"), Instant.parse("2026-03-11T00:00:00Z"))).isTrue();
        assertThat(workingHours.isActiveDuring(Instant.parse("2026-04-01T00:00:00Z"), Instant.parse("2026-04-02T00:00:00Z"))).isFalse();
        assertThat(workingHours.isActiveDuring(Instant.parse("2026-02-27T00:00:00Z"), Instant.parse("2026-03-01T00:00:00Z"))).isFalse();
    }

    @Test
    void tripShouldExposeItsBoundsAsActiveWindow() {
        Trip trip = Trip.of(Instant.parse("2026-03-02T00:00:00Z"), Instant.parse("2026-03-05T00:00:00Z"));

        assertThat(trip.activeFrom()).contains(Instant.parse("2026-03-02T00:00:00Z"));
        assertThat(trip.activeTo()).contains(Instant.parse("2026-03-05T00:00:00Z"));
        assertThat(trip.kind()).isEqualTo(Kind.TRIP);
    }

    @Test
    void tripShouldRequireBothBounds() {
        assertThatThrownBy(() -> new Trip(ConstraintId.generate(), null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void workingHoursShouldRejectInvertedRange() {
        assertThatThrownBy(() -> WorkingHours.perpetual(WorkingHours.WEEKDAYS,
            LocalTime.parse("17:00"), LocalTime.parse("09:00"), ZoneOffset.UTC))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void kindShouldParseItsWireValue() {
        assertThat(Kind.parse("no_meetings_after")).isEqualTo(Kind.NO_MEETINGS_AFTER);
        assertThatThrownBy(() -> Kind.parse("vacation")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constraintIdShouldCarryItsPrefix() {
        assertThat(ConstraintId.generate().value()).startsWith("cst_");
        assertThatThrownBy(() -> new ConstraintId("abc")).isInstanceOf(IllegalArgumentException.class);
    }
}
