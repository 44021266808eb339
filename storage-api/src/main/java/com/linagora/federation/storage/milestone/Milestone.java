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

package com.linagora.federation.storage.milestone;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;

public record Milestone(MilestoneId id,
                        String relationshipId,
                        Kind kind,
                        LocalDate date,
                        boolean recursAnnually,
                        Optional<String> note) {

    public enum Kind {
        BIRTHDAY,
        ANNIVERSARY,
        CUSTOM
    }

    public Milestone {
        Preconditions.checkNotNull(id, "'id' must not be null");
        Preconditions.checkArgument(!StringUtils.isBlank(relationshipId), "'relationshipId' must not be empty");
        Preconditions.checkNotNull(kind, "'kind' must not be null");
        Preconditions.checkNotNull(date, "'date' must not be null");
        Preconditions.checkNotNull(note, "'note' must not be null");
    }

    /**
     * Days, within [from, to] inclusive, on which this milestone falls.
     * A recurring 29 February is observed on 28 February of non leap years.
     */
    public List<LocalDate> occurrencesBetween(LocalDate from, LocalDate to) {
        Preconditions.checkArgument(!to.isBefore(from), "'to' must not be before 'from'");
        if (!recursAnnually) {
            return isWithin(date, from, to) ? List.of(date) : List.of();
        }
        MonthDay monthDay = MonthDay.from(date);
        return IntStream.rangeClosed(Math.max(from.getYear(), date.getYear()), to.getYear())
            .mapToObj(monthDay::atYear)
            .filter(occurrence -> isWithin(occurrence, from, to))
            .toList();
    }

    private static boolean isWithin(LocalDate day, LocalDate from, LocalDate to) {
        return !day.isBefore(from) && !day.isAfter(to);
    }
}
