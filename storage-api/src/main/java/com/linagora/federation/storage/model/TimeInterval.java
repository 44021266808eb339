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

package com.linagora.federation.storage.model;

import java.time.Duration;
import java.time.Instant;

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;

/**
 * A half-open interval [start, end).
 */
public record TimeInterval(Instant start, Instant end) {

    public static TimeInterval of(Instant start, Duration duration) {
        return new TimeInterval(start, start.plus(duration));
    }

    public static TimeInterval from(Range<Instant> range) {
        Preconditions.checkArgument(range.hasLowerBound() && range.hasUpperBound(), "range must be bounded");
        return new TimeInterval(range.lowerEndpoint(), range.upperEndpoint());
    }

    public TimeInterval {
        Preconditions.checkNotNull(start, "'start' must not be null");
        Preconditions.checkNotNull(end, "'end' must not be null");
        Preconditions.checkArgument(!end.isBefore(start), "'end' must not be before 'start'");
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && end.isAfter(other.start);
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return start.isBefore(otherEnd) && end.isAfter(otherStart);
    }

    public Range<Instant> toRange() {
        return Range.closedOpen(start, end);
    }
}
