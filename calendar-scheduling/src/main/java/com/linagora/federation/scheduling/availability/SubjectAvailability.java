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

import java.time.Instant;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.linagora.federation.storage.model.SubjectId;
import com.linagora.federation.storage.model.TimeInterval;

/**
 * Hard blocks and the working-hours preference mask of one subject over a window.
 * {@code preferred} is empty when the subject has no working hours at all.
 */
public record SubjectAvailability(SubjectId subject,
                                  ImmutableRangeSet<Instant> hardBlocks,
                                  Optional<ImmutableRangeSet<Instant>> preferred) {

    public static SubjectAvailability of(SubjectId subject, RangeSet<Instant> hardBlocks, Optional<RangeSet<Instant>> preferred) {
        return new SubjectAvailability(subject, ImmutableRangeSet.copyOf(hardBlocks), preferred.map(ImmutableRangeSet::copyOf));
    }

    public SubjectAvailability {
        Preconditions.checkNotNull(subject, "'subject' must not be null");
        Preconditions.checkNotNull(hardBlocks, "'hardBlocks' must not be null");
        Preconditions.checkNotNull(preferred, "'preferred' must not be null");
    }

    public boolean isBlocked(TimeInterval interval) {
        return hardBlocks.intersects(interval.toRange());
    }

    public boolean isPreferred(TimeInterval interval) {
        Range<Instant> range = interval.toRange();
        return preferred.map(mask -> mask.encloses(range)).orElse(false);
    }

    public boolean hasPreferences() {
        return preferred.isPresent();
    }
}
