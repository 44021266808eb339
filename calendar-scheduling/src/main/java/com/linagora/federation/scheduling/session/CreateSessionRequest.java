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

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.james.core.Username;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.linagora.federation.storage.model.AccountId;
import com.linagora.federation.storage.model.CalendarId;
import com.linagora.federation.storage.model.TimeInterval;

/**
 * Parameters of a single-user scheduling session. Validated on construction, before any I/O.
 * {@code requiredAccountIds} keeps its iteration order: the committed event is written to the first account.
 */
public record CreateSessionRequest(Username username,
                                   String title,
                                   int durationMinutes,
                                   Instant windowStart,
                                   Instant windowEnd,
                                   Set<AccountId> requiredAccountIds,
                                   Optional<Integer> maxCandidates,
                                   Optional<Duration> holdTimeout,
                                   Optional<CalendarId> targetCalendarId) {

    public static final int MIN_DURATION_MINUTES = 15;
    public static final int MAX_DURATION_MINUTES = 480;

    public static void validateCommon(String title, int durationMinutes, Instant windowStart, Instant windowEnd) {
        Preconditions.checkArgument(!StringUtils.isBlank(title), "title is required");
        Preconditions.checkArgument(durationMinutes >= MIN_DURATION_MINUTES && durationMinutes <= MAX_DURATION_MINUTES,
            "durationMinutes must be between %s and %s", MIN_DURATION_MINUTES, MAX_DURATION_MINUTES);
        Preconditions.checkArgument(windowStart != null && windowEnd != null && windowStart.isBefore(windowEnd),
            "windowStart must be before windowEnd");
    }

    public static void validateOverrides(Optional<Integer> maxCandidates, Optional<Duration> holdTimeout) {
        Preconditions.checkNotNull(maxCandidates, "'maxCandidates' must not be null");
        Preconditions.checkNotNull(holdTimeout, "'holdTimeout' must not be null");
        maxCandidates.ifPresent(value -> Preconditions.checkArgument(value > 0, "maxCandidates must be positive"));
        holdTimeout.ifPresent(value -> Preconditions.checkArgument(!value.isNegative(), "holdTimeout must not be negative"));
    }

    public CreateSessionRequest(Username username, String title, int durationMinutes, Instant windowStart, Instant windowEnd,
                                Set<AccountId> requiredAccountIds) {
        this(username, title, durationMinutes, windowStart, windowEnd, requiredAccountIds,
            Optional.empty(), Optional.empty(), Optional.empty());
    }

    public CreateSessionRequest {
        Preconditions.checkNotNull(username, "'username' must not be null");
        validateCommon(title, durationMinutes, windowStart, windowEnd);
        Preconditions.checkArgument(requiredAccountIds != null && !requiredAccountIds.isEmpty(), "requiredAccountIds must not be empty");
        validateOverrides(maxCandidates, holdTimeout);
        Preconditions.checkNotNull(targetCalendarId, "'targetCalendarId' must not be null");
        requiredAccountIds = ImmutableSet.copyOf(requiredAccountIds);
    }

    public CreateSessionRequest withMaxCandidates(int maxCandidates) {
        return new CreateSessionRequest(username, title, durationMinutes, windowStart, windowEnd, requiredAccountIds,
            Optional.of(maxCandidates), holdTimeout, targetCalendarId);
    }

    public CreateSessionRequest withHoldTimeout(Duration holdTimeout) {
        return new CreateSessionRequest(username, title, durationMinutes, windowStart, windowEnd, requiredAccountIds,
            maxCandidates, Optional.of(holdTimeout), targetCalendarId);
    }

    public CreateSessionRequest withTargetCalendarId(CalendarId targetCalendarId) {
        return new CreateSessionRequest(username, title, durationMinutes, windowStart, windowEnd, requiredAccountIds,
            maxCandidates, holdTimeout, Optional.of(targetCalendarId));
    }

    public TimeInterval window() {
        return new TimeInterval(windowStart, windowEnd);
    }

    public Duration duration() {
        return Duration.ofMinutes(durationMinutes);
    }
}
