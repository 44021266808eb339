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

package com.linagora.federation.scheduling;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import org.apache.commons.configuration2.Configuration;
import org.apache.james.util.DurationParser;

import com.google.common.base.Preconditions;
import com.linagora.federation.storage.model.CalendarId;

public record SchedulingConfiguration(int defaultMaxCandidates,
                                      Duration defaultHoldTimeout,
                                      boolean holdsBlockAvailability,
                                      Duration slotStep,
                                      Duration requestTimeout,
                                      ZoneId scoringTimeZone,
                                      CalendarId defaultTargetCalendarId,
                                      boolean sweeperEnabled,
                                      Duration sweeperPollInterval) {

    public static final int DEFAULT_MAX_CANDIDATES = 5;
    public static final Duration DEFAULT_HOLD_TIMEOUT = Duration.ofHours(24);
    public static final Duration DEFAULT_SLOT_STEP = Duration.ofMinutes(30);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SWEEPER_POLL_INTERVAL = Duration.ofMinutes(1);

    public static final SchedulingConfiguration DEFAULT = new SchedulingConfiguration(DEFAULT_MAX_CANDIDATES,
        DEFAULT_HOLD_TIMEOUT, true, DEFAULT_SLOT_STEP, DEFAULT_REQUEST_TIMEOUT, ZoneOffset.UTC,
        CalendarId.PRIMARY, true, DEFAULT_SWEEPER_POLL_INTERVAL);

    public static SchedulingConfiguration parse(Configuration configuration) {
        int maxCandidates = configuration.getInt("candidates.max.default", DEFAULT_MAX_CANDIDATES);
        Duration holdTimeout = parseDuration(configuration, "hold.timeout.default", ChronoUnit.HOURS)
            .orElse(DEFAULT_HOLD_TIMEOUT);
        boolean holdsBlockAvailability = configuration.getBoolean("hold.blocks.availability", true);
        Duration slotStep = parseDuration(configuration, "slot.step", ChronoUnit.MINUTES)
            .orElse(DEFAULT_SLOT_STEP);
        Duration requestTimeout = parseDuration(configuration, "request.timeout", ChronoUnit.SECONDS)
            .orElse(DEFAULT_REQUEST_TIMEOUT);
        ZoneId scoringTimeZone = Optional.ofNullable(configuration.getString("scoring.timezone", null))
            .map(ZoneId::of)
            .orElse(ZoneOffset.UTC);
        CalendarId targetCalendarId = new CalendarId(configuration.getString("calendar.target.default", CalendarId.PRIMARY.value()));
        boolean sweeperEnabled = configuration.getBoolean("hold.sweeper.enabled", true);
        Duration sweeperPollInterval = parseDuration(configuration, "hold.sweeper.poll.interval", ChronoUnit.SECONDS)
            .orElse(DEFAULT_SWEEPER_POLL_INTERVAL);

        return new SchedulingConfiguration(maxCandidates, holdTimeout, holdsBlockAvailability, slotStep, requestTimeout,
            scoringTimeZone, targetCalendarId, sweeperEnabled, sweeperPollInterval);
    }

    private static Optional<Duration> parseDuration(Configuration configuration, String key, ChronoUnit defaultUnit) {
        return Optional.ofNullable(configuration.getString(key, null))
            .map(rawValue -> DurationParser.parse(rawValue, defaultUnit));
    }

    public SchedulingConfiguration {
        Preconditions.checkArgument(defaultMaxCandidates > 0, "'candidates.max.default' must be positive");
        Preconditions.checkNotNull(defaultHoldTimeout, "'hold.timeout.default' must not be null");
        Preconditions.checkArgument(!defaultHoldTimeout.isNegative(), "'hold.timeout.default' must not be negative");
        Preconditions.checkNotNull(slotStep, "'slot.step' must not be null");
        Preconditions.checkArgument(!slotStep.isNegative() && !slotStep.isZero(), "'slot.step' must be positive");
        Preconditions.checkNotNull(requestTimeout, "'request.timeout' must not be null");
        Preconditions.checkArgument(!requestTimeout.isNegative() && !requestTimeout.isZero(), "'request.timeout' must be positive");
        Preconditions.checkNotNull(scoringTimeZone, "'scoring.timezone' must not be null");
        Preconditions.checkNotNull(defaultTargetCalendarId, "'calendar.target.default' must not be null");
        Preconditions.checkNotNull(sweeperPollInterval, "'hold.sweeper.poll.interval' must not be null");
        Preconditions.checkArgument(!sweeperPollInterval.isNegative() && !sweeperPollInterval.isZero(),
            "'hold.sweeper.poll.interval' must be positive");
    }
}
