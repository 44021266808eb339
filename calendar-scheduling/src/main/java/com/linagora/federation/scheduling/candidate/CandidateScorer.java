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

package com.linagora.federation.scheduling.candidate;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;
import com.linagora.federation.scheduling.availability.SubjectAvailability;
import com.linagora.federation.storage.model.TimeInterval;

/**
 * Soft preference score of a free slot. Never negative; the explanation names the
 * decisive factor first.
 */
public class CandidateScorer {

    public record Factor(String label, int contribution) {
        public String render() {
            if (contribution == 0) {
                return label;
            }
            return String.format("%s (%+d)", label, contribution);
        }
    }

    public record Score(int value, List<Factor> factors) {
        public String explanation() {
            if (factors.isEmpty()) {
                return NO_SIGNAL;
            }
            return factors.stream()
                .map(Factor::render)
                .collect(Collectors.joining(", "));
        }
    }

    public static final int ALL_WORKING_HOURS = 30;
    public static final int SOME_WORKING_HOURS = 15;
    public static final int MORNING = 10;
    public static final int AFTERNOON = 5;
    public static final int ADJACENCY_PENALTY = -2;
    public static final int MAX_EARLY_BONUS = 7;
    public static final Duration ADJACENCY_DISTANCE = Duration.ofMinutes(30);

    static final String NO_SIGNAL = "free slot, no preference signal";
    private static final LocalTime MORNING_START = LocalTime.of(8, 0);
    private static final LocalTime NOON = LocalTime.of(12, 0);
    private static final LocalTime AFTERNOON_END = LocalTime.of(17, 0);

    private final ZoneId timeZone;

    public CandidateScorer(ZoneId timeZone) {
        Preconditions.checkNotNull(timeZone, "'timeZone' must not be null");
        this.timeZone = timeZone;
    }

    public Score score(TimeInterval slot, TimeInterval window, List<SubjectAvailability> availabilities) {
        List<Factor> factors = new ArrayList<>();
        workingHours(slot, availabilities, factors);
        timeOfDay(slot, factors);
        adjacency(slot, availabilities, factors);
        earlyInWindow(slot, window, factors);

        int total = factors.stream().mapToInt(Factor::contribution).sum();
        List<Factor> ordered = factors.stream()
            .sorted(Comparator.comparingInt((Factor factor) -> Math.abs(factor.contribution())).reversed())
            .toList();
        return new Score(Math.max(0, total), ordered);
    }

    private void workingHours(TimeInterval slot, List<SubjectAvailability> availabilities, List<Factor> factors) {
        List<SubjectAvailability> withPreferences = availabilities.stream()
            .filter(SubjectAvailability::hasPreferences)
            .toList();
        if (withPreferences.isEmpty()) {
            return;
        }
        long inside = withPreferences.stream()
            .filter(availability -> availability.isPreferred(slot))
            .count();
        if (inside == withPreferences.size()) {
            factors.add(new Factor("within working hours", ALL_WORKING_HOURS));
        } else if (inside > 0) {
            factors.add(new Factor("partially within working hours", SOME_WORKING_HOURS));
        } else {
            factors.add(new Factor("outside working hours", 0));
        }
    }

    private void timeOfDay(TimeInterval slot, List<Factor> factors) {
        LocalTime localStart = slot.start().atZone(timeZone).toLocalTime();
        if (!localStart.isBefore(MORNING_START) && localStart.isBefore(NOON)) {
            factors.add(new Factor("morning", MORNING));
        } else if (!localStart.isBefore(NOON) && localStart.isBefore(AFTERNOON_END)) {
            factors.add(new Factor("afternoon", AFTERNOON));
        }
    }

    private void adjacency(TimeInterval slot, List<SubjectAvailability> availabilities, List<Factor> factors) {
        Range<Instant> before = Range.closed(slot.start().minus(ADJACENCY_DISTANCE), slot.start());
        Range<Instant> after = Range.closed(slot.end(), slot.end().plus(ADJACENCY_DISTANCE));
        long adjacentBlocks = availabilities.stream()
            .flatMap(availability -> availability.hardBlocks().asRanges().stream())
            .filter(block -> before.contains(block.upperEndpoint()) || after.contains(block.lowerEndpoint()))
            .count();
        if (adjacentBlocks > 0) {
            factors.add(new Factor("next to " + adjacentBlocks + " busy block(s)", (int) adjacentBlocks * ADJACENCY_PENALTY));
        }
    }

    private void earlyInWindow(TimeInterval slot, TimeInterval window, List<Factor> factors) {
        long daysIn = Duration.between(window.start(), slot.start()).toDays();
        int bonus = (int) Math.max(0, MAX_EARLY_BONUS - daysIn);
        if (bonus > 0) {
            factors.add(new Factor("early in window", bonus));
        }
    }
}
