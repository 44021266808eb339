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

package com.linagora.federation.storage.mongodb;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.apache.james.metrics.api.Metric;
import org.apache.james.metrics.api.MetricFactory;
import org.apache.james.metrics.api.TimeMetric;

import com.mongodb.event.CommandFailedEvent;
import com.mongodb.event.CommandListener;
import com.mongodb.event.CommandStartedEvent;
import com.mongodb.event.CommandSucceededEvent;

/**
 * Counts and times the commands sent to MongoDB, one metric pair per tracked command name.
 */
public class MongoCommandMetricsListener implements CommandListener {

    public static final String METRIC_PREFIX = "federation.mongodb.command.";
    public static final Set<String> TRACKED_COMMANDS = Set.of("find", "insert", "update", "findAndModify", "delete");
    private static final String OTHER = "other";

    private final Map<String, Metric> counters;
    private final Map<String, TimeMetric> timers;
    private final Metric failures;
    private final Metric otherCounter;
    private final TimeMetric otherTimer;

    public MongoCommandMetricsListener(MetricFactory metricFactory) {
        counters = TRACKED_COMMANDS.stream()
            .collect(Collectors.toUnmodifiableMap(Function.identity(),
                command -> metricFactory.generate(METRIC_PREFIX + command + ".count")));
        timers = TRACKED_COMMANDS.stream()
            .collect(Collectors.toUnmodifiableMap(Function.identity(),
                command -> metricFactory.timer(METRIC_PREFIX + command + ".timer")));
        failures = metricFactory.generate(METRIC_PREFIX + "failed.count");
        otherCounter = metricFactory.generate(METRIC_PREFIX + OTHER + ".count");
        otherTimer = metricFactory.timer(METRIC_PREFIX + OTHER + ".timer");
    }

    @Override
    public void commandStarted(CommandStartedEvent event) {
        counters.getOrDefault(event.getCommandName(), otherCounter).increment();
    }

    @Override
    public void commandSucceeded(CommandSucceededEvent event) {
        timers.getOrDefault(event.getCommandName(), otherTimer)
            .record(Duration.ofNanos(event.getElapsedTime(TimeUnit.NANOSECONDS)));
    }

    @Override
    public void commandFailed(CommandFailedEvent event) {
        failures.increment();
    }
}
