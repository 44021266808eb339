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

package com.linagora.federation.scheduling.hold;

import java.io.Closeable;
import java.time.Clock;

import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;

import org.apache.james.lifecycle.api.Startable;
import org.apache.james.metrics.api.Metric;
import org.apache.james.metrics.api.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linagora.federation.scheduling.SchedulingConfiguration;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Periodically moves held holds past their expiry to expired.
 */
public class HoldExpirySweeper implements Startable, Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(HoldExpirySweeper.class);

    private final Clock clock;
    private final HoldManager holdManager;
    private final SchedulingConfiguration configuration;
    private final MetricFactory metricFactory;
    private final Metric expiredMetric;

    private Disposable loop;

    @Inject
    public HoldExpirySweeper(Clock clock, HoldManager holdManager, SchedulingConfiguration configuration, MetricFactory metricFactory) {
        this.clock = clock;
        this.holdManager = holdManager;
        this.configuration = configuration;
        this.metricFactory = metricFactory;
        this.expiredMetric = metricFactory.generate("federation.hold.expired");
    }

    public void start() {
        if (!configuration.sweeperEnabled()) {
            LOGGER.info("Hold expiry sweeper is disabled");
            return;
        }

        LOGGER.info("Starting HoldExpirySweeper: pollInterval={}", configuration.sweeperPollInterval());

        loop = Flux.interval(configuration.sweeperPollInterval(), configuration.sweeperPollInterval())
            .onBackpressureDrop()
            .concatMap(tick -> sweep()
                .onErrorResume(ex -> {
                    LOGGER.warn("Hold expiry sweep failed", ex);
                    return Mono.empty();
                }))
            .doFinally(signal -> LOGGER.info("HoldExpirySweeper terminating, signal={}", signal))
            .subscribeOn(Schedulers.parallel())
            .subscribe(count -> {
                if (count > 0) {
                    LOGGER.debug("Expired {} hold(s) this tick", count);
                }
            }, ex -> LOGGER.error("HoldExpirySweeper encountered an error", ex));
    }

    public Mono<Long> sweep() {
        return Mono.from(metricFactory.decoratePublisherWithTimerMetric("federation.hold.sweep.duration",
            holdManager.expireHolds(clock.instant())
                .doOnNext(count -> expiredMetric.add(count.intValue()))));
    }

    public boolean isRunning() {
        return loop != null && !loop.isDisposed();
    }

    @PreDestroy
    @Override
    public void close() {
        if (loop != null && !loop.isDisposed()) {
            loop.dispose();
        }
    }
}
