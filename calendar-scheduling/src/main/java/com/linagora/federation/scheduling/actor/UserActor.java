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

package com.linagora.federation.scheduling.actor;

import java.time.Duration;
import java.util.function.Supplier;

import org.apache.james.core.Username;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.publisher.Sinks;

/**
 * Serializes every operation submitted for one user: an operation starts only once the
 * previous one has completed, whatever its outcome.
 */
public class UserActor implements Disposable {
    private static final Logger LOGGER = LoggerFactory.getLogger(UserActor.class);
    private static final Duration EMIT_RETRY_DURATION = Duration.ofSeconds(1);

    private record Task<T>(Supplier<Mono<T>> operation, MonoSink<T> caller) {
        Mono<Void> run() {
            return Mono.defer(operation)
                .doOnSuccess(caller::success)
                .doOnError(caller::error)
                .then();
        }
    }

    private final Username username;
    private final Sinks.Many<Task<?>> mailbox;
    private final Disposable loop;

    public UserActor(Username username) {
        this.username = username;
        this.mailbox = Sinks.many().unicast().onBackpressureBuffer();
        this.loop = mailbox.asFlux()
            .concatMap(task -> task.run()
                .onErrorResume(error -> {
                    LOGGER.debug("Operation of {} failed", username.asString(), error);
                    return Mono.empty();
                }))
            .subscribe();
    }

    public <T> Mono<T> submit(Supplier<Mono<T>> operation) {
        return Mono.create(sink -> mailbox.emitNext(new Task<>(operation, sink),
            Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY_DURATION)));
    }

    public Username username() {
        return username;
    }

    /**
     * Stops accepting work. Operations already queued still run.
     */
    public void retire() {
        mailbox.tryEmitComplete();
    }

    @Override
    public void dispose() {
        mailbox.tryEmitComplete();
        loop.dispose();
    }

    @Override
    public boolean isDisposed() {
        return loop.isDisposed();
    }
}
