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

package com.linagora.federation.storage.hold;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import com.linagora.federation.storage.model.SubjectId;
import com.linagora.federation.storage.session.SessionId;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class MemoryHoldDAO implements HoldDAO {

    private final Map<HoldId, Hold> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> create(Collection<Hold> holds) {
        return Mono.fromRunnable(() -> holds.forEach(hold -> store.put(hold.holdId(), hold)));
    }

    @Override
    public Flux<Hold> listBySession(SessionId sessionId) {
        return Flux.defer(() -> Flux.fromStream(store.values().stream()
            .filter(hold -> hold.sessionId().equals(sessionId))
            .sorted(Comparator.comparing(Hold::start).thenComparing(hold -> hold.subject().value()))));
    }

    @Override
    public Flux<Hold> listActiveBySubject(SubjectId subject, Instant now) {
        return Flux.defer(() -> Flux.fromStream(store.values().stream()
            .filter(hold -> hold.subject().equals(subject))
            .filter(hold -> hold.isActiveAt(now))));
    }

    @Override
    public Mono<Long> releaseBySession(SessionId sessionId) {
        return updateWhere(hold -> hold.sessionId().equals(sessionId) && hold.status() != Hold.Status.RELEASED,
            hold -> hold.withStatus(Hold.Status.RELEASED));
    }

    @Override
    public Mono<Long> expire(Instant now) {
        return updateWhere(hold -> hold.status() == Hold.Status.HELD && hold.isExpiredAt(now),
            hold -> hold.withStatus(Hold.Status.EXPIRED));
    }

    @Override
    public Mono<Long> extend(SessionId sessionId, Instant expiresAt) {
        return updateWhere(hold -> hold.sessionId().equals(sessionId) && hold.status() == Hold.Status.HELD,
            hold -> hold.withExpiresAt(expiresAt));
    }

    private Mono<Long> updateWhere(Predicate<Hold> condition, UnaryOperator<Hold> update) {
        return Mono.fromCallable(() -> {
            AtomicLong updated = new AtomicLong();
            store.keySet().forEach(holdId -> store.computeIfPresent(holdId, (id, hold) -> {
                if (condition.test(hold)) {
                    updated.incrementAndGet();
                    return update.apply(hold);
                }
                return hold;
            }));
            return updated.get();
        });
    }
}
