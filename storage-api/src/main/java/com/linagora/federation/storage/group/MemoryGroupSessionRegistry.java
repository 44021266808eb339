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

package com.linagora.federation.storage.group;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.james.core.Username;

import com.linagora.federation.storage.session.SessionId;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class MemoryGroupSessionRegistry implements GroupSessionRegistry {

    private final Map<SessionId, GroupSessionRegistration> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> register(GroupSessionRegistration registration) {
        return Mono.fromRunnable(() -> store.put(registration.sessionId(), registration));
    }

    @Override
    public Mono<GroupSessionRegistration> find(SessionId sessionId) {
        return Mono.fromCallable(() -> store.get(sessionId));
    }

    @Override
    public Flux<GroupSessionRegistration> listByParticipant(Username participant) {
        return Flux.defer(() -> Flux.fromStream(store.values().stream()
            .filter(registration -> registration.isParticipant(participant))
            .sorted(Comparator.comparing(GroupSessionRegistration::createdAt))));
    }

    @Override
    public Mono<Boolean> updateStatus(SessionId sessionId, GroupSession.Status expected, GroupSession.Status target, Instant updatedAt) {
        return Mono.fromCallable(() -> {
            AtomicBoolean updated = new AtomicBoolean(false);
            store.computeIfPresent(sessionId, (id, registration) -> {
                if (registration.status() != expected) {
                    return registration;
                }
                updated.set(true);
                return registration.withStatus(target, updatedAt);
            });
            return updated.get();
        });
    }
}
