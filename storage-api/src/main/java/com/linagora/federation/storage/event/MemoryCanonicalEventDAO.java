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

package com.linagora.federation.storage.event;

import java.time.Instant;
import java.util.List;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import com.google.common.collect.Tables;
import com.linagora.federation.storage.model.SubjectId;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class MemoryCanonicalEventDAO implements CanonicalEventDAO {

    private final Table<SubjectId, EventId, CanonicalEvent> store = Tables.synchronizedTable(HashBasedTable.create());

    @Override
    public Flux<BusyInterval> getBusyIntervals(SubjectId subject, Instant windowStart, Instant windowEnd) {
        return Flux.defer(() -> Flux.fromIterable(snapshot(subject)))
            .filter(CanonicalEvent::isBusy)
            .filter(event -> event.interval().overlaps(windowStart, windowEnd))
            .map(CanonicalEvent::asBusyInterval);
    }

    @Override
    public Mono<EventId> create(CanonicalEvent.CreationRequest request) {
        return Mono.fromCallable(() -> {
            EventId eventId = EventId.generate();
            store.put(request.subject(), eventId, request.toEvent(eventId));
            return eventId;
        });
    }

    @Override
    public Mono<CanonicalEvent> find(SubjectId subject, EventId eventId) {
        return Mono.fromCallable(() -> store.get(subject, eventId));
    }

    @Override
    public Flux<CanonicalEvent> list(SubjectId subject) {
        return Flux.defer(() -> Flux.fromIterable(snapshot(subject)));
    }

    @Override
    public Mono<Void> delete(SubjectId subject, EventId eventId) {
        return Mono.fromRunnable(() -> store.remove(subject, eventId));
    }

    private List<CanonicalEvent> snapshot(SubjectId subject) {
        synchronized (store) {
            return ImmutableList.copyOf(store.row(subject).values());
        }
    }
}
