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

import com.linagora.federation.storage.model.SubjectId;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface CanonicalEventDAO {

    // busy events overlapping [windowStart, windowEnd)
    Flux<BusyInterval> getBusyIntervals(SubjectId subject, Instant windowStart, Instant windowEnd);

    Mono<EventId> create(CanonicalEvent.CreationRequest request);

    Mono<CanonicalEvent> find(SubjectId subject, EventId eventId);

    Flux<CanonicalEvent> list(SubjectId subject);

    Mono<Void> delete(SubjectId subject, EventId eventId);
}
