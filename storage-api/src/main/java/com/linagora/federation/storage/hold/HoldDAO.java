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

import com.linagora.federation.storage.model.SubjectId;
import com.linagora.federation.storage.session.SessionId;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface HoldDAO {
    Mono<Void> create(Collection<Hold> holds);

    Flux<Hold> listBySession(SessionId sessionId);

    // HELD holds of the subject that are not expired at 'now'
    Flux<Hold> listActiveBySubject(SubjectId subject, Instant now);

    // every hold of the session that is not RELEASED becomes RELEASED, returns how many changed
    Mono<Long> releaseBySession(SessionId sessionId);

    // HELD holds with expiresAt <= now become EXPIRED, returns how many changed
    Mono<Long> expire(Instant now);

    // new expiry for the HELD holds of the session, returns how many changed
    Mono<Long> extend(SessionId sessionId, Instant expiresAt);
}
