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

import org.apache.james.core.Username;

import com.linagora.federation.storage.session.SessionId;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface GroupSessionRegistry {
    Mono<Void> register(GroupSessionRegistration registration);

    Mono<GroupSessionRegistration> find(SessionId sessionId);

    Flux<GroupSessionRegistration> listByParticipant(Username participant);

    /**
     * Compare-and-set of the status.
     *
     * @return true when the stored status was {@code expected} and is now {@code target},
     * false when the session is unknown or its status differs from {@code expected}
     */
    Mono<Boolean> updateStatus(SessionId sessionId, GroupSession.Status expected, GroupSession.Status target, Instant updatedAt);
}
