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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.linagora.federation.storage.session.SessionId;

import reactor.core.publisher.Mono;

public class MemoryGroupSessionDAO implements GroupSessionDAO {

    private final Map<SessionId, GroupSession> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> save(GroupSession session) {
        return Mono.fromRunnable(() -> store.put(session.sessionId(), session));
    }

    @Override
    public Mono<GroupSession> find(SessionId sessionId) {
        return Mono.fromCallable(() -> store.get(sessionId));
    }
}
