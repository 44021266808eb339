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
import java.util.List;

import org.apache.james.core.Username;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.linagora.federation.storage.session.SessionId;

/**
 * Cross-user index entry of a group session: enough to find who owns it and who may see it.
 */
public record GroupSessionRegistration(SessionId sessionId,
                                       Username creator,
                                       List<Username> participants,
                                       String title,
                                       GroupSession.Status status,
                                       Instant createdAt,
                                       Instant updatedAt) {

    public GroupSessionRegistration {
        Preconditions.checkNotNull(sessionId, "'sessionId' must not be null");
        Preconditions.checkNotNull(creator, "'creator' must not be null");
        Preconditions.checkNotNull(status, "'status' must not be null");
        participants = ImmutableList.copyOf(participants);
    }

    public boolean isParticipant(Username username) {
        return participants.contains(username);
    }

    public GroupSessionRegistration withStatus(GroupSession.Status status, Instant updatedAt) {
        return new GroupSessionRegistration(sessionId, creator, participants, title, status, createdAt, updatedAt);
    }
}
