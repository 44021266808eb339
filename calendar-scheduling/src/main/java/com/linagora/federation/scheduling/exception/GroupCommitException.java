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

package com.linagora.federation.scheduling.exception;

import java.util.List;

import org.apache.james.core.Username;

import com.google.common.collect.ImmutableList;
import com.linagora.federation.storage.session.SessionId;

/**
 * Writing the committed event failed for one participant. Events already written for
 * {@link #succeededParticipants()} have been deleted on a best effort basis.
 */
public class GroupCommitException extends SchedulingException {
    private final SessionId sessionId;
    private final List<Username> succeededParticipants;
    private final Username failedParticipant;

    public GroupCommitException(SessionId sessionId, List<Username> succeededParticipants, Username failedParticipant, Throwable cause) {
        super(String.format("Commit of group session %s failed for %s after succeeding for %s",
            sessionId.value(), failedParticipant.asString(),
            succeededParticipants.stream().map(Username::asString).toList()), cause);
        this.sessionId = sessionId;
        this.succeededParticipants = ImmutableList.copyOf(succeededParticipants);
        this.failedParticipant = failedParticipant;
    }

    public SessionId sessionId() {
        return sessionId;
    }

    public List<Username> succeededParticipants() {
        return succeededParticipants;
    }

    public Username failedParticipant() {
        return failedParticipant;
    }
}
