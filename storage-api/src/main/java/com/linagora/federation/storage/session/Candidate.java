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

package com.linagora.federation.storage.session;

import java.time.Instant;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;
import com.linagora.federation.storage.model.TimeInterval;

public record Candidate(CandidateId candidateId,
                        SessionId sessionId,
                        Instant start,
                        Instant end,
                        int score,
                        String explanation) {

    public Candidate {
        Preconditions.checkNotNull(candidateId, "'candidateId' must not be null");
        Preconditions.checkNotNull(sessionId, "'sessionId' must not be null");
        Preconditions.checkNotNull(start, "'start' must not be null");
        Preconditions.checkNotNull(end, "'end' must not be null");
        Preconditions.checkArgument(start.isBefore(end), "'start' must be before 'end'");
        Preconditions.checkArgument(score >= 0, "'score' must not be negative");
        Preconditions.checkArgument(!StringUtils.isBlank(explanation), "'explanation' must not be empty");
    }

    public TimeInterval interval() {
        return new TimeInterval(start, end);
    }
}
