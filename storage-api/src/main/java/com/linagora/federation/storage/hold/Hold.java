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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.linagora.federation.storage.model.SubjectId;
import com.linagora.federation.storage.model.TimeInterval;
import com.linagora.federation.storage.session.SessionId;

/**
 * A tentative reservation of a candidate interval against one subject.
 * Only {@code HELD} moves forward; {@code RELEASED} is final.
 */
public record Hold(HoldId holdId,
                   SessionId sessionId,
                   SubjectId subject,
                   Instant start,
                   Instant end,
                   Instant expiresAt,
                   Status status) {

    public enum Status {
        HELD("held"),
        EXPIRED("expired"),
        RELEASED("released");

        public static Status parse(String value) {
            for (Status status : values()) {
                if (status.value.equals(value)) {
                    return status;
                }
            }
            throw new IllegalArgumentException("Unknown hold status: " + value);
        }

        private final String value;

        Status(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public static Hold held(SessionId sessionId, SubjectId subject, TimeInterval interval, Instant expiresAt) {
        return new Hold(HoldId.generate(), sessionId, subject, interval.start(), interval.end(), expiresAt, Status.HELD);
    }

    public Hold {
        Preconditions.checkNotNull(holdId, "'holdId' must not be null");
        Preconditions.checkNotNull(sessionId, "'sessionId' must not be null");
        Preconditions.checkNotNull(subject, "'subject' must not be null");
        Preconditions.checkNotNull(expiresAt, "'expiresAt' must not be null");
        Preconditions.checkNotNull(status, "'status' must not be null");
        Preconditions.checkArgument(start.isBefore(end), "'start' must be before 'end'");
    }

    public TimeInterval interval() {
        return new TimeInterval(start, end);
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isActiveAt(Instant now) {
        return status == Status.HELD && !isExpiredAt(now);
    }

    public Hold withStatus(Status status) {
        return new Hold(holdId, sessionId, subject, start, end, expiresAt, status);
    }

    public Hold withExpiresAt(Instant expiresAt) {
        return new Hold(holdId, sessionId, subject, start, end, expiresAt, status);
    }

    public String toShortString() {
        return MoreObjects.toStringHelper(this)
            .add("holdId", holdId.value())
            .add("sessionId", sessionId.value())
            .add("subject", subject.value())
            .add("status", status.value())
            .toString();
    }
}
