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

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.linagora.federation.storage.model.CalendarId;
import com.linagora.federation.storage.model.SubjectId;
import com.linagora.federation.storage.model.TimeInterval;

public record CanonicalEvent(EventId eventId,
                             SubjectId subject,
                             CalendarId calendarId,
                             String title,
                             TimeInterval interval,
                             Source source,
                             Status status,
                             Transparency transparency) {

    public enum Source {
        PROVIDER,
        SYSTEM
    }

    public enum Status {
        CONFIRMED,
        TENTATIVE,
        CANCELLED
    }

    public enum Transparency {
        OPAQUE,
        TRANSPARENT
    }

    public record CreationRequest(SubjectId subject,
                                  CalendarId calendarId,
                                  String title,
                                  TimeInterval interval,
                                  Source source,
                                  Status status,
                                  Transparency transparency) {

        public static CreationRequest systemConfirmed(SubjectId subject, CalendarId calendarId, String title, TimeInterval interval) {
            return new CreationRequest(subject, calendarId, title, interval, Source.SYSTEM, Status.CONFIRMED, Transparency.OPAQUE);
        }

        public CreationRequest {
            Preconditions.checkNotNull(subject, "'subject' must not be null");
            Preconditions.checkNotNull(calendarId, "'calendarId' must not be null");
            Preconditions.checkArgument(!StringUtils.isBlank(title), "'title' must not be empty");
            Preconditions.checkNotNull(interval, "'interval' must not be null");
            Preconditions.checkNotNull(source, "'source' must not be null");
            Preconditions.checkNotNull(status, "'status' must not be null");
            Preconditions.checkNotNull(transparency, "'transparency' must not be null");
        }

        public CanonicalEvent toEvent(EventId eventId) {
            return new CanonicalEvent(eventId, subject, calendarId, title, interval, source, status, transparency);
        }
    }

    public boolean isBusy() {
        return status != Status.CANCELLED && transparency == Transparency.OPAQUE;
    }

    public BusyInterval asBusyInterval() {
        return new BusyInterval(interval, source);
    }

    public String toShortString() {
        return MoreObjects.toStringHelper(this)
            .add("eventId", eventId.value())
            .add("subject", subject.value())
            .add("start", interval.start())
            .add("end", interval.end())
            .toString();
    }
}
