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

import com.google.common.base.Preconditions;
import com.linagora.federation.storage.model.TimeInterval;

/**
 * What the canonical store discloses about a busy event: its bounds and where it came from, never its text.
 */
public record BusyInterval(TimeInterval interval, CanonicalEvent.Source source) {

    public BusyInterval {
        Preconditions.checkNotNull(interval, "'interval' must not be null");
        Preconditions.checkNotNull(source, "'source' must not be null");
    }

    public boolean isExternal() {
        return source != CanonicalEvent.Source.SYSTEM;
    }
}
