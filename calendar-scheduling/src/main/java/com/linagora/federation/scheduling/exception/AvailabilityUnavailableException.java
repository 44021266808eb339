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

import com.linagora.federation.storage.model.SubjectId;

/**
 * A busy-interval, constraint or milestone source failed or did not answer in time.
 */
public class AvailabilityUnavailableException extends SchedulingException {

    public AvailabilityUnavailableException(SubjectId subject, Throwable cause) {
        super("Availability of " + subject.value() + " could not be resolved: " + cause.getMessage(), cause);
    }
}
