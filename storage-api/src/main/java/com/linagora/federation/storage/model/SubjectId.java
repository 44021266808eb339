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

package com.linagora.federation.storage.model;

import org.apache.commons.lang3.StringUtils;
import org.apache.james.core.Username;

import com.google.common.base.Preconditions;

/**
 * Whose availability is looked at: a connected account in the single-user flow,
 * a participant user in the group flow.
 */
public record SubjectId(String value) {

    public static SubjectId of(AccountId accountId) {
        return new SubjectId(accountId.value());
    }

    public static SubjectId of(Username username) {
        return new SubjectId(username.asString());
    }

    public SubjectId {
        Preconditions.checkArgument(!StringUtils.isBlank(value), "subject id must not be empty");
    }
}
