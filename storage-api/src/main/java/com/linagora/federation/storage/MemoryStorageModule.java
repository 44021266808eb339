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

package com.linagora.federation.storage;

import com.google.inject.AbstractModule;
import com.google.inject.Scopes;
import com.linagora.federation.storage.constraint.ConstraintDAO;
import com.linagora.federation.storage.constraint.MemoryConstraintDAO;
import com.linagora.federation.storage.event.CanonicalEventDAO;
import com.linagora.federation.storage.event.MemoryCanonicalEventDAO;
import com.linagora.federation.storage.group.GroupSessionDAO;
import com.linagora.federation.storage.group.GroupSessionRegistry;
import com.linagora.federation.storage.group.MemoryGroupSessionDAO;
import com.linagora.federation.storage.group.MemoryGroupSessionRegistry;
import com.linagora.federation.storage.hold.HoldDAO;
import com.linagora.federation.storage.hold.MemoryHoldDAO;
import com.linagora.federation.storage.milestone.MemoryMilestoneDAO;
import com.linagora.federation.storage.milestone.MilestoneDAO;
import com.linagora.federation.storage.session.MemorySchedulingSessionDAO;
import com.linagora.federation.storage.session.SchedulingSessionDAO;

public class MemoryStorageModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(MemoryCanonicalEventDAO.class).in(Scopes.SINGLETON);
        bind(CanonicalEventDAO.class).to(MemoryCanonicalEventDAO.class);

        bind(MemoryConstraintDAO.class).in(Scopes.SINGLETON);
        bind(ConstraintDAO.class).to(MemoryConstraintDAO.class);

        bind(MemoryMilestoneDAO.class).in(Scopes.SINGLETON);
        bind(MilestoneDAO.class).to(MemoryMilestoneDAO.class);

        bind(MemorySchedulingSessionDAO.class).in(Scopes.SINGLETON);
        bind(SchedulingSessionDAO.class).to(MemorySchedulingSessionDAO.class);

        bind(MemoryHoldDAO.class).in(Scopes.SINGLETON);
        bind(HoldDAO.class).to(MemoryHoldDAO.class);

        bind(MemoryGroupSessionDAO.class).in(Scopes.SINGLETON);
        bind(GroupSessionDAO.class).to(MemoryGroupSessionDAO.class);

        bind(MemoryGroupSessionRegistry.class).in(Scopes.SINGLETON);
        bind(GroupSessionRegistry.class).to(MemoryGroupSessionRegistry.class);
    }
}
