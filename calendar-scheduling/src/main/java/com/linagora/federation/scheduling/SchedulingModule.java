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

package com.linagora.federation.scheduling;

import java.time.Clock;

import jakarta.inject.Singleton;

import org.apache.james.utils.InitializationOperation;
import org.apache.james.utils.InitilizationOperationBuilder;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.multibindings.ProvidesIntoSet;
import com.linagora.federation.scheduling.actor.UserActorRegistry;
import com.linagora.federation.scheduling.availability.AvailabilityResolver;
import com.linagora.federation.scheduling.candidate.CandidateGenerator;
import com.linagora.federation.scheduling.group.GroupSchedulingService;
import com.linagora.federation.scheduling.group.GroupSessionSerializer;
import com.linagora.federation.scheduling.hold.HoldExpirySweeper;
import com.linagora.federation.scheduling.hold.HoldManager;
import com.linagora.federation.scheduling.session.SchedulingSessionService;

public class SchedulingModule extends AbstractModule {

    @Override
    protected void configure() {
        install(new SchedulingConfigurationModule());

        bind(AvailabilityResolver.class).in(Scopes.SINGLETON);
        bind(CandidateGenerator.class).in(Scopes.SINGLETON);
        bind(HoldManager.class).in(Scopes.SINGLETON);
        bind(HoldExpirySweeper.class).in(Scopes.SINGLETON);
        bind(UserActorRegistry.class).in(Scopes.SINGLETON);
        bind(SchedulingSessionService.class).in(Scopes.SINGLETON);
        bind(GroupSchedulingService.class).in(Scopes.SINGLETON);
        bind(GroupSessionSerializer.class).in(Scopes.SINGLETON);
    }

    @Provides
    @Singleton
    Clock provideClock() {
        return Clock.systemUTC();
    }

    @ProvidesIntoSet
    InitializationOperation startHoldExpirySweeper(HoldExpirySweeper holdExpirySweeper) {
        return InitilizationOperationBuilder
            .forClass(HoldExpirySweeper.class)
            .init(holdExpirySweeper::start);
    }
}
