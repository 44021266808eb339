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

import java.io.FileNotFoundException;

import jakarta.inject.Singleton;

import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.james.utils.PropertiesProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;

public class SchedulingConfigurationModule extends AbstractModule {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchedulingConfigurationModule.class);

    @Provides
    @Singleton
    public SchedulingConfiguration provideSchedulingConfiguration(PropertiesProvider propertiesProvider) throws ConfigurationException {
        try {
            return SchedulingConfiguration.parse(propertiesProvider.getConfiguration("scheduling"));
        } catch (FileNotFoundException e) {
            LOGGER.info("No scheduling.properties found, using default scheduling configuration");
            return SchedulingConfiguration.DEFAULT;
        }
    }
}
