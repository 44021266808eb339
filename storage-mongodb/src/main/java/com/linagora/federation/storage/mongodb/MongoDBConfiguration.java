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

package com.linagora.federation.storage.mongodb;

import java.util.Optional;

import org.apache.commons.configuration2.AbstractConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.convert.DisabledListDelimiterHandler;
import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;

public record MongoDBConfiguration(String mongoURL, String database) {
    public static final String DEFAULT_DATABASE = "twake_federation";

    public static MongoDBConfiguration parse(Configuration configuration) {
        if (configuration instanceof AbstractConfiguration abstractConfiguration) {
            abstractConfiguration.setListDelimiterHandler(new DisabledListDelimiterHandler());
        }

        return new MongoDBConfiguration(
            Optional.ofNullable(configuration.getString("mongo.url", null))
                .orElseThrow(() -> new IllegalArgumentException("'mongo.url' is mandatory")),
            configuration.getString("mongo.database", DEFAULT_DATABASE));
    }

    public MongoDBConfiguration {
        Preconditions.checkArgument(!StringUtils.isBlank(mongoURL), "'mongo.url' must not be empty");
        Preconditions.checkArgument(!StringUtils.isBlank(database), "'mongo.database' must not be empty");
    }
}
