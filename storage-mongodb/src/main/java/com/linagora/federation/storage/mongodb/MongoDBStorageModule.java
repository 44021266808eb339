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

import java.io.FileNotFoundException;

import jakarta.inject.Singleton;

import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.james.metrics.api.MetricFactory;
import org.apache.james.utils.InitializationOperation;
import org.apache.james.utils.InitilizationOperationBuilder;
import org.apache.james.utils.PropertiesProvider;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.multibindings.ProvidesIntoSet;
import com.google.inject.util.Modules;
import com.linagora.federation.storage.MemoryStorageModule;
import com.linagora.federation.storage.group.GroupSessionRegistry;
import com.linagora.federation.storage.hold.HoldDAO;
import com.mongodb.reactivestreams.client.MongoDatabase;

/**
 * Memory stores, except the hold table and the group registry which live in MongoDB.
 */
public class MongoDBStorageModule extends AbstractModule {

    @Override
    protected void configure() {
        install(Modules.override(new MemoryStorageModule()).with(new AbstractModule() {
            @Override
            protected void configure() {
                bind(MongoDBHoldDAO.class).in(Scopes.SINGLETON);
                bind(HoldDAO.class).to(MongoDBHoldDAO.class);

                bind(MongoDBGroupSessionRegistry.class).in(Scopes.SINGLETON);
                bind(GroupSessionRegistry.class).to(MongoDBGroupSessionRegistry.class);
            }
        }));
        bind(MongoDBCollectionInitializer.class).in(Scopes.SINGLETON);
    }

    @Provides
    @Singleton
    MongoDBConfiguration provideMongoDBConfiguration(PropertiesProvider propertiesProvider) throws ConfigurationException, FileNotFoundException {
        return MongoDBConfiguration.parse(propertiesProvider.getConfiguration("mongodb"));
    }

    @Provides
    @Singleton
    MongoDatabase provideMongoDatabase(MongoDBConfiguration configuration, MetricFactory metricFactory) {
        return MongoDBConnectionFactory.instantiateDB(configuration, metricFactory);
    }

    @ProvidesIntoSet
    InitializationOperation initializeCollections(MongoDBCollectionInitializer initializer) {
        return InitilizationOperationBuilder
            .forClass(MongoDBCollectionInitializer.class)
            .init(initializer::start);
    }
}
