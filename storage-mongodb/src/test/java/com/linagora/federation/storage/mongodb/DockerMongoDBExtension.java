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

import java.util.List;

import org.apache.james.metrics.tests.RecordingMetricFactory;
import org.bson.Document;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.testcontainers.containers.MongoDBContainer;

import com.mongodb.reactivestreams.client.MongoDatabase;

import reactor.core.publisher.Mono;

/**
 * Starts a MongoDB container for the test class.
 */
public class DockerMongoDBExtension implements BeforeAllCallback, AfterAllCallback, AfterEachCallback {
    public static final List<String> CLEANUP_COLLECTIONS = List.of(MongoDBHoldDAO.COLLECTION, MongoDBGroupSessionRegistry.COLLECTION);

    private static MongoDBContainer mongoDBContainer;
    private static MongoDatabase db;

    private final List<String> cleanupCollections;

    public DockerMongoDBExtension(List<String> cleanupCollections) {
        this.cleanupCollections = cleanupCollections;
    }

    public DockerMongoDBExtension() {
        this(CLEANUP_COLLECTIONS);
    }

    @Override
    public void beforeAll(ExtensionContext extensionContext) {
        mongoDBContainer = new MongoDBContainer("mongo:6.0");
        mongoDBContainer.start();
        MongoDBConfiguration configuration = new MongoDBConfiguration(mongoDBContainer.getConnectionString(), "federation_docker");
        db = MongoDBConnectionFactory.instantiateDB(configuration, new RecordingMetricFactory());
        MongoDBCollectionFactory.initialize(db);
    }

    @Override
    public void afterAll(ExtensionContext extensionContext) {
        if (mongoDBContainer != null) {
            mongoDBContainer.stop();
        }
    }

    @Override
    public void afterEach(ExtensionContext extensionContext) {
        for (String collection : cleanupCollections) {
            Mono.from(db.getCollection(collection).deleteMany(new Document())).block();
        }
    }

    public MongoDatabase getDb() {
        return db;
    }
}
