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

import static com.mongodb.client.model.Indexes.ascending;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.client.model.IndexOptions;
import com.mongodb.reactivestreams.client.MongoDatabase;

import reactor.core.publisher.Flux;
/**
 * Indexes backing the queries of the MongoDB stores. Creating an existing index is a no-op.
 */
public class MongoDBCollectionFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(MongoDBCollectionFactory.class);

    private MongoDBCollectionFactory() {
    }

    public static void initialize(MongoDatabase database) {
        Flux.concat(
                database.getCollection(MongoDBHoldDAO.COLLECTION)
                    .createIndex(ascending(MongoDBHoldDAO.FIELD_SESSION_ID), new IndexOptions()),
                database.getCollection(MongoDBHoldDAO.COLLECTION)
                    .createIndex(ascending(MongoDBHoldDAO.FIELD_SUBJECT, MongoDBHoldDAO.FIELD_STATUS), new IndexOptions()),
                database.getCollection(MongoDBHoldDAO.COLLECTION)
                    .createIndex(ascending(MongoDBHoldDAO.FIELD_STATUS, MongoDBHoldDAO.FIELD_EXPIRES_AT), new IndexOptions()),
                database.getCollection(MongoDBGroupSessionRegistry.COLLECTION)
                    .createIndex(ascending(MongoDBGroupSessionRegistry.FIELD_PARTICIPANTS), new IndexOptions()))
            .doOnNext(index -> LOGGER.debug("Ensured MongoDB index {}", index))
            .then()
            .block();
    }
}
