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

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;

import java.time.Instant;
import java.util.Date;
import java.util.List;

import jakarta.inject.Inject;

import org.apache.james.core.Username;
import org.bson.Document;

import com.linagora.federation.storage.group.GroupSession;
import com.linagora.federation.storage.group.GroupSessionRegistration;
import com.linagora.federation.storage.group.GroupSessionRegistry;
import com.linagora.federation.storage.session.SessionId;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Updates;
import com.mongodb.reactivestreams.client.MongoCollection;
import com.mongodb.reactivestreams.client.MongoDatabase;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable group session index shared by every coordinator instance. The status update is a
 * single {@code findOneAndUpdate} filtered on the expected status.
 */
public class MongoDBGroupSessionRegistry implements GroupSessionRegistry {
    public static final String COLLECTION = "federation_group_sessions";

    public static final String FIELD_ID = "_id";
    public static final String FIELD_CREATOR = "creator";
    public static final String FIELD_PARTICIPANTS = "participants";
    public static final String FIELD_TITLE = "title";
    public static final String FIELD_STATUS = "status";
    public static final String FIELD_CREATED_AT = "createdAt";
    public static final String FIELD_UPDATED_AT = "updatedAt";

    private final MongoCollection<Document> collection;

    @Inject
    public MongoDBGroupSessionRegistry(MongoDatabase database) {
        this.collection = database.getCollection(COLLECTION);
    }

    @Override
    public Mono<Void> register(GroupSessionRegistration registration) {
        return Mono.from(collection.replaceOne(eq(FIELD_ID, registration.sessionId().value()),
                toDocument(registration),
                new ReplaceOptions().upsert(true)))
            .then();
    }

    @Override
    public Mono<GroupSessionRegistration> find(SessionId sessionId) {
        return Mono.from(collection.find(eq(FIELD_ID, sessionId.value())).first())
            .map(this::fromDocument);
    }

    @Override
    public Flux<GroupSessionRegistration> listByParticipant(Username participant) {
        return Flux.from(collection.find(eq(FIELD_PARTICIPANTS, participant.asString())))
            .map(this::fromDocument);
    }

    @Override
    public Mono<Boolean> updateStatus(SessionId sessionId, GroupSession.Status expected, GroupSession.Status target, Instant updatedAt) {
        return Mono.from(collection.findOneAndUpdate(
                and(eq(FIELD_ID, sessionId.value()), eq(FIELD_STATUS, expected.value())),
                Updates.combine(
                    Updates.set(FIELD_STATUS, target.value()),
                    Updates.set(FIELD_UPDATED_AT, Date.from(updatedAt)))))
            .map(previous -> true)
            .defaultIfEmpty(false);
    }

    private Document toDocument(GroupSessionRegistration registration) {
        return new Document()
            .append(FIELD_ID, registration.sessionId().value())
            .append(FIELD_CREATOR, registration.creator().asString())
            .append(FIELD_PARTICIPANTS, registration.participants().stream().map(Username::asString).toList())
            .append(FIELD_TITLE, registration.title())
            .append(FIELD_STATUS, registration.status().value())
            .append(FIELD_CREATED_AT, Date.from(registration.createdAt()))
            .append(FIELD_UPDATED_AT, Date.from(registration.updatedAt()));
    }

    private GroupSessionRegistration fromDocument(Document document) {
        List<Username> participants = document.getList(FIELD_PARTICIPANTS, String.class).stream()
            .map(Username::of)
            .toList();
        return new GroupSessionRegistration(new SessionId(document.getString(FIELD_ID)),
            Username.of(document.getString(FIELD_CREATOR)),
            participants,
            document.getString(FIELD_TITLE),
            GroupSession.Status.parse(document.getString(FIELD_STATUS)),
            document.getDate(FIELD_CREATED_AT).toInstant(),
            document.getDate(FIELD_UPDATED_AT).toInstant());
    }
}
