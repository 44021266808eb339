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
import static com.mongodb.client.model.Filters.gt;
import static com.mongodb.client.model.Filters.lte;
import static com.mongodb.client.model.Filters.ne;
import static com.mongodb.client.model.Sorts.ascending;

import java.time.Instant;
import java.util.Collection;
import java.util.Date;

import jakarta.inject.Inject;

import org.bson.Document;
import org.bson.conversions.Bson;

import com.linagora.federation.storage.hold.Hold;
import com.linagora.federation.storage.hold.HoldDAO;
import com.linagora.federation.storage.hold.HoldId;
import com.linagora.federation.storage.model.SubjectId;
import com.linagora.federation.storage.session.SessionId;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.UpdateResult;
import com.mongodb.reactivestreams.client.MongoCollection;
import com.mongodb.reactivestreams.client.MongoDatabase;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class MongoDBHoldDAO implements HoldDAO {
    public static final String COLLECTION = "federation_holds";

    public static final String FIELD_ID = "_id";
    public static final String FIELD_SESSION_ID = "sessionId";
    public static final String FIELD_SUBJECT = "subject";
    public static final String FIELD_START = "start";
    public static final String FIELD_END = "end";
    public static final String FIELD_EXPIRES_AT = "expiresAt";
    public static final String FIELD_STATUS = "status";

    private final MongoCollection<Document> collection;

    @Inject
    public MongoDBHoldDAO(MongoDatabase database) {
        this.collection = database.getCollection(COLLECTION);
    }

    @Override
    public Mono<Void> create(Collection<Hold> holds) {
        if (holds.isEmpty()) {
            return Mono.empty();
        }
        return Mono.from(collection.insertMany(holds.stream().map(this::toDocument).toList())).then();
    }

    @Override
    public Flux<Hold> listBySession(SessionId sessionId) {
        return Flux.from(collection.find(eq(FIELD_SESSION_ID, sessionId.value()))
                .sort(ascending(FIELD_START, FIELD_SUBJECT)))
            .map(this::fromDocument);
    }

    @Override
    public Flux<Hold> listActiveBySubject(SubjectId subject, Instant now) {
        return Flux.from(collection.find(and(
                eq(FIELD_SUBJECT, subject.value()),
                eq(FIELD_STATUS, Hold.Status.HELD.value()),
                gt(FIELD_EXPIRES_AT, Date.from(now)))))
            .map(this::fromDocument);
    }

    @Override
    public Mono<Long> releaseBySession(SessionId sessionId) {
        return updateMany(and(
                eq(FIELD_SESSION_ID, sessionId.value()),
                ne(FIELD_STATUS, Hold.Status.RELEASED.value())),
            Updates.set(FIELD_STATUS, Hold.Status.RELEASED.value()));
    }

    @Override
    public Mono<Long> expire(Instant now) {
        return updateMany(and(
                eq(FIELD_STATUS, Hold.Status.HELD.value()),
                lte(FIELD_EXPIRES_AT, Date.from(now))),
            Updates.set(FIELD_STATUS, Hold.Status.EXPIRED.value()));
    }

    @Override
    public Mono<Long> extend(SessionId sessionId, Instant expiresAt) {
        return updateMany(and(
                eq(FIELD_SESSION_ID, sessionId.value()),
                eq(FIELD_STATUS, Hold.Status.HELD.value())),
            Updates.set(FIELD_EXPIRES_AT, Date.from(expiresAt)));
    }

    private Mono<Long> updateMany(Bson filter, Bson update) {
        return Mono.from(collection.updateMany(filter, update))
            .map(UpdateResult::getMatchedCount);
    }

    private Document toDocument(Hold hold) {
        return new Document()
            .append(FIELD_ID, hold.holdId().value())
            .append(FIELD_SESSION_ID, hold.sessionId().value())
            .append(FIELD_SUBJECT, hold.subject().value())
            .append(FIELD_START, Date.from(hold.start()))
            .append(FIELD_END, Date.from(hold.end()))
            .append(FIELD_EXPIRES_AT, Date.from(hold.expiresAt()))
            .append(FIELD_STATUS, hold.status().value());
    }

    private Hold fromDocument(Document document) {
        return new Hold(new HoldId(document.getString(FIELD_ID)),
            new SessionId(document.getString(FIELD_SESSION_ID)),
            new SubjectId(document.getString(FIELD_SUBJECT)),
            document.getDate(FIELD_START).toInstant(),
            document.getDate(FIELD_END).toInstant(),
            document.getDate(FIELD_EXPIRES_AT).toInstant(),
            Hold.Status.parse(document.getString(FIELD_STATUS)));
    }
}
