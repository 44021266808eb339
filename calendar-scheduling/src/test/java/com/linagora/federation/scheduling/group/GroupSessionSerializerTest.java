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

package com.linagora.federation.scheduling.group;

import static net.javacrumbs.jsonunit.assertj.JsonAssertions.assertThatJson;
import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.apache.james.core.Username;
import org.junit.jupiter.api.Test;

import com.linagora.federation.storage.group.GroupSession;
import com.linagora.federation.storage.session.Candidate;
import com.linagora.federation.storage.session.CandidateId;
import com.linagora.federation.storage.session.SessionId;

class GroupSessionSerializerTest {
    static final SessionId SESSION_ID = new SessionId("ses_0f3a9c");
    static final CandidateId CANDIDATE_ID = new CandidateId("cnd_7b21e4");
    static final Candidate CANDIDATE = new Candidate(CANDIDATE_ID, SESSION_ID,
        Instant.parse("2026-03-02T11:00:00Z"), Instant.parse("2026-03-02T12:00:00Z"), 15,
        "morning (+10), early in window (+7), next to 1 busy block(s) (-2)");

    GroupSessionSerializer testee = new GroupSessionSerializer();

    static GroupSession session(GroupSession.Status status, Optional<CandidateId> committedCandidateId) {
        return new GroupSession(SESSION_ID, Username.of("alice@linagora.com"),
            List.of(Username.of("alice@linagora.com"), Username.of("bob@linagora.com")),
            "Roadmap review", 60,
            Instant.parse("2026-03-02T09:00:00Z"), Instant.parse("2026-03-02T17:00:00Z"),
            5, Duration.ofHours(24), status, List.of(CANDIDATE), committedCandidateId,
            Instant.parse("2026-03-01T12:00:00Z"));
    }

    @Test
    void serializeShouldExposeTheSessionFields() throws Exception {
        String json = testee.serialize(session(GroupSession.Status.CANDIDATES_READY, Optional.empty()));

        assertThatJson(json).isEqualTo("""
            {
              "sessionId": "ses_0f3a9c",
              "creatorUserId": "alice@linagora.com",
              "participantUserIds": ["alice@linagora.com", "bob@linagora.com"],
              "title": "Roadmap review",
              "durationMinutes": 60,
              "windowStart": "2026-03-02T09:00:00Z",
              "windowEnd": "2026-03-02T17:00:00Z",
              "maxCandidates": 5,
              "holdTimeoutMs": 86400000,
              "status": "candidates_ready",
              "candidates": [
                {
                  "candidateId": "cnd_7b21e4",
                  "start": "2026-03-02T11:00:00Z",
                  "end": "2026-03-02T12:00:00Z",
                  "score": 15,
                  "explanation": "morning (+10), early in window (+7), next to 1 busy block(s) (-2)"
                }
              ],
              "committedCandidateId": null,
              "createdAt": "2026-03-01T12:00:00Z"
            }""");
    }

    @Test
    void serializeShouldExposeTheCommittedCandidate() throws Exception {
        String json = testee.serialize(session(GroupSession.Status.COMMITTED, Optional.of(CANDIDATE_ID)));

        assertThatJson(json).node("status").isEqualTo("committed");
        assertThatJson(json).node("committedCandidateId").isEqualTo("cnd_7b21e4");
    }

    @Test
    void serializeAsBytesShouldMatchSerialize() throws Exception {
        GroupSession session = session(GroupSession.Status.GATHERING, Optional.empty());

        assertThat(new String(testee.serializeAsBytes(session), StandardCharsets.UTF_8))
            .isEqualTo(testee.serialize(session));
    }
}
