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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.apache.james.core.Username;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.linagora.federation.storage.group.GroupSession;
import com.linagora.federation.storage.session.Candidate;
import com.linagora.federation.storage.session.CandidateId;

/**
 * JSON payload of a group session, as handed to any participant. It only carries identifiers,
 * the session's own title, timestamps, scores and explanations.
 */
public class GroupSessionSerializer {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new Jdk8Module())
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public record CandidateDTO(@JsonProperty("candidateId") String candidateId,
                        @JsonProperty("start") Instant start,
                        @JsonProperty("end") Instant end,
                        @JsonProperty("score") int score,
                        @JsonProperty("explanation") String explanation) {

        static CandidateDTO from(Candidate candidate) {
            return new CandidateDTO(candidate.candidateId().value(), candidate.start(), candidate.end(),
                candidate.score(), candidate.explanation());
        }
    }

    public record GroupSessionDTO(@JsonProperty("sessionId") String sessionId,
                           @JsonProperty("creatorUserId") String creatorUserId,
                           @JsonProperty("participantUserIds") List<String> participantUserIds,
                           @JsonProperty("title") String title,
                           @JsonProperty("durationMinutes") int durationMinutes,
                           @JsonProperty("windowStart") Instant windowStart,
                           @JsonProperty("windowEnd") Instant windowEnd,
                           @JsonProperty("maxCandidates") int maxCandidates,
                           @JsonProperty("holdTimeoutMs") long holdTimeoutMs,
                           @JsonProperty("status") String status,
                           @JsonProperty("candidates") List<CandidateDTO> candidates,
                           @JsonProperty("committedCandidateId") Optional<String> committedCandidateId,
                           @JsonProperty("createdAt") Instant createdAt) {

        static GroupSessionDTO from(GroupSession session) {
            return new GroupSessionDTO(session.sessionId().value(),
                session.creator().asString(),
                session.participants().stream().map(Username::asString).toList(),
                session.title(),
                session.durationMinutes(),
                session.windowStart(),
                session.windowEnd(),
                session.maxCandidates(),
                session.holdTimeout().toMillis(),
                session.status().value(),
                session.candidates().stream().map(CandidateDTO::from).toList(),
                session.committedCandidateId().map(CandidateId::value),
                session.createdAt());
        }
    }

    public String serialize(GroupSession session) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(GroupSessionDTO.from(session));
    }

    public byte[] serializeAsBytes(GroupSession session) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsBytes(GroupSessionDTO.from(session));
    }
}
