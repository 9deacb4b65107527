package com.ryuqq.jobstore.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Persisted JSON shape of documents.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class DocumentMapperTest {

    private final ObjectMapper mapper = DocumentMapper.create();

    @Test
    void jobDocument_writesDiscriminatorAndIsoInstants() throws Exception {
        // given
        JobDocument job = new JobDocument("job-1", "critical");
        job.setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
        job.appendHistory(new StateHistoryEntry("enqueued", "Triggered", Instant.parse("2024-01-01T00:00:01Z"),
            Map.of("Queue", "critical")));
        job.setEtag("\"00000001\"");

        // when
        JsonNode json = mapper.readTree(mapper.writeValueAsString(job));

        // then
        assertThat(json.get("documentType").asText()).isEqualTo("job");
        assertThat(json.get("id").asText()).isEqualTo("job:job-1");
        assertThat(json.get("createdAt").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(json.get("state").asText()).isEqualTo("enqueued");
        assertThat(json.get("_etag").asText()).isEqualTo("\"00000001\"");
        assertThat(json.has("expireAt")).isFalse();
    }

    @Test
    void unknownFields_ignoredOnRead() throws Exception {
        String json = "{\"id\":\"counter:stats:succeeded\",\"documentType\":\"counter\","
            + "\"key\":\"stats:succeeded\",\"value\":3,\"addedByNewerVersion\":true}";

        CounterDocument counter = mapper.readValue(json, CounterDocument.class);

        assertThat(counter.getValue()).isEqualTo(3);
        assertThat(counter.getId()).isEqualTo("counter:stats:succeeded");
    }
}
