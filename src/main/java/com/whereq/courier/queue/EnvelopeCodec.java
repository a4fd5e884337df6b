package com.whereq.courier.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.courier.exception.JobValidationException;
import com.whereq.courier.exception.QueueStoreException;
import com.whereq.courier.model.DeadLetterEntry;
import com.whereq.courier.model.Job;
import com.whereq.courier.model.JobEnvelope;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * JSON form of queue items.
 *
 * A stored item is either an envelope ({@code {"body": {...}, "enqueuedAt": ...}}) or,
 * when pushed by older producers, a bare job. Both decode to {@link JobEnvelope}.
 */
@Component
@RequiredArgsConstructor
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Wrap a job into a new envelope stamped with the current time
     */
    public JobEnvelope wrap(Job job) {
        return JobEnvelope.builder()
            .streamId("job-" + UUID.randomUUID())
            .body(job)
            .enqueuedAt(Instant.now(clock))
            .build();
    }

    public String encode(JobEnvelope envelope) {
        return write(envelope);
    }

    public String encode(DeadLetterEntry entry) {
        return write(entry);
    }

    /**
     * Decode a stored item or an incoming request body
     *
     * @param json envelope or bare job
     * @return envelope holding the job
     * @throws JobValidationException when the JSON is neither shape
     */
    public JobEnvelope decode(String json) {
        if (json == null || json.isBlank()) {
            throw new JobValidationException("Job payload is empty");
        }
        try {
            return decode(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new JobValidationException("Job payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decode an already parsed envelope or bare job
     */
    public JobEnvelope decode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new JobValidationException("Job payload must be a JSON object");
        }
        try {
            JsonNode body = node.get("body");
            if (body != null && body.isObject()) {
                return objectMapper.treeToValue(node, JobEnvelope.class);
            }
            if (node.hasNonNull("questionText")) {
                Job job = objectMapper.treeToValue(node, Job.class);
                return JobEnvelope.builder()
                    .streamId("direct-" + UUID.randomUUID())
                    .body(job)
                    .build();
            }
        } catch (JsonProcessingException e) {
            throw new JobValidationException("Job payload has invalid fields: " + e.getOriginalMessage(), e);
        }
        throw new JobValidationException("Job payload is neither a job nor a queue envelope");
    }

    public DeadLetterEntry decodeDeadLetter(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, DeadLetterEntry.class);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new QueueStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
