package com.whereq.courier.queue;

import com.whereq.courier.exception.JobValidationException;
import com.whereq.courier.model.ChannelType;
import com.whereq.courier.model.JobEnvelope;
import com.whereq.courier.support.MutableClock;
import com.whereq.courier.support.TestFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeCodecTest {

    private final EnvelopeCodec codec = new EnvelopeCodec(TestFixtures.objectMapper(),
        new MutableClock(TestFixtures.START));

    @Test
    void decodesIngestionFieldNames() {
        JobEnvelope envelope = codec.decode("{\"streamId\":\"s-1\",\"body\":{"
            + "\"questionText\":\"What is X?\",\"channel\":\"D1\",\"channel_type\":\"im\","
            + "\"thread_ts\":\"1.1\",\"stub_ts\":\"2.2\",\"event_ts\":\"3.3\",\"response_url\":\"https://hooks/x\"}}");

        assertThat(envelope.getStreamId()).isEqualTo("s-1");
        assertThat(envelope.getBody().getChannelId()).isEqualTo("D1");
        assertThat(envelope.getBody().getChannelType()).isEqualTo(ChannelType.IM);
        assertThat(envelope.getBody().getThreadId()).isEqualTo("1.1");
        assertThat(envelope.getBody().getPlaceholderMessageId()).isEqualTo("2.2");
        assertThat(envelope.getBody().getEventId()).isEqualTo("3.3");
        assertThat(envelope.getBody().getResponseUrl()).isEqualTo("https://hooks/x");
    }

    @Test
    void ignoresUnknownFields() {
        JobEnvelope envelope = codec.decode("{\"questionText\":\"Q\",\"channelId\":\"C1\",\"extra\":42}");

        assertThat(envelope.getBody().getQuestionText()).isEqualTo("Q");
    }

    @Test
    void encodedEnvelopeCarriesTheEnqueueTime() {
        String json = codec.encode(codec.wrap(TestFixtures.channelJob()));

        assertThat(json).contains("\"enqueuedAt\":\"2024-05-01T10:00:00Z\"");
        assertThat(json).doesNotContain("responseUrl");
    }

    @Test
    void rejectsObjectsThatAreNeitherShape() {
        assertThatThrownBy(() -> codec.decode("{\"type\":\"ping\"}"))
            .isInstanceOf(JobValidationException.class);
        assertThatThrownBy(() -> codec.decode(""))
            .isInstanceOf(JobValidationException.class);
    }
}
