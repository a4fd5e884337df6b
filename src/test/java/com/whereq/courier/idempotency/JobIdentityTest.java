package com.whereq.courier.idempotency;

import com.whereq.courier.model.Job;
import com.whereq.courier.support.TestFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobIdentityTest {

    @Test
    void sameEventInSameChannelHasSameIdentity() {
        Job first = TestFixtures.channelJob();
        Job redelivered = first.toBuilder().questionText("What is X? (retry)").userId("U2").build();

        assertThat(JobIdentity.of(redelivered)).isEqualTo(JobIdentity.of(first));
    }

    @Test
    void threadTakesPrecedenceOverChannel() {
        Job inThread = TestFixtures.channelJob().toBuilder().threadId("100.1").build();
        Job otherChannelSameThread = inThread.toBuilder().channelId("C2").build();

        assertThat(JobIdentity.of(otherChannelSameThread)).isEqualTo(JobIdentity.of(inThread));
        assertThat(JobIdentity.of(inThread)).isNotEqualTo(JobIdentity.of(TestFixtures.channelJob()));
    }

    @Test
    void differentEventsDiffer() {
        Job job = TestFixtures.channelJob();

        assertThat(JobIdentity.of(job.toBuilder().eventId("1714557600.000200").build()))
            .isNotEqualTo(JobIdentity.of(job))
            .hasSize(32);
    }

    @Test
    void requiresAnEventId() {
        Job job = TestFixtures.channelJob().toBuilder().eventId(null).build();

        assertThatThrownBy(() -> JobIdentity.of(job)).isInstanceOf(IllegalArgumentException.class);
    }
}
