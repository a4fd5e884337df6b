package com.whereq.courier.idempotency;

import com.whereq.courier.model.Job;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Stable identity of a job, derived from where it is answered and the platform event it came from
 */
public final class JobIdentity {

    private JobIdentity() {
    }

    /**
     * Identity of a job: hash of (thread, or channel, or response URL) and event id
     *
     * @param job job with an event id
     * @return hex digest
     */
    public static String of(Job job) {
        if (!job.hasEventId()) {
            throw new IllegalArgumentException("Job identity needs an event id");
        }
        String scope = firstNonBlank(job.getThreadId(), job.getChannelId(), job.getResponseUrl());
        return DigestUtils.md5DigestAsHex((scope + "-" + job.getEventId()).getBytes(StandardCharsets.UTF_8));
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }
}
