package com.whereq.courier.diagnostics;

import com.whereq.courier.dto.TimestampReport;
import com.whereq.courier.model.Job;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Checks that message timestamps look like {@code seconds.fraction}.
 * Jobs built from other sources sometimes carry a bare epoch value, which the platform
 * rejects as a thread or message reference.
 */
@Component
public class TimestampFormatValidator {

    private static final Pattern TIMESTAMP = Pattern.compile("\\d+\\.\\d+");

    public TimestampFormat check(String value) {
        if (value == null || value.isBlank()) {
            return TimestampFormat.NOT_PRESENT;
        }
        return TIMESTAMP.matcher(value.trim()).matches() ? TimestampFormat.VALID : TimestampFormat.INVALID;
    }

    public TimestampReport report(Job job) {
        TimestampFormat eventIdFormat = check(job.getEventId());
        TimestampFormat threadIdFormat = check(job.getThreadId());
        TimestampFormat placeholderFormat = check(job.getPlaceholderMessageId());

        return TimestampReport.builder()
            .eventId(job.getEventId())
            .eventIdFormat(eventIdFormat)
            .threadId(job.getThreadId())
            .threadIdFormat(threadIdFormat)
            .placeholderMessageId(job.getPlaceholderMessageId())
            .placeholderMessageIdFormat(placeholderFormat)
            .valid(eventIdFormat != TimestampFormat.INVALID
                && threadIdFormat != TimestampFormat.INVALID
                && placeholderFormat != TimestampFormat.INVALID)
            .build();
    }
}
