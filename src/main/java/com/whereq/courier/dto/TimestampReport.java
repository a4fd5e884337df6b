package com.whereq.courier.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.courier.diagnostics.TimestampFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Timestamp fields of a job and whether each one is well formed
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TimestampReport {
    private String eventId;

    private TimestampFormat eventIdFormat;

    private String threadId;

    private TimestampFormat threadIdFormat;

    private String placeholderMessageId;

    private TimestampFormat placeholderMessageIdFormat;

    /**
     * True when no present field is malformed
     */
    private boolean valid;
}
