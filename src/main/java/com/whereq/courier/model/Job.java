package com.whereq.courier.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One question waiting to be answered and delivered back to its conversation.
 *
 * The aliases accept the field names the platform ingestion layer uses
 * ({@code stub_ts}, {@code channel_type}, {@code response_url}, ...).
 * Required fields are checked by {@link com.whereq.courier.queue.JobValidator} on enqueue and dispatch.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Job {
    /**
     * The question asked by the user
     */
    private String questionText;

    /**
     * Conversation to deliver the answer to
     */
    @JsonAlias("channel")
    private String channelId;

    /**
     * Slash-command response URL, used when no bot token is configured
     */
    @JsonAlias("response_url")
    private String responseUrl;

    /**
     * Thread the answer belongs to
     */
    @JsonAlias({"threadTs", "thread_ts"})
    private String threadId;

    /**
     * Kind of conversation, governs threading
     */
    @JsonAlias("channel_type")
    private ChannelType channelType;

    /**
     * Already posted "thinking" message to edit in place
     */
    @JsonAlias({"stub_ts", "stubTs"})
    private String placeholderMessageId;

    /**
     * Platform event timestamp, basis of de-duplication
     */
    @JsonAlias({"eventTs", "event_ts"})
    private String eventId;

    /**
     * User who asked the question
     */
    private String userId;

    /**
     * Request incremental updates while the answer is generated
     */
    private boolean useStreaming;

    @JsonIgnore
    public boolean hasChannel() {
        return hasText(channelId);
    }

    @JsonIgnore
    public boolean hasResponseUrl() {
        return hasText(responseUrl);
    }

    @JsonIgnore
    public boolean hasPlaceholder() {
        return hasText(placeholderMessageId);
    }

    @JsonIgnore
    public boolean hasEventId() {
        return hasText(eventId);
    }

    /**
     * A job must name somewhere to deliver the answer
     */
    @JsonIgnore
    public boolean isDeliverable() {
        return hasChannel() || hasResponseUrl();
    }

    /**
     * Thread reference to attach to a new message, or null when the conversation is not threaded
     */
    @JsonIgnore
    public String replyThreadId() {
        if (!hasText(threadId)) {
            return null;
        }
        if (channelType != null && !channelType.supportsThreads()) {
            return null;
        }
        return threadId;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
