package com.whereq.courier.worker;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * How a streamed answer ended
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StreamingOutcome {

    public enum Kind {
        /**
         * The stream completed and the final content was pushed
         */
        COMPLETED,

        /**
         * The stream failed after some content; that content was pushed with the incomplete notice
         */
        PARTIAL,

        /**
         * The stream failed before any content; only the warning was pushed
         */
        FAILED
    }

    private final Kind kind;

    /**
     * Cause of the failure, null when completed
     */
    private final String error;

    public static StreamingOutcome completed() {
        return new StreamingOutcome(Kind.COMPLETED, null);
    }

    public static StreamingOutcome partial(String error) {
        return new StreamingOutcome(Kind.PARTIAL, error);
    }

    public static StreamingOutcome failed(String error) {
        return new StreamingOutcome(Kind.FAILED, error);
    }
}
