package com.whereq.courier.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Courier.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "courier")
@Data
public class CourierProperties {

    private QueueConfig queue = new QueueConfig();

    private IdempotencyConfig idempotency = new IdempotencyConfig();

    private DeliveryConfig delivery = new DeliveryConfig();

    private SlackConfig slack = new SlackConfig();

    private GenerationConfig generation = new GenerationConfig();

    private StreamingConfig streaming = new StreamingConfig();

    private WorkerConfig worker = new WorkerConfig();

    private MessagesConfig messages = new MessagesConfig();

    @Data
    public static class QueueConfig {
        /**
         * Queue name. Lists are stored under queue:{name}:waiting, :processing and :dead.
         */
        private String name = "slack-message-queue";

        /**
         * Backing store for the queue lists.
         */
        private StoreType store = StoreType.REDIS;

        /**
         * Number of dead-letter entries included in diagnostics.
         */
        private int deadLetterSampleSize = 3;

        public String waitingKey() {
            return "queue:" + name + ":waiting";
        }

        public String processingKey() {
            return "queue:" + name + ":processing";
        }

        public String deadKey() {
            return "queue:" + name + ":dead";
        }
    }

    @Data
    public static class IdempotencyConfig {
        /**
         * Where processed job identities are remembered.
         * REDIS is shared by every running instance, MEMORY only by the current process.
         */
        private StoreType store = StoreType.REDIS;

        /**
         * How long a job identity suppresses duplicates.
         */
        private Duration retention = Duration.ofHours(1);

        /**
         * How often the in-memory guard evicts expired identities.
         */
        private Duration sweepInterval = Duration.ofMinutes(15);

        private String keyPrefix = "courier:processed:";
    }

    @Data
    public static class DeliveryConfig {
        /**
         * Total attempts per platform call when throttled.
         */
        private int maxAttempts = 3;

        /**
         * Wait after a throttling error. Slightly above the platform's one message
         * per second per channel limit.
         */
        private Duration throttleInterval = Duration.ofMillis(1100);

        private Duration requestTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class SlackConfig {
        private String baseUrl = "https://slack.com/api";

        /**
         * Bot token. Blank means direct delivery is not configured.
         */
        private String botToken;
    }

    @Data
    public static class GenerationConfig {
        private String baseUrl = "http://localhost:8090";

        /**
         * Upper bound for a blocking generation call.
         */
        private Duration timeout = Duration.ofSeconds(9);
    }

    @Data
    public static class StreamingConfig {
        /**
         * Deployment switch; jobs asking for streaming are answered in one piece while disabled.
         */
        private boolean enabled = false;

        /**
         * Minimum gap between two in-place edits of the same message.
         */
        private Duration updateInterval = Duration.ofMillis(2000);

        /**
         * Minimum gap between the last edit and the final flush.
         */
        private Duration flushInterval = Duration.ofMillis(1000);

        /**
         * Wall-clock bound on one streamed answer; on expiry the content so far is delivered as incomplete.
         */
        private Duration timeout = Duration.ofSeconds(55);

        /**
         * Text of the "still working" placeholder; never pushed as content.
         */
        private String placeholderText = "Thinking...";
    }

    @Data
    public static class WorkerConfig {
        /**
         * Shared secret for diagnostics and queue administration. Blank denies all of them.
         */
        private String secretKey;

        /**
         * Worker URL triggered again while jobs remain in the queue. Blank disables chaining.
         */
        private String chainUrl;
    }

    @Data
    public static class MessagesConfig {
        private String warning = "⚠️ Sorry, I hit an error tracking down the docs. Please try again.";

        private String incompleteNotice = "\n\n(Note: This response may be incomplete due to a processing error.)";

        private String testQuestion = "Test message from the force-worker endpoint. "
            + "If you see this, the queue and worker are functioning correctly.";
    }

    public enum StoreType {
        /**
         * Shared Redis instance.
         */
        REDIS,

        /**
         * Process-local state, for local runs without Redis.
         */
        MEMORY
    }
}
