package com.questrail.datagram.config;

import com.questrail.datagram.api.InvalidConfigException;

import java.time.Duration;

/**
 * WorkerPoolPolicy
 * -----------------------------------------------------------------------------
 * Concurrency and shutdown sizing for a datagram server.
 *
 * <p>Every value is finite. The queues are the server's only backpressure
 * mechanism, so they are always bounded. A violation is reported as an
 * {@link InvalidConfigException} for the {@code poolPolicy} field.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>requestWorkers</b>: threads running the request handler.</li>
 *   <li><b>responseWorkers</b>: threads running the response handler.</li>
 *   <li><b>requestQueueCapacity</b>: datagrams buffered between the reader and
 *       the request workers. When full, the reader blocks and further datagrams
 *       wait in (and may overflow) the kernel receive buffer.</li>
 *   <li><b>responseQueueCapacity</b>: replies buffered between the request and
 *       response workers. When full, request workers block before enqueueing.</li>
 *   <li><b>shutdownGracePeriod</b>: how long {@code stop()} lets queued and
 *       in-flight work finish before abandoning it.</li>
 *   <li><b>maxConsecutiveReadErrors</b>: consecutive failed reads after which
 *       the reader stops reading.</li>
 * </ul>
 */
public record WorkerPoolPolicy(
        int requestWorkers,
        int responseWorkers,
        int requestQueueCapacity,
        int responseQueueCapacity,
        Duration shutdownGracePeriod,
        int maxConsecutiveReadErrors
) {
    private static final String FIELD = "poolPolicy";

    /**
     * Canonical constructor with validation.
     *
     * @throws InvalidConfigException naming {@code poolPolicy} if any value is out of range
     */
    public WorkerPoolPolicy {
        requirePositive(requestWorkers, "requestWorkers");
        requirePositive(responseWorkers, "responseWorkers");
        requirePositive(requestQueueCapacity, "requestQueueCapacity");
        requirePositive(responseQueueCapacity, "responseQueueCapacity");
        if (shutdownGracePeriod == null) {
            throw new InvalidConfigException(FIELD, "shutdownGracePeriod must not be null");
        }
        if (shutdownGracePeriod.isNegative()) {
            throw new InvalidConfigException(FIELD, "shutdownGracePeriod must be non-negative");
        }
        requirePositive(maxConsecutiveReadErrors, "maxConsecutiveReadErrors");
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new InvalidConfigException(FIELD, name + " must be positive, was " + value);
        }
    }

    /**
     * Creates a policy with small, safe defaults.
     *
     * <p>Default values:</p>
     * <ul>
     *   <li>requestWorkers: 4</li>
     *   <li>responseWorkers: 2</li>
     *   <li>requestQueueCapacity: 64</li>
     *   <li>responseQueueCapacity: 64</li>
     *   <li>shutdownGracePeriod: 2s</li>
     *   <li>maxConsecutiveReadErrors: 10</li>
     * </ul>
     *
     * @return a policy with typical operational defaults
     */
    public static WorkerPoolPolicy defaults() {
        return new WorkerPoolPolicy(4, 2, 64, 64, Duration.ofSeconds(2), 10);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int requestWorkers = 4;
        private int responseWorkers = 2;
        private int requestQueueCapacity = 64;
        private int responseQueueCapacity = 64;
        private Duration shutdownGracePeriod = Duration.ofSeconds(2);
        private int maxConsecutiveReadErrors = 10;

        public Builder withRequestWorkers(int requestWorkers) {
            this.requestWorkers = requestWorkers;
            return this;
        }

        public Builder withResponseWorkers(int responseWorkers) {
            this.responseWorkers = responseWorkers;
            return this;
        }

        public Builder withRequestQueueCapacity(int capacity) {
            this.requestQueueCapacity = capacity;
            return this;
        }

        public Builder withResponseQueueCapacity(int capacity) {
            this.responseQueueCapacity = capacity;
            return this;
        }

        public Builder withShutdownGracePeriod(Duration gracePeriod) {
            this.shutdownGracePeriod = gracePeriod;
            return this;
        }

        public Builder withMaxConsecutiveReadErrors(int maxErrors) {
            this.maxConsecutiveReadErrors = maxErrors;
            return this;
        }

        public WorkerPoolPolicy build() {
            return new WorkerPoolPolicy(
                    requestWorkers,
                    responseWorkers,
                    requestQueueCapacity,
                    responseQueueCapacity,
                    shutdownGracePeriod,
                    maxConsecutiveReadErrors
            );
        }
    }
}
