package com.docgate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Micrometer instrumentation for gateway operations.
 * <p>
 * Every operation is timed under {@value #OPERATIONS_TIMER}, tagged with the collection, the
 * operation and its outcome. Failures additionally increment {@value #FAILURES_COUNTER}. The
 * outcome of a failure is produced by a classifier so this module stays independent of the
 * gateway's error types.
 */
public final class OperationMetrics {

    public static final String OPERATIONS_TIMER = "docgate.operations";
    public static final String FAILURES_COUNTER = "docgate.operations.failed";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_COLLECTION = "collection";
    public static final String TAG_OPERATION = "operation";
    public static final String TAG_OUTCOME = "outcome";

    /** Outcome tag value for operations that returned normally. */
    public static final String OUTCOME_SUCCESS = "success";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Function<RuntimeException, String> failureClassifier;

    public OperationMetrics(MeterRegistry registry, String serviceName) {
        this(registry, serviceName, e -> "error");
    }

    /**
     * @param registry          meter registry to publish to
     * @param serviceName       value of the {@code service} tag on every meter
     * @param failureClassifier maps a thrown exception to its {@code outcome} tag value
     */
    public OperationMetrics(MeterRegistry registry, String serviceName,
                            Function<RuntimeException, String> failureClassifier) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        if (failureClassifier == null) {
            throw new IllegalArgumentException("failureClassifier must not be null");
        }
        this.registry = registry;
        this.serviceName = serviceName;
        this.failureClassifier = failureClassifier;
    }

    /**
     * Times {@code work}, recording its outcome. Exceptions are counted and rethrown unchanged.
     */
    public <T> T record(String collection, String operation, Supplier<T> work) {
        Timer.Sample sample = Timer.start(registry);
        try {
            T result = work.get();
            sample.stop(timer(collection, operation, OUTCOME_SUCCESS));
            return result;
        } catch (RuntimeException e) {
            String outcome = failureClassifier.apply(e);
            sample.stop(timer(collection, operation, outcome));
            failures(collection, operation, outcome).increment();
            throw e;
        }
    }

    /**
     * Timer for one collection, operation and outcome.
     */
    public Timer timer(String collection, String operation, String outcome) {
        return Timer.builder(OPERATIONS_TIMER)
                .description("Duration of virtual table operations")
                .tags(tags(collection, operation, outcome))
                .register(registry);
    }

    /**
     * Failure counter for one collection, operation and outcome.
     */
    public Counter failures(String collection, String operation, String outcome) {
        return Counter.builder(FAILURES_COUNTER)
                .description("Virtual table operations that ended in an error")
                .tags(tags(collection, operation, outcome))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tags(String collection, String operation, String outcome) {
        return Tags.of(TAG_SERVICE, serviceName)
                .and(TAG_COLLECTION, collection)
                .and(TAG_OPERATION, operation)
                .and(TAG_OUTCOME, outcome);
    }
}
