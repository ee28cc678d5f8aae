package io.validata.core.engine;

import io.validata.core.binding.RecordBinder;
import io.validata.core.config.ValidatorConfig;
import io.validata.core.error.RecordStructureException;
import io.validata.core.error.UniquenessCheckException;
import io.validata.core.model.Field;
import io.validata.core.model.FieldOutcome;
import io.validata.core.model.Record;
import io.validata.core.model.ValidationReport;
import io.validata.core.spi.ValidationListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveTask;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates records and aggregates one outcome per eligible field into a {@link ValidationReport}.
 *
 * <p>
 * Each record becomes a {@code RecordTask} that forks one {@code FieldTask} per eligible field
 * into a bounded {@link ForkJoinPool} and joins them all. Sub-records are validated by nested
 * {@code RecordTask}s in the same pool; work-stealing joins keep the thread count bounded at
 * every nesting level.
 *
 * <p>
 * Fields are isolated from each other. Any runtime fault while evaluating one field becomes that
 * field's {@code "validation fault: ..."} entry and siblings still complete. A
 * {@link UniquenessCheckException} is different: it is carried out of the field task and
 * re-thrown by {@link #validate} once every sibling has finished, so the caller can tell "store
 * unavailable" apart from "value taken".
 *
 * <p>
 * Thread-safe; one instance can serve concurrent callers. Closing it shuts the pool down.
 */
public final class RecordValidator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RecordValidator.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final ValidatorConfig config;
    private final ForkJoinPool pool;
    private final MessageSynthesizer synthesizer;
    private final FieldEvaluator evaluator;
    private final ValidationListener listener;

    /** Creates a validator with {@link ValidatorConfig#DEFAULT}. */
    public RecordValidator() {
        this(ValidatorConfig.DEFAULT);
    }

    public RecordValidator(ValidatorConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.pool = new ForkJoinPool(config.parallelism());
        this.synthesizer = new MessageSynthesizer(config.messageStore());
        this.evaluator = new FieldEvaluator(new TypeDispatcher());
        this.listener = config.listener();
    }

    /**
     * Validates a record.
     *
     * @return the report; empty if and only if every eligible field passed
     * @throws RecordStructureException  if {@code record} is null
     * @throws UniquenessCheckException if the uniqueness store could not answer
     */
    public ValidationReport validate(Record record) {
        if (record == null) {
            throw new RecordStructureException("record must not be null");
        }
        int fieldCount = record.eligibleFields().size();
        notifyValidationStarted(record, fieldCount);

        long startNanos = System.nanoTime();
        RecordResult result = pool.invoke(new RecordTask(record, 0));
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;

        if (result.dependencyFailure() != null) {
            UniquenessCheckException failure = result.dependencyFailure();
            LOG.warn(
                    "validation.dependency_failed record={} field={} duration_ms={} detail={}",
                    record.name(),
                    failure.fieldLabel(),
                    durationMs,
                    failure.getMessage());
            throw failure;
        }

        ValidationReport report = result.report();
        LOG.info(
                "validation.completed record={} fields={} violations={} duration_ms={}",
                record.name(),
                fieldCount,
                report.size(),
                durationMs);
        notifyValidationCompleted(record, fieldCount, report.size(), durationMs);
        return report;
    }

    /**
     * Binds an annotated object with {@link RecordBinder} and validates it.
     *
     * @throws RecordStructureException if {@code object} is not a record
     */
    public ValidationReport validateObject(Object object) {
        return validate(RecordBinder.bind(object));
    }

    public ValidatorConfig config() {
        return config;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("validator.shutdown_timeout seconds={}", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // --- Tasks ---

    /** Report of one record, or the first dependency failure among its fields. */
    private record RecordResult(ValidationReport report, UniquenessCheckException dependencyFailure) {}

    private record FieldResult(FieldOutcome outcome, UniquenessCheckException dependencyFailure) {}

    private ValidationReport validateSubRecord(Record record, int depth) {
        RecordResult result = new RecordTask(record, depth).invoke();
        if (result.dependencyFailure() != null) {
            throw result.dependencyFailure();
        }
        return result.report();
    }

    private final class RecordTask extends RecursiveTask<RecordResult> {

        private static final long serialVersionUID = 1L;

        private final transient Record record;
        private final int depth;

        RecordTask(Record record, int depth) {
            this.record = record;
            this.depth = depth;
        }

        @Override
        protected RecordResult compute() {
            List<FieldTask> tasks = new ArrayList<>();
            for (Field field : record.eligibleFields()) {
                tasks.add(new FieldTask(record, field, depth));
            }
            ForkJoinTask.invokeAll(tasks);

            List<FieldOutcome> outcomes = new ArrayList<>(tasks.size());
            UniquenessCheckException failure = null;
            for (FieldTask task : tasks) {
                FieldResult result = task.join();
                outcomes.add(result.outcome());
                if (failure == null && result.dependencyFailure() != null) {
                    failure = result.dependencyFailure();
                }
            }
            return new RecordResult(ValidationReport.of(outcomes), failure);
        }
    }

    private final class FieldTask extends RecursiveTask<FieldResult> {

        private static final long serialVersionUID = 1L;

        private final transient Record record;
        private final transient Field field;
        private final int depth;

        FieldTask(Record record, Field field, int depth) {
            this.record = record;
            this.field = field;
            this.depth = depth;
        }

        @Override
        protected FieldResult compute() {
            EvaluationContext context = new EvaluationContext(
                    config, synthesizer, record, field, depth, RecordValidator.this::validateSubRecord);
            try {
                FieldOutcome outcome = evaluator.evaluate(field, context);
                LOG.debug(
                        "field.evaluated record={} field={} depth={} outcome={}",
                        record.name(),
                        field.label(),
                        depth,
                        outcome.type());
                return new FieldResult(outcome, null);
            } catch (UniquenessCheckException e) {
                return new FieldResult(FieldOutcome.passed(field.label()), e);
            } catch (RuntimeException e) {
                String detail = e.getMessage() != null ? e.getMessage() : e.toString();
                LOG.warn("field.faulted record={} field={} depth={} detail={}", record.name(), field.label(), depth, detail);
                notifyFieldFaulted(record, field, detail);
                return new FieldResult(FieldOutcome.fault(field.label(), MessageSynthesizer.fault(detail)), null);
            }
        }
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never change a result.

    private void notifyValidationStarted(Record record, int fieldCount) {
        if (listener == null) return;
        try {
            listener.onValidationStarted(new ValidationListener.ValidationStartedEvent(record.name(), fieldCount));
        } catch (Exception e) {
            LOG.warn("ValidationListener.onValidationStarted failed", e);
        }
    }

    private void notifyValidationCompleted(Record record, int fieldCount, int violationCount, long durationMs) {
        if (listener == null) return;
        try {
            listener.onValidationCompleted(new ValidationListener.ValidationCompletedEvent(
                    record.name(), fieldCount, violationCount, durationMs));
        } catch (Exception e) {
            LOG.warn("ValidationListener.onValidationCompleted failed", e);
        }
    }

    private void notifyFieldFaulted(Record record, Field field, String detail) {
        if (listener == null) return;
        try {
            listener.onFieldFaulted(new ValidationListener.FieldFaultedEvent(record.name(), field.label(), detail));
        } catch (Exception e) {
            LOG.warn("ValidationListener.onFieldFaulted failed", e);
        }
    }
}
