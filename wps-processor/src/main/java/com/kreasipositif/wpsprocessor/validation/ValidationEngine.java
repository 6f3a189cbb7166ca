package com.kreasipositif.wpsprocessor.validation;

import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.domain.WpsLine;
import com.kreasipositif.wpsprocessor.exception.WpsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Evaluates validation rules against a batch.
 *
 * <h3>Execution</h3>
 * <ol>
 *   <li>Rules are snapshotted, filtered to active ones and ordered by (sequence, code).</li>
 *   <li>FILE rules run sequentially against the batch header; each contributes a result line
 *       whether it passes or fails.</li>
 *   <li>Per-line rules run concurrently: the lines are split into at most {@code parallelism}
 *       contiguous slices, each evaluated on the task executor. Only failures are recorded.
 *       Slices are merged back in line order, so the result does not depend on scheduling.</li>
 * </ol>
 *
 * <p>A check that throws is recorded as a failure carrying the rule's configured severity and
 * message, with the exception text kept as the line's detail.
 */
@Slf4j
public class ValidationEngine {

    private static final Comparator<ValidationRule> ORDER =
            Comparator.comparingInt(ValidationRule::getSequence).thenComparing(ValidationRule::getCode);

    private final TaskExecutor executor;
    private final int parallelism;

    public ValidationEngine(TaskExecutor executor, int parallelism) {
        this.executor = executor;
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * Evaluates {@code rules} using the batch's current lines and no peer batches.
     */
    public ValidationResult evaluate(WpsBatch batch, List<ValidationRule> rules, ReferenceData referenceData) {
        return evaluate(batch, rules, new RuleContext(batch.getLines(), List.of(), referenceData, null));
    }

    /**
     * @param context must carry the line snapshot to evaluate; {@code context.lines()} is what gets checked
     */
    public ValidationResult evaluate(WpsBatch batch, List<ValidationRule> rules, RuleContext context) {
        List<ValidationRule> snapshot = rules.stream()
                .filter(ValidationRule::isActive)
                .sorted(ORDER)
                .toList();
        List<ValidationRule> fileRules = snapshot.stream().filter(r -> !r.getScope().isPerLine()).toList();
        List<ValidationRule> lineRules = snapshot.stream().filter(r -> r.getScope().isPerLine()).toList();
        List<WpsLine> lines = context.lines();

        List<ValidationResultLine> results = new ArrayList<>();

        // ── File-level rules ─────────────────────────────────────────────────
        RuleTarget header = RuleTarget.file(batch);
        for (ValidationRule rule : fileRules) {
            results.add(run(rule, header, context));
        }

        // ── Line-level rules (parallel slices, merged in order) ─────────────
        if (!lineRules.isEmpty() && !lines.isEmpty()) {
            int sliceSize = (lines.size() + parallelism - 1) / parallelism;
            List<CompletableFuture<List<ValidationResultLine>>> slices = new ArrayList<>();
            for (int from = 0; from < lines.size(); from += sliceSize) {
                int start = from;
                int end = Math.min(lines.size(), from + sliceSize);
                slices.add(CompletableFuture.supplyAsync(
                        () -> evaluateSlice(batch, lines, start, end, lineRules, context), executor));
            }
            for (CompletableFuture<List<ValidationResultLine>> slice : slices) {
                results.addAll(join(slice));
            }
        }

        int totalChecks = fileRules.size() + lineRules.size() * lines.size();
        ValidationResult result = ValidationResult.of(batch.getReference(), totalChecks, results);
        log.info("Validated batch {}: {} check(s), {} error(s), {} warning(s) → {}",
                batch.getReference(), totalChecks, result.failedErrorCount(), result.warningCount(), result.status());
        return result;
    }

    private List<ValidationResultLine> evaluateSlice(WpsBatch batch, List<WpsLine> lines, int start, int end,
                                                     List<ValidationRule> lineRules, RuleContext context) {
        List<ValidationResultLine> failures = new ArrayList<>();
        for (int i = start; i < end; i++) {
            RuleTarget target = RuleTarget.line(batch, lines.get(i), i);
            for (ValidationRule rule : lineRules) {
                ValidationResultLine outcome = run(rule, target, context);
                if (!outcome.passed()) {
                    failures.add(outcome);
                }
            }
        }
        return failures;
    }

    private ValidationResultLine run(ValidationRule rule, RuleTarget target, RuleContext context) {
        boolean passed;
        String detail = null;
        try {
            passed = rule.getCheck().test(target, context);
        } catch (RuntimeException e) {
            passed = false;
            detail = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.warn("Rule {} raised on record {} of batch {}: {}",
                    rule.getCode(), target.displayName(), target.batch().getReference(), detail);
        }
        if (!passed) {
            log.debug("Rule {} failed on {} ({})", rule.getCode(), target.displayName(), rule.getSeverity());
        }
        return new ValidationResultLine(
                rule.getCode(),
                rule.getName(),
                rule.getType(),
                rule.getScope(),
                rule.getFieldName(),
                passed,
                rule.getSeverity(),
                passed ? null : rule.getMessage(),
                passed ? null : rule.getHelpText(),
                target.lineIndex(),
                target.displayName(),
                detail);
    }

    private static List<ValidationResultLine> join(CompletableFuture<List<ValidationResultLine>> slice) {
        try {
            return slice.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new WpsException("Line validation failed", cause);
        }
    }
}
