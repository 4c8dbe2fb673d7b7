package com.eainde.kyc.batch;

import com.eainde.kyc.exception.AuditPersistenceException;
import com.eainde.kyc.exception.RecordValidationException;
import com.eainde.kyc.model.VerificationResult;
import com.eainde.kyc.workflow.VerificationPipeline;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Verifies every row of a batch through the single-record pipeline.
 *
 * <p>Rows run concurrently on the batch executor. A failing row is reported in its own
 * outcome and never aborts the others; outcomes come back in input order.</p>
 */
@Slf4j
@Service
public class BatchVerificationService {

    static final String BATCH_ROW_MDC_KEY = "batchRow";

    private final VerificationPipeline pipeline;
    private final BatchCsvParser parser;
    private final Executor executor;

    public BatchVerificationService(VerificationPipeline pipeline,
                                    BatchCsvParser parser,
                                    @Qualifier("batchExecutor") Executor executor) {
        this.pipeline = pipeline;
        this.parser = parser;
        this.executor = executor;
    }

    public BatchSummary process(InputStream csv) {
        return process(parser.parse(csv));
    }

    public BatchSummary process(List<BatchRow> rows) {
        log.info("Starting batch of {} rows", rows.size());

        List<CompletableFuture<BatchRowOutcome>> futures = rows.stream()
                .map(row -> CompletableFuture
                        .supplyAsync(() -> verifyRow(row), executor)
                        .handle((outcome, error) -> error == null
                                ? outcome
                                : BatchRowOutcome.failure(row, describe(error))))
                .collect(Collectors.toList());

        List<BatchRowOutcome> outcomes = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());

        BatchSummary summary = BatchSummary.of(outcomes);
        log.info("Batch finished: {} rows, {} verified, {} failed",
                summary.total(), summary.successful(), summary.failed());
        return summary;
    }

    BatchRowOutcome verifyRow(BatchRow row) {
        MDC.put(BATCH_ROW_MDC_KEY, String.valueOf(row.rowIndex()));
        try {
            VerificationResult result = pipeline.verify(row.toRequest());
            return BatchRowOutcome.success(row, result);
        } catch (RecordValidationException e) {
            log.warn("Row {} rejected: {}", row.rowIndex(), e.getViolations());
            return BatchRowOutcome.failure(row, String.join("; ", e.getViolations()));
        } catch (AuditPersistenceException e) {
            log.error("Row {} scored but not logged", row.rowIndex(), e);
            return BatchRowOutcome.failure(row, "Audit log write failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Row {} failed", row.rowIndex(), e);
            return BatchRowOutcome.failure(row, describe(e));
        } finally {
            MDC.remove(BATCH_ROW_MDC_KEY);
        }
    }

    private static String describe(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null && cause instanceof CompletionException) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
