package com.scoutintel.transferroom.service;

import com.scoutintel.transferroom.exception.UpsertException;
import com.scoutintel.transferroom.model.SyncRunStats;
import com.scoutintel.transferroom.model.UpsertOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.function.Function;

/**
 * Writes records in sub-batches, one transaction per sub-batch.
 *
 * Each record runs in a nested transaction (a savepoint), so a failing record is rolled
 * back on its own and counted, and the rest of the sub-batch still commits. Counters are
 * folded into the run totals only once the sub-batch has committed.
 */
@Component
@Slf4j
public class SubBatchWriter {

    private final TransactionTemplate batchTransaction;
    private final TransactionTemplate recordTransaction;

    public SubBatchWriter(PlatformTransactionManager transactionManager) {
        this.batchTransaction = new TransactionTemplate(transactionManager);
        this.recordTransaction = new TransactionTemplate(transactionManager);
        this.recordTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    /**
     * @param entity    label used in error samples and logs, e.g. "player"
     * @param items     records to write, in order
     * @param batchSize records per transaction
     * @param idOf      external id of a record, for error samples; must not throw
     * @param upsert    maps and writes one record
     * @param stats     run totals to fold each committed sub-batch into
     */
    public <T> void write(String entity,
                          List<T> items,
                          int batchSize,
                          Function<T, Object> idOf,
                          Function<T, UpsertOutcome> upsert,
                          SyncRunStats stats) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }

        for (int from = 0; from < items.size(); from += batchSize) {
            List<T> slice = items.subList(from, Math.min(from + batchSize, items.size()));

            SyncRunStats batch = batchTransaction.execute(status -> {
                SyncRunStats tally = new SyncRunStats();
                for (T item : slice) {
                    writeOne(entity, item, idOf, upsert, tally);
                }
                return tally;
            });

            if (batch != null) {
                stats.absorb(batch);
            }
            log.info("Progress: {}/{} {} records processed ({} failed so far)",
                    from + slice.size(), items.size(), entity, stats.getRecordsFailed());
        }
    }

    private <T> void writeOne(String entity,
                              T item,
                              Function<T, Object> idOf,
                              Function<T, UpsertOutcome> upsert,
                              SyncRunStats tally) {
        try {
            UpsertOutcome outcome = recordTransaction.execute(status -> upsert.apply(item));
            if (outcome != null) {
                tally.recordOutcome(outcome);
            }
        } catch (RuntimeException e) {
            String error = e instanceof UpsertException
                    ? e.getMessage()
                    : entity + " " + idOf.apply(item) + ": " + e.getMessage();
            log.error("Error upserting {}", error);
            tally.recordFailure(error);
        }
    }
}
