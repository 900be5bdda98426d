package lovedata.menus.cleaning.service;

import lombok.extern.slf4j.Slf4j;
import lovedata.menus.cleaning.config.CleaningConfig;
import lovedata.menus.cleaning.exception.CleaningAbortedException;
import lovedata.menus.cleaning.exception.StructuralDefectException;
import lovedata.menus.cleaning.model.AuditReport;
import lovedata.menus.cleaning.model.CleanedMenuRecord;
import lovedata.menus.cleaning.model.CleaningResult;
import lovedata.menus.cleaning.model.FieldAudit;
import lovedata.menus.cleaning.model.MenuFields;
import lovedata.menus.cleaning.model.RawMenuRecord;
import lovedata.menus.cleaning.model.VenueCategory;
import lovedata.menus.cleaning.transformer.CallNumberTransformer;
import lovedata.menus.cleaning.transformer.ColumnTransformer;
import lovedata.menus.cleaning.transformer.FieldResult;
import lovedata.menus.cleaning.transformer.MenuTransformers;
import lovedata.menus.cleaning.transformer.NormalizationPrimitives;
import lovedata.menus.cleaning.util.CorrelationIdUtil;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs the cleaning pipeline over a raw record set.
 *
 * Stages, strictly in order:
 * 1. LOAD - validate structure (required columns, numeric unique ids); no record is touched
 * 2. TRANSFORM - every record through every column transformer, sharded over the cleaning executor
 * 3. EMIT - cleaned records in input order plus the merged audit report
 *
 * Content defects never stop a run; they are resolved per field and counted.
 * Structural defects abort before any record is transformed.
 */
@Service
@Slf4j
public class MenuCleaningPipeline {

    private final ColumnTransformerRegistry transformerRegistry;
    private final CleaningConfig cleaningConfig;
    private final Executor cleaningExecutor;
    private final Clock clock;

    public MenuCleaningPipeline(ColumnTransformerRegistry transformerRegistry,
                                CleaningConfig cleaningConfig,
                                @Qualifier("cleaningExecutor") Executor cleaningExecutor,
                                Clock clock) {
        this.transformerRegistry = transformerRegistry;
        this.cleaningConfig = cleaningConfig;
        this.cleaningExecutor = cleaningExecutor;
        this.clock = clock;
    }

    /**
     * Clean with today's date as the upper bound for menu dates.
     */
    public CleaningResult clean(List<RawMenuRecord> records) {
        return clean(records, LocalDate.now(clock));
    }

    /**
     * @param records raw records, never modified
     * @param runDate upper bound for menu dates
     * @return one cleaned record per input record, same order, plus audit
     * @throws StructuralDefectException if a required column is missing or ids are invalid/duplicated
     * @throws CleaningAbortedException if a worker shard fails
     */
    public CleaningResult clean(List<RawMenuRecord> records, LocalDate runDate) {
        if (records == null) {
            throw new IllegalArgumentException("Record list must not be null");
        }
        if (runDate == null) {
            throw new IllegalArgumentException("Run date must not be null");
        }
        if (records.isEmpty()) {
            log.info("No records to clean");
            return new CleaningResult(List.of(), new AuditReport(), runDate);
        }

        long startTime = System.currentTimeMillis();
        MenuTransformers transformers = transformerRegistry.getTransformers(runDate);

        // LOAD
        List<Integer> ids = validateStructure(records, transformers);
        log.info("Validated {} raw records, starting transformation (run date {})", records.size(), runDate);

        // TRANSFORM
        List<ShardResult> shardResults = transformShards(records, ids, transformers);

        // EMIT
        List<CleanedMenuRecord> cleaned = new ArrayList<>(records.size());
        AuditReport auditReport = new AuditReport();
        for (ShardResult shard : shardResults) {
            cleaned.addAll(shard.records);
            auditReport.merge(shard.auditReport);
        }
        logUnmappedValues(auditReport);

        CleaningResult result = new CleaningResult(cleaned, auditReport, runDate);
        log.info("Cleaned {} records in {} ms: {} missing names, {} missing dates",
                result.getRecordCount(), System.currentTimeMillis() - startTime,
                result.getSummary().getMissingNames(), result.getSummary().getMissingDates());
        return result;
    }

    /**
     * @return the parsed id of every record, in input order
     */
    List<Integer> validateStructure(List<RawMenuRecord> records, MenuTransformers transformers) {
        Set<String> required = new LinkedHashSet<>();
        required.add(MenuFields.ID);
        for (ColumnTransformer<?> transformer : transformers.all()) {
            required.addAll(transformer.getSourceFields());
        }

        Set<String> present = new HashSet<>();
        for (RawMenuRecord record : records) {
            if (record == null) {
                throw new StructuralDefectException("Record list contains a null record");
            }
            present.addAll(record.columnNames());
        }
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!present.contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new StructuralDefectException("Required source column(s) missing: " + missing);
        }

        List<Integer> ids = new ArrayList<>(records.size());
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < records.size(); i++) {
            String rawId = NormalizationPrimitives.blankToNull(records.get(i).get(MenuFields.ID));
            int id;
            try {
                id = Integer.parseInt(rawId);
            } catch (NumberFormatException e) {
                throw new StructuralDefectException(String.format(
                        "Record %d has an invalid id: '%s'", i + 1, rawId), e);
            }
            if (!seen.add(id)) {
                throw new StructuralDefectException("Duplicate id " + id + " at record " + (i + 1));
            }
            ids.add(id);
        }
        return ids;
    }

    private List<ShardResult> transformShards(List<RawMenuRecord> records, List<Integer> ids,
                                              MenuTransformers transformers) {
        CleaningConfig.Processing processing = cleaningConfig.getProcessing();
        int shardSize = Math.max(1, processing.getShardSize());

        if (!processing.isParallelEnabled() || records.size() <= shardSize) {
            return List.of(cleanShard(records, ids, transformers));
        }

        List<CompletableFuture<ShardResult>> futures = new ArrayList<>();
        for (int from = 0; from < records.size(); from += shardSize) {
            int to = Math.min(from + shardSize, records.size());
            List<RawMenuRecord> shardRecords = records.subList(from, to);
            List<Integer> shardIds = ids.subList(from, to);
            try {
                futures.add(CompletableFuture.supplyAsync(
                        CorrelationIdUtil.wrap(() -> cleanShard(shardRecords, shardIds, transformers)),
                        cleaningExecutor));
            } catch (RuntimeException e) {
                futures.forEach(future -> future.cancel(true));
                log.error("Could not submit cleaning shard {}, aborting run: {}", futures.size(), e.getMessage(), e);
                throw new CleaningAbortedException("Could not submit cleaning shard " + futures.size(), e);
            }
        }
        log.debug("Submitted {} shards of up to {} records", futures.size(), shardSize);

        List<ShardResult> results = new ArrayList<>(futures.size());
        for (int shard = 0; shard < futures.size(); shard++) {
            try {
                results.add(futures.get(shard).join());
            } catch (CompletionException e) {
                futures.forEach(future -> future.cancel(true));
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Cleaning shard {} failed, aborting run: {}", shard, cause.getMessage(), cause);
                throw new CleaningAbortedException("Cleaning shard " + shard + " failed: " + cause.getMessage(), cause);
            }
        }
        return results;
    }

    private ShardResult cleanShard(List<RawMenuRecord> records, List<Integer> ids, MenuTransformers transformers) {
        AuditReport auditReport = new AuditReport();
        List<CleanedMenuRecord> cleaned = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            cleaned.add(cleanRecord(records.get(i), ids.get(i), transformers, auditReport));
        }
        return new ShardResult(cleaned, auditReport);
    }

    private CleanedMenuRecord cleanRecord(RawMenuRecord raw, int id, MenuTransformers transformers,
                                          AuditReport auditReport) {
        String name = apply(transformers.getName(), raw, auditReport);
        LocalDate date = apply(transformers.getDate(), raw, auditReport);
        String place = apply(transformers.getPlace(), raw, auditReport);
        String event = apply(transformers.getEvent(), raw, auditReport);
        VenueCategory venue = apply(transformers.getVenue(), raw, auditReport);
        String occasion = apply(transformers.getOccasion(), raw, auditReport);
        String currency = apply(transformers.getCurrency(), raw, auditReport);
        String currencyCode = apply(transformers.getCurrencyCode(), raw, auditReport);
        CallNumberTransformer.CallNumberSplit callNumber = apply(transformers.getCallNumber(), raw, auditReport);
        Integer pageCount = apply(transformers.getPageCount(), raw, auditReport);
        Integer dishCount = apply(transformers.getDishCount(), raw, auditReport);

        return CleanedMenuRecord.builder()
                .id(id)
                .name(name)
                .date(date)
                .place(place)
                .event(event)
                .venue(venue)
                .occasion(occasion)
                .currency(currency)
                .currencyCode(currencyCode)
                .callNumberNormalized(callNumber.getNormalized())
                .wotm(callNumber.isWotm())
                .physicalDescription(raw.get(MenuFields.PHYSICAL_DESCRIPTION))
                .pageCount(pageCount)
                .dishCount(dishCount)
                .status(raw.get(MenuFields.STATUS))
                .notes(raw.get(MenuFields.NOTES))
                .build();
    }

    private static <T> T apply(ColumnTransformer<T> transformer, RawMenuRecord raw, AuditReport auditReport) {
        FieldResult<T> result = transformer.transform(raw);
        auditReport.record(transformer.getFieldName(), result);
        return result.getValue();
    }

    private void logUnmappedValues(AuditReport auditReport) {
        auditReport.getFields().forEach((field, audit) -> {
            for (var entry : audit.getUnmappedValues().entrySet()) {
                log.warn("Unmapped {} value: {} (count={})", field, entry.getKey(), entry.getValue());
            }
            logFieldAudit(field, audit);
        });
    }

    private void logFieldAudit(String field, FieldAudit audit) {
        log.debug("Field {}: total={}, nulled={}, fallback={}, changed={}",
                field, audit.getTotal(), audit.getNulled(), audit.getFallbackCount(), audit.getChanged());
    }

    private static final class ShardResult {

        private final List<CleanedMenuRecord> records;
        private final AuditReport auditReport;

        ShardResult(List<CleanedMenuRecord> records, AuditReport auditReport) {
            this.records = records;
            this.auditReport = auditReport;
        }
    }
}
