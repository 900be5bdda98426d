package lovedata.menus.cleaning.service;

import lovedata.menus.cleaning.config.CleaningConfig;
import lovedata.menus.cleaning.exception.CleaningAbortedException;
import lovedata.menus.cleaning.exception.StructuralDefectException;
import lovedata.menus.cleaning.model.CleaningResult;
import lovedata.menus.cleaning.model.CleaningRun;
import lovedata.menus.cleaning.model.ExportFormat;
import lovedata.menus.cleaning.model.RawMenuRecord;
import lovedata.menus.cleaning.util.CorrelationIdUtil;
import lovedata.menus.cleaning.util.FileValidationUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.security.NoSuchAlgorithmException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cleans uploaded menu exports end to end: idempotency check, run tracking,
 * pipeline, persisted audit, COPY of the cleaned records.
 */
@Service
public class MenuCleaningService {

    private static final Logger logger = LoggerFactory.getLogger(MenuCleaningService.class);

    private final MenuCleaningPipeline pipeline;
    private final MenuCsvParsingService csvParsingService;
    private final FileChecksumService fileChecksumService;
    private final CleanedMenuCopyService copyService;
    private final CleaningRunService runService;
    private final CleaningConfig cleaningConfig;
    private final Clock clock;

    public MenuCleaningService(MenuCleaningPipeline pipeline,
                               MenuCsvParsingService csvParsingService,
                               FileChecksumService fileChecksumService,
                               CleanedMenuCopyService copyService,
                               CleaningRunService runService,
                               CleaningConfig cleaningConfig,
                               Clock clock) {
        this.pipeline = pipeline;
        this.csvParsingService = csvParsingService;
        this.fileChecksumService = fileChecksumService;
        this.copyService = copyService;
        this.runService = runService;
        this.cleaningConfig = cleaningConfig;
        this.clock = clock;
    }

    /**
     * Clean an uploaded CSV (plain, .gz or .zip) and load the result.
     *
     * A file whose checksum already has a COMPLETED run is not cleaned again;
     * a DUPLICATE run pointing at the earlier one is recorded instead.
     *
     * @throws IllegalArgumentException on an invalid upload
     * @throws StructuralDefectException if the data lacks required columns or has bad ids
     * @throws CleaningAbortedException if reading, cleaning or loading fails
     */
    public CleaningOutcome cleanUpload(MultipartFile file) {
        ExportFormat format = FileValidationUtil.validateMenuExport(file);
        String fileName = file.getOriginalFilename();
        String checksum = calculateChecksum(file);
        logger.info("Received {} menu export {} ({} bytes, checksum {})", format, fileName, file.getSize(), checksum);

        if (cleaningConfig.getTarget().isEnableIdempotency()) {
            CleaningRun existing = runService.findCompletedByChecksum(checksum);
            if (existing != null) {
                logger.info("DUPLICATE UPLOAD: File {} with checksum {} was already cleaned in run {}",
                        fileName, checksum, existing.getRunId());
                CleaningRun duplicate = new CleaningRun(fileName, file.getSize(), checksum);
                duplicate.setCorrelationId(CorrelationIdUtil.getCurrentCorrelationId());
                duplicate.markAsDuplicateOf(existing);
                return CleaningOutcome.duplicate(runService.save(duplicate));
            }
        }

        String tableName = cleaningConfig.getTarget().getTable();
        CleaningRun run = new CleaningRun(fileName, file.getSize(), checksum);
        run.setTargetTable(tableName);
        run.setRunDate(LocalDate.now(clock));
        run.setCorrelationId(CorrelationIdUtil.getCurrentCorrelationId());
        run.markAsProcessing();
        run = runService.save(run);

        try {
            List<RawMenuRecord> records = csvParsingService.readRecords(file);
            run.setInputRecords((long) records.size());

            CleaningResult result = pipeline.clean(records, run.getRunDate());

            // audit first: once COPY has committed, only the status update is left
            runService.saveAuditReport(run.getRunId(), result.getAuditReport());
            long loaded = copyService.executeCopy(run.getRunId(), result.getRecords(), tableName);

            run.applySummary(result.getSummary());
            run.setLoadedRecords(loaded);
            run.markAsCompleted();
            run = runService.update(run);

            logger.info("Run {} completed: {} records cleaned, {} loaded into {} in {}ms",
                    run.getRunId(), result.getRecordCount(), loaded, tableName, run.getProcessingDurationMs());
            return CleaningOutcome.completed(run, result);

        } catch (StructuralDefectException | IllegalArgumentException e) {
            logger.error("Run {} rejected: {}", run.getRunId(), e.getMessage());
            markFailed(run, e);
            throw e;
        } catch (IOException | SQLException | CleaningAbortedException e) {
            logger.error("Run {} failed for file {}", run.getRunId(), fileName, e);
            markFailed(run, e);
            throw new CleaningAbortedException("Failed to clean file " + fileName + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            logger.error("Run {} failed unexpectedly for file {}", run.getRunId(), fileName, e);
            markFailed(run, e);
            throw e;
        }
    }

    /**
     * Clean records posted as JSON without persisting anything.
     * Non-string values (numbers, booleans) are read as their text form.
     */
    public CleaningResult preview(List<Map<String, Object>> rawRecords) {
        if (rawRecords == null) {
            throw new IllegalArgumentException("Request body must be a JSON array of records");
        }
        List<RawMenuRecord> records = new ArrayList<>(rawRecords.size());
        for (Map<String, Object> raw : rawRecords) {
            if (raw == null) {
                throw new IllegalArgumentException("Record list contains a null record");
            }
            Map<String, String> fields = new LinkedHashMap<>();
            raw.forEach((key, value) -> fields.put(key, value == null ? null : value.toString()));
            records.add(RawMenuRecord.of(fields));
        }
        logger.info("Previewing cleaning of {} records", records.size());
        return pipeline.clean(records);
    }

    private String calculateChecksum(MultipartFile file) {
        try {
            return fileChecksumService.calculateFileChecksum(file);
        } catch (IOException e) {
            throw new IllegalArgumentException("Could not read uploaded file: " + e.getMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private void markFailed(CleaningRun run, Exception cause) {
        run.markAsFailed(cause.getMessage());
        try {
            runService.update(run);
        } catch (RuntimeException updateError) {
            logger.error("Failed to record failure of run {}: {}", run.getRunId(), updateError.getMessage(), updateError);
        }
    }

    /**
     * Run record plus, for a run that actually cleaned, its result.
     */
    public static final class CleaningOutcome {

        private final CleaningRun run;
        private final CleaningResult result;

        private CleaningOutcome(CleaningRun run, CleaningResult result) {
            this.run = run;
            this.result = result;
        }

        public static CleaningOutcome completed(CleaningRun run, CleaningResult result) {
            return new CleaningOutcome(run, result);
        }

        public static CleaningOutcome duplicate(CleaningRun run) {
            return new CleaningOutcome(run, null);
        }

        public CleaningRun getRun() {
            return run;
        }

        public CleaningResult getResult() {
            return result;
        }

        public boolean isDuplicate() {
            return result == null;
        }
    }
}
