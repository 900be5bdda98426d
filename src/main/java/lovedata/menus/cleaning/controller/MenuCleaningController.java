package lovedata.menus.cleaning.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lovedata.menus.cleaning.dto.CleaningPreviewResponseDto;
import lovedata.menus.cleaning.dto.CleaningRunResponseDto;
import lovedata.menus.cleaning.dto.CleaningRunStatusDto;
import lovedata.menus.cleaning.dto.ErrorResponseDto;
import lovedata.menus.cleaning.dto.RunAuditDto;
import lovedata.menus.cleaning.exception.StructuralDefectException;
import lovedata.menus.cleaning.model.CleaningResult;
import lovedata.menus.cleaning.model.CleaningRun;
import lovedata.menus.cleaning.service.CleaningRunService;
import lovedata.menus.cleaning.service.MenuCleaningService;
import lovedata.menus.cleaning.service.MenuCleaningService.CleaningOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Controller for menu cleaning operations
 * Handles menu export uploads, dry-run previews and run/audit lookups
 */
@RestController
@RequestMapping("/api/v1/menus")
@CrossOrigin(origins = "*", maxAge = 3600)
@Tag(name = "Menu Cleaning", description = "Clean historical menu exports and inspect cleaning audits")
public class MenuCleaningController {

    private static final Logger logger = LoggerFactory.getLogger(MenuCleaningController.class);

    @Autowired
    private MenuCleaningService cleaningService;

    @Autowired
    private CleaningRunService runService;

    /**
     * Upload a menu export, clean it and load the cleaned rows
     */
    @PostMapping(value = "/clean", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
        summary = "Clean menu export",
        description = "Upload a menu CSV (optionally .gz or .zip), clean every column and load the result"
    )
    @ApiResponse(responseCode = "200", description = "File cleaned and loaded, or already cleaned earlier")
    @ApiResponse(responseCode = "400", description = "Invalid file or structurally defective data")
    @ApiResponse(responseCode = "500", description = "Processing error")
    public ResponseEntity<?> cleanUpload(
            @Parameter(
                description = "Menu CSV file to clean",
                required = true,
                content = @Content(mediaType = MediaType.MULTIPART_FORM_DATA_VALUE)
            )
            @RequestParam("file") MultipartFile file) {

        logger.info("Cleaning menu file: {}", file.getOriginalFilename());

        try {
            CleaningOutcome outcome = cleaningService.cleanUpload(file);
            return ResponseEntity.ok(CleaningRunResponseDto.from(outcome));

        } catch (IllegalArgumentException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Validation Error", e.getMessage()));

        } catch (StructuralDefectException e) {
            logger.warn("Structural defect: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Structural Defect", e.getMessage()));

        } catch (Exception e) {
            logger.error("Failed to clean menu file: {}", file.getOriginalFilename(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Failed to clean file: " + e.getMessage()));
        }
    }

    /**
     * Clean records posted as JSON and return them without loading
     */
    @PostMapping(value = "/clean/preview", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Preview cleaning",
        description = "Clean a JSON array of raw menu records and return cleaned records with their audit"
    )
    @ApiResponse(responseCode = "200", description = "Records cleaned")
    @ApiResponse(responseCode = "400", description = "Structurally defective records")
    public ResponseEntity<?> preview(@RequestBody List<Map<String, Object>> records) {
        logger.info("Preview request with {} records", records == null ? 0 : records.size());

        try {
            CleaningResult result = cleaningService.preview(records);
            return ResponseEntity.ok(CleaningPreviewResponseDto.from(result));

        } catch (IllegalArgumentException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Validation Error", e.getMessage()));

        } catch (StructuralDefectException e) {
            logger.warn("Structural defect: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Structural Defect", e.getMessage()));

        } catch (Exception e) {
            logger.error("Failed to preview cleaning", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Failed to clean records: " + e.getMessage()));
        }
    }

    /**
     * Get cleaning run status by run ID
     */
    @GetMapping("/runs/{runId}")
    @Operation(
        summary = "Get cleaning run status",
        description = "Retrieve status and data quality summary of a cleaning run"
    )
    @ApiResponse(responseCode = "200", description = "Status retrieved successfully")
    @ApiResponse(responseCode = "404", description = "Run ID not found")
    public ResponseEntity<CleaningRunStatusDto> getRunStatus(@PathVariable String runId) {
        logger.info("Retrieving cleaning run: {}", runId);

        try {
            CleaningRun run = runService.findByRunId(UUID.fromString(runId));
            if (run == null) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(new CleaningRunStatusDto(run));

        } catch (IllegalArgumentException e) {
            logger.warn("Invalid run ID format: {}", runId);
            return ResponseEntity.badRequest().build();

        } catch (Exception e) {
            logger.error("Failed to retrieve cleaning run: {}", runId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    /**
     * Get persisted audit of a cleaning run
     */
    @GetMapping("/runs/{runId}/audit")
    @Operation(
        summary = "Get cleaning audit",
        description = "Per-field counters and unmapped values recorded for a cleaning run"
    )
    @ApiResponse(responseCode = "200", description = "Audit retrieved successfully")
    @ApiResponse(responseCode = "404", description = "Run ID not found")
    public ResponseEntity<RunAuditDto> getRunAudit(@PathVariable String runId) {
        logger.info("Retrieving audit for cleaning run: {}", runId);

        try {
            UUID id = UUID.fromString(runId);
            if (runService.findByRunId(id) == null) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(RunAuditDto.of(id, runService.findFieldAudit(id), runService.findUnmappedValues(id)));

        } catch (IllegalArgumentException e) {
            logger.warn("Invalid run ID format: {}", runId);
            return ResponseEntity.badRequest().build();

        } catch (Exception e) {
            logger.error("Failed to retrieve audit for run: {}", runId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }
}
