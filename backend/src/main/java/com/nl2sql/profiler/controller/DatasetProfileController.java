package com.nl2sql.profiler.controller;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.nl2sql.profiler.config.OpenApiConfig;
import com.nl2sql.profiler.dto.profile.ColumnProfile;
import com.nl2sql.profiler.dto.profile.DatasetProfile;
import com.nl2sql.profiler.exception.ResourceNotFoundException;
import com.nl2sql.profiler.service.DatasetProfilingService;
import com.nl2sql.profiler.service.ProgressListener;
import com.nl2sql.profiler.service.enrichment.DatasetContextFormatter;
import com.nl2sql.profiler.service.loading.FileNames;
import com.nl2sql.profiler.service.storage.IDatasetStore;
import com.nl2sql.profiler.service.storage.ProfileRegistry;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = OpenApiConfig.DATASETS_TAG)
public class DatasetProfileController {

  private static final Pattern TABLE_NAME = Pattern.compile("[a-z_][a-z0-9_]*");

  @Value("${app.upload.max-file-size:10485760}")
  private long maxFileSize;

  @Value("${app.upload.allowed-extensions:csv,tsv,txt,xlsx,xls}")
  private Set<String> allowedExtensions;

  private final DatasetProfilingService profilingService;
  private final ProfileRegistry profileRegistry;
  private final IDatasetStore datasetStore;
  private final DatasetContextFormatter contextFormatter;

  @PostMapping(
      value = "/datasets/profile",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Profile uploaded file",
      description =
          "Infer column types, compute quality statistics, synthesize a SQL schema and annotate"
              + " the columns of an uploaded CSV, TSV, TXT or Excel file")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successful profiling",
            content = @Content(schema = @Schema(implementation = DatasetProfile.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid or unreadable file",
            content = @Content),
        @ApiResponse(
            responseCode = "422",
            description = "No valid table could be created",
            content = @Content),
        @ApiResponse(
            responseCode = "500",
            description = "Internal server error",
            content = @Content)
      })
  public ResponseEntity<DatasetProfile> profileFile(
      @Parameter(description = "File to profile", required = true) @RequestParam("file")
          MultipartFile file,
      @Parameter(description = "Store the rows and column profiles after profiling")
          @RequestParam(value = "persist", defaultValue = "false")
          boolean persist)
      throws IOException {
    validateFile(file);
    String fileName = file.getOriginalFilename();
    byte[] bytes = file.getBytes();

    ProgressListener listener =
        (stage, percent, message) -> log.debug("{} {}% {}", stage, percent, message);
    DatasetProfile profile =
        persist
            ? profilingService.ingest(bytes, fileName, listener)
            : profilingService.profile(bytes, fileName, listener);
    log.info("Profiled {} as table {} (persisted: {})", fileName, profile.getTableName(), persist);
    return ResponseEntity.ok(profile);
  }

  @GetMapping(value = "/datasets", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List profiled datasets")
  public ResponseEntity<List<String>> listDatasets() {
    return ResponseEntity.ok(profileRegistry.tableNames());
  }

  @GetMapping(value = "/datasets/{tableName}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get the profile of a dataset")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Profile found"),
        @ApiResponse(responseCode = "404", description = "Dataset not found", content = @Content)
      })
  public ResponseEntity<DatasetProfile> getProfile(
      @Parameter(description = "Synthesized table name", required = true) @PathVariable
          String tableName) {
    return ResponseEntity.ok(findProfile(tableName));
  }

  @GetMapping(value = "/datasets/{tableName}/context", produces = MediaType.TEXT_PLAIN_VALUE)
  @Operation(
      summary = "Get the query context of a dataset",
      description =
          "Plain-text description of the table used as context for natural-language queries")
  public ResponseEntity<String> getContext(@PathVariable String tableName) {
    return ResponseEntity.ok(contextFormatter.format(findProfile(tableName)));
  }

  @GetMapping(
      value = "/datasets/{tableName}/stored-columns",
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get the column profiles held by the dataset store")
  public ResponseEntity<List<ColumnProfile>> getStoredColumns(@PathVariable String tableName) {
    List<ColumnProfile> profiles = datasetStore.findProfiles(checkTableName(tableName));
    if (profiles.isEmpty()) {
      throw new ResourceNotFoundException("No stored profiles for table " + tableName);
    }
    return ResponseEntity.ok(profiles);
  }

  @DeleteMapping("/datasets/{tableName}")
  @Operation(summary = "Delete a dataset, its stored rows and its column profiles")
  public ResponseEntity<Void> deleteDataset(@PathVariable String tableName) {
    if (!profileRegistry.remove(checkTableName(tableName))) {
      throw new ResourceNotFoundException("Dataset not found: " + tableName);
    }
    datasetStore.dropDataset(tableName);
    log.info("Deleted dataset {}", tableName);
    return ResponseEntity.noContent().build();
  }

  private DatasetProfile findProfile(String tableName) {
    return profileRegistry
        .find(tableName)
        .orElseThrow(() -> new ResourceNotFoundException("Dataset not found: " + tableName));
  }

  private static String checkTableName(String tableName) {
    if (!TABLE_NAME.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }

    if (file.getSize() > maxFileSize) {
      throw new IllegalArgumentException(
          "File size exceeds maximum allowed size of " + maxFileSize + " bytes");
    }

    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isBlank()) {
      throw new IllegalArgumentException("File name is empty");
    }

    String extension = FileNames.extension(fileName);
    if (!allowedExtensions.contains(extension)) {
      throw new IllegalArgumentException(
          "File type not supported. Allowed types: " + allowedExtensions);
    }
  }
}
