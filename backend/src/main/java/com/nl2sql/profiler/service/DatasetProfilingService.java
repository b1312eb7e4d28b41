package com.nl2sql.profiler.service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.nl2sql.profiler.config.CoreConfig;
import com.nl2sql.profiler.dto.profile.ColumnProfile;
import com.nl2sql.profiler.dto.profile.ColumnQuality;
import com.nl2sql.profiler.dto.profile.DatasetProfile;
import com.nl2sql.profiler.dto.profile.QualityReport;
import com.nl2sql.profiler.dto.profile.SchemaDocument;
import com.nl2sql.profiler.dto.profile.SchemaDocument.SchemaColumn;
import com.nl2sql.profiler.exception.ColumnAnalysisException;
import com.nl2sql.profiler.exception.DatasetStoreException;
import com.nl2sql.profiler.exception.ProfilingCancelledException;
import com.nl2sql.profiler.exception.ProfilingException;
import com.nl2sql.profiler.model.Column;
import com.nl2sql.profiler.model.ColumnarTable;
import com.nl2sql.profiler.model.ProfilingStage;
import com.nl2sql.profiler.model.TypeInferenceWarning;
import com.nl2sql.profiler.service.enrichment.DatasetAnnotator;
import com.nl2sql.profiler.service.enrichment.MetadataEnricher;
import com.nl2sql.profiler.service.inference.TypeInferenceResult;
import com.nl2sql.profiler.service.inference.TypeOptimizer;
import com.nl2sql.profiler.service.loading.DatasetLoader;
import com.nl2sql.profiler.service.quality.CorrelationCalculator;
import com.nl2sql.profiler.service.quality.QualityAnalyzer;
import com.nl2sql.profiler.service.schema.SchemaSynthesizer;
import com.nl2sql.profiler.service.storage.BatchSizeCalculator;
import com.nl2sql.profiler.service.storage.IDatasetStore;
import com.nl2sql.profiler.service.storage.ProfileRegistry;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the profiling pipeline for one uploaded file: load, optimize every column, analyze every
 * column, synthesize the schema, annotate the profiles and optionally hand everything to the
 * dataset store.
 *
 * <p>Optimization and analysis fan out one task per column on the bounded column executor. Each
 * group is joined before the next stage starts and its results are merged by the coordinating
 * thread only.
 */
@Slf4j
@Service
public class DatasetProfilingService {

  private static final String MDC_RUN_ID = "runId";
  private static final String MDC_DATASET = "dataset";

  private final DatasetLoader datasetLoader;
  private final TypeOptimizer typeOptimizer;
  private final QualityAnalyzer qualityAnalyzer;
  private final CorrelationCalculator correlationCalculator;
  private final SchemaSynthesizer schemaSynthesizer;
  private final MetadataEnricher metadataEnricher;
  private final DatasetAnnotator datasetAnnotator;
  private final BatchSizeCalculator batchSizeCalculator;
  private final IDatasetStore datasetStore;
  private final ProfileRegistry profileRegistry;
  private final Executor columnExecutor;
  private final Executor runExecutor;

  public DatasetProfilingService(
      DatasetLoader datasetLoader,
      TypeOptimizer typeOptimizer,
      QualityAnalyzer qualityAnalyzer,
      CorrelationCalculator correlationCalculator,
      SchemaSynthesizer schemaSynthesizer,
      MetadataEnricher metadataEnricher,
      DatasetAnnotator datasetAnnotator,
      BatchSizeCalculator batchSizeCalculator,
      IDatasetStore datasetStore,
      ProfileRegistry profileRegistry,
      @Qualifier(CoreConfig.COLUMN_EXECUTOR) Executor columnExecutor,
      @Qualifier(CoreConfig.RUN_EXECUTOR) Executor runExecutor) {
    this.datasetLoader = datasetLoader;
    this.typeOptimizer = typeOptimizer;
    this.qualityAnalyzer = qualityAnalyzer;
    this.correlationCalculator = correlationCalculator;
    this.schemaSynthesizer = schemaSynthesizer;
    this.metadataEnricher = metadataEnricher;
    this.datasetAnnotator = datasetAnnotator;
    this.batchSizeCalculator = batchSizeCalculator;
    this.datasetStore = datasetStore;
    this.profileRegistry = profileRegistry;
    this.columnExecutor = columnExecutor;
    this.runExecutor = runExecutor;
  }

  public DatasetProfile profile(byte[] bytes, String fileName) {
    return profile(bytes, fileName, ProgressListener.NONE);
  }

  /** Profiles the file on the calling thread without persisting it. */
  public DatasetProfile profile(byte[] bytes, String fileName, ProgressListener listener) {
    return execute(newRun(fileName), bytes, listener, false);
  }

  /** Profiles the file on the calling thread and hands table and profiles to the store. */
  public DatasetProfile ingest(byte[] bytes, String fileName, ProgressListener listener) {
    return execute(newRun(fileName), bytes, listener, true);
  }

  /**
   * Starts a run on the run executor and returns immediately.
   *
   * @param persist whether to hand the result to the dataset store
   * @return a handle whose result completes with the profile or the run's terminal error
   */
  public ProfilingRun start(
      byte[] bytes, String fileName, ProgressListener listener, boolean persist) {
    ProfilingRun run = newRun(fileName);
    run.setResult(
        CompletableFuture.supplyAsync(() -> execute(run, bytes, listener, persist), runExecutor));
    return run;
  }

  private DatasetProfile execute(
      ProfilingRun run, byte[] bytes, ProgressListener listener, boolean persist) {
    MDC.put(MDC_RUN_ID, run.getRunId());
    MDC.put(MDC_DATASET, run.getFileName());
    long started = System.currentTimeMillis();
    try {
      DatasetProfile profile = pipeline(run, bytes, listener, persist);
      advance(run, listener, ProfilingStage.COMPLETE, 100, "Profiling complete");
      log.info(
          "Profiled {} into table {}: {} rows, {} columns in {} ms",
          run.getFileName(),
          profile.getTableName(),
          profile.getRowCount(),
          profile.getColumnCount(),
          System.currentTimeMillis() - started);
      return profile;
    } catch (ProfilingCancelledException e) {
      log.info("Profiling of {} cancelled during {}", run.getFileName(), e.getStage());
      fail(run, listener, e);
      throw e;
    } catch (ProfilingException e) {
      log.error(
          "Profiling of {} failed during {}: {}", run.getFileName(), e.getStage(), e.getMessage());
      fail(run, listener, e);
      throw e;
    } catch (RuntimeException e) {
      ProfilingException wrapped =
          new ProfilingException(
              run.getStage(), "Unexpected error while profiling: " + e.getMessage(), e);
      log.error("Profiling of {} failed during {}", run.getFileName(), run.getStage(), e);
      fail(run, listener, wrapped);
      throw wrapped;
    } finally {
      MDC.remove(MDC_RUN_ID);
      MDC.remove(MDC_DATASET);
    }
  }

  private DatasetProfile pipeline(
      ProfilingRun run, byte[] bytes, ProgressListener listener, boolean persist) {
    run.checkCancelled();
    advance(run, listener, ProfilingStage.LOADING, 10, "Loading and parsing " + run.getFileName());
    ColumnarTable table = datasetLoader.load(bytes, run.getFileName());
    run.checkCancelled();

    advance(
        run,
        listener,
        ProfilingStage.OPTIMIZING,
        30,
        "Optimizing types of " + table.getColumnCount() + " columns");
    List<TypeInferenceResult> inference =
        fanOut(run, ProfilingStage.OPTIMIZING, table.getColumns(), typeOptimizer::optimize);
    table.freeze();
    log.debug("Type optimization produced {} results", inference.size());
    run.checkCancelled();

    advance(run, listener, ProfilingStage.ANALYZING, 50, "Analyzing data quality");
    List<ColumnQuality> qualities =
        fanOut(run, ProfilingStage.ANALYZING, table.getColumns(), this::analyzeIsolated);
    Map<String, Map<String, Double>> correlations =
        correlationCalculator.correlate(
            table.getColumns().stream().filter(c -> c.getSemanticType().isNumeric()).toList());
    QualityReport qualityReport = qualityReport(table, qualities, correlations);
    run.checkCancelled();

    advance(run, listener, ProfilingStage.SYNTHESIZING, 70, "Generating table schema");
    SchemaDocument schema = schemaSynthesizer.synthesize(run.getFileName(), table);
    run.checkCancelled();

    advance(run, listener, ProfilingStage.ENRICHING, 85, "Generating column metadata");
    List<ColumnProfile> columns = columnProfiles(table, schema, qualities);
    int batchSize = batchSizeCalculator.batchSize(table);
    DatasetProfile profile =
        DatasetProfile.builder()
            .tableName(schema.getTableName())
            .sourceFileName(run.getFileName())
            .rowCount(table.getRowCount())
            .columnCount(table.getColumnCount())
            .columns(columns)
            .qualityReport(qualityReport)
            .schema(schema)
            .exampleQueries(datasetAnnotator.exampleQueries(schema.getTableName(), columns))
            .queryHints(datasetAnnotator.queryHints(columns))
            .schemaSummary(datasetAnnotator.schemaSummary(columns))
            .batchSize(batchSize)
            .profiledAt(LocalDateTime.now())
            .build();

    if (persist) {
      if (!run.beginPersisting()) {
        throw new ProfilingCancelledException(run.getStage());
      }
      advance(run, listener, ProfilingStage.STORING, 90, "Storing data and metadata");
      persist(schema, table, columns, batchSize);
    } else {
      run.checkCancelled();
    }
    profileRegistry.register(profile);
    return profile;
  }

  private <T> List<T> fanOut(
      ProfilingRun run, ProfilingStage stage, List<Column> columns, Function<Column, T> task) {
    List<CompletableFuture<T>> futures = new ArrayList<>(columns.size());
    for (Column column : columns) {
      CompletableFuture<T> future =
          CompletableFuture.supplyAsync(() -> task.apply(column), columnExecutor);
      run.track(future);
      futures.add(future);
    }
    if (run.isCancelled()) {
      futures.forEach(f -> f.cancel(true));
    }
    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    } catch (CancellationException | CompletionException e) {
      if (run.isCancelled()) {
        throw new ProfilingCancelledException(stage);
      }
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof ProfilingException) {
        throw (ProfilingException) cause;
      }
      throw new ProfilingException(
          stage, "Column task failed during " + stage + ": " + cause.getMessage(), cause);
    }
    List<T> results = new ArrayList<>(futures.size());
    for (CompletableFuture<T> future : futures) {
      results.add(future.join());
    }
    return results;
  }

  private ColumnQuality analyzeIsolated(Column column) {
    try {
      return qualityAnalyzer.analyze(column);
    } catch (ColumnAnalysisException e) {
      log.warn("Column '{}' degraded: {}", column.getName(), e.getMessage());
      return qualityAnalyzer.degraded(column, e);
    }
  }

  private QualityReport qualityReport(
      ColumnarTable table,
      List<ColumnQuality> qualities,
      Map<String, Map<String, Double>> correlations) {
    Map<String, ColumnQuality> columnStats = new LinkedHashMap<>();
    List<String> failedColumns = new ArrayList<>();
    Map<String, List<String>> warnings = new LinkedHashMap<>();
    List<Column> columns = table.getColumns();
    for (int i = 0; i < columns.size(); i++) {
      Column column = columns.get(i);
      ColumnQuality quality = qualities.get(i);
      columnStats.put(column.getName(), quality);
      if (quality.isFailed()) {
        failedColumns.add(column.getName());
      }
      if (!column.getWarnings().isEmpty()) {
        warnings.put(
            column.getName(),
            column.getWarnings().stream().map(TypeInferenceWarning::toString).toList());
      }
    }
    long estimatedSize =
        Math.round(batchSizeCalculator.estimateRowBytes(table) * table.getRowCount());
    return QualityReport.builder()
        .rowCount(table.getRowCount())
        .estimatedSizeBytes(estimatedSize)
        .columnStats(columnStats)
        .correlations(correlations)
        .failedColumns(List.copyOf(failedColumns))
        .warnings(warnings)
        .build();
  }

  private List<ColumnProfile> columnProfiles(
      ColumnarTable table, SchemaDocument schema, List<ColumnQuality> qualities) {
    List<Column> columns = table.getColumns();
    List<ColumnProfile> profiles = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      Column column = columns.get(i);
      SchemaColumn schemaColumn = schema.getColumns().get(i);
      ColumnQuality quality = qualities.get(i);
      ColumnProfile base =
          ColumnProfile.builder()
              .name(schemaColumn.getName())
              .originalName(column.getName())
              .semanticType(column.getSemanticType())
              .sqlType(schemaColumn.getSqlType())
              .storageWidth(column.getIntegerWidth())
              .nullable(schemaColumn.isNullable())
              .categorical(column.isCategorical())
              .uniqueCount(quality.getUniqueCount())
              .nullCount(quality.getNullCount())
              .numericStats(quality.getNumericStats())
              .sampleValues(quality.getSampleValues())
              .topValues(quality.getTopValues())
              .enumValues(quality.getEnumValues())
              .specialPattern(quality.getSpecialPattern())
              .analysisError(quality.getError())
              .build();
      profiles.add(metadataEnricher.enrich(base));
    }
    return List.copyOf(profiles);
  }

  private void persist(
      SchemaDocument schema, ColumnarTable table, List<ColumnProfile> columns, int batchSize) {
    try {
      datasetStore.replaceTable(schema, table, batchSize);
      datasetStore.replaceProfiles(schema.getTableName(), columns);
    } catch (RuntimeException e) {
      try {
        datasetStore.dropDataset(schema.getTableName());
      } catch (RuntimeException cleanup) {
        log.error(
            "Could not remove partial dataset {}: {}", schema.getTableName(), cleanup.getMessage());
      }
      if (e instanceof DatasetStoreException) {
        throw (DatasetStoreException) e;
      }
      throw new DatasetStoreException(
          "Failed to store dataset " + schema.getTableName() + ": " + e.getMessage(), e);
    }
  }

  private void advance(
      ProfilingRun run, ProgressListener listener, ProfilingStage stage, int percent, String msg) {
    run.setStage(stage);
    log.info("Stage {} ({}%): {}", stage, percent, msg);
    notify(listener, stage, percent, msg);
  }

  private void fail(ProfilingRun run, ProgressListener listener, ProfilingException error) {
    run.setStage(ProfilingStage.FAILED);
    notify(listener, ProfilingStage.FAILED, 100, error.getMessage());
  }

  private static void notify(
      ProgressListener listener, ProfilingStage stage, int percent, String message) {
    try {
      listener.onProgress(stage, percent, message);
    } catch (RuntimeException e) {
      log.warn("Progress listener failed at {}: {}", stage, e.getMessage());
    }
  }

  private static ProfilingRun newRun(String fileName) {
    return new ProfilingRun(UUID.randomUUID().toString(), fileName);
  }
}
