package com.nl2sql.profiler.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "profiler")
public class ProfilerProperties {

  @Valid private Loader loader = new Loader();
  @Valid private Inference inference = new Inference();
  @Valid private Quality quality = new Quality();
  @Valid private Schema schema = new Schema();
  @Valid private Batch batch = new Batch();
  @Valid private Executor executor = new Executor();
  @Valid private Storage storage = new Storage();

  @Data
  public static class Loader {
    /** Charsets tried in order with strict decoding before falling back to lossy UTF-8. */
    @NotEmpty
    private List<String> encodings =
        new ArrayList<>(List.of("UTF-8", "ISO-8859-1", "windows-1252", "UTF-16"));

    private List<String> nullTokens =
        new ArrayList<>(List.of("", "NA", "N/A", "NULL", "null", "NaN", "nan", "#N/A"));

    /** Inputs above this size are parsed in parallel partitions. */
    @Min(1)
    private long largeFileThresholdBytes = 500L * 1024 * 1024;

    /** Number of partitions for large inputs; 0 means one per available processor. */
    @Min(0)
    private int partitions = 0;
  }

  @Data
  public static class Inference {
    /** Fraction of non-null values that must parse as dates for a column to become DATE. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double temporalThreshold = 0.5;

    private String locale = "en-US";

    /** Categorical when distinct/rows is below this ratio. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double maxUniqueRatio = 0.05;

    /** Categorical when distinct count is below this value; 0 disables the absolute test. */
    @Min(0)
    private int maxUniqueCount = 0;
  }

  @Data
  public static class Quality {
    private double outlierZThreshold = 3.0;

    @Min(1)
    private int sampleValues = 5;

    @Min(1)
    private int topValues = 10;

    @Min(1)
    private int patternSampleSize = 1000;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double patternMatchThreshold = 0.8;

    @Valid private PatternCache patternCache = new PatternCache();
  }

  @Data
  public static class PatternCache {
    @Min(1)
    private long maxSize = 256;

    @Min(1)
    private long expireAfterAccessMinutes = 30;
  }

  @Data
  public static class Schema {
    @Min(8)
    private int maxTableNameLength = 55;
  }

  @Data
  public static class Batch {
    @Min(1)
    private int minRows = 1000;

    @Min(1)
    private int maxRows = 50_000;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double memoryFraction = 0.1;
  }

  @Data
  public static class Executor {
    @Min(1)
    private int threadsPerCore = 2;

    @Min(1)
    private int queueCapacity = 1000;

    @Min(1)
    private int runPoolSize = 2;
  }

  @Data
  public static class Storage {
    private String url =
        "jdbc:h2:mem:profiler;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE;"
            + "NON_KEYWORDS=VALUE,KEY,YEAR,MONTH,DAY,HOUR,MINUTE,SECOND";
    private String username = "sa";
    private String password = "";
  }
}
