package com.nl2sql.profiler.config;

import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.nl2sql.profiler.exception.GlobalExceptionHandler;

import io.swagger.v3.core.converter.ModelConverters;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;

/**
 * OpenAPI document for the profiler. Error bodies of every endpoint share the {@code
 * ErrorResponse} schema registered here, so clients can read {@code stage} from failed uploads.
 */
@Configuration
public class OpenApiConfig {

  public static final String DATASETS_TAG = "Datasets";

  @Value("${springdoc.info.title:Dataset Profiler API}")
  private String title;

  @Value("${springdoc.info.version:0.1.0}")
  private String version;

  @Value("${springdoc.info.description:Profiles uploaded CSV, TSV and Excel files}")
  private String description;

  @Value("${server.port:8081}")
  private String serverPort;

  @Value("${app.upload.allowed-extensions:csv,tsv,txt,xlsx,xls}")
  private List<String> allowedExtensions;

  @Bean
  public OpenAPI profilerOpenAPI() {
    return new OpenAPI()
        .info(
            new Info()
                .title(title)
                .version(version)
                .description(description + ". Accepted extensions: " + allowedExtensions)
                .license(new License().name("Apache 2.0")))
        .servers(List.of(new Server().url("http://localhost:" + serverPort)))
        .tags(
            List.of(
                new Tag()
                    .name(DATASETS_TAG)
                    .description(
                        "Upload a file to profile it, then read or delete the registered"
                            + " dataset by its synthesized table name")))
        .components(new Components().schemas(errorSchemas()));
  }

  @SuppressWarnings("rawtypes")
  static Map<String, Schema> errorSchemas() {
    return ModelConverters.getInstance().read(GlobalExceptionHandler.ErrorResponse.class);
  }
}
