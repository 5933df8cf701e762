package com.segments.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings under {@code app.reporting}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.reporting")
public class ReportingProperties {

    /** Table used when a request names none. */
    @NotBlank
    private String defaultTable = "user_cluster";

    /** JDBC fetch size for exports; {@code Integer.MIN_VALUE} makes MySQL stream rows. */
    private int exportFetchSize = Integer.MIN_VALUE;

    @Min(1)
    private int queryTimeoutSeconds = 10;

    @Valid
    private SchemaCache schemaCache = new SchemaCache();

    private List<String> corsAllowedOrigins = new ArrayList<>();

    @Data
    public static class SchemaCache {

        @Min(1)
        private int capacity = 10;

        @NotNull
        private Eviction eviction = Eviction.FIFO;
    }

    public enum Eviction {
        FIFO,
        LRU
    }
}
