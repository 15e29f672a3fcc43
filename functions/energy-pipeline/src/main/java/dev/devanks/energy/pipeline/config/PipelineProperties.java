package dev.devanks.energy.pipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    @Data
    @Validated
    public static class InputProperties {
        /**
         * Location of the measurement snapshot. Plain paths are resolved against the filesystem,
         * {@code file:} and {@code classpath:} prefixes are honoured.
         */
        @NotBlank
        private String location;

        private char delimiter = ';';

        private char quoteChar = '"';
    }

    @Data
    @Validated
    public static class OutputProperties {
        @NotBlank
        private String cleanedLocation;

        @NotBlank
        private String hourlyLocation;

        @NotBlank
        private String summaryLocation;

        private char delimiter = ',';
    }

    @NotNull
    @Valid
    private InputProperties input = new InputProperties();

    @NotNull
    @Valid
    private OutputProperties output = new OutputProperties();
}
