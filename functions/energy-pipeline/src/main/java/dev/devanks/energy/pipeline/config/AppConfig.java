package dev.devanks.energy.pipeline.config;

import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class AppConfig {

    /**
     * Reader for the delimited input. Rows come back as plain string arrays so the header
     * can be validated before any data row is touched.
     * <p>
     * Only the reader is exposed: a {@link CsvMapper} bean would replace Boot's JSON ObjectMapper.
     */
    @Bean
    public ObjectReader measurementCsvReader(PipelineProperties properties) {
        var input = properties.getInput();
        log.info("Initializing measurement CSV reader (delimiter '{}', quote '{}').",
                input.getDelimiter(), input.getQuoteChar());
        return csvRowReader(input.getDelimiter(), input.getQuoteChar());
    }

    public static ObjectReader csvRowReader(char delimiter, char quoteChar) {
        var mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.WRAP_AS_ARRAY)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
        var schema = CsvSchema.emptySchema()
                .withColumnSeparator(delimiter)
                .withQuoteChar(quoteChar);
        return mapper.readerFor(String[].class).with(schema);
    }
}
