package dev.devanks.energy.pipeline.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.pipeline.model.PipelineResult;
import dev.devanks.energy.pipeline.service.PipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

import static dev.devanks.energy.pipeline.model.PipelineResult.Status.FAILURE;

@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineFunction {

    static final String INPUT_LOCATION_KEY = "inputLocation";

    private final PipelineService pipelineService;

    /**
     * Main function bean: measurementPipeline. Invoked once per input snapshot.
     */
    @Bean
    public Function<HashMap<String, Object>, PipelineResult> measurementPipeline() {
        return payload -> {
            log.info("measurementPipeline function triggered with payload: {}", payload);

            if (payload == null || payload.isEmpty() || !payload.containsKey(INPUT_LOCATION_KEY)) {
                return runForConfiguredInput();
            }

            return runForGivenInput(payload);
        };
    }

    @VisibleForTesting
    PipelineResult runForConfiguredInput() {
        log.info("Default run: processing the configured input location.");
        try {
            return pipelineService.runPipeline().block();
        } catch (Exception e) {
            return failure(null, e);
        }
    }

    /**
     * Handles payload-driven runs: processes the snapshot named by 'inputLocation'.
     */
    @VisibleForTesting
    PipelineResult runForGivenInput(Map<String, Object> payload) {
        var value = payload.get(INPUT_LOCATION_KEY);
        if (!(value instanceof String location) || location.isBlank()) {
            log.error("Invalid '{}' in payload: {}", INPUT_LOCATION_KEY, payload);
            return PipelineResult.builder()
                    .status(FAILURE)
                    .message("Pipeline not started.")
                    .errorDetails("Invalid '" + INPUT_LOCATION_KEY + "' in payload. Expected a non-blank string.")
                    .build();
        }

        log.info("Payload-driven run: processing input {}.", location);
        try {
            return pipelineService.runPipeline(location).block();
        } catch (Exception e) {
            return failure(location, e);
        }
    }

    private PipelineResult failure(String location, Exception e) {
        log.error("Measurement pipeline run failed for input {}: {}", location, e.getMessage(), e);
        return PipelineResult.builder()
                .status(FAILURE)
                .message("Pipeline failed.")
                .inputLocation(location)
                .errorDetails(e.getMessage())
                .build();
    }
}
