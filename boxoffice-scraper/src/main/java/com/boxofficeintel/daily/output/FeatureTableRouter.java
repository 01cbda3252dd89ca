package com.boxofficeintel.daily.output;

import com.boxofficeintel.daily.config.BoxOfficeProperties;
import com.boxofficeintel.daily.model.FeatureVector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes the feature table to the configured sink(s).
 * Supports DATABASE, CSV, or BOTH modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FeatureTableRouter {

    private final FeatureTableWriter tableWriter;
    private final FeatureCsvWriter csvWriter;
    private final BoxOfficeProperties properties;

    public void write(List<FeatureVector> vectors) {
        BoxOfficeProperties.Output.OutputMode mode = properties.getOutput().getMode();
        log.debug("Writing {} feature rows in {} mode", vectors.size(), mode);

        switch (mode) {
            case DATABASE -> tableWriter.replaceAll(vectors);
            case CSV -> csvWriter.write(vectors);
            case BOTH -> {
                tableWriter.replaceAll(vectors);
                csvWriter.write(vectors);
            }
        }
    }
}
