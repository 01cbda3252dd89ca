package com.boxofficeintel.daily.output;

import com.boxofficeintel.daily.config.BoxOfficeProperties;
import com.boxofficeintel.daily.model.FeatureVector;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes the feature table as CSV for the model-training side.
 *
 * Output path: {outputDir}/{fileName}, e.g. data/output/features.csv
 *
 * The file is written next to the target and then moved over it, so readers never see a
 * half-written table. Formatting is locale-independent; equal vectors give equal bytes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FeatureCsvWriter {

    private final BoxOfficeProperties properties;

    public Path write(List<FeatureVector> vectors) {
        BoxOfficeProperties.Output.Csv csv = properties.getOutput().getCsv();
        Path outputDir = Paths.get(csv.getOutputDir());
        ensureDirectory(outputDir);

        Path target = outputDir.resolve(csv.getFileName());
        Path temp = outputDir.resolve(csv.getFileName() + ".tmp");

        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(temp, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (csv.isIncludeHeader()) {
                writer.writeNext(header());
            }
            for (FeatureVector vector : vectors) {
                writer.writeNext(toRow(vector));
            }
        } catch (IOException e) {
            log.error("Failed to write feature CSV {}: {}", temp, e.getMessage(), e);
            throw new UncheckedIOException("Feature CSV write failed", e);
        }

        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot move " + temp + " to " + target, e);
        }
        log.info("Written {} feature rows to CSV: {}", vectors.size(), target);
        return target;
    }

    private String[] header() {
        return FeatureVector.builder().build().asColumnMap().keySet().toArray(new String[0]);
    }

    private String[] toRow(FeatureVector vector) {
        return vector.asColumnMap().values().stream()
                .map(this::str)
                .toArray(String[]::new);
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
