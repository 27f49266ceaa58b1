package org.carball.tempo.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.tempo.model.query.QuerySample;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads recorded query samples from a JSON export. Accepts either a bare array of samples or an
 * object with a {@code samples} array (plus any metadata, which is ignored).
 */
@Slf4j
public class SampleFileLoader {

    private final ObjectMapper objectMapper;

    public SampleFileLoader() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
    }

    public List<QuerySample> load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Sample file not found: " + path);
        }

        JsonNode root = objectMapper.readTree(Files.readString(path));
        JsonNode samples = root != null && root.isObject() ? root.get("samples") : root;
        if (samples == null || !samples.isArray()) {
            throw new IllegalStateException("Missing or invalid samples array in " + path);
        }

        List<QuerySample> results = new ArrayList<>(samples.size());
        int index = 0;
        for (JsonNode node : samples) {
            try {
                results.add(objectMapper.treeToValue(node, QuerySample.class));
            } catch (IOException e) {
                throw new IOException("Invalid sample at index " + index + " in " + path + ": " + e.getMessage(), e);
            }
            index++;
        }

        log.info("Loaded {} samples from {}", results.size(), path);
        return results;
    }
}
