package org.dxworks.fortframe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.dxworks.fortframe.TestUtils.SAMPLES;
import static org.dxworks.fortframe.TestUtils.sample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void collectsFortranSourcesInNameOrder() throws IOException {
        List<Path> files = App.collectSourceFiles(List.of(SAMPLES));

        List<String> names = new ArrayList<>();
        files.forEach(file -> names.add(file.getFileName().toString()));
        assertEquals(List.of("broken.f90", "constants.f90", "lab.f90", "legacy.f", "main.f90", "physics.f90",
                "shapes.f90", "solver.f90", "solver_impl.f90", "with_include.f90"), names);
    }

    @Test
    void writesRunUnitErrorAndDoneRecords() throws IOException {
        Path output = Files.createTempFile("fortframe", ".jsonl");
        try {
            FortframeConfig config = FortframeConfig.builder().workers(2).build();
            App.run(output, List.of(SAMPLES), config);

            List<JsonNode> records = new ArrayList<>();
            for (String line : Files.readAllLines(output, StandardCharsets.UTF_8)) {
                records.add(MAPPER.readTree(line));
            }
            assertEquals(12, records.size());

            JsonNode run = records.get(0);
            assertEquals("run", run.get("kind").asText());
            assertEquals(10, run.get("total_files").asInt());

            List<String> units = new ArrayList<>();
            for (JsonNode record : records.subList(1, 10)) {
                units.add(record.get("kind").asText() + " " + record.get("name").asText());
            }
            assertEquals(List.of("module constants", "module lab", "subroutine LEGACY", "program main",
                    "module physics", "module shapes", "module solver", "submodule solver_impl",
                    "module with_include"), units);

            JsonNode error = records.get(10);
            assertEquals("error", error.get("kind").asText());
            assertEquals(sample("broken.f90").toString(), error.get("file").asText());
            assertTrue(error.get("error").asText().contains("open_ended"));

            JsonNode done = records.get(11);
            assertEquals("done", done.get("kind").asText());
            assertEquals(9, done.get("files_analyzed").asInt());
            assertEquals(1, done.get("files_with_errors").asInt());
            assertEquals(9, done.get("units").asInt());
        } finally {
            Files.deleteIfExists(output);
        }
    }

    @Test
    void singleFileInput() throws IOException {
        Path output = Files.createTempFile("fortframe", ".jsonl");
        try {
            App.run(output, List.of(sample("constants.f90")), FortframeConfig.defaults());

            List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
            assertEquals(3, lines.size());
            JsonNode constants = MAPPER.readTree(lines.get(1));
            assertEquals("constants", constants.get("name").asText());
            assertEquals("pi", constants.get("exports").get(0).asText());
        } finally {
            Files.deleteIfExists(output);
        }
    }
}
