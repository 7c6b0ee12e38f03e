package org.dxworks.fortframe;

import org.dxworks.fortframe.analyzer.parser.ParseException;
import org.dxworks.fortframe.model.Project;
import org.dxworks.fortframe.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.dxworks.fortframe.TestUtils.loadSamples;
import static org.dxworks.fortframe.TestUtils.sample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProjectLoaderTest {

    @Test
    void parsedFilesKeepTheInputOrder() {
        FortframeConfig config = FortframeConfig.builder().workers(4).build();
        List<Path> paths = List.of(sample("lab.f90"), sample("constants.f90"), sample("physics.f90"),
                sample("shapes.f90"), sample("main.f90"));

        List<SourceFile> files = new ProjectLoader(config, Diagnostics.of(config)).parseAll(paths);

        List<String> names = new ArrayList<>();
        files.forEach(file -> names.add(file.getName()));
        assertEquals(List.of("lab.f90", "constants.f90", "physics.f90", "shapes.f90", "main.f90"), names);
    }

    @Test
    void failingFileIsReportedAndLeftOut() {
        FortframeConfig config = FortframeConfig.builder().workers(2).build();
        Diagnostics diagnostics = Diagnostics.of(config);
        ProjectLoader loader = new ProjectLoader(config, diagnostics);

        Project project = loader.load(List.of(sample("constants.f90"), sample("broken.f90"), sample("lab.f90")));

        assertEquals(2, project.getFiles().size());
        assertEquals(List.of(sample("broken.f90").toString()), project.getFailedFiles());
        Map<Path, String> failures = loader.getFailures();
        assertTrue(failures.get(sample("broken.f90")).contains("END statement does not match"));
        assertEquals(1, diagnostics.getErrors().size());
    }

    @Test
    void strictModeStopsAtTheFirstFailure() {
        FortframeConfig config = FortframeConfig.builder().strict(true).workers(1).build();

        assertThrows(ParseException.class, () -> loadSamples(config, "constants.f90", "broken.f90"));
    }

    @Test
    void unknownExtensionIsSkipped() {
        FortframeConfig config = TestUtils.warningConfig();
        Diagnostics diagnostics = Diagnostics.of(config);

        List<SourceFile> files = new ProjectLoader(config, diagnostics)
                .parseAll(List.of(sample("include/params.inc"), sample("constants.f90")));

        assertEquals(1, files.size());
        assertTrue(diagnostics.getWarnings().get(0).contains("not a recognised Fortran source extension"));
    }

    @Test
    void fixedFormFilesAreDetectedByExtension() {
        FortframeConfig config = FortframeConfig.defaults();

        Project project = loadSamples(config, "legacy.f");

        assertEquals("legacy", project.getProcedures().get(0).getLowerName());
        assertEquals("scale", project.getProcedures().get(0).calls.get(0).getName().toLowerCase());
    }

    @Test
    void emptyInputGivesAnEmptyProject() {
        FortframeConfig config = FortframeConfig.defaults();

        Project project = new ProjectLoader(config, Diagnostics.of(config)).load(List.of());

        assertTrue(project.getFiles().isEmpty());
        assertTrue(project.getModules().isEmpty());
    }
}
