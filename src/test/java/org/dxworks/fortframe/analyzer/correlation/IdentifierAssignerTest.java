package org.dxworks.fortframe.analyzer.correlation;

import org.dxworks.fortframe.Diagnostics;
import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.model.DerivedType;
import org.dxworks.fortframe.model.Function;
import org.dxworks.fortframe.model.Module;
import org.dxworks.fortframe.model.Project;
import org.junit.jupiter.api.Test;

import static org.dxworks.fortframe.TestUtils.correlateTexts;
import static org.dxworks.fortframe.TestUtils.lines;
import static org.dxworks.fortframe.TestUtils.loadSamples;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class IdentifierAssignerTest {

    @Test
    void normalizeSpellsOutSpecialCharacters() {
        assertEquals("operator(lt)", IdentifierAssigner.normalize("OPERATOR(<)"));
        assertEquals("operator(gt=)", IdentifierAssigner.normalize("operator(>=)"));
        assertEquals("operator(SLASH)", IdentifierAssigner.normalize("operator(/)"));
        assertEquals("operator(ASTERISK)", IdentifierAssigner.normalize("operator(*)"));
        assertEquals("__unnamed__", IdentifierAssigner.normalize(""));
    }

    @Test
    void pagesAndAnchors() {
        Project project = loadSamples(FortframeConfig.defaults(), "shapes.f90");
        Module shapes = project.findModule("shapes");
        Function newCircle = shapes.functions.get(0);
        DerivedType circle = shapes.types.get(1);

        assertEquals("sourcefile/shapes.f90.html", project.getFiles().get(0).getUrl());
        assertEquals("module/shapes.html", shapes.getUrl());
        assertEquals("proc/new_circle.html", newCircle.getUrl());
        assertEquals("proc/new_circle.html#variable-r", newCircle.args.get(0).getUrl());
        assertEquals("type/circle.html", circle.getUrl());
        assertEquals("type/circle.html#variable-radius", circle.variables.get(0).getUrl());
        assertEquals("type/circle.html#boundprocedure-area", circle.boundProcedures.get(0).getUrl());
    }

    @Test
    void repeatedNamesGetASuffix() {
        FortframeConfig config = FortframeConfig.defaults();
        Project project = correlateTexts(config, Diagnostics.of(config),
                "a.f90", lines("module a", "contains", "  subroutine run()", "  end subroutine run", "end module a"),
                "b.f90", lines("module b", "contains", "  subroutine run()", "  end subroutine run", "end module b"));

        assertEquals("proc/run.html", project.findModule("a").subroutines.get(0).getUrl());
        assertEquals("run~1", project.findModule("b").subroutines.get(0).getIdentifier());
        assertEquals("proc/run~1.html", project.findModule("b").subroutines.get(0).getUrl());
    }

    @Test
    void namespacesAreCountedSeparately() {
        FortframeConfig config = FortframeConfig.defaults();
        Project project = correlateTexts(config, Diagnostics.of(config),
                "run.f90", lines(
                        "module run",
                        "contains",
                        "  subroutine run()",
                        "  end subroutine run",
                        "end module run"));
        Module run = project.findModule("run");

        assertEquals("module/run.html", run.getUrl());
        assertEquals("proc/run.html", run.subroutines.get(0).getUrl());
    }

    @Test
    void externalModulesKeepTheirLink() {
        Project project = loadSamples(FortframeConfig.defaults(), "shapes.f90");

        assertEquals("iso_fortran_env", project.getExternalModules().get(0).getIdentifier());
    }
}
