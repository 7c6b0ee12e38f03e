package org.dxworks.fortframe.analyzer.correlation;

import org.dxworks.fortframe.Diagnostics;
import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.model.BlockData;
import org.dxworks.fortframe.model.BoundProcedure;
import org.dxworks.fortframe.model.CommonBlock;
import org.dxworks.fortframe.model.DerivedType;
import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.Function;
import org.dxworks.fortframe.model.Interface;
import org.dxworks.fortframe.model.Module;
import org.dxworks.fortframe.model.Namelist;
import org.dxworks.fortframe.model.Permission;
import org.dxworks.fortframe.model.Program;
import org.dxworks.fortframe.model.Project;
import org.dxworks.fortframe.model.Submodule;
import org.dxworks.fortframe.model.Subroutine;
import org.dxworks.fortframe.model.Variable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.dxworks.fortframe.TestUtils.correlateTexts;
import static org.dxworks.fortframe.TestUtils.lines;
import static org.dxworks.fortframe.TestUtils.loadSamples;
import static org.dxworks.fortframe.TestUtils.warningConfig;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CorrelatorTest {

    private static List<String> names(List<? extends Entity> entities) {
        List<String> names = new ArrayList<>();
        entities.forEach(entity -> names.add(entity.getName()));
        return names;
    }

    @Test
    void exportsOnlyPublicDeclarations() {
        Module shapes = loadSamples(FortframeConfig.defaults(), "shapes.f90").findModule("shapes");

        assertEquals(Set.of("new_circle", "area_of"), shapes.exports.procedures.keySet());
        assertEquals(Set.of("shape", "circle"), shapes.exports.types.keySet());
        assertTrue(shapes.exports.absInterfaces.isEmpty());
    }

    @Test
    void privateEntitiesArePrunedByDefault() {
        Module shapes = loadSamples(FortframeConfig.defaults(), "shapes.f90").findModule("shapes");

        assertEquals(List.of("new_circle", "area_of"), names(shapes.functions));
        assertTrue(shapes.subroutines.isEmpty());
        assertTrue(shapes.absInterfaces.isEmpty());
        assertEquals(List.of("label"), names(shapes.types.get(0).variables));
    }

    @Test
    void displayingPrivateEntitiesKeepsThem() {
        FortframeConfig config = FortframeConfig.builder()
                .display(EnumSet.of(Permission.PUBLIC, Permission.PRIVATE))
                .build();
        Module shapes = loadSamples(config, "shapes.f90").findModule("shapes");

        assertEquals(List.of("new_circle", "circle_area", "area_of"), names(shapes.functions));
        assertEquals(List.of("area_interface"), names(shapes.absInterfaces));
        assertEquals(List.of("label", "secret"), names(shapes.types.get(0).variables));
    }

    @Test
    void projectCollectsTypesAndInterfacesOfEveryUnit() {
        FortframeConfig config = FortframeConfig.builder()
                .display(EnumSet.of(Permission.PUBLIC, Permission.PRIVATE))
                .build();
        Project project = loadSamples(config, "shapes.f90", "solver.f90");

        assertEquals(List.of("shape", "circle"), names(project.getTypes()));
        assertEquals(List.of("area_interface"), names(project.getAbsInterfaces()));
        assertEquals(names(project.findModule("solver").interfaces), names(project.getInterfaces()));
        assertFalse(project.getInterfaces().isEmpty());
    }

    @Test
    void hidingUndocumentedEntities() {
        FortframeConfig config = FortframeConfig.builder().hideUndoc(true).build();
        Module shapes = loadSamples(config, "shapes.f90").findModule("shapes");

        assertEquals(List.of("new_circle"), names(shapes.functions));
        assertEquals(List.of("shape", "circle"), names(shapes.types));
        assertEquals(List.of("radius"), names(shapes.types.get(1).variables));
    }

    @Test
    void resolvesTypeBoundProcedures() {
        Module shapes = loadSamples(FortframeConfig.defaults(), "shapes.f90").findModule("shapes");
        DerivedType shape = shapes.types.get(0);
        BoundProcedure area = shape.boundProcedures.get(0);
        BoundProcedure describe = shape.boundProcedures.get(1);
        BoundProcedure info = shape.boundProcedures.get(2);

        Interface prototype = assertInstanceOf(Interface.class, area.prototype.get());
        assertEquals("area_interface", prototype.getName());
        assertEquals("shape_describe", describe.bindings.get(0).get().getName());
        assertSame(describe, info.bindings.get(0).get());
    }

    @Test
    void extendedTypesInheritComponentsAndBindings() {
        Module shapes = loadSamples(FortframeConfig.defaults(), "shapes.f90").findModule("shapes");
        DerivedType shape = shapes.types.get(0);
        DerivedType circle = shapes.types.get(1);

        assertSame(shape, circle.extendsType.get());
        assertEquals(List.of("label"), names(circle.inheritedVariables));
        assertEquals(List.of("describe"), names(circle.inheritedBoundProcedures));
        assertFalse(circle.extensionCycle);

        BoundProcedure inheritedInfo = circle.inheritedGenerics.get(0);
        assertEquals("info", inheritedInfo.getName());
        assertSame(circle, inheritedInfo.parent);
        assertSame(shape.boundProcedures.get(1), inheritedInfo.bindings.get(0).get());
        assertEquals("circle_area", circle.boundProcedures.get(0).bindings.get(0).get().getName());
    }

    @Test
    void procedureInternalsAreDroppedButArgumentsKept() {
        Project project = correlateTexts(FortframeConfig.defaults(), Diagnostics.of(FortframeConfig.defaults()),
                "m.f90", lines(
                        "module m",
                        "contains",
                        "  subroutine plain(a)",
                        "    integer :: a",
                        "    integer :: scratch",
                        "  end subroutine plain",
                        "  subroutine detailed(a)",
                        "    !! proc_internals: true",
                        "    !! Keeps its locals.",
                        "    integer :: a",
                        "    integer :: scratch",
                        "  end subroutine detailed",
                        "end module m"));
        Module m = project.findModule("m");
        Subroutine plain = m.subroutines.get(0);
        Subroutine detailed = m.subroutines.get(1);

        assertEquals(List.of("a"), names(plain.args));
        assertTrue(plain.variables.isEmpty());
        assertEquals(List.of("scratch"), names(detailed.variables));
        assertEquals("true", detailed.metadata.get("proc_internals"));
        assertEquals("Keeps its locals.", detailed.getDocumentation());
    }

    @Test
    void displayMetadataAppliesToChildren() {
        Project project = correlateTexts(FortframeConfig.defaults(), Diagnostics.of(FortframeConfig.defaults()),
                "m.f90", lines(
                        "module m",
                        "  !! display: public private",
                        "  private",
                        "  integer :: hidden",
                        "end module m"));

        assertEquals(List.of("hidden"), names(project.findModule("m").variables));
    }

    @Test
    void intrinsicModulesResolveToExternalLinks() {
        Project project = loadSamples(FortframeConfig.defaults(), "shapes.f90");
        Module used = project.findModule("shapes").uses.get(0).module.get();

        assertTrue(used.isExternal());
        assertEquals(List.of("iso_fortran_env"), names(project.getExternalModules()));
        assertEquals("http://fortranwiki.org/fortran/show/iso_fortran_env", project.getExternalModules().get(0).getUrl());
    }

    @Test
    void extraModulesComeFromTheConfiguration() {
        FortframeConfig config = FortframeConfig.builder()
                .extraModules(Map.of("netcdf", "https://example.org/netcdf/"))
                .build();
        Project project = correlateTexts(config, Diagnostics.of(config),
                "io.f90", lines("module io", "  use netcdf", "end module io"));

        assertEquals("https://example.org/netcdf/", project.getExternalModules().get(0).url);
        assertTrue(project.findModule("io").uses.get(0).module.isResolved());
    }

    @Test
    void unknownModuleIsReported() {
        Diagnostics diagnostics = Diagnostics.of(warningConfig());
        Project project = correlateTexts(warningConfig(), diagnostics,
                "io.f90", lines("module io", "  !! Input and output.", "  use nowhere", "end module io"));

        assertFalse(project.findModule("io").uses.get(0).module.isResolved());
        assertTrue(diagnostics.getWarnings().stream()
                .anyMatch(warning -> warning.contains("Could not identify module 'nowhere'")));
    }

    @Test
    void programSeesUsedModulesAndResolvesCalls() {
        Project project = loadSamples(FortframeConfig.defaults(), "main.f90", "shapes.f90");
        Module shapes = project.findModule("shapes");
        Program main = project.getPrograms().get(0);
        DerivedType shape = shapes.types.get(0);

        Variable c = main.variables.get(0);
        assertSame(shapes.types.get(1), c.prototype.get());

        Subroutine report = main.subroutines.get(0);
        assertSame(report, main.calls.get(0).target.get());
        BoundProcedure describe = assertInstanceOf(BoundProcedure.class, report.calls.get(0).target.get());
        assertSame(shape, describe.parent);
        assertTrue(shapes.usedBy.contains(main));
    }

    @Test
    void onlyListsAndRenamesAreReExported() {
        Project project = loadSamples(FortframeConfig.defaults(), "lab.f90", "physics.f90", "constants.f90");
        Module physics = project.findModule("physics");
        Module lab = project.findModule("lab");
        Module constants = project.findModule("constants");

        assertEquals(Set.of("pi", "euler"), physics.exports.variables.keySet());
        assertSame(constants.variables.get(1), physics.exports.variables.get("euler"));
        assertTrue(lab.visible.procedures.containsKey("circumference"));
        assertTrue(lab.visible.variables.containsKey("pi"));
        assertTrue(lab.visible.variables.containsKey("euler"));
        assertFalse(lab.visible.variables.containsKey("e"));
        assertFalse(constants.exports.variables.containsKey("counter"));
    }

    @Test
    void onlyListKeepsEveryLocalNameOfARenamedEntity() {
        FortframeConfig config = FortframeConfig.defaults();
        Project project = correlateTexts(config, Diagnostics.of(config),
                "m.f90", lines("module m", "  integer :: x", "end module m"),
                "user.f90", lines("module user", "  use m, only: x, y => x", "end module user"));
        Variable x = project.findModule("m").variables.get(0);
        Module user = project.findModule("user");

        assertSame(x, user.visible.variables.get("x"));
        assertSame(x, user.visible.variables.get("y"));
        assertEquals(Set.of("x", "y"), user.exports.variables.keySet());
    }

    @Test
    void renamesWithoutOnlyListHideTheRemoteName() {
        FortframeConfig config = FortframeConfig.defaults();
        Project project = correlateTexts(config, Diagnostics.of(config),
                "m.f90", lines("module m", "  integer :: x, w", "end module m"),
                "user.f90", lines("module user", "  use m, y => x, z => x", "end module user"));
        Module user = project.findModule("user");

        assertEquals(Set.of("y", "z", "w"), user.visible.variables.keySet());
        assertSame(user.visible.variables.get("y"), user.visible.variables.get("z"));
    }

    @Test
    void useWithoutOnlyListSeesWhatTheUsedModuleUses() {
        FortframeConfig config = FortframeConfig.defaults();
        Project project = correlateTexts(config, Diagnostics.of(config),
                "c.f90", lines("module c", "  use b", "end module c"),
                "b.f90", lines("module b", "  use a", "  integer :: beta", "end module b"),
                "a.f90", lines("module a", "  integer :: alpha", "end module a"));
        Module c = project.findModule("c");

        assertSame(project.findModule("a").variables.get(0), c.visible.variables.get("alpha"));
        assertSame(project.findModule("b").variables.get(0), c.visible.variables.get("beta"));
    }

    @Test
    void typesExtendThroughTwoModules() {
        FortframeConfig config = FortframeConfig.defaults();
        Project project = correlateTexts(config, Diagnostics.of(config),
                "c.f90", lines(
                        "module c",
                        "  use b",
                        "  type, extends(derived) :: leaf",
                        "    character(len=8) :: tag",
                        "  end type leaf",
                        "  type :: holder",
                        "    type(base) :: inner",
                        "  end type holder",
                        "end module c"),
                "b.f90", lines(
                        "module b",
                        "  use a",
                        "  type, extends(base) :: derived",
                        "    real :: weight",
                        "  end type derived",
                        "end module b"),
                "a.f90", lines(
                        "module a",
                        "  type :: base",
                        "    integer :: id",
                        "  contains",
                        "    procedure :: describe => base_describe",
                        "  end type base",
                        "contains",
                        "  subroutine base_describe(self)",
                        "    class(base), intent(in) :: self",
                        "  end subroutine base_describe",
                        "end module a"));
        DerivedType base = project.findModule("a").types.get(0);
        DerivedType derived = project.findModule("b").types.get(0);
        DerivedType leaf = project.findModule("c").types.get(0);
        DerivedType holder = project.findModule("c").types.get(1);

        assertSame(derived, leaf.extendsType.get());
        assertEquals(List.of(derived, base), leaf.ancestors());
        assertEquals(List.of("id", "weight"), names(leaf.inheritedVariables));
        assertEquals(List.of("describe"), names(leaf.inheritedBoundProcedures));
        assertEquals(List.of(holder), base.componentOf);
    }

    @Test
    void blockDataSharesCommonBlocksWithPrograms() {
        Diagnostics diagnostics = Diagnostics.of(warningConfig());
        Project project = correlateTexts(warningConfig(), diagnostics,
                "init.f90", lines(
                        "block data init",
                        "  use sizes",
                        "  integer :: counts(width)",
                        "  common /state/ counts, total",
                        "  data counts /1, 2, 3/",
                        "end block data init"),
                "sizes.f90", lines("module sizes", "  integer, parameter :: width = 3", "end module sizes"),
                "main.f90", lines(
                        "program main",
                        "  real :: scale",
                        "  common /State/ counts(3), total",
                        "  common scale",
                        "  namelist /run/ scale, total, missing",
                        "end program main"));
        BlockData init = project.getBlockData().get(0);
        Module sizes = project.findModule("sizes");
        Program main = project.getPrograms().get(0);

        assertEquals("blockdata/init.html", init.getUrl());
        assertSame(sizes, init.uses.get(0).module.get());
        assertTrue(sizes.usedBy.contains(init));
        assertEquals(List.of("state", ""), project.getCommonBlockNames());
        assertEquals(List.of(init.commonBlocks.get(0), main.commonBlocks.get(0)), project.getCommonBlocks("STATE"));
        assertEquals(List.of(main.commonBlocks.get(1)), project.getCommonBlocks(""));

        CommonBlock state = main.commonBlocks.get(0);
        assertEquals("program/main.html#common-state", state.getUrl());
        assertEquals("program/main.html#variable-counts", state.variables.get(0).getUrl());

        Namelist run = main.namelists.get(0);
        assertEquals("program/main.html#namelist-run", run.getUrl());
        assertSame(main.commonBlocks.get(1).variables.get(0), run.variables.get(0).get());
        assertSame(state.variables.get(1), run.variables.get(1).get());
        assertFalse(run.variables.get(2).isResolved());
        assertTrue(diagnostics.getWarnings().stream()
                .anyMatch(warning -> warning.contains("Could not find variable 'missing' of namelist 'run'")));
    }

    @Test
    void namelistOfAProcedureResolvesItsArguments() {
        String source = lines(
                "subroutine read_input(unit, dt)",
                "  integer, intent(in) :: unit",
                "  real :: dt",
                "  integer :: steps",
                "  common /io/ last_unit",
                "  namelist /params/ dt, steps",
                "end subroutine read_input");
        FortframeConfig config = FortframeConfig.builder().procInternals(true).build();
        Subroutine withInternals = (Subroutine) correlateTexts(config, Diagnostics.of(config), "io.f90", source)
                .getProcedures().get(0);
        Namelist params = withInternals.namelists.get(0);

        assertSame(withInternals.args.get(1), params.variables.get(0).get());
        assertSame(withInternals.variables.get(0), params.variables.get(1).get());
        assertEquals(1, withInternals.commonBlocks.size());

        Subroutine withoutInternals = (Subroutine) correlateTexts(FortframeConfig.defaults(),
                Diagnostics.of(FortframeConfig.defaults()), "io.f90", source).getProcedures().get(0);
        assertTrue(withoutInternals.namelists.isEmpty());
        assertTrue(withoutInternals.commonBlocks.isEmpty());
    }

    @Test
    void correlationFollowsModuleDependencies() {
        FortframeConfig config = FortframeConfig.defaults();
        Project forward = loadSamples(config, "constants.f90", "physics.f90", "lab.f90");
        Project backward = loadSamples(config, "lab.f90", "physics.f90", "constants.f90");

        assertEquals(forward.findModule("lab").visible.variables.keySet(),
                backward.findModule("lab").visible.variables.keySet());
    }

    @Test
    void moduleCycleFails() {
        FortframeConfig config = FortframeConfig.defaults();
        DependencyCycleException error = assertThrows(DependencyCycleException.class, () -> correlateTexts(config,
                Diagnostics.of(config),
                "a.f90", lines("module a", "  use b", "end module a"),
                "b.f90", lines("module b", "  use a", "end module b")));

        assertEquals(List.of("a", "b", "a"), error.getCycle());
    }

    @Test
    void duplicateProgramsFail() {
        FortframeConfig config = FortframeConfig.defaults();

        assertThrows(DuplicateProgramException.class, () -> correlateTexts(config, Diagnostics.of(config),
                "one.f90", lines("program p", "end program p"),
                "two.f90", lines("program P", "end program P")));
    }

    @Test
    void duplicateModuleKeepsTheFirst() {
        Diagnostics diagnostics = Diagnostics.of(warningConfig());
        Project project = correlateTexts(warningConfig(), diagnostics,
                "one.f90", lines("module m", "  integer :: first", "end module m"),
                "two.f90", lines("module m", "  integer :: second", "end module m"),
                "user.f90", lines("module user", "  use m", "end module user"));

        assertTrue(project.findModule("user").visible.variables.containsKey("first"));
        assertTrue(diagnostics.getWarnings().stream()
                .anyMatch(warning -> warning.contains("has the name of a module in one.f90")));
    }

    @Test
    void localDeclarationsShadowUsedOnes() {
        FortframeConfig config = FortframeConfig.defaults();
        Project project = correlateTexts(config, Diagnostics.of(config),
                "base.f90", lines("module base", "  integer :: n", "end module base"),
                "user.f90", lines("module user", "  use base", "  real :: n", "end module user"));

        Variable visible = (Variable) project.findModule("user").visible.variables.get("n");
        assertEquals("real", visible.vartype);
    }

    @Test
    void submodulesLinkSeparateProcedures() {
        Project project = loadSamples(FortframeConfig.defaults(), "solver_impl.f90", "solver.f90");
        Module solver = project.findModule("solver");
        Submodule impl = project.getSubmodules().get(0);
        Interface solve = solver.interfaces.get(0);
        Interface reset = solver.interfaces.get(1);

        assertSame(solver, impl.ancestorModule.get());
        assertEquals(List.of(impl), solver.descendants);

        Function implementation = impl.functions.get(0);
        assertSame(solve, implementation.separateInterface.get());
        assertSame(implementation, solve.implementation.get());
        assertSame(reset, impl.modProcedures.get(0).interfaceRef.get());
        assertSame(impl.modProcedures.get(0), reset.implementation.get());
        assertEquals(2, project.getSubmoduleProcedures().size());
    }

    @Test
    void missingSubmoduleAncestorIsReported() {
        Diagnostics diagnostics = Diagnostics.of(warningConfig());
        Project project = correlateTexts(warningConfig(), diagnostics,
                "orphan.f90", lines("submodule (gone) orphan", "end submodule orphan"));

        assertFalse(project.getSubmodules().get(0).ancestorModule.isResolved());
        assertTrue(diagnostics.getWarnings().stream()
                .anyMatch(warning -> warning.contains("Could not identify ancestor MODULE 'gone'")));
    }

    @Test
    void typeConstructorAndComponentOf() {
        FortframeConfig config = FortframeConfig.defaults();
        Project project = correlateTexts(config, Diagnostics.of(config), "geo.f90", lines(
                "module geo",
                "  type :: point",
                "    real :: x, y",
                "  end type point",
                "  type :: segment",
                "    type(point) :: a, b",
                "  end type segment",
                "  interface point",
                "    module procedure make_point",
                "  end interface point",
                "contains",
                "  function make_point(x, y) result(p)",
                "    real, intent(in) :: x, y",
                "    type(point) :: p",
                "  end function make_point",
                "end module geo"));
        Module geo = project.findModule("geo");
        DerivedType point = geo.types.get(0);
        DerivedType segment = geo.types.get(1);

        assertEquals(List.of(segment), point.componentOf);
        assertSame(geo.interfaces.get(0), point.constructor.get());
        assertEquals("make_point", geo.interfaces.get(0).moduleProcedures.get(0).procedure.get().getName());
    }

    @Test
    void unresolvedTypeIsKeptByName() {
        FortframeConfig config = FortframeConfig.defaults();
        Project project = correlateTexts(config, Diagnostics.of(config), "m.f90",
                lines("module m", "  type(mystery) :: thing", "end module m"));
        Variable thing = project.findModule("m").variables.get(0);

        assertFalse(thing.prototype.isResolved());
        assertEquals("type(mystery)", thing.fullType());
    }

    @Test
    void everyEntityHasAHandle() {
        Project project = loadSamples(FortframeConfig.defaults(), "shapes.f90", "main.f90");

        for (int handle = 0; handle < project.getEntityCount(); handle++) {
            assertEquals(handle, project.getEntity(handle).getHandle());
        }
        assertNull(project.findModule("nowhere"));
    }

    @Test
    void correlatedListsAreReadOnly() {
        Module shapes = loadSamples(FortframeConfig.defaults(), "shapes.f90").findModule("shapes");

        assertThrows(UnsupportedOperationException.class, () -> shapes.functions.clear());
    }
}
