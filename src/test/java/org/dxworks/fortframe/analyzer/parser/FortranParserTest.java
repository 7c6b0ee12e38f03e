package org.dxworks.fortframe.analyzer.parser;

import org.dxworks.fortframe.Diagnostics;
import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.ProjectLoader;
import org.dxworks.fortframe.SourceForm;
import org.dxworks.fortframe.model.BlockData;
import org.dxworks.fortframe.model.BoundProcedure;
import org.dxworks.fortframe.model.CallSite;
import org.dxworks.fortframe.model.CommonBlock;
import org.dxworks.fortframe.model.DerivedType;
import org.dxworks.fortframe.model.Enumeration;
import org.dxworks.fortframe.model.Function;
import org.dxworks.fortframe.model.Interface;
import org.dxworks.fortframe.model.Module;
import org.dxworks.fortframe.model.Permission;
import org.dxworks.fortframe.model.Program;
import org.dxworks.fortframe.model.SourceFile;
import org.dxworks.fortframe.model.Subroutine;
import org.dxworks.fortframe.model.Submodule;
import org.dxworks.fortframe.model.Variable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.fortframe.TestUtils.lines;
import static org.dxworks.fortframe.TestUtils.parseText;
import static org.dxworks.fortframe.TestUtils.sample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FortranParserTest {

    private static SourceFile parseSample(String name) {
        FortframeConfig config = FortframeConfig.defaults();
        return new ProjectLoader(config, Diagnostics.of(config)).parseFile(sample(name), SourceForm.FREE);
    }

    private static List<String> names(List<? extends org.dxworks.fortframe.model.Entity> entities) {
        List<String> names = new ArrayList<>();
        entities.forEach(entity -> names.add(entity.getName()));
        return names;
    }

    @Test
    void parsesModuleStructure() {
        SourceFile file = parseSample("shapes.f90");

        assertEquals(1, file.modules.size());
        Module shapes = file.modules.get(0);
        assertEquals("shapes", shapes.getName());
        assertEquals(Permission.PRIVATE, shapes.defaultAccess);
        assertEquals("Geometric shapes used by the examples.", shapes.getDocumentation());
        assertEquals("iso_fortran_env", shapes.uses.get(0).getModuleName());
        assertEquals(", only: real64", shapes.uses.get(0).clause);
        assertEquals(List.of("shape", "circle"), names(shapes.types));
        assertEquals(List.of("new_circle", "circle_area", "area_of"), names(shapes.functions));
        assertEquals(List.of("shape_describe"), names(shapes.subroutines));
        assertEquals(List.of("area_interface"), names(shapes.absInterfaces));
    }

    @Test
    void publicStatementOverridesModuleDefault() {
        Module shapes = parseSample("shapes.f90").modules.get(0);

        assertEquals(Permission.PUBLIC, shapes.types.get(0).permission);
        assertEquals(Permission.PUBLIC, shapes.functions.get(0).permission);
        assertEquals(Permission.PRIVATE, shapes.functions.get(1).permission);
        assertEquals(Permission.PRIVATE, shapes.subroutines.get(0).permission);
        assertEquals(Permission.PRIVATE, shapes.absInterfaces.get(0).permission);
        assertTrue(shapes.publicNames.contains("new_circle"));
    }

    @Test
    void parsesDerivedTypes() {
        Module shapes = parseSample("shapes.f90").modules.get(0);
        DerivedType shape = shapes.types.get(0);
        DerivedType circle = shapes.types.get(1);

        assertEquals(List.of("abstract"), shape.attributes);
        assertEquals("Base of every shape.", shape.getDocumentation());
        assertEquals(List.of("label", "secret"), names(shape.variables));
        assertEquals("32", shape.variables.get(0).strlen);
        assertEquals("'unnamed'", shape.variables.get(0).initial);
        assertEquals(Permission.PRIVATE, shape.variables.get(1).permission);

        assertEquals("shape", circle.extendsType.getName());
        Variable radius = circle.variables.get(0);
        assertEquals("real64", radius.kind);
        assertEquals("Radius in metres", radius.getDocumentation());
    }

    @Test
    void parsesTypeBoundProcedures() {
        DerivedType shape = parseSample("shapes.f90").modules.get(0).types.get(0);

        assertEquals(List.of("area", "describe", "info"), names(shape.boundProcedures));
        BoundProcedure area = shape.boundProcedures.get(0);
        assertTrue(area.deferred);
        assertEquals("area_interface", area.prototype.getName());
        assertTrue(area.bindings.isEmpty());

        BoundProcedure describe = shape.boundProcedures.get(1);
        assertFalse(describe.generic);
        assertEquals("shape_describe", describe.bindings.get(0).getName());

        BoundProcedure info = shape.boundProcedures.get(2);
        assertTrue(info.generic);
        assertEquals("describe", info.bindings.get(0).getName());
    }

    @Test
    void abstractInterfaceWrapsItsProcedure() {
        Interface areaInterface = parseSample("shapes.f90").modules.get(0).absInterfaces.get(0);

        assertTrue(areaInterface.isAbstract);
        assertFalse(areaInterface.generic);
        Function function = assertInstanceOf(Function.class, areaInterface.getProcedure());
        assertEquals(List.of("self"), names(function.args));
        assertEquals("a", function.result.getName());
        assertEquals("real64", function.result.kind);
    }

    @Test
    void matchesArgumentsAndResultToDeclarations() {
        Function newCircle = parseSample("shapes.f90").modules.get(0).functions.get(0);

        assertEquals("Builds a circle.", newCircle.getDocumentation());
        Variable r = (Variable) newCircle.args.get(0);
        assertEquals("in", r.intent);
        assertEquals("real(real64)", r.fullType());
        assertEquals("c", newCircle.result.getName());
        assertEquals("type(circle)", newCircle.result.fullType());
        assertTrue(newCircle.variables.isEmpty());
    }

    @Test
    void visibilityStatementsAndAttributes() {
        SourceFile file = parseText("m.f90", lines(
                "module m",
                "  private",
                "  integer :: hidden",
                "  integer, public :: shown",
                "  public :: exposed",
                "contains",
                "  subroutine exposed()",
                "  end subroutine exposed",
                "  subroutine internal()",
                "  end subroutine internal",
                "end module m"));
        Module module = file.modules.get(0);

        assertEquals(Permission.PRIVATE, module.variables.get(0).permission);
        assertEquals(Permission.PUBLIC, module.variables.get(1).permission);
        assertEquals(Permission.PUBLIC, module.subroutines.get(0).permission);
        assertEquals(Permission.PRIVATE, module.subroutines.get(1).permission);
        assertTrue(module.publicNames.contains("exposed"));
        assertTrue(module.publicNames.contains("shown"));
        assertFalse(module.publicNames.contains("hidden"));
    }

    @Test
    void inlineFunctionTypeAndLegacyImplicitArguments() {
        SourceFile file = parseText("add.f90", lines(
                "integer function add(a, b)",
                "  integer, intent(in) :: a",
                "  add = a + int(b)",
                "end function add"));
        Function add = file.functions.get(0);

        assertEquals("integer", add.result.vartype);
        assertEquals("add", add.result.getName());
        Variable a = (Variable) add.args.get(0);
        Variable b = (Variable) add.args.get(1);
        assertFalse(a.implicitlyTyped);
        assertTrue(b.implicitlyTyped);
        assertEquals("real", b.vartype);
        assertEquals("integer", ImplicitTyping.legacyImplicitType("n"));
    }

    @Test
    void dummyProcedureComesFromInterfaceBlock() {
        SourceFile file = parseText("apply.f90", lines(
                "subroutine apply(f, x)",
                "  interface",
                "    function f(y)",
                "      real :: f, y",
                "    end function f",
                "  end interface",
                "  real :: x",
                "end subroutine apply"));
        Subroutine apply = file.subroutines.get(0);

        Function f = assertInstanceOf(Function.class, apply.args.get(0));
        assertEquals(apply, f.parent);
        assertEquals("y", f.args.get(0).getName());
        assertInstanceOf(Variable.class, apply.args.get(1));
        assertTrue(apply.interfaces.isEmpty());
    }

    @Test
    void alternateReturnArgument() {
        Subroutine s = parseText("alt.f90", lines(
                "subroutine s(x, *)",
                "  real :: x",
                "end subroutine s")).subroutines.get(0);

        assertEquals("alternate return", ((Variable) s.args.get(1)).vartype);
    }

    @Test
    void genericInterfaceKeepsModuleProcedures() {
        Module ops = parseText("ops.f90", lines(
                "module ops",
                "  interface combine",
                "    module procedure combine_int, combine_real",
                "  end interface combine",
                "contains",
                "  function combine_int(a) result(r)",
                "    integer :: a, r",
                "  end function combine_int",
                "  function combine_real(a) result(r)",
                "    real :: a, r",
                "  end function combine_real",
                "end module ops")).modules.get(0);

        Interface combine = ops.interfaces.get(0);
        assertTrue(combine.generic);
        assertEquals(List.of("combine_int", "combine_real"), names(combine.moduleProcedures));
    }

    @Test
    void typeParametersAreMatchedToDeclarations() {
        DerivedType matrix = parseText("matrix.f90", lines(
                "module m",
                "  type :: matrix(k, n)",
                "    integer, kind :: k = 4",
                "    integer, len :: n",
                "    real(k) :: values(n, n)",
                "  end type matrix",
                "end module m")).modules.get(0).types.get(0);

        assertEquals(List.of("k", "n"), names(matrix.parameters));
        assertEquals(List.of("values"), names(matrix.variables));
        assertEquals("(n,n)", matrix.variables.get(0).dimension);
    }

    @Test
    void enumeratorsAreNumbered() {
        Enumeration colours = parseText("colours.f90", lines(
                "module colours",
                "  enum, bind(c)",
                "    enumerator :: red = 1, green, blue",
                "    enumerator :: black = 10, white",
                "  end enum",
                "end module colours")).modules.get(0).enums.get(0);

        assertTrue(colours.bindC);
        List<String> values = new ArrayList<>();
        colours.variables.forEach(enumerator -> values.add(enumerator.initial));
        assertEquals(List.of("1", "2", "3", "10", "11"), values);
        assertTrue(colours.variables.get(1).parameter);
    }

    @Test
    void standaloneAttributeStatements() {
        Subroutine s = parseText("attrs.f90", lines(
                "subroutine s()",
                "  real :: grid",
                "  dimension grid(10,10)",
                "  real :: w",
                "  parameter (w = 2.5)",
                "end subroutine s")).subroutines.get(0);

        assertEquals("(10,10)", s.variables.get(0).dimension);
        assertTrue(s.variables.get(1).parameter);
        assertEquals("2.5", s.variables.get(1).initial);
    }

    @Test
    void callsAreDeduplicatedAndAssociationsExpanded() {
        Subroutine driver = parseText("driver.f90", lines(
                "subroutine driver()",
                "  call setup()",
                "  CALL Setup()",
                "  associate (s => sim%solver)",
                "    call s%run()",
                "  end associate",
                "  if (done) call finish",
                "end subroutine driver")).subroutines.get(0);

        List<String> chains = new ArrayList<>();
        for (CallSite call : driver.calls) {
            chains.add(String.join("%", call.chain));
        }
        assertEquals(List.of("setup", "sim%solver%run", "finish"), chains);
    }

    @Test
    void separateModuleProcedureInterfaces() {
        Module solver = parseSample("solver.f90").modules.get(0);

        assertEquals(List.of("solve", "reset"), names(solver.interfaces));
        assertTrue(solver.interfaces.get(0).getProcedure().separateModuleProcedure);
    }

    @Test
    void submoduleWithImplementations() {
        Submodule impl = parseSample("solver_impl.f90").submodules.get(0);

        assertEquals("solver", impl.ancestorModule.getName());
        assertNull(impl.parentSubmodule);
        assertEquals(Permission.PRIVATE, impl.permission);
        assertTrue(impl.functions.get(0).separateModuleProcedure);
        assertEquals(List.of("reset"), names(impl.modProcedures));
    }

    @Test
    void unnamedProgramTakesTheFileName() {
        SourceFile file = parseText("demo.f90", lines("program", "end program"));

        assertEquals("demo", file.programs.get(0).getName());
    }

    @Test
    void blockConstructsAreSkipped() {
        Subroutine s = parseText("block.f90", lines(
                "subroutine s()",
                "  integer :: kept",
                "  block",
                "    integer :: scratch",
                "  end block",
                "end subroutine s")).subroutines.get(0);

        assertEquals(List.of("kept"), names(s.variables));
    }

    @Test
    void blockDataUnitsCollectTheirCommonBlocks() {
        SourceFile file = parseText("init.f90", lines(
                "block data init",
                "  !! Initial values of the shared state",
                "  integer :: counts(3)",
                "  common /state/ counts, total",
                "  data counts /1, 2, 3/",
                "end block data init",
                "block data",
                "  common /flags/ verbose",
                "  logical :: verbose",
                "end"));

        assertEquals(List.of("init", ""), names(file.blockData));
        BlockData init = file.blockData.get(0);
        assertTrue(init.hasDocumentation());
        assertTrue(init.variables.isEmpty());

        CommonBlock state = init.commonBlocks.get(0);
        assertEquals(List.of("counts", "total"), names(state.variables));
        assertSame(state, state.variables.get(0).parent);
        assertEquals("(3)", state.variables.get(0).dimension);
        assertTrue(state.variables.get(1).implicitlyTyped);
        assertEquals("real", state.variables.get(1).vartype);

        assertEquals("logical", file.blockData.get(1).commonBlocks.get(0).variables.get(0).vartype);
    }

    @Test
    void commonStatementsSplitIntoNamedAndBlankBlocks() {
        Subroutine s = parseText("s.f90", lines(
                "subroutine s(n)",
                "  integer :: n",
                "  real :: a, b",
                "  common a(10), /grid/ nx, ny, // b",
                "  common /GRID/ nz",
                "end subroutine s")).subroutines.get(0);

        assertEquals(List.of("", "grid"), names(s.commonBlocks));
        CommonBlock blank = s.commonBlocks.get(0);
        assertTrue(blank.isBlank());
        assertEquals(List.of("a", "b"), names(blank.variables));
        assertEquals("(10)", blank.variables.get(0).dimension);
        assertEquals(List.of("nx", "ny", "nz"), names(s.commonBlocks.get(1).variables));
        assertEquals("integer", s.commonBlocks.get(1).variables.get(0).vartype);
        assertTrue(s.variables.isEmpty());
        assertEquals(List.of("n"), names(s.args));
    }

    @Test
    void namelistGroupsListTheirMembersByName() {
        Program p = parseText("p.f90", lines(
                "program p",
                "  integer :: steps",
                "  real :: dt",
                "  namelist /run/ steps, dt /output/ dt",
                "  !! Output settings",
                "  namelist /run/ label",
                "end program p")).programs.get(0);

        assertEquals(List.of("run", "output"), names(p.namelists));
        List<String> members = new ArrayList<>();
        p.namelists.get(0).variables.forEach(member -> members.add(member.getName()));
        assertEquals(List.of("steps", "dt", "label"), members);
        assertFalse(p.namelists.get(0).variables.get(0).isResolved());
        assertTrue(p.namelists.get(0).hasDocumentation());
        assertEquals(List.of("steps", "dt"), names(p.variables));
    }

    @Test
    void commonOutsideAProgramUnitFails() {
        ParseException error = assertThrows(ParseException.class,
                () -> parseText("c.f90", lines("common /state/ x")));

        assertTrue(error.getMessage().contains("COMMON statement in file scope"));
    }

    @Test
    void namelistWithoutAGroupNameFails() {
        ParseException error = assertThrows(ParseException.class,
                () -> parseText("p.f90", lines("program p", "  namelist // x", "end program p")));

        assertTrue(error.getMessage().contains("NAMELIST group without a name"));
    }

    @Test
    void mismatchedEndFails() {
        ParseException error = assertThrows(ParseException.class, () -> parseSample("broken.f90"));

        assertTrue(error.getMessage().contains("END statement does not match subroutine 'open_ended'"));
        assertEquals(6, error.getLine());
    }

    @Test
    void wrongEndNameFails() {
        ParseException error = assertThrows(ParseException.class,
                () -> parseText("m.f90", lines("module m", "end module n")));

        assertTrue(error.getMessage().contains("does not match"));
    }

    @Test
    void fileEndingInsideAUnitFails() {
        ParseException error = assertThrows(ParseException.class,
                () -> parseText("m.f90", lines("module m", "  integer :: x")));

        assertTrue(error.getMessage().contains("File ended while still nested in module 'm'"));
    }

    @Test
    void twoProgramsInOneFileFail() {
        assertThrows(ParseException.class, () -> parseText("p.f90", lines(
                "program a", "end program a", "program b", "end program b")));
    }

    @Test
    void declarationOutsideAnyUnitFails() {
        assertThrows(ParseException.class, () -> parseText("x.f90", lines("integer :: x")));
    }

    @Test
    void endOutsideAnyUnitFails() {
        ParseException error = assertThrows(ParseException.class, () -> parseText("x.f90", lines("end module m")));

        assertTrue(error.getMessage().contains("outside of any nesting"));
    }
}
