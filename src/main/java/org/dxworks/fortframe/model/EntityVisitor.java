package org.dxworks.fortframe.model;

public interface EntityVisitor<R> {

    R visitSourceFile(SourceFile file);

    R visitModule(Module module);

    R visitSubmodule(Submodule submodule);

    R visitExternalModule(ExternalModule module);

    R visitProgram(Program program);

    R visitBlockData(BlockData blockData);

    R visitSubroutine(Subroutine subroutine);

    R visitFunction(Function function);

    R visitModuleProcedureImplementation(ModuleProcedureImplementation implementation);

    R visitInterface(Interface anInterface);

    R visitDerivedType(DerivedType type);

    R visitEnumeration(Enumeration enumeration);

    R visitVariable(Variable variable);

    R visitCommonBlock(CommonBlock commonBlock);

    R visitNamelist(Namelist namelist);

    R visitBoundProcedure(BoundProcedure boundProcedure);

    R visitModuleProcedureReference(ModuleProcedureReference reference);

    R visitFinalProcedure(FinalProcedure finalProcedure);
}
