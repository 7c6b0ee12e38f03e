package org.dxworks.fortframe.model;

public enum EntityKind {
    SOURCE_FILE("sourcefile"),
    MODULE("module"),
    SUBMODULE("submodule"),
    EXTERNAL_MODULE("external module"),
    PROGRAM("program"),
    BLOCK_DATA("blockdata"),
    SUBROUTINE("subroutine"),
    FUNCTION("function"),
    MODULE_PROCEDURE_IMPLEMENTATION("module procedure"),
    INTERFACE("interface"),
    DERIVED_TYPE("type"),
    ENUMERATION("enum"),
    VARIABLE("variable"),
    COMMON_BLOCK("common"),
    NAMELIST("namelist"),
    BOUND_PROCEDURE("boundprocedure"),
    MODULE_PROCEDURE_REFERENCE("modproc"),
    FINAL_PROCEDURE("finalproc");

    private final String name;

    EntityKind(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
