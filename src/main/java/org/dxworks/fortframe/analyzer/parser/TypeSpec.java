package org.dxworks.fortframe.analyzer.parser;

/**
 * The type part of a declaration, plus whatever follows it.
 */
final class TypeSpec {
    String vartype;
    String kind;
    String strlen;
    String prototypeName;
    String prototypeArgs;
    String rest = "";
}
