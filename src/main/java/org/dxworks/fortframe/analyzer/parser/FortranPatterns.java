package org.dxworks.fortframe.analyzer.parser;

import java.util.regex.Pattern;

/**
 * Statement classifiers. Every pattern is applied to a single logical statement whose character literals have
 * been masked.
 */
final class FortranPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    static final Pattern LABEL = Pattern.compile("^\\d{1,5}\\s+");

    static final Pattern END = Pattern.compile(
            "^end\\s*(?:(?<kind>module|submodule|subroutine|function|procedure|program|type|interface|enum"
                    + "|block\\s*data|block|associate)(?:\\s+(?<name>\\S.*))?)?$", FLAGS);

    static final Pattern CONTAINS = Pattern.compile("^contains$", FLAGS);

    static final Pattern VISIBILITY = Pattern.compile("^(public|private|protected)$", FLAGS);

    static final Pattern SEQUENCE = Pattern.compile("^sequence$", FLAGS);

    static final Pattern FORMAT = Pattern.compile("^format\\s*\\(.*\\)$", FLAGS);

    static final Pattern ARITHMETIC_GOTO = Pattern.compile("^if\\s*\\(.*\\)\\s*\\d+\\s*,\\s*\\d+\\s*,\\s*\\d+$", FLAGS);

    static final Pattern ATTRIBUTE = Pattern.compile(
            "^(asynchronous|allocatable|bind\\s*\\(.*\\)|data|dimension|external|intent\\s*\\(\\s*\\w+\\s*\\)"
                    + "|optional|parameter|pointer|private|protected|public|save|target|value|volatile)"
                    + "(?:\\s+|\\s*::\\s*)((?:/|\\(|\\w).*?)\\s*$", FLAGS);

    static final Pattern MODULE_PROCEDURE = Pattern.compile(
            "^(?<module>module\\s+)?procedure\\s*(?:::|\\s)\\s*(?<names>\\w.*)$", FLAGS);

    static final Pattern BLOCK_DATA = Pattern.compile("^block\\s*data(?:\\s+(\\w+))?$", FLAGS);

    static final Pattern COMMON = Pattern.compile("^common(?:\\s*(?=/)|\\s+)(?<body>\\S.*)$", FLAGS);

    static final Pattern NAMELIST = Pattern.compile("^namelist\\s*(?<body>/.*)$", FLAGS);

    static final Pattern BLOCK = Pattern.compile("^(?:\\w+\\s*:)?\\s*block$", FLAGS);

    static final Pattern ASSOCIATE = Pattern.compile("^(?:\\w+\\s*:)?\\s*associate\\s*\\((?<associations>.+)\\)$", FLAGS);

    static final Pattern MODULE = Pattern.compile("^module(?:\\s+(?<name>\\w+))?$", FLAGS);

    static final Pattern SUBMODULE = Pattern.compile(
            "^submodule\\s*\\(\\s*(?<ancestor>\\w+)\\s*(?::\\s*(?<parent>\\w+))?\\s*\\)\\s*(?:::|\\s)\\s*(?<name>\\w+)$", FLAGS);

    static final Pattern PROGRAM = Pattern.compile("^program(?:\\s+(?<name>\\w+))?$", FLAGS);

    static final Pattern SUBROUTINE = Pattern.compile(
            "^(?:(?<attributes>.+?)\\s+)?subroutine\\s+(?<name>\\w+)\\s*(?<arguments>\\([^()]*\\))?"
                    + "(?:\\s*bind\\s*\\(\\s*(?<bindC>.*)\\s*\\))?$", FLAGS);

    static final Pattern FUNCTION = Pattern.compile(
            "^(?:(?<attributes>.+?)\\s+)?function\\s+(?<name>\\w+)\\s*(?<arguments>\\([^()]*\\))?"
                    + "(?=(?:.*result\\s*\\(\\s*(?<result>\\w+)\\s*\\))?)"
                    + "(?=(?:.*bind\\s*\\(\\s*(?<bindC>.*)\\s*\\))?).*$", FLAGS);

    static final Pattern TYPE = Pattern.compile(
            "^type(?:\\s+|\\s*(?<attributes>,.*)?::\\s*)(?<name>(?!is\\s*\\()\\w+)\\s*(?<parameters>\\([^()]*\\))?\\s*$", FLAGS);

    static final Pattern EXTENDS = Pattern.compile("extends\\s*\\(\\s*(\\w+)\\s*\\)", FLAGS);

    static final Pattern INTERFACE = Pattern.compile("^(?<abstract>abstract\\s+)?interface(?:\\s+(?<name>\\S.*))?$", FLAGS);

    static final Pattern ENUM = Pattern.compile("^enum(?<bindC>\\s*,\\s*bind\\s*\\(\\s*c\\s*\\))?\\s*$", FLAGS);

    static final Pattern BOUND_PROCEDURE = Pattern.compile(
            "^(?<generic>generic|procedure)\\s*(?<prototype>\\([^()]*\\))?\\s*(?:,\\s*(?<attributes>\\w[^:]*))?"
                    + "(?:\\s*::)?\\s*(?<names>\\w.*)$", FLAGS);

    static final Pattern FINAL = Pattern.compile("^final\\s*(?:::)?\\s*(?<names>\\w.*)$", FLAGS);

    static final Pattern VARIABLE = Pattern.compile(
            "^(integer|real|double\\s*precision|character|complex|double\\s*complex|logical|type(?!\\s+is)"
                    + "|class(?!\\s+is|\\s+default)|procedure|enumerator)\\s*((?:\\(|\\s\\w|[:,*]).*)$", FLAGS);

    static final Pattern USE = Pattern.compile(
            "^use(?:\\s*(?:,\\s*(?<nature>(?:non_)?intrinsic)\\s*)?::\\s*|\\s+)(?<name>\\w+)\\s*(?<clause>,.*)?$", FLAGS);

    static final Pattern CALL = Pattern.compile(
            "^(?:if\\s*\\(.*\\)\\s*)?call\\s+(?<chain>(?:\\w+\\s*(?:\\([^()]*\\))?\\s*%\\s*)*)(?<name>\\w+)\\s*(?:\\(.*\\))?$", FLAGS);

    static final Pattern PROCEDURE_PREFIX = Pattern.compile(
            "\\b(impure|pure|elemental|non_recursive|recursive|module)\\b", FLAGS);

    private FortranPatterns() {
    }
}
