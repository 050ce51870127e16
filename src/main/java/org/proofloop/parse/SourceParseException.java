package org.proofloop.parse;

import java.util.List;

/**
 * 源码无法解析。只中止当前源码单元，不影响同一次运行中的其它单元。
 */
public class SourceParseException extends Exception {

    private final String unitName;
    private final List<ParseProblem> problems;

    public SourceParseException(String unitName, List<ParseProblem> problems) {
        super(unitName + ": " + (problems.isEmpty() ? "unparseable source" : problems.get(0).toString()));
        this.unitName = unitName;
        this.problems = List.copyOf(problems);
    }

    public String getUnitName() {
        return unitName;
    }

    public List<ParseProblem> getProblems() {
        return problems;
    }
}
