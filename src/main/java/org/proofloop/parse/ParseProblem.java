package org.proofloop.parse;

/**
 * 单条语法问题（行号/列号取不到时为 -1）
 */
public record ParseProblem(int line, int column, String message) {

    @Override
    public String toString() {
        return "Line " + line + ":" + column + " " + message;
    }
}
