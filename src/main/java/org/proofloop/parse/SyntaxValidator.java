package org.proofloop.parse;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;

import java.util.List;

public class SyntaxValidator {

    private SyntaxValidator() {
    }

    /**
     * 验证候选证明（测试源码）是否符合 Java 语法
     *
     * @param codeString 候选证明的源代码
     * @return 语法问题列表；为空表示语法正确
     */
    public static List<ParseProblem> validate(String codeString) {
        if (codeString == null || codeString.trim().isEmpty()) {
            return List.of(new ParseProblem(-1, -1, "empty source"));
        }

        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        ParseResult<CompilationUnit> result = new JavaParser(config).parse(codeString);
        if (result.isSuccessful()) {
            return List.of();
        }
        // JavaParser 把所有错误整理在 problems 里
        List<ParseProblem> problems = SourceParser.toProblems(result.getProblems());
        return problems.isEmpty() ? List.of(new ParseProblem(-1, -1, "unparseable source")) : problems;
    }

    public static boolean validateSyntax(String codeString) {
        return validate(codeString).isEmpty();
    }
}
