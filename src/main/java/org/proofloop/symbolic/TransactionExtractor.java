package org.proofloop.symbolic;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 从利用测试方法中按源码顺序提取交易序列
 * <p>
 * 只看语句顶层的调用：{@code vm.prank(a)} / {@code vm.startPrank(a)} 切换发起方，
 * 其它 {@code vm.*} 和断言被跳过，剩下带接收者的调用各算一笔交易。
 */
public class TransactionExtractor {

    private static final Logger log = LoggerFactory.getLogger(TransactionExtractor.class);

    private static final String CHEATS = "vm";
    private static final String DEFAULT_SENDER = "this";
    private static final Set<String> SKIPPED = Set.of("require", "fail", "emit", "println", "print");

    public TransactionSequence extract(String source, String testClass, String testName) {
        List<Transaction> out = new ArrayList<>();
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        ParseResult<CompilationUnit> result = new JavaParser(config).parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            log.debug("Proof {} does not parse, no transactions extracted", testClass);
            return new TransactionSequence(testClass, testName, out);
        }
        Optional<MethodDeclaration> test = findTest(result.getResult().get(), testClass, testName);
        if (test.isEmpty() || test.get().getBody().isEmpty()) {
            return new TransactionSequence(testClass, testName, out);
        }

        String sender = DEFAULT_SENDER;
        boolean oneShot = false;
        for (Statement stmt : test.get().getBody().get().findAll(Statement.class)) {
            for (MethodCallExpr call : topLevelCalls(stmt)) {
                String name = call.getNameAsString();
                Optional<Expression> scope = call.getScope();
                if (scope.isPresent() && CHEATS.equals(scope.get().toString())) {
                    if ((name.equals("prank") || name.equals("startPrank")) && call.getArguments().isNonEmpty()) {
                        sender = call.getArgument(0).toString();
                        oneShot = name.equals("prank");
                    } else if (name.equals("stopPrank")) {
                        sender = DEFAULT_SENDER;
                        oneShot = false;
                    }
                    continue;
                }
                if (scope.isEmpty() || scope.get() instanceof ThisExpr
                        || name.startsWith("assert") || SKIPPED.contains(name)) {
                    continue;
                }
                List<String> args = new ArrayList<>();
                call.getArguments().forEach(a -> args.add(a.toString()));
                int line = call.getBegin().map(p -> p.line).orElse(-1);
                out.add(new Transaction(sender, scope.get().toString(), name, args, line));
                // vm.prank 只作用于下一笔调用
                if (oneShot) {
                    sender = DEFAULT_SENDER;
                    oneShot = false;
                }
            }
        }
        return new TransactionSequence(testClass, testName, out);
    }

    private static Optional<MethodDeclaration> findTest(CompilationUnit cu, String testClass, String testName) {
        String simple = testClass == null ? null : testClass.substring(testClass.lastIndexOf('.') + 1);
        for (MethodDeclaration md : cu.findAll(MethodDeclaration.class)) {
            if (!md.getNameAsString().equals(testName)) continue;
            if (simple == null) return Optional.of(md);
            Optional<String> owner = md.findAncestor(ClassOrInterfaceDeclaration.class)
                    .map(ClassOrInterfaceDeclaration::getNameAsString);
            if (owner.isEmpty() || owner.get().equals(simple)) return Optional.of(md);
        }
        return Optional.empty();
    }

    private static List<MethodCallExpr> topLevelCalls(Statement stmt) {
        List<MethodCallExpr> calls = new ArrayList<>();
        if (stmt instanceof ExpressionStmt es) {
            Expression e = es.getExpression();
            if (e instanceof MethodCallExpr call) {
                calls.add(call);
            } else if (e.isVariableDeclarationExpr()) {
                for (VariableDeclarator v : e.asVariableDeclarationExpr().getVariables()) {
                    v.getInitializer().filter(Expression::isMethodCallExpr)
                            .ifPresent(init -> calls.add(init.asMethodCallExpr()));
                }
            } else if (e.isAssignExpr() && e.asAssignExpr().getValue().isMethodCallExpr()) {
                calls.add(e.asAssignExpr().getValue().asMethodCallExpr());
            }
        }
        return calls;
    }
}
