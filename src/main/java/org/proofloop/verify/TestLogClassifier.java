package org.proofloop.verify;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析工具链输出，支持 Foundry 风格（[PASS]/[FAIL. Reason: ...]）
 * 和 Maven Surefire 风格（Tests run: N, Failures: F, Errors: E）的日志
 * <p>
 * 只有指定的利用测试出现在输出中并且带有通过标记时才判定为通过。
 */
public class TestLogClassifier {

    // javac: Foo.java:12: error: ...   maven: [ERROR] /x/Foo.java:[12,5] ...
    private static final Pattern COMPILE_ERROR = Pattern.compile(
            "(COMPILATION ERROR|Compilation failed|Compiler run failed|\\.java:\\d+: error:|\\[ERROR\\] .*\\.java:\\[\\d+,\\d+\\])");
    private static final Pattern REVERT = Pattern.compile(
            "(\\[FAIL\\. Reason: [^\\]]*revert|EvmError: Revert|RevertException|reverted with)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ASSERTION = Pattern.compile(
            "(\\[FAIL|AssertionFailedError|AssertionError|assertion failed)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUREFIRE = Pattern.compile(
            "Tests run: (\\d+), Failures: (\\d+), Errors: (\\d+), Skipped: (\\d+)");

    public TestOutcome classify(ToolchainRun run, CandidateProof proof) {
        String out = run.output() == null ? "" : run.output();
        String test = proof.testName();
        if (run.timedOut()) {
            return TestOutcome.fail(FailureKind.TIMEOUT, "timed out after " + run.elapsed().toMillis() + " ms");
        }
        Matcher m = COMPILE_ERROR.matcher(out);
        if (m.find()) {
            return TestOutcome.fail(FailureKind.COMPILATION_ERROR, "compile error: " + lineOf(out, m.start()));
        }
        m = REVERT.matcher(out);
        if (m.find()) {
            return TestOutcome.fail(FailureKind.REVERT, "reverted: " + lineOf(out, m.start()));
        }
        m = ASSERTION.matcher(out);
        if (m.find()) {
            return TestOutcome.fail(FailureKind.ASSERTION_FAILURE, "assertion failed: " + lineOf(out, m.start()));
        }
        if (!mentions(out, proof)) {
            return TestOutcome.fail(FailureKind.INCONCLUSIVE, "test " + test + " not found in output (exit " + run.exitCode() + ")");
        }
        if (run.exitCode() == 0 && passMarker(out, test)) {
            return TestOutcome.pass(test + " passed");
        }
        return TestOutcome.fail(FailureKind.ASSERTION_FAILURE, test + " did not pass (exit " + run.exitCode() + ")");
    }

    // Surefire 只打印类名（Running X / -- in X），方法由 -Dtest=Class#method 过滤
    private static boolean mentions(String out, CandidateProof proof) {
        if (out.contains(proof.testName())) return true;
        String cls = simpleName(proof.testClass());
        return cls != null && out.contains(cls) && SUREFIRE.matcher(out).find();
    }

    private static boolean passMarker(String out, String test) {
        for (String line : out.split("\\R")) {
            if (line.contains("[PASS]") && line.contains(test)) return true;
        }
        // 每条汇总都必须是真正执行且全部通过；跳过的测试不算通过
        Matcher m = SUREFIRE.matcher(out);
        boolean seen = false;
        while (m.find()) {
            int run = Integer.parseInt(m.group(1));
            int failures = Integer.parseInt(m.group(2));
            int errors = Integer.parseInt(m.group(3));
            int skipped = Integer.parseInt(m.group(4));
            if (failures > 0 || errors > 0 || skipped > 0 || run - skipped <= 0) {
                return false;
            }
            seen = true;
        }
        return seen;
    }

    private static String simpleName(String testClass) {
        if (testClass == null || testClass.isBlank()) return null;
        return testClass.substring(testClass.lastIndexOf('.') + 1);
    }

    private static String lineOf(String text, int offset) {
        int s = text.lastIndexOf('\n', offset - 1) + 1;
        int e = text.indexOf('\n', offset);
        return text.substring(s, e < 0 ? text.length() : e).trim();
    }
}
