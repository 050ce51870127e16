package org.proofloop.verify;

import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

/**
 * 验证相关测试共用的证明与目标项目
 */
public final class Proofs {

    public static final String TEST_CLASS = "ExploitTest";
    public static final String TEST_NAME = "testExploit";
    public static final String PATH = "test/ExploitTest.java";

    public static final ToolchainSpec TOOLCHAIN =
            new ToolchainSpec("forge", "0.2.0", "{executable} test --match-test {testName} --gas-limit {stepBudget}");

    private Proofs() {
    }

    public static CandidateProof expecting(String outcome) {
        return new CandidateProof("package exploit;\n\n"
                + "public class ExploitTest {\n"
                + "    // expect: " + outcome + "\n"
                + "    public void testExploit() {\n"
                + "        vm.prank(attacker);\n"
                + "        vault.withdraw();\n"
                + "    }\n"
                + "}\n", PATH, TEST_CLASS, TEST_NAME);
    }

    public static CandidateProof broken() {
        return new CandidateProof("public class ExploitTest {\n    public void testExploit( {\n}\n",
                PATH, TEST_CLASS, TEST_NAME);
    }

    public static ExecutionBudget budget(long timeoutMillis) {
        return new ExecutionBudget(Duration.ofMillis(timeoutMillis), 30_000_000L);
    }

    /**
     * 在 dir 下生成一个最小的目标项目
     */
    public static Path targetProject(Path dir) throws IOException {
        FileUtils.writeStringToFile(dir.resolve("src/Vault.java").toFile(),
                "public class Vault {\n    public void withdraw() {\n    }\n}\n", StandardCharsets.UTF_8);
        return dir;
    }
}
