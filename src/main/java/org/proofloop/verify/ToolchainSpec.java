package org.proofloop.verify;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 固定版本的测试工具链
 * <p>
 * 命令模板按空白切分后替换占位符：{executable} {version} {testClass} {testName} {stepBudget} {workspace}
 */
public record ToolchainSpec(String executable, String version, String commandTemplate) {

    public static final String STEP_BUDGET_ENV = "PROOF_STEP_BUDGET";

    public ToolchainSpec {
        if (executable == null || executable.isBlank()) throw new IllegalArgumentException("executable is required");
        if (commandTemplate == null || commandTemplate.isBlank()) throw new IllegalArgumentException("command is required");
    }

    public List<String> command(CandidateProof proof, ExecutionBudget budget, Path workspace) {
        List<String> out = new ArrayList<>();
        for (String token : commandTemplate.trim().split("\\s+")) {
            out.add(token.replace("{executable}", executable)
                    .replace("{version}", version == null ? "" : version)
                    .replace("{testClass}", proof.testClass() == null ? "" : proof.testClass())
                    .replace("{testName}", proof.testName())
                    .replace("{stepBudget}", Long.toString(budget.stepBudget()))
                    .replace("{workspace}", workspace.toString()));
        }
        return out;
    }

    @Override
    public String toString() {
        return executable + "@" + version;
    }
}
