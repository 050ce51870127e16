package org.proofloop.verify;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 在某个沙箱里运行一次测试命令所需的全部信息
 */
public record ToolchainInvocation(String sandboxId, Path workspace, List<String> command,
                                  Map<String, String> environment, Duration timeout,
                                  CandidateProof proof) {
}
