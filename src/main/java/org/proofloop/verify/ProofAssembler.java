package org.proofloop.verify;

import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 在沙箱工作区中物化目标项目 + 候选证明
 */
public class ProofAssembler {

    public Path assemble(Path workspace, Path targetProject, CandidateProof proof) throws AssemblyException {
        if (targetProject == null || !Files.isDirectory(targetProject)) {
            throw new AssemblyException("Target project not found: " + targetProject);
        }
        try {
            FileUtils.copyDirectory(targetProject.toFile(), workspace.toFile());
        } catch (IOException e) {
            throw new AssemblyException("Cannot copy " + targetProject + " into sandbox: " + e.getMessage(), e);
        }

        Path root = workspace.toAbsolutePath().normalize();
        Path dest = root.resolve(proof.relativePath()).normalize();
        if (!dest.startsWith(root)) {
            throw new AssemblyException("Proof path " + proof.relativePath() + " escapes the sandbox workspace");
        }
        // 证明不能覆盖目标项目自己的文件
        if (Files.exists(dest)) {
            throw new AssemblyException("Proof file " + proof.relativePath() + " conflicts with an existing project file");
        }
        try {
            FileUtils.writeStringToFile(dest.toFile(), proof.source(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AssemblyException("Cannot write proof " + proof.relativePath() + ": " + e.getMessage(), e);
        }
        return dest;
    }
}
