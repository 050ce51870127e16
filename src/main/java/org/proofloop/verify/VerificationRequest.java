package org.proofloop.verify;

import java.nio.file.Path;

/**
 * @param targetProject 被验证项目的根目录，每次尝试都会被复制进新的沙箱
 */
public record VerificationRequest(Path targetProject, CandidateProof proof) {
}
