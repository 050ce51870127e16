package org.proofloop.verify;

/**
 * 候选利用证明：一个可执行的测试源文件
 *
 * @param relativePath 写入沙箱工作区的相对路径
 * @param testClass    测试类名（简单名或全限定名）
 * @param testName     被指定的利用测试方法名，只有它通过才算验证成功
 */
public record CandidateProof(String source, String relativePath, String testClass, String testName) {

    public CandidateProof {
        if (source == null) throw new IllegalArgumentException("proof source is required");
        if (relativePath == null || relativePath.isBlank()) throw new IllegalArgumentException("relativePath is required");
        if (testName == null || testName.isBlank()) throw new IllegalArgumentException("testName is required");
    }
}
