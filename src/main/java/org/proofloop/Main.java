package org.proofloop;

import org.apache.commons.io.FileUtils;
import org.proofloop.anchor.AnchorVocabulary;
import org.proofloop.config.ConfigException;
import org.proofloop.config.ProofLoopConfig;
import org.proofloop.flow.UnresolvedReference;
import org.proofloop.hpg.HpgCodec;
import org.proofloop.parse.SourceParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 分析一组 Java 文件（或目录）：
 * - 解析、匹配锚点
 * - 构建 CFG + DFG 并切片
 * - 输出 HPG JSON 到 outputs/
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final Path OUTPUT_DIR = Path.of("outputs");

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            System.err.println("usage: Main <file-or-directory> [more ...]");
            System.exit(2);
        }
        List<Path> inputs = new ArrayList<>();
        for (String a : args) inputs.add(Path.of(a));

        try {
            Path out = run(inputs, OUTPUT_DIR);
            System.out.println("HPG written to " + out);
        } catch (ConfigException e) {
            log.error("Configuration error: {}", e.getMessage());
            System.exit(1);
        }
    }

    static Path run(List<Path> inputs, Path outputDir) throws ConfigException, IOException {
        // 1. 配置 + 锚点词表
        ProofLoopConfig config = ProofLoopConfig.load();
        AnchorVocabulary vocabulary = config.getVocabularyPath().isPresent()
                ? AnchorVocabulary.load(config.getVocabularyPath().get())
                : AnchorVocabulary.loadDefault();

        // 2. 收集源码文件；目录本身作为 SymbolSolver 的源码根
        Set<Path> files = new TreeSet<>();
        List<Path> roots = new ArrayList<>();
        for (Path p : inputs) {
            if (Files.isDirectory(p)) {
                roots.add(p);
                Collection<File> found = FileUtils.listFiles(p.toFile(), new String[]{"java"}, true);
                for (File f : found) files.add(f.toPath());
            } else if (Files.isRegularFile(p)) {
                files.add(p);
            } else {
                log.warn("Skipping {}: not a file or directory", p);
            }
        }

        // 3. 分析并输出
        AnalysisPipeline pipeline = new AnalysisPipeline(vocabulary, config.getSliceBounds(),
                config.getAnalysisWorkers(), roots);
        AnalysisReport report = pipeline.runFiles(new ArrayList<>(files));
        for (SourceParseException e : report.parseErrors()) {
            log.error("{}", e.getMessage());
        }
        for (UnresolvedReference w : report.warnings()) {
            log.warn("Unresolved call {} at {}:{}", w.calleeName(), w.unitName(), w.line());
        }
        for (AnchorFailure f : report.failures()) {
            log.warn("Anchor {} not sliced: {}", f.anchor(), f.reason());
        }
        Path target = outputDir.resolve(HpgCodec.outputName(inputs.get(0)));
        return HpgCodec.write(report.graph(), target);
    }
}
