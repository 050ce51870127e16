package org.proofloop;

import com.github.javaparser.ast.CompilationUnit;
import org.apache.commons.io.FileUtils;
import org.proofloop.anchor.AnchorMatcher;
import org.proofloop.anchor.AnchorOccurrence;
import org.proofloop.anchor.AnchorVocabulary;
import org.proofloop.flow.DependencyAnalyzer;
import org.proofloop.flow.ProgramModel;
import org.proofloop.hpg.HeterogeneousProgramGraph;
import org.proofloop.hpg.HpgAssembler;
import org.proofloop.parse.IdAllocator;
import org.proofloop.parse.ParseProblem;
import org.proofloop.parse.SourceParseException;
import org.proofloop.parse.SourceParser;
import org.proofloop.parse.SourceUnit;
import org.proofloop.slice.DependencySlicer;
import org.proofloop.slice.Slice;
import org.proofloop.slice.SliceBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 源码 -> 解析 -> 锚点匹配 + 依赖分析 -> 切片 -> HPG
 * <p>
 * 解析和切片在工作线程池上并行，输入（AST、词表、依赖模型）只读共享；
 * 编号分配按输入顺序串行进行，同样的输入得到同样的编号。
 */
public class AnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final AnchorVocabulary vocabulary;
    private final SliceBounds bounds;
    private final int workers;
    private final List<Path> sourceRoots;

    /**
     * @param workers     工作线程数，0 表示可用核数
     * @param sourceRoots 交给 SymbolSolver 的源码目录
     */
    public AnalysisPipeline(AnchorVocabulary vocabulary, SliceBounds bounds, int workers, List<Path> sourceRoots) {
        this.vocabulary = vocabulary;
        this.bounds = bounds;
        this.workers = workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
        this.sourceRoots = List.copyOf(sourceRoots);
    }

    public AnalysisReport runFiles(List<Path> files) throws IOException {
        Map<String, String> sources = new LinkedHashMap<>();
        for (Path f : files) {
            sources.put(f.toString(), FileUtils.readFileToString(f.toFile(), StandardCharsets.UTF_8));
        }
        return run(sources);
    }

    /**
     * @param sources 单元名 -> 源码文本，按迭代顺序分配编号
     */
    public AnalysisReport run(Map<String, String> sources) {
        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "analysis-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            return run(sources, pool);
        } finally {
            pool.shutdownNow();
        }
    }

    private AnalysisReport run(Map<String, String> sources, ExecutorService pool) {
        IdAllocator ids = new IdAllocator();
        SourceParser parser = new SourceParser(ids, sourceRoots);

        // 1. 并行解析
        Map<String, Future<CompilationUnit>> trees = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : sources.entrySet()) {
            trees.put(e.getKey(), pool.submit(() -> parser.parseTree(e.getKey(), e.getValue())));
        }

        // 2. 按输入顺序编号
        List<SourceUnit> units = new ArrayList<>();
        List<SourceParseException> parseErrors = new ArrayList<>();
        for (Map.Entry<String, Future<CompilationUnit>> e : trees.entrySet()) {
            try {
                units.add(parser.index(e.getKey(), e.getValue().get()));
            } catch (ExecutionException ex) {
                if (ex.getCause() instanceof SourceParseException spe) {
                    parseErrors.add(spe);
                } else {
                    parseErrors.add(new SourceParseException(e.getKey(), List.of(
                            new ParseProblem(-1, -1, String.valueOf(ex.getCause())))));
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Analysis interrupted while parsing " + e.getKey(), ex);
            }
        }

        // 3. 锚点 + 依赖
        AnchorMatcher matcher = new AnchorMatcher(vocabulary);
        List<AnchorOccurrence> anchors = new ArrayList<>();
        for (SourceUnit unit : units) {
            anchors.addAll(matcher.match(unit));
        }
        ProgramModel model = new DependencyAnalyzer(ids).analyze(units);

        // 4. 每个锚点独立切片，单个失败只记录
        DependencySlicer slicer = new DependencySlicer(model, bounds);
        List<Future<Slice>> pending = new ArrayList<>();
        for (AnchorOccurrence a : anchors) {
            pending.add(pool.submit(() -> slicer.slice(a)));
        }
        List<Slice> slices = new ArrayList<>();
        List<AnchorFailure> failures = new ArrayList<>();
        for (int i = 0; i < anchors.size(); i++) {
            AnchorOccurrence a = anchors.get(i);
            try {
                slices.add(pending.get(i).get());
            } catch (ExecutionException ex) {
                log.warn("Slicing failed for anchor {}: {}", a, ex.getCause().getMessage());
                failures.add(new AnchorFailure(a, String.valueOf(ex.getCause().getMessage())));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Analysis interrupted while slicing " + a, ex);
            }
        }

        // 5. 合并成 HPG
        HeterogeneousProgramGraph graph = new HpgAssembler(model).assemble(slices, vocabulary.getVersion());
        log.info("Analysis finished: {} units ({} unparsable), {} anchors, {} slices, {} failures",
                units.size(), parseErrors.size(), anchors.size(), slices.size(), failures.size());
        return new AnalysisReport(units, parseErrors, anchors, slices, failures, model.warnings(), model, graph);
    }
}
