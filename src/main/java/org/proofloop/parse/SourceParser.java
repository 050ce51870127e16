package org.proofloop.parse;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.*;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.TreeMap;

/**
 * 把源码文本解析为带稳定编号的 {@link SourceUnit}
 * <p>
 * 解析（{@link #parseTree}）只读配置，可以在多个线程上并发执行；
 * 编号（{@link #index}）从运行级的 {@link IdAllocator} 取号。
 */
public class SourceParser {

    private static final Logger log = LoggerFactory.getLogger(SourceParser.class);

    private final ParserConfiguration configuration;
    private final IdAllocator ids;

    public SourceParser(IdAllocator ids, List<Path> sourceRoots) {
        this.ids = ids;
        // SymbolSolver：JDK + 分析目标的源码目录
        CombinedTypeSolver typeSolver = new CombinedTypeSolver();
        typeSolver.add(new ReflectionTypeSolver());
        for (Path root : sourceRoots) {
            if (Files.isDirectory(root)) {
                typeSolver.add(new JavaParserTypeSolver(root));
            }
        }
        this.configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setSymbolResolver(new JavaSymbolSolver(typeSolver));
    }

    public SourceParser(IdAllocator ids) {
        this(ids, List.of());
    }

    public SourceUnit parse(String unitName, String text) throws SourceParseException {
        return index(unitName, parseTree(unitName, text));
    }

    public CompilationUnit parseTree(String unitName, String text) throws SourceParseException {
        if (text == null || text.isBlank()) {
            throw new SourceParseException(unitName, List.of(new ParseProblem(-1, -1, "empty source")));
        }
        // JavaParser 实例不是线程安全的，每次新建
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(text);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            List<ParseProblem> problems = toProblems(result.getProblems());
            log.warn("Parse failed for {} ({} problems)", unitName, problems.size());
            throw new SourceParseException(unitName, problems);
        }
        return result.getResult().get();
    }

    static List<ParseProblem> toProblems(List<Problem> problems) {
        List<ParseProblem> out = new ArrayList<>();
        for (Problem p : problems) {
            int line = p.getLocation()
                    .flatMap(l -> l.getBegin().getRange())
                    .map(r -> r.begin.line)
                    .orElse(-1);
            int column = p.getLocation()
                    .flatMap(l -> l.getBegin().getRange())
                    .map(r -> r.begin.column)
                    .orElse(-1);
            out.add(new ParseProblem(line, column, p.getMessage()));
        }
        return out;
    }

    /**
     * 为合约、函数以及函数体内的语句分配编号，建立父子关系
     */
    public SourceUnit index(String unitName, CompilationUnit cu) {
        Indexer indexer = new Indexer();
        List<Integer> roots = new ArrayList<>();
        for (TypeDeclaration<?> td : cu.getTypes()) {
            roots.add(indexer.contract(td, -1));
        }
        log.debug("Indexed {}: {} nodes, {} top-level declarations", unitName, indexer.nodes.size(), roots.size());
        return new SourceUnit(unitName, cu, indexer.nodes, roots, indexer.index);
    }

    private class Indexer {
        final TreeMap<Integer, AstNode> nodes = new TreeMap<>();
        final IdentityHashMap<Node, Integer> index = new IdentityHashMap<>();

        int contract(TypeDeclaration<?> td, int parentId) {
            int id = ids.next();
            add(new AstNode(id, NodeRole.CONTRACT, td.getClass().getSimpleName(), td.getNameAsString(),
                    beginLine(td), endLine(td), parentId, -1, id, td));
            for (BodyDeclaration<?> member : td.getMembers()) {
                if (member instanceof CallableDeclaration<?> cd) {
                    function(cd, id);
                } else if (member instanceof TypeDeclaration<?> nested) {
                    contract(nested, id);
                }
            }
            return id;
        }

        void function(CallableDeclaration<?> cd, int contractId) {
            int id = ids.next();
            add(new AstNode(id, NodeRole.FUNCTION, cd.getClass().getSimpleName(), cd.getNameAsString(),
                    beginLine(cd), endLine(cd), contractId, id, contractId, cd));
            BlockStmt body = null;
            if (cd instanceof MethodDeclaration md) {
                body = md.getBody().orElse(null);
            } else if (cd instanceof ConstructorDeclaration ctor) {
                body = ctor.getBody();
            }
            if (body != null) {
                for (Statement s : body.getStatements()) {
                    statement(s, id, id, contractId);
                }
            }
        }

        void statement(Statement s, int parentId, int functionId, int contractId) {
            // BlockStmt 本身不建节点，只遍历里面的语句
            if (s.isBlockStmt()) {
                for (Statement child : s.asBlockStmt().getStatements()) {
                    statement(child, parentId, functionId, contractId);
                }
                return;
            }

            int id = ids.next();
            add(new AstNode(id, NodeRole.STATEMENT, s.getClass().getSimpleName(), header(s),
                    beginLine(s), endLine(s), parentId, functionId, contractId, s));

            // 控制结构内部再递归
            if (s.isIfStmt()) {
                IfStmt is = s.asIfStmt();
                statement(is.getThenStmt(), id, functionId, contractId);
                is.getElseStmt().ifPresent(e -> statement(e, id, functionId, contractId));
            } else if (s.isForStmt()) {
                statement(s.asForStmt().getBody(), id, functionId, contractId);
            } else if (s.isForEachStmt()) {
                statement(s.asForEachStmt().getBody(), id, functionId, contractId);
            } else if (s.isWhileStmt()) {
                statement(s.asWhileStmt().getBody(), id, functionId, contractId);
            } else if (s.isDoStmt()) {
                statement(s.asDoStmt().getBody(), id, functionId, contractId);
            } else if (s.isTryStmt()) {
                TryStmt ts = s.asTryStmt();
                statement(ts.getTryBlock(), id, functionId, contractId);
                ts.getCatchClauses().forEach(c -> statement(c.getBody(), id, functionId, contractId));
                ts.getFinallyBlock().ifPresent(f -> statement(f, id, functionId, contractId));
            } else if (s.isSwitchStmt()) {
                s.asSwitchStmt().getEntries().forEach(e ->
                        e.getStatements().forEach(c -> statement(c, id, functionId, contractId)));
            } else if (s.isLabeledStmt()) {
                statement(s.asLabeledStmt().getStatement(), id, functionId, contractId);
            } else if (s.isSynchronizedStmt()) {
                statement(s.asSynchronizedStmt().getBody(), id, functionId, contractId);
            }
        }

        private void add(AstNode node) {
            nodes.put(node.id, node);
            index.put(node.astNode, node.id);
            if (node.parentId >= 0) {
                nodes.get(node.parentId).children.add(node.id);
            }
        }
    }

    /**
     * 控制结构只保留头部，避免把整个循环体塞进节点名
     */
    static String header(Statement s) {
        if (s instanceof IfStmt is) return "if (" + is.getCondition() + ")";
        if (s instanceof WhileStmt ws) return "while (" + ws.getCondition() + ")";
        if (s instanceof DoStmt ds) return "do-while (" + ds.getCondition() + ")";
        if (s instanceof ForEachStmt fe) return "for (" + fe.getVariable() + " : " + fe.getIterable() + ")";
        if (s instanceof ForStmt) return "for (...)";
        if (s instanceof SwitchStmt ss) return "switch (" + ss.getSelector() + ")";
        if (s instanceof TryStmt) return "try";
        if (s instanceof LabeledStmt ls) return ls.getLabel() + ":";
        if (s instanceof SynchronizedStmt sy) return "synchronized (" + sy.getExpression() + ")";
        return s.toString().replaceAll("\\s+", " ").trim();
    }

    private static int beginLine(Node n) {
        return n.getBegin().map(p -> p.line).orElse(-1);
    }

    private static int endLine(Node n) {
        return n.getEnd().map(p -> p.line).orElse(-1);
    }
}
