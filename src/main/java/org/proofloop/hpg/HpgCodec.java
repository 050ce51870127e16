package org.proofloop.hpg;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.proofloop.anchor.AnchorOccurrence;
import org.proofloop.slice.SliceBoundary;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * HPG 的 JSON 读写（Gson）
 * <p>
 * 读入时重新走一遍 {@link HeterogeneousProgramGraph} 的加点/加边检查，
 * 任何违反图约束的文件都会被拒绝。
 */
public final class HpgCodec {

    public static final String FORMAT = "hpg";
    public static final int VERSION = 1;
    public static final String EXTENSION = ".hpg.json";

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private HpgCodec() {
    }

    // 磁盘上的表格形式
    private static final class Document {
        String format;
        int version;
        String vocabularyVersion;
        List<HpgNode> nodes = new ArrayList<>();
        List<HpgEdge> edges = new ArrayList<>();
        List<AnchorOccurrence> anchors = new ArrayList<>();
        List<SliceBoundary> boundaries = new ArrayList<>();
    }

    public static String toJson(HeterogeneousProgramGraph graph) {
        Document doc = new Document();
        doc.format = FORMAT;
        doc.version = VERSION;
        doc.vocabularyVersion = graph.getVocabularyVersion();
        doc.nodes.addAll(graph.nodes());
        doc.edges.addAll(graph.edges());
        doc.anchors.addAll(graph.anchors());
        doc.boundaries.addAll(graph.boundaries());
        return GSON.toJson(doc);
    }

    public static void write(HeterogeneousProgramGraph graph, Writer out) throws IOException {
        out.write(toJson(graph));
        out.flush();
    }

    public static Path write(HeterogeneousProgramGraph graph, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(graph, w);
        }
        return file;
    }

    public static HeterogeneousProgramGraph read(Path file) throws IOException, HpgFormatException {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(r);
        }
    }

    public static HeterogeneousProgramGraph read(Reader in) throws HpgFormatException {
        Document doc;
        try {
            doc = GSON.fromJson(in, Document.class);
        } catch (JsonParseException e) {
            throw new HpgFormatException("Malformed HPG JSON: " + e.getMessage(), e);
        }
        if (doc == null) {
            throw new HpgFormatException("Empty HPG document");
        }
        if (!FORMAT.equals(doc.format) || doc.version != VERSION) {
            throw new HpgFormatException("Unsupported HPG format " + doc.format + " v" + doc.version);
        }

        HeterogeneousProgramGraph g = new HeterogeneousProgramGraph();
        g.setVocabularyVersion(doc.vocabularyVersion);
        try {
            for (HpgNode n : orEmpty(doc.nodes)) {
                if (n == null || n.type() == null) {
                    throw new HpgFormatException("Node without a known type: " + n);
                }
                g.addNode(n);
            }
            for (HpgEdge e : orEmpty(doc.edges)) {
                if (e == null || e.type() == null) {
                    throw new HpgFormatException("Edge without a known type: " + e);
                }
                g.addEdge(e);
            }
        } catch (IllegalArgumentException e) {
            throw new HpgFormatException("Invalid HPG: " + e.getMessage(), e);
        }
        orEmpty(doc.anchors).forEach(g::addAnchor);
        orEmpty(doc.boundaries).forEach(g::addBoundary);

        List<String> problems = g.validate();
        if (!problems.isEmpty()) {
            throw new HpgFormatException("Invalid HPG: " + problems);
        }
        return g;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    /**
     * 由被分析项目的路径生成输出文件名：只保留字母数字、点、横线和下划线
     */
    public static String outputName(Path project) {
        Path name = project.toAbsolutePath().normalize().getFileName();
        String raw = name == null ? "project" : name.toString();
        String slug = raw.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]+", "-").replaceAll("^-+|-+$", "");
        if (slug.isEmpty()) slug = "project";
        return slug + EXTENSION;
    }
}
