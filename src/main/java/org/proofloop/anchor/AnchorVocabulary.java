package org.proofloop.anchor;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.proofloop.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 版本化的锚点词表。每次运行只加载一次，所有工作线程共享同一个实例。
 */
public final class AnchorVocabulary {

    private static final Logger log = LoggerFactory.getLogger(AnchorVocabulary.class);

    public static final String DEFAULT_RESOURCE = "anchors/default-vocabulary.json";

    private final String version;
    private final List<AnchorPattern> patterns;

    public AnchorVocabulary(String version, List<AnchorPattern> patterns) {
        this.version = version;
        this.patterns = List.copyOf(patterns);
    }

    public String getVersion() {
        return version;
    }

    public List<AnchorPattern> getPatterns() {
        return patterns;
    }

    // Gson 读取用的原始结构
    private static class Document {
        String version;
        List<AnchorPattern> patterns;
    }

    public static AnchorVocabulary load(Path path) throws ConfigException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException e) {
            throw new ConfigException("Cannot read anchor vocabulary " + path, e);
        }
    }

    public static AnchorVocabulary loadDefault() throws ConfigException {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static AnchorVocabulary loadResource(String resource) throws ConfigException {
        InputStream in = AnchorVocabulary.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new ConfigException("Anchor vocabulary resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return read(reader, resource);
        } catch (IOException e) {
            throw new ConfigException("Cannot read anchor vocabulary " + resource, e);
        }
    }

    static AnchorVocabulary read(Reader reader, String origin) throws ConfigException {
        Document doc;
        try {
            doc = new Gson().fromJson(reader, Document.class);
        } catch (JsonParseException e) {
            throw new ConfigException("Malformed anchor vocabulary " + origin, e);
        }
        if (doc == null || doc.version == null || doc.patterns == null) {
            throw new ConfigException("Anchor vocabulary " + origin + " needs 'version' and 'patterns'");
        }

        Set<String> seen = new HashSet<>();
        List<AnchorPattern> frozen = new ArrayList<>();
        for (AnchorPattern p : doc.patterns) {
            if (p == null) {
                throw new ConfigException("Invalid anchor pattern in " + origin + ": empty entry in 'patterns'");
            }
            String problem = p.problem();
            if (problem != null) {
                throw new ConfigException("Invalid anchor pattern in " + origin + ": " + problem);
            }
            if (!seen.add(p.getId())) {
                throw new ConfigException("Duplicate anchor pattern id " + p.getId() + " in " + origin);
            }
            frozen.add(new AnchorPattern(p.getId(), p.getCategory(), p.getKind(), p.getNames(),
                    p.getScopes(), p.getRole()));
        }
        log.info("Loaded anchor vocabulary {} ({} patterns) from {}", doc.version, frozen.size(), origin);
        return new AnchorVocabulary(doc.version, frozen);
    }
}
