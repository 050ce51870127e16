package org.proofloop.hpg;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.proofloop.Analyzed;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

class HpgCodecTest {

    @TempDir
    Path tmp;

    @Test
    void writesAndReadsBackTheSameGraph() throws Exception {
        HeterogeneousProgramGraph g = HpgAssemblerTest.vaultGraph(Analyzed.of("Vault.java"));
        Path file = HpgCodec.write(g, tmp.resolve("out/vault.hpg.json"));
        assertTrue(Files.exists(file));

        HeterogeneousProgramGraph back = HpgCodec.read(file);
        assertEquals(new HashSet<>(g.nodes()), new HashSet<>(back.nodes()));
        assertEquals(g.edges(), back.edges());
        assertEquals(g.anchors(), back.anchors());
        assertEquals(g.boundaries(), back.boundaries());
        assertEquals(g.getVocabularyVersion(), back.getVocabularyVersion());
    }

    @Test
    void usesExternalNamesForTypes() throws Exception {
        String json = HpgCodec.toJson(HpgAssemblerTest.vaultGraph(Analyzed.of("Vault.java")));
        assertTrue(json.contains("\"format\": \"hpg\""));
        assertTrue(json.contains("\"Statement\""));
        assertTrue(json.contains("\"ast_child_of\""));
        assertTrue(json.contains("\"cfg_next\""));
        assertTrue(json.contains("\"calls\""));
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThrows(HpgFormatException.class, () -> HpgCodec.read(new StringReader("{ nodes: [")));
        assertThrows(HpgFormatException.class, () -> HpgCodec.read(new StringReader("")));
        assertThrows(HpgFormatException.class,
                () -> HpgCodec.read(new StringReader("{\"format\":\"dot\",\"version\":1}")));
        assertThrows(HpgFormatException.class,
                () -> HpgCodec.read(new StringReader("{\"format\":\"hpg\",\"version\":7}")));
    }

    @Test
    void rejectsGraphsThatBreakTheConstraints() {
        String functions = "{\"format\":\"hpg\",\"version\":1,\"nodes\":["
                + "{\"id\":1,\"type\":\"Function\",\"kind\":\"m\",\"name\":\"f\",\"functionId\":1,\"contractId\":-1},"
                + "{\"id\":2,\"type\":\"Function\",\"kind\":\"m\",\"name\":\"g\",\"functionId\":2,\"contractId\":-1}],"
                + "\"edges\":[{\"type\":\"cfg_next\",\"source\":1,\"target\":2}]}";
        assertThrows(HpgFormatException.class, () -> HpgCodec.read(new StringReader(functions)));

        String dangling = "{\"format\":\"hpg\",\"version\":1,\"nodes\":["
                + "{\"id\":1,\"type\":\"Function\",\"kind\":\"m\",\"name\":\"f\",\"functionId\":1,\"contractId\":-1}],"
                + "\"edges\":[{\"type\":\"calls\",\"source\":1,\"target\":9}]}";
        assertThrows(HpgFormatException.class, () -> HpgCodec.read(new StringReader(dangling)));

        String orphan = "{\"format\":\"hpg\",\"version\":1,\"nodes\":["
                + "{\"id\":3,\"type\":\"Statement\",\"kind\":\"s\",\"name\":\"x;\",\"functionId\":1,\"contractId\":0}]}";
        assertThrows(HpgFormatException.class, () -> HpgCodec.read(new StringReader(orphan)));

        String unknownType = "{\"format\":\"hpg\",\"version\":1,\"nodes\":["
                + "{\"id\":3,\"type\":\"Module\",\"kind\":\"s\",\"name\":\"x\",\"functionId\":1,\"contractId\":0}]}";
        assertThrows(HpgFormatException.class, () -> HpgCodec.read(new StringReader(unknownType)));
    }

    @Test
    void outputNameIsASlugOfTheProjectDirectory() {
        assertEquals("my-project.hpg.json", HpgCodec.outputName(Path.of("/work/My Project!")));
        assertEquals("vault.sol.hpg.json", HpgCodec.outputName(Path.of("contracts/Vault.sol")));
        assertEquals("project.hpg.json", HpgCodec.outputName(Path.of("/")));
    }
}
