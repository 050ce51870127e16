package org.proofloop.verify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceSandboxProviderTest {

    @TempDir
    Path tmp;

    @Test
    void eachProvisionGetsAFreshWorkspace() throws Exception {
        WorkspaceSandboxProvider provider = new WorkspaceSandboxProvider(tmp);
        try (Sandbox a = provider.provision("job-1", 1, Proofs.TOOLCHAIN);
             Sandbox b = provider.provision("job-1", 2, Proofs.TOOLCHAIN)) {
            assertNotEquals(a.id(), b.id());
            assertNotEquals(a.workspace(), b.workspace());
            assertTrue(Files.isDirectory(a.workspace()));
            assertTrue(a.workspace().startsWith(tmp));
            assertSame(Proofs.TOOLCHAIN, a.toolchain());
            assertEquals(2, provider.liveSandboxes());
        }
        assertEquals(0, provider.liveSandboxes());
    }

    @Test
    void closeDeletesTheWorkspaceOnce() throws Exception {
        WorkspaceSandboxProvider provider = new WorkspaceSandboxProvider(tmp);
        Sandbox sandbox = provider.provision("job-2", 1, Proofs.TOOLCHAIN);
        Files.writeString(sandbox.workspace().resolve("left-over.txt"), "x");
        assertTrue(sandbox.isAlive());

        sandbox.close();
        sandbox.close();
        assertFalse(sandbox.isAlive());
        assertFalse(Files.exists(sandbox.workspace()));
        assertEquals(0, provider.liveSandboxes());
    }

    @Test
    void unusableBaseDirectoryIsAProvisionError() throws Exception {
        Path file = Files.writeString(tmp.resolve("not-a-dir"), "x");
        WorkspaceSandboxProvider provider = new WorkspaceSandboxProvider(file);
        assertThrows(ProvisionException.class, () -> provider.provision("job-3", 1, Proofs.TOOLCHAIN));
    }
}
