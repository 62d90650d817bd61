package io.github.ontology.registry.maven.plugin.internal;

import org.apache.maven.plugin.MojoFailureException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import static io.github.ontology.registry.maven.plugin.test.TestUtils.createSession;
import static io.github.ontology.registry.maven.plugin.test.TestUtils.setVariableValueToObject;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

/**
 * Unit tests for {@link UnregisterMojo}
 */
public class UnregisterMojoTest {
    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private UnregisterMojo createMojo(File registryDirectory, String version) {
        UnregisterMojo mojo = new UnregisterMojo();
        setVariableValueToObject(mojo, "ontologyId", "uo");
        setVariableValueToObject(mojo, "version", version);
        setVariableValueToObject(mojo, "fileType", FileType.JSON);
        setVariableValueToObject(mojo, "registryDirectory", registryDirectory);
        setVariableValueToObject(mojo, "versions", Collections.singletonMap("uo", "2026-01-16"));
        setVariableValueToObject(mojo, "session", createSession(false));
        return mojo;
    }

    @Test
    public void testUnregisterDeclared() throws Exception {
        File registry = this.temporaryFolder.newFolder("registry");
        Path entry = Files.createFile(registry.toPath().resolve("uo_2026-01-16.json"));

        createMojo(registry, "2026-01-16").execute();

        assertThat(Files.exists(entry), is(false));
    }

    @Test
    public void testUnregisterLatest() throws Exception {
        File registry = this.temporaryFolder.newFolder("registry");
        Path entry = Files.createFile(registry.toPath().resolve("uo_2026-01-16.json"));

        createMojo(registry, "latest").execute();

        assertThat(Files.exists(entry), is(false));
    }

    @Test
    public void testUnregisterAbsentEntry() throws Exception {
        File registry = this.temporaryFolder.newFolder("registry");

        createMojo(registry, "1.0").execute();

        assertThat(registry.list().length, is(0));
    }

    @Test
    public void testUnregisterUnresolvableLatest() throws Exception {
        File registry = this.temporaryFolder.newFolder("registry");
        UnregisterMojo mojo = createMojo(registry, "latest");
        setVariableValueToObject(mojo, "ontologyId", "chebi");

        assertThrows(MojoFailureException.class, mojo::execute);
    }
}
