/*
 * Copyright 2009-2018 The Apache Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */
package io.github.ontology.registry.maven.plugin.internal;

import io.github.ontology.registry.maven.plugin.internal.cache.FileSystemOntologyRegistry;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;
import org.apache.maven.shared.utils.StringUtils;

/**
 * Makes sure an ontology release is present in the local registry, downloading it
 * on the first use.
 */
@Mojo(name = "register", defaultPhase = LifecyclePhase.GENERATE_RESOURCES, requiresProject = false, threadSafe = true)
public class RegisterMojo extends AbstractOntologyRegistryMojo {

    /**
     * Name of a project property receiving the absolute path of the registered file.
     */
    @Parameter(property = "ontology.outputProperty")
    private String outputProperty;

    /**
     * Directory the registered file is copied to. Nothing is copied if not set.
     */
    @Parameter(property = "ontology.outputDirectory")
    private File outputDirectory;

    /**
     * Flag to determine whether to fail when the ontology can't be registered.
     */
    @Parameter(property = "ontology.failOnError", defaultValue = "true")
    private boolean failOnError = true;

    @Override
    protected String goal() {
        return "register";
    }

    @Override
    protected void execute(final FileSystemOntologyRegistry registry)
        throws MojoExecutionException, MojoFailureException {
        final String id = this.requireOntologyId();
        final Version selected = this.selectedVersion();
        if (this.session != null && this.session.isOffline()) {
            if (selected.isLatest() && !this.hasConfiguredVersions()) {
                this.fail(
                    String.format("Latest version of %s can't be resolved in offline mode", id), null
                );
                return;
            }
            if (!registry.get(id, selected, this.fileType).isPresent()) {
                this.fail(
                    String.format("No %s %s in registry and maven is in offline mode", id, selected),
                    null
                );
                return;
            }
        }
        final Path path;
        try {
            path = registry.register(id, selected, this.fileType);
        } catch (final OntologyRegistryException ex) {
            this.fail(ex.getMessage(), ex);
            return;
        }
        getLog().info(String.format("Ontology %s (%s) registered at %s", id, selected, path));
        this.exportPath(path);
        if (this.outputDirectory != null) {
            this.copy(path);
        }
    }

    /**
     * Publishes the registered path as a project property.
     * @param path Registered file.
     */
    private void exportPath(final Path path) {
        if (StringUtils.isBlank(this.outputProperty)) {
            return;
        }
        final MavenProject project = this.session == null ? null : this.session.getCurrentProject();
        if (project == null) {
            getLog().warn(
                String.format("No project to set property %s on", this.outputProperty)
            );
            return;
        }
        project.getProperties().setProperty(this.outputProperty, path.toAbsolutePath().toString());
    }

    /**
     * Copies the registered file to the output directory.
     * @param path Registered file.
     * @throws MojoExecutionException If the copy fails.
     */
    private void copy(final Path path) throws MojoExecutionException {
        final Path target = this.outputDirectory.toPath().resolve(path.getFileName());
        try {
            Files.createDirectories(this.outputDirectory.toPath());
            Files.copy(path, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (final IOException ex) {
            throw new MojoExecutionException("IO Error: ", ex);
        }
        getLog().debug(String.format("Copied %s to %s", path, target));
    }

    /**
     * Reports a registration failure depending on {@link #failOnError}.
     * @param message Failure message.
     * @param cause Cause, may be {@literal null}.
     * @throws MojoFailureException If failing on errors.
     */
    private void fail(final String message, final Exception cause) throws MojoFailureException {
        if (this.failOnError) {
            throw new MojoFailureException(message, cause);
        }
        getLog().warn(message);
        getLog().warn("Ignoring registration failure.");
    }
}
