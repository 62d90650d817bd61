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
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;

/**
 * Removes an ontology release from the local registry.
 */
@Mojo(name = "unregister", requiresProject = false, threadSafe = true)
public class UnregisterMojo extends AbstractOntologyRegistryMojo {

    @Override
    protected String goal() {
        return "unregister";
    }

    @Override
    protected void execute(final FileSystemOntologyRegistry registry)
        throws MojoExecutionException, MojoFailureException {
        final String id = this.requireOntologyId();
        final Version selected = this.selectedVersion();
        try {
            registry.unregister(id, selected, this.fileType);
        } catch (final OntologyRegistryException ex) {
            throw new MojoFailureException(ex.getMessage(), ex);
        }
        getLog().info(String.format("Ontology %s (%s) unregistered", id, selected));
    }
}
