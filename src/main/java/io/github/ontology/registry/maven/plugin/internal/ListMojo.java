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
import java.util.List;
import org.apache.maven.plugins.annotations.Mojo;

/**
 * Logs the files held by the local registry.
 */
@Mojo(name = "list", requiresProject = false, threadSafe = true)
public class ListMojo extends AbstractOntologyRegistryMojo {

    @Override
    protected String goal() {
        return "list";
    }

    @Override
    protected void execute(final FileSystemOntologyRegistry registry) {
        final List<String> entries = registry.list();
        if (entries.isEmpty()) {
            getLog().info("No ontologies registered in " + registry.getRegistryPath());
            return;
        }
        getLog().info(String.format("%d ontologies registered:", entries.size()));
        entries.forEach(entry -> getLog().info("  " + entry));
    }
}
