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
package io.github.ontology.registry.maven.plugin.internal.provider;

import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException;

/**
 * Source of ontology file contents.
 * Implementations must be safe to call from several threads.
 */
public interface OntologyProvider {

    /**
     * Provides the raw content of one ontology release file.
     * @param ontologyId Ontology id, e.g. {@code go}.
     * @param fileName File name inside the release, e.g. {@code go.owl}.
     * @param version Concrete release version.
     * @return File content.
     * @throws OntologyRegistryException With reason
     *  {@link OntologyRegistryException.Reason#PROVIDING_ONTOLOGY} if the content
     *  can't be obtained.
     */
    byte[] provideOntology(String ontologyId, String fileName, String version)
        throws OntologyRegistryException;
}
