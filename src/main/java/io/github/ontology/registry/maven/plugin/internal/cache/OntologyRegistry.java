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
package io.github.ontology.registry.maven.plugin.internal.cache;

import io.github.ontology.registry.maven.plugin.internal.FileType;
import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException;
import io.github.ontology.registry.maven.plugin.internal.Version;
import java.util.List;
import java.util.Optional;

/**
 * Local registry of ontology files keyed by ontology id, resolved version and file type.
 * @param <E> Handle type of a registered entry.
 */
public interface OntologyRegistry<E> {

    /**
     * Makes sure the ontology is registered, fetching it if it is missing.
     * @param ontologyId Ontology id.
     * @param version Version selector.
     * @param fileType File type.
     * @return Registered entry.
     * @throws OntologyRegistryException If the version can't be resolved, the content
     *  can't be fetched or the entry can't be stored.
     */
    E register(String ontologyId, Version version, FileType fileType)
        throws OntologyRegistryException;

    /**
     * Removes a registered ontology. Removing an absent entry does nothing.
     * @param ontologyId Ontology id.
     * @param version Version selector.
     * @param fileType File type.
     * @throws OntologyRegistryException If the version can't be resolved or the entry
     *  can't be removed.
     */
    void unregister(String ontologyId, Version version, FileType fileType)
        throws OntologyRegistryException;

    /**
     * Looks up a registered ontology without fetching anything.
     * @param ontologyId Ontology id.
     * @param version Version selector.
     * @param fileType File type.
     * @return Entry; empty if not registered or the version can't be resolved.
     */
    Optional<E> get(String ontologyId, Version version, FileType fileType);

    /**
     * Lists all registered entries.
     * @return Entry identifiers; empty if nothing can be listed.
     */
    List<String> list();
}
