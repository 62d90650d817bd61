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

import io.github.ontology.registry.maven.plugin.internal.OntologyMetadata;
import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException;

/**
 * Source of ontology metadata, used to resolve the latest version of an ontology.
 * Implementations must be safe to call from several threads.
 */
public interface OntologyMetadataProvider {

    /**
     * Provides metadata of the given ontology.
     * @param ontologyId Ontology id, e.g. {@code mondo}.
     * @return Metadata with a concrete version.
     * @throws OntologyRegistryException With reason
     *  {@link OntologyRegistryException.Reason#PROVIDING_METADATA} if the metadata or its
     *  version can't be obtained.
     */
    OntologyMetadata provideMetadata(String ontologyId) throws OntologyRegistryException;
}
