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

import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException;
import io.github.ontology.registry.maven.plugin.internal.Version;
import io.github.ontology.registry.maven.plugin.internal.provider.OntologyMetadataProvider;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Maps version selectors to concrete versions.
 * Only the latest version is looked up through the metadata provider.
 */
@ThreadSafe
final class VersionResolver {

    /**
     * Metadata provider consulted for the latest version.
     */
    private final OntologyMetadataProvider metadataProvider;

    /**
     * Constructor.
     * @param metadataProvider Metadata provider.
     */
    VersionResolver(final OntologyMetadataProvider metadataProvider) {
        this.metadataProvider = metadataProvider;
    }

    /**
     * Resolves the version selector.
     * @param ontologyId Ontology id.
     * @param version Version selector.
     * @return Concrete version.
     * @throws OntologyRegistryException Failure of the metadata provider, unchanged.
     */
    String resolve(final String ontologyId, final Version version)
        throws OntologyRegistryException {
        final String resolved;
        if (version.isLatest()) {
            resolved = this.metadataProvider.provideMetadata(ontologyId).getVersion();
        } else {
            resolved = version.getDeclared();
        }
        return resolved;
    }
}
