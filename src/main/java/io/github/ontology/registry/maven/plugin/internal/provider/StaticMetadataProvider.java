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
import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException.Reason;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.concurrent.Immutable;

/**
 * Metadata provider answering from a fixed table of ontology ids to versions.
 * Used to pin versions without asking a remote service.
 */
@Immutable
public final class StaticMetadataProvider implements OntologyMetadataProvider {

    /**
     * Ontology id to version.
     */
    private final Map<String, String> versions;

    /**
     * Constructor.
     * @param versions Ontology id to version; copied.
     */
    public StaticMetadataProvider(final Map<String, String> versions) {
        this.versions = Collections.unmodifiableMap(new HashMap<>(versions));
    }

    @Override
    public OntologyMetadata provideMetadata(final String ontologyId)
        throws OntologyRegistryException {
        final String version = this.versions.get(ontologyId);
        if (version == null) {
            throw new OntologyRegistryException(
                Reason.PROVIDING_METADATA,
                String.format("No version configured for %s", ontologyId)
            );
        }
        return OntologyMetadata.of(ontologyId, version);
    }
}
