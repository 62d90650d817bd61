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

import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Descriptive metadata of an ontology as returned by a metadata provider.
 * Only the version is used for registration, everything else is informational.
 */
@Immutable
public final class OntologyMetadata {

    private final String ontologyId;
    private final String version;
    private final String jsonFileLocation;
    private final String owlFileLocation;
    private final String oboFileLocation;
    private final String title;

    /**
     * Constructor.
     * @param ontologyId Ontology id (prefix).
     * @param version Current version.
     * @param jsonFileLocation Download location of the JSON file, may be {@literal null}.
     * @param owlFileLocation Download location of the OWL file, may be {@literal null}.
     * @param oboFileLocation Download location of the OBO file, may be {@literal null}.
     * @param title Human readable name, may be {@literal null}.
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public OntologyMetadata(
        final String ontologyId, final String version,
        @Nullable final String jsonFileLocation, @Nullable final String owlFileLocation,
        @Nullable final String oboFileLocation, @Nullable final String title
    ) {
        this.ontologyId = Objects.requireNonNull(ontologyId, "ontologyId");
        this.version = Objects.requireNonNull(version, "version");
        this.jsonFileLocation = jsonFileLocation;
        this.owlFileLocation = owlFileLocation;
        this.oboFileLocation = oboFileLocation;
        this.title = title;
    }

    /**
     * Metadata carrying nothing but the id and the version.
     * @param ontologyId Ontology id.
     * @param version Current version.
     * @return Metadata.
     */
    public static OntologyMetadata of(final String ontologyId, final String version) {
        return new OntologyMetadata(ontologyId, version, null, null, null, null);
    }

    public String getOntologyId() {
        return this.ontologyId;
    }

    public String getVersion() {
        return this.version;
    }

    public Optional<String> getJsonFileLocation() {
        return Optional.ofNullable(this.jsonFileLocation);
    }

    public Optional<String> getOwlFileLocation() {
        return Optional.ofNullable(this.owlFileLocation);
    }

    public Optional<String> getOboFileLocation() {
        return Optional.ofNullable(this.oboFileLocation);
    }

    public Optional<String> getTitle() {
        return Optional.ofNullable(this.title);
    }

    @Override
    public String toString() {
        return String.format("%s (%s)", this.ontologyId, this.version);
    }
}
