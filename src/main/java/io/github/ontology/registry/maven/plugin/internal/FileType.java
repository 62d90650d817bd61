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

/**
 * Supported ontology file formats with corresponding file endings.
 */
public enum FileType {

    /**
     * OBO Graphs JSON.
     */
    JSON(".json"),

    /**
     * OBO flat file format.
     */
    OBO(".obo"),

    /**
     * OWL (RDF/XML).
     */
    OWL(".owl");

    /**
     * File ending including the leading dot.
     */
    private final String ending;

    /**
     * Constructor.
     * @param ending File ending.
     */
    FileType(final String ending) {
        this.ending = ending;
    }

    /**
     * Get file ending, e.g. {@code .owl}.
     * @return File ending including the leading dot.
     */
    public String getFileEnding() {
        return this.ending;
    }
}
