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
import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException.Reason;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.annotation.concurrent.ThreadSafe;
import org.apache.maven.plugin.logging.Log;

/**
 * Ontology provider reading from a local mirror laid out like the OBO library,
 * {@code {mirror}/{id}/releases/{version}/{fileName}}.
 */
@ThreadSafe
public final class DirectoryOntologyProvider implements OntologyProvider {

    /**
     * Mirror root directory.
     */
    private final Path mirror;

    /**
     * Logger.
     */
    private final Log log;

    /**
     * Constructor.
     * @param mirror Mirror root directory.
     * @param log Logger.
     */
    public DirectoryOntologyProvider(final Path mirror, final Log log) {
        this.mirror = mirror;
        this.log = log;
    }

    @Override
    public byte[] provideOntology(final String ontologyId, final String fileName, final String version)
        throws OntologyRegistryException {
        final Path source = this.mirror.resolve(ontologyId)
            .resolve("releases")
            .resolve(version)
            .resolve(fileName);
        if (!Files.isRegularFile(source)) {
            throw new OntologyRegistryException(
                Reason.PROVIDING_ONTOLOGY, String.format("No such file %s", source)
            );
        }
        try {
            final byte[] content = Files.readAllBytes(source);
            this.log.debug(String.format("Read %s from mirror", source));
            return content;
        } catch (final IOException ex) {
            throw new OntologyRegistryException(
                Reason.PROVIDING_ONTOLOGY, String.format("Unable to read %s", source), ex
            );
        }
    }
}
