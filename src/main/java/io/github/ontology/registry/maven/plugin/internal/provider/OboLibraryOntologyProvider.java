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

import io.github.ontology.registry.maven.plugin.internal.HttpResourceRequester;
import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException;
import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException.Reason;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import javax.annotation.concurrent.ThreadSafe;
import org.apache.maven.plugin.logging.Log;

/**
 * Ontology provider downloading release files from the OBO Foundry PURL service,
 * {@code {baseUrl}/{id}/releases/{version}/{fileName}}.
 */
@ThreadSafe
public final class OboLibraryOntologyProvider implements OntologyProvider {

    /**
     * Public OBO PURL base.
     */
    public static final String DEFAULT_BASE_URL = "https://purl.obolibrary.org/obo";

    /**
     * Base URL without trailing slash.
     */
    private final String baseUrl;

    /**
     * HTTP transport.
     */
    private final HttpResourceRequester requester;

    /**
     * Logger.
     */
    private final Log log;

    /**
     * Constructor.
     * @param baseUrl Base URL.
     * @param requester HTTP transport.
     * @param log Logger.
     */
    public OboLibraryOntologyProvider(
        final String baseUrl, final HttpResourceRequester requester, final Log log
    ) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requester = requester;
        this.log = log;
    }

    @Override
    public byte[] provideOntology(final String ontologyId, final String fileName, final String version)
        throws OntologyRegistryException {
        final String location = String.format(
            "%s/%s/releases/%s/%s", this.baseUrl, ontologyId, version, fileName
        );
        final byte[] content;
        try {
            content = this.requester.get(new URI(location));
        } catch (final IOException | URISyntaxException ex) {
            throw new OntologyRegistryException(Reason.PROVIDING_ONTOLOGY, ex.getMessage(), ex);
        }
        this.log.debug(
            String.format("Got file '%s' for ontology '%s' and version '%s'", fileName, ontologyId, version)
        );
        return content;
    }
}
