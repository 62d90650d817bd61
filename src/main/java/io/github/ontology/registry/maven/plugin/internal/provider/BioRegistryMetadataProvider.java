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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.ontology.registry.maven.plugin.internal.HttpResourceRequester;
import io.github.ontology.registry.maven.plugin.internal.OntologyMetadata;
import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException;
import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException.Reason;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import javax.annotation.concurrent.ThreadSafe;
import org.apache.maven.plugin.logging.Log;

/**
 * Metadata provider backed by the <a href="https://bioregistry.io">Bioregistry</a> API.
 * Reads {@code {apiUrl}registry/{id}} and takes the version from the record.
 */
@ThreadSafe
public final class BioRegistryMetadataProvider implements OntologyMetadataProvider {

    /**
     * Public Bioregistry API.
     */
    public static final String DEFAULT_API_URL = "https://bioregistry.io/api/";

    /**
     * JSON reader, thread safe once configured.
     */
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * API base URL, always ending with a slash.
     */
    private final String apiUrl;

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
     * @param apiUrl API base URL; a trailing slash is added if missing.
     * @param requester HTTP transport.
     * @param log Logger.
     */
    public BioRegistryMetadataProvider(
        final String apiUrl, final HttpResourceRequester requester, final Log log
    ) {
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl : apiUrl + "/";
        this.requester = requester;
        this.log = log;
    }

    /**
     * API base URL.
     * @return URL ending with a slash.
     */
    public String getApiUrl() {
        return this.apiUrl;
    }

    @Override
    public OntologyMetadata provideMetadata(final String ontologyId)
        throws OntologyRegistryException {
        final byte[] body;
        try {
            body = this.requester.get(new URI(this.apiUrl + "registry/" + ontologyId));
        } catch (final IOException | URISyntaxException ex) {
            throw new OntologyRegistryException(Reason.PROVIDING_METADATA, ex.getMessage(), ex);
        }
        final BioRegistryResource resource;
        try {
            resource = MAPPER.readValue(body, BioRegistryResource.class);
        } catch (final JsonProcessingException ex) {
            throw new OntologyRegistryException(
                Reason.PROVIDING_METADATA,
                String.format("Cant convert to json for %s", ontologyId),
                ex
            );
        } catch (final IOException ex) {
            throw new OntologyRegistryException(Reason.PROVIDING_METADATA, ex.getMessage(), ex);
        }
        if (resource == null || resource.getVersion() == null) {
            throw new OntologyRegistryException(
                Reason.PROVIDING_METADATA, String.format("Version not found for %s", ontologyId)
            );
        }
        this.log.debug(
            String.format("Bioregistry reports version %s for %s", resource.getVersion(), ontologyId)
        );
        return new OntologyMetadata(
            resource.getPrefix() == null ? ontologyId : resource.getPrefix(),
            resource.getVersion(),
            resource.getDownloadJson(),
            resource.getDownloadOwl(),
            resource.getDownloadObo(),
            resource.getName()
        );
    }
}
