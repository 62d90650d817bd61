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

import java.io.IOException;
import java.net.URI;

/**
 * Thrown when a remote resource answers with a redirect that is not followed
 * or with an error status.
 */
public final class RemoteResourceException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * HTTP status code.
     */
    private final int statusCode;

    /**
     * Constructor.
     * @param uri Requested resource.
     * @param statusCode HTTP code.
     * @param statusLine Reason phrase.
     */
    public RemoteResourceException(final URI uri, final int statusCode, final String statusLine) {
        super(String.format("Request to %s failed with code %d: %s", uri, statusCode, statusLine));
        this.statusCode = statusCode;
    }

    /**
     * Get HTTP status code.
     * @return HTTP status code.
     */
    public int getHttpCode() {
        return this.statusCode;
    }
}
