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
 * HTTP status codes the requester reacts to.
 */
@SuppressWarnings("checkstyle:JavadocVariable")
public enum HttpCodes {
    MOVED_PERMANENTLY(301),
    SEE_OTHER(303),
    BAD_REQUEST(400);

    private final int code;

    /**
     * Constructor.
     * @param httpCode Numeric code.
     */
    HttpCodes(final int httpCode) {
        this.code = httpCode;
    }

    /**
     * Numeric code.
     * @return Numeric code.
     */
    public int getCode() {
        return this.code;
    }

    /**
     * Whether the status is a redirect that has not been followed.
     * @param status Response status.
     * @return True for 301 to 303.
     */
    static boolean isRedirect(final int status) {
        return status >= MOVED_PERMANENTLY.getCode() && status <= SEE_OTHER.getCode();
    }

    /**
     * Whether the status reports a client or server error.
     * @param status Response status.
     * @return True for 4xx and 5xx.
     */
    static boolean isError(final int status) {
        return status >= BAD_REQUEST.getCode();
    }
}
