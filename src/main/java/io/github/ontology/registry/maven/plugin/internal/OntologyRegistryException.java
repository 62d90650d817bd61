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
 * Thrown when an ontology can't be resolved, fetched, stored or removed.
 * The {@link Reason} tells which step failed.
 */
public final class OntologyRegistryException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Failure kinds.
     */
    public enum Reason {

        /**
         * The metadata provider could not resolve a version.
         */
        PROVIDING_METADATA("Unable to provide metadata"),

        /**
         * The ontology provider could not deliver the content.
         */
        PROVIDING_ONTOLOGY("Unable to provide ontology"),

        /**
         * The registry directory could not be created.
         */
        NO_REGISTRY("Unable to create registry"),

        /**
         * The temporary file could not be created or written.
         */
        UNABLE_TO_WRITE("Unable to write ontology"),

        /**
         * The temporary file could not be moved to its final name.
         */
        UNABLE_TO_RENAME("Unable to publish ontology"),

        /**
         * A registered file could not be deleted.
         */
        UNABLE_TO_REMOVE("Unable to unregister ontology");

        /**
         * Message prefix.
         */
        private final String summary;

        /**
         * Constructor.
         * @param summary Message prefix.
         */
        Reason(final String summary) {
            this.summary = summary;
        }
    }

    /**
     * Failure kind.
     */
    private final Reason reason;

    /**
     * Constructor.
     * @param reason Failure kind.
     * @param detail Failure details.
     */
    public OntologyRegistryException(final Reason reason, final String detail) {
        super(String.format("%s: %s", reason.summary, detail));
        this.reason = reason;
    }

    /**
     * Constructor.
     * @param reason Failure kind.
     * @param detail Failure details.
     * @param cause Underlying exception.
     */
    public OntologyRegistryException(
        final Reason reason, final String detail, final Throwable cause
    ) {
        super(String.format("%s: %s", reason.summary, detail), cause);
        this.reason = reason;
    }

    /**
     * Get failure kind.
     * @return Failure kind.
     */
    public Reason getReason() {
        return this.reason;
    }
}
