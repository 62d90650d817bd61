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
 * File naming used by the registry and by ontology providers.
 * Ids and versions are not escaped, callers must pass file system safe values.
 */
public final class FileNameUtils {

    /**
     * Suffix of files being written before they are published.
     */
    private static final String TEMPORARY_SUFFIX = ".tmp";

    /**
     * Private constructor.
     */
    private FileNameUtils() {
    }

    /**
     * Name of the registered file, {@code {id}_{version}{ending}}.
     * @param ontologyId Ontology id.
     * @param version Resolved version.
     * @param fileType File type.
     * @return Registry file name.
     */
    public static String getRegistryFileName(
        final String ontologyId, final String version, final FileType fileType
    ) {
        return String.format("%s_%s%s", ontologyId, version, fileType.getFileEnding());
    }

    /**
     * Name of the file in the remote release directory, {@code {id}{ending}}.
     * The version is not part of it since remote sources keep one directory per release.
     * @param ontologyId Ontology id.
     * @param fileType File type.
     * @return Provider file name.
     */
    public static String getProviderFileName(final String ontologyId, final FileType fileType) {
        return ontologyId + fileType.getFileEnding();
    }

    /**
     * Name of the sibling file the content is written to before publishing.
     * @param registryFileName Registry file name.
     * @return Temporary file name.
     */
    public static String getTemporaryFileName(final String registryFileName) {
        return registryFileName + TEMPORARY_SUFFIX;
    }
}
