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
package io.github.ontology.registry.maven.plugin.internal.cache;

import io.github.ontology.registry.maven.plugin.internal.FileNameUtils;
import io.github.ontology.registry.maven.plugin.internal.FileType;
import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException;
import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException.Reason;
import io.github.ontology.registry.maven.plugin.internal.Version;
import io.github.ontology.registry.maven.plugin.internal.provider.OntologyMetadataProvider;
import io.github.ontology.registry.maven.plugin.internal.provider.OntologyProvider;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.annotation.concurrent.ThreadSafe;
import org.apache.maven.plugin.logging.Log;

/**
 * Ontology registry storing every entry as one file in a flat directory.
 * <p>Files are named {@code {id}_{version}{ending}} and only ever become visible under
 * that name through an atomic move of a fully written temporary sibling, so an existing
 * file is always complete. Content is fetched outside of the lock; the lock only
 * serializes writing, publishing and removal of files.</p>
 */
@ThreadSafe
public final class FileSystemOntologyRegistry implements OntologyRegistry<Path> {

    /**
     * Directory where the registered files are stored.
     */
    private final Path registryPath;

    /**
     * Resolver of version selectors.
     */
    private final VersionResolver resolver;

    /**
     * Source of ontology contents.
     */
    private final OntologyProvider ontologyProvider;

    /**
     * Guards writing and removal of registry files.
     */
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Logger.
     */
    private final Log log;

    /**
     * Constructor. The registry directory is created on the first registration.
     * @param registryPath Directory where the registered files are stored.
     * @param metadataProvider Provider used to resolve latest versions.
     * @param ontologyProvider Provider of ontology contents.
     * @param log Logger.
     */
    public FileSystemOntologyRegistry(
        final Path registryPath, final OntologyMetadataProvider metadataProvider,
        final OntologyProvider ontologyProvider, final Log log
    ) {
        this.registryPath = registryPath;
        this.resolver = new VersionResolver(metadataProvider);
        this.ontologyProvider = ontologyProvider;
        this.log = log;
    }

    /**
     * Directory where the registered files are stored.
     * @return Registry directory.
     */
    public Path getRegistryPath() {
        return this.registryPath;
    }

    @Override
    public Path register(final String ontologyId, final Version version, final FileType fileType)
        throws OntologyRegistryException {
        final String resolved = this.resolver.resolve(ontologyId, version);
        final String fileName = FileNameUtils.getRegistryFileName(ontologyId, resolved, fileType);
        final Path target = this.registryPath.resolve(fileName);
        if (Files.exists(target)) {
            this.log.debug(String.format("Ontology '%s' already registered.", target));
            return target;
        }
        try {
            Files.createDirectories(this.registryPath);
        } catch (final IOException ex) {
            throw new OntologyRegistryException(
                Reason.NO_REGISTRY, this.registryPath.toString(), ex
            );
        }
        final byte[] content = this.ontologyProvider.provideOntology(
            ontologyId, FileNameUtils.getProviderFileName(ontologyId, fileType), resolved
        );
        this.lock.lock();
        try {
            if (Files.exists(target)) {
                this.log.debug(
                    String.format("Ontology '%s' was registered by another thread.", target)
                );
                return target;
            }
            this.publish(content, target);
        } finally {
            this.lock.unlock();
        }
        this.log.debug(String.format("Registered %s", target));
        return target;
    }

    @Override
    public void unregister(final String ontologyId, final Version version, final FileType fileType)
        throws OntologyRegistryException {
        final String resolved = this.resolver.resolve(ontologyId, version);
        final Path target = this.entryPath(ontologyId, resolved, fileType);
        this.lock.lock();
        try {
            if (Files.deleteIfExists(target)) {
                this.log.debug(String.format("Unregistered %s", target));
            }
        } catch (final IOException ex) {
            throw new OntologyRegistryException(Reason.UNABLE_TO_REMOVE, target.toString(), ex);
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public Optional<Path> get(final String ontologyId, final Version version, final FileType fileType) {
        final String resolved;
        try {
            resolved = this.resolver.resolve(ontologyId, version);
        } catch (final OntologyRegistryException ex) {
            this.log.warn(
                String.format("Unable to get ontology '%s' for version %s: %s", ontologyId, version, ex.getMessage())
            );
            return Optional.empty();
        }
        final Path target = this.entryPath(ontologyId, resolved, fileType);
        if (!Files.exists(target)) {
            this.log.debug(String.format("Unable to get location: %s", target));
            return Optional.empty();
        }
        this.log.debug(String.format("Returned register location %s", target));
        return Optional.of(target);
    }

    @Override
    public List<String> list() {
        if (!Files.isDirectory(this.registryPath)) {
            return Collections.emptyList();
        }
        try (Stream<Path> entries = Files.list(this.registryPath)) {
            return entries
                .filter(Files::isRegularFile)
                .map(path -> path.toAbsolutePath().toString())
                .sorted()
                .collect(Collectors.toList());
        } catch (final IOException ex) {
            this.log.debug(String.format("Unable to list %s: %s", this.registryPath, ex.getMessage()));
            return Collections.emptyList();
        }
    }

    /**
     * Path of a registry entry.
     * @param ontologyId Ontology id.
     * @param resolved Resolved version.
     * @param fileType File type.
     * @return Entry path.
     */
    private Path entryPath(final String ontologyId, final String resolved, final FileType fileType) {
        return this.registryPath.resolve(
            FileNameUtils.getRegistryFileName(ontologyId, resolved, fileType)
        );
    }

    /**
     * Writes the content to a temporary sibling of the target and moves it in place.
     * Must be called while holding the lock.
     * @param content File content.
     * @param target Registry entry path.
     * @throws OntologyRegistryException If writing or moving fails.
     */
    private void publish(final byte[] content, final Path target) throws OntologyRegistryException {
        final Path temporary = target.resolveSibling(
            FileNameUtils.getTemporaryFileName(target.getFileName().toString())
        );
        try {
            Files.write(temporary, content);
        } catch (final IOException ex) {
            this.deleteQuietly(temporary);
            throw new OntologyRegistryException(
                Reason.UNABLE_TO_WRITE,
                String.format("Unable to write to temporary file '%s'", temporary),
                ex
            );
        }
        try {
            Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (final IOException ex) {
            this.deleteQuietly(temporary);
            throw new OntologyRegistryException(
                Reason.UNABLE_TO_RENAME,
                String.format("Unable to rename temporary file '%s'", temporary),
                ex
            );
        }
    }

    /**
     * Best effort removal of a temporary file after a failed write.
     * @param temporary Temporary file.
     */
    private void deleteQuietly(final Path temporary) {
        try {
            Files.deleteIfExists(temporary);
        } catch (final IOException ex) {
            this.log.warn(String.format("Could not delete temporary file %s", temporary), ex);
        }
    }
}
