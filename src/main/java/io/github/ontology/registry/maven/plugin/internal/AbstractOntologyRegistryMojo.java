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

import io.github.ontology.registry.maven.plugin.internal.cache.FileSystemOntologyRegistry;
import io.github.ontology.registry.maven.plugin.internal.provider.BioRegistryMetadataProvider;
import io.github.ontology.registry.maven.plugin.internal.provider.DirectoryOntologyProvider;
import io.github.ontology.registry.maven.plugin.internal.provider.OboLibraryOntologyProvider;
import io.github.ontology.registry.maven.plugin.internal.provider.OntologyMetadataProvider;
import io.github.ontology.registry.maven.plugin.internal.provider.OntologyProvider;
import io.github.ontology.registry.maven.plugin.internal.provider.StaticMetadataProvider;
import java.io.File;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.maven.execution.MavenSession;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.shared.utils.StringUtils;
import org.eclipse.aether.repository.AuthenticationContext;
import org.eclipse.aether.repository.Proxy;
import org.eclipse.aether.repository.RemoteRepository;

/**
 * Common configuration of the ontology registry goals.
 */
public abstract class AbstractOntologyRegistryMojo extends AbstractMojo {

    /**
     * User agent sent to remote services.
     */
    private static final String USER_AGENT = "ontology-registry-maven-plugin";

    /**
     * Id of the ontology, e.g. {@code go} or {@code mondo}.
     */
    @Parameter(property = "ontology.id")
    protected String ontologyId;

    /**
     * Version of the ontology, or {@code latest} to ask the metadata service.
     */
    @Parameter(property = "ontology.version", defaultValue = "latest")
    protected String version = "latest";

    /**
     * File type of the ontology: JSON, OBO or OWL.
     */
    @Parameter(property = "ontology.fileType", defaultValue = "OWL")
    protected FileType fileType = FileType.OWL;

    /**
     * The directory to use as registry. Default is
     * ${local-repo}/.cache/ontology-registry
     */
    @Parameter(property = "ontology.registry.directory")
    protected File registryDirectory;

    /**
     * Bioregistry API used to resolve latest versions.
     */
    @Parameter(property = "ontology.metadata.url", defaultValue = BioRegistryMetadataProvider.DEFAULT_API_URL)
    protected String metadataUrl = BioRegistryMetadataProvider.DEFAULT_API_URL;

    /**
     * Base URL of the ontology release files.
     */
    @Parameter(property = "ontology.download.url", defaultValue = OboLibraryOntologyProvider.DEFAULT_BASE_URL)
    protected String downloadUrl = OboLibraryOntologyProvider.DEFAULT_BASE_URL;

    /**
     * Fixed ontology versions by id. When set, latest versions are looked up here
     * instead of asking the metadata service.
     */
    @Parameter(property = "ontology.versions")
    protected Map<String, String> versions = new HashMap<>();

    /**
     * Local directory laid out as {@code {id}/releases/{version}/{file}} used
     * instead of downloading.
     */
    @Parameter(property = "ontology.mirror.directory")
    protected File mirrorDirectory;

    /**
     * Read timeout for remote calls in milliseconds.
     */
    @Parameter(property = "ontology.readTimeOut", defaultValue = "3000")
    protected int readTimeOut = 3000;

    /**
     * Whether to follow redirects (301 Moved Permanently, 302 Found, 303 See Other).
     */
    @Parameter(property = "ontology.followRedirects", defaultValue = "true")
    protected boolean followRedirects = true;

    /**
     * Whether to skip execution of Mojo.
     */
    @Parameter(property = "ontology.skip", defaultValue = "false")
    protected boolean skip;

    @Parameter(defaultValue = "${session}", readonly = true)
    protected MavenSession session;

    @Override
    public final void execute() throws MojoExecutionException, MojoFailureException {
        if (this.skip) {
            getLog().info(String.format("ontology-registry:%s skipped", this.goal()));
            return;
        }
        this.execute(this.createRegistry());
    }

    /**
     * Runs the goal against the configured registry.
     * @param registry Registry.
     * @throws MojoExecutionException If the goal is misconfigured or an I/O error occurs.
     * @throws MojoFailureException If the registry operation fails.
     */
    protected abstract void execute(FileSystemOntologyRegistry registry)
        throws MojoExecutionException, MojoFailureException;

    /**
     * Goal name used in log messages.
     * @return Goal name.
     */
    protected abstract String goal();

    /**
     * Configured ontology id.
     * @return Ontology id.
     * @throws MojoExecutionException If no id is configured.
     */
    protected String requireOntologyId() throws MojoExecutionException {
        if (StringUtils.isBlank(this.ontologyId)) {
            throw new MojoExecutionException("ontologyId must be set");
        }
        return this.ontologyId.trim();
    }

    /**
     * Configured version selector.
     * @return Version selector.
     * @throws MojoExecutionException If the version is blank.
     */
    protected Version selectedVersion() throws MojoExecutionException {
        try {
            return Version.parse(this.version);
        } catch (final IllegalArgumentException ex) {
            throw new MojoExecutionException(ex.getMessage(), ex);
        }
    }

    /**
     * Creates the registry with the configured providers.
     * @return Registry.
     * @throws MojoFailureException If the registry directory is not a directory.
     */
    FileSystemOntologyRegistry createRegistry() throws MojoFailureException {
        if (this.registryDirectory == null) {
            this.registryDirectory = new File(
                this.session.getLocalRepository().getBasedir(), ".cache/ontology-registry"
            );
        } else if (this.registryDirectory.exists() && !this.registryDirectory.isDirectory()) {
            throw new MojoFailureException(
                "registryDirectory is not a directory: " + this.registryDirectory.getAbsolutePath()
            );
        }
        getLog().debug("Registry is: " + this.registryDirectory.getAbsolutePath());
        final OntologyMetadataProvider metadata;
        if (!this.hasConfiguredVersions()) {
            metadata = new BioRegistryMetadataProvider(
                this.metadataUrl, this.createRequester(this.metadataUrl), getLog()
            );
        } else {
            getLog().debug("Using configured versions " + this.versions);
            metadata = new StaticMetadataProvider(this.versions);
        }
        final OntologyProvider ontologies;
        if (this.mirrorDirectory == null) {
            ontologies = new OboLibraryOntologyProvider(
                this.downloadUrl, this.createRequester(this.downloadUrl), getLog()
            );
        } else {
            getLog().debug("Using mirror " + this.mirrorDirectory.getAbsolutePath());
            ontologies = new DirectoryOntologyProvider(this.mirrorDirectory.toPath(), getLog());
        }
        return new FileSystemOntologyRegistry(
            this.registryDirectory.toPath(), metadata, ontologies, getLog()
        );
    }

    /**
     * Whether versions are pinned through {@link #versions} instead of being looked up remotely.
     * @return True if versions are configured.
     */
    protected boolean hasConfiguredVersions() {
        return this.versions != null && !this.versions.isEmpty();
    }

    /**
     * Creates the HTTP transport for one remote source, using the proxy the Maven session
     * selects for that source's URL.
     * @param baseUrl Base URL of the remote source.
     * @return HTTP transport.
     */
    private HttpResourceRequester createRequester(final String baseUrl) {
        final HttpResourceRequester.Builder builder = new HttpResourceRequester.Builder()
            .withConnectTimeout(this.readTimeOut)
            .withSocketTimeout(this.readTimeOut)
            .withRedirectsEnabled(this.followRedirects)
            .withHeader("User-Agent", USER_AGENT)
            .withLog(getLog());
        if (this.session != null && this.session.getRepositorySession() != null) {
            final RemoteRepository repository = new RemoteRepository.Builder(
                null, "default", baseUrl
            ).build();
            Optional.ofNullable(this.session.getRepositorySession().getProxySelector())
                .map(selector -> selector.getProxy(repository))
                .ifPresent(proxy -> this.addProxy(builder, repository, proxy));
        }
        return builder.build();
    }

    private void addProxy(final HttpResourceRequester.Builder builder,
                          final RemoteRepository repository,
                          final Proxy proxy) {
        builder.withProxyHost(proxy.getHost());
        builder.withProxyPort(proxy.getPort());

        final RemoteRepository proxyRepo = new RemoteRepository.Builder(repository)
                .setProxy(proxy)
                .build();

        try (AuthenticationContext ctx = AuthenticationContext.forProxy(
                this.session.getRepositorySession(), proxyRepo)) {
            if (ctx != null) {
                builder.withProxyUserName(ctx.get(AuthenticationContext.USERNAME));
                builder.withProxyPassword(ctx.get(AuthenticationContext.PASSWORD));
                builder.withNtlmDomain(ctx.get(AuthenticationContext.NTLM_DOMAIN));
                builder.withNtlmHost(ctx.get(AuthenticationContext.NTLM_WORKSTATION));
            }
        }
    }
}
