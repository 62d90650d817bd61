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

import java.util.Objects;
import javax.annotation.concurrent.Immutable;
import org.apache.maven.shared.utils.StringUtils;

/**
 * Version selector of an ontology: either the {@link #latest()} release,
 * to be resolved through metadata, or an already concrete declared version.
 */
@Immutable
public final class Version {

    /**
     * Literal used for the latest version.
     */
    private static final String LATEST = "latest";

    /**
     * The only latest instance.
     */
    private static final Version LATEST_VERSION = new Version(null);

    /**
     * Declared version, {@literal null} for the latest version.
     */
    private final String declared;

    /**
     * Constructor.
     * @param declared Declared version or {@literal null}.
     */
    private Version(final String declared) {
        this.declared = declared;
    }

    /**
     * Version selector that requires resolution.
     * @return Latest version selector.
     */
    public static Version latest() {
        return LATEST_VERSION;
    }

    /**
     * Concrete version selector.
     * @param version Version string, e.g. {@code 2024-01-04}.
     * @return Declared version selector.
     */
    public static Version declared(final String version) {
        return new Version(Objects.requireNonNull(version, "version"));
    }

    /**
     * Parses a textual version selector. The text {@code latest} (in any case)
     * selects the latest version, anything else is taken as declared.
     * @param text Version selector text.
     * @return Parsed version.
     * @throws IllegalArgumentException If the text is blank.
     */
    public static Version parse(final String text) {
        if (StringUtils.isBlank(text)) {
            throw new IllegalArgumentException("Version must not be blank");
        }
        final String trimmed = text.trim();
        final Version result;
        if (LATEST.equalsIgnoreCase(trimmed)) {
            result = Version.latest();
        } else {
            result = Version.declared(trimmed);
        }
        return result;
    }

    /**
     * Whether this selector has to be resolved.
     * @return True for the latest version.
     */
    public boolean isLatest() {
        return this.declared == null;
    }

    /**
     * Declared version string.
     * @return Declared version.
     * @throws IllegalStateException If called on the latest version.
     */
    public String getDeclared() {
        if (this.declared == null) {
            throw new IllegalStateException("Latest version has no declared value");
        }
        return this.declared;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Version)) {
            return false;
        }
        return Objects.equals(this.declared, ((Version) other).declared);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.declared);
    }

    @Override
    public String toString() {
        return this.isLatest() ? LATEST : this.declared;
    }
}
