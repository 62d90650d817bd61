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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Registry record returned by the Bioregistry API, reduced to the fields we read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
final class BioRegistryResource {

    @JsonProperty("prefix")
    private String prefix;

    @JsonProperty("name")
    private String name;

    @JsonProperty("version")
    private String version;

    @JsonProperty("download_owl")
    private String downloadOwl;

    @JsonProperty("download_obo")
    private String downloadObo;

    @JsonProperty("download_json")
    private String downloadJson;

    String getPrefix() {
        return this.prefix;
    }

    String getName() {
        return this.name;
    }

    String getVersion() {
        return this.version;
    }

    String getDownloadOwl() {
        return this.downloadOwl;
    }

    String getDownloadObo() {
        return this.downloadObo;
    }

    String getDownloadJson() {
        return this.downloadJson;
    }
}
