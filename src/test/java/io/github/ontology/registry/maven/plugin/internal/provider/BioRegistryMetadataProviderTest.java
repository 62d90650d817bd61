package io.github.ontology.registry.maven.plugin.internal.provider;

import com.github.tomakehurst.wiremock.junit.WireMockRule;
import io.github.ontology.registry.maven.plugin.internal.HttpResourceRequester;
import io.github.ontology.registry.maven.plugin.internal.OntologyMetadata;
import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException;
import io.github.ontology.registry.maven.plugin.internal.OntologyRegistryException.Reason;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;
import org.junit.Rule;
import org.junit.Test;

import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

/**
 * Unit tests for {@link BioRegistryMetadataProvider}
 */
public class BioRegistryMetadataProviderTest {
    @Rule
    public WireMockRule wireMock = new WireMockRule(options().dynamicPort());
    private final static Log LOG = new SystemStreamLog();
    private final static String MONDO = "{"
            + "\"prefix\": \"mondo\","
            + "\"name\": \"Mondo Disease Ontology\","
            + "\"version\": \"2024-01-04\","
            + "\"homepage\": \"https://monarch-initiative.github.io/mondo\","
            + "\"download_owl\": \"http://purl.obolibrary.org/obo/mondo.owl\","
            + "\"download_json\": \"http://purl.obolibrary.org/obo/mondo.json\","
            + "\"download_obo\": null"
            + "}";

    private BioRegistryMetadataProvider createProvider(String apiUrl) {
        return new BioRegistryMetadataProvider(apiUrl,
                new HttpResourceRequester.Builder().withLog(LOG).build(), LOG);
    }

    @Test
    public void testTrailingSlashIsAdded() {
        assertThat(createProvider("https://bioregistry.io/api").getApiUrl(), is("https://bioregistry.io/api/"));
        assertThat(createProvider("https://bioregistry.io/api/").getApiUrl(), is("https://bioregistry.io/api/"));
    }

    @Test
    public void testProvideMetadata() throws Exception {
        this.wireMock.stubFor(get(urlEqualTo("/registry/mondo"))
                .willReturn(okJson(MONDO)));

        OntologyMetadata metadata = createProvider(this.wireMock.baseUrl()).provideMetadata("mondo");

        assertThat(metadata.getOntologyId(), is("mondo"));
        assertThat(metadata.getVersion(), is("2024-01-04"));
        assertThat(metadata.getTitle(), is(Optional.of("Mondo Disease Ontology")));
        assertThat(metadata.getJsonFileLocation(), is(Optional.of("http://purl.obolibrary.org/obo/mondo.json")));
        assertThat(metadata.getOboFileLocation(), is(Optional.empty()));
    }

    @Test
    public void testMissingVersion() {
        this.wireMock.stubFor(get(urlEqualTo("/registry/chebi"))
                .willReturn(okJson("{\"prefix\": \"chebi\", \"name\": \"ChEBI\"}")));

        OntologyRegistryException ex = assertThrows(OntologyRegistryException.class,
                () -> createProvider(this.wireMock.baseUrl()).provideMetadata("chebi"));

        assertThat(ex.getReason(), is(Reason.PROVIDING_METADATA));
        assertThat(ex.getMessage(), containsString("Version not found"));
    }

    @Test
    public void testMalformedJson() {
        this.wireMock.stubFor(get(urlEqualTo("/registry/mondo"))
                .willReturn(ok().withBody("invalid json {")));

        OntologyRegistryException ex = assertThrows(OntologyRegistryException.class,
                () -> createProvider(this.wireMock.baseUrl()).provideMetadata("mondo"));

        assertThat(ex.getReason(), is(Reason.PROVIDING_METADATA));
        assertThat(ex.getMessage(), containsString("Cant convert to json"));
    }

    @Test
    public void testServerError() {
        this.wireMock.stubFor(get(urlEqualTo("/registry/mondo"))
                .willReturn(serverError().withBody("Internal Server Error")));

        OntologyRegistryException ex = assertThrows(OntologyRegistryException.class,
                () -> createProvider(this.wireMock.baseUrl()).provideMetadata("mondo"));

        assertThat(ex.getReason(), is(Reason.PROVIDING_METADATA));
        assertThat(ex.getMessage(), containsString("500"));
    }
}
