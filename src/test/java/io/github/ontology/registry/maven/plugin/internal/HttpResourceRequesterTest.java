package io.github.ontology.registry.maven.plugin.internal;

import com.github.tomakehurst.wiremock.junit.WireMockRule;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;
import org.junit.Rule;
import org.junit.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

/**
 * Unit tests for {@link HttpResourceRequester}
 */
public class HttpResourceRequesterTest {
    @Rule
    public WireMockRule wireMock = new WireMockRule(options().dynamicPort());
    private final static Log LOG = new SystemStreamLog();

    private HttpResourceRequester.Builder createRequesterBuilder() {
        return new HttpResourceRequester.Builder()
                .withConnectTimeout(3000)
                .withSocketTimeout(3000)
                .withLog(LOG);
    }

    private URI uri(String path) {
        return URI.create(this.wireMock.baseUrl() + path);
    }

    @Test
    public void testGet() throws Exception {
        this.wireMock.stubFor(get(urlEqualTo("/hello"))
                .willReturn(ok().withBody("Hello, world!")));

        byte[] body = createRequesterBuilder().build().get(uri("/hello"));

        assertThat(new String(body, StandardCharsets.UTF_8), is("Hello, world!"));
    }

    @Test
    public void testHeadersAreSent() throws Exception {
        this.wireMock.stubFor(get(anyUrl())
                .withHeader("User-Agent", equalTo("ontology-test"))
                .willReturn(ok().withBody("ok")));

        byte[] body = createRequesterBuilder()
                .withHeader("User-Agent", "ontology-test")
                .build()
                .get(uri("/agent"));

        assertThat(new String(body, StandardCharsets.UTF_8), is("ok"));
    }

    /**
     * Error responses shall be reported with their status code.
     */
    @Test
    public void testErrorStatus() {
        this.wireMock.stubFor(get(anyUrl()).willReturn(forbidden()));

        RemoteResourceException ex = assertThrows(RemoteResourceException.class,
                () -> createRequesterBuilder().build().get(uri("/secret")));

        assertThat(ex.getHttpCode(), is(403));
    }

    @Test
    public void testRedirectNotFollowed() {
        this.wireMock.stubFor(get(urlEqualTo("/old"))
                .willReturn(aResponse().withStatus(302).withHeader("Location", "/new")));

        RemoteResourceException ex = assertThrows(RemoteResourceException.class,
                () -> createRequesterBuilder().withRedirectsEnabled(false).build().get(uri("/old")));

        assertThat(ex.getHttpCode(), is(302));
    }

    @Test
    public void testRedirectFollowed() throws Exception {
        this.wireMock.stubFor(get(urlEqualTo("/old"))
                .willReturn(aResponse().withStatus(302).withHeader("Location", "/new")));
        this.wireMock.stubFor(get(urlEqualTo("/new"))
                .willReturn(ok().withBody("moved")));

        byte[] body = createRequesterBuilder().withRedirectsEnabled(true).build().get(uri("/old"));

        assertThat(new String(body, StandardCharsets.UTF_8), is("moved"));
    }
}
