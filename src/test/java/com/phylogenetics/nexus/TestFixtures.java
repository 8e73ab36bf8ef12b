package com.phylogenetics.nexus;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

/**
 * Locates NEXUS files under src/test/resources.
 */
public final class TestFixtures {

    private TestFixtures() {
        // Utility class
    }

    public static Path fixture(String name) {
        URL url = TestFixtures.class.getResource("/" + name);
        if (url == null) {
            throw new IllegalArgumentException("No test resource " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Bad resource URL " + url, e);
        }
    }
}
