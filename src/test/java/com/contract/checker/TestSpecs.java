package com.contract.checker;

import com.contract.checker.model.Contract;
import com.contract.checker.processor.SpecificationLoader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads fixture specs from {@code src/test/resources/specs}.
 */
public final class TestSpecs {

    private TestSpecs() {
    }

    public static Path path(String name) {
        URL url = TestSpecs.class.getResource("/specs/" + name);
        if (url == null) {
            throw new IllegalArgumentException("No fixture spec: " + name);
        }
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static Contract load(String name) {
        try {
            return new SpecificationLoader().load(path(name), null);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Contract parse(String json) {
        return new SpecificationLoader().parse(json);
    }
}
