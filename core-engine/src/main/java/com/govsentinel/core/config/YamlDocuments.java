package com.govsentinel.core.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.function.Function;

/**
 * Shared file / classpath plumbing for the YAML loaders.
 */
final class YamlDocuments {

    private YamlDocuments() {
    }

    static <T> T parse(InputStream is, Class<T> type) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(type, options));
        return yaml.load(is);
    }

    static <R> R fromFile(String path, String what, Function<InputStream, R> reader) {
        Objects.requireNonNull(path, what + " file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return reader.apply(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException(what + " file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + what + " file: " + path, e);
        }
    }

    static <R> R fromClasspath(String resource, Function<InputStream, R> reader) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = YamlDocuments.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return reader.apply(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }
}
