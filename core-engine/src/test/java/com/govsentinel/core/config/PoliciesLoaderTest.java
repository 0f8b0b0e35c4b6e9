package com.govsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoliciesLoaderTest {

    @Test
    @DisplayName("Should load a replacement policy file")
    void shouldLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("policies.yml");
        Files.writeString(file, "policies:\n"
                + "  - family: aragon\n"
                + "    active: [open]\n"
                + "    terminal: [executed]\n");

        assertThat(PoliciesLoader.fromFile(file.toString()).families()).containsExactly("aragon");
    }

    @Test
    @DisplayName("Should fail fast on an invalid table")
    void shouldFailOnInvalidTable(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("policies.yml");
        Files.writeString(file, "policies:\n"
                + "  - family: broken\n"
                + "    active: [open]\n"
                + "    update: [open]\n"
                + "    terminal: [done]\n");

        assertThatThrownBy(() -> PoliciesLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("more than one set");
    }

    @Test
    @DisplayName("Should refuse a document with no policies")
    void shouldRefuseEmptyDocument(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("policies.yml");
        Files.writeString(file, "policies: []\n");

        assertThatThrownBy(() -> PoliciesLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class);
    }
}
