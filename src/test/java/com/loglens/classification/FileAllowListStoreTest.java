package com.loglens.classification;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileAllowListStoreTest {
    
    @TempDir
    Path folder;
    
    @Test
    void shouldMatchNormalizedMessagesPerSourceFile() throws IOException {
        // Given: an allow-list for app.log with a line carrying volatile values
        Files.writeString(folder.resolve("app.log"),
            "[{\"log\": \"[2024-03-01] cache refresh from 10.0.0.1 done\"}, {\"other\": \"ignored\"}]");
        FileAllowListStore store = new FileAllowListStore(folder, new ObjectMapper());
        
        // When/Then: the same line with other volatile values is allow-listed
        assertThat(store.isAllowListed("/var/input/app.log", "[2024-03-02] cache refresh from 192.168.1.7 done"))
            .isTrue();
        assertThat(store.isAllowListed("app.log", "cache refresh failed")).isFalse();
        assertThat(store.isAllowListed("other.log", "cache refresh from 10.0.0.1 done")).isFalse();
        assertThat(store.isAllowListed(null, "anything")).isFalse();
    }
    
    @Test
    void shouldTreatUnreadableFileAsEmpty() throws IOException {
        Files.writeString(folder.resolve("broken.log"), "{ not json");
        FileAllowListStore store = new FileAllowListStore(folder, new ObjectMapper());
        
        assertThat(store.isAllowListed("broken.log", "{ not json")).isFalse();
    }
}
