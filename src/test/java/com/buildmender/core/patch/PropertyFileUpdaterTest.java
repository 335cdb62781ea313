package com.buildmender.core.patch;

import com.buildmender.core.filesystem.FileSystemManager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PropertyFileUpdaterTest {

    @TempDir
    Path tempDir;

    private Path project;
    private PropertyFileUpdater updater;

    @BeforeEach
    void setUp() throws Exception {
        updater = new PropertyFileUpdater(new FileSystemManager(tempDir.toString()));
        project = Files.createDirectories(tempDir.resolve("demo"));
    }

    @Test
    void testCreatesMissingFile() throws Exception {
        boolean replaced = updater.setProperty(project, "guavaVersion", "33.0.0-jre");

        assertFalse(replaced);
        assertEquals("guavaVersion=33.0.0-jre\n", Files.readString(project.resolve("gradle.properties")));
    }

    @Test
    void testAppendsNewKey() throws Exception {
        Path properties = project.resolve("gradle.properties");
        Files.writeString(properties, "org.gradle.jvmargs=-Xmx2g");

        updater.setProperty(project, "guavaVersion", "33.0.0-jre");

        assertEquals("org.gradle.jvmargs=-Xmx2g\nguavaVersion=33.0.0-jre\n", Files.readString(properties));
    }

    @Test
    void testRewritesEveryDefinition() throws Exception {
        Path properties = project.resolve("gradle.properties");
        Files.writeString(properties, "guavaVersion = 31.0\nother=1\nguavaVersion:32.0\n");

        boolean replaced = updater.setProperty(project, "guavaVersion", "33.0.0-jre");

        assertTrue(replaced);
        assertEquals("guavaVersion=33.0.0-jre\nother=1\nguavaVersion=33.0.0-jre\n", Files.readString(properties));
    }

    @Test
    void testCommentsAndSimilarKeysUntouched() throws Exception {
        Path properties = project.resolve("gradle.properties");
        String original = "# guavaVersion=30.0\n! guavaVersion=29.0\nguavaVersionOld=28.0\n";
        Files.writeString(properties, original);

        updater.setProperty(project, "guavaVersion", "33.0.0-jre");

        assertEquals(original + "guavaVersion=33.0.0-jre\n", Files.readString(properties));
    }

    @Test
    void testWindowsLineEndingsKept() throws Exception {
        Path properties = project.resolve("gradle.properties");
        Files.writeString(properties, "a=1\r\nguavaVersion=1\r\n");

        updater.setProperty(project, "guavaVersion", "33.0.0-jre");

        assertEquals("a=1\r\nguavaVersion=33.0.0-jre\r\n", Files.readString(properties));
    }

    @Test
    void testAppendToWindowsFileUsesCrlf() throws Exception {
        Path properties = project.resolve("gradle.properties");
        Files.writeString(properties, "a=1\r\nb=2");

        updater.setProperty(project, "guavaVersion", "33.0.0-jre");

        assertEquals("a=1\r\nb=2\r\nguavaVersion=33.0.0-jre\r\n", Files.readString(properties));
    }

    @Test
    void testRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> updater.setProperty(project, " ", "1"));
        assertThrows(IllegalArgumentException.class, () -> updater.setProperty(project, "a=b", "1"));
        assertThrows(IllegalArgumentException.class, () -> updater.setProperty(project, "a", "1\n2"));
    }
}
