package com.assetpack.exporter.dependency;

import com.assetpack.exporter.model.ExportDiagnostics;
import com.assetpack.exporter.util.ParallelRunner;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AssetIndex.
 */
class AssetIndexTest {

    private static final String MATERIAL_GUID = "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaa01";
    private static final String TEXTURE_GUID = "bbbbbbbbbbbbbbbbbbbbbbbbbbbbbb02";
    private static final String MISSING_GUID = "cccccccccccccccccccccccccccccc03";

    @TempDir
    Path tempDir;

    private ParallelRunner runner;
    private ExportDiagnostics diagnostics;
    private AssetIndex index;

    @BeforeEach
    void setUp() {
        runner = new ParallelRunner(4);
        diagnostics = new ExportDiagnostics();
        index = new AssetIndex(runner, diagnostics);
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    @Test
    void testIndexFileByAssetOrMetaPath() throws IOException {
        Path material = asset("Player.mat", MATERIAL_GUID, "");
        Path texture = asset("Player.png", TEXTURE_GUID, "");

        index.indexFile(material);
        index.indexFile(texture.resolveSibling("Player.png.meta"));

        assertThat(index.fileForGuid(MATERIAL_GUID)).contains(material);
        assertThat(index.fileForGuid(TEXTURE_GUID)).contains(texture);
        assertThat(index.fileForGuid(MISSING_GUID)).isEmpty();
        assertThat(index.fileForGuid(null)).isEmpty();
    }

    @Test
    void testIndexFilesConcurrently() throws IOException {
        List<Path> metaFiles = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            String guid = String.format("%032x", i + 1);
            asset("Asset" + i + ".asset", guid, "");
            metaFiles.add(tempDir.resolve("Asset" + i + ".asset.meta"));
        }

        index.indexFiles(metaFiles);

        assertThat(index.size()).isEqualTo(200);
        assertThat(index.fileForGuid(String.format("%032x", 200))).contains(tempDir.resolve("Asset199.asset"));
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void testDirectReferencesResolveAndDeduplicate() throws IOException {
        Path material = asset("Player.mat", MATERIAL_GUID, "");
        Path prefab = asset("Player.prefab", "dddddddddddddddddddddddddddddd04", """
                m_Materials:
                - {fileID: 2100000, guid: %s, type: 2}
                - {fileID: 2100000, guid: %s, type: 2}
                """.formatted(MATERIAL_GUID, MATERIAL_GUID));
        index.indexFiles(List.of(material, prefab));

        assertThat(index.directReferencesOf(prefab)).containsExactly(material);
    }

    @Test
    void testDanglingReferenceIsDropped() throws IOException {
        Path prefab = asset("Player.prefab", "dddddddddddddddddddddddddddddd04", """
                m_Script: {fileID: 11500000, guid: %s, type: 3}
                """.formatted(MISSING_GUID));
        index.indexFiles(List.of(prefab));

        assertThat(index.directReferencesOf(prefab)).isEmpty();
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void testMissingMetaIsNotAnError() throws IOException {
        Path orphan = tempDir.resolve("Orphan.asset");
        Files.writeString(orphan, "data");

        index.indexFiles(List.of(orphan));

        assertThat(index.size()).isEqualTo(1);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void testReferencesOfMissingFileAreEmpty() {
        assertThat(index.directReferencesOf(tempDir.resolve("Nope.prefab"))).isEmpty();
    }

    private Path asset(String name, String guid, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        Files.writeString(tempDir.resolve(name + ".meta"), "fileFormatVersion: 2\nguid: " + guid + "\n");
        return file;
    }
}
