package com.assetpack.exporter.integration;

import com.assetpack.exporter.export.ExportConfig;
import com.assetpack.exporter.export.ExportResult;
import com.assetpack.exporter.export.ExportService;
import com.assetpack.exporter.export.UnpackService;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for exporting a project and unpacking the result.
 */
class ExportIntegrationTest {

    @TempDir
    Path tempDir;

    @Test
    void testExportAndUnpackScene() throws IOException {
        Path project = tempDir.resolve("Game");

        // Scene -> prefab -> material -> texture, plus a shader pulled in by the material
        write(project, "Assets/Scenes/Main.unity", """
                %YAML 1.1
                --- !u!1001 &100100000
                PrefabInstance:
                  m_SourcePrefab: {fileID: 100100000, guid: 10000000000000000000000000000002, type: 3}
                """, "10000000000000000000000000000001");
        write(project, "Assets/Prefabs/Hero.prefab", """
                MeshRenderer:
                  m_Materials:
                  - {fileID: 2100000, guid: 10000000000000000000000000000003, type: 2}
                """, "10000000000000000000000000000002");
        write(project, "Assets/Materials/Hero.mat", """
                Material:
                  m_Shader: {fileID: 4800000, guid: 10000000000000000000000000000005, type: 3}
                  m_Texture: {fileID: 2800000, guid: 10000000000000000000000000000004, type: 3}
                  m_Builtin: {fileID: 10303, guid: 0000000000000000f000000000000000, type: 0}
                """, "10000000000000000000000000000003");
        writeBinary(project, "Assets/Textures/Hero.png", "10000000000000000000000000000004");
        write(project, "Assets/Shaders/Hero.shader", "Shader \"Hero\" {}\n", "10000000000000000000000000000005");
        write(project, "Assets/Unused/Other.mat", "Material:\n", "10000000000000000000000000000006");

        Path output = tempDir.resolve("Main.unitypackage");
        ExportResult result = new ExportService(ExportConfig.builder()
                .source(project)
                .output(output)
                .assetPattern("Assets/Scenes/*.unity")
                .excludePatterns(ExportConfig.DEFAULT_EXCLUDE_PATTERNS)
                .build()).export();

        assertThat(result.getFilesMatched()).isEqualTo(1);
        assertThat(result.getAssetsWritten()).isEqualTo(5);
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getWarnings()).isEmpty();

        Path restored = tempDir.resolve("restored");
        int unpacked = new UnpackService().unpack(output, restored);

        assertThat(unpacked).isEqualTo(5);
        assertThat(restored.resolve("Assets/Scenes/Main.unity")).exists();
        assertThat(restored.resolve("Assets/Prefabs/Hero.prefab")).exists();
        assertThat(restored.resolve("Assets/Materials/Hero.mat")).exists();
        assertThat(restored.resolve("Assets/Shaders/Hero.shader.meta")).exists();
        assertThat(restored.resolve("Assets/Unused/Other.mat")).doesNotExist();
        assertThat(Files.readAllBytes(restored.resolve("Assets/Textures/Hero.png")))
                .isEqualTo(Files.readAllBytes(project.resolve("Assets/Textures/Hero.png")));
    }

    private static void write(Path root, String relative, String content, String guid) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        Files.writeString(root.resolve(relative + ".meta"), "fileFormatVersion: 2\nguid: " + guid + "\n");
    }

    private static void writeBinary(Path root, String relative, String guid) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        byte[] png = new byte[2048];
        for (int i = 0; i < png.length; i++) {
            png[i] = (byte) (i % 251);
        }
        Files.write(file, png);
        Files.writeString(root.resolve(relative + ".meta"), "fileFormatVersion: 2\nguid: " + guid + "\n");
    }
}
