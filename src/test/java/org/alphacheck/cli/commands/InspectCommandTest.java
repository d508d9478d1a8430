package org.alphacheck.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.alphacheck.cli.CommandLineInterface;
import org.alphacheck.png.PngTestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

@Tag("unit")
class InspectCommandTest {

    @TempDir
    Path tempDir;

    private Path configFile;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        configFile = tempDir.resolve("alphacheck.conf");
        Files.writeString(configFile, "alphacheck.threads = 1\n");
        out = new StringWriter();
        err = new StringWriter();
    }

    private int inspect(Path file) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute("-c", configFile.toString(), "inspect", file.toString());
    }

    @Test
    void testTransparentRgba_printsHeaderAndChunks() throws Exception {
        Path file = tempDir.resolve("icon.png");
        Files.write(file, PngTestImages.rgbaPixel(0));

        int exitCode = inspect(file);

        assertThat(exitCode).describedAs("stderr: %s", err).isEqualTo(0);
        String output = out.toString();
        assertThat(output).contains("Size:         1x1");
        assertThat(output).contains("Bit depth:    8");
        assertThat(output).contains("Color model:  TRUECOLOR_ALPHA (type 6, 4 bytes/pixel)");
        assertThat(output).contains("Row length:   4 bytes");
        assertThat(output).contains("Chunks:       3\n".replace("\n", System.lineSeparator()));
        assertThat(output).contains("IHDR  offset=8");
        assertThat(output).contains("length=13");
        assertThat(output).contains("IEND");
        assertThat(output).contains("critical");
        assertThat(output).doesNotContain("ancillary");
        assertThat(output).doesNotContain("Palette:");
        assertThat(output).contains("Transparent:  yes");
    }

    @Test
    void testOpaqueWithoutIend_flagsMissingTerminator() throws Exception {
        Path file = tempDir.resolve("opaque.png");
        Files.write(file, PngTestImages.builder(2, 1, 2).raster(new byte[6]).withoutIend().build());

        int exitCode = inspect(file);

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("(no IEND)");
        assertThat(out.toString()).contains("Color model:  TRUECOLOR (type 2, 3 bytes/pixel)");
        assertThat(out.toString()).contains("Transparent:  no");
    }

    @Test
    void testUndecodableFile_reportsKindAndExitsOne() throws Exception {
        Path file = tempDir.resolve("deep.png");
        Files.write(file, PngTestImages.builder(1, 1, 6).bitDepth(16).raster(new byte[4]).build());

        int exitCode = inspect(file);

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("UNSUPPORTED_FEATURE");
        assertThat(err.toString()).contains("unsupported bit depth: 16");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testMissingFile_reportsErrorAndExitsOne() {
        int exitCode = inspect(tempDir.resolve("absent.png"));

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString().trim()).isEqualTo("Error: File not found: " + tempDir.resolve("absent.png"));
    }

    @Test
    void testIndexedWithAncillaryChunk_printsPaletteAndChunkKinds() throws Exception {
        Path file = tempDir.resolve("indexed.png");
        Files.write(file, PngTestImages.builder(2, 2, 3)
            .raster(new byte[4])
            .trns(new byte[]{0})
            .build());

        int exitCode = inspect(file);

        assertThat(exitCode).describedAs("stderr: %s", err).isEqualTo(0);
        String output = out.toString();
        assertThat(output).contains("Palette:      2 entries");
        assertThat(output).containsPattern("tRNS\\s+offset=\\d+\\s+length=1\\s+ancillary");
        assertThat(output).containsPattern("PLTE\\s+offset=\\d+\\s+length=6\\s+critical");
        assertThat(output).contains("Transparent:  yes");
    }
}
