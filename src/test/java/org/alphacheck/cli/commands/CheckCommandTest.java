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

/**
 * Tests for the check command: output lines and exit codes.
 */
@Tag("unit")
class CheckCommandTest {

    @TempDir
    Path tempDir;

    private Path configFile;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        configFile = tempDir.resolve("alphacheck.conf");
        Files.writeString(configFile, "alphacheck.assets = []\n");
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        String[] full = new String[args.length + 3];
        full[0] = "-c";
        full[1] = configFile.toString();
        full[2] = "check";
        System.arraycopy(args, 0, full, 3, args.length);
        return cmdLine.execute(full);
    }

    private Path write(String name, byte[] content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, content);
        return file;
    }

    @Test
    void testCommandRegistered() {
        assertThat(CommandLineInterface.createCommandLine().getSubcommands()).containsKeys("check", "inspect");
    }

    @Test
    void testAllAssetsTransparent_exitsZero() throws Exception {
        Path a = write("a.png", PngTestImages.rgbaPixel(0));
        Path b = write("b.png", PngTestImages.indexed(1, 1, new byte[]{(byte) 128}));

        int exitCode = run(a.toString(), b.toString());

        assertThat(exitCode)
            .describedAs("stderr: %s, stdout: %s", err, out)
            .isEqualTo(0);
        assertThat(out.toString()).contains("Asset transparency check passed for 2 required assets.");
    }

    @Test
    void testFailures_listedInInputOrder_exitsOne() throws Exception {
        Path missing = tempDir.resolve("missing.png");
        Path opaque = write("opaque.png", PngTestImages.rgbaPixel(255));
        Path good = write("good.png", PngTestImages.rgbaPixel(1));
        Path broken = write("broken.png", new byte[]{1, 2, 3});

        int exitCode = run(missing.toString(), opaque.toString(), good.toString(), broken.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString().lines()).containsExactly(
            "Asset transparency check failed:",
            "- Missing asset file: " + missing,
            "- No transparent pixels found in " + opaque,
            "- Failed to validate " + broken + ": not a PNG file (signature mismatch)");
    }

    @Test
    void testConfiguredAssets_resolvedAgainstBaseDir() throws Exception {
        write("icons/32x32.png", PngTestImages.rgbaPixel(0));
        write("icons/logo.png", PngTestImages.rgbaPixel(255));
        Files.writeString(configFile, """
            alphacheck.assets = ["icons/32x32.png", "icons/logo.png"]
            """);

        int exitCode = run("--base-dir", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("- No transparent pixels found in " + tempDir.resolve("icons/logo.png"));
        assertThat(out.toString()).doesNotContain("32x32");
    }

    @Test
    void testConfiguredBaseDir_usedWithoutOption() throws Exception {
        write("icons/32x32.png", PngTestImages.rgbaPixel(0));
        Files.writeString(configFile, "alphacheck.base-dir = \"" + tempDir.toString().replace("\\", "\\\\") + "\"\n"
            + "alphacheck.assets = [\"icons/32x32.png\"]\n");

        int exitCode = run();

        assertThat(exitCode).describedAs("stderr: %s", err).isEqualTo(0);
        assertThat(out.toString()).contains("passed for 1 required assets");
    }

    @Test
    void testNoAssets_isUsageError() {
        int exitCode = run();

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("No assets to check");
    }

    @Test
    void testPaletteModeOption_switchesIndexedVerdict() throws Exception {
        // entry 0 is transparent, but only entry 1 is referenced
        byte[] png = PngTestImages.builder(1, 1, 3).raster(new byte[]{1}).trns(new byte[]{0, (byte) 255}).build();
        Path icon = write("icon.png", png);

        assertThat(run(icon.toString())).isEqualTo(0);
        assertThat(run("--palette-mode", "pixels", icon.toString())).isEqualTo(1);
    }

    @Test
    void testInvalidThreads_isUsageError() throws Exception {
        Path icon = write("icon.png", PngTestImages.rgbaPixel(0));

        assertThat(run("--threads", "0", icon.toString())).isEqualTo(2);
    }

    @Test
    void testParallelThreads_sameResult() throws Exception {
        Path a = write("a.png", PngTestImages.rgbaPixel(0));
        Path b = write("b.png", PngTestImages.rgbaPixel(255));

        int exitCode = run("--threads", "2", a.toString(), b.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString().lines()).containsExactly(
            "Asset transparency check failed:",
            "- No transparent pixels found in " + b);
    }

    @Test
    void testMissingConfigFile_reportsError() throws Exception {
        configFile = tempDir.resolve("nope.conf");
        Path icon = write("icon.png", PngTestImages.rgbaPixel(0));

        int exitCode = run(icon.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Configuration file not found");
    }
}
