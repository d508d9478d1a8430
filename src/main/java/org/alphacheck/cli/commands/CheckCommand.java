package org.alphacheck.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.alphacheck.check.AssetCheckService;
import org.alphacheck.check.AssetReport;
import org.alphacheck.check.CheckSummary;
import org.alphacheck.cli.CommandLineInterface;
import org.alphacheck.png.PngTransparencyDecoder;
import org.alphacheck.png.alpha.PaletteCheckMode;
import org.alphacheck.png.stream.ZlibDecompressor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that fails unless every required PNG asset contains transparent pixels.
 * <p>
 * Assets come from the positional arguments, or from {@code alphacheck.assets} (resolved
 * against {@code alphacheck.base-dir}) when none are given. Every asset is checked even
 * after a failure; the exit code is 1 if any asset is missing, undecodable or fully opaque.
 */
@Command(
    name = "check",
    description = "Verify that required PNG assets exist and contain transparent pixels"
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(
        paramLabel = "ASSET",
        arity = "0..*",
        description = "PNG files to check (default: alphacheck.assets from the configuration)"
    )
    private List<Path> assets = new ArrayList<>();

    @Option(
        names = {"--base-dir"},
        description = "Directory configured asset paths are relative to (default: alphacheck.base-dir)"
    )
    private Path baseDir;

    @Option(
        names = {"--palette-mode"},
        description = "How indexed images are judged: ${COMPLETION-CANDIDATES} (default: alphacheck.palette-mode)"
    )
    private PaletteCheckMode paletteMode;

    @Option(
        names = {"--threads"},
        description = "Number of assets decoded in parallel (default: alphacheck.threads)"
    )
    private Integer threads;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            List<Path> targets = resolveAssets(config);
            if (targets.isEmpty()) {
                throw new ParameterException(spec.commandLine(),
                    "No assets to check: pass ASSET arguments or configure alphacheck.assets");
            }

            AssetCheckService service = createService(config);
            CheckSummary summary = service.check(targets);

            if (!summary.passed()) {
                out.println("Asset transparency check failed:");
                for (AssetReport failure : summary.failures()) {
                    out.println("- " + failure.describeFailure());
                }
                out.flush();
                return 1;
            }

            out.printf("Asset transparency check passed for %d required assets.%n", targets.size());
            out.flush();
            return 0;

        } catch (ParameterException e) {
            throw e;
        } catch (Exception e) {
            log.error("Check failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private List<Path> resolveAssets(Config config) {
        if (!assets.isEmpty()) {
            return assets;
        }
        Path base = baseDir != null ? baseDir : Path.of(config.getString("alphacheck.base-dir"));
        List<Path> resolved = new ArrayList<>();
        for (String asset : config.getStringList("alphacheck.assets")) {
            resolved.add(base.resolve(asset));
        }
        return resolved;
    }

    private AssetCheckService createService(Config config) {
        if (paletteMode == null && threads == null) {
            return new AssetCheckService(config);
        }
        PaletteCheckMode mode = paletteMode != null
            ? paletteMode
            : config.getEnum(PaletteCheckMode.class, "alphacheck.palette-mode");
        int workers = threads != null ? threads : config.getInt("alphacheck.threads");
        if (workers < 1) {
            throw new ParameterException(spec.commandLine(), "--threads must be >= 1, got: " + workers);
        }
        PngTransparencyDecoder decoder = new PngTransparencyDecoder(
            new ZlibDecompressor(config.getBytes("alphacheck.decoder.max-inflated-bytes")), mode);
        return new AssetCheckService(decoder, workers);
    }
}
