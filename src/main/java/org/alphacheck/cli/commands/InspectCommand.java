package org.alphacheck.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.alphacheck.cli.CommandLineInterface;
import org.alphacheck.png.DecodedImage;
import org.alphacheck.png.PngDecodeException;
import org.alphacheck.png.PngTransparencyDecoder;
import org.alphacheck.png.alpha.PaletteCheckMode;
import org.alphacheck.png.chunk.Chunk;
import org.alphacheck.png.chunk.ImageHeader;
import org.alphacheck.png.stream.ZlibDecompressor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that prints the header, chunk layout and transparency verdict of one PNG file.
 */
@Command(
    name = "inspect",
    description = "Print the header, chunks and transparency of a PNG file"
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectCommand.class);

    @Parameters(index = "0", paramLabel = "FILE", description = "PNG file to inspect")
    private Path file;

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
            PngTransparencyDecoder decoder = new PngTransparencyDecoder(
                new ZlibDecompressor(config.getBytes("alphacheck.decoder.max-inflated-bytes")),
                config.getEnum(PaletteCheckMode.class, "alphacheck.palette-mode"));

            DecodedImage image = decoder.decode(Files.readAllBytes(file));
            ImageHeader header = image.header();

            out.printf("File:         %s%n", file);
            out.printf("Size:         %dx%d%n", header.width(), header.height());
            out.printf("Bit depth:    %d%n", header.bitDepth());
            out.printf("Color model:  %s (type %d, %d bytes/pixel)%n",
                header.colorModel(), header.colorModel().code(), header.colorModel().bytesPerPixel());
            out.printf("Row length:   %d bytes%n", header.rowLength());
            out.printf("Chunks:       %d%s%n", image.chunks().chunks().size(),
                image.chunks().isTerminated() ? "" : " (no IEND)");
            for (Chunk chunk : image.chunks().chunks()) {
                out.printf("  %-4s  offset=%-8d length=%-8d %s%n", chunk.type(), chunk.offset(), chunk.length(),
                    chunk.isCritical() ? "critical" : "ancillary");
            }
            image.chunks().last(Chunk.PLTE).ifPresent(palette ->
                out.printf("Palette:      %d entries%n", palette.length() / 3));
            out.printf("Transparent:  %s%n", image.hasTransparency() ? "yes" : "no");
            out.flush();
            return 0;

        } catch (NoSuchFileException e) {
            err.println("Error: File not found: " + file);
            err.flush();
            return 1;
        } catch (PngDecodeException e) {
            log.debug("Decode of {} failed", file, e);
            err.printf("Error: %s (%s): %s%n", file, e.getKind(), e.getMessage());
            err.flush();
            return 1;
        } catch (Exception e) {
            log.error("Inspect failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
