package org.alphacheck.check;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.alphacheck.png.PngDecodeException;
import org.alphacheck.png.PngTransparencyDecoder;
import org.alphacheck.png.alpha.PaletteCheckMode;
import org.alphacheck.png.stream.ZlibDecompressor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Checks that a list of required PNG assets exist and contain transparent pixels.
 * <p>
 * Each asset is evaluated independently: a missing, unreadable or malformed file produces a
 * failing {@link AssetReport} and never stops evaluation of the remaining assets. With more
 * than one thread the assets are decoded on a fixed pool; reports always come back in the
 * order the assets were given.
 * <p>
 * Configuration (under {@code alphacheck}):
 * <ul>
 *   <li>{@code threads}: worker threads, default 1</li>
 *   <li>{@code palette-mode}: {@code TABLE} or {@code PIXELS}</li>
 *   <li>{@code decoder.max-inflated-bytes}: cap on inflated image data per asset</li>
 * </ul>
 */
public class AssetCheckService {

    private static final Logger log = LoggerFactory.getLogger(AssetCheckService.class);

    private final PngTransparencyDecoder decoder;
    private final int threads;

    /**
     * Creates a service from the {@code alphacheck} configuration block.
     *
     * @param config resolved application config
     */
    public AssetCheckService(Config config) {
        this(new PngTransparencyDecoder(
                new ZlibDecompressor(config.getBytes("alphacheck.decoder.max-inflated-bytes")),
                config.getEnum(PaletteCheckMode.class, "alphacheck.palette-mode")),
            config.getInt("alphacheck.threads"));
    }

    /**
     * @param decoder decoder shared by all workers
     * @param threads number of worker threads (must be &gt;= 1)
     * @throws IllegalArgumentException if {@code threads} is less than 1
     */
    public AssetCheckService(PngTransparencyDecoder decoder, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got: " + threads);
        }
        this.decoder = decoder;
        this.threads = threads;
    }

    /**
     * Checks all assets.
     *
     * @param assets asset paths, checked and reported in this order
     * @return one report per asset
     */
    public CheckSummary check(List<Path> assets) {
        if (threads == 1 || assets.size() <= 1) {
            List<AssetReport> reports = new ArrayList<>(assets.size());
            for (Path asset : assets) {
                reports.add(checkAsset(asset));
            }
            return new CheckSummary(reports);
        }
        return checkParallel(assets);
    }

    private CheckSummary checkParallel(List<Path> assets) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, assets.size()));
        try {
            List<Future<AssetReport>> futures = new ArrayList<>(assets.size());
            for (Path asset : assets) {
                futures.add(executor.submit(() -> checkAsset(asset)));
            }

            List<AssetReport> reports = new ArrayList<>(assets.size());
            for (int i = 0; i < futures.size(); i++) {
                reports.add(await(futures.get(i), assets.get(i)));
            }
            return new CheckSummary(reports);
        } finally {
            executor.shutdownNow();
        }
    }

    private AssetReport await(Future<AssetReport> future, Path asset) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AssetReport.failed(asset, null, "interrupted");
        } catch (ExecutionException e) {
            log.warn("Unexpected failure checking {}: {}", asset, e.getCause().toString());
            log.debug("Stack trace:", e.getCause());
            return AssetReport.failed(asset, null, e.getCause().toString());
        }
    }

    /**
     * Checks a single asset. Never throws for bad input; every problem becomes a report.
     *
     * @param asset path of the PNG file
     * @return the asset's report
     */
    public AssetReport checkAsset(Path asset) {
        if (!Files.exists(asset)) {
            log.warn("Missing asset file: {}", asset);
            return AssetReport.missing(asset);
        }

        try {
            byte[] data = Files.readAllBytes(asset);
            boolean transparent = decoder.hasTransparency(data);
            log.debug("{}: {} bytes, transparent={}", asset, data.length, transparent);
            return transparent ? AssetReport.transparent(asset) : AssetReport.opaque(asset);
        } catch (PngDecodeException e) {
            log.warn("Failed to decode {} ({}): {}", asset, e.getKind(), e.getMessage());
            return AssetReport.failed(asset, e.getKind(), e.getMessage());
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", asset, e.getMessage());
            return AssetReport.failed(asset, null, "I/O error: " + e.getMessage());
        }
    }
}
