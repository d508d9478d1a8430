package org.alphacheck.check;

import java.nio.file.Path;

import org.alphacheck.png.ErrorKind;

/**
 * Result of checking one asset.
 *
 * @param path      the asset path as configured
 * @param status    outcome
 * @param errorKind decode failure category, or {@code null} unless {@code status == FAILED}
 *                  and the failure came from the decoder
 * @param message   error message, or {@code null} unless {@code status == FAILED}
 */
public record AssetReport(Path path, AssetStatus status, ErrorKind errorKind, String message) {

    static AssetReport transparent(Path path) {
        return new AssetReport(path, AssetStatus.TRANSPARENT, null, null);
    }

    static AssetReport opaque(Path path) {
        return new AssetReport(path, AssetStatus.OPAQUE, null, null);
    }

    static AssetReport missing(Path path) {
        return new AssetReport(path, AssetStatus.MISSING, null, null);
    }

    static AssetReport failed(Path path, ErrorKind kind, String message) {
        return new AssetReport(path, AssetStatus.FAILED, kind, message);
    }

    public boolean passed() {
        return status.passed();
    }

    /**
     * @return the line printed for a failing asset; {@code null} for a passing one
     */
    public String describeFailure() {
        return switch (status) {
            case TRANSPARENT -> null;
            case OPAQUE -> "No transparent pixels found in " + path;
            case MISSING -> "Missing asset file: " + path;
            case FAILED -> "Failed to validate " + path + ": " + message;
        };
    }
}
