package com.insighthub.report.domain.model;

import java.nio.file.Path;

/**
 * Handle to an already rendered raster (a chart written to disk by the analysis step).
 * The layout core never opens the file; only the canvas does.
 */
public record ImageSource(Path path) {

    public ImageSource {
        if (path == null) {
            throw new IllegalArgumentException("Image path is required.");
        }
    }

    public static ImageSource of(String path) {
        return new ImageSource(Path.of(path));
    }

    public String displayName() {
        Path fileName = path.getFileName();
        return fileName != null ? fileName.toString() : path.toString();
    }
}
