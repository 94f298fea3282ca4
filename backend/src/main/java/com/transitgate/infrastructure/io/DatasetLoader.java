package com.transitgate.infrastructure.io;

import com.transitgate.domain.dataset.model.Dataset;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads one tabular file into a {@link Dataset}, rows in file order.
 */
public interface DatasetLoader {

    boolean supports(Path path);

    /**
     * @throws DatasetLoadException if the file is missing, unreadable or malformed
     */
    Dataset load(Path path, String name);

    static String extensionOf(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static String baseNameOf(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }
}
