package com.di.mllogs.loader;

import com.di.mllogs.exception.DataSourceException;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.io.FileSystems;
import org.apache.beam.sdk.io.fs.EmptyMatchTreatment;
import org.apache.beam.sdk.io.fs.MatchResult;

import java.io.IOException;

/**
 * Eager checks on input paths so that a missing file fails when the load is requested,
 * not somewhere inside the running pipeline.
 */
@Slf4j
final class InputPaths {

    private InputPaths() {}

    /**
     * Verifies that {@code path} (a file or glob) matches at least one file.
     *
     * @return number of matched files
     * @throws DataSourceException if the path is blank, matches nothing or cannot be listed
     */
    static int requireMatch(String path, String description) {
        if (path == null || path.isBlank()) {
            throw new DataSourceException(description + " path cannot be null or blank");
        }
        MatchResult match;
        try {
            match = FileSystems.match(path, EmptyMatchTreatment.DISALLOW);
        } catch (IOException e) {
            throw new DataSourceException("Cannot list " + description + " path: " + path, e);
        }
        if (match.status() != MatchResult.Status.OK) {
            throw new DataSourceException(String.format(
                    "%s path not found: %s (status=%s)", description, path, match.status()));
        }
        try {
            int files = match.metadata().size();
            log.info("{} path {} matched {} file(s)", description, path, files);
            return files;
        } catch (IOException e) {
            throw new DataSourceException("Cannot read " + description + " path: " + path, e);
        }
    }
}
