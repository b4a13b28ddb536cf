package com.myorg.choirsplit.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * External correction of the lyric position dump, e.g. against a printed score.
 * Returns the corrected table in the same TSV layout, or empty when nothing was corrected.
 */
@FunctionalInterface
public interface LyricCorrector {

    Optional<Path> correct(Path lyricDump, Path referenceDocument) throws IOException;
}
