package com.di.mllogs.sink;

import org.apache.beam.sdk.io.Compression;
import org.apache.beam.sdk.io.FileIO;
import org.apache.beam.sdk.transforms.windowing.BoundedWindow;
import org.apache.beam.sdk.transforms.windowing.PaneInfo;

/**
 * Names output shards {@code <column>=<value>/part-SSSSS-of-NNNNN.parquet}, relative to the
 * output directory.
 */
public class PartitionFileNaming implements FileIO.Write.FileNaming {

    /** Partition value used for a null key, as Hive-style readers expect. */
    public static final String NULL_PARTITION = "__HIVE_DEFAULT_PARTITION__";

    private final String directory;

    public PartitionFileNaming(String directory) {
        this.directory = directory;
    }

    /** Directory name of one partition, e.g. {@code metricId=0}. */
    public static String partitionDirectory(String column, Object value) {
        return column + "=" + (value == null ? NULL_PARTITION : value);
    }

    @Override
    public String getFilename(BoundedWindow window, PaneInfo pane, int numShards, int shardIndex,
                              Compression compression) {
        return String.format("%s/part-%05d-of-%05d%s%s",
                directory, shardIndex, numShards, ParquetScoreWriter.FILE_SUFFIX,
                compression.getSuggestedSuffix());
    }
}
