package com.di.epistream.load;

import com.di.epistream.exception.ErrorCategory;

/**
 * Wraps the cause of a failed partition together with the partition it belongs to.
 */
public class PartitionLoadException extends RuntimeException {

    private final transient CountryPartition partition;
    private final ErrorCategory category;

    public PartitionLoadException(CountryPartition partition, Throwable cause) {
        super("Partition " + partition.getCountryCode() + " [" + partition.getFromDate() + ".." + partition.getToDate()
                + "] failed: " + rootMessage(cause), cause);
        this.partition = partition;
        this.category = ErrorCategory.categorize(cause);
    }

    public CountryPartition getPartition() {
        return partition;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public PartitionFailure toFailure() {
        return new PartitionFailure(partition.getCountryCode(), partition.getFromDate(), partition.getToDate(),
                partition.size(), category, rootMessage(getCause()));
    }

    static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message != null ? message : root.getClass().getSimpleName();
    }
}
