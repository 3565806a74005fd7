package com.di.epistream.load;

import com.di.epistream.exception.ErrorCategory;

import java.time.LocalDate;

/**
 * A partition whose transaction was rolled back. None of its rows were written.
 */
public record PartitionFailure(String countryCode,
                               LocalDate fromDate,
                               LocalDate toDate,
                               int rows,
                               ErrorCategory category,
                               String message) {
}
