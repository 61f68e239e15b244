package com.libragraph.sift.core.report;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One entry of the session failure report.
 *
 * @param parserId variant involved; null for failures not tied to a parser
 * @param path     result-tree path of the region being scanned
 * @param offset   offset within that region
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanFailure(
        FailureKind kind,
        String parserId,
        String path,
        long offset,
        String message
) {
    public static ScanFailure of(FailureKind kind, String parserId, String path, long offset, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return new ScanFailure(kind, parserId, path, offset, message);
    }
}
