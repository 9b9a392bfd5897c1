package com.pkgmeta.core.handler;

import com.pkgmeta.core.model.PackageRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of running one handler on one descriptor file.
 *
 * @param handlerId id of the handler that read the file
 * @param file descriptor file
 * @param success whether the descriptor could be read
 * @param records extracted records, empty on failure
 * @param errors reasons the descriptor produced no record
 */
public record ExtractionResult(
    String handlerId,
    Path file,
    boolean success,
    List<PackageRecord> records,
    List<String> errors
) {
    /**
     * Compact constructor with validation.
     */
    public ExtractionResult {
        Objects.requireNonNull(handlerId, "handlerId must not be null");
        Objects.requireNonNull(file, "file must not be null");
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    /**
     * Creates a successful result.
     *
     * @param handlerId handler id
     * @param file descriptor file
     * @param records extracted records
     * @return successful result
     */
    public static ExtractionResult of(String handlerId, Path file, List<PackageRecord> records) {
        return new ExtractionResult(handlerId, file, true, records, List.of());
    }

    /**
     * Creates a failed result that carries no record.
     *
     * @param handlerId handler id
     * @param file descriptor file
     * @param error error message
     * @return failed result
     */
    public static ExtractionResult failed(String handlerId, Path file, String error) {
        return new ExtractionResult(handlerId, file, false, List.of(), List.of(error));
    }

    /**
     * Returns true if any produced record lost data during parsing.
     *
     * @return true if a record is partial
     */
    public boolean hasPartialRecords() {
        return records.stream().anyMatch(PackageRecord::isPartial);
    }
}
