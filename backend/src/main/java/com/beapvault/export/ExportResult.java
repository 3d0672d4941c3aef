package com.beapvault.export;

/**
 * Either exported data or an error, never both. A failed export carries no partial data.
 */
public record ExportResult<T>(boolean success, T data, String error) {

    public static <T> ExportResult<T> success(T data) {
        return new ExportResult<>(true, data, null);
    }

    public static <T> ExportResult<T> failure(String error) {
        return new ExportResult<>(false, null, error);
    }
}
