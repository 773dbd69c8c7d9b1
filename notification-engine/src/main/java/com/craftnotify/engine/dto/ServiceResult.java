package com.craftnotify.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result wrapper returned by engine operations.
 * 
 * A successful result only says the operation was applied. For sends, the
 * caller inspects the returned notification's status and error message to
 * learn whether any channel actually delivered.
 * 
 * @param <T> Type of the data payload
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceResult<T>(
    boolean success,
    T data,
    String error
) {
    public static <T> ServiceResult<T> success(T data) {
        return new ServiceResult<>(true, data, null);
    }

    public static ServiceResult<Void> successEmpty() {
        return new ServiceResult<>(true, null, null);
    }

    public static <T> ServiceResult<T> failure(String error) {
        return new ServiceResult<>(false, null, error);
    }
}
