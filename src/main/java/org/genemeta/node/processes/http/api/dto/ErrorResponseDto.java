package org.genemeta.node.processes.http.api.dto;

/**
 * JSON body of every error response.
 *
 * @param status  HTTP status code.
 * @param error   HTTP reason phrase, e.g. {@code Bad Request}.
 * @param message What went wrong.
 */
public record ErrorResponseDto(int status, String error, String message) {}
