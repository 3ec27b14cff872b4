package org.genemeta.node.processes.http.api;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

import org.genemeta.datapipeline.services.ranking.DiseaseNotFoundException;
import org.genemeta.node.processes.http.api.dto.ErrorResponseDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;

/**
 * Base class of the query API controllers.
 * <p>
 * Provides route registration under a base path, parameter parsing helpers and the common
 * exception to JSON error mapping: {@link BadRequestException} → 400, {@link NotFoundException}
 * and {@link DiseaseNotFoundException} → 404, an exhausted connection pool → 429 and any other
 * {@link SQLException} → 500. Any other runtime exception, an {@link IllegalArgumentException}
 * from below the HTTP layer included, is an internal error (500).
 */
public abstract class AbstractApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractApiController.class);

    protected final Config options;

    protected AbstractApiController(final Config options) {
        this.options = options;
    }

    /**
     * Registers this controller's routes.
     *
     * @param app      The Javalin application.
     * @param basePath Path prefix, e.g. {@code /api}.
     */
    public abstract void registerRoutes(Javalin app, String basePath);

    protected static String path(final String basePath, final String suffix) {
        return (basePath + suffix).replaceAll("//", "/");
    }

    /**
     * Registers the shared exception handlers. Handlers are keyed by exception type, so
     * registering them once per controller is harmless.
     */
    protected void setupExceptionHandlers(final Javalin app) {
        app.exception(BadRequestException.class, (e, ctx) ->
            sendError(ctx, HttpStatus.BAD_REQUEST, e.getMessage()));
        app.exception(NotFoundException.class, (e, ctx) ->
            sendError(ctx, HttpStatus.NOT_FOUND, e.getMessage()));
        app.exception(DiseaseNotFoundException.class, (e, ctx) ->
            sendError(ctx, HttpStatus.NOT_FOUND, e.getMessage()));
        app.exception(SQLException.class, (e, ctx) -> {
            if (e instanceof SQLTransientConnectionException) {
                LOGGER.warn("Connection pool exhausted for {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
                sendError(ctx, HttpStatus.TOO_MANY_REQUESTS, "Database busy, retry later");
            } else {
                LOGGER.error("Database error for {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
                sendError(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "Database error: " + e.getMessage());
            }
        });
        app.exception(RuntimeException.class, (e, ctx) -> {
            LOGGER.error("Unexpected error for {} {}", ctx.method(), ctx.path(), e);
            sendError(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "Internal error");
        });
    }

    protected static void sendError(final Context ctx, final HttpStatus status, final String message) {
        ctx.status(status).json(new ErrorResponseDto(status.getCode(), status.getMessage(), message));
    }

    /**
     * Returns a required query parameter.
     *
     * @throws BadRequestException if it is missing or blank.
     */
    protected static String requireQueryParam(final Context ctx, final String name) {
        final String value = ctx.queryParam(name);
        if (value == null || value.isBlank()) {
            throw new BadRequestException("Query parameter '" + name + "' is required");
        }
        return value.trim();
    }

    protected static double parseDouble(final String name, final String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new BadRequestException("Parameter '" + name + "' must be a number, got '" + value + "'");
        }
    }

    protected static int parseInt(final String name, final String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new BadRequestException("Parameter '" + name + "' must be an integer, got '" + value + "'");
        }
    }

    protected static long parseLong(final String name, final String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new BadRequestException("Parameter '" + name + "' must be an integer, got '" + value + "'");
        }
    }

    /**
     * Thrown by handlers for a malformed or out-of-range request; mapped to 400.
     */
    public static class BadRequestException extends RuntimeException {
        public BadRequestException(final String message) {
            super(message);
        }
    }

    /**
     * Thrown by handlers for a path entity that does not exist; mapped to 404.
     */
    public static class NotFoundException extends RuntimeException {
        public NotFoundException(final String message) {
            super(message);
        }
    }
}
