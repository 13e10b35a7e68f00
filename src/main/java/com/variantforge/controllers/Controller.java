package com.variantforge.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.javalin.Javalin;

import java.io.FileNotFoundException;
import java.util.Map;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    /**
     * Register this controller's routes with the Javalin app.
     */
    void registerRoutes(Javalin app);

    /**
     * Safe error body helper that handles null exception messages.
     * Use this instead of Map.of("error", e.getMessage()) to prevent NPE.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("error", m);
    }

    /**
     * HTTP status for an exception thrown while serving a request.
     */
    static int statusFor(Exception e) {
        if (e instanceof FileNotFoundException) {
            return 404;
        }
        if (e instanceof SecurityException) {
            return 403;
        }
        if (e instanceof IllegalArgumentException || e instanceof JsonProcessingException) {
            return 400;
        }
        return 500;
    }
}
