package com.variantforge.controllers;

import com.variantforge.AppLogger;
import com.variantforge.VariantService;
import com.variantforge.models.EntrySummary;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.List;
import java.util.Map;

/**
 * Read-only views of a document: its Entries and its cross-reference tables.
 */
public class DocumentController implements Controller {

    private final VariantService variantService;
    private final AppLogger logger;

    public DocumentController(VariantService variantService) {
        this.variantService = variantService;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/documents/entries", this::listEntries);
        app.get("/api/documents/cross-references", this::getCrossReferences);
    }

    private void listEntries(Context ctx) {
        String path = ctx.queryParam("path");
        try {
            List<EntrySummary> entries = variantService.listEntries(path);
            ctx.json(Map.of("path", path, "entries", entries));
        } catch (Exception e) {
            fail(ctx, "Failed to list entries", e);
        }
    }

    private void getCrossReferences(Context ctx) {
        try {
            ctx.json(variantService.crossReferences(ctx.queryParam("path")));
        } catch (Exception e) {
            fail(ctx, "Failed to read cross-references", e);
        }
    }

    private void fail(Context ctx, String what, Exception e) {
        int status = Controller.statusFor(e);
        if (logger != null) {
            if (status >= 500) {
                logger.error(what + ": " + e.getMessage(), e);
            } else {
                logger.warn(what + ": " + e.getMessage());
            }
        }
        ctx.status(status).json(Controller.errorBody(e));
    }
}
