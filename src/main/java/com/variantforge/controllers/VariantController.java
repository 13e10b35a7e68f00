package com.variantforge.controllers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.variantforge.AppLogger;
import com.variantforge.VariantService;
import com.variantforge.models.VariantDefaults;
import com.variantforge.models.VariantJob;
import com.variantforge.models.VariantRunResult;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

public class VariantController implements Controller {

    private final VariantService variantService;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public VariantController(VariantService variantService, ObjectMapper objectMapper) {
        this.variantService = variantService;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/variants/preview", this::preview);
        app.post("/api/variants/apply", this::apply);
        app.get("/api/variants/history", this::history);
        app.get("/api/variants/defaults", this::getDefaults);
        app.put("/api/variants/defaults", this::updateDefaults);
    }

    private void preview(Context ctx) {
        try {
            VariantJob job = readJob(ctx);
            ctx.json(variantService.preview(job.getPath(), job.getRequest()));
        } catch (Exception e) {
            fail(ctx, "Preview failed", e);
        }
    }

    private void apply(Context ctx) {
        try {
            VariantJob job = readJob(ctx);
            VariantRunResult result = variantService.apply(job.getPath(), job.getRequest());
            if (!result.getOutcome().isSuccess()) {
                ctx.status(422);
            }
            ctx.json(result);
        } catch (Exception e) {
            fail(ctx, "Apply failed", e);
        }
    }

    private void history(Context ctx) {
        try {
            ctx.json(Map.of("records", variantService.history()));
        } catch (Exception e) {
            fail(ctx, "Failed to read history", e);
        }
    }

    private void getDefaults(Context ctx) {
        ctx.json(variantService.getDefaults());
    }

    private void updateDefaults(Context ctx) {
        try {
            VariantDefaults defaults = objectMapper.readValue(ctx.body(), VariantDefaults.class);
            ctx.json(variantService.updateDefaults(defaults));
        } catch (Exception e) {
            fail(ctx, "Failed to update defaults", e);
        }
    }

    private VariantJob readJob(Context ctx) throws Exception {
        String body = ctx.body();
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("Request body is required");
        }
        VariantJob job = objectMapper.readValue(body, VariantJob.class);
        if (job.getRequest() == null) {
            throw new IllegalArgumentException("request is required");
        }
        return job;
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
