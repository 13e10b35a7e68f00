package com.variantforge.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.variantforge.transform.TransformRequest;

/**
 * HTTP body for preview and apply: the workspace-relative document path and the request to run on it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VariantJob {

    private String path;
    private TransformRequest request;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public TransformRequest getRequest() {
        return request;
    }

    public void setRequest(TransformRequest request) {
        this.request = request;
    }
}
