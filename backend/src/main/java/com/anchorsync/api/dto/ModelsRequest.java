package com.anchorsync.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Body of POST and DELETE /api/v1/admin/models.
 */
public record ModelsRequest(
        @NotEmpty(message = "MODELS_REQUIRED")
        List<@NotBlank(message = "INVALID_MODEL") String> models
) {
}
