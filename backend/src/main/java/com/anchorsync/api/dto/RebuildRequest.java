package com.anchorsync.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * Body of POST /api/v1/admin/sync/rebuild. Both block bounds are inclusive.
 */
public record RebuildRequest(
        @NotEmpty(message = "MODELS_REQUIRED")
        List<@NotBlank(message = "INVALID_MODEL") String> models,

        @NotNull(message = "INVALID_BLOCK_RANGE")
        @PositiveOrZero(message = "INVALID_BLOCK_RANGE")
        Long fromBlock,

        @NotNull(message = "INVALID_BLOCK_RANGE")
        @PositiveOrZero(message = "INVALID_BLOCK_RANGE")
        Long toBlock
) {
}
