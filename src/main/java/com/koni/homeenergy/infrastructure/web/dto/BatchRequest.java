package com.koni.homeenergy.infrastructure.web.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Batch of samples submitted together. Records are validated one by one by the
 * domain validator so errors can name the offending record.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class BatchRequest {

    @NotNull(message = "data is required")
    private List<SampleRequest> data;
}
