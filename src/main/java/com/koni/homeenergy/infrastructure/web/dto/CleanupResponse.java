package com.koni.homeenergy.infrastructure.web.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CleanupResponse {

    private final String message;
    private final long deletedCount;
    private final int daysToKeep;
}
