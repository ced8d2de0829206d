package com.koni.homeenergy.infrastructure.web.controller;

import com.koni.homeenergy.application.query.EnergyQueryHandler;
import com.koni.homeenergy.application.query.GetDailyEnergyQuery;
import com.koni.homeenergy.application.query.GetEnergyQuery;
import com.koni.homeenergy.infrastructure.resilience.AdmissionTier;
import com.koni.homeenergy.infrastructure.web.admission.Admission;
import com.koni.homeenergy.infrastructure.web.dto.EnergyBucketResponse;
import com.koni.homeenergy.infrastructure.web.dto.EnergyResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for energy statistics derived from power samples.
 * 
 * Endpoints:
 * - GET /api/v1/energy: energy over [startTime, endTime) with a per-device breakdown
 * - GET /api/v1/energy/daily: one bucket per calendar day between from and to, inclusive
 */
@RestController
@RequestMapping("/api/v1/energy")
@RequiredArgsConstructor
public class EnergyController {

    private final EnergyQueryHandler energyQueryHandler;

    @GetMapping
    @Admission(AdmissionTier.MEDIUM)
    public EnergyResponse energy(
            @RequestParam(required = false) String deviceId,
            @RequestParam(required = false) String deviceType,
            @RequestParam(required = false) String room,
            @RequestParam(required = false) Instant startTime,
            @RequestParam(required = false) Instant endTime) {
        GetEnergyQuery query = new GetEnergyQuery(deviceId, deviceType, room, startTime, endTime);
        return EnergyResponse.from(energyQueryHandler.handle(query));
    }

    @GetMapping("/daily")
    @Admission(AdmissionTier.MEDIUM)
    public List<EnergyBucketResponse> daily(
            @RequestParam(required = false) String deviceId,
            @RequestParam(required = false) String deviceType,
            @RequestParam(required = false) String room,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        GetDailyEnergyQuery query = new GetDailyEnergyQuery(deviceId, deviceType, room, from, to);
        return energyQueryHandler.handle(query).stream().map(EnergyBucketResponse::from).toList();
    }
}
