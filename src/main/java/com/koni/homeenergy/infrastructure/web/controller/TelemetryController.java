package com.koni.homeenergy.infrastructure.web.controller;

import com.koni.homeenergy.application.command.PurgeSamplesCommand;
import com.koni.homeenergy.application.command.PurgeSamplesCommandHandler;
import com.koni.homeenergy.application.command.RecordBatchCommand;
import com.koni.homeenergy.application.command.RecordBatchCommandHandler;
import com.koni.homeenergy.application.command.RecordSampleCommand;
import com.koni.homeenergy.application.command.RecordSampleCommandHandler;
import com.koni.homeenergy.application.query.FindSamplesQuery;
import com.koni.homeenergy.application.query.FindSamplesQueryHandler;
import com.koni.homeenergy.application.query.GetDeviceStatsQuery;
import com.koni.homeenergy.application.query.GetDeviceStatsQueryHandler;
import com.koni.homeenergy.domain.model.Sample;
import com.koni.homeenergy.infrastructure.resilience.AdmissionTier;
import com.koni.homeenergy.infrastructure.web.admission.Admission;
import com.koni.homeenergy.infrastructure.web.dto.BatchRequest;
import com.koni.homeenergy.infrastructure.web.dto.CleanupResponse;
import com.koni.homeenergy.infrastructure.web.dto.DeviceStatsResponse;
import com.koni.homeenergy.infrastructure.web.dto.SampleRequest;
import com.koni.homeenergy.infrastructure.web.dto.SampleResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * REST controller for telemetry ingestion, retrieval and retention.
 * 
 * Endpoints:
 * - POST /api/v1/telemetry/ingest: record one sample
 * - POST /api/v1/telemetry/ingest/batch: record up to 1000 samples
 * - GET /api/v1/telemetry: find samples by device, type, room and time window
 * - GET /api/v1/telemetry/devices/{deviceId}/stats: per-category statistics
 * - POST /api/v1/telemetry/cleanup: delete samples past the retention period
 */
@RestController
@RequestMapping("/api/v1/telemetry")
@RequiredArgsConstructor
@Slf4j
public class TelemetryController {

    private final RecordSampleCommandHandler recordSampleHandler;
    private final RecordBatchCommandHandler recordBatchHandler;
    private final PurgeSamplesCommandHandler purgeSamplesHandler;
    private final FindSamplesQueryHandler findSamplesHandler;
    private final GetDeviceStatsQueryHandler deviceStatsHandler;

    /**
     * Records one sample.
     * 
     * Example request:
     * POST /api/v1/telemetry/ingest
     * {
     *   "deviceId": "dev-001",
     *   "category": "power",
     *   "value": 120.5,
     *   "status": true,
     *   "timestamp": "2025-01-31T13:00:00Z"
     * }
     * 
     * @return 201 Created with the stored sample
     */
    @PostMapping("/ingest")
    @Admission(AdmissionTier.SHORT)
    public ResponseEntity<SampleResponse> ingest(@RequestBody @Valid SampleRequest request) {
        log.debug("Received sample: deviceId={}, category={}, value={}",
                request.getDeviceId(), request.getCategory(), request.getValue());

        Sample stored = recordSampleHandler.handle(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(SampleResponse.from(stored));
    }

    /**
     * Records a batch of samples. Records of unknown devices are skipped.
     *
     * @return 201 Created with the stored samples
     */
    @PostMapping("/ingest/batch")
    @Admission(AdmissionTier.MEDIUM)
    public ResponseEntity<List<SampleResponse>> ingestBatch(@RequestBody @Valid BatchRequest request) {
        List<RecordSampleCommand> commands = new ArrayList<>(request.getData().size());
        for (SampleRequest sample : request.getData()) {
            commands.add(sample == null ? null : sample.toCommand());
        }
        log.debug("Received batch of {} samples", commands.size());

        List<Sample> stored = recordBatchHandler.handle(new RecordBatchCommand(commands));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(stored.stream().map(SampleResponse::from).toList());
    }

    @GetMapping
    @Admission(AdmissionTier.MEDIUM)
    public List<SampleResponse> find(
            @RequestParam(required = false) String deviceId,
            @RequestParam(required = false) String deviceType,
            @RequestParam(required = false) String room,
            @RequestParam(required = false) Instant startTime,
            @RequestParam(required = false) Instant endTime,
            @RequestParam(defaultValue = "false") boolean includeDevice) {
        FindSamplesQuery query = new FindSamplesQuery(deviceId, deviceType, room, startTime, endTime, includeDevice);
        return findSamplesHandler.handle(query).stream().map(SampleResponse::from).toList();
    }

    @GetMapping("/devices/{deviceId}/stats")
    @Admission(AdmissionTier.MEDIUM)
    public DeviceStatsResponse stats(
            @PathVariable String deviceId,
            @RequestParam(defaultValue = "" + GetDeviceStatsQuery.DEFAULT_HOURS) int hours) {
        return DeviceStatsResponse.from(deviceStatsHandler.handle(new GetDeviceStatsQuery(deviceId, hours)));
    }

    @PostMapping("/cleanup")
    @Admission(AdmissionTier.LONG)
    public CleanupResponse cleanup(
            @RequestParam(defaultValue = "" + PurgeSamplesCommand.DEFAULT_DAYS_TO_KEEP) int daysToKeep) {
        long deleted = purgeSamplesHandler.handle(new PurgeSamplesCommand(daysToKeep));
        return new CleanupResponse(
                "Successfully deleted " + deleted + " old telemetry records",
                deleted,
                daysToKeep);
    }
}
