package com.sandy.aiot.rack.control.controller;

import com.sandy.aiot.rack.control.entity.CommandLog;
import com.sandy.aiot.rack.control.model.Actuator;
import com.sandy.aiot.rack.control.model.CommandHandle;
import com.sandy.aiot.rack.control.model.CommandResult;
import com.sandy.aiot.rack.control.model.Metric;
import com.sandy.aiot.rack.control.model.RackSnapshot;
import com.sandy.aiot.rack.control.model.TrendEstimate;
import com.sandy.aiot.rack.control.service.CommandAuditService;
import com.sandy.aiot.rack.control.service.CommandDispatcher;
import com.sandy.aiot.rack.control.service.RackControlService;
import com.sandy.aiot.rack.control.service.RackNotFoundException;
import com.sandy.aiot.rack.control.service.TrendEstimatorService;
import com.sandy.aiot.rack.control.service.impl.RackAutomationService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Rack state, trends, command audit and manual commands. Command endpoints answer once the
 * device acknowledged or the command expired; both come back as 200 with the result.
 */
@RestController
@RequestMapping("/api/racks")
@RequiredArgsConstructor
@Slf4j
public class RackController {

    private final CommandDispatcher dispatcher;
    private final RackControlService rackControlService;
    private final TrendEstimatorService trendEstimator;
    private final CommandAuditService commandAuditService;
    private final RackAutomationService automationService;

    @GetMapping
    public List<RackSnapshot> list() {
        return dispatcher.racks();
    }

    @GetMapping("/pending")
    public List<CommandHandle> pending() {
        return dispatcher.pendingCommands();
    }

    @GetMapping("/{rackId}")
    public RackSnapshot get(@PathVariable("rackId") String rackId) {
        return dispatcher.rack(rackId).orElseThrow(() -> new RackNotFoundException(rackId));
    }

    @GetMapping("/{rackId}/trend/{metric}")
    public TrendView trend(@PathVariable("rackId") String rackId, @PathVariable("metric") String metric) {
        Metric m = Metric.fromSegment(metric)
                .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + metric));
        TrendView v = new TrendView();
        v.setRackId(rackId);
        v.setMetric(m);
        Optional<TrendEstimate> estimate = trendEstimator.estimate(rackId, m);
        v.setAvailable(estimate.isPresent());
        v.setSampleCount(estimate.map(TrendEstimate::sampleCount).orElse(trendEstimator.sampleCount(rackId, m)));
        estimate.ifPresent(e -> {
            v.setWindowMean(e.windowMean());
            v.setRatePerSecond(e.rateOfChange());
            v.setRatePerMinute(e.ratePerMinute());
            v.setWindowStart(e.windowStart());
            v.setWindowEnd(e.windowEnd());
        });
        return v;
    }

    @GetMapping("/{rackId}/commands")
    public List<CommandLog> commands(@PathVariable("rackId") String rackId) {
        return commandAuditService.findByRack(rackId);
    }

    @PostMapping("/{rackId}/commands/{actuator}")
    public CompletableFuture<CommandResult> command(@PathVariable("rackId") String rackId,
                                                    @PathVariable("actuator") String actuator,
                                                    @RequestBody CommandReq req) {
        Actuator a = Actuator.fromSegment(actuator)
                .orElseThrow(() -> new IllegalArgumentException("Unknown actuator: " + actuator));
        if (req == null || req.getValue() == null) {
            throw new IllegalArgumentException("value is required");
        }
        return rackControlService.send(rackId, a, req.getValue());
    }

    @PostMapping("/{rackId}/door/toggle")
    public CompletableFuture<CommandResult> toggleDoor(@PathVariable("rackId") String rackId) {
        return rackControlService.toggleDoor(rackId);
    }

    @PostMapping("/{rackId}/ventilation/toggle")
    public CompletableFuture<CommandResult> toggleVentilation(@PathVariable("rackId") String rackId) {
        return rackControlService.toggleVentilation(rackId);
    }

    @PostMapping("/{rackId}/alarm/silence")
    public CompletableFuture<CommandResult> silenceAlarm(@PathVariable("rackId") String rackId) {
        return rackControlService.silenceAlarm(rackId);
    }

    @PostMapping("/{rackId}/alarm/break-in")
    public CompletableFuture<CommandResult> breakIn(@PathVariable("rackId") String rackId) {
        return rackControlService.activateBreakInAlert(rackId);
    }

    @PostMapping("/evaluate")
    public ResponseEntity<ActionResp> evaluate() {
        int issued = automationService.evaluateAll();
        return ResponseEntity.ok(ActionResp.ok("issued " + issued + " command(s)"));
    }

    @Data
    public static class CommandReq {
        private Integer value;
    }

    @Data
    public static class TrendView {
        private String rackId;
        private Metric metric;
        private boolean available;
        private int sampleCount;
        private Double windowMean;
        private Double ratePerSecond;
        private Double ratePerMinute;
        private Instant windowStart;
        private Instant windowEnd;
    }

    @Data
    public static class ActionResp {
        private boolean success;
        private String message;
        public static ActionResp ok(String msg) { ActionResp r = new ActionResp(); r.success = true; r.message = msg; return r; }
    }
}
