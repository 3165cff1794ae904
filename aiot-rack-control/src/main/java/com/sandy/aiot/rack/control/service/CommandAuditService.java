package com.sandy.aiot.rack.control.service;

import com.sandy.aiot.rack.control.entity.CommandLog;
import com.sandy.aiot.rack.control.model.CommandResult;
import com.sandy.aiot.rack.control.repository.CommandLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Persists every terminal command result. Runs on whatever thread resolved the command
 * (ack delivery or expiry sweep); failures are logged and never reach the dispatcher.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CommandAuditService implements CommandResolutionListener {

    private final CommandLogRepository commandLogRepository;

    @Override
    public void onResolved(CommandResult result) {
        try {
            CommandLog saved = commandLogRepository.save(CommandLog.builder()
                    .commandId(result.commandId())
                    .rackId(result.rackId())
                    .actuator(result.actuator())
                    .desiredValue(result.desiredValue())
                    .achievedValue(result.achievedValue())
                    .outcome(result.outcome())
                    .issuedAt(result.issuedAt())
                    .resolvedAt(result.resolvedAt())
                    .latencyMs(result.latencyMs())
                    .build());
            log.debug("Command audit saved id={} commandId={} outcome={}", saved.getId(), result.commandId(), result.outcome());
        } catch (Exception e) {
            log.error("Command audit save failed commandId={} rackId={} error={}", result.commandId(), result.rackId(), e.getMessage(), e);
        }
    }

    public List<CommandLog> findByRack(String rackId) {
        return commandLogRepository.findByRackIdOrderByResolvedAtDesc(rackId);
    }
}
