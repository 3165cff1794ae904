package com.sandy.aiot.rack.control.repository;

import com.sandy.aiot.rack.control.entity.CommandLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CommandLogRepository extends JpaRepository<CommandLog, Long> {
    List<CommandLog> findByRackIdOrderByResolvedAtDesc(String rackId);
    Optional<CommandLog> findByCommandId(String commandId);
}
