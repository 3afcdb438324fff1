package com.task4ge.api.health;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class StatusService {

  private final DatabaseProbe databaseProbe;
  private final StatusProperties props;

  public StatusReport check() {
    Map<String, HealthEntry> results = new LinkedHashMap<>();
    results.put("gcinfo", gcInfo());
    results.put("database", database());

    HealthStatus overall = HealthStatus.HEALTHY;
    for (HealthEntry entry : results.values()) {
      overall = overall.worst(entry.status());
    }
    return new StatusReport(overall, results);
  }

  HealthEntry gcInfo() {
    MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
    return gcInfo(heap.getUsed(), heap.getCommitted(), heap.getMax(), ManagementFactory.getGarbageCollectorMXBeans());
  }

  HealthEntry gcInfo(long allocated, long committed, long max, List<GarbageCollectorMXBean> collectors) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("allocated", allocated);
    data.put("committed", committed);
    data.put("max", max);
    for (GarbageCollectorMXBean gc : collectors) {
      data.put(gc.getName() + ".collections", gc.getCollectionCount());
      data.put(gc.getName() + ".timeMs", gc.getCollectionTime());
    }
    HealthStatus status = allocated >= props.gcThresholdBytes() ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
    return new HealthEntry(status, "Reports degraded status if allocated bytes >= " + props.gcThresholdBytes(), data);
  }

  HealthEntry database() {
    try {
      databaseProbe.ping();
      return new HealthEntry(HealthStatus.HEALTHY, "Database reachable", Map.of());
    } catch (DataAccessException e) {
      return new HealthEntry(HealthStatus.UNHEALTHY, "Database unreachable",
          Map.of("error", String.valueOf(e.getMostSpecificCause().getMessage())));
    }
  }
}
