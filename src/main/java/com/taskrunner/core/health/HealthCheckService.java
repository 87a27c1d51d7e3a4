package com.taskrunner.core.health;

import com.taskrunner.core.store.AlarmStore;
import com.taskrunner.remote.Provisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    /** Alarms overdue by more than this mean the poller is not keeping up. */
    static final Duration ALARM_BACKLOG_AGE = Duration.ofMinutes(5);

    private final DataSource dataSource;
    private final Provisioner provisioner;
    private final AlarmStore alarmStore;
    private final Clock clock;

    public HealthCheckService(
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) Provisioner provisioner,
            AlarmStore alarmStore,
            Clock clock) {
        this.dataSource = dataSource;
        this.provisioner = provisioner;
        this.alarmStore = alarmStore;
        this.clock = clock;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkProvisioner());
        results.add(checkAlarmBacklog());
        return results;
    }

    public HealthStatus.Status overallStatus() {
        return HealthStatus.overall(checkAll());
    }

    public boolean isHealthy() {
        return overallStatus() == HealthStatus.Status.UP;
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return HealthStatus.down("database", "No DataSource configured");
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database", "Database connection valid",
                        Map.of("product", conn.getMetaData().getDatabaseProductName()));
            }
            return HealthStatus.down("database", "Database connection invalid");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database", "Database error: " + e.getMessage());
        }
    }

    private HealthStatus checkProvisioner() {
        if (provisioner == null) {
            return HealthStatus.down("provisioner", "No Provisioner configured");
        }
        return HealthStatus.up("provisioner", "Provisioner available (" + provisioner.name() + ")",
                Map.of("type", provisioner.name()));
    }

    private HealthStatus checkAlarmBacklog() {
        try {
            int overdue = alarmStore.countDue(clock.instant().minus(ALARM_BACKLOG_AGE));
            if (overdue > 0) {
                return HealthStatus.degraded("alarms",
                        overdue + " alarm(s) overdue by more than " + ALARM_BACKLOG_AGE.toMinutes() + " minutes",
                        Map.of("overdue", String.valueOf(overdue)));
            }
            return HealthStatus.up("alarms", "No alarm backlog", Map.of("overdue", "0"));
        } catch (RuntimeException e) {
            log.warn("Alarm backlog check failed: {}", e.getMessage());
            return HealthStatus.down("alarms", "Alarm store error: " + e.getMessage());
        }
    }
}
