package com.nrqlbridge.service.core.health;

import com.nrqlbridge.service.core.query.NrqlExecutor;
import com.nrqlbridge.service.core.query.QueryExecutionException;
import com.nrqlbridge.service.core.result.ResultSet;
import com.nrqlbridge.service.core.settings.ConnectionSettings;
import com.nrqlbridge.service.core.settings.InvalidSettingsException;
import com.nrqlbridge.service.core.settings.SettingsValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/** Datasource "Save &amp; test": validates the connection and runs a one-row probe query. */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    static final String PROBE_QUERY = "SELECT count(*) FROM Transaction SINCE 1 hour ago LIMIT 1";

    private final ObjectProvider<NrqlExecutor> executorProvider;

    public HealthCheckResult check(ConnectionSettings settings) {
        try {
            SettingsValidator.validate(settings);
        } catch (InvalidSettingsException ex) {
            return HealthCheckResult.error("Invalid configuration: " + ex.getMessage());
        }

        NrqlExecutor executor = executorProvider.getIfAvailable();
        if (executor == null) {
            return HealthCheckResult.error("No NRQL executor is configured");
        }

        ResultSet probe;
        try {
            probe = executor.execute(PROBE_QUERY, settings.accountId());
        } catch (QueryExecutionException ex) {
            if (ex.getReason() == QueryExecutionException.Reason.UNAUTHORIZED) {
                log.warn("Health check rejected for account {}: {}", settings.accountId(), ex.getMessage());
                return HealthCheckResult.error("Authentication failed: check the API key");
            }
            log.warn("Health check failed for account {} ({})", settings.accountId(), ex.getReason(), ex);
            return HealthCheckResult.error("Failed to connect to New Relic: " + ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Health check failed for account {}", settings.accountId(), ex);
            return HealthCheckResult.error("Failed to connect to New Relic: " + ex.getMessage());
        }

        if (probe == null || probe.isEmpty()) {
            return HealthCheckResult.error("Connected, but the account returned an empty response");
        }
        return HealthCheckResult.ok("Successfully connected to New Relic (" + probe.size() + " row(s))");
    }
}
