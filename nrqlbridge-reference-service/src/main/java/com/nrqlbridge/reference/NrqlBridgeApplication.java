package com.nrqlbridge.reference;

import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/** Reference service that wires the Grafana endpoints onto the core query pipeline. */
@Slf4j
@SpringBootApplication(scanBasePackages = {"com.nrqlbridge"})
public class NrqlBridgeApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(NrqlBridgeApplication.class, args);
        boolean demo = context.getEnvironment().getProperty("demo-data.nrql.enabled", Boolean.class, false);
        log.info(
                "NRQL bridge started (profiles {}, demo executor {})",
                Arrays.toString(context.getEnvironment().getActiveProfiles()),
                demo ? "on" : "off");
    }
}
