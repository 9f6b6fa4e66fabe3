package com.finrisk.analytics.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final FinRiskProperties props;

    public StartupDiagnostics(FinRiskProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var anomaly = props.anomaly();
        log.info("Anomaly config: threshold={}, windowCap={}, topN={}, parallel={}, workerThreads={}, kpiMetrics={}",
                anomaly.threshold(), anomaly.windowCap(), anomaly.topN(), anomaly.parallelFlag(),
                anomaly.workerThreads(), anomaly.kpiMetrics());

        var data = props.data();
        log.info("Data config: source='{}', inputDir='{}', outputDir='{}', runnerEnabled={}",
                data.source(), data.inputDir(), props.output().dir(), props.runner().enabledFlag());
    }
}
