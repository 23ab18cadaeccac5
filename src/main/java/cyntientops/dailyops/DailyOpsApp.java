package cyntientops.dailyops;

import cyntientops.dailyops.config.DailyOpsConfig;
import cyntientops.dailyops.config.Dependencies;
import cyntientops.dailyops.model.RunOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point: starts the daily trigger and keeps it alive until shutdown.
 * With {@code --once} it runs today's pipeline a single time and exits.
 */
public class DailyOpsApp {

    private static final Logger log = LoggerFactory.getLogger(DailyOpsApp.class);

    public static void main(String[] args) throws InterruptedException {
        DailyOpsConfig config = DailyOpsConfig.fromEnv();
        boolean once = args.length > 0 && "--once".equals(args[0]);

        Dependencies deps = Dependencies.create(config);
        if (!deps.database().isHealthy()) {
            log.error("Database {} is not reachable", config.databaseUrl());
            deps.close();
            System.exit(2);
        }
        deps.migrationOrchestrator().setProgressListener((step, total, status) ->
                log.info("Migration [{}/{}] {}", step, total, status));

        if (once) {
            RunOutcome outcome;
            try {
                outcome = deps.dailyTrigger().runNow();
            } finally {
                deps.close();
            }
            log.info("Daily run finished: {}", outcome);
            if (outcome == RunOutcome.FAILED) {
                System.exit(1);
            }
            return;
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            shutdown.countDown();
        }, "dailyops-shutdown"));

        deps.dailyTrigger().start();
        shutdown.await();
    }
}
