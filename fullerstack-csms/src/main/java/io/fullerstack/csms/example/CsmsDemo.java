package io.fullerstack.csms.example;

import io.fullerstack.csms.config.CentralSystemConfig;
import io.fullerstack.csms.model.IdTag;
import io.fullerstack.csms.store.InMemoryChargingStore;
import io.fullerstack.csms.system.CsmsSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Runs the central system on an in-memory store.
 * <p>
 * Usage:
 * <pre>
 * java -Dcsms.port=9000 io.fullerstack.csms.example.CsmsDemo TAG001 TAG002
 * </pre>
 * Every argument is stored as an accepted id tag. Point a charge point at
 * {@code ws://host:port/<chargePointId>}.
 * </p>
 */
public class CsmsDemo {
    private static final Logger logger = LoggerFactory.getLogger(CsmsDemo.class);

    public static void main(String[] args) throws InterruptedException {
        CentralSystemConfig config = CentralSystemConfig.load();

        InMemoryChargingStore store = new InMemoryChargingStore();
        for (String tag : args) {
            store.upsertIdTag(IdTag.accepted(tag));
            logger.info("Seeded accepted id tag {}", tag);
        }

        CsmsSystem system = new CsmsSystem(config, store, Clock.systemUTC());
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            system.close();
            shutdown.countDown();
        }, "csms-shutdown"));

        system.start();
        logger.info("Central system running, press Ctrl+C to stop");
        shutdown.await();
    }
}
