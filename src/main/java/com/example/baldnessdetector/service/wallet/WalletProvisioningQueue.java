package com.example.baldnessdetector.service.wallet;

import com.example.baldnessdetector.config.WalletProperties;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Bounded queue of users waiting for a wallet, drained by a single dedicated worker.
 * <p>
 * Submitting never blocks: when the queue is full the task is dropped and counted as
 * rejected. A failed attempt is retried with linear backoff up to the configured number
 * of attempts, after which the user simply keeps a null wallet address. Nothing here
 * ever reaches the login caller.
 */
@Component
@Slf4j
public class WalletProvisioningQueue {

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    private final WalletProvisioner provisioner;
    private final WalletProperties.Provisioning settings;
    private final MeterRegistry meterRegistry;
    private final ExecutorService executorService;
    private final BlockingQueue<Long> queue;

    private volatile boolean running;

    @Autowired
    public WalletProvisioningQueue(WalletProvisioner provisioner, WalletProperties properties,
                                   MeterRegistry meterRegistry) {
        this(provisioner, properties, meterRegistry,
                Executors.newSingleThreadExecutor(new CustomizableThreadFactory("wallet-provisioner-")));
    }

    WalletProvisioningQueue(
            WalletProvisioner provisioner,
            WalletProperties properties,
            MeterRegistry meterRegistry,
            ExecutorService executorService) {
        this.provisioner = provisioner;
        this.settings = properties.getProvisioning();
        this.meterRegistry = meterRegistry;
        this.executorService = executorService;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, settings.getQueueCapacity()));
        meterRegistry.gauge("wallet.provisioning.queue.size", queue, BlockingQueue::size);
    }

    @PostConstruct
    public void start() {
        if (!settings.isEnabled()) {
            log.info("Wallet provisioning disabled");
            return;
        }
        running = true;
        executorService.submit(this::runWorker);
    }

    /**
     * Queues a provisioning task for the user without waiting for it.
     *
     * @return false when provisioning is disabled or the queue is full
     */
    public boolean submit(Long userId) {
        if (!settings.isEnabled()) {
            log.debug("Wallet provisioning disabled, not queueing user {}", userId);
            return false;
        }
        if (!queue.offer(userId)) {
            log.warn("Wallet provisioning queue full ({} pending), dropping user {}", queue.size(), userId);
            count("rejected");
            return false;
        }
        count("enqueued");
        return true;
    }

    /**
     * Runs every attempt for one user. Never throws.
     */
    public void provision(Long userId) {
        int maxAttempts = Math.max(1, settings.getMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ProvisioningOutcome outcome = provisioner.provisionOnce(userId);
                count(outcome.name().toLowerCase(Locale.ROOT));
                return;
            } catch (Exception ex) {
                if (attempt == maxAttempts) {
                    log.error("Wallet provisioning for user {} failed after {} attempts", userId, attempt, ex);
                    count("failed");
                    return;
                }
                log.warn("Wallet provisioning attempt {}/{} for user {} failed: {}",
                        attempt, maxAttempts, userId, ex.getMessage());
                meterRegistry.counter("wallet.provisioning.retries").increment();
                if (!sleepBeforeRetry(attempt)) {
                    log.warn("Wallet provisioning for user {} interrupted", userId);
                    count("failed");
                    return;
                }
            }
        }
    }

    public int pendingTasks() {
        return queue.size();
    }

    boolean processNext(Duration timeout) throws InterruptedException {
        Long userId = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (userId == null) {
            return false;
        }
        provision(userId);
        return true;
    }

    private void runWorker() {
        log.info("Wallet provisioning worker started");
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                processNext(POLL_TIMEOUT);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Wallet provisioning worker stopped");
    }

    private boolean sleepBeforeRetry(int attempt) {
        long delayMillis = settings.getRetryBackoff().toMillis() * attempt;
        if (delayMillis <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMillis);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void count(String result) {
        meterRegistry.counter("wallet.provisioning.tasks", "result", result).increment();
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(2, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
    }
}
