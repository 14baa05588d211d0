package com.seveninterprise.healthalert.services;

import com.google.common.util.concurrent.Striped;
import com.seveninterprise.healthalert.exceptions.AlertException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import jakarta.annotation.PostConstruct;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Ponto de serialização por alerta
 *
 * Toda mutação de um alerta (reconhecimento, escalação, entrega, resolução)
 * roda sob o lock do seu alertId e dentro de uma transação aberta e
 * confirmada enquanto o lock está retido. Entre nós, o @Version do alerta
 * rejeita escritas concorrentes.
 */
@Component
public class AlertLockManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlertLockManager.class);

    private final TransactionTemplate transactionTemplate;
    private Striped<Lock> locks;

    @Value("${healthalert.lock.stripes:256}")
    private int stripes;

    @Value("${healthalert.lock.wait.seconds:30}")
    private long lockWaitSeconds;

    public AlertLockManager(TransactionTemplate transactionTemplate) {
        this.transactionTemplate = transactionTemplate;
    }

    @PostConstruct
    public void init() {
        this.locks = Striped.lock(stripes > 0 ? stripes : 256);
    }

    /**
     * Executa a mutação sob o lock do alerta em uma transação própria
     */
    public <T> T executeInLock(String alertId, Supplier<T> mutation) {
        Lock lock = locks.get(alertId);
        boolean acquired;
        try {
            acquired = lock.tryLock(lockWaitSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertException("Interrompido aguardando lock do alerta " + alertId, e);
        }

        if (!acquired) {
            LOGGER.warn("⏭️ [LOCK] Timeout aguardando lock do alerta {}", alertId);
            throw new AlertException("Timeout aguardando lock do alerta " + alertId);
        }

        try {
            return transactionTemplate.execute(status -> mutation.get());
        } finally {
            lock.unlock();
        }
    }

    public void runInLock(String alertId, Runnable mutation) {
        executeInLock(alertId, () -> {
            mutation.run();
            return null;
        });
    }
}
