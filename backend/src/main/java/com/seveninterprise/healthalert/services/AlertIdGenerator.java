package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.AlertSequence;
import com.seveninterprise.healthalert.repositories.AlertSequenceRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Gera identificadores ALT-SYS-#### a partir de um contador persistido
 *
 * O contador é lido com lock pessimista, então dois criadores concorrentes
 * nunca recebem o mesmo número. Acima de 9999 o número simplesmente cresce.
 */
@Service
public class AlertIdGenerator {

    static final String SEQUENCE_KEY = "alert";
    private static final String ID_FORMAT = "ALT-SYS-%04d";

    private final AlertSequenceRepository sequenceRepository;

    public AlertIdGenerator(AlertSequenceRepository sequenceRepository) {
        this.sequenceRepository = sequenceRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String nextAlertId() {
        AlertSequence sequence = sequenceRepository.findForUpdate(SEQUENCE_KEY)
            .orElseGet(() -> sequenceRepository.saveAndFlush(new AlertSequence(SEQUENCE_KEY, 0L)));
        long next = sequence.increment();
        sequenceRepository.save(sequence);
        return format(next);
    }

    public static String format(long sequenceNumber) {
        return String.format(ID_FORMAT, sequenceNumber);
    }
}
