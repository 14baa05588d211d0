package com.seveninterprise.healthalert.model;

import jakarta.persistence.*;

/**
 * Contador persistido para a geração dos identificadores ALT-SYS-####
 */
@Entity
@Table(name = "alert_sequences")
public class AlertSequence {

    @Id
    @Column(name = "seq_key", length = 32)
    private String key;

    @Column(name = "seq", nullable = false)
    private long value;

    public AlertSequence() {}

    public AlertSequence(String key, long value) {
        this.key = key;
        this.value = value;
    }

    public long increment() {
        return ++value;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public long getValue() {
        return value;
    }

    public void setValue(long value) {
        this.value = value;
    }
}
