package com.example.tuckshop.infrastructure.persistence.entity;

import jakarta.persistence.*;

/**
 * Counter row holding the last order number handed out.
 */
@Entity
@Table(name = "order_sequence")
public class OrderSequenceEntity {

    @Id
    @Column(name = "name", length = 32)
    private String name;

    @Column(name = "last_issued", nullable = false)
    private long lastValue;

    protected OrderSequenceEntity() {
    }

    public OrderSequenceEntity(String name, long lastValue) {
        this.name = name;
        this.lastValue = lastValue;
    }

    public String getName() {
        return name;
    }

    public long getLastValue() {
        return lastValue;
    }

    public void setLastValue(long lastValue) {
        this.lastValue = lastValue;
    }
}
