package com.example.tuckshop.infrastructure.persistence;

import com.example.tuckshop.domain.model.OrderNumber;
import com.example.tuckshop.infrastructure.persistence.entity.OrderSequenceEntity;
import com.example.tuckshop.infrastructure.persistence.repository.OrderSequenceRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Hands out order numbers from a single counter row.
 * <p>
 * The row is locked for update inside the transaction that inserts the order, so two
 * concurrent creations queue on the lock instead of reading the same value. A number is
 * consumed only if that transaction commits.
 */
@Component
public class OrderNumberSequencer {

    static final String ORDER_SEQUENCE = "orders";

    private final OrderSequenceRepository repository;

    public OrderNumberSequencer(OrderSequenceRepository repository) {
        this.repository = repository;
    }

    /**
     * Returns the next order number. Must run inside the order-insert transaction.
     *
     * @throws IllegalStateException if the counter row has not been seeded
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OrderNumber next() {
        OrderSequenceEntity sequence = repository.findForUpdate(ORDER_SEQUENCE)
                .orElseThrow(() -> new IllegalStateException("Order sequence has not been initialised"));

        OrderNumber next = sequence.getLastValue() == 0
                ? OrderNumber.first()
                : OrderNumber.of(sequence.getLastValue()).next();
        sequence.setLastValue(next.getValue());
        return next;
    }
}
