package com.example.tuckshop.infrastructure.persistence;

import com.example.tuckshop.infrastructure.persistence.entity.OrderSequenceEntity;
import com.example.tuckshop.infrastructure.persistence.repository.OrderJpaRepository;
import com.example.tuckshop.infrastructure.persistence.repository.OrderSequenceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Seeds the order counter row on start-up from the highest stored order number.
 */
@Component
public class OrderSequenceInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(OrderSequenceInitializer.class);

    private final OrderSequenceRepository sequenceRepository;
    private final OrderJpaRepository orderRepository;

    public OrderSequenceInitializer(OrderSequenceRepository sequenceRepository, OrderJpaRepository orderRepository) {
        this.sequenceRepository = sequenceRepository;
        this.orderRepository = orderRepository;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (sequenceRepository.existsById(OrderNumberSequencer.ORDER_SEQUENCE)) {
            log.debug("Order sequence already initialised");
            return;
        }
        long max = orderRepository.findMaxOrderNumber();
        sequenceRepository.save(new OrderSequenceEntity(OrderNumberSequencer.ORDER_SEQUENCE, max));
        log.info("Order sequence initialised at {}", max);
    }
}
