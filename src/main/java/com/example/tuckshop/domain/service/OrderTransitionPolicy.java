package com.example.tuckshop.domain.service;

import com.example.tuckshop.domain.model.Caller;
import com.example.tuckshop.domain.model.Order;
import com.example.tuckshop.domain.model.OrderStatus;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.example.tuckshop.domain.model.OrderStatus.CANCELLED;
import static com.example.tuckshop.domain.model.OrderStatus.CANCELLED_ACKNOWLEDGED;
import static com.example.tuckshop.domain.model.OrderStatus.COMPLETED;
import static com.example.tuckshop.domain.model.OrderStatus.IN_PROGRESS;
import static com.example.tuckshop.domain.model.OrderStatus.PENDING;

/**
 * Single source of truth for who may move an order from which status to which.
 *
 * <pre>
 * actor      | pending                 | in-progress          | cancelled
 * -----------+-------------------------+----------------------+-----------------------
 * customer   | cancelled               | -                    | -
 * staff      | in-progress, cancelled  | completed, cancelled | cancelled-acknowledged
 * </pre>
 */
public final class OrderTransitionPolicy {

    private enum Actor { CUSTOMER, STAFF }

    private static final Map<Actor, Map<OrderStatus, Set<OrderStatus>>> TRANSITIONS = new EnumMap<>(Actor.class);

    static {
        Map<OrderStatus, Set<OrderStatus>> customer = new EnumMap<>(OrderStatus.class);
        customer.put(PENDING, Set.of(CANCELLED));
        TRANSITIONS.put(Actor.CUSTOMER, customer);

        Map<OrderStatus, Set<OrderStatus>> staff = new EnumMap<>(OrderStatus.class);
        staff.put(PENDING, Set.of(IN_PROGRESS, CANCELLED));
        staff.put(IN_PROGRESS, Set.of(COMPLETED, CANCELLED));
        staff.put(CANCELLED, Set.of(CANCELLED_ACKNOWLEDGED));
        TRANSITIONS.put(Actor.STAFF, staff);
    }

    public enum Decision {
        /** Apply the transition. */
        ALLOWED,
        /** Already cancelled; report success without touching anything. */
        NO_OP,
        FORBIDDEN,
        INVALID_TRANSITION
    }

    /**
     * Decides whether {@code caller} may move {@code order} to {@code target}.
     */
    public Decision evaluate(Caller caller, Order order, OrderStatus target) {
        Objects.requireNonNull(caller, "Caller cannot be null");
        Objects.requireNonNull(order, "Order cannot be null");
        Objects.requireNonNull(target, "Target status cannot be null");

        if (!caller.isStaff()) {
            if (!order.isOwnedBy(caller.uid())) {
                return Decision.FORBIDDEN;
            }
            return isListed(Actor.CUSTOMER, order.getStatus(), target) ? Decision.ALLOWED : Decision.FORBIDDEN;
        }

        if (target == CANCELLED && order.getStatus().isCancelled()) {
            return Decision.NO_OP;
        }
        return isListed(Actor.STAFF, order.getStatus(), target) ? Decision.ALLOWED : Decision.INVALID_TRANSITION;
    }

    /**
     * True when moving between the two statuses must put the order's stock back.
     */
    public boolean restoresStock(OrderStatus from, OrderStatus to) {
        return to == CANCELLED && (from == PENDING || from == IN_PROGRESS);
    }

    private static boolean isListed(Actor actor, OrderStatus from, OrderStatus to) {
        return TRANSITIONS.get(actor).getOrDefault(from, Set.of()).contains(to);
    }
}
