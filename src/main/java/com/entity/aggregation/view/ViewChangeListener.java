package com.entity.aggregation.view;

/**
 * Notified after a new view snapshot has been published.
 */
@FunctionalInterface
public interface ViewChangeListener {

    void onViewChanged(EntityViewSnapshot previous, EntityViewSnapshot current);
}
