package com.example.kitcheneta.event;

import com.example.kitcheneta.model.OrderStatus;
import com.example.kitcheneta.service.load.LoadCacheService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
class OrderLoadSynchronizerTest {

    private static final Long ORDER_ID = 42L;
    private static final Long LOCATION_ID = 1L;

    @Mock
    private LoadCacheService loadCacheService;

    @InjectMocks
    private OrderLoadSynchronizer synchronizer;

    @Test
    @DisplayName("新建订单（RECEIVED）进入活跃集合：+1")
    void created_Increments() {
        synchronizer.onOrderLifecycle(OrderLifecycleEvent.created(ORDER_ID, LOCATION_ID, OrderStatus.RECEIVED));

        verify(loadCacheService).incrementActiveOrders(LOCATION_ID);
        verifyNoMoreInteractions(loadCacheService);
    }

    @Test
    @DisplayName("活跃状态之间流转不改变计数")
    void statusChangedWithinActiveSet_NoCall() {
        synchronizer.onOrderLifecycle(OrderLifecycleEvent.statusChanged(ORDER_ID, LOCATION_ID,
                OrderStatus.RECEIVED, OrderStatus.PREPARING));
        synchronizer.onOrderLifecycle(OrderLifecycleEvent.statusChanged(ORDER_ID, LOCATION_ID,
                OrderStatus.PREPARING, OrderStatus.READY));

        verifyNoInteractions(loadCacheService);
    }

    @Test
    void statusChangedToCompleted_Decrements() {
        synchronizer.onOrderLifecycle(OrderLifecycleEvent.statusChanged(ORDER_ID, LOCATION_ID,
                OrderStatus.READY, OrderStatus.COMPLETED));

        verify(loadCacheService).decrementActiveOrders(LOCATION_ID);
        verifyNoMoreInteractions(loadCacheService);
    }

    @Test
    void reopenedFromCompleted_Increments() {
        synchronizer.onOrderLifecycle(OrderLifecycleEvent.statusChanged(ORDER_ID, LOCATION_ID,
                OrderStatus.COMPLETED, OrderStatus.PREPARING));

        verify(loadCacheService).incrementActiveOrders(LOCATION_ID);
        verifyNoMoreInteractions(loadCacheService);
    }

    @Test
    void deletedWhileActive_Decrements() {
        synchronizer.onOrderLifecycle(OrderLifecycleEvent.deleted(ORDER_ID, LOCATION_ID, OrderStatus.PREPARING));

        verify(loadCacheService).decrementActiveOrders(LOCATION_ID);
        verifyNoMoreInteractions(loadCacheService);
    }

    @Test
    @DisplayName("删除/恢复已完成订单不影响计数")
    void deletedOrRestoredWhileCompleted_NoCall() {
        synchronizer.onOrderLifecycle(OrderLifecycleEvent.deleted(ORDER_ID, LOCATION_ID, OrderStatus.COMPLETED));
        synchronizer.onOrderLifecycle(OrderLifecycleEvent.restored(ORDER_ID, LOCATION_ID, OrderStatus.COMPLETED));

        verifyNoInteractions(loadCacheService);
    }

    @Test
    void restoredWhileActive_Increments() {
        synchronizer.onOrderLifecycle(OrderLifecycleEvent.restored(ORDER_ID, LOCATION_ID, OrderStatus.READY));

        verify(loadCacheService).incrementActiveOrders(LOCATION_ID);
        verifyNoMoreInteractions(loadCacheService);
    }
}
