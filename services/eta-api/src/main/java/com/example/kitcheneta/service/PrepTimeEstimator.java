package com.example.kitcheneta.service;

import com.example.kitcheneta.exception.EtaBusinessException;
import com.example.kitcheneta.exception.EtaErrorCode;
import com.example.kitcheneta.service.dto.LineItem;
import com.example.kitcheneta.service.dto.LoadInfo;
import com.example.kitcheneta.service.dto.ReadyTimeEstimate;
import com.example.kitcheneta.service.load.LoadCacheService;
import com.example.kitcheneta.service.load.LoadMultiplierPolicy;
import com.example.kitcheneta.service.offering.OfferingCacheFacade;
import com.example.kitcheneta.service.offering.OfferingSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Order ready-time estimation.
 *
 * <ol>
 *   <li>Sum base prep time of every line (base seconds x quantity)</li>
 *   <li>Scale by the kitchen load multiplier of the location</li>
 *   <li>Never promise less than {@link #MINIMUM_READY_TIME}, even for one fast item on an idle kitchen</li>
 * </ol>
 *
 * 只读计数缓存，从不修改它；计数的增减只来自订单生命周期事件。
 */
@Service
public class PrepTimeEstimator {

    private static final Logger log = LoggerFactory.getLogger(PrepTimeEstimator.class);

    public static final Duration MINIMUM_READY_TIME = Duration.ofMinutes(10);

    private static final BigDecimal MILLIS_PER_SECOND = BigDecimal.valueOf(1000);

    private final OfferingCacheFacade offeringCacheFacade;
    private final LoadCacheService loadCacheService;
    private final Clock clock;

    public PrepTimeEstimator(OfferingCacheFacade offeringCacheFacade,
                             LoadCacheService loadCacheService,
                             Clock clock) {
        this.offeringCacheFacade = offeringCacheFacade;
        this.loadCacheService = loadCacheService;
        this.clock = clock;
    }

    /**
     * @throws EtaBusinessException with {@link EtaErrorCode#INVALID_OFFERINGS} when the list is empty,
     *                              a quantity is below one, or an offering is missing, unavailable
     *                              or belongs to another location
     */
    public ReadyTimeEstimate estimate(Long locationId, List<LineItem> lineItems) {
        long baseSeconds = basePrepTimeSeconds(locationId, lineItems);

        long activeOrders = loadCacheService.getActiveOrderCount(locationId);
        BigDecimal multiplier = LoadMultiplierPolicy.multiplier(activeOrders);

        Duration adjusted = scale(baseSeconds, multiplier);
        Duration prepDuration = adjusted.compareTo(MINIMUM_READY_TIME) < 0 ? MINIMUM_READY_TIME : adjusted;
        Instant readyAt = clock.instant().plus(prepDuration);

        log.debug("Estimated location {}: base={}s, activeOrders={}, multiplier={}, prep={}s",
                locationId, baseSeconds, activeOrders, multiplier, prepDuration.toSeconds());
        return new ReadyTimeEstimate(readyAt, prepDuration, toLoadInfo(activeOrders, multiplier));
    }

    public LoadInfo loadInfo(Long locationId) {
        long activeOrders = loadCacheService.getActiveOrderCount(locationId);
        return toLoadInfo(activeOrders, LoadMultiplierPolicy.multiplier(activeOrders));
    }

    /**
     * @return true only when the list is non-empty and every line references an available
     *         offering of this location with a quantity of at least one
     */
    public boolean validateOfferings(List<LineItem> lineItems, Long locationId) {
        if (lineItems == null || lineItems.isEmpty()) {
            return false;
        }
        for (LineItem item : lineItems) {
            if (orderable(item, locationId) == null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Resolves a menu item to this location's offering of it, for estimates keyed by catalog item.
     */
    public LineItem resolveMenuItem(Long locationId, Long menuItemId, int quantity) {
        OfferingSnapshot offering = offeringCacheFacade.loadByLocationAndMenuItem(locationId, menuItemId);
        if (offering == null) {
            throw new EtaBusinessException(EtaErrorCode.INVALID_OFFERINGS,
                    "Menu item " + menuItemId + " is not offered at location " + locationId);
        }
        return new LineItem(offering.id(), quantity);
    }

    private long basePrepTimeSeconds(Long locationId, List<LineItem> lineItems) {
        if (lineItems == null || lineItems.isEmpty()) {
            throw new EtaBusinessException(EtaErrorCode.INVALID_OFFERINGS, "At least one product must be ordered");
        }
        long total = 0;
        for (LineItem item : lineItems) {
            OfferingSnapshot offering = orderable(item, locationId);
            if (offering == null) {
                throw new EtaBusinessException(EtaErrorCode.INVALID_OFFERINGS);
            }
            total += (long) offering.basePrepTimeSeconds() * item.quantity();
        }
        return total;
    }

    private OfferingSnapshot orderable(LineItem item, Long locationId) {
        if (item == null || item.offeringId() == null || item.quantity() < 1) {
            return null;
        }
        OfferingSnapshot offering = offeringCacheFacade.load(item.offeringId());
        if (offering == null || !offering.orderableAt(locationId)) {
            log.debug("Offering {} is not orderable at location {}", item.offeringId(), locationId);
            return null;
        }
        return offering;
    }

    private static Duration scale(long baseSeconds, BigDecimal multiplier) {
        long millis = BigDecimal.valueOf(baseSeconds)
                .multiply(multiplier)
                .multiply(MILLIS_PER_SECOND)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
        return Duration.ofMillis(millis);
    }

    private static LoadInfo toLoadInfo(long activeOrders, BigDecimal multiplier) {
        return new LoadInfo(
                activeOrders,
                multiplier.setScale(2, RoundingMode.HALF_UP).doubleValue(),
                LoadMultiplierPolicy.isHighLoad(multiplier));
    }
}
