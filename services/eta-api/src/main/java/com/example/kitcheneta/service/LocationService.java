package com.example.kitcheneta.service;

import com.example.kitcheneta.exception.EtaBusinessException;
import com.example.kitcheneta.exception.EtaErrorCode;
import com.example.kitcheneta.repository.LocationRepository;
import com.example.kitcheneta.service.dto.LineItem;
import com.example.kitcheneta.service.dto.LoadInfo;
import com.example.kitcheneta.service.dto.ReadyTimeEstimate;
import com.example.kitcheneta.service.offering.OfferingLoader;
import com.example.kitcheneta.service.offering.OfferingSnapshot;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 门店维度的只读查询：可售菜品、负载、假设下单的出餐时间估算（不落库）。
 */
@Service
public class LocationService {

    private final LocationRepository locationRepository;
    private final OfferingLoader offeringLoader;
    private final PrepTimeEstimator prepTimeEstimator;

    public LocationService(LocationRepository locationRepository,
                           OfferingLoader offeringLoader,
                           PrepTimeEstimator prepTimeEstimator) {
        this.locationRepository = locationRepository;
        this.offeringLoader = offeringLoader;
        this.prepTimeEstimator = prepTimeEstimator;
    }

    public List<OfferingSnapshot> availableOfferings(Long locationId) {
        requireLocation(locationId);
        return offeringLoader.loadAvailable(locationId);
    }

    public LoadInfo loadInfo(Long locationId) {
        requireLocation(locationId);
        return prepTimeEstimator.loadInfo(locationId);
    }

    /**
     * @param lines each line names either an offering or a menu item; menu items are resolved to
     *              this location's offering first
     */
    public ReadyTimeEstimate estimate(Long locationId, List<EstimateLine> lines) {
        requireLocation(locationId);
        List<LineItem> lineItems = lines.stream()
                .map(line -> toLineItem(locationId, line))
                .toList();
        if (!prepTimeEstimator.validateOfferings(lineItems, locationId)) {
            throw new EtaBusinessException(EtaErrorCode.INVALID_OFFERINGS);
        }
        return prepTimeEstimator.estimate(locationId, lineItems);
    }

    private LineItem toLineItem(Long locationId, EstimateLine line) {
        if (line.offeringId() != null) {
            return new LineItem(line.offeringId(), line.quantity());
        }
        if (line.menuItemId() != null) {
            return prepTimeEstimator.resolveMenuItem(locationId, line.menuItemId(), line.quantity());
        }
        throw new EtaBusinessException(EtaErrorCode.INVALID_OFFERINGS, "Each line needs an offeringId or a menuItemId");
    }

    private void requireLocation(Long locationId) {
        if (!locationRepository.existsById(locationId)) {
            throw new EtaBusinessException(EtaErrorCode.LOCATION_NOT_FOUND, "Location " + locationId + " not found");
        }
    }

    public record EstimateLine(Long offeringId, Long menuItemId, int quantity) {
    }
}
