package com.example.kitcheneta.controller;

import com.example.kitcheneta.controller.dto.EstimateReadyTimeRequest;
import com.example.kitcheneta.controller.dto.OfferingResponse;
import com.example.kitcheneta.controller.dto.ReadyTimeResponse;
import com.example.kitcheneta.service.LocationService;
import com.example.kitcheneta.service.LocationService.EstimateLine;
import com.example.kitcheneta.service.dto.LoadInfo;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.List;

@RestController
@RequestMapping("/api/locations/{locationId}")
public class LocationController {

    private final LocationService locationService;

    public LocationController(LocationService locationService) {
        this.locationService = locationService;
    }

    @GetMapping("/offerings")
    public List<OfferingResponse> offerings(@PathVariable Long locationId) {
        return locationService.availableOfferings(locationId).stream()
                .map(OfferingResponse::of)
                .toList();
    }

    /**
     * 假设下单的出餐时间，不创建订单、不改变负载计数。
     */
    @PostMapping("/estimate-ready-at")
    public ReadyTimeResponse estimateReadyAt(@PathVariable Long locationId,
                                             @Valid @RequestBody EstimateReadyTimeRequest request) {
        List<EstimateLine> lines = request.lines().stream()
                .map(line -> new EstimateLine(line.offeringId(), line.menuItemId(), line.quantity()))
                .toList();
        return ReadyTimeResponse.of(locationService.estimate(locationId, lines));
    }

    @GetMapping("/load")
    public LoadInfo load(@PathVariable Long locationId) {
        return locationService.loadInfo(locationId);
    }
}
