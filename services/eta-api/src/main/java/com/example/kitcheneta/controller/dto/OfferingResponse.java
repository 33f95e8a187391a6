package com.example.kitcheneta.controller.dto;

import com.example.kitcheneta.service.offering.OfferingSnapshot;

public record OfferingResponse(Long id, Long menuItemId, String name, int basePrepTimeSeconds) {

    public static OfferingResponse of(OfferingSnapshot snapshot) {
        return new OfferingResponse(snapshot.id(), snapshot.menuItemId(), snapshot.name(),
                snapshot.basePrepTimeSeconds());
    }
}
