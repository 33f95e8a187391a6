package com.example.kitcheneta.controller.dto;

import com.example.kitcheneta.model.Location;

public record LocationResponse(Long id, Long companyId, String name, String address) {

    public static LocationResponse of(Location location) {
        return new LocationResponse(location.getId(), location.getCompanyId(), location.getName(),
                location.getAddress());
    }
}
