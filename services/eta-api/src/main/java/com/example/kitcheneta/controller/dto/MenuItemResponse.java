package com.example.kitcheneta.controller.dto;

import com.example.kitcheneta.model.MenuItem;

public record MenuItemResponse(Long id, Long companyId, String name, int basePrepTimeSeconds) {

    public static MenuItemResponse of(MenuItem menuItem) {
        return new MenuItemResponse(menuItem.getId(), menuItem.getCompanyId(), menuItem.getName(),
                menuItem.getBasePrepTimeSeconds());
    }
}
