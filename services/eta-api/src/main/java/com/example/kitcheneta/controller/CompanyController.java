package com.example.kitcheneta.controller;

import com.example.kitcheneta.controller.dto.LocationResponse;
import com.example.kitcheneta.controller.dto.MenuItemResponse;
import com.example.kitcheneta.service.CompanyService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/companies/{companyId}")
public class CompanyController {

    private final CompanyService companyService;

    public CompanyController(CompanyService companyService) {
        this.companyService = companyService;
    }

    @GetMapping("/products")
    public List<MenuItemResponse> products(@PathVariable Long companyId) {
        return companyService.menuItems(companyId).stream()
                .map(MenuItemResponse::of)
                .toList();
    }

    @GetMapping("/locations")
    public List<LocationResponse> locations(@PathVariable Long companyId) {
        return companyService.locations(companyId).stream()
                .map(LocationResponse::of)
                .toList();
    }
}
