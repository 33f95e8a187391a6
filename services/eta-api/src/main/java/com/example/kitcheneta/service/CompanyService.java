package com.example.kitcheneta.service;

import com.example.kitcheneta.exception.EtaBusinessException;
import com.example.kitcheneta.exception.EtaErrorCode;
import com.example.kitcheneta.model.Location;
import com.example.kitcheneta.model.MenuItem;
import com.example.kitcheneta.repository.CompanyRepository;
import com.example.kitcheneta.repository.LocationRepository;
import com.example.kitcheneta.repository.MenuItemRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 公司维度的只读查询：菜品主目录和旗下门店。
 */
@Service
@Transactional(readOnly = true)
public class CompanyService {

    private final CompanyRepository companyRepository;
    private final MenuItemRepository menuItemRepository;
    private final LocationRepository locationRepository;

    public CompanyService(CompanyRepository companyRepository,
                          MenuItemRepository menuItemRepository,
                          LocationRepository locationRepository) {
        this.companyRepository = companyRepository;
        this.menuItemRepository = menuItemRepository;
        this.locationRepository = locationRepository;
    }

    public List<MenuItem> menuItems(Long companyId) {
        requireCompany(companyId);
        return menuItemRepository.findByCompanyIdOrderByIdAsc(companyId);
    }

    public List<Location> locations(Long companyId) {
        requireCompany(companyId);
        return locationRepository.findByCompanyIdOrderByIdAsc(companyId);
    }

    private void requireCompany(Long companyId) {
        if (!companyRepository.existsById(companyId)) {
            throw new EtaBusinessException(EtaErrorCode.COMPANY_NOT_FOUND, "Company " + companyId + " not found");
        }
    }
}
