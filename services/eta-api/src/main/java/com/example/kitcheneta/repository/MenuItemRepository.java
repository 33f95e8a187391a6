package com.example.kitcheneta.repository;

import com.example.kitcheneta.model.MenuItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface MenuItemRepository extends JpaRepository<MenuItem, Long> {

    List<MenuItem> findByCompanyIdOrderByIdAsc(Long companyId);
}
