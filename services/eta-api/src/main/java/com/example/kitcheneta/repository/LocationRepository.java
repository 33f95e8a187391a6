package com.example.kitcheneta.repository;

import com.example.kitcheneta.model.Location;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LocationRepository extends JpaRepository<Location, Long> {

    List<Location> findByCompanyIdOrderByIdAsc(Long companyId);
}
