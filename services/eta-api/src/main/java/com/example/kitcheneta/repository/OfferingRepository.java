package com.example.kitcheneta.repository;

import com.example.kitcheneta.model.Offering;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface OfferingRepository extends JpaRepository<Offering, Long> {

    Optional<Offering> findByLocationIdAndMenuItemId(Long locationId, Long menuItemId);

    List<Offering> findByLocationIdAndAvailableTrue(Long locationId);
}
