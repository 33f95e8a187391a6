package com.example.kitcheneta.service.offering;

import com.example.kitcheneta.model.Offering;
import com.example.kitcheneta.repository.OfferingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@Transactional(readOnly = true)
public class JpaOfferingLoader implements OfferingLoader {

    private static final Logger log = LoggerFactory.getLogger(JpaOfferingLoader.class);

    private final OfferingRepository offeringRepository;

    public JpaOfferingLoader(OfferingRepository offeringRepository) {
        this.offeringRepository = offeringRepository;
    }

    @Override
    public Optional<OfferingSnapshot> load(Long offeringId) {
        return offeringRepository.findById(offeringId)
                .map(offering -> {
                    log.debug("Loaded offering from database: offeringId={}, locationId={}",
                            offeringId, offering.getLocationId());
                    return toSnapshot(offering);
                });
    }

    @Override
    public Optional<OfferingSnapshot> loadByLocationAndMenuItem(Long locationId, Long menuItemId) {
        return offeringRepository.findByLocationIdAndMenuItemId(locationId, menuItemId)
                .map(JpaOfferingLoader::toSnapshot);
    }

    @Override
    public List<OfferingSnapshot> loadAvailable(Long locationId) {
        return offeringRepository.findByLocationIdAndAvailableTrue(locationId).stream()
                .map(JpaOfferingLoader::toSnapshot)
                .toList();
    }

    private static OfferingSnapshot toSnapshot(Offering offering) {
        return new OfferingSnapshot(
                offering.getId(),
                offering.getLocationId(),
                offering.getMenuItem().getId(),
                offering.getMenuItem().getName(),
                offering.isAvailable(),
                offering.getMenuItem().getBasePrepTimeSeconds());
    }
}
