package com.example.kitcheneta.repository;

import com.example.kitcheneta.model.Company;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CompanyRepository extends JpaRepository<Company, Long> {
}
