package com.siteguard.infrastructure.persistence;

import com.siteguard.domain.model.Site;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface SpringDataSiteRepository extends JpaRepository<Site, UUID> {
}
