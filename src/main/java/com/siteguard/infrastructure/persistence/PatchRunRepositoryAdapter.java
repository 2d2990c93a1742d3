package com.siteguard.infrastructure.persistence;

import com.siteguard.domain.model.PatchRun;
import com.siteguard.domain.repository.PatchRunRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class PatchRunRepositoryAdapter implements PatchRunRepository {

    private final SpringDataPatchRunRepository springDataRepository;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public PatchRun append(PatchRun patchRun) {
        entityManager.persist(patchRun);
        return patchRun;
    }

    @Override
    public Page<PatchRun> findBySite(UUID siteId, Pageable pageable) {
        return springDataRepository.findBySiteId(siteId, pageable);
    }
}
