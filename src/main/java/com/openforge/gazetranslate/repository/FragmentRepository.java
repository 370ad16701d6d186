package com.openforge.gazetranslate.repository;

import com.openforge.gazetranslate.domain.Fragment;
import com.openforge.gazetranslate.domain.FragmentStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface FragmentRepository extends JpaRepository<Fragment, Long>, JpaSpecificationExecutor<Fragment> {

    Optional<Fragment> findByOwnerIdAndSourceKeyAndSourceLangAndTargetLang(
            String ownerId, String sourceKey, String sourceLang, String targetLang);

    Optional<Fragment> findByIdAndOwnerId(Long id, String ownerId);

    List<Fragment> findByOwnerIdAndIdIn(String ownerId, Collection<Long> ids);

    List<Fragment> findByOwnerIdAndSourceLangAndTargetLang(String ownerId, String sourceLang, String targetLang);

    List<Fragment> findByOwnerId(String ownerId);

    List<Fragment> findByOwnerIdAndStatusIn(String ownerId, Collection<FragmentStatus> statuses);

    /** Keyset page for the stale sweep: ids strictly after {@code afterId}, oldest id first. */
    List<Fragment> findByStatusInAndCreateTimeBeforeAndIdGreaterThanOrderByIdAsc(
            Collection<FragmentStatus> statuses, Instant createdBefore, Long afterId, Pageable page);
}
