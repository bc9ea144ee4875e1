package com.openforge.docrouter.repository;

import com.openforge.docrouter.domain.BootstrapMarker;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BootstrapMarkerRepository extends JpaRepository<BootstrapMarker, Long> {

    Optional<BootstrapMarker> findByCollectionName(String collectionName);
}
