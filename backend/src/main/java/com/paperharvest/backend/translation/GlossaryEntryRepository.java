package com.paperharvest.backend.translation;

import com.paperharvest.backend.model.entity.GlossaryEntry;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface GlossaryEntryRepository extends JpaRepository<GlossaryEntry, Long> {

    Optional<GlossaryEntry> findByNormalizedTerm(String normalizedTerm);
}
