package org.example.analysis.repository;

import org.example.analysis.entity.CharacterEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CharacterRepository extends JpaRepository<CharacterEntity, String> {

    Optional<CharacterEntity> findByBookIdAndName(String bookId, String name);

    long countByBookId(String bookId);
}
