package org.example.analysis.repository;

import org.example.analysis.entity.ForeshadowingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ForeshadowingRepository extends JpaRepository<ForeshadowingEntity, String> {

    List<ForeshadowingEntity> findByBookIdOrderBySetupChapter(String bookId);

    Optional<ForeshadowingEntity> findByBookIdAndSetupChapterAndPayoffChapterAndTheme(
            String bookId, int setupChapter, int payoffChapter, String theme);
}
