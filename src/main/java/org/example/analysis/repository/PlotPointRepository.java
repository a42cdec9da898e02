package org.example.analysis.repository;

import org.example.analysis.entity.PlotPointEntity;
import org.example.analysis.model.PlotPointType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PlotPointRepository extends JpaRepository<PlotPointEntity, String> {

    List<PlotPointEntity> findByBookIdOrderByChapterIndex(String bookId);

    Optional<PlotPointEntity> findByBookIdAndType(String bookId, PlotPointType type);
}
