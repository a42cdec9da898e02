package org.example.analysis.entity;

import jakarta.persistence.*;
import org.example.analysis.model.PlotPointType;

import java.time.LocalDateTime;

@Entity
@Table(name = "plot_points", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"book_id", "type"})
})
public class PlotPointEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "book_id", nullable = false)
    private BookEntity book;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PlotPointType type;

    @Column(nullable = false)
    private int chapterIndex;

    @Column(length = 2000)
    private String description;

    @Column(nullable = false)
    private double confidence;

    @Column(nullable = false)
    private LocalDateTime detectedAt;

    public PlotPointEntity() {}

    public PlotPointEntity(BookEntity book, PlotPointType type) {
        this.book = book;
        this.type = type;
        this.detectedAt = LocalDateTime.now();
    }

    // Getters and setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public BookEntity getBook() { return book; }
    public void setBook(BookEntity book) { this.book = book; }

    public PlotPointType getType() { return type; }
    public void setType(PlotPointType type) { this.type = type; }

    public int getChapterIndex() { return chapterIndex; }
    public void setChapterIndex(int chapterIndex) { this.chapterIndex = chapterIndex; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }

    public LocalDateTime getDetectedAt() { return detectedAt; }
    public void setDetectedAt(LocalDateTime detectedAt) { this.detectedAt = detectedAt; }
}
