package org.example.analysis.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

@Entity
@Table(name = "foreshadowings", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"book_id", "setup_chapter", "payoff_chapter", "theme"})
})
public class ForeshadowingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "book_id", nullable = false)
    private BookEntity book;

    // 0-indexed chapter positions
    @Column(name = "setup_chapter", nullable = false)
    private int setupChapter;

    @Column(length = 2000)
    private String setupText;

    @Column(name = "payoff_chapter", nullable = false)
    private int payoffChapter;

    @Column(length = 2000)
    private String payoffText;

    @Column(nullable = false)
    private String theme;

    @Column(nullable = false)
    private double confidence;

    @Column(nullable = false)
    private LocalDateTime detectedAt;

    public ForeshadowingEntity() {}

    public ForeshadowingEntity(BookEntity book, int setupChapter, int payoffChapter, String theme) {
        this.book = book;
        this.setupChapter = setupChapter;
        this.payoffChapter = payoffChapter;
        this.theme = theme;
        this.detectedAt = LocalDateTime.now();
    }

    // Getters and setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public BookEntity getBook() { return book; }
    public void setBook(BookEntity book) { this.book = book; }

    public int getSetupChapter() { return setupChapter; }
    public void setSetupChapter(int setupChapter) { this.setupChapter = setupChapter; }

    public String getSetupText() { return setupText; }
    public void setSetupText(String setupText) { this.setupText = setupText; }

    public int getPayoffChapter() { return payoffChapter; }
    public void setPayoffChapter(int payoffChapter) { this.payoffChapter = payoffChapter; }

    public String getPayoffText() { return payoffText; }
    public void setPayoffText(String payoffText) { this.payoffText = payoffText; }

    public String getTheme() { return theme; }
    public void setTheme(String theme) { this.theme = theme; }

    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }

    public LocalDateTime getDetectedAt() { return detectedAt; }
    public void setDetectedAt(LocalDateTime detectedAt) { this.detectedAt = detectedAt; }
}
