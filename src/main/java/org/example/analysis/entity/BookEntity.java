package org.example.analysis.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "books")
public class BookEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false)
    private String author;

    // Theme analysis (persisted after LLM analysis)
    private String themeMood;
    private String themeGenre;
    private String themeEra;
    private String themeEmotionalTone;
    private String themeAmbientSound;
    private LocalDateTime themeAnalyzedAt;

    @OneToMany(mappedBy = "book", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("chapterIndex")
    private List<ChapterEntity> chapters = new ArrayList<>();

    public BookEntity() {}

    public BookEntity(String title, String author) {
        this.title = title;
        this.author = author;
    }

    // Getters and setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getAuthor() { return author; }
    public void setAuthor(String author) { this.author = author; }

    public String getThemeMood() { return themeMood; }
    public void setThemeMood(String themeMood) { this.themeMood = themeMood; }

    public String getThemeGenre() { return themeGenre; }
    public void setThemeGenre(String themeGenre) { this.themeGenre = themeGenre; }

    public String getThemeEra() { return themeEra; }
    public void setThemeEra(String themeEra) { this.themeEra = themeEra; }

    public String getThemeEmotionalTone() { return themeEmotionalTone; }
    public void setThemeEmotionalTone(String themeEmotionalTone) { this.themeEmotionalTone = themeEmotionalTone; }

    public String getThemeAmbientSound() { return themeAmbientSound; }
    public void setThemeAmbientSound(String themeAmbientSound) { this.themeAmbientSound = themeAmbientSound; }

    public LocalDateTime getThemeAnalyzedAt() { return themeAnalyzedAt; }
    public void setThemeAnalyzedAt(LocalDateTime themeAnalyzedAt) { this.themeAnalyzedAt = themeAnalyzedAt; }

    public List<ChapterEntity> getChapters() { return chapters; }
    public void setChapters(List<ChapterEntity> chapters) { this.chapters = chapters; }

    public void addChapter(ChapterEntity chapter) {
        chapters.add(chapter);
        chapter.setBook(this);
    }
}
