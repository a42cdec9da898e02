package org.example.analysis.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

@Entity
@Table(name = "characters", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"book_id", "name"})
})
public class CharacterEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "book_id", nullable = false)
    private BookEntity book;

    @Column(nullable = false)
    private String name;

    // JSON array of trait strings
    @Column(columnDefinition = "TEXT")
    private String traitsJson;

    @Column(length = 1000)
    private String voiceProfileJson;

    private Integer speakerId;

    // JSON array of {chapterId, pageNumber, text, emotion, intensity}
    @Column(columnDefinition = "TEXT")
    private String dialogsJson;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public CharacterEntity() {}

    public CharacterEntity(BookEntity book, String name) {
        this.book = book;
        this.name = name;
        this.createdAt = LocalDateTime.now();
    }

    // Getters and setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public BookEntity getBook() { return book; }
    public void setBook(BookEntity book) { this.book = book; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getTraitsJson() { return traitsJson; }
    public void setTraitsJson(String traitsJson) { this.traitsJson = traitsJson; }

    public String getVoiceProfileJson() { return voiceProfileJson; }
    public void setVoiceProfileJson(String voiceProfileJson) { this.voiceProfileJson = voiceProfileJson; }

    public Integer getSpeakerId() { return speakerId; }
    public void setSpeakerId(Integer speakerId) { this.speakerId = speakerId; }

    public String getDialogsJson() { return dialogsJson; }
    public void setDialogsJson(String dialogsJson) { this.dialogsJson = dialogsJson; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
}
