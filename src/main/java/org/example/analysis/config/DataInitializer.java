package org.example.analysis.config;

import org.example.analysis.entity.BookEntity;
import org.example.analysis.entity.ChapterEntity;
import org.example.analysis.entity.ParagraphEntity;
import org.example.analysis.repository.BookRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Seeds a small sample book for local runs of the analysis pipeline.
 */
@Component
@Profile("dev")
public class DataInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final BookRepository bookRepository;

    public DataInitializer(BookRepository bookRepository) {
        this.bookRepository = bookRepository;
    }

    @Override
    public void run(String... args) {
        // Only initialize if database is empty
        if (bookRepository.count() > 0) {
            log.info("Database already contains books, skipping sample data");
            return;
        }

        BookEntity prideAndPrejudice = new BookEntity("Pride and Prejudice", "Jane Austen");

        ChapterEntity ch1 = new ChapterEntity(0, "Chapter 1");
        ch1.addParagraph(new ParagraphEntity(0,
            "It is a truth universally acknowledged, that a single man in possession of a good fortune, must be in want of a wife."));
        ch1.addParagraph(new ParagraphEntity(1,
            "\"My dear Mr. Bennet,\" said his lady to him one day, \"have you heard that Netherfield Park is let at last?\""));
        ch1.addParagraph(new ParagraphEntity(2,
            "Mr. Bennet replied that he had not."));
        ch1.addParagraph(new ParagraphEntity(3,
            "\"But it is,\" returned she; \"for Mrs. Long has just been here, and she told me all about it.\""));
        ch1.addParagraph(new ParagraphEntity(4,
            "\"You want to tell me, and I have no objection to hearing it.\""));
        prideAndPrejudice.addChapter(ch1);

        ChapterEntity ch2 = new ChapterEntity(1, "Chapter 2");
        ch2.addParagraph(new ParagraphEntity(0,
            "Mr. Bennet was among the earliest of those who waited on Mr. Bingley. He had always intended to visit him, though to the last always assuring his wife that he should not go."));
        ch2.addParagraph(new ParagraphEntity(1,
            "\"I hope Mr. Bingley will like it, Lizzy,\" said Mr. Bennet."));
        prideAndPrejudice.addChapter(ch2);

        ChapterEntity ch3 = new ChapterEntity(2, "Chapter 3");
        ch3.addParagraph(new ParagraphEntity(0,
            "Not all that Mrs. Bennet, however, with the assistance of her five daughters, could ask on the subject, was sufficient to draw from her husband any satisfactory description of Mr. Bingley."));
        prideAndPrejudice.addChapter(ch3);

        bookRepository.save(prideAndPrejudice);
        log.info("Seeded sample book '{}' with {} chapters",
                prideAndPrejudice.getTitle(), prideAndPrejudice.getChapters().size());
    }
}
