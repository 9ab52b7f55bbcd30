package uk.gegc.trivia.features.question.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A trivia question. {@code category} holds the id of a category row; the reference
 * is not checked on insert.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "questions")
public class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Integer id;

    @Column(name = "question", nullable = false, length = 1000)
    private String question;

    @Column(name = "answer", nullable = false, length = 1000)
    private String answer;

    @Column(name = "category", nullable = false)
    private Integer category;

    @Column(name = "difficulty", nullable = false)
    private Integer difficulty;

    public Question(String question, String answer, Integer category, Integer difficulty) {
        this.question = question;
        this.answer = answer;
        this.category = category;
        this.difficulty = difficulty;
    }
}
